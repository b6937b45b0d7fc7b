package com.supplyguard.core.storage;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.supplyguard.core.model.Equipment;
import com.supplyguard.core.model.NewsCategory;
import com.supplyguard.core.model.NewsEvent;
import com.supplyguard.core.model.Schedule;
import com.supplyguard.core.strategy.KeywordMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Immutable in-memory store, optionally seeded from a JSON document on the classpath.
 * Results keep the seed order.
 */
public class InMemorySupplyChainRepository implements SupplyChainRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemorySupplyChainRepository.class);

    private final List<Equipment> equipment;
    private final List<Schedule> schedules;
    private final List<NewsEvent> newsEvents;
    private final Map<String, Equipment> equipmentById;

    public InMemorySupplyChainRepository(List<Equipment> equipment, List<Schedule> schedules,
                                         List<NewsEvent> newsEvents) {
        this.equipment = equipment == null ? List.of() : List.copyOf(equipment);
        this.schedules = schedules == null ? List.of() : List.copyOf(schedules);
        this.newsEvents = newsEvents == null ? List.of() : List.copyOf(newsEvents);
        this.equipmentById = this.equipment.stream()
                .collect(Collectors.toUnmodifiableMap(Equipment::id, Function.identity(), (a, b) -> a));
    }

    record SeedData(
        @JsonProperty("equipment") List<Equipment> equipment,
        @JsonProperty("schedules") List<Schedule> schedules,
        @JsonProperty("news_events") List<NewsEvent> newsEvents
    ) {}

    public static InMemorySupplyChainRepository fromClasspath(ObjectMapper mapper, String location) {
        var resource = new ClassPathResource(location);
        if (!resource.exists()) {
            log.warn("Seed data {} not found, starting with an empty store", location);
            return new InMemorySupplyChainRepository(List.of(), List.of(), List.of());
        }
        try (InputStream in = resource.getInputStream()) {
            SeedData seed = mapper.readValue(in, SeedData.class);
            var repo = new InMemorySupplyChainRepository(seed.equipment(), seed.schedules(), seed.newsEvents());
            log.info("Loaded seed data from {}: {} equipment, {} schedules, {} news events", location,
                    repo.equipment.size(), repo.schedules.size(), repo.newsEvents.size());
            return repo;
        } catch (IOException e) {
            throw new StorageUnavailableException("Failed to load seed data from " + location, e);
        }
    }

    @Override
    public List<Equipment> findEquipment(DataFilter filter) {
        return equipment.stream().filter(e -> matches(e, filter)).toList();
    }

    @Override
    public List<Schedule> findSchedules(DataFilter filter) {
        boolean unrestricted = filter.countries().isEmpty() && filter.equipmentCategories().isEmpty()
                && filter.equipmentIds().isEmpty();
        return schedules.stream()
                .filter(s -> {
                    if (unrestricted) {
                        return true;
                    }
                    var eq = equipmentById.get(s.equipmentId());
                    return eq != null && matches(eq, filter);
                })
                .toList();
    }

    @Override
    public List<NewsEvent> findNewsEvents(Set<NewsCategory> categories, DataFilter filter) {
        return newsEvents.stream()
                .filter(n -> categories == null || categories.isEmpty() || categories.contains(n.category()))
                .filter(n -> filter.countries().isEmpty() || countryMatches(n.country(), filter.countries()))
                .filter(n -> filter.since() == null
                        || (n.publishedAt() != null && !n.publishedAt().isBefore(filter.since())))
                .toList();
    }

    private static boolean matches(Equipment e, DataFilter filter) {
        boolean countryOk = filter.countries().isEmpty()
                || countryMatches(e.manufacturingCountry(), filter.countries())
                || countryMatches(e.destinationCountry(), filter.countries());
        boolean categoryOk = filter.equipmentCategories().isEmpty()
                || filter.equipmentCategories().stream().anyMatch(c ->
                        KeywordMatcher.contains(e.category(), c) || KeywordMatcher.contains(e.name(), c));
        boolean idOk = filter.equipmentIds().isEmpty() || filter.equipmentIds().contains(e.id());
        return countryOk && categoryOk && idOk;
    }

    private static boolean countryMatches(String country, List<String> wanted) {
        String normalized = KeywordMatcher.normalize(country).trim();
        return wanted.stream().anyMatch(w -> KeywordMatcher.normalize(w).trim().equals(normalized));
    }
}
