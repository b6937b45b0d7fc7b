package com.supplyguard.core.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.supplyguard.core.model.ImpactLevel;
import com.supplyguard.core.model.NewsCategory;
import com.supplyguard.core.model.ScheduleStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static com.supplyguard.core.TestFixtures.NOW;
import static com.supplyguard.core.TestFixtures.equipment;
import static com.supplyguard.core.TestFixtures.news;
import static com.supplyguard.core.TestFixtures.schedule;
import static org.junit.jupiter.api.Assertions.*;

class InMemorySupplyChainRepositoryTest {

    private InMemorySupplyChainRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemorySupplyChainRepository(
                List.of(equipment("EQ-1", "Robotics", "China", "Germany"),
                        equipment("EQ-2", "Machinery", "Japan", "United States")),
                List.of(schedule("S1", "EQ-1", ScheduleStatus.DELAYED, 5),
                        schedule("S2", "EQ-2", ScheduleStatus.IN_PROGRESS, 0)),
                List.of(news("N1", NewsCategory.POLITICAL, ImpactLevel.HIGH, "China", "Sanctions", 2),
                        news("N2", NewsCategory.TARIFF, ImpactLevel.MEDIUM, "Japan", "Tariff review", 40),
                        news("N3", NewsCategory.POLITICAL, ImpactLevel.LOW, "Japan", "Election", 5)));
    }

    // ── Filters ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("filters")
    class Filters {

        @Test
        @DisplayName("no restriction returns everything in seed order")
        void unrestricted() {
            assertEquals(List.of("EQ-1", "EQ-2"),
                    repository.findEquipment(DataFilter.all()).stream().map(e -> e.id()).toList());
            assertEquals(2, repository.findSchedules(DataFilter.all()).size());
            assertEquals(3, repository.findNewsEvents(Set.of(), DataFilter.all()).size());
        }

        @Test
        @DisplayName("countries match either end of the route, ignoring case")
        void countryFilter() {
            var filter = new DataFilter(List.of("germany"), List.of(), null);

            assertEquals(List.of("EQ-1"), repository.findEquipment(filter).stream().map(e -> e.id()).toList());
            assertEquals(List.of("S1"), repository.findSchedules(filter).stream().map(s -> s.id()).toList());
        }

        @Test
        @DisplayName("equipment ids restrict equipment and their schedules")
        void equipmentIdFilter() {
            var filter = new DataFilter(List.of(), List.of(), null, List.of("EQ-2"));

            assertEquals(List.of("EQ-2"), repository.findEquipment(filter).stream().map(e -> e.id()).toList());
            assertEquals(List.of("S2"), repository.findSchedules(filter).stream().map(s -> s.id()).toList());
        }

        @Test
        @DisplayName("equipment categories match as substrings")
        void categoryFilter() {
            var filter = new DataFilter(List.of(), List.of("robot"), null);

            assertEquals(List.of("EQ-1"), repository.findEquipment(filter).stream().map(e -> e.id()).toList());
            assertEquals(List.of("S1"), repository.findSchedules(filter).stream().map(s -> s.id()).toList());
        }

        @Test
        @DisplayName("news is filtered by category, country and age")
        void newsFilter() {
            var political = repository.findNewsEvents(EnumSet.of(NewsCategory.POLITICAL), DataFilter.all());
            assertEquals(List.of("N1", "N3"), political.stream().map(n -> n.id()).toList());

            var japan = repository.findNewsEvents(Set.of(), new DataFilter(List.of("JAPAN"), List.of(), null));
            assertEquals(List.of("N2", "N3"), japan.stream().map(n -> n.id()).toList());

            var recent = repository.findNewsEvents(Set.of(),
                    DataFilter.all().withSince(NOW.minusSeconds(30L * 86_400)));
            assertEquals(List.of("N1", "N3"), recent.stream().map(n -> n.id()).toList());
        }
    }

    // ── Seed loading ────────────────────────────────────────────────

    @Test
    @DisplayName("loads the bundled seed data")
    void loadsSeed() {
        var seeded = InMemorySupplyChainRepository.fromClasspath(
                new ObjectMapper().findAndRegisterModules(), "seed/supply-chain.json");

        assertEquals(8, seeded.findEquipment(DataFilter.all()).size());
        assertEquals(12, seeded.findSchedules(DataFilter.all()).size());
        assertEquals(10, seeded.findNewsEvents(Set.of(), DataFilter.all()).size());
        var first = seeded.findEquipment(DataFilter.all()).get(0);
        assertEquals("EQ-001", first.id());
        assertEquals("Germany", first.manufacturingCountry());
    }

    @Test
    @DisplayName("a missing seed location gives an empty store")
    void missingSeed() {
        var empty = InMemorySupplyChainRepository.fromClasspath(new ObjectMapper(), "seed/does-not-exist.json");

        assertTrue(empty.findEquipment(DataFilter.all()).isEmpty());
        assertTrue(empty.findNewsEvents(Set.of(), DataFilter.all()).isEmpty());
    }
}
