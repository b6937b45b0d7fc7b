package com.supplyguard.core.classifier;

import com.supplyguard.core.config.RiskProperties;
import com.supplyguard.core.model.ExtractedEntities;
import com.supplyguard.core.model.QueryContext;
import com.supplyguard.core.strategy.KeywordMatcher;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls countries, equipment categories and a time window out of query text
 * using a fixed vocabulary. Context hints take precedence and come first.
 */
@Component
public class EntityExtractor {

    static final List<String> EQUIPMENT_CATEGORIES =
            List.of("robot", "machinery", "electronic", "medical", "chemical", "equipment");

    /** Chinese equipment terms mapped to the English category they stand for. */
    static final List<Map.Entry<String, String>> EQUIPMENT_CATEGORY_ALIASES = List.of(
            Map.entry("機器人", "robot"),
            Map.entry("機械", "machinery"),
            Map.entry("電子", "electronic"),
            Map.entry("醫療", "medical"),
            Map.entry("化工", "chemical"),
            Map.entry("設備", "equipment"));

    private static final Pattern TIME_PHRASE = Pattern.compile(
            "\\b(recent|past|last|next)\\s+(?:(\\d{1,3})\\s+)?(day|week|month)s?\\b");

    private static final Pattern CJK_TIME_PHRASE = Pattern.compile(
            "(最近|過去|未來)\\s*(\\d{1,3})?\\s*(天|週|周|個月|月)");

    private final RiskProperties properties;

    public EntityExtractor(RiskProperties properties) {
        this.properties = properties;
    }

    public ExtractedEntities extract(String text, QueryContext context) {
        String lower = KeywordMatcher.normalize(text);
        QueryContext ctx = context == null ? QueryContext.empty() : context;

        var countries = new LinkedHashSet<String>();
        if (ctx.country() != null && !ctx.country().isBlank()) {
            countries.add(properties.canonicalCountry(ctx.country()));
        }
        if (ctx.counterpartCountry() != null && !ctx.counterpartCountry().isBlank()) {
            countries.add(properties.canonicalCountry(ctx.counterpartCountry()));
        }
        countries.addAll(countriesIn(lower));

        var categories = new LinkedHashSet<String>();
        if (ctx.equipmentType() != null && !ctx.equipmentType().isBlank()) {
            categories.add(KeywordMatcher.normalize(ctx.equipmentType()).trim());
        }
        for (String category : EQUIPMENT_CATEGORIES) {
            if (KeywordMatcher.containsWord(lower, category)) {
                categories.add(category);
            }
        }
        for (var alias : EQUIPMENT_CATEGORY_ALIASES) {
            if (lower.contains(alias.getKey())) {
                categories.add(alias.getValue());
            }
        }

        var equipmentIds = ctx.equipmentId() == null || ctx.equipmentId().isBlank()
                ? List.<String>of()
                : List.of(ctx.equipmentId().trim());

        Integer window = ctx.timeWindowDays() != null ? ctx.timeWindowDays() : timeWindowIn(lower);
        return new ExtractedEntities(new ArrayList<>(countries), new ArrayList<>(categories), window, equipmentIds);
    }

    /** Canonical names ordered by first position in the text. */
    private List<String> countriesIn(String lower) {
        var byPosition = new TreeMap<Integer, String>();
        var vocabulary = new ArrayList<String>(properties.getCountryRisk().keySet());
        vocabulary.addAll(properties.getCountryAliases().keySet());
        for (String name : vocabulary) {
            String regex = KeywordMatcher.isIdeographic(name)
                    ? Pattern.quote(name)
                    : "\\b" + Pattern.quote(name) + "\\b";
            Matcher m = Pattern.compile(regex).matcher(lower);
            if (m.find()) {
                byPosition.putIfAbsent(m.start(), properties.canonicalCountry(name));
            }
        }
        return List.copyOf(new LinkedHashSet<>(byPosition.values()));
    }

    static Integer timeWindowIn(String lower) {
        Matcher m = TIME_PHRASE.matcher(lower);
        if (m.find()) {
            int n = m.group(2) == null ? 1 : Integer.parseInt(m.group(2));
            int unit = switch (m.group(3)) {
                case "week" -> 7;
                case "month" -> 30;
                default -> 1;
            };
            return n * unit;
        }
        Matcher cjk = CJK_TIME_PHRASE.matcher(lower);
        if (cjk.find()) {
            int n = cjk.group(2) == null ? 1 : Integer.parseInt(cjk.group(2));
            int unit = switch (cjk.group(3)) {
                case "週", "周" -> 7;
                case "個月", "月" -> 30;
                default -> 1;
            };
            return n * unit;
        }
        return null;
    }
}
