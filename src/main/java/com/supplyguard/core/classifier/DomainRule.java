package com.supplyguard.core.classifier;

import com.supplyguard.core.model.RiskDimension;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Keywords and regex patterns that vote for one domain.
 */
record DomainRule(RiskDimension domain, List<String> keywords, List<Pattern> patterns) {

    static final int KEYWORD_POINTS = 2;
    static final int PATTERN_POINTS = 3;

    static DomainRule of(RiskDimension domain, List<String> keywords, String... patterns) {
        return new DomainRule(domain, List.copyOf(keywords),
                Arrays.stream(patterns).map(Pattern::compile).toList());
    }

    static final List<DomainRule> DEFAULTS = List.of(
        of(RiskDimension.SCHEDULING,
            List.of("schedule", "delivery", "timeline", "delay", "deadline",
                    "排程", "交付", "時間表", "延遲", "截止日期", "進度"),
            "schedule.*risk", "delivery.*delay", "排程.*風險", "交付.*延遲"),
        of(RiskDimension.POLITICAL,
            List.of("political", "government", "policy", "election", "sanction",
                    "政治", "政府", "政策", "選舉", "制裁", "外交"),
            "political.*risk", "government.*change", "政治.*風險", "政府.*變化"),
        of(RiskDimension.LOGISTICS,
            List.of("logistics", "transport", "shipping", "port", "cargo",
                    "物流", "運輸", "航運", "港口", "貨物", "運送"),
            "logistics.*risk", "transport.*delay", "物流.*風險", "運輸.*延遲"),
        of(RiskDimension.TARIFF,
            List.of("tariff", "trade", "customs", "duty", "import", "export",
                    "關稅", "貿易", "海關", "稅收", "進口", "出口"),
            "tariff.*risk", "trade.*war", "關稅.*風險", "貿易.*戰")
    );
}
