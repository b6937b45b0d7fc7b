package com.supplyguard.core.model;

import java.io.Serializable;
import java.time.Instant;

public record NewsEvent(
    String id,
    String title,
    String content,
    String source,
    String country,
    NewsCategory category,
    ImpactLevel impactLevel,
    Instant publishedAt
) implements Serializable {

    public boolean isHighImpact() {
        return impactLevel == ImpactLevel.HIGH;
    }

    /** Title and content joined, for keyword scanning. */
    public String text() {
        return (title == null ? "" : title) + " " + (content == null ? "" : content);
    }
}
