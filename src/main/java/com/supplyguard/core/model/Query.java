package com.supplyguard.core.model;

import java.io.Serializable;

/**
 * Immutable inbound request: raw text plus optional context.
 */
public record Query(String text, QueryContext context) implements Serializable {

    public Query {
        text = text == null ? "" : text;
        context = context == null ? QueryContext.empty() : context;
    }

    public static Query of(String text) {
        return new Query(text, QueryContext.empty());
    }
}
