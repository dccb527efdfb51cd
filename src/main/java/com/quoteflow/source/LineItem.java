package com.quoteflow.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record LineItem(String description, String quantity, String price) {
    public LineItem {
        description = description == null ? "" : description;
    }

    public static LineItem of(String description) {
        return new LineItem(description, null, null);
    }
}
