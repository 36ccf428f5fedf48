package com.calypso.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum StylingApproach {

    TAILWIND("tailwind", "Tailwind CSS"),
    CSS("css", "CSS Modules"),
    SCSS("scss", "SCSS/Sass");

    private final String wireName;
    private final String label;

    StylingApproach(String wireName, String label) {
        this.wireName = wireName;
        this.label = label;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public String label() {
        return label;
    }

    @JsonCreator
    public static StylingApproach fromWireName(String value) {
        for (StylingApproach styling : values()) {
            if (styling.wireName.equalsIgnoreCase(value) || styling.name().equalsIgnoreCase(value)) {
                return styling;
            }
        }
        throw new IllegalArgumentException("Unknown styling approach: " + value);
    }
}
