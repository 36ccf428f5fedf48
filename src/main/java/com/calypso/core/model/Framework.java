package com.calypso.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Target framework of a generated project.
 * <p>
 * {@code HTML} projects have no build step, so verification is skipped for them.
 */
public enum Framework {

    NEXTJS("nextjs", "Next.js (App Router)", "nextjs"),
    VITE_REACT("vite_react", "Vite + React", "vite"),
    HTML("html", "HTML/CSS/JS", null);

    private final String wireName;
    private final String label;
    private final String hostingFramework;

    Framework(String wireName, String label, String hostingFramework) {
        this.wireName = wireName;
        this.label = label;
        this.hostingFramework = hostingFramework;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public String label() {
        return label;
    }

    /** Framework preset understood by the hosting provider, or {@code null} for a static site. */
    public String hostingFramework() {
        return hostingFramework;
    }

    public boolean requiresBuild() {
        return this != HTML;
    }

    @JsonCreator
    public static Framework fromWireName(String value) {
        for (Framework framework : values()) {
            if (framework.wireName.equalsIgnoreCase(value) || framework.name().equalsIgnoreCase(value)) {
                return framework;
            }
        }
        throw new IllegalArgumentException("Unknown framework: " + value);
    }
}
