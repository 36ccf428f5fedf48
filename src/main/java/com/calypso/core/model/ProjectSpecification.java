package com.calypso.core.model;

import java.util.List;
import java.util.Map;

/**
 * Structured project brief supplied by the authoring tool: what the generated
 * site should contain. Owned by the project CRUD surfaces, read-only here.
 */
public record ProjectSpecification(
    String name,
    String description,
    List<Feature> features,
    List<Flow> flows,
    List<Page> pages,
    StyleGuide styleGuide
) {

    public ProjectSpecification {
        features = features == null ? List.of() : List.copyOf(features);
        flows = flows == null ? List.of() : List.copyOf(flows);
        pages = pages == null ? List.of() : List.copyOf(pages);
    }

    public record Feature(String title, String description) {}

    public record Flow(String title, List<Step> steps) {
        public Flow {
            steps = steps == null ? List.of() : List.copyOf(steps);
        }
    }

    public record Step(String title, String description) {}

    /**
     * @param designHtml HTML design for the page, may be null when the page has no design yet
     */
    public record Page(String title, String description, List<Section> contents, String designHtml) {
        public Page {
            contents = contents == null ? List.of() : List.copyOf(contents);
        }
    }

    public record Section(String name, String description) {}

    public record StyleGuide(String html, Map<String, String> fonts, Map<String, String> colors) {}
}
