package com.boundgen.domain.document.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Structured document produced by one generation attempt.
 * <p>
 * Sections are immutable lists; reconciliation produces new instances through
 * {@link #withSection}. The raw JSON the generator returned is kept for schema checks.
 * </p>
 */
public final class GeneratedDocument {

    private final JsonNode source;
    private final Map<DocumentSection, List<DocumentItem>> sections;

    public GeneratedDocument(JsonNode source, Map<DocumentSection, List<DocumentItem>> sections) {
        this.source = source;
        EnumMap<DocumentSection, List<DocumentItem>> copy = new EnumMap<>(DocumentSection.class);
        for (DocumentSection section : DocumentSection.values()) {
            List<DocumentItem> items = sections.get(section);
            copy.put(section, items == null ? List.of() : List.copyOf(items));
        }
        this.sections = Collections.unmodifiableMap(copy);
    }

    public static GeneratedDocument of(Map<DocumentSection, List<DocumentItem>> sections) {
        return new GeneratedDocument(null, sections);
    }

    public JsonNode source() {
        return source;
    }

    public List<DocumentItem> section(DocumentSection section) {
        return sections.get(section);
    }

    public Map<DocumentSection, List<DocumentItem>> sections() {
        return sections;
    }

    public List<DocumentItem> knownConstraints() {
        return section(DocumentSection.KNOWN_CONSTRAINTS);
    }

    public List<DocumentItem> assumptions() {
        return section(DocumentSection.ASSUMPTIONS);
    }

    public List<DocumentItem> recommendations() {
        return section(DocumentSection.RECOMMENDATIONS);
    }

    public List<DocumentItem> unknowns() {
        return section(DocumentSection.UNKNOWNS);
    }

    public List<DocumentItem> earlyDecisionPoints() {
        return section(DocumentSection.EARLY_DECISION_POINTS);
    }

    public List<DocumentItem> guardrails() {
        return section(DocumentSection.GUARDRAILS);
    }

    public List<LocatedItem> located(DocumentSection section) {
        List<DocumentItem> items = section(section);
        List<LocatedItem> located = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            located.add(new LocatedItem(section, i, items.get(i)));
        }
        return located;
    }

    /** Every entry of every section, in section then entry order. */
    public List<LocatedItem> located() {
        List<LocatedItem> located = new ArrayList<>();
        for (DocumentSection section : DocumentSection.values()) {
            located.addAll(located(section));
        }
        return located;
    }

    public GeneratedDocument withSection(DocumentSection section, List<DocumentItem> items) {
        EnumMap<DocumentSection, List<DocumentItem>> copy = new EnumMap<>(sections);
        copy.put(section, items);
        return new GeneratedDocument(source, copy);
    }
}
