package com.boundgen.domain.document.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One entry of a document section.
 *
 * @param id           generator-assigned id (nullable)
 * @param text         entry text
 * @param source       who authored the entry; {@link #USER_CLARIFICATION} for pinned entries (nullable)
 * @param constraintId invariant id for pinned entries (nullable)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DocumentItem(
        String id,
        String text,
        String source,
        @JsonProperty("constraint_id") String constraintId
) {
    public static final String USER_CLARIFICATION = "user_clarification";

    public DocumentItem {
        text = text == null ? "" : text;
    }

    public static DocumentItem of(String text) {
        return new DocumentItem(null, text, null, null);
    }

    public static DocumentItem pinned(String constraintId, String text) {
        return new DocumentItem(null, text, USER_CLARIFICATION, constraintId);
    }

    @JsonIgnore
    public boolean isPinned() {
        return USER_CLARIFICATION.equals(source);
    }
}
