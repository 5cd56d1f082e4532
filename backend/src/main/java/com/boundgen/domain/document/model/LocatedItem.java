package com.boundgen.domain.document.model;

/**
 * A document entry together with its JSON pointer.
 */
public record LocatedItem(DocumentSection section, int index, DocumentItem item) {

    public String location() {
        return section.pointer(index);
    }

    public String text() {
        return item.text();
    }
}
