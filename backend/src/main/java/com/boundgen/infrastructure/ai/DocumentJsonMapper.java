package com.boundgen.infrastructure.ai;

import com.boundgen.domain.document.model.DocumentItem;
import com.boundgen.domain.document.model.DocumentSection;
import com.boundgen.domain.document.model.GeneratedDocument;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads generator JSON into a {@link GeneratedDocument} and writes documents back out.
 * <p>
 * Entries may be plain strings or objects whose text sits under one of several field names.
 * Output that is not JSON still yields a document (with empty sections) so that schema
 * validation reports it instead of the call failing. Provenance fields ({@code source},
 * {@code constraint_id}) are not read: only reconciliation marks entries as user-pinned.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DocumentJsonMapper {

    static final List<String> TEXT_FIELDS = List.of(
            "text", "constraint", "description", "recommendation",
            "assumption", "question", "guardrail", "unknown");

    private final ObjectMapper objectMapper;

    public GeneratedDocument parse(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("Generated content is not valid JSON: {}", e.getOriginalMessage());
            return new GeneratedDocument(TextNode.valueOf(json), Map.of());
        }
        return fromJson(root);
    }

    public GeneratedDocument fromJson(JsonNode root) {
        Map<DocumentSection, List<DocumentItem>> sections = new EnumMap<>(DocumentSection.class);
        if (root != null && root.isObject()) {
            for (DocumentSection section : DocumentSection.values()) {
                List<DocumentItem> items = new ArrayList<>();
                for (String key : section.keys()) {
                    readItems(root.get(key), items);
                }
                sections.put(section, items);
            }
        }
        return new GeneratedDocument(root, sections);
    }

    /** Canonical JSON of the document sections, using the primary key of each section. */
    public ObjectNode toJson(GeneratedDocument document) {
        ObjectNode root = objectMapper.createObjectNode();
        for (DocumentSection section : DocumentSection.values()) {
            ArrayNode array = root.putArray(section.key());
            for (DocumentItem item : document.section(section)) {
                array.add(objectMapper.valueToTree(item));
            }
        }
        return root;
    }

    private void readItems(JsonNode node, List<DocumentItem> items) {
        if (node == null || node.isNull()) {
            return;
        }
        if (node.isArray()) {
            for (JsonNode element : node) {
                readItem(null, element, items);
            }
        } else if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                readItem(field.getKey(), field.getValue(), items);
            }
        }
    }

    private void readItem(String keyId, JsonNode element, List<DocumentItem> items) {
        if (element.isObject()) {
            String id = textOrNull(element, "id");
            items.add(new DocumentItem(
                    id != null ? id : keyId,
                    itemText(element),
                    null,
                    null));
        } else if (element.isValueNode() && !element.isNull()) {
            items.add(new DocumentItem(keyId, element.asText(), null, null));
        }
    }

    private String itemText(JsonNode element) {
        for (String field : TEXT_FIELDS) {
            JsonNode value = element.get(field);
            if (value != null && value.isValueNode() && !value.asText().isBlank()) {
                return value.asText();
            }
        }
        return "";
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
