package com.boundgen.infrastructure.ai.validation.rules;

import com.boundgen.domain.document.model.GeneratedDocument;
import com.boundgen.domain.validation.model.Finding;
import com.boundgen.domain.validation.model.RuleGroup;
import com.boundgen.domain.validation.model.RuleGroupSettings;
import com.boundgen.domain.validation.model.Severity;
import com.boundgen.infrastructure.ai.DocumentJsonMapper;
import com.boundgen.infrastructure.ai.validation.RuleGroupCheck;
import com.boundgen.infrastructure.ai.validation.RuleGroupOutcome;
import com.boundgen.infrastructure.ai.validation.ValidationInput;
import com.fasterxml.jackson.databind.JsonNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Rule group 9. Validates the raw generator output against the JSON Schema named by the
 * schema reference, loaded from {@code classpath:/schemas/<ref>.json}.
 */
@Slf4j
@Component
public class SchemaConformanceCheck implements RuleGroupCheck {

    static final String VIOLATION_RULE = "SCHEMA-001";
    static final String UNKNOWN_SCHEMA_RULE = "SCHEMA-002";

    private static final Pattern SAFE_REF = Pattern.compile("[A-Za-z0-9_.\\-]+");

    private final DocumentJsonMapper documentMapper;
    private final JsonSchemaFactory schemaFactory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
    private final Map<String, Optional<JsonSchema>> schemas = new ConcurrentHashMap<>();

    public SchemaConformanceCheck(DocumentJsonMapper documentMapper) {
        this.documentMapper = documentMapper;
    }

    @Override
    public RuleGroup group() {
        return RuleGroup.SCHEMA;
    }

    @Override
    public RuleGroupOutcome evaluate(ValidationInput input, RuleGroupSettings settings) {
        Optional<JsonSchema> schema = schemaFor(input.schemaRef());
        if (schema.isEmpty()) {
            return RuleGroupOutcome.of(List.of(Finding.of(UNKNOWN_SCHEMA_RULE, Severity.WARNING, "",
                    "No schema registered for '" + input.schemaRef() + "', structural check skipped")), settings);
        }

        JsonNode json = documentJson(input.document());
        Set<ValidationMessage> messages = schema.get().validate(json);

        List<Finding> findings = new ArrayList<>();
        messages.stream()
                .sorted(Comparator.comparing(ValidationMessage::getMessage))
                .forEach(message -> findings.add(new Finding(VIOLATION_RULE, settings.severity(),
                        toPointer(message.getInstanceLocation().toString()),
                        message.getMessage(),
                        "Return a JSON object that matches schema " + input.schemaRef() + ".")));
        return RuleGroupOutcome.of(findings, settings);
    }

    Optional<JsonSchema> schemaFor(String schemaRef) {
        if (schemaRef == null || !SAFE_REF.matcher(schemaRef).matches()) {
            return Optional.empty();
        }
        return schemas.computeIfAbsent(schemaRef, this::load);
    }

    private Optional<JsonSchema> load(String schemaRef) {
        String path = "/schemas/" + schemaRef + ".json";
        try (InputStream in = SchemaConformanceCheck.class.getResourceAsStream(path)) {
            if (in == null) {
                log.warn("Schema {} not found on classpath", path);
                return Optional.empty();
            }
            return Optional.of(schemaFactory.getSchema(in));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read schema " + path, e);
        }
    }

    private JsonNode documentJson(GeneratedDocument document) {
        return document.source() != null ? document.source() : documentMapper.toJson(document);
    }

    /** {@code $.known_constraints[0].text} to {@code /known_constraints/0/text}. */
    static String toPointer(String path) {
        if (path == null || path.isEmpty() || "$".equals(path)) {
            return "";
        }
        String pointer = path.startsWith("$") ? path.substring(1) : path;
        return pointer.replaceAll("\\[(\\d+)]", ".$1").replace('.', '/');
    }
}
