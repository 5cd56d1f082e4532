package com.boundgen.support;

import com.boundgen.domain.clarification.model.AnswerType;
import com.boundgen.domain.clarification.model.Choice;
import com.boundgen.domain.clarification.model.Clarification;
import com.boundgen.domain.clarification.model.ConstraintKind;
import com.boundgen.domain.clarification.model.MergedClarifications;
import com.boundgen.domain.clarification.model.Priority;
import com.boundgen.domain.document.model.DocumentItem;
import com.boundgen.domain.document.model.DocumentSection;
import com.boundgen.domain.document.model.GeneratedDocument;
import com.boundgen.domain.generation.model.TaskParameters;
import com.boundgen.infrastructure.ai.clarification.AnswerLabelResolver;
import com.boundgen.infrastructure.ai.clarification.ClarificationMerger;
import com.boundgen.infrastructure.ai.clarification.ConstraintDeriver;
import com.boundgen.infrastructure.ai.text.KeywordOverlapMatcher;
import com.boundgen.infrastructure.ai.validation.ValidationInput;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Shared test data: the clarifications used across tests and small document builders.
 */
public final class Fixtures {

    public static final String SCHEMA_REF = "generated_document.v1";

    private Fixtures() {
    }

    public static KeywordOverlapMatcher matcher() {
        return new KeywordOverlapMatcher();
    }

    public static ClarificationMerger merger() {
        AnswerLabelResolver resolver = new AnswerLabelResolver();
        return new ClarificationMerger(new ConstraintDeriver(resolver), resolver, matcher());
    }

    public static Clarification deploymentContext() {
        return Clarification.builder()
                .id("DEPLOYMENT_CONTEXT")
                .questionText("Where will the app be used?")
                .priority(Priority.MUST)
                .constraintKind(ConstraintKind.REQUIREMENT)
                .answerType(AnswerType.SINGLE_CHOICE)
                .answer("personal")
                .answerLabel("Personal use (family/home)")
                .resolved(true)
                .build();
    }

    public static Clarification existingSystems() {
        return Clarification.builder()
                .id("EXISTING_SYSTEMS")
                .questionText("Does it need to connect to existing systems?")
                .priority(Priority.MUST)
                .constraintKind(ConstraintKind.EXCLUSION)
                .answerType(AnswerType.YES_NO)
                .answer(false)
                .answerLabel("No")
                .resolved(true)
                .canonicalTags(List.of("No integrations"))
                .build();
    }

    public static Clarification platform() {
        return Clarification.builder()
                .id("PLATFORM")
                .questionText("Which platform should it run on?")
                .priority(Priority.MUST)
                .constraintKind(ConstraintKind.SELECTION)
                .answerType(AnswerType.SINGLE_CHOICE)
                .choices(List.of(
                        new Choice("web", "Web browser"),
                        new Choice("ios", "iOS app"),
                        new Choice("android", "Android app")))
                .answer("web")
                .answerLabel("Web browser")
                .resolved(true)
                .build();
    }

    public static Clarification offlineSupport() {
        return Clarification.builder()
                .id("OFFLINE_SUPPORT")
                .questionText("Should it work offline?")
                .priority(Priority.SHOULD)
                .constraintKind(ConstraintKind.PREFERENCE)
                .answerType(AnswerType.FREE_TEXT)
                .answer("Offline sync for shopping lists")
                .answerLabel("Offline sync for shopping lists")
                .resolved(true)
                .build();
    }

    public static MergedClarifications merged(Clarification... clarifications) {
        return merger().merge(Arrays.asList(clarifications));
    }

    public static List<DocumentItem> items(String... texts) {
        return Arrays.stream(texts).map(DocumentItem::of).toList();
    }

    public static DocumentBuilder document() {
        return new DocumentBuilder();
    }

    public static TaskParameters task() {
        return TaskParameters.builder()
                .documentType("project_discovery")
                .taskPrompt("Produce a project discovery document.")
                .build();
    }

    public static ValidationInput input(MergedClarifications merged, GeneratedDocument document) {
        return input(merged, document, task());
    }

    public static ValidationInput input(MergedClarifications merged, GeneratedDocument document, TaskParameters task) {
        return new ValidationInput(merged, document, task, SCHEMA_REF, 1);
    }

    public static final class DocumentBuilder {

        private final Map<DocumentSection, List<DocumentItem>> sections = new EnumMap<>(DocumentSection.class);

        public DocumentBuilder with(DocumentSection section, String... texts) {
            sections.put(section, items(texts));
            return this;
        }

        public DocumentBuilder withItems(DocumentSection section, List<DocumentItem> items) {
            sections.put(section, items);
            return this;
        }

        public GeneratedDocument build() {
            return GeneratedDocument.of(sections);
        }
    }
}
