package com.bomassembler.core.edit;

import com.bomassembler.core.config.ToolIdentity;
import com.bomassembler.core.edit.field.FieldHandler;
import com.bomassembler.core.edit.field.FieldHandlers;
import com.bomassembler.core.model.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Applies an edit request to a document, one field at a time.
 *
 * <p>The subject is resolved first, then every handler of the field table runs in order. A field
 * that is not configured, not supported on the subject or given an invalid value is skipped and
 * recorded in the {@link EditReport}; it never stops the remaining fields.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * FieldReconciliationEngine engine = new FieldReconciliationEngine(
 *     new ToolIdentity("bomassembler", "1.0.0"), Clock.systemUTC());
 *
 * EditSettings settings = new EditSettings(
 *     SearchSpec.primaryComponent(),
 *     EditPolicy.MISSING,
 *     EditRequest.builder().name("widget").purl("pkg:maven/acme/widget@1.0").build());
 *
 * EditResult result = engine.edit(document, settings);
 * }</pre>
 */
public class FieldReconciliationEngine {

    private static final Logger log = LoggerFactory.getLogger(FieldReconciliationEngine.class);

    private final List<FieldHandler> handlers;
    private final SubjectResolver resolver;

    public FieldReconciliationEngine(ToolIdentity tool, Clock clock) {
        this(FieldHandlers.defaults(tool, clock), new SubjectResolver());
    }

    public FieldReconciliationEngine(List<FieldHandler> handlers, SubjectResolver resolver) {
        this.handlers = List.copyOf(handlers);
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
    }

    /**
     * Returns the field table in application order.
     *
     * @return field handlers
     */
    public List<FieldHandler> handlers() {
        return handlers;
    }

    /**
     * Resolves the subject and applies every field.
     *
     * @param document document to edit, left unchanged (the result carries the edited copy)
     * @param settings subject search, policy and values
     * @return edited document and field outcomes
     */
    public EditResult edit(Document document, EditSettings settings) {
        log.debug("Editing document {} (subject: {}, policy: {})",
            document.name(), settings.search().subject(), settings.policy());
        EditSubject subject = resolver.resolve(document, settings.search());
        EditReport report = apply(subject, settings.policy(), settings.request());
        return new EditResult(subject.document(), report);
    }

    /**
     * Applies every field to an already resolved subject.
     *
     * @param subject subject under edit, updated in place
     * @param policy edit policy
     * @param request configured values
     * @return field outcomes in table order
     */
    public EditReport apply(EditSubject subject, EditPolicy policy, EditRequest request) {
        Map<String, FieldOutcome> outcomes = new LinkedHashMap<>();
        for (FieldHandler handler : handlers) {
            FieldOutcome outcome = handler.apply(subject, policy, request);
            outcomes.put(handler.name(), outcome);
            logOutcome(handler, subject, outcome);
        }
        return new EditReport(outcomes);
    }

    private void logOutcome(FieldHandler handler, EditSubject subject, FieldOutcome outcome) {
        switch (outcome) {
            case APPLIED -> log.debug("Updated {}", handler.name());
            case NO_CONFIGURATION -> log.trace("Skipping {}: not configured", handler.name());
            case NOT_SUPPORTED -> {
                if (!subject.isDocument() && !subject.hasComponent()) {
                    log.info("Cannot update {}: no component resolved for subject {}", handler.name(), subject.kind());
                } else {
                    log.info("Cannot update {}: not supported for subject {}", handler.name(), subject.kind());
                }
            }
            case INVALID_INPUT -> log.warn("Cannot update {}: invalid value", handler.name());
        }
    }
}
