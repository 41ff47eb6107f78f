package com.bomassembler.core.edit;

import com.bomassembler.core.model.Component;
import com.bomassembler.core.model.CreationInfo;
import com.bomassembler.core.model.Document;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * The document under edit plus, for component subjects, the position of the resolved component.
 *
 * <p>Field handlers replace values through the {@code update*} methods; the model records stay
 * immutable and this holder tracks the latest version of the document. Components are only ever
 * replaced in place, never added or removed.
 */
public final class EditSubject {

    private static final int NONE = -1;

    private final SubjectKind kind;
    private final int componentIndex;
    private Document document;

    private EditSubject(SubjectKind kind, Document document, int componentIndex) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.document = Objects.requireNonNull(document, "document must not be null");
        this.componentIndex = componentIndex;
    }

    public static EditSubject forDocument(Document document) {
        return new EditSubject(SubjectKind.DOCUMENT, document, NONE);
    }

    public static EditSubject forComponent(SubjectKind kind, Document document, int componentIndex) {
        if (componentIndex < 0 || componentIndex >= document.components().size()) {
            throw new IndexOutOfBoundsException("Component index out of range: " + componentIndex);
        }
        return new EditSubject(kind, document, componentIndex);
    }

    /**
     * Creates a component subject whose component could not be found. Component-scoped fields
     * are unavailable on it.
     *
     * @param kind requested subject kind
     * @param document document under edit
     * @return unresolved subject
     */
    public static EditSubject unresolved(SubjectKind kind, Document document) {
        return new EditSubject(kind, document, NONE);
    }

    public SubjectKind kind() {
        return kind;
    }

    public boolean isDocument() {
        return kind == SubjectKind.DOCUMENT;
    }

    public boolean hasComponent() {
        return componentIndex != NONE;
    }

    public Document document() {
        return document;
    }

    /**
     * Returns the current version of the resolved component.
     *
     * @return resolved component
     * @throws IllegalStateException if no component was resolved
     */
    public Component component() {
        if (!hasComponent()) {
            throw new IllegalStateException("No component resolved for subject " + kind);
        }
        return document.components().get(componentIndex);
    }

    /**
     * Returns the creation info, or an empty one when the document has none yet.
     *
     * @return creation info, never null
     */
    public CreationInfo creationInfo() {
        CreationInfo info = document.creationInfo();
        return info == null ? CreationInfo.empty() : info;
    }

    public void updateDocument(UnaryOperator<Document> update) {
        document = update.apply(document);
    }

    public void updateCreationInfo(UnaryOperator<CreationInfo> update) {
        document = document.withCreationInfo(update.apply(creationInfo()));
    }

    /**
     * Replaces the resolved component with an updated version.
     *
     * @param update function from the current to the updated component
     * @throws IllegalStateException if no component was resolved
     */
    public void updateComponent(UnaryOperator<Component> update) {
        Component updated = update.apply(component());
        List<Component> components = new ArrayList<>(document.components());
        components.set(componentIndex, updated);
        document = document.withComponents(components);
    }
}
