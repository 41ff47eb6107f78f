package com.bomassembler.core.edit;

import com.bomassembler.core.model.Component;
import com.bomassembler.core.model.Document;
import com.bomassembler.core.model.Relationship;
import com.bomassembler.core.model.RelationshipType;
import com.bomassembler.core.util.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.OptionalInt;
import java.util.stream.IntStream;

/**
 * Locates the target of an edit within a document.
 *
 * <p>A component search that finds nothing is not an error: the returned subject is
 * {@linkplain EditSubject#unresolved unresolved} and component-scoped fields are skipped.
 */
public class SubjectResolver {

    private static final Logger log = LoggerFactory.getLogger(SubjectResolver.class);

    /**
     * Resolves the subject described by the search.
     *
     * @param document document to search
     * @param search search specification
     * @return resolved (or unresolved) subject
     */
    public EditSubject resolve(Document document, SearchSpec search) {
        OptionalInt index = switch (search.subject()) {
            case DOCUMENT -> OptionalInt.empty();
            case PRIMARY_COMPONENT -> findPrimary(document);
            case COMPONENT_NAME_VERSION -> findByNameVersion(document, search.name(), search.version());
        };

        if (search.subject() == SubjectKind.DOCUMENT) {
            return EditSubject.forDocument(document);
        }
        if (index.isEmpty()) {
            log.info("No component found for subject {} (name: {}, version: {}); component fields will be skipped",
                search.subject(), search.name(), search.version());
            return EditSubject.unresolved(search.subject(), document);
        }

        Component component = document.components().get(index.getAsInt());
        log.debug("Resolved subject {} to component {} ({} {})",
            search.subject(), component.id(), component.name(), component.version());
        return EditSubject.forComponent(search.subject(), document, index.getAsInt());
    }

    /**
     * Finds the component the document describes. Exactly one distinct described identifier
     * must exist and it must name a component of the document.
     */
    private OptionalInt findPrimary(Document document) {
        List<String> described = document.relationships().stream()
            .filter(rel -> rel.type() == RelationshipType.DESCRIBES)
            .filter(rel -> rel.refA().equals(document.spdxId()))
            .map(Relationship::refB)
            .distinct()
            .toList();

        if (described.size() != 1) {
            log.debug("Document describes {} elements; primary component is ambiguous or absent", described.size());
            return OptionalInt.empty();
        }

        String id = described.get(0);
        return IntStream.range(0, document.components().size())
            .filter(i -> document.components().get(i).id().equals(id))
            .findFirst();
    }

    private OptionalInt findByNameVersion(Document document, String name, String version) {
        if (Strings.isEmpty(name)) {
            return OptionalInt.empty();
        }
        return IntStream.range(0, document.components().size())
            .filter(i -> {
                Component c = document.components().get(i);
                return name.equals(c.name()) && (Strings.isEmpty(version) || version.equals(c.version()));
            })
            .findFirst();
    }
}
