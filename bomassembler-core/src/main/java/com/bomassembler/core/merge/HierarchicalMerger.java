package com.bomassembler.core.merge;

import com.bomassembler.core.config.AssemblyConfig.App;
import com.bomassembler.core.config.Contact;
import com.bomassembler.core.config.ToolIdentity;
import com.bomassembler.core.model.Component;
import com.bomassembler.core.model.CreationInfo;
import com.bomassembler.core.model.Creator;
import com.bomassembler.core.model.Document;
import com.bomassembler.core.model.Relationship;
import com.bomassembler.core.model.RelationshipType;
import com.bomassembler.core.util.IdGenerator;
import com.bomassembler.core.util.Timestamps;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Merges documents under a synthesized root component.
 *
 * <p>Stages, in order:
 * <ol>
 *   <li>{@link MergeStage#INIT} - document header, creators, license-list version, external
 *       document references of all inputs</li>
 *   <li>{@link MergeStage#SYNTHESIZE_ROOT} - root component and the DESCRIBES relationship from the
 *       document to it, always the first relationship</li>
 *   <li>{@link MergeStage#INGEST} - per input: copy every component; described components get a
 *       new identifier, a CONTAINS relationship from the root, and every relationship of that
 *       input is rewritten to the new identifier; then all non-DESCRIBES relationships, files,
 *       other-license records, snippets and annotations are appended</li>
 *   <li>{@link MergeStage#FINALIZE} - the output document is complete</li>
 * </ol>
 *
 * <p>Components are copied whole, including the package properties the model does not name.
 * Non-described components keep their identifiers. Collisions between such identifiers across
 * inputs are not detected.
 */
public class HierarchicalMerger implements DocumentMerger {

    private static final Logger log = LoggerFactory.getLogger(HierarchicalMerger.class);

    public static final String SPDX_VERSION = "SPDX-2.3";
    public static final String DATA_LICENSE = "CC0-1.0";
    static final String NAMESPACE_BASE = "https://spdx.org/spdxdocs/";
    static final List<String> APPENDED_SECTIONS = List.of("snippets", "annotations");

    private final App app;
    private final ToolIdentity tool;
    private final Clock clock;
    private final IdGenerator ids;
    private final ComponentCopier copier;
    private final RootComponentFactory rootFactory = new RootComponentFactory();

    private final MergeProgress progress;

    public HierarchicalMerger(App app, ToolIdentity tool, Clock clock) {
        this(app, tool, clock, new MergeProgress());
    }

    public HierarchicalMerger(App app, ToolIdentity tool, Clock clock, MergeProgress progress) {
        this(app, tool, clock, IdGenerator.random(), new JacksonComponentCopier(), progress);
    }

    public HierarchicalMerger(App app, ToolIdentity tool, Clock clock, IdGenerator ids, ComponentCopier copier) {
        this(app, tool, clock, ids, copier, new MergeProgress());
    }

    public HierarchicalMerger(App app, ToolIdentity tool, Clock clock, IdGenerator ids, ComponentCopier copier,
                              MergeProgress progress) {
        this.app = Objects.requireNonNull(app, "app must not be null");
        this.tool = Objects.requireNonNull(tool, "tool must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.ids = Objects.requireNonNull(ids, "ids must not be null");
        this.copier = Objects.requireNonNull(copier, "copier must not be null");
        this.progress = Objects.requireNonNull(progress, "progress must not be null");
    }

    /**
     * Returns the stage reached by the last merge, null before the first one.
     *
     * @return current stage
     */
    public MergeStage stage() {
        return progress.stage();
    }

    @Override
    public MergeResult merge(List<Document> inputs) {
        try {
            return doMerge(inputs);
        } catch (RuntimeException e) {
            progress.abort(e);
            throw e;
        }
    }

    private MergeResult doMerge(List<Document> inputs) {
        progress.begin();
        String licenseListVersion = LicenseListVersions.select(inputs);
        log.debug("License list versions reconciled across {} inputs: selected {}", inputs.size(), licenseListVersion);

        CreationInfo creationInfo = new CreationInfo(
            Timestamps.utcNow(clock),
            creators(),
            String.format("Generated by %s using %d documents", tool.displayName(), inputs.size()),
            licenseListVersion);

        List<JsonNode> externalDocumentRefs = new ArrayList<>();
        inputs.forEach(doc -> externalDocumentRefs.addAll(doc.externalDocumentRefs()));

        progress.advance(MergeStage.SYNTHESIZE_ROOT);
        String rootId = ids.elementId("RootPackage");
        Component root = rootFactory.create(app, rootId);
        log.debug("Root component id: {}", rootId);

        List<Component> components = new ArrayList<>();
        List<Relationship> relationships = new ArrayList<>();
        List<JsonNode> files = new ArrayList<>();
        List<JsonNode> otherLicenses = new ArrayList<>();
        Map<String, ArrayNode> sections = new LinkedHashMap<>();
        components.add(root);
        relationships.add(Relationship.of(Document.DOCUMENT_ID, RelationshipType.DESCRIBES, rootId));

        progress.advance(MergeStage.INGEST);
        int componentsIn = 0;
        int cloneFailures = 0;
        int described = 0;
        for (Document doc : inputs) {
            log.debug("Processing document {} ({}): components={}, files={}, relationships={}, otherLicenses={}, externalDocumentRefs={}",
                doc.name(), doc.namespace(), doc.components().size(), doc.files().size(),
                doc.relationships().size(), doc.otherLicenses().size(), doc.externalDocumentRefs().size());

            Set<String> describedIds = doc.relationships().stream()
                .filter(rel -> rel.type() == RelationshipType.DESCRIBES)
                .map(Relationship::refB)
                .collect(Collectors.toSet());

            List<Relationship> docRelationships = new ArrayList<>(doc.relationships());

            for (Component component : doc.components()) {
                componentsIn++;
                Component copy;
                try {
                    copy = copier.copy(component);
                } catch (ComponentCopyException e) {
                    log.warn("Failed to copy component {} ({}); skipping it: {}",
                        component.id(), component.name(), e.getMessage());
                    cloneFailures++;
                    continue;
                }

                if (describedIds.contains(component.id())) {
                    String newId = ids.elementId("Package");
                    copy = copy.withId(newId);
                    relationships.add(Relationship.of(rootId, RelationshipType.CONTAINS, newId));
                    docRelationships.replaceAll(rel -> rel.rewrite(component.id(), newId));
                    described++;
                    log.debug("Re-identified described component {} as {}", component.id(), newId);
                }
                components.add(copy);
            }

            docRelationships.stream()
                .filter(rel -> rel.type() != RelationshipType.DESCRIBES)
                .forEach(relationships::add);
            files.addAll(doc.files());
            otherLicenses.addAll(doc.otherLicenses());
            appendSections(doc, sections);
        }

        progress.advance(MergeStage.FINALIZE);
        Document output = new Document(
            SPDX_VERSION,
            DATA_LICENSE,
            Document.DOCUMENT_ID,
            app.name(),
            namespace(app.name()),
            creationInfo,
            externalDocumentRefs,
            components,
            files,
            relationships,
            otherLicenses,
            null,
            new LinkedHashMap<>(sections));

        MergeStatistics statistics = new MergeStatistics(
            inputs.size(),
            componentsIn,
            components.size(),
            cloneFailures,
            described,
            relationships.size(),
            files.size(),
            otherLicenses.size(),
            externalDocumentRefs.size());
        log.info("Merged {} documents: components={}, relationships={}, files={}, otherLicenses={}, skipped={}",
            statistics.inputs(), statistics.componentsOut(), statistics.relationships(),
            statistics.files(), statistics.otherLicenses(), statistics.cloneFailures());

        return new MergeResult(output, rootId, statistics);
    }

    private List<Creator> creators() {
        List<Creator> creators = new ArrayList<>();
        for (Contact author : app.authors()) {
            if (author == null || author.blank()) {
                continue;
            }
            creators.add(Creator.organization(author.display()));
        }
        creators.add(tool.creator());
        return creators;
    }

    private String namespace(String name) {
        String slug = name == null || name.isBlank()
            ? "bom"
            : name.trim().replaceAll("[^A-Za-z0-9._-]+", "-");
        return NAMESPACE_BASE + slug + "-" + ids.uuid();
    }

    private static void appendSections(Document doc, Map<String, ArrayNode> sections) {
        for (String name : APPENDED_SECTIONS) {
            JsonNode section = doc.extensions().get(name);
            if (section != null && section.isArray() && !section.isEmpty()) {
                sections.computeIfAbsent(name, key -> JsonNodeFactory.instance.arrayNode())
                    .addAll((ArrayNode) section.deepCopy());
            }
        }
    }
}
