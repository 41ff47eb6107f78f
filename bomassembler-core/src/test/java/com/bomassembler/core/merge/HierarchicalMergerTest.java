package com.bomassembler.core.merge;

import com.bomassembler.core.config.AssemblyConfig.App;
import com.bomassembler.core.config.Contact;
import com.bomassembler.core.model.Component;
import com.bomassembler.core.model.CreationInfo;
import com.bomassembler.core.model.Creator;
import com.bomassembler.core.model.Document;
import com.bomassembler.core.model.Relationship;
import com.bomassembler.core.model.RelationshipType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.bomassembler.core.TestDocuments.CLOCK;
import static com.bomassembler.core.TestDocuments.NOW;
import static com.bomassembler.core.TestDocuments.TOOL;
import static com.bomassembler.core.TestDocuments.component;
import static com.bomassembler.core.TestDocuments.document;
import static com.bomassembler.core.TestDocuments.sequentialIds;
import static com.bomassembler.core.TestDocuments.uuid;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link HierarchicalMerger}.
 */
class HierarchicalMergerTest {

    private static final String DOC = Document.DOCUMENT_ID;
    private static final String ROOT_ID = "SPDXRef-RootPackage-" + uuid(1);
    private static final String A1_ID = "SPDXRef-Package-" + uuid(2);
    private static final String B1_ID = "SPDXRef-Package-" + uuid(3);

    private final App app = new App("platform", "2.0", null, "application", null,
        List.of(new Contact("Acme", "sbom@acme.example"), new Contact(" ", null)),
        null, null, null, null, null);

    private Document inputA;
    private Document inputB;

    @BeforeEach
    void setUp() {
        inputA = document("a", "3.19",
            List.of(component("SPDXRef-a1", "a", "1.0"), component("SPDXRef-a2", "a-dep", "0.1")),
            List.of(
                Relationship.of(DOC, RelationshipType.DESCRIBES, "SPDXRef-a1"),
                Relationship.of("SPDXRef-a1", RelationshipType.DEPENDS_ON, "SPDXRef-a2")));

        JsonNode file = JsonNodeFactory.instance.objectNode().put("SPDXID", "SPDXRef-File-b").put("fileName", "./b.jar");
        JsonNode license = JsonNodeFactory.instance.objectNode().put("licenseId", "LicenseRef-b").put("extractedText", "b");
        inputB = new Document("SPDX-2.3", "CC0-1.0", DOC, "b", "https://example.com/spdx/b",
            new CreationInfo("2024-01-01T00:00:00Z", List.of(Creator.tool("syft-0.90.0")), null, "3.20"),
            List.of(JsonNodeFactory.instance.objectNode().put("externalDocumentId", "DocumentRef-x")),
            List.of(component("SPDXRef-b1", "b", "2.0"), component("SPDXRef-b2", "b-dep", "0.2")),
            List.of(file),
            List.of(
                Relationship.of(DOC, RelationshipType.DESCRIBES, "SPDXRef-b1"),
                Relationship.of("SPDXRef-b1", RelationshipType.CONTAINS, "SPDXRef-b2"),
                Relationship.of("SPDXRef-b2", RelationshipType.DESCRIBED_BY, "SPDXRef-b1")),
            List.of(license),
            null);
    }

    private HierarchicalMerger merger(ComponentCopier copier) {
        return new HierarchicalMerger(app, TOOL, CLOCK, sequentialIds(), copier);
    }

    private HierarchicalMerger merger() {
        return merger(new JacksonComponentCopier());
    }

    @Test
    void merge_twoInputs_buildsHierarchyUnderRoot() {
        MergeResult result = merger().merge(List.of(inputA, inputB));
        Document out = result.document();

        assertThat(result.rootComponentId()).isEqualTo(ROOT_ID);
        assertThat(out.components()).extracting(Component::id)
            .containsExactly(ROOT_ID, A1_ID, "SPDXRef-a2", B1_ID, "SPDXRef-b2");
        assertThat(out.relationships()).containsExactly(
            Relationship.of(DOC, RelationshipType.DESCRIBES, ROOT_ID),
            Relationship.of(ROOT_ID, RelationshipType.CONTAINS, A1_ID),
            Relationship.of(A1_ID, RelationshipType.DEPENDS_ON, "SPDXRef-a2"),
            Relationship.of(ROOT_ID, RelationshipType.CONTAINS, B1_ID),
            Relationship.of(B1_ID, RelationshipType.CONTAINS, "SPDXRef-b2"),
            Relationship.of("SPDXRef-b2", RelationshipType.DESCRIBED_BY, B1_ID));
    }

    @Test
    void merge_outputHasSingleDescribesToRoot() {
        Document out = merger().merge(List.of(inputA, inputB)).document();

        assertThat(out.relationships())
            .filteredOn(rel -> rel.type() == RelationshipType.DESCRIBES)
            .containsExactly(Relationship.of(DOC, RelationshipType.DESCRIBES, ROOT_ID));
        assertThat(out.relationships().get(0).refB()).isEqualTo(out.components().get(0).id());
    }

    @Test
    void merge_noRelationshipReferencesReplacedIds() {
        Document out = merger().merge(List.of(inputA, inputB)).document();

        assertThat(out.relationships()).noneMatch(rel -> rel.references("SPDXRef-a1"));
        assertThat(out.relationships()).noneMatch(rel -> rel.references("SPDXRef-b1"));
    }

    @Test
    void merge_buildsDocumentHeader() {
        Document out = merger().merge(List.of(inputA, inputB)).document();

        assertThat(out.spdxVersion()).isEqualTo("SPDX-2.3");
        assertThat(out.dataLicense()).isEqualTo("CC0-1.0");
        assertThat(out.spdxId()).isEqualTo(DOC);
        assertThat(out.name()).isEqualTo("platform");
        assertThat(out.namespace()).isEqualTo("https://spdx.org/spdxdocs/platform-" + uuid(4));
        assertThat(out.creationInfo().created()).isEqualTo(NOW);
        assertThat(out.creationInfo().creators()).containsExactly(
            Creator.organization("Acme (sbom@acme.example)"), Creator.tool("bomassembler-1.0.0"));
        assertThat(out.creationInfo().comment()).isEqualTo("Generated by bomassembler-1.0.0 using 2 documents");
        assertThat(out.creationInfo().licenseListVersion()).isEqualTo("3.19");
    }

    @Test
    void merge_concatenatesPassThroughCollections() {
        Document out = merger().merge(List.of(inputA, inputB)).document();

        assertThat(out.files()).isEqualTo(inputB.files());
        assertThat(out.otherLicenses()).isEqualTo(inputB.otherLicenses());
        assertThat(out.externalDocumentRefs()).isEqualTo(inputB.externalDocumentRefs());
    }

    @Test
    void merge_appendsSnippetsAndAnnotationsInInputOrder() {
        Document withSections = new Document("SPDX-2.3", "CC0-1.0", DOC, "c", "https://example.com/spdx/c",
            null, null, List.of(component("SPDXRef-c1", "c", "3.0")), null,
            List.of(Relationship.of(DOC, RelationshipType.DESCRIBES, "SPDXRef-c1")), null, null,
            Map.of("snippets", snippets("SPDXRef-snippet-c"),
                "annotations", JsonNodeFactory.instance.arrayNode().add(
                    JsonNodeFactory.instance.objectNode().put("comment", "from c"))));
        Document moreSnippets = new Document("SPDX-2.3", "CC0-1.0", DOC, "d", "https://example.com/spdx/d",
            null, null, List.of(), null, List.of(), null, null,
            Map.of("snippets", snippets("SPDXRef-snippet-d1", "SPDXRef-snippet-d2")));

        Document out = merger().merge(List.of(withSections, inputA, moreSnippets)).document();

        assertThat(out.extensions().get("snippets")).extracting(node -> node.get("SPDXID").asText())
            .containsExactly("SPDXRef-snippet-c", "SPDXRef-snippet-d1", "SPDXRef-snippet-d2");
        assertThat(out.extensions().get("annotations")).hasSize(1);
    }

    @Test
    void merge_copiesUnmodelledPackageProperties() {
        Component withHomepage = new Component("SPDXRef-a1", "a", "1.0", null, null, null, null, null, null,
            null, null, null, null,
            Map.of("homepage", JsonNodeFactory.instance.textNode("https://a.example")));
        Document input = document("a", "3.19", List.of(withHomepage),
            List.of(Relationship.of(DOC, RelationshipType.DESCRIBES, "SPDXRef-a1")));

        Document out = merger().merge(List.of(input)).document();

        Component copy = out.findComponent(A1_ID).orElseThrow();
        assertThat(copy.extensions().get("homepage").asText()).isEqualTo("https://a.example");
        assertThat(input.components().get(0).id()).isEqualTo("SPDXRef-a1");
    }

    private static ArrayNode snippets(String... ids) {
        ArrayNode snippets = JsonNodeFactory.instance.arrayNode();
        for (String id : ids) {
            snippets.addObject().put("SPDXID", id);
        }
        return snippets;
    }

    @Test
    void merge_reportsStatistics() {
        MergeStatistics stats = merger().merge(List.of(inputA, inputB)).statistics();

        assertThat(stats.inputs()).isEqualTo(2);
        assertThat(stats.componentsIn()).isEqualTo(4);
        assertThat(stats.componentsOut()).isEqualTo(5);
        assertThat(stats.describedComponents()).isEqualTo(2);
        assertThat(stats.cloneFailures()).isZero();
        assertThat(stats.relationships()).isEqualTo(6);
        assertThat(stats.files()).isEqualTo(1);
        assertThat(stats.otherLicenses()).isEqualTo(1);
        assertThat(stats.externalDocumentRefs()).isEqualTo(1);
    }

    @Test
    void merge_leavesInputsUnmodified() {
        Document aBefore = inputA;
        List<Relationship> aRelationships = List.copyOf(inputA.relationships());
        List<Component> bComponents = List.copyOf(inputB.components());

        merger().merge(List.of(inputA, inputB));

        assertThat(inputA).isSameAs(aBefore);
        assertThat(inputA.relationships()).isEqualTo(aRelationships);
        assertThat(inputB.components()).isEqualTo(bComponents);
    }

    @Test
    void merge_copyFailure_skipsComponentAndContinues() {
        ComponentCopier failingForA2 = component -> {
            if (component.id().equals("SPDXRef-a2")) {
                throw new ComponentCopyException("boom", new IllegalStateException("boom"));
            }
            return component;
        };

        MergeResult result = merger(failingForA2).merge(List.of(inputA, inputB));

        assertThat(result.document().components()).extracting(Component::id)
            .containsExactly(ROOT_ID, A1_ID, B1_ID, "SPDXRef-b2");
        assertThat(result.statistics().cloneFailures()).isEqualTo(1);
    }

    @Test
    void merge_noInputs_producesRootOnly() {
        MergeResult result = merger().merge(List.of());

        assertThat(result.document().components()).hasSize(1);
        assertThat(result.document().relationships()).containsExactly(
            Relationship.of(DOC, RelationshipType.DESCRIBES, ROOT_ID));
        assertThat(result.document().creationInfo().licenseListVersion()).isEqualTo("3.19");
    }

    @Test
    void merge_unparsableLicenseListVersion_abortsBeforeOutput() {
        Document broken = document("c", "not-a-version", List.of(), List.of());
        HierarchicalMerger merger = merger();

        assertThatThrownBy(() -> merger.merge(List.of(inputA, broken)))
            .isInstanceOf(LicenseListVersionException.class);
        assertThat(merger.stage()).isEqualTo(MergeStage.ABORTED);
    }

    @Test
    void merge_success_endsInFinalizeStage() {
        HierarchicalMerger merger = merger();

        merger.merge(List.of(inputA));

        assertThat(merger.stage()).isEqualTo(MergeStage.FINALIZE);
    }
}
