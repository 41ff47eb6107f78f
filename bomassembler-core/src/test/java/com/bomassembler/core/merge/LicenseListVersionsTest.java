package com.bomassembler.core.merge;

import com.bomassembler.core.model.Document;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static com.bomassembler.core.TestDocuments.document;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link LicenseListVersions}.
 */
class LicenseListVersionsTest {

    private static List<Document> withVersions(String... versions) {
        return Arrays.stream(versions)
            .map(v -> document("doc-" + v, v, List.of(), List.of()))
            .toList();
    }

    @Test
    void select_noInputs_returnsBaseline() {
        assertThat(LicenseListVersions.select(List.of())).isEqualTo("3.19");
    }

    @Test
    void select_noVersionsDeclared_returnsBaseline() {
        assertThat(LicenseListVersions.select(withVersions(null, ""))).isEqualTo(LicenseListVersions.BASELINE);
    }

    @Test
    void select_singleVersion_returnsItVerbatim() {
        assertThat(LicenseListVersions.select(withVersions("3.21"))).isEqualTo("3.21");
    }

    @Test
    void select_singleUnparsableVersion_isNotParsed() {
        assertThat(LicenseListVersions.select(withVersions("latest", "latest"))).isEqualTo("latest");
    }

    @Test
    void select_severalVersions_returnsOldest() {
        assertThat(LicenseListVersions.select(withVersions("3.20", "3.19"))).isEqualTo("3.19");
        assertThat(LicenseListVersions.select(withVersions("3.21", "3.9", "3.10"))).isEqualTo("3.9");
    }

    @Test
    void select_equalVersionsWrittenDifferently_returnsFirstInput() {
        assertThat(LicenseListVersions.select(withVersions("3.19.0", "3.19", "3.20"))).isEqualTo("3.19.0");
        assertThat(LicenseListVersions.select(withVersions("3.19", "3.19.0", "3.20"))).isEqualTo("3.19");
    }

    @Test
    void select_unparsableAmongSeveral_throws() {
        assertThatThrownBy(() -> LicenseListVersions.select(withVersions("3.19", "not-a-version")))
            .isInstanceOf(LicenseListVersionException.class)
            .hasMessageContaining("not-a-version");
    }
}
