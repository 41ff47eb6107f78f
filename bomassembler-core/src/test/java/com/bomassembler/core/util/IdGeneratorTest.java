package com.bomassembler.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link IdGenerator}.
 */
class IdGeneratorTest {

    private static final UUID FIXED = UUID.fromString("1b4e28ba-2fa1-11d2-883f-0016d3cca427");

    @Test
    void elementId_usesKindAndUuid() {
        IdGenerator ids = new IdGenerator(() -> FIXED);

        assertThat(ids.elementId("RootPackage"))
            .isEqualTo("SPDXRef-RootPackage-1b4e28ba-2fa1-11d2-883f-0016d3cca427");
    }

    @Test
    void random_generatesDistinctIds() {
        IdGenerator ids = IdGenerator.random();

        String first = ids.elementId("Package");
        String second = ids.elementId("Package");

        assertThat(first).isNotEqualTo(second);
        assertThat(first).matches("SPDXRef-Package-[0-9a-f]{8}-[0-9a-f]{4}-4[0-9a-f]{3}-[0-9a-f]{4}-[0-9a-f]{12}");
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {" ", "\t"})
    void elementId_withInvalidKind_throwsException(String kind) {
        assertThatThrownBy(() -> IdGenerator.random().elementId(kind))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Kind must not be null or blank");
    }

    @Test
    void uuid_returnsUuidString() {
        assertThat(new IdGenerator(() -> FIXED).uuid()).isEqualTo(FIXED.toString());
    }
}
