package com.lineagescope.core.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link IdGenerator}.
 */
class IdGeneratorTest {

    @Test
    void generate_withSameComponents_returnsSameId() {
        String id1 = IdGenerator.generate("abinitio:graphs/load.mp", "Load_Orders");
        String id2 = IdGenerator.generate("abinitio:graphs/load.mp", "Load_Orders");

        assertThat(id1).isEqualTo(id2).hasSize(16).matches("[0-9a-f]{16}");
    }

    @Test
    void generate_withDifferentComponents_returnsDifferentIds() {
        assertThat(IdGenerator.generate("p1", "Reformat"))
            .isNotEqualTo(IdGenerator.generate("p2", "Reformat"));
    }

    @Test
    void generate_withSingleComponent_hashesLengthPrefixedText() {
        // SHA-256("3:abc")
        assertThat(IdGenerator.generate("abc")).isEqualTo("aab5f9ae99b2e38f");
    }

    @Test
    void generate_withSeparatorInsideComponents_keepsPairsDistinct() {
        assertThat(IdGenerator.generate("a", "bc")).isNotEqualTo(IdGenerator.generate("ab", "c"));
        assertThat(IdGenerator.generate("hadoop:wf", "load"))
            .isNotEqualTo(IdGenerator.generate("hadoop", "wf:load"));
        assertThat(IdGenerator.generate("abc", ""))
            .isEqualTo("bdf1004d3099a7a3")
            .isNotEqualTo(IdGenerator.generate("abc"));
    }

    @Test
    void generate_withNullComponent_treatsItAsEmpty() {
        assertThat(IdGenerator.generate("p", null)).isEqualTo(IdGenerator.generate("p", ""));
    }

    @Test
    void generate_withNoComponents_throwsException() {
        assertThatThrownBy(IdGenerator::generate)
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("At least one component");
    }
}
