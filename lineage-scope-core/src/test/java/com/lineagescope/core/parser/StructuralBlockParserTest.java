package com.lineagescope.core.parser;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link StructuralBlockParser}.
 */
class StructuralBlockParserTest {

    private StructuralBlockParser parser;

    @BeforeEach
    void setUp() {
        parser = new StructuralBlockParser();
    }

    // ==================== scan ====================

    @Test
    void scan_withNestedBlock_returnsOneSpanAndSplitsInternal() {
        // Given
        String text = "{1|G|{2|X|}|end}";

        // When
        BlockScan scan = parser.scan(text);
        StructuralBlock block = parser.split(scan.spans().get(0));

        // Then
        assertThat(scan.spans()).containsExactly("{1|G|{2|X|}|end}");
        assertThat(scan.hasWarnings()).isFalse();
        assertThat(block.header()).isEqualTo("{1|G|");
        assertThat(block.internal()).isEqualTo("{2|X|}");
        assertThat(block.trailer()).isEqualTo("|end}");
        assertThat(block.groupKey()).isEqualTo("1");
    }

    @Test
    void scan_withTextBetweenBlocks_returnsTopLevelSpansInOrder() {
        BlockScan scan = parser.scan("graph {a} noise {b{c}} tail");

        assertThat(scan.spans()).containsExactly("{a}", "{b{c}}");
    }

    @Test
    void scan_withUnclosedBlock_discardsPartialBlockAndWarns() {
        BlockScan scan = parser.scan("{a}{b{c}");

        assertThat(scan.spans()).containsExactly("{a}");
        assertThat(scan.warnings()).singleElement().asString().contains("Unmatched '{'");
    }

    @Test
    void scan_withStrayCloses_skipsThemAndKeepsBlocks() {
        BlockScan scan = parser.scan("}{a}}");

        assertThat(scan.spans()).containsExactly("{a}");
        assertThat(scan.warnings()).singleElement().asString().contains("Skipped 2");
    }

    @Test
    void scan_withNullOrEmptyText_returnsNoSpans() {
        assertThat(parser.scan(null).spans()).isEmpty();
        assertThat(parser.scan("").spans()).isEmpty();
        assertThat(parser.scan("no blocks at all").spans()).isEmpty();
    }

    @Test
    void scan_withCustomDelimiters_usesThem() {
        StructuralBlockParser parens = new StructuralBlockParser('(', ')', false);

        BlockScan scan = parens.scan("(a(b)) {ignored} (c)");

        assertThat(scan.spans()).containsExactly("(a(b))", "(c)");
        assertThat(parens.open()).isEqualTo('(');
        assertThat(parens.close()).isEqualTo(')');
        assertThat(parens.isQuoteAware()).isFalse();
    }

    @Test
    void scan_withQuotedCloseDelimiter_dependsOnQuoteAwareness() {
        String text = "{a|\"}\"|b}";

        BlockScan unaware = parser.scan(text);
        BlockScan aware = new StructuralBlockParser('{', '}', true).scan(text);

        assertThat(unaware.spans()).containsExactly("{a|\"}");
        assertThat(unaware.hasWarnings()).isTrue();
        assertThat(aware.spans()).containsExactly(text);
        assertThat(aware.hasWarnings()).isFalse();
    }

    @Test
    void scan_concatenatedSpans_areSubsequenceOfInput() {
        String text = "x{1|{2}|}y{3}z";

        BlockScan scan = parser.scan(text);

        assertThat(String.join("", scan.spans())).isEqualTo("{1|{2}|}{3}");
    }

    @Test
    void constructor_withEqualDelimiters_throwsException() {
        assertThatThrownBy(() -> new StructuralBlockParser('|', '|', false))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new StructuralBlockParser('|', '}', false))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // ==================== split ====================

    @Test
    void split_withLeafBlock_returnsWholeTextAsHeader() {
        StructuralBlock block = parser.split("{1|X|}");

        assertThat(block.header()).isEqualTo("{1|X|}");
        assertThat(block.hasInternal()).isFalse();
        assertThat(block.trailer()).isEmpty();
    }

    @Test
    void split_withSeveralNestedBlocks_takesFirstAsInternal() {
        StructuralBlock block = parser.split("{0|{a{deep}}|{b}|t}");

        assertThat(block.header()).isEqualTo("{0|");
        assertThat(block.internal()).isEqualTo("{a{deep}}");
        assertThat(block.trailer()).isEqualTo("|{b}|t}");
    }

    @Test
    void internalBlock_withNestedBlock_splitsOneLevelFurther() {
        StructuralBlock outer = parser.split("{0|{1|{2}|inner}|outer}");

        StructuralBlock inner = parser.internalBlock(outer).orElseThrow();

        assertThat(inner.text()).isEqualTo("{1|{2}|inner}");
        assertThat(inner.internal()).isEqualTo("{2}");
        assertThat(parser.internalBlock(parser.split("{leaf}"))).isEmpty();
    }

    // ==================== decompose ====================

    @Test
    void decompose_withBreadcrumbPolicy_foldsLabelsInOrder() {
        // Given
        BreadcrumbPolicy policy = new BreadcrumbPolicy("0", 3, Set.of("@@@1"), ".");
        List<String> spans = List.of(
            "{0|{x}|a|b|Sub1}",
            "{1|Comp|}",
            "{0|{y}|a|b|Sub1}",
            "{0|{z}|a|b|@@@1}",
            "{0|{w}|a|b|Sub2}",
            "{1|Other|}"
        );

        // When
        List<StructuralBlock> blocks = parser.decompose(spans, policy);

        // Then
        assertThat(blocks).extracting(StructuralBlock::hierarchyPath)
            .containsExactly("Sub1", "Sub1", "Sub1", "Sub1", "Sub1.Sub2", "Sub1.Sub2");
    }

    @Test
    void decompose_withDisabledPolicy_leavesPathsEmpty() {
        List<StructuralBlock> blocks = parser.decompose(
            List.of("{0|{x}|a|b|Sub1}", "{1|Comp|}"), BreadcrumbPolicy.disabled());

        assertThat(blocks).extracting(StructuralBlock::hierarchyPath).containsOnly("");
    }

    // ==================== splitFields ====================

    @Test
    void splitFields_withNestedSeparators_keepsNestedValueWhole() {
        List<String> fields = parser.splitFields("{1|{a|b}|c}");

        assertThat(fields).containsExactly("1", "{a|b}", "c");
    }

    @Test
    void splitFields_withEmptyFields_keepsThem() {
        assertThat(parser.splitFields("a||b|")).containsExactly("a", "", "b", "");
    }

    @Test
    void fieldAt_withIndexBeyondFields_returnsNull() {
        assertThat(parser.fieldAt("a|b", 1)).isEqualTo("b");
        assertThat(parser.fieldAt("a|b", 5)).isNull();
    }
}
