package com.lineagescope.core.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Recovers balanced, delimiter-nested blocks from flat text without a grammar.
 *
 * <p>The parser works on any open/close delimiter pair (braces by default) and offers
 * four operations:
 * <ol>
 *   <li>{@link #scan(String)} finds the maximal top-level balanced spans with a single
 *       left-to-right depth count</li>
 *   <li>{@link #split(String)} breaks one span into header, internal and trailer</li>
 *   <li>{@link #decompose(List, BreadcrumbPolicy)} splits a whole span sequence while
 *       folding a hierarchy breadcrumb over it</li>
 *   <li>{@link #splitFields(String)} splits a segment into pipe-delimited fields at
 *       nesting depth zero</li>
 * </ol>
 *
 * <p>By default delimiters inside quoted literals are counted like any other, which
 * matches how existing extracts were produced. With {@code quoteAware} set, delimiters
 * between double quotes (backslash escapes honoured) are ignored inside blocks.
 *
 * <p>Instances are immutable and may be shared between threads.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * StructuralBlockParser parser = new StructuralBlockParser();
 * BlockScan scan = parser.scan(content);
 * List<StructuralBlock> blocks = parser.decompose(scan.spans(), policy);
 * }</pre>
 */
public final class StructuralBlockParser {

    private static final Logger log = LoggerFactory.getLogger(StructuralBlockParser.class);

    /** Default open delimiter. */
    public static final char DEFAULT_OPEN = '{';

    /** Default close delimiter. */
    public static final char DEFAULT_CLOSE = '}';

    /** Separator between the fields of a block. */
    public static final char FIELD_SEPARATOR = '|';

    private static final char QUOTE = '"';
    private static final char ESCAPE = '\\';

    private final char open;
    private final char close;
    private final boolean quoteAware;

    /**
     * Creates a quote-unaware parser for brace-delimited text.
     */
    public StructuralBlockParser() {
        this(DEFAULT_OPEN, DEFAULT_CLOSE, false);
    }

    /**
     * Creates a parser for the given delimiter pair.
     *
     * @param open open delimiter
     * @param close close delimiter
     * @param quoteAware whether delimiters inside double-quoted literals are ignored
     * @throws IllegalArgumentException if the delimiters are equal or collide with the field separator
     */
    public StructuralBlockParser(char open, char close, boolean quoteAware) {
        if (open == close) {
            throw new IllegalArgumentException("Open and close delimiters must differ: " + open);
        }
        if (open == FIELD_SEPARATOR || close == FIELD_SEPARATOR) {
            throw new IllegalArgumentException("Delimiters must not be the field separator");
        }
        this.open = open;
        this.close = close;
        this.quoteAware = quoteAware;
    }

    public char open() {
        return open;
    }

    public char close() {
        return close;
    }

    public boolean isQuoteAware() {
        return quoteAware;
    }

    // ==================== Span Scanning ====================

    /**
     * Returns the ordered maximal top-level balanced spans of the text.
     *
     * <p>A span starts where depth goes from 0 to 1 and ends where it returns to 0.
     * A span still open at end of input is discarded and reported as a warning; close
     * delimiters at depth 0 are skipped and reported. This method never throws.
     *
     * @param text text to scan, may be null
     * @return spans and structural warnings
     */
    public BlockScan scan(String text) {
        if (text == null || text.isEmpty()) {
            return new BlockScan(List.of(), List.of());
        }

        List<String> spans = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        int depth = 0;
        int start = -1;
        int strayCloses = 0;
        boolean inQuote = false;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);

            if (inQuote) {
                if (c == ESCAPE) {
                    i++;
                } else if (c == QUOTE) {
                    inQuote = false;
                }
                continue;
            }
            if (quoteAware && depth > 0 && c == QUOTE) {
                inQuote = true;
                continue;
            }

            if (c == open) {
                if (depth == 0) {
                    start = i;
                }
                depth++;
            } else if (c == close) {
                if (depth == 0) {
                    strayCloses++;
                    continue;
                }
                depth--;
                if (depth == 0) {
                    spans.add(text.substring(start, i + 1));
                }
            }
        }

        if (depth > 0) {
            String warning = String.format(
                "Unmatched '%c' at offset %d: %d delimiter(s) left open, partial block discarded",
                open, start, depth);
            log.warn(warning);
            warnings.add(warning);
        }
        if (strayCloses > 0) {
            String warning = String.format("Skipped %d unmatched '%c' outside any block", strayCloses, close);
            log.debug(warning);
            warnings.add(warning);
        }

        return new BlockScan(spans, warnings);
    }

    /**
     * Finds the first open delimiter at or after {@code from}.
     *
     * @param text text to search
     * @param from start index (inclusive)
     * @return index of the delimiter, or -1 if there is none
     */
    public int findOpen(String text, int from) {
        return findOpen(text, from, text.length());
    }

    /**
     * Finds the end of the balanced block starting at {@code openIndex}.
     *
     * @param text text containing the block
     * @param openIndex index of the block's open delimiter
     * @return index just past the matching close delimiter, or -1 if the block never closes
     * @throws IllegalArgumentException if {@code openIndex} does not point at an open delimiter
     */
    public int findBlockEnd(String text, int openIndex) {
        if (openIndex < 0 || openIndex >= text.length() || text.charAt(openIndex) != open) {
            throw new IllegalArgumentException("No open delimiter at index " + openIndex);
        }
        int depth = 0;
        boolean inQuote = false;
        for (int i = openIndex; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inQuote) {
                if (c == ESCAPE) {
                    i++;
                } else if (c == QUOTE) {
                    inQuote = false;
                }
                continue;
            }
            if (quoteAware && depth > 0 && c == QUOTE) {
                inQuote = true;
            } else if (c == open) {
                depth++;
            } else if (c == close) {
                depth--;
                if (depth == 0) {
                    return i + 1;
                }
            }
        }
        return -1;
    }

    // ==================== Header / Internal / Trailer ====================

    /**
     * Splits one balanced span into header, internal and trailer.
     *
     * <p>The internal segment is the first balanced sub-span strictly inside the outer
     * delimiters, with all of its own nesting. Everything before it is the header and
     * everything after it the trailer. A span without nested blocks is returned whole as
     * the header.
     *
     * @param span balanced span as returned by {@link #scan(String)}
     * @return decomposed block with an empty hierarchy path
     */
    public StructuralBlock split(String span) {
        String text = span == null ? "" : span.strip();
        if (text.length() < 2) {
            return new StructuralBlock(text, text, "", "", groupKeyOf(text), "");
        }

        int innerOpen = findOpen(text, 1, text.length() - 1);
        if (innerOpen < 0) {
            return new StructuralBlock(text, text, "", "", groupKeyOf(text), "");
        }

        int innerEnd = findBlockEnd(text, innerOpen);
        if (innerEnd < 0) {
            log.debug("Nested block at offset {} never closes, treating block as leaf", innerOpen);
            return new StructuralBlock(text, text, "", "", groupKeyOf(text), "");
        }

        String header = text.substring(0, innerOpen).strip();
        String internal = text.substring(innerOpen, innerEnd).strip();
        String trailer = text.substring(innerEnd).strip();
        return new StructuralBlock(text, header, internal, trailer, groupKeyOf(header), "");
    }

    /**
     * Splits the internal segment of a block one level further.
     *
     * @param block decomposed block
     * @return the internal segment as a block, or empty for leaf blocks
     */
    public Optional<StructuralBlock> internalBlock(StructuralBlock block) {
        if (!block.hasInternal()) {
            return Optional.empty();
        }
        return Optional.of(split(block.internal()).withHierarchyPath(block.hierarchyPath()));
    }

    /**
     * Splits every span and attaches the breadcrumb path in effect at that span.
     *
     * <p>The breadcrumb is an explicit fold over the span sequence: only spans whose
     * group key is tracked by the policy can extend the path, and every span emitted
     * after an extension carries the extended path. Spans must be passed in their
     * original order.
     *
     * @param spans spans in text order
     * @param policy breadcrumb policy
     * @return decomposed blocks in the same order
     */
    public List<StructuralBlock> decompose(List<String> spans, BreadcrumbPolicy policy) {
        List<StructuralBlock> blocks = new ArrayList<>(spans.size());
        HierarchyState state = HierarchyState.initial();

        for (String span : spans) {
            StructuralBlock block = split(span);
            if (policy.tracks(block.groupKey()) && !block.trailer().isEmpty()) {
                state = state.advance(fieldAt(block.trailer(), policy.fieldIndex()), policy);
            }
            blocks.add(block.withHierarchyPath(state.path()));
        }

        return blocks;
    }

    // ==================== Field Splitting ====================

    /**
     * Splits a segment into pipe-delimited fields.
     *
     * <p>A leading open delimiter and an unmatched trailing close delimiter are removed
     * first. Separators inside nested blocks do not split, so nested values stay whole.
     * Empty fields, including a trailing one, are kept.
     *
     * @param segment header, trailer or whole block text
     * @return raw fields, not trimmed
     */
    public List<String> splitFields(String segment) {
        if (segment == null) {
            return List.of();
        }
        String text = segment.strip();
        if (!text.isEmpty() && text.charAt(0) == open) {
            text = text.substring(1);
        }
        if (!text.isEmpty() && text.charAt(text.length() - 1) == close && netDepth(text) < 0) {
            text = text.substring(0, text.length() - 1);
        }

        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;
        boolean inQuote = false;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inQuote) {
                current.append(c);
                if (c == ESCAPE && i + 1 < text.length()) {
                    current.append(text.charAt(++i));
                } else if (c == QUOTE) {
                    inQuote = false;
                }
                continue;
            }
            if (quoteAware && c == QUOTE) {
                inQuote = true;
            } else if (c == open) {
                depth++;
            } else if (c == close) {
                depth = Math.max(0, depth - 1);
            } else if (c == FIELD_SEPARATOR && depth == 0) {
                fields.add(current.toString());
                current.setLength(0);
                continue;
            }
            current.append(c);
        }
        fields.add(current.toString());

        return fields;
    }

    /**
     * Returns the trimmed field at the given index, or null if the segment is shorter.
     *
     * @param segment segment to split
     * @param index zero-based field index
     * @return trimmed field or null
     */
    public String fieldAt(String segment, int index) {
        List<String> fields = splitFields(segment);
        return index < fields.size() ? fields.get(index).trim() : null;
    }

    private String groupKeyOf(String header) {
        List<String> fields = splitFields(header);
        return fields.isEmpty() ? "" : fields.get(0).trim();
    }

    private int findOpen(String text, int from, int to) {
        boolean inQuote = false;
        for (int i = Math.max(0, from); i < to; i++) {
            char c = text.charAt(i);
            if (inQuote) {
                if (c == ESCAPE) {
                    i++;
                } else if (c == QUOTE) {
                    inQuote = false;
                }
                continue;
            }
            if (quoteAware && c == QUOTE) {
                inQuote = true;
            } else if (c == open) {
                return i;
            }
        }
        return -1;
    }

    private int netDepth(String text) {
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == open) {
                depth++;
            } else if (c == close) {
                depth--;
            }
        }
        return depth;
    }
}
