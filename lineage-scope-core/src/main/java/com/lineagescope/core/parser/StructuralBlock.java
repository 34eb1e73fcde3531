package com.lineagescope.core.parser;

import java.util.Objects;

/**
 * A balanced block split into header, internal and trailer segments.
 *
 * <p>For the block <code>{1|G|{2|X|}|end}</code> the header is <code>{1|G|</code>,
 * the internal segment <code>{2|X|}</code> and the trailer <code>|end}</code>. Leaf
 * blocks carry the whole text as header and empty internal and trailer segments.
 *
 * @param text complete block text
 * @param header text before the first nested block
 * @param internal first nested block including its own nesting, or empty
 * @param trailer text after the first nested block, or empty
 * @param groupKey first field of the header
 * @param hierarchyPath breadcrumb path in effect when this block was emitted
 */
public record StructuralBlock(
    String text,
    String header,
    String internal,
    String trailer,
    String groupKey,
    String hierarchyPath
) {
    public StructuralBlock {
        Objects.requireNonNull(text, "text must not be null");
        header = header == null ? "" : header;
        internal = internal == null ? "" : internal;
        trailer = trailer == null ? "" : trailer;
        groupKey = groupKey == null ? "" : groupKey;
        hierarchyPath = hierarchyPath == null ? "" : hierarchyPath;
    }

    public boolean hasInternal() {
        return !internal.isEmpty();
    }

    StructuralBlock withHierarchyPath(String path) {
        return new StructuralBlock(text, header, internal, trailer, groupKey, path);
    }
}
