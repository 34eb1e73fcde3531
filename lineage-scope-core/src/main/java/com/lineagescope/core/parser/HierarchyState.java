package com.lineagescope.core.parser;

/**
 * Running breadcrumb threaded through the ordered blocks of one scan.
 *
 * <p>Immutable: each step returns a new state, so a parser instance holds no scan state.
 *
 * @param path dot-joined path accumulated so far
 * @param previousLabel label appended last, or empty
 */
public record HierarchyState(String path, String previousLabel) {

    public HierarchyState {
        path = path == null ? "" : path;
        previousLabel = previousLabel == null ? "" : previousLabel;
    }

    public static HierarchyState initial() {
        return new HierarchyState("", "");
    }

    /**
     * Folds one parent label into the state.
     *
     * <p>The label is appended when the policy accepts it and it differs from the label
     * appended last; otherwise the state is returned unchanged.
     *
     * @param label label read from a block trailer, may be null
     * @param policy breadcrumb policy
     * @return the next state
     */
    public HierarchyState advance(String label, BreadcrumbPolicy policy) {
        if (!policy.accepts(label)) {
            return this;
        }
        String trimmed = label.trim();
        if (trimmed.equals(previousLabel)) {
            return this;
        }
        String nextPath = path.isEmpty() ? trimmed : path + policy.separator() + trimmed;
        return new HierarchyState(nextPath, trimmed);
    }
}
