package com.lineagescope.core.builder;

import com.lineagescope.core.model.ComponentRole;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps adapter role hints onto the closed {@link ComponentRole} set.
 *
 * <p>A hint resolves, in order, as a role name ({@code "source"}, {@code "JOIN"}), as a
 * built-in alias, or as an adapter-supplied alias. Hints that do not resolve become
 * {@link ComponentRole#UNKNOWN}. Alias keys are matched case-insensitively with runs of
 * non-alphanumeric characters treated as {@code _}.
 */
public final class RoleResolver {

    private static final Map<String, ComponentRole> DEFAULT_ALIASES = Map.ofEntries(
        Map.entry("input_file", ComponentRole.SOURCE),
        Map.entry("input_table", ComponentRole.SOURCE),
        Map.entry("read", ComponentRole.SOURCE),
        Map.entry("extract", ComponentRole.SOURCE),
        Map.entry("output_file", ComponentRole.SINK),
        Map.entry("output_table", ComponentRole.SINK),
        Map.entry("write", ComponentRole.SINK),
        Map.entry("load", ComponentRole.SINK),
        Map.entry("lookup_file", ComponentRole.LOOKUP),
        Map.entry("lookup_table", ComponentRole.LOOKUP),
        Map.entry("reformat", ComponentRole.TRANSFORM),
        Map.entry("filter", ComponentRole.TRANSFORM),
        Map.entry("filter_by_expression", ComponentRole.TRANSFORM),
        Map.entry("sort", ComponentRole.TRANSFORM),
        Map.entry("rollup", ComponentRole.TRANSFORM),
        Map.entry("aggregate", ComponentRole.TRANSFORM),
        Map.entry("normalize", ComponentRole.TRANSFORM),
        Map.entry("denormalize", ComponentRole.TRANSFORM),
        Map.entry("dedup_sorted", ComponentRole.TRANSFORM),
        Map.entry("merge", ComponentRole.JOIN)
    );

    private final Map<String, ComponentRole> aliases;

    private RoleResolver(Map<String, ComponentRole> aliases) {
        this.aliases = aliases;
    }

    /**
     * Resolver with the built-in aliases only.
     *
     * @return default resolver
     */
    public static RoleResolver defaults() {
        return new RoleResolver(DEFAULT_ALIASES);
    }

    /**
     * Resolver with the built-in aliases extended by adapter aliases.
     *
     * <p>Adapter aliases override built-in ones with the same key.
     *
     * @param extraAliases adapter vocabulary, may be null
     * @return resolver
     */
    public static RoleResolver withAliases(Map<String, ComponentRole> extraAliases) {
        if (extraAliases == null || extraAliases.isEmpty()) {
            return defaults();
        }
        Map<String, ComponentRole> merged = new HashMap<>(DEFAULT_ALIASES);
        extraAliases.forEach((hint, role) -> merged.put(normalize(hint), role));
        return new RoleResolver(Map.copyOf(merged));
    }

    /**
     * Resolves a role hint.
     *
     * @param roleHint hint from a normalized unit, may be null
     * @return resolved role, {@link ComponentRole#UNKNOWN} if unrecognized
     */
    public ComponentRole resolve(String roleHint) {
        if (roleHint == null || roleHint.isBlank()) {
            return ComponentRole.UNKNOWN;
        }
        Optional<ComponentRole> byName = ComponentRole.fromName(roleHint);
        if (byName.isPresent()) {
            return byName.get();
        }
        return aliases.getOrDefault(normalize(roleHint), ComponentRole.UNKNOWN);
    }

    static String normalize(String hint) {
        return hint.trim()
            .toLowerCase(Locale.ROOT)
            .replaceAll("[^a-z0-9]+", "_")
            .replaceAll("^_+|_+$", "");
    }
}
