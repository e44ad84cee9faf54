package com.libragraph.unpack.extract.config;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Ordered directory prefixes whose members are never extracted.
 *
 * <p>Prefixes are stored with forward slashes and a trailing {@code /}. A member
 * matches when its normalized name starts with a prefix or contains it directly
 * after a {@code /}, so {@code node_modules/} also excludes
 * {@code vendor/node_modules/pkg.js} but not {@code my_node_modules/x.js}.
 *
 * <p>A prefix written with a leading {@code /} is anchored to the archive root:
 * {@code /build/} excludes {@code build/libs/app.jar} but keeps
 * {@code src/main/java/com/acme/build/Plan.java}. The build output defaults are
 * anchored because those directory names are common inside source trees.
 */
public record SkipRuleset(List<String> prefixes) {

    /** Version control, dependency caches and build output. */
    public static final List<String> DEFAULT_PREFIXES = List.of(
            ".git/", ".svn/", ".hg/", "__MACOSX/",
            "node_modules/", "bower_components/", "vendor/",
            "__pycache__/", ".venv/", "venv/", ".tox/",
            ".gradle/", ".mvn/", "/target/", "/build/", "/dist/", "/out/"
    );

    public SkipRuleset {
        List<String> normalized = new ArrayList<>(prefixes.size());
        for (String prefix : prefixes) {
            String p = normalizePrefix(prefix);
            if (!p.isEmpty() && !normalized.contains(p)) {
                normalized.add(p);
            }
        }
        prefixes = List.copyOf(normalized);
    }

    public static SkipRuleset defaults() {
        return new SkipRuleset(DEFAULT_PREFIXES);
    }

    public static SkipRuleset none() {
        return new SkipRuleset(List.of());
    }

    public static SkipRuleset of(String... prefixes) {
        return new SkipRuleset(List.of(prefixes));
    }

    public static SkipRuleset of(Collection<String> prefixes) {
        return new SkipRuleset(List.copyOf(prefixes));
    }

    /**
     * @param memberName member name already normalized to forward slashes
     */
    public boolean matches(String memberName) {
        for (String prefix : prefixes) {
            if (prefix.startsWith("/")) {
                if (memberName.startsWith(prefix.substring(1))) {
                    return true;
                }
            } else if (memberName.startsWith(prefix) || memberName.contains("/" + prefix)) {
                return true;
            }
        }
        return false;
    }

    private static String normalizePrefix(String prefix) {
        String p = prefix.trim().replace('\\', '/');
        boolean anchored = p.startsWith("/");
        while (p.startsWith("/")) {
            p = p.substring(1);
        }
        if (p.isEmpty()) {
            return p;
        }
        p = p.endsWith("/") ? p : p + "/";
        return anchored ? "/" + p : p;
    }
}
