package com.opstranslate.core.rules;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Placeholder syntax shared by rule templates.
 *
 * <ul>
 *   <li>{@code {MemoryGB}}: unit parameter</li>
 *   <li>{@code {Name|lower}}, {@code {condition|negate}}: unit parameter with filters</li>
 *   <li>{@code {profile:network_security.model}}: profile value, filled by the profile resolver</li>
 * </ul>
 * Target templating such as {@code "{{ vm_name }}"} passes through untouched as long as
 * a space follows the braces.
 */
public final class TemplateSyntax {

    /** Prefix of profile placeholders. */
    public static final String PROFILE_PREFIX = "profile:";

    /** Filters a unit placeholder may apply, in any order. */
    public static final Set<String> FILTERS = Set.of("lower", "negate");

    /** Matches one placeholder; group 1 is its body. */
    public static final Pattern PLACEHOLDER = Pattern.compile(
        "\\{(profile:[A-Za-z0-9_.\\-]+|[A-Za-z_][A-Za-z0-9_]*(?:\\|[a-z]+)*)}");

    private TemplateSyntax() {
    }

    /**
     * Collects profile paths referenced anywhere in a template tree, in encounter order.
     *
     * @param template string, map, list or scalar
     * @return referenced dotted paths
     */
    public static Set<String> profileReferences(Object template) {
        Set<String> paths = new LinkedHashSet<>();
        collect(template, paths);
        return paths;
    }

    /**
     * Lists the placeholder bodies of a string, in order.
     *
     * @param text template text
     * @return placeholder bodies
     */
    public static List<String> placeholders(String text) {
        List<String> bodies = new ArrayList<>();
        Matcher matcher = PLACEHOLDER.matcher(text);
        while (matcher.find()) {
            bodies.add(matcher.group(1));
        }
        return bodies;
    }

    /**
     * Lists filters used in a template tree that are not in {@link #FILTERS}.
     *
     * @param template string, map, list or scalar
     * @return unknown filter names, in encounter order
     */
    public static Set<String> unknownFilters(Object template) {
        Set<String> unknown = new LinkedHashSet<>();
        visitStrings(template, text -> {
            for (String body : placeholders(text)) {
                String[] parts = body.split("\\|");
                for (int i = 1; i < parts.length; i++) {
                    if (!FILTERS.contains(parts[i])) {
                        unknown.add(parts[i]);
                    }
                }
            }
        });
        return unknown;
    }

    private static void visitStrings(Object template, Consumer<String> visitor) {
        if (template instanceof String text) {
            visitor.accept(text);
        } else if (template instanceof Map<?, ?> map) {
            map.forEach((key, value) -> {
                visitStrings(key, visitor);
                visitStrings(value, visitor);
            });
        } else if (template instanceof List<?> list) {
            list.forEach(element -> visitStrings(element, visitor));
        }
    }

    private static void collect(Object template, Set<String> paths) {
        visitStrings(template, text -> {
            for (String body : placeholders(text)) {
                if (body.startsWith(PROFILE_PREFIX)) {
                    paths.add(body.substring(PROFILE_PREFIX.length()));
                }
            }
        });
    }
}
