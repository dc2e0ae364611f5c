package com.opstranslate.core.profile;

import com.opstranslate.core.mapping.PartialTask;
import com.opstranslate.core.model.ResolvedTask;
import com.opstranslate.core.model.TaskStatus;
import com.opstranslate.core.rules.TemplateSyntax;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;

/**
 * Completes partial tasks from the environment profile.
 *
 * <p>A task is {@link TaskStatus#BLOCKED} if and only if at least one of its required
 * profile paths is absent. Blocked tasks keep their action and parameters, placeholders
 * for missing paths stay as text, and the blocked reason is built only from the task,
 * the missing paths and the evidence, so identical inputs give identical text. No
 * default is ever substituted for a missing path.
 */
public final class ProfileResolver {

    private static final Logger log = LoggerFactory.getLogger(ProfileResolver.class);

    private final Profile profile;

    public ProfileResolver(Profile profile) {
        this.profile = Objects.requireNonNull(profile, "profile must not be null");
    }

    /**
     * Resolves a partial task.
     *
     * @param task mapped task
     * @return resolved or blocked task
     */
    public ResolvedTask resolve(PartialTask task) {
        List<String> missing = task.requiredProfilePaths().stream()
            .filter(path -> !profile.contains(path))
            .toList();

        String name = String.valueOf(fill(task.name()));
        @SuppressWarnings("unchecked")
        Map<String, Object> params = (Map<String, Object>) fill(task.params());

        if (missing.isEmpty()) {
            return new ResolvedTask(task.unit(), task.ruleId(), task.category(), name, task.targetAction(),
                params, task.tags(), TaskStatus.RESOLVED, null, List.of());
        }

        log.warn("{}: '{}' blocked, profile {} lacks {}", task.unit().describe(), name, profile.name(), missing);
        return new ResolvedTask(task.unit(), task.ruleId(), task.category(), name, task.targetAction(),
            params, task.tags(), TaskStatus.BLOCKED, blockedReason(name, missing, task), missing);
    }

    // ==================== Placeholder Filling ====================

    private Object fill(Object value) {
        if (value instanceof String text) {
            return fillString(text);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> filled = new LinkedHashMap<>();
            map.forEach((key, element) -> filled.put(String.valueOf(fillString(String.valueOf(key))), fill(element)));
            return filled;
        }
        if (value instanceof List<?> list) {
            List<Object> filled = new ArrayList<>();
            list.forEach(element -> filled.add(fill(element)));
            return filled;
        }
        return value;
    }

    private Object fillString(String text) {
        Matcher whole = TemplateSyntax.PLACEHOLDER.matcher(text);
        if (whole.matches() && whole.group(1).startsWith(TemplateSyntax.PROFILE_PREFIX)) {
            String path = whole.group(1).substring(TemplateSyntax.PROFILE_PREFIX.length());
            return profile.lookup(path).orElse(text);
        }

        Matcher matcher = TemplateSyntax.PLACEHOLDER.matcher(text);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String body = matcher.group(1);
            String replacement = matcher.group();
            if (body.startsWith(TemplateSyntax.PROFILE_PREFIX)) {
                replacement = profile.lookup(body.substring(TemplateSyntax.PROFILE_PREFIX.length()))
                    .map(String::valueOf)
                    .orElse(replacement);
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    // ==================== Blocked Reason ====================

    static String blockedReason(String taskName, List<String> missing, PartialTask task) {
        StringBuilder reason = new StringBuilder();
        reason.append("BLOCKED: ").append(taskName).append(" requires profile configuration that is not set.\n");
        reason.append("Missing: ").append(String.join(", ", missing)).append('\n');
        reason.append("Evidence: ").append(task.unit().describe()).append(": ").append(task.unit().rawText()).append('\n');
        reason.append("TO FIX: Add to profile.yml:\n");
        appendSnippet(reason, snippetTree(missing), 1);
        return reason.toString().stripTrailing();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> snippetTree(List<String> paths) {
        Map<String, Object> tree = new LinkedHashMap<>();
        for (String path : paths) {
            Map<String, Object> node = tree;
            String[] segments = path.split("\\.");
            for (int i = 0; i < segments.length - 1; i++) {
                Object child = node.get(segments[i]);
                if (!(child instanceof Map)) {
                    child = new LinkedHashMap<String, Object>();
                    node.put(segments[i], child);
                }
                node = (Map<String, Object>) child;
            }
            // a deeper path already shows this key
            node.putIfAbsent(segments[segments.length - 1], "<value>");
        }
        return tree;
    }

    @SuppressWarnings("unchecked")
    private static void appendSnippet(StringBuilder out, Map<String, Object> tree, int depth) {
        String indent = "  ".repeat(depth);
        tree.forEach((key, value) -> {
            if (value instanceof Map<?, ?> child) {
                out.append(indent).append(key).append(":\n");
                appendSnippet(out, (Map<String, Object>) child, depth + 1);
            } else {
                out.append(indent).append(key).append(": ").append(value).append('\n');
            }
        });
    }
}
