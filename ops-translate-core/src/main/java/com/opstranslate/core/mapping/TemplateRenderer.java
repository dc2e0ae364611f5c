package com.opstranslate.core.mapping;

import com.opstranslate.core.model.ParameterValue;
import com.opstranslate.core.model.SourceUnit;
import com.opstranslate.core.rules.TemplateSyntax;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fills rule templates with unit parameters.
 *
 * <p>Substitution forms:
 * <ul>
 *   <li>{@code "{Name}"}: the parameter value; bare numbers and booleans keep their type</li>
 *   <li>{@code "{MemoryGB}Gi"}: the value with the literal suffix kept, always a string</li>
 *   <li>variable references render as target templating, {@code $vmName} becomes
 *       {@code "{{ vmname }}"}</li>
 * </ul>
 * A string, map entry or list element whose parameter is missing is left out of the result.
 * {@code {profile:...}} placeholders are kept for the profile resolver. Stateless.
 */
public final class TemplateRenderer {

    private static final Pattern INTEGER = Pattern.compile("-?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("-?\\d+\\.\\d+");

    /**
     * Renders a template tree.
     *
     * @param template string, map, list or scalar from the rule table
     * @param unit unit supplying parameter values
     * @return rendered value, or empty when a referenced parameter is missing
     */
    public Optional<Object> render(Object template, SourceUnit unit) {
        if (template instanceof String text) {
            return renderString(text, unit);
        }
        if (template instanceof Map<?, ?> map) {
            return Optional.of(renderMap(map, unit));
        }
        if (template instanceof List<?> list) {
            List<Object> rendered = new ArrayList<>();
            for (Object element : list) {
                render(element, unit).ifPresent(rendered::add);
            }
            return Optional.of(rendered);
        }
        return Optional.ofNullable(template);
    }

    /**
     * Renders a parameter map, dropping entries whose key or value references a missing parameter.
     *
     * @param template parameter template
     * @param unit unit supplying parameter values
     * @return rendered parameters in template order
     */
    public Map<String, Object> renderMap(Map<?, ?> template, SourceUnit unit) {
        Map<String, Object> rendered = new LinkedHashMap<>();
        template.forEach((key, value) -> {
            Optional<Object> renderedKey = render(String.valueOf(key), unit);
            Optional<Object> renderedValue = render(value, unit);
            if (renderedKey.isPresent() && renderedValue.isPresent()) {
                rendered.put(String.valueOf(renderedKey.get()), renderedValue.get());
            }
        });
        return rendered;
    }

    /**
     * Renders a label such as a task name; missing parameters show as {@code <Name>}.
     *
     * @param template label template
     * @param unit unit supplying parameter values
     * @return rendered label
     */
    public String renderLabel(String template, SourceUnit unit) {
        Matcher matcher = TemplateSyntax.PLACEHOLDER.matcher(template);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            Placeholder placeholder = Placeholder.parse(matcher.group(1));
            String replacement = placeholder.isProfile()
                ? matcher.group()
                : placeholder.inline(unit).orElse("<" + placeholder.name() + ">");
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Checks whether any unit placeholder in the template resolves to a variable reference.
     *
     * @param template template tree
     * @param unit unit supplying parameter values
     * @return true if a referenced parameter is only known at execution time
     */
    public boolean referencesVariable(Object template, SourceUnit unit) {
        if (template instanceof String text) {
            for (String body : TemplateSyntax.placeholders(text)) {
                Placeholder placeholder = Placeholder.parse(body);
                if (!placeholder.isProfile() && unit.parameter(placeholder.name())
                    .map(ParameterValue::isVariableReference).orElse(false)) {
                    return true;
                }
            }
            return false;
        }
        if (template instanceof Map<?, ?> map) {
            return map.entrySet().stream()
                .anyMatch(entry -> referencesVariable(entry.getKey(), unit) || referencesVariable(entry.getValue(), unit));
        }
        if (template instanceof List<?> list) {
            return list.stream().anyMatch(element -> referencesVariable(element, unit));
        }
        return false;
    }

    // ==================== Strings ====================

    private Optional<Object> renderString(String text, SourceUnit unit) {
        Matcher whole = TemplateSyntax.PLACEHOLDER.matcher(text);
        if (whole.matches()) {
            Placeholder placeholder = Placeholder.parse(whole.group(1));
            if (placeholder.isProfile()) {
                return Optional.of(text);
            }
            return placeholder.typed(unit);
        }

        Matcher matcher = TemplateSyntax.PLACEHOLDER.matcher(text);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            Placeholder placeholder = Placeholder.parse(matcher.group(1));
            if (placeholder.isProfile()) {
                matcher.appendReplacement(result, Matcher.quoteReplacement(matcher.group()));
                continue;
            }
            Optional<String> value = placeholder.inline(unit);
            if (value.isEmpty()) {
                return Optional.empty();
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(value.get()));
        }
        matcher.appendTail(result);
        return Optional.of(result.toString());
    }

    static String targetVariable(String name) {
        return "{{ " + name.toLowerCase(Locale.ROOT) + " }}";
    }

    static Object coerce(String text) {
        if (INTEGER.matcher(text).matches()) {
            long value = Long.parseLong(text);
            return value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE ? (Object) (int) value : (Object) value;
        }
        if (DECIMAL.matcher(text).matches()) {
            return Double.parseDouble(text);
        }
        if (text.equalsIgnoreCase("true") || text.equalsIgnoreCase("false")) {
            return Boolean.parseBoolean(text);
        }
        return text;
    }

    /**
     * One parsed placeholder body: a parameter name and its filters.
     */
    private record Placeholder(String name, List<String> filters, boolean isProfile) {

        static Placeholder parse(String body) {
            if (body.startsWith(TemplateSyntax.PROFILE_PREFIX)) {
                return new Placeholder(body.substring(TemplateSyntax.PROFILE_PREFIX.length()), List.of(), true);
            }
            String[] parts = body.split("\\|");
            List<String> filters = new ArrayList<>();
            for (int i = 1; i < parts.length; i++) {
                filters.add(parts[i]);
            }
            return new Placeholder(parts[0], filters, false);
        }

        Optional<Object> typed(SourceUnit unit) {
            Optional<ParameterValue> value = unit.parameter(name);
            if (value.isEmpty()) {
                return Optional.empty();
            }
            if (!filters.isEmpty() || value.get().isVariableReference()) {
                return inline(unit).map(text -> (Object) text);
            }
            ParameterValue parameter = value.get();
            return Optional.of(parameter.type() == ParameterValue.ValueType.LITERAL
                ? coerce(parameter.text())
                : parameter.text());
        }

        Optional<String> inline(SourceUnit unit) {
            return unit.parameter(name).map(this::applyFilters);
        }

        private String applyFilters(ParameterValue value) {
            if (value.isVariableReference()) {
                return targetVariable(value.text());
            }
            String text = value.text();
            for (String filter : filters) {
                text = switch (filter) {
                    case "lower" -> text.toLowerCase(Locale.ROOT);
                    case "negate" -> ConditionNegator.negate(text);
                    default -> throw new IllegalStateException("unknown template filter: " + filter);
                };
            }
            return text;
        }
    }
}
