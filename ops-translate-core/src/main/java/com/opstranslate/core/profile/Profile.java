package com.opstranslate.core.profile;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Environment profile: a nested key-value structure queried by dotted path.
 *
 * <p>Immutable; nested maps and lists are copied on construction so a profile can be
 * shared by every worker of a run.
 */
public final class Profile {

    private final String name;
    private final Map<String, Object> values;

    public Profile(String name, Map<String, Object> values) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.values = values == null ? Map.of() : deepCopy(values);
    }

    /**
     * Creates an empty profile; every required path is missing.
     *
     * @param name profile name
     * @return empty profile
     */
    public static Profile empty(String name) {
        return new Profile(name, Map.of());
    }

    public String name() {
        return name;
    }

    public Map<String, Object> values() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * Looks up a dotted path such as {@code network_security.model}.
     *
     * @param path dotted path
     * @return value, or empty if any segment is missing or the value is null
     */
    public Optional<Object> lookup(String path) {
        Object current = values;
        for (String segment : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> map) || !map.containsKey(segment)) {
                return Optional.empty();
            }
            current = map.get(segment);
        }
        return Optional.ofNullable(current);
    }

    public boolean contains(String path) {
        return lookup(path).isPresent();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> deepCopy(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(String.valueOf(key), copyValue(value)));
        return Collections.unmodifiableMap(copy);
    }

    @SuppressWarnings("unchecked")
    private static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return deepCopy((Map<String, Object>) map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>();
            list.forEach(element -> copy.add(copyValue(element)));
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Profile other)) {
            return false;
        }
        return name.equals(other.name) && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, values);
    }

    @Override
    public String toString() {
        return "Profile{" + name + ", keys=" + values.keySet() + "}";
    }
}
