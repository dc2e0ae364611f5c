package com.opstranslate.core.rules;

import com.opstranslate.core.model.SourceUnit;
import com.opstranslate.core.model.UnitShape;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Predicate over a source unit, built from a rule table {@code match} block.
 *
 * <p>All given criteria must hold:
 * <ul>
 *   <li>{@code identifier}: identifier equals the value, ignoring case</li>
 *   <li>{@code pattern}: identifier fully matches the regular expression</li>
 *   <li>{@code shape}: unit has the given shape</li>
 *   <li>{@code hasParameters}: unit carries every listed parameter (names ignore case)</li>
 * </ul>
 * Immutable and thread-safe.
 */
public final class UnitMatcher {

    private final String identifier;
    private final Pattern pattern;
    private final UnitShape shape;
    private final List<String> requiredParameters;

    private UnitMatcher(String identifier, Pattern pattern, UnitShape shape, List<String> requiredParameters) {
        this.identifier = identifier;
        this.pattern = pattern;
        this.shape = shape;
        this.requiredParameters = List.copyOf(requiredParameters);
    }

    /**
     * Creates a matcher from its criteria.
     *
     * @param identifier exact identifier, or null
     * @param pattern regular expression for the identifier, or null
     * @param shape required shape, or null
     * @param requiredParameters parameters that must be present, or null
     * @return matcher
     * @throws IllegalArgumentException if no criterion is given
     * @throws java.util.regex.PatternSyntaxException if the pattern does not compile
     */
    public static UnitMatcher of(String identifier, String pattern, UnitShape shape, List<String> requiredParameters) {
        List<String> parameters = requiredParameters == null ? List.of() : requiredParameters;
        if (identifier == null && pattern == null && shape == null && parameters.isEmpty()) {
            throw new IllegalArgumentException("matcher needs at least one of identifier, pattern, shape, hasParameters");
        }
        return new UnitMatcher(identifier, pattern == null ? null : Pattern.compile(pattern), shape, parameters);
    }

    public static UnitMatcher identifier(String identifier) {
        return of(identifier, null, null, null);
    }

    public static UnitMatcher pattern(String pattern) {
        return of(null, pattern, null, null);
    }

    public static UnitMatcher shape(UnitShape shape) {
        return of(null, null, shape, null);
    }

    /**
     * Tests the unit against every criterion.
     *
     * @param unit unit to test
     * @return true if all criteria hold
     */
    public boolean matches(SourceUnit unit) {
        if (unit.shape().isOpaque()) {
            return false;
        }
        if (shape != null && unit.shape() != shape) {
            return false;
        }
        if (identifier != null && !(unit.hasIdentifier() && unit.identifier().equalsIgnoreCase(identifier))) {
            return false;
        }
        if (pattern != null && !(unit.hasIdentifier() && pattern.matcher(unit.identifier()).matches())) {
            return false;
        }
        for (String parameter : requiredParameters) {
            if (!unit.hasParameter(parameter)) {
                return false;
            }
        }
        return true;
    }

    public Optional<String> identifier() {
        return Optional.ofNullable(identifier);
    }

    public Optional<String> pattern() {
        return Optional.ofNullable(pattern).map(Pattern::pattern);
    }

    public Optional<UnitShape> shape() {
        return Optional.ofNullable(shape);
    }

    public List<String> requiredParameters() {
        return requiredParameters;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof UnitMatcher other)) {
            return false;
        }
        return Objects.equals(identifier, other.identifier)
            && Objects.equals(pattern().orElse(null), other.pattern().orElse(null))
            && shape == other.shape
            && requiredParameters.equals(other.requiredParameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identifier, pattern().orElse(null), shape, requiredParameters);
    }

    @Override
    public String toString() {
        List<String> parts = new ArrayList<>();
        if (identifier != null) {
            parts.add("identifier=" + identifier);
        }
        if (pattern != null) {
            parts.add("pattern=" + pattern.pattern());
        }
        if (shape != null) {
            parts.add("shape=" + shape);
        }
        if (!requiredParameters.isEmpty()) {
            parts.add("hasParameters=" + requiredParameters);
        }
        return "UnitMatcher{" + String.join(", ", parts) + "}";
    }
}
