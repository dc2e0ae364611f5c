package com.opstranslate.core.merge;

import com.opstranslate.core.model.ConflictRecord;
import com.opstranslate.core.model.ConflictType;
import com.opstranslate.core.model.Gap;
import com.opstranslate.core.model.InputDefinition;
import com.opstranslate.core.model.IntentField;
import com.opstranslate.core.model.MergedIntent;
import com.opstranslate.core.model.Requirement;
import com.opstranslate.core.model.ResolvedTask;
import com.opstranslate.core.model.SourceIntent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Combines the source intents of a run into one {@link MergedIntent}.
 *
 * <p>Each requirement field has a fixed strategy ({@link IntentField#strategy()}):
 * <ul>
 *   <li>maximum: numeric maximum across sources</li>
 *   <li>minimum: numeric minimum, for quotas</li>
 *   <li>most-restrictive: logical OR of boolean flags</li>
 *   <li>union: sorted set union of list values</li>
 *   <li>explicit conflict: equal values merge, differing values leave the field unset
 *       and produce a {@link ConflictRecord}</li>
 *   <li>mixed: equal values merge, differing values become {@code "mixed"}</li>
 * </ul>
 * Inputs merge as a set keyed by name; same name with a different definition records a
 * conflict and keeps the first-seen definition per {@link FirstSeenPolicy}. An input whose
 * name is a field ({@code CpuCount} for {@code cpu_count}) contributes its default to that
 * field instead: only type and required flag must agree, and the kept definition carries
 * the merged value as its default. With the default
 * policy every strategy is commutative and associative, so any permutation of the sources
 * yields an equal result. The merger performs no I/O and holds no state between calls.
 */
public final class IntentMerger {

    private static final Logger log = LoggerFactory.getLogger(IntentMerger.class);

    static final String MIXED_VALUE = "mixed";

    private final FirstSeenPolicy firstSeenPolicy;

    public IntentMerger() {
        this(FirstSeenPolicy.SOURCE_NAME);
    }

    public IntentMerger(FirstSeenPolicy firstSeenPolicy) {
        this.firstSeenPolicy = Objects.requireNonNull(firstSeenPolicy, "firstSeenPolicy must not be null");
    }

    /**
     * Merges the given source intents.
     *
     * @param intents completed source intents
     * @return merged intent, possibly carrying conflicts
     * @throws IllegalArgumentException if two intents share a source name
     */
    public MergedIntent merge(List<SourceIntent> intents) {
        Objects.requireNonNull(intents, "intents must not be null");
        Set<String> names = new HashSet<>();
        for (SourceIntent intent : intents) {
            if (!names.add(intent.sourceName())) {
                throw new IllegalArgumentException("duplicate source name: " + intent.sourceName());
            }
        }

        List<SourceIntent> visitOrder = new ArrayList<>(intents);
        if (firstSeenPolicy == FirstSeenPolicy.SOURCE_NAME) {
            visitOrder.sort(Comparator.comparing(SourceIntent::sourceName));
        }

        List<ConflictRecord> conflicts = new ArrayList<>();
        Map<IntentField, Object> fields = mergeFields(visitOrder, conflicts);
        Map<String, InputDefinition> inputs = mergeInputs(visitOrder, fields, conflicts);
        conflicts.sort(Comparator.comparing(ConflictRecord::subject).thenComparing(ConflictRecord::type));

        List<String> sources = intents.stream().map(SourceIntent::sourceName).sorted().toList();
        Map<String, List<ResolvedTask>> tasksBySource = new TreeMap<>();
        Map<String, List<Gap>> gapsBySource = new TreeMap<>();
        for (SourceIntent intent : intents) {
            tasksBySource.put(intent.sourceName(), intent.tasks());
            gapsBySource.put(intent.sourceName(), intent.gaps());
        }
        List<Gap> gaps = gapsBySource.values().stream().flatMap(List::stream).toList();

        if (!conflicts.isEmpty()) {
            log.warn("Merged {} sources with {} conflicts: {}", sources.size(), conflicts.size(),
                conflicts.stream().map(ConflictRecord::subject).toList());
        } else {
            log.info("Merged {} sources without conflicts", sources.size());
        }
        return new MergedIntent(sources, inputs, fields, conflicts, tasksBySource, gaps);
    }

    // ==================== Inputs ====================

    private Map<String, InputDefinition> mergeInputs(List<SourceIntent> visitOrder, Map<IntentField, Object> fields,
                                                     List<ConflictRecord> conflicts) {
        Map<String, InputDefinition> retained = new TreeMap<>();
        Map<String, Map<String, List<String>>> variants = new TreeMap<>();
        Set<String> conflicted = new TreeSet<>();

        for (SourceIntent intent : visitOrder) {
            for (InputDefinition input : intent.inputs()) {
                variants.computeIfAbsent(input.name(), key -> new TreeMap<>())
                    .computeIfAbsent(input.summary(), key -> new ArrayList<>())
                    .add(intent.sourceName());
                InputDefinition existing = retained.putIfAbsent(input.name(), input);
                if (existing == null) {
                    continue;
                }
                boolean fieldBacked = IntentField.fromInputName(input.name()).isPresent();
                if (fieldBacked ? !existing.sameSignatureAs(input) : !existing.sameDefinitionAs(input)) {
                    conflicted.add(input.name());
                }
            }
        }

        for (Map.Entry<String, InputDefinition> entry : retained.entrySet()) {
            Optional<IntentField> field = IntentField.fromInputName(entry.getKey());
            if (field.isPresent() && declaresDefault(visitOrder, entry.getKey())) {
                Object value = fields.get(field.get());
                entry.setValue(entry.getValue().withDefaultValue(value == null ? null : display(value)));
            }
        }

        for (String name : conflicted) {
            InputDefinition kept = retained.get(name);
            conflicts.add(new ConflictRecord(
                "inputs." + name,
                ConflictType.INPUT_DEFINITION,
                variants.get(name),
                kept.summary(),
                "Input '" + name + "' is declared differently across sources; the definition ["
                    + kept.summary() + "] was kept. Align the declarations or rename one input."));
        }
        return retained;
    }

    // ==================== Requirement Fields ====================

    private Map<IntentField, Object> mergeFields(List<SourceIntent> visitOrder, List<ConflictRecord> conflicts) {
        Map<IntentField, Map<String, List<String>>> declared = new EnumMap<>(IntentField.class);
        Map<IntentField, List<Object>> values = new EnumMap<>(IntentField.class);
        for (SourceIntent intent : visitOrder) {
            List<Requirement> requirements = new ArrayList<>(intent.requirements());
            for (InputDefinition input : intent.inputs()) {
                Optional<IntentField> field = IntentField.fromInputName(input.name());
                if (field.isPresent() && input.defaultValue() != null) {
                    requirements.add(new Requirement(field.get(), input.defaultValue(),
                        intent.sourceName() + ":input " + input.name()));
                }
            }
            for (Requirement requirement : requirements) {
                Map<String, List<String>> bySource = declared.computeIfAbsent(requirement.field(), key -> new TreeMap<>());
                List<String> sources = bySource.computeIfAbsent(display(requirement.value()), key -> new ArrayList<>());
                if (!sources.contains(intent.sourceName())) {
                    sources.add(intent.sourceName());
                }
                values.computeIfAbsent(requirement.field(), key -> new ArrayList<>()).add(requirement.value());
            }
        }

        Map<IntentField, Object> merged = new EnumMap<>(IntentField.class);
        for (Map.Entry<IntentField, List<Object>> entry : values.entrySet()) {
            IntentField field = entry.getKey();
            Map<String, List<String>> bySource = declared.get(field);
            switch (field.strategy()) {
                case MAXIMUM -> extreme(entry.getValue(), 1).ifPresentOrElse(
                    value -> merged.put(field, value),
                    () -> conflicts.add(invalid(field, bySource, "numeric values")));
                case MINIMUM -> extreme(entry.getValue(), -1).ifPresentOrElse(
                    value -> merged.put(field, value),
                    () -> conflicts.add(invalid(field, bySource, "numeric values")));
                case MOST_RESTRICTIVE -> anyTrue(entry.getValue()).ifPresentOrElse(
                    value -> merged.put(field, value),
                    () -> conflicts.add(invalid(field, bySource, "true or false")));
                case UNION -> merged.put(field, union(entry.getValue()));
                case EXPLICIT_CONFLICT -> {
                    if (bySource.size() == 1) {
                        merged.put(field, entry.getValue().get(0));
                    } else {
                        conflicts.add(new ConflictRecord(field.key(), ConflictType.FIELD_VALUE, bySource, null,
                            "Sources disagree on '" + field.key() + "'; the merged value is left unset. "
                                + "Choose one value and align the sources or set it explicitly in the profile."));
                    }
                }
                case MIXED -> merged.put(field, bySource.size() == 1 ? entry.getValue().get(0) : MIXED_VALUE);
                default -> throw new IllegalStateException("unhandled strategy " + field.strategy());
            }
        }
        return merged;
    }

    /**
     * Numeric maximum ({@code direction} 1) or minimum ({@code direction} -1); empty if any
     * value is not a number.
     */
    private Optional<Object> extreme(List<Object> values, int direction) {
        BigDecimal best = null;
        for (Object value : values) {
            BigDecimal number = toNumber(value);
            if (number == null) {
                return Optional.empty();
            }
            if (best == null || Integer.signum(number.compareTo(best)) == direction) {
                best = number;
            }
        }
        return Optional.ofNullable(best).map(IntentMerger::normalizeNumber);
    }

    private static boolean declaresDefault(List<SourceIntent> intents, String inputName) {
        return intents.stream()
            .flatMap(intent -> intent.inputs().stream())
            .anyMatch(input -> input.name().equals(inputName) && input.defaultValue() != null);
    }

    private Optional<Object> anyTrue(List<Object> values) {
        boolean result = false;
        for (Object value : values) {
            if (value instanceof Boolean flag) {
                result |= flag;
            } else if ("true".equalsIgnoreCase(String.valueOf(value)) || "false".equalsIgnoreCase(String.valueOf(value))) {
                result |= Boolean.parseBoolean(String.valueOf(value));
            } else {
                return Optional.empty();
            }
        }
        return Optional.of(result);
    }

    private List<String> union(List<Object> values) {
        Set<String> union = new TreeSet<>();
        for (Object value : values) {
            if (value instanceof List<?> list) {
                list.forEach(element -> union.add(String.valueOf(element)));
            } else {
                for (String part : String.valueOf(value).split(",")) {
                    if (!part.isBlank()) {
                        union.add(part.strip());
                    }
                }
            }
        }
        return List.copyOf(union);
    }

    private ConflictRecord invalid(IntentField field, Map<String, List<String>> bySource, String expected) {
        return new ConflictRecord(field.key(), ConflictType.INVALID_VALUE, bySource, null,
            "'" + field.key() + "' merges by " + field.strategy().name().toLowerCase(Locale.ROOT)
                + " and needs " + expected + "; the merged value is left unset.");
    }

    private static BigDecimal toNumber(Object value) {
        if (value instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        try {
            return new BigDecimal(String.valueOf(value).strip());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Object normalizeNumber(BigDecimal number) {
        BigDecimal stripped = number.stripTrailingZeros();
        if (stripped.scale() <= 0) {
            long whole = stripped.longValue();
            return whole <= Integer.MAX_VALUE && whole >= Integer.MIN_VALUE ? (Object) (int) whole : (Object) whole;
        }
        return stripped.doubleValue();
    }

    private static String display(Object value) {
        if (value instanceof List<?> list) {
            return String.join(",", list.stream().map(String::valueOf).toList());
        }
        return String.valueOf(value);
    }
}
