package com.opstranslate.core.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.opstranslate.core.model.ConflictRecord;
import com.opstranslate.core.model.Gap;
import com.opstranslate.core.model.InputDefinition;
import com.opstranslate.core.model.MergedIntent;
import com.opstranslate.core.model.Requirement;
import com.opstranslate.core.model.ResolvedTask;
import com.opstranslate.core.model.SourceIntent;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Serializes intents and gap reports to YAML or JSON.
 *
 * <p>Field order is fixed by this class, not by reflection, and no timestamps or run
 * identifiers are written, so identical inputs give byte-identical text that operators
 * can diff between runs.
 */
public class IntentSerializer {

    private final ObjectMapper yamlMapper;
    private final ObjectMapper jsonMapper;

    public IntentSerializer() {
        this.yamlMapper = new ObjectMapper(YAMLFactory.builder()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
            .enable(YAMLGenerator.Feature.INDENT_ARRAYS_WITH_INDICATOR)
            .build());
        this.jsonMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String serialize(SourceIntent intent, OutputFormat format) {
        return write(toTree(intent), format);
    }

    public String serialize(MergedIntent merged, OutputFormat format) {
        return write(toTree(merged), format);
    }

    public String serialize(GapReport report, OutputFormat format) {
        return write(toTree(report), format);
    }

    /**
     * Writes an already ordered tree of maps, lists and scalars.
     *
     * @param tree value tree
     * @param format output format
     * @return serialized text ending with a newline
     */
    public String write(Object tree, OutputFormat format) {
        ObjectMapper mapper = format == OutputFormat.JSON ? jsonMapper : yamlMapper;
        try {
            String text = mapper.writeValueAsString(tree);
            return text.endsWith("\n") ? text : text + "\n";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + format.extension(), e);
        }
    }

    // ==================== Trees ====================

    Map<String, Object> toTree(SourceIntent intent) {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("source", intent.sourceName());
        tree.put("kind", intent.kind().name().toLowerCase(Locale.ROOT));
        tree.put("inputs", intent.inputs().stream().map(IntentSerializer::input).toList());
        tree.put("requirements", intent.requirements().stream().map(IntentSerializer::requirement).toList());
        tree.put("tasks", intent.tasks().stream().map(IntentSerializer::task).toList());
        tree.put("gaps", intent.gaps().stream().map(IntentSerializer::gap).toList());
        return tree;
    }

    Map<String, Object> toTree(MergedIntent merged) {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("sources", merged.sources());
        Map<String, Object> inputs = new LinkedHashMap<>();
        merged.inputs().forEach((name, input) -> inputs.put(name, input(input)));
        tree.put("inputs", inputs);
        tree.put("fields", merged.fieldsByKey());
        tree.put("conflicts", merged.conflicts().stream().map(IntentSerializer::conflict).toList());
        Map<String, Object> tasks = new LinkedHashMap<>();
        merged.tasksBySource().forEach((source, list) ->
            tasks.put(source, list.stream().map(IntentSerializer::task).toList()));
        tree.put("tasks", tasks);
        tree.put("gaps", merged.gaps().stream().map(IntentSerializer::gap).toList());
        return tree;
    }

    Map<String, Object> toTree(GapReport report) {
        Map<String, Object> tree = new LinkedHashMap<>();
        Map<String, Object> summary = new LinkedHashMap<>();
        report.countsByType().forEach((type, count) -> summary.put(type.key(), count));
        tree.put("summary", summary);
        List<Map<String, Object>> entries = new ArrayList<>();
        for (GapReport.Entry entry : report.entries()) {
            Map<String, Object> node = new LinkedHashMap<>();
            node.put("type", entry.type().key());
            node.put("severity", entry.severity().name().toLowerCase(Locale.ROOT));
            node.put("reference", entry.reference());
            node.put("reason", entry.reason());
            node.put("remediation", entry.remediation());
            if (!entry.evidence().isEmpty()) {
                node.put("evidence", entry.evidence());
            }
            entries.add(node);
        }
        tree.put("entries", entries);
        return tree;
    }

    private static Map<String, Object> input(InputDefinition input) {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put("name", input.name());
        node.put("type", input.type());
        node.put("required", input.required());
        if (input.defaultValue() != null) {
            node.put("default", input.defaultValue());
        }
        if (input.description() != null) {
            node.put("description", input.description());
        }
        return node;
    }

    private static Map<String, Object> requirement(Requirement requirement) {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put("field", requirement.field().key());
        node.put("value", requirement.value());
        node.put("origin", requirement.origin());
        return node;
    }

    private static Map<String, Object> task(ResolvedTask task) {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put("name", task.name());
        node.put("action", task.targetAction());
        node.put("status", task.status().name().toLowerCase(Locale.ROOT));
        node.put("rule", task.ruleId());
        node.put("category", task.category().key());
        node.put("source", task.unit().describe());
        node.put("params", task.params());
        if (!task.tags().isEmpty()) {
            node.put("tags", task.tags());
        }
        if (task.isBlocked()) {
            node.put("missing_profile_paths", task.missingProfilePaths());
            node.put("blocked_reason", task.blockedReason());
        }
        return node;
    }

    private static Map<String, Object> gap(Gap gap) {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put("type", gap.type().key());
        node.put("source", gap.unit().describe());
        node.put("reason", gap.reason());
        node.put("remediation", gap.remediation());
        node.put("evidence", gap.unit().rawText());
        return node;
    }

    private static Map<String, Object> conflict(ConflictRecord conflict) {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put("subject", conflict.subject());
        node.put("type", conflict.type().name().toLowerCase(Locale.ROOT));
        node.put("values", conflict.valuesBySource());
        if (conflict.retainedValue() != null) {
            node.put("retained", conflict.retainedValue());
        }
        node.put("remediation", conflict.remediation());
        return node;
    }
}
