package com.opstranslate.core.rules;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.opstranslate.core.model.Classification;
import com.opstranslate.core.model.IntentField;
import com.opstranslate.core.model.UnitShape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.PatternSyntaxException;

/**
 * Loads and validates mapping rule tables from YAML.
 *
 * <p><b>File format:</b></p>
 * <pre>{@code
 * version: "1.0"
 * classification:            # optional, replaces built-in matchers per category
 *   integration:
 *     - identifier: Invoke-RestMethod
 * rules:
 *   mutation:
 *     - id: create-vm
 *       description: "Create VM {Name}"
 *       match: { pattern: "New-VM|CreateVM" }
 *       action: kubevirt.core.kubevirt_vm
 *       params:
 *         memory: "{MemoryGB}Gi"
 *       requires: [ storage.default_class ]
 *       requirements:
 *         memory_gb: "{MemoryGB}"
 *       tags: [ provisioning ]
 * }</pre>
 *
 * <p>Any structural problem raises {@link RuleTableException}: adding a rule never needs
 * a code change, but a broken table stops the run at start-up.
 */
public class RuleTableLoader {

    private static final Logger log = LoggerFactory.getLogger(RuleTableLoader.class);

    /** Classpath location of the built-in rule table. */
    public static final String DEFAULT_RESOURCE = "mappings/default-rules.yaml";

    private static final Set<String> MATCH_KEYS = Set.of("identifier", "pattern", "shape", "hasParameters");

    private final ObjectMapper yamlMapper;

    public RuleTableLoader() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
    }

    /**
     * Loads the built-in rule table from the classpath.
     *
     * @return default rule table
     * @throws RuleTableException if the resource is missing or invalid
     */
    public RuleTable loadDefault() {
        try (InputStream in = RuleTableLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new RuleTableException("Built-in rule table not found on classpath: " + DEFAULT_RESOURCE);
            }
            return parse(yamlMapper.readTree(in), DEFAULT_RESOURCE);
        } catch (IOException e) {
            throw new RuleTableException("Failed to read built-in rule table: " + e.getMessage(), e);
        }
    }

    /**
     * Loads a rule table from a file.
     *
     * @param path YAML file
     * @return rule table
     * @throws RuleTableException if the file is missing, unreadable or invalid
     */
    public RuleTable load(Path path) {
        if (!Files.exists(path)) {
            throw new RuleTableException("Rule table not found: " + path);
        }
        try {
            return parse(yamlMapper.readTree(path.toFile()), path.toString());
        } catch (IOException e) {
            throw new RuleTableException("Failed to parse rule table " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parses a rule table from YAML text.
     *
     * @param yaml YAML content
     * @param origin name used in error messages
     * @return rule table
     * @throws RuleTableException if the content is invalid
     */
    public RuleTable parse(String yaml, String origin) {
        try {
            return parse(yamlMapper.readTree(yaml), origin);
        } catch (IOException e) {
            throw new RuleTableException("Failed to parse rule table " + origin + ": " + e.getMessage(), e);
        }
    }

    // ==================== Table Structure ====================

    private RuleTable parse(JsonNode root, String origin) {
        if (root == null || !root.isObject()) {
            throw new RuleTableException(origin + ": rule table must be a mapping");
        }
        JsonNode versionNode = root.get("version");
        if (versionNode == null || !versionNode.isValueNode() || versionNode.asText().isBlank()) {
            throw new RuleTableException(origin + ": missing 'version'");
        }
        String version = versionNode.asText();

        ClassifierRules classifierRules = ClassifierRules.defaults();
        JsonNode classification = root.get("classification");
        if (classification != null && !classification.isNull()) {
            classifierRules = classifierRules.withOverrides(parseClassification(classification, origin));
        }

        JsonNode rulesNode = root.get("rules");
        if (rulesNode == null || !rulesNode.isObject()) {
            throw new RuleTableException(origin + ": missing 'rules' mapping");
        }

        Map<Classification, List<MappingRule>> rules = new EnumMap<>(Classification.class);
        Set<String> ids = new HashSet<>();
        Iterator<Map.Entry<String, JsonNode>> categories = rulesNode.fields();
        while (categories.hasNext()) {
            Map.Entry<String, JsonNode> entry = categories.next();
            Classification category = category(entry.getKey(), origin);
            List<MappingRule> categoryRules = new ArrayList<>();
            for (JsonNode ruleNode : asList(entry.getValue(), origin + ": rules." + entry.getKey())) {
                MappingRule rule = parseRule(ruleNode, category, origin);
                if (!ids.add(rule.id())) {
                    throw new RuleTableException(origin + ": duplicate rule id '" + rule.id() + "'");
                }
                categoryRules.add(rule);
            }
            rules.put(category, categoryRules);
        }

        RuleTable table = new RuleTable(version, rules, classifierRules);
        log.info("Loaded rule table {} version {} with {} rules", origin, version, table.size());
        return table;
    }

    private Map<Classification, List<UnitMatcher>> parseClassification(JsonNode node, String origin) {
        if (!node.isObject()) {
            throw new RuleTableException(origin + ": 'classification' must be a mapping");
        }
        Map<Classification, List<UnitMatcher>> overrides = new EnumMap<>(Classification.class);
        Iterator<Map.Entry<String, JsonNode>> entries = node.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            Classification category = category(entry.getKey(), origin);
            List<UnitMatcher> matchers = new ArrayList<>();
            for (JsonNode matcherNode : asList(entry.getValue(), origin + ": classification." + entry.getKey())) {
                matchers.add(parseMatcher(matcherNode, origin + ": classification." + entry.getKey()));
            }
            overrides.put(category, matchers);
        }
        return overrides;
    }

    // ==================== Rules ====================

    private MappingRule parseRule(JsonNode node, Classification category, String origin) {
        if (!node.isObject()) {
            throw new RuleTableException(origin + ": each rule must be a mapping");
        }
        String id = text(node, "id");
        if (id == null || id.isBlank()) {
            throw new RuleTableException(origin + ": rule without 'id' in category " + category.key());
        }
        String context = origin + ": rule '" + id + "'";
        String action = text(node, "action");
        if (action == null || action.isBlank()) {
            throw new RuleTableException(context + " has no 'action'");
        }
        JsonNode match = node.get("match");
        if (match == null) {
            throw new RuleTableException(context + " has no 'match'");
        }

        UnitMatcher matcher = parseMatcher(match, context);
        String description = text(node, "description");
        Map<String, Object> params = toMap(node.get("params"), context + " params");
        Map<IntentField, Object> requirements = parseRequirements(node.get("requirements"), context);
        List<String> tags = toStrings(node.get("tags"), context + " tags");

        Set<String> unknownFilters = new LinkedHashSet<>(TemplateSyntax.unknownFilters(description));
        unknownFilters.addAll(TemplateSyntax.unknownFilters(params));
        unknownFilters.addAll(TemplateSyntax.unknownFilters(new ArrayList<>(requirements.values())));
        if (!unknownFilters.isEmpty()) {
            throw new RuleTableException(context + " uses unknown template filters " + unknownFilters);
        }

        Set<String> required = new LinkedHashSet<>(toStrings(node.get("requires"), context + " requires"));
        required.addAll(TemplateSyntax.profileReferences(description));
        required.addAll(TemplateSyntax.profileReferences(params));

        return new MappingRule(id, category, description, matcher, action, params,
            new ArrayList<>(required), requirements, tags);
    }

    private UnitMatcher parseMatcher(JsonNode node, String context) {
        if (!node.isObject()) {
            throw new RuleTableException(context + ": 'match' must be a mapping");
        }
        node.fieldNames().forEachRemaining(key -> {
            if (!MATCH_KEYS.contains(key)) {
                throw new RuleTableException(context + ": unknown match key '" + key + "'");
            }
        });
        UnitShape shape = null;
        String shapeText = text(node, "shape");
        if (shapeText != null) {
            try {
                shape = UnitShape.valueOf(shapeText.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new RuleTableException(context + ": unknown shape '" + shapeText + "'", e);
            }
        }
        try {
            return UnitMatcher.of(text(node, "identifier"), text(node, "pattern"), shape,
                toStrings(node.get("hasParameters"), context + " hasParameters"));
        } catch (PatternSyntaxException e) {
            throw new RuleTableException(context + ": invalid pattern: " + e.getDescription(), e);
        } catch (IllegalArgumentException e) {
            throw new RuleTableException(context + ": " + e.getMessage(), e);
        }
    }

    private Map<IntentField, Object> parseRequirements(JsonNode node, String context) {
        Map<IntentField, Object> requirements = new LinkedHashMap<>();
        Map<String, Object> raw = toMap(node, context + " requirements");
        raw.forEach((key, value) -> {
            IntentField field = IntentField.fromKey(key)
                .orElseThrow(() -> new RuleTableException(context + ": unknown requirement field '" + key + "'"));
            requirements.put(field, value);
        });
        return requirements;
    }

    // ==================== Node Helpers ====================

    private Classification category(String key, String origin) {
        try {
            Classification category = Classification.fromKey(key);
            if (category == Classification.UNKNOWN) {
                throw new RuleTableException(origin + ": 'unknown' is not a mappable category");
            }
            return category;
        } catch (IllegalArgumentException e) {
            throw new RuleTableException(origin + ": unknown category '" + key + "'", e);
        }
    }

    private List<JsonNode> asList(JsonNode node, String context) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new RuleTableException(context + " must be a list");
        }
        List<JsonNode> list = new ArrayList<>();
        node.forEach(list::add);
        return list;
    }

    private Map<String, Object> toMap(JsonNode node, String context) {
        if (node == null || node.isNull()) {
            return Map.of();
        }
        if (!node.isObject()) {
            throw new RuleTableException(context + " must be a mapping");
        }
        return yamlMapper.convertValue(node, new TypeReference<LinkedHashMap<String, Object>>() { });
    }

    private List<String> toStrings(JsonNode node, String context) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (node.isValueNode()) {
            return List.of(node.asText());
        }
        if (!node.isArray()) {
            throw new RuleTableException(context + " must be a list");
        }
        List<String> values = new ArrayList<>();
        node.forEach(element -> values.add(element.asText()));
        return values;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isValueNode() && !value.isNull() ? value.asText() : null;
    }
}
