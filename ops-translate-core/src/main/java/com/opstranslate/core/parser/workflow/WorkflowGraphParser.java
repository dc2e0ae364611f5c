package com.opstranslate.core.parser.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.opstranslate.core.graph.DependencyOrderer;
import com.opstranslate.core.graph.EdgeType;
import com.opstranslate.core.graph.GraphEdge;
import com.opstranslate.core.model.InputDefinition;
import com.opstranslate.core.model.ParameterValue;
import com.opstranslate.core.model.SourceDocument;
import com.opstranslate.core.model.SourceKind;
import com.opstranslate.core.model.SourceUnit;
import com.opstranslate.core.model.UnitKind;
import com.opstranslate.core.model.UnitShape;
import com.opstranslate.core.parser.ParsedSource;
import com.opstranslate.core.parser.StructuralParseException;
import com.opstranslate.core.parser.base.AbstractJacksonParser;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses vRealize Orchestrator workflow exports into graph nodes and orders them.
 *
 * <p>Expected document structure:
 * <pre>{@code
 * <workflow xmlns="http://vmware.com/vco/workflow" root-name="item1">
 *   <input><param name="vmName" type="string"/></input>
 *   <workflow-item name="item1" type="task" out-name="item2">
 *     <display-name>Create VM</display-name>
 *     <script>System.getModule("com.acme.vm").createVM(vmName, cpu);</script>
 *     <in-binding><bind name="vmName" type="string" export-name="vmName"/></in-binding>
 *   </workflow-item>
 *   <workflow-item name="item2" type="end"/>
 *   <output><param name="vmId" type="string"/></output>
 * </workflow>
 * }</pre>
 *
 * <p>Input declarations come first in document position, then workflow items, then
 * outputs. {@code end} items are terminal markers and produce no node; edges into them
 * are dropped. Unknown item types become {@link UnitShape#UNRECOGNIZED} nodes.
 *
 * <p>A task script with several statements becomes one node per statement. The first
 * keeps the item name, the others are named {@code item#2}, {@code item#3} and so on;
 * they are chained in script order and the item's outgoing edges leave from the last one.
 */
public class WorkflowGraphParser extends AbstractJacksonParser {

    private static final Pattern ACTION_CALL = Pattern.compile(
        "System\\.getModule\\(\\s*[\"']([^\"']+)[\"']\\s*\\)\\.(\\w+)\\s*\\(");
    private static final Pattern GUARDED_THROW = Pattern.compile(
        "(?s)^\\s*if\\s*\\((.*)\\)\\s*\\{\\s*throw\\s+(?:new\\s+Error\\s*\\(\\s*)?[\"'](.*?)[\"']\\s*\\)?\\s*;?\\s*}\\s*$");
    private static final Pattern BARE_THROW = Pattern.compile(
        "(?s)^\\s*throw\\s+(?:new\\s+Error\\s*\\(\\s*)?[\"'](.*?)[\"']\\s*\\)?\\s*;?\\s*$");
    private static final Pattern SINGLE_ASSIGNMENT = Pattern.compile(
        "^\\s*(?:var\\s+|let\\s+|const\\s+)?([A-Za-z_$][\\w$]*)\\s*=\\s*([^;\\n=][^;\\n]*?)\\s*;?\\s*$");
    private static final Pattern LOG_CALL = Pattern.compile(
        "(?s)^\\s*System\\.(log|warn|debug|error)\\s*\\((.*)\\)\\s*;?\\s*$");
    private static final Pattern RETURN_CONDITION = Pattern.compile("(?s)^\\s*return\\s+(.*?)\\s*;?\\s*$");

    private static final Set<String> DECISION_TYPES = Set.of("custom-condition", "condition", "decision");
    private static final Set<String> INTERACTION_TYPES = Set.of("input", "user-interaction", "waiting-event");

    private final DependencyOrderer orderer = new DependencyOrderer();

    @Override
    public String getId() {
        return "vro-workflow";
    }

    @Override
    public String getDisplayName() {
        return "vRealize Orchestrator Workflow Parser";
    }

    @Override
    public SourceKind getSourceKind() {
        return SourceKind.WORKFLOW;
    }

    @Override
    protected Set<String> getSupportedExtensions() {
        return Set.of("xml", "workflow");
    }

    @Override
    public ParsedSource parse(SourceDocument document) throws StructuralParseException {
        WorkflowGraph graph = parseGraph(document);
        List<SourceUnit> ordered = orderer.order(graph.sourceName(), graph.nodes(), graph.edges());
        log.debug("Parsed {} nodes and {} edges from {}", ordered.size(), graph.edges().size(), document.name());
        return new ParsedSource(document.name(), SourceKind.WORKFLOW, ordered, graph.inputs());
    }

    /**
     * Reads the document into an unordered graph.
     *
     * @param document workflow export
     * @return nodes in document order plus edges
     * @throws StructuralParseException if the XML is invalid or item names repeat
     */
    public WorkflowGraph parseGraph(SourceDocument document) throws StructuralParseException {
        String sourceName = document.name();
        JsonNode root = parseXmlContent(sourceName, document.content());
        if (!root.isObject()) {
            throw new StructuralParseException(sourceName, "root element has no workflow content");
        }

        List<SourceUnit> nodes = new ArrayList<>();
        List<InputDefinition> inputs = new ArrayList<>();

        for (JsonNode param : params(root, "input")) {
            InputDefinition input = toInputDefinition(param);
            if (input == null) {
                continue;
            }
            inputs.add(input);
            nodes.add(declarationNode(sourceName, nodes.size(), UnitShape.INPUT, "Input", "input", input));
        }

        JsonNode items = normalizeToArray(root.get("workflow-item"));
        Set<String> itemNames = new HashSet<>();
        Set<String> endItems = new HashSet<>();
        Map<String, String> exits = new LinkedHashMap<>();
        List<GraphEdge> edges = new ArrayList<>();
        List<JsonNode> itemsWithEdges = new ArrayList<>();
        for (JsonNode item : items) {
            String name = extractAttribute(item, "name");
            String type = lower(extractAttribute(item, "type"));
            if (name == null) {
                nodes.add(SourceUnit.opaque(sourceName, "item#" + nodes.size(), nodes.size(),
                    UnitKind.GRAPH_NODE, UnitShape.UNRECOGNIZED, describeItem(item, null, type)));
                continue;
            }
            if (!itemNames.add(name)) {
                throw new StructuralParseException(sourceName, "workflow item '" + name + "' is declared more than once");
            }
            if ("end".equals(type)) {
                endItems.add(name);
                continue;
            }
            List<SourceUnit> itemNodes = toNodes(sourceName, nodes.size(), item, name, type);
            for (int i = 1; i < itemNodes.size(); i++) {
                edges.add(new GraphEdge(itemNodes.get(i - 1).location(), itemNodes.get(i).location(), EdgeType.NEXT));
            }
            nodes.addAll(itemNodes);
            exits.put(name, itemNodes.get(itemNodes.size() - 1).location());
            itemsWithEdges.add(item);
        }

        for (JsonNode param : params(root, "output")) {
            InputDefinition output = toInputDefinition(param);
            if (output != null) {
                nodes.add(declarationNode(sourceName, nodes.size(), UnitShape.OUTPUT, "Output", "output", output));
            }
        }

        Set<String> known = new HashSet<>();
        for (SourceUnit node : nodes) {
            if (!known.add(node.location())) {
                throw new StructuralParseException(sourceName, "node '" + node.location() + "' is declared more than once");
            }
        }
        for (JsonNode item : itemsWithEdges) {
            String from = exits.get(extractAttribute(item, "name"));
            addEdge(sourceName, edges, known, endItems, from, extractAttribute(item, "out-name"), EdgeType.NEXT);
            addEdge(sourceName, edges, known, endItems, from, extractAttribute(item, "alt-out-name"), EdgeType.ALTERNATE);
            addEdge(sourceName, edges, known, endItems, from, extractAttribute(item, "catch-name"), EdgeType.EXCEPTION);
        }

        return new WorkflowGraph(sourceName, extractAttribute(root, "root-name"), nodes, edges, inputs);
    }

    // ==================== Item Shapes ====================

    private List<SourceUnit> toNodes(String sourceName, int position, JsonNode item, String name, String type) {
        if ("task".equals(type)) {
            String script = extractText(item, "script");
            List<String> statements = ScriptStatements.split(script);
            Map<String, ParameterValue> bindings = inBindings(item);
            if (statements.size() <= 1) {
                return List.of(taskNode(sourceName, position, name, script, bindings, describeItem(item, name, type)));
            }
            List<SourceUnit> units = new ArrayList<>();
            for (String statement : statements) {
                String location = units.isEmpty() ? name : name + "#" + (units.size() + 1);
                String raw = "<workflow-item name=\"" + name + "\" type=\"task\">: " + statement;
                units.add(taskNode(sourceName, position + units.size(), location, statement, bindings, raw));
            }
            log.debug("{}:{} split into {} statements", sourceName, name, units.size());
            return units;
        }
        return List.of(toNode(sourceName, position, item, name, type));
    }

    private SourceUnit toNode(String sourceName, int position, JsonNode item, String name, String type) {
        String script = extractText(item, "script");
        String raw = describeItem(item, name, type);
        Map<String, ParameterValue> bindings = inBindings(item);

        if (DECISION_TYPES.contains(type)) {
            Map<String, ParameterValue> params = new LinkedHashMap<>();
            if (script != null && !script.isBlank()) {
                Matcher returned = RETURN_CONDITION.matcher(script);
                params.put("condition", ParameterValue.literal(returned.matches() ? returned.group(1) : script.strip()));
            }
            params.putAll(bindings);
            return node(sourceName, name, position, UnitShape.DECISION, "Decision", params, raw);
        }
        if (INTERACTION_TYPES.contains(type)) {
            return node(sourceName, name, position, UnitShape.INTERACTION, "UserInteraction", bindings, raw);
        }
        if ("link".equals(type)) {
            Map<String, ParameterValue> params = new LinkedHashMap<>();
            String linked = extractAttribute(item, "linked-workflow-id");
            if (linked != null) {
                params.put("workflow", ParameterValue.quoted(linked));
            }
            params.putAll(bindings);
            return node(sourceName, name, position, UnitShape.LINK, "CallWorkflow", params, raw);
        }

        log.debug("{}:{} has unrecognized item type '{}'", sourceName, name, type);
        return SourceUnit.opaque(sourceName, name, position, UnitKind.GRAPH_NODE, UnitShape.UNRECOGNIZED, raw);
    }

    private SourceUnit taskNode(String sourceName, int position, String name, String script,
                                Map<String, ParameterValue> bindings, String raw) {
        if (script == null || script.isBlank()) {
            return node(sourceName, name, position, UnitShape.TASK, "ScriptTask", bindings, raw);
        }

        Matcher action = ACTION_CALL.matcher(script);
        if (action.find()) {
            Map<String, ParameterValue> params = new LinkedHashMap<>();
            params.put("module", ParameterValue.quoted(action.group(1)));
            params.putAll(bindings);
            return node(sourceName, name, position, UnitShape.ACTION_CALL, action.group(2), params, raw);
        }

        Matcher guarded = GUARDED_THROW.matcher(script);
        if (guarded.matches()) {
            Map<String, ParameterValue> params = new LinkedHashMap<>();
            params.put("condition", ParameterValue.literal(guarded.group(1).strip()));
            params.put("message", ParameterValue.quoted(guarded.group(2)));
            return node(sourceName, name, position, UnitShape.THROW, "throw", params, raw);
        }
        Matcher bare = BARE_THROW.matcher(script);
        if (bare.matches()) {
            return node(sourceName, name, position, UnitShape.THROW, "throw",
                Map.of("message", ParameterValue.quoted(bare.group(1))), raw);
        }

        Matcher logCall = LOG_CALL.matcher(script);
        if (logCall.matches()) {
            return node(sourceName, name, position, UnitShape.CALL, "System." + logCall.group(1),
                Map.of("message", scriptValue(logCall.group(2))), raw);
        }

        Matcher assignment = SINGLE_ASSIGNMENT.matcher(script.strip());
        if (assignment.matches()) {
            Map<String, ParameterValue> params = new LinkedHashMap<>();
            params.put("Name", ParameterValue.literal(assignment.group(1)));
            params.put("Value", scriptValue(assignment.group(2)));
            return node(sourceName, name, position, UnitShape.ASSIGNMENT, "Set-Variable", params, raw);
        }

        return node(sourceName, name, position, UnitShape.TASK, "ScriptTask", bindings, raw);
    }

    private ParameterValue scriptValue(String expression) {
        String value = expression.strip();
        if (value.length() >= 2 && (value.startsWith("\"") && value.endsWith("\"")
            || value.startsWith("'") && value.endsWith("'"))) {
            return ParameterValue.quoted(value.substring(1, value.length() - 1));
        }
        if (value.matches("[A-Za-z_$][\\w$.]*") && !value.equals("true") && !value.equals("false")
            && !value.equals("null")) {
            return ParameterValue.variable(value);
        }
        return ParameterValue.literal(value);
    }

    // ==================== Declarations and Bindings ====================

    private Iterable<JsonNode> params(JsonNode root, String section) {
        JsonNode block = root.get(section);
        if (block == null || !block.isObject()) {
            return List.of();
        }
        return normalizeToArray(block.get("param"));
    }

    private InputDefinition toInputDefinition(JsonNode param) {
        String name = extractAttribute(param, "name");
        if (name == null) {
            return null;
        }
        String description = extractText(param, "description");
        return new InputDefinition(name, extractAttribute(param, "type"), true, null, description);
    }

    private SourceUnit declarationNode(String sourceName, int position, UnitShape shape, String identifier,
                                       String prefix, InputDefinition declaration) {
        Map<String, ParameterValue> params = new LinkedHashMap<>();
        params.put("name", ParameterValue.literal(declaration.name()));
        params.put("type", ParameterValue.literal(declaration.type()));
        if (shape == UnitShape.INPUT) {
            params.put("required", ParameterValue.literal("true"));
        }
        String raw = "<param name=\"" + declaration.name() + "\" type=\"" + declaration.type() + "\"/>";
        return node(sourceName, prefix + ":" + declaration.name(), position, shape, identifier, params, raw);
    }

    private Map<String, ParameterValue> inBindings(JsonNode item) {
        Map<String, ParameterValue> bindings = new LinkedHashMap<>();
        JsonNode inBinding = item.get("in-binding");
        if (inBinding == null || !inBinding.isObject()) {
            return bindings;
        }
        for (JsonNode bind : normalizeToArray(inBinding.get("bind"))) {
            String name = extractAttribute(bind, "name");
            if (name == null) {
                continue;
            }
            String exported = extractAttribute(bind, "export-name");
            bindings.put(name, ParameterValue.variable(exported != null ? exported : name));
        }
        return bindings;
    }

    private void addEdge(String sourceName, List<GraphEdge> edges, Set<String> known, Set<String> endItems,
                         String from, String to, EdgeType type) {
        if (to == null || to.isBlank() || endItems.contains(to)) {
            return;
        }
        if (!known.contains(to)) {
            log.debug("{}:{} points to unknown item '{}'; edge ignored", sourceName, from, to);
            return;
        }
        edges.add(new GraphEdge(from, to, type));
    }

    private String describeItem(JsonNode item, String name, String type) {
        StringBuilder raw = new StringBuilder("<workflow-item");
        if (name != null) {
            raw.append(" name=\"").append(name).append('"');
        }
        raw.append(" type=\"").append(type == null ? "" : type).append("\">");
        String displayName = extractText(item, "display-name");
        if (displayName != null && !displayName.isBlank()) {
            raw.append(' ').append(displayName.strip());
        }
        String script = extractText(item, "script");
        if (script != null && !script.isBlank()) {
            raw.append(": ").append(script.strip());
        }
        return raw.toString();
    }

    private static String lower(String value) {
        return value == null ? null : value.toLowerCase(Locale.ROOT);
    }

    private static SourceUnit node(String sourceName, String location, int position, UnitShape shape,
                                   String identifier, Map<String, ParameterValue> params, String raw) {
        return new SourceUnit(sourceName, location, position, UnitKind.GRAPH_NODE, shape, identifier,
            params, null, raw);
    }
}
