package com.opstranslate.core.parser.workflow;

import com.opstranslate.core.graph.DependencyCycleException;
import com.opstranslate.core.graph.EdgeType;
import com.opstranslate.core.graph.GraphEdge;
import com.opstranslate.core.model.InputDefinition;
import com.opstranslate.core.model.ParameterValue;
import com.opstranslate.core.model.SourceDocument;
import com.opstranslate.core.model.SourceUnit;
import com.opstranslate.core.model.UnitKind;
import com.opstranslate.core.model.UnitShape;
import com.opstranslate.core.parser.ParsedSource;
import com.opstranslate.core.parser.StructuralParseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link WorkflowGraphParser}.
 */
class WorkflowGraphParserTest {

    private static final String PROVISION_WORKFLOW = """
        <?xml version="1.0" encoding="UTF-8"?>
        <workflow xmlns="http://vmware.com/vco/workflow" root-name="item1" id="wf-provision">
          <display-name>Provision VM</display-name>
          <input>
            <param name="vmName" type="string"/>
            <param name="cpuCount" type="number"/>
          </input>
          <output>
            <param name="vmId" type="string"/>
          </output>
          <workflow-item name="item1" type="custom-condition" out-name="item2" alt-out-name="item3">
            <display-name>Large VM?</display-name>
            <script encoded="false">return cpuCount &gt; 8;</script>
            <in-binding>
              <bind name="cpuCount" type="number" export-name="cpuCount"/>
            </in-binding>
          </workflow-item>
          <workflow-item name="item3" type="task" out-name="item0">
            <display-name>Create VM</display-name>
            <script encoded="false">System.getModule("com.acme.vm").createVM(vmName, cpuCount);</script>
            <in-binding>
              <bind name="name" type="string" export-name="vmName"/>
              <bind name="numCpu" type="number" export-name="cpuCount"/>
            </in-binding>
          </workflow-item>
          <workflow-item name="item2" type="input" out-name="item3">
            <display-name>Approve large VM</display-name>
          </workflow-item>
          <workflow-item name="item0" type="end"/>
        </workflow>
        """;

    private WorkflowGraphParser parser;

    @BeforeEach
    void setUp() {
        parser = new WorkflowGraphParser();
    }

    @Test
    void shouldHaveCorrectMetadata() {
        assertThat(parser.getId()).isEqualTo("vro-workflow");
        assertThat(parser.supports(new SourceDocument("provision.xml", ""))).isTrue();
        assertThat(parser.supports(new SourceDocument("provision.ps1", ""))).isFalse();
    }

    @Test
    void parseGraph_workflow_readsNodesInDocumentPositionOrder() throws StructuralParseException {
        // When
        WorkflowGraph graph = parser.parseGraph(new SourceDocument("provision.xml", PROVISION_WORKFLOW));

        // Then
        assertThat(graph.rootName()).isEqualTo("item1");
        assertThat(graph.nodes()).extracting(SourceUnit::location).containsExactly(
            "input:vmName", "input:cpuCount", "item1", "item3", "item2", "output:vmId");
        assertThat(graph.nodes()).allMatch(node -> node.kind() == UnitKind.GRAPH_NODE);
        assertThat(graph.inputs()).extracting(InputDefinition::name).containsExactly("vmName", "cpuCount");
    }

    @Test
    void parseGraph_links_dropEdgesIntoEndItems() throws StructuralParseException {
        WorkflowGraph graph = parser.parseGraph(new SourceDocument("provision.xml", PROVISION_WORKFLOW));

        assertThat(graph.edges()).containsExactly(
            new GraphEdge("item1", "item2", EdgeType.NEXT),
            new GraphEdge("item1", "item3", EdgeType.ALTERNATE),
            new GraphEdge("item2", "item3", EdgeType.NEXT));
    }

    @Test
    void parse_workflow_ordersNodesByDependencies() throws StructuralParseException {
        // When
        ParsedSource parsed = parser.parse(new SourceDocument("provision.xml", PROVISION_WORKFLOW));

        // Then
        assertThat(parsed.units()).extracting(SourceUnit::location).containsExactly(
            "input:vmName", "input:cpuCount", "item1", "item2", "item3", "output:vmId");
    }

    @Test
    void parse_itemShapes_mapToIdentifiersAndParameters() throws StructuralParseException {
        // When
        List<SourceUnit> units = parser.parse(new SourceDocument("provision.xml", PROVISION_WORKFLOW)).units();

        // Then
        SourceUnit decision = units.get(2);
        assertThat(decision.shape()).isEqualTo(UnitShape.DECISION);
        assertThat(decision.parameter("condition")).contains(ParameterValue.literal("cpuCount > 8"));
        assertThat(decision.rawText())
            .isEqualTo("<workflow-item name=\"item1\" type=\"custom-condition\"> Large VM?: return cpuCount > 8;");

        SourceUnit approval = units.get(3);
        assertThat(approval.shape()).isEqualTo(UnitShape.INTERACTION);
        assertThat(approval.identifier()).isEqualTo("UserInteraction");

        SourceUnit action = units.get(4);
        assertThat(action.shape()).isEqualTo(UnitShape.ACTION_CALL);
        assertThat(action.identifier()).isEqualTo("createVM");
        assertThat(action.parameter("module")).contains(ParameterValue.quoted("com.acme.vm"));
        assertThat(action.parameter("name")).contains(ParameterValue.variable("vmName"));
        assertThat(action.parameter("numCpu")).contains(ParameterValue.variable("cpuCount"));

        SourceUnit output = units.get(5);
        assertThat(output.shape()).isEqualTo(UnitShape.OUTPUT);
        assertThat(output.parameter("name")).contains(ParameterValue.literal("vmId"));
    }

    @Test
    void parse_taskScripts_recognizeThrowAssignmentAndOpaqueTasks() throws StructuralParseException {
        // Given
        String xml = """
            <workflow root-name="a">
              <workflow-item name="a" type="task" out-name="b">
                <script>if (cpuCount > 32) { throw "Too many CPUs"; }</script>
              </workflow-item>
              <workflow-item name="b" type="task" out-name="c">
                <script>var vmFolder = "prod";</script>
              </workflow-item>
              <workflow-item name="c" type="task" out-name="d">
                <script>for (var i = 0; i &lt; 3; i++) { System.log(i); }</script>
              </workflow-item>
              <workflow-item name="d" type="link" linked-workflow-id="wf-network"/>
            </workflow>
            """;

        // When
        List<SourceUnit> units = parser.parse(new SourceDocument("tasks.xml", xml)).units();

        // Then
        assertThat(units).extracting(SourceUnit::shape).containsExactly(
            UnitShape.THROW, UnitShape.ASSIGNMENT, UnitShape.TASK, UnitShape.LINK);
        assertThat(units.get(0).parameter("condition")).contains(ParameterValue.literal("cpuCount > 32"));
        assertThat(units.get(0).parameter("message")).contains(ParameterValue.quoted("Too many CPUs"));
        assertThat(units.get(1).parameter("Name")).contains(ParameterValue.literal("vmFolder"));
        assertThat(units.get(1).parameter("Value")).contains(ParameterValue.quoted("prod"));
        assertThat(units.get(2).identifier()).isEqualTo("ScriptTask");
        assertThat(units.get(3).identifier()).isEqualTo("CallWorkflow");
        assertThat(units.get(3).parameter("workflow")).contains(ParameterValue.quoted("wf-network"));
    }

    @Test
    void parse_multiStatementScript_becomesOneNodePerStatementInScriptOrder() throws StructuralParseException {
        // Given
        String xml = """
            <workflow root-name="item1">
              <workflow-item name="item1" type="task" out-name="item2">
                <script>System.log("Sizing VM");
            if (cpuCount &gt; 16) { throw "Too many CPUs"; }
            vmSize = "large";</script>
              </workflow-item>
              <workflow-item name="item2" type="task" out-name="item0">
                <script>System.getModule("com.acme.vm").createVM(vmName);</script>
              </workflow-item>
              <workflow-item name="item0" type="end"/>
            </workflow>
            """;
        SourceDocument document = new SourceDocument("sizing.xml", xml);

        // When
        WorkflowGraph graph = parser.parseGraph(document);
        List<SourceUnit> units = parser.parse(document).units();

        // Then
        assertThat(units).extracting(SourceUnit::location).containsExactly("item1", "item1#2", "item1#3", "item2");
        assertThat(units).extracting(SourceUnit::position).containsExactly(0, 1, 2, 3);
        assertThat(units).extracting(SourceUnit::shape).containsExactly(
            UnitShape.CALL, UnitShape.THROW, UnitShape.ASSIGNMENT, UnitShape.ACTION_CALL);
        assertThat(units.get(0).identifier()).isEqualTo("System.log");
        assertThat(units.get(0).parameter("message")).contains(ParameterValue.quoted("Sizing VM"));
        assertThat(units.get(1).parameter("condition")).contains(ParameterValue.literal("cpuCount > 16"));
        assertThat(units.get(2).parameter("Name")).contains(ParameterValue.literal("vmSize"));
        assertThat(graph.edges()).containsExactly(
            new GraphEdge("item1", "item1#2", EdgeType.NEXT),
            new GraphEdge("item1#2", "item1#3", EdgeType.NEXT),
            new GraphEdge("item1#3", "item2", EdgeType.NEXT));
    }

    @Test
    void parse_duplicateItemNames_throwsStructuralParseException() {
        // Given
        String xml = """
            <workflow>
              <workflow-item name="item1" type="task" out-name="item0"><script>x = 1;</script></workflow-item>
              <workflow-item name="item1" type="task" out-name="item0"><script>y = 2;</script></workflow-item>
              <workflow-item name="item0" type="end"/>
            </workflow>
            """;

        // When / Then
        assertThatThrownBy(() -> parser.parse(new SourceDocument("dup.xml", xml)))
            .isInstanceOf(StructuralParseException.class)
            .hasMessage("dup.xml: workflow item 'item1' is declared more than once");
    }

    @Test
    void parse_unknownItemType_becomesUnrecognizedNode() throws StructuralParseException {
        String xml = """
            <workflow>
              <workflow-item name="loop1" type="foreach"/>
            </workflow>
            """;

        List<SourceUnit> units = parser.parse(new SourceDocument("loop.xml", xml)).units();

        assertThat(units).hasSize(1);
        assertThat(units.get(0).shape()).isEqualTo(UnitShape.UNRECOGNIZED);
        assertThat(units.get(0).location()).isEqualTo("loop1");
        assertThat(units.get(0).rawText()).isEqualTo("<workflow-item name=\"loop1\" type=\"foreach\">");
    }

    @Test
    void parse_cyclicLinks_throwsDependencyCycle() {
        // Given
        String xml = """
            <workflow>
              <workflow-item name="a" type="task" out-name="b"><script>x = 1;</script></workflow-item>
              <workflow-item name="b" type="task" out-name="a"><script>y = 2;</script></workflow-item>
            </workflow>
            """;

        // When / Then
        assertThatThrownBy(() -> parser.parse(new SourceDocument("cycle.xml", xml)))
            .isInstanceOf(DependencyCycleException.class)
            .extracting(e -> ((DependencyCycleException) e).getCycleNodes())
            .isEqualTo(List.of("a", "b"));
    }

    @Test
    void parse_invalidXml_throwsStructuralParseException() {
        assertThatThrownBy(() -> parser.parse(new SourceDocument("broken.xml", "<workflow><workflow-item")))
            .isInstanceOf(StructuralParseException.class)
            .hasMessageContaining("broken.xml");
    }

    @Test
    void parse_emptyDocument_throwsStructuralParseException() {
        assertThatThrownBy(() -> parser.parse(new SourceDocument("empty.xml", "  ")))
            .isInstanceOf(StructuralParseException.class)
            .hasMessageContaining("empty");
    }
}
