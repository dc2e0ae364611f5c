package com.opstranslate.core.mapping;

import com.opstranslate.core.model.Classification;
import com.opstranslate.core.model.IntentField;
import com.opstranslate.core.model.ParameterValue;
import com.opstranslate.core.model.Requirement;
import com.opstranslate.core.model.SourceUnit;
import com.opstranslate.core.model.UnitKind;
import com.opstranslate.core.model.UnitShape;
import com.opstranslate.core.rules.RuleTable;
import com.opstranslate.core.rules.RuleTableLoader;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link MappingEngine} against the built-in rule table.
 */
class MappingEngineTest {

    private static RuleTable defaultTable;

    private MappingEngine engine;

    @BeforeAll
    static void loadRules() {
        defaultTable = new RuleTableLoader().loadDefault();
    }

    @Test
    void map_createVmWorkflowCall_rendersMemoryWithUnit() {
        // Given: CreateVM(name, cpuCount=2, memoryGB=8) from a workflow task
        Map<String, ParameterValue> params = new LinkedHashMap<>();
        params.put("name", ParameterValue.variable("vmName"));
        params.put("numCpu", ParameterValue.literal("2"));
        params.put("memoryGB", ParameterValue.literal("8"));
        SourceUnit unit = unit("CreateVM", UnitShape.ACTION_CALL, params);
        engine = new MappingEngine(defaultTable);

        // When
        MappingOutcome outcome = engine.map(unit, Classification.MUTATION);

        // Then
        assertThat(outcome).isInstanceOf(MappingOutcome.Mapped.class);
        PartialTask task = ((MappingOutcome.Mapped) outcome).task();
        assertThat(task.ruleId()).isEqualTo("create-vm");
        assertThat(task.targetAction()).isEqualTo("kubevirt.core.kubevirt_vm");
        assertThat(task.params())
            .containsEntry("memory", "8Gi")
            .containsEntry("cpu_cores", 2)
            .containsEntry("name", "{{ vmname }}")
            .doesNotContainKey("disk_size");
        assertThat(task.tags()).containsExactly("provision");
        assertThat(task.category()).isEqualTo(Classification.MUTATION);
    }

    @Test
    void map_literalRequirements_areRecordedWithOrigin() {
        // Given
        Map<String, ParameterValue> params = new LinkedHashMap<>();
        params.put("Name", ParameterValue.quoted("db01"));
        params.put("NumCpu", ParameterValue.literal("4"));
        params.put("MemoryGB", ParameterValue.variable("mem"));
        engine = new MappingEngine(defaultTable);

        // When
        PartialTask task = ((MappingOutcome.Mapped) engine.map(unit("New-VM", UnitShape.COMMAND, params),
            Classification.MUTATION)).task();

        // Then: the variable memory size is only known at run time and is not a requirement
        assertThat(task.requirements())
            .containsExactly(new Requirement(IntentField.CPU_COUNT, 4, "deploy.ps1:line 3"));
        assertThat(task.name()).isEqualTo("Create VM db01");
    }

    @Test
    void map_networkAdapter_carriesRequiredProfilePath() {
        // Given
        Map<String, ParameterValue> params = new LinkedHashMap<>();
        params.put("vm", ParameterValue.variable("vm"));
        params.put("network", ParameterValue.quoted("prod-net"));
        engine = new MappingEngine(defaultTable);

        // When
        PartialTask task = ((MappingOutcome.Mapped) engine.map(
            unit("AttachNetworkAdapter", UnitShape.ACTION_CALL, params), Classification.INTEGRATION)).task();

        // Then
        assertThat(task.ruleId()).isEqualTo("network-adapter");
        assertThat(task.requiredProfilePaths()).containsExactly("network_security.model");
        assertThat(task.params()).containsEntry("network_policy", "{profile:network_security.model}");
        assertThat(task.params().get("networks")).isEqualTo(List.of(Map.of("name", "prod-net")));
        assertThat(task.requirements())
            .containsExactly(new Requirement(IntentField.TARGET_NETWORK, "prod-net", "deploy.ps1:line 3"));
    }

    @Test
    void map_noRuleInCategory_returnsNoMatch() {
        // Given
        engine = new MappingEngine(defaultTable);
        SourceUnit unit = unit("Invoke-Frobnicate", UnitShape.COMMAND, Map.of());

        // When
        MappingOutcome outcome = engine.map(unit, Classification.MUTATION);

        // Then
        assertThat(outcome).isInstanceOf(MappingOutcome.NoMatch.class);
        MappingOutcome.NoMatch noMatch = (MappingOutcome.NoMatch) outcome;
        assertThat(noMatch.reason()).isEqualTo("No mutation rule matches 'Invoke-Frobnicate'");
        assertThat(noMatch.remediation()).contains("'mutation' section").contains("version 1.0");
    }

    @Test
    void map_unknownCategory_throwsIllegalArgument() {
        engine = new MappingEngine(defaultTable);
        SourceUnit unit = unit("Invoke-Frobnicate", UnitShape.COMMAND, Map.of());

        assertThatThrownBy(() -> engine.map(unit, Classification.UNKNOWN))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("deploy.ps1:line 3");
    }

    @Test
    void map_guardedThrow_negatesConditionIntoAssert() {
        // Given: if ($CpuCount -gt 16) { throw "too many CPUs" }
        Map<String, ParameterValue> params = new LinkedHashMap<>();
        params.put("condition", ParameterValue.literal("$CpuCount -gt 16"));
        params.put("message", ParameterValue.quoted("too many CPUs"));
        engine = new MappingEngine(defaultTable);

        // When
        PartialTask task = ((MappingOutcome.Mapped) engine.map(unit(null, UnitShape.THROW, params),
            Classification.GATE)).task();

        // Then
        assertThat(task.ruleId()).isEqualTo("guarded-throw");
        assertThat(task.targetAction()).isEqualTo("ansible.builtin.assert");
        assertThat(task.params())
            .containsEntry("that", List.of("cpucount <= 16"))
            .containsEntry("fail_msg", "too many CPUs");
    }

    private static SourceUnit unit(String identifier, UnitShape shape, Map<String, ParameterValue> params) {
        return new SourceUnit("deploy.ps1", "line 3", 2, UnitKind.STATEMENT, shape, identifier, params, null,
            "raw statement");
    }
}
