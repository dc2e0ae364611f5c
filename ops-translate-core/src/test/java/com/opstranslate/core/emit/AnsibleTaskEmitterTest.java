package com.opstranslate.core.emit;

import com.opstranslate.core.merge.IntentMerger;
import com.opstranslate.core.model.Classification;
import com.opstranslate.core.model.IntentField;
import com.opstranslate.core.model.MergedIntent;
import com.opstranslate.core.model.Requirement;
import com.opstranslate.core.model.ResolvedTask;
import com.opstranslate.core.model.SourceIntent;
import com.opstranslate.core.model.SourceKind;
import com.opstranslate.core.model.TaskStatus;
import com.opstranslate.core.model.UnitReference;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link AnsibleTaskEmitter}.
 */
class AnsibleTaskEmitterTest {

    private final AnsibleTaskEmitter emitter = new AnsibleTaskEmitter();

    @Test
    void tasks_resolvedTask_usesActionAsModuleKey() {
        // Given
        SourceIntent intent = intent("start.ps1", List.of(resolved("start.ps1")), List.of());

        // When
        List<Map<String, Object>> tasks = emitter.tasks(intent);

        // Then
        assertThat(tasks).hasSize(1);
        assertThat(tasks.get(0))
            .containsEntry("name", "Start VM web01")
            .containsEntry("kubevirt.core.kubevirt_vm", Map.of("name", "web01", "running", true))
            .doesNotContainKey("tags");
    }

    @Test
    void tasks_blockedTask_becomesFailTaskWithReason() {
        // Given
        SourceIntent intent = intent("net.xml", List.of(blocked("net.xml")), List.of());

        // When
        Map<String, Object> task = emitter.tasks(intent).get(0);

        // Then
        assertThat(task.get("name")).isEqualTo("BLOCKED: Attach network");
        assertThat(task).doesNotContainKey("kubevirt.core.kubevirt_vm");
        assertThat(task.get(AnsibleTaskEmitter.FAIL_MODULE))
            .isEqualTo(Map.of("msg", "BLOCKED: Attach network requires profile configuration that is not set."));
        assertThat(task.get("tags")).isEqualTo(List.of("network", AnsibleTaskEmitter.BLOCKED_TAG));
    }

    @Test
    void render_sourceIntent_writesHeaderAndYamlList() {
        String yaml = emitter.render(intent("start.ps1", List.of(resolved("start.ps1")), List.of()));

        assertThat(yaml).startsWith("# Generated by ops-translate from start.ps1\n");
        assertThat(yaml).contains("- name: Start VM web01").contains("kubevirt.core.kubevirt_vm:");
    }

    @Test
    void render_unacknowledgedConflicts_throws() {
        // Given
        MergedIntent merged = conflictingMerge();

        // When / Then
        assertThatThrownBy(() -> emitter.render(merged, false))
            .isInstanceOf(UnresolvedConflictsException.class)
            .hasMessageContaining("target_network")
            .satisfies(e -> assertThat(((UnresolvedConflictsException) e).getConflicts()).hasSize(1));
    }

    @Test
    void render_acknowledgedConflicts_emitsAllSources() {
        String yaml = emitter.render(conflictingMerge(), true);

        assertThat(yaml).startsWith("# Generated by ops-translate from a.ps1, b.ps1\n");
        assertThat(emitter.tasks(conflictingMerge(), true)).hasSize(2);
    }

    private static MergedIntent conflictingMerge() {
        SourceIntent a = intent("a.ps1", List.of(resolved("a.ps1")),
            List.of(new Requirement(IntentField.TARGET_NETWORK, "prod-net", "a.ps1:line 1")));
        SourceIntent b = intent("b.ps1", List.of(resolved("b.ps1")),
            List.of(new Requirement(IntentField.TARGET_NETWORK, "dev-net", "b.ps1:line 1")));
        return new IntentMerger().merge(List.of(a, b));
    }

    private static SourceIntent intent(String name, List<ResolvedTask> tasks, List<Requirement> requirements) {
        return new SourceIntent(name, SourceKind.SCRIPT, tasks, List.of(), List.of(), requirements);
    }

    private static ResolvedTask resolved(String source) {
        return new ResolvedTask(new UnitReference(source, "line 1", "Start-VM -VM web01"), "start-vm",
            Classification.MUTATION, "Start VM web01", "kubevirt.core.kubevirt_vm",
            Map.of("name", "web01", "running", true), List.of(), TaskStatus.RESOLVED, null, List.of());
    }

    private static ResolvedTask blocked(String source) {
        return new ResolvedTask(new UnitReference(source, "item1", "AttachNetworkAdapter(vm, network)"),
            "network-adapter", Classification.INTEGRATION, "Attach network", "kubevirt.core.kubevirt_vm",
            Map.of("name", "{{ vm }}"), List.of("network"), TaskStatus.BLOCKED,
            "BLOCKED: Attach network requires profile configuration that is not set.",
            List.of("network_security.model"));
    }
}
