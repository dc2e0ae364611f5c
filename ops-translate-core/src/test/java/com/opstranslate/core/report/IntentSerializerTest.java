package com.opstranslate.core.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opstranslate.core.model.Classification;
import com.opstranslate.core.model.Gap;
import com.opstranslate.core.model.GapType;
import com.opstranslate.core.model.InputDefinition;
import com.opstranslate.core.model.IntentField;
import com.opstranslate.core.model.Requirement;
import com.opstranslate.core.model.ResolvedTask;
import com.opstranslate.core.model.SourceIntent;
import com.opstranslate.core.model.SourceKind;
import com.opstranslate.core.model.TaskStatus;
import com.opstranslate.core.model.UnitReference;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link IntentSerializer}.
 */
class IntentSerializerTest {

    private final IntentSerializer serializer = new IntentSerializer();

    @Test
    void serialize_sameIntentTwice_isByteIdentical() {
        // Given
        SourceIntent intent = sampleIntent();

        // When
        String first = serializer.serialize(intent, OutputFormat.YAML);
        String second = new IntentSerializer().serialize(sampleIntent(), OutputFormat.YAML);

        // Then
        assertThat(first).isEqualTo(second);
        assertThat(first).doesNotStartWith("---").endsWith("\n");
    }

    @Test
    void serialize_yaml_writesTopLevelKeysInFixedOrder() {
        String yaml = serializer.serialize(sampleIntent(), OutputFormat.YAML);

        assertThat(yaml.indexOf("source:")).isLessThan(yaml.indexOf("kind:"));
        assertThat(yaml.indexOf("kind:")).isLessThan(yaml.indexOf("inputs:"));
        assertThat(yaml.indexOf("inputs:")).isLessThan(yaml.indexOf("requirements:"));
        assertThat(yaml.indexOf("requirements:")).isLessThan(yaml.indexOf("tasks:"));
        assertThat(yaml.indexOf("tasks:")).isLessThan(yaml.indexOf("gaps:"));
        assertThat(yaml).contains("memory: 8Gi");
    }

    @Test
    void serialize_json_writesTaskAndGapFields() throws Exception {
        // When
        JsonNode root = new ObjectMapper().readTree(serializer.serialize(sampleIntent(), OutputFormat.JSON));

        // Then
        assertThat(root.get("source").asText()).isEqualTo("provision.ps1");
        assertThat(root.get("kind").asText()).isEqualTo("script");
        JsonNode task = root.get("tasks").get(0);
        assertThat(task.get("action").asText()).isEqualTo("kubevirt.core.kubevirt_vm");
        assertThat(task.get("status").asText()).isEqualTo("resolved");
        assertThat(task.get("source").asText()).isEqualTo("provision.ps1:line 5");
        assertThat(task.get("params").get("memory").asText()).isEqualTo("8Gi");
        assertThat(task.has("blocked_reason")).isFalse();
        JsonNode gap = root.get("gaps").get(0);
        assertThat(gap.get("type").asText()).isEqualTo("unknown");
        assertThat(gap.get("evidence").asText()).isEqualTo("Frobnicate the widget");
        assertThat(root.get("requirements").get(0).get("field").asText()).isEqualTo("memory_gb");
        assertThat(root.get("inputs").get(0).has("default")).isFalse();
    }

    @Test
    void fromString_acceptsYmlAndRejectsUnknown() {
        assertThat(OutputFormat.fromString("YML")).isEqualTo(OutputFormat.YAML);
        assertThat(OutputFormat.fromString(" json ")).isEqualTo(OutputFormat.JSON);
        assertThat(OutputFormat.JSON.extension()).isEqualTo("json");
        assertThatThrownBy(() -> OutputFormat.fromString("xml"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("xml");
    }

    static SourceIntent sampleIntent() {
        UnitReference createRef = new UnitReference("provision.ps1", "line 5", "New-VM -Name db01 -MemoryGB 8");
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("name", "db01");
        params.put("memory", "8Gi");
        ResolvedTask create = new ResolvedTask(createRef, "create-vm", Classification.MUTATION, "Create VM db01",
            "kubevirt.core.kubevirt_vm", params, List.of("provision"), TaskStatus.RESOLVED, null, List.of());
        Gap gap = Gap.of(new UnitReference("provision.ps1", "line 7", "Frobnicate the widget"),
            GapType.UNCLASSIFIED, "Statement form is not recognized", "Review the original line manually");
        return new SourceIntent("provision.ps1", SourceKind.SCRIPT, List.of(create), List.of(gap),
            List.of(new InputDefinition("VmName", "string", true, null, null)),
            List.of(new Requirement(IntentField.MEMORY_GB, 8, "provision.ps1:line 5")));
    }
}
