package com.opstranslate.core.pipeline;

import com.opstranslate.core.model.Gap;
import com.opstranslate.core.merge.IntentMerger;
import com.opstranslate.core.model.GapType;
import com.opstranslate.core.model.IntentField;
import com.opstranslate.core.model.MergedIntent;
import com.opstranslate.core.model.ResolvedTask;
import com.opstranslate.core.model.SourceDocument;
import com.opstranslate.core.model.SourceIntent;
import com.opstranslate.core.model.SourceKind;
import com.opstranslate.core.model.TaskStatus;
import com.opstranslate.core.parser.SourceParserRegistry;
import com.opstranslate.core.profile.Profile;
import com.opstranslate.core.rules.RuleTable;
import com.opstranslate.core.rules.RuleTableLoader;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests for {@link TranslationPipeline} with the built-in rules and parsers.
 */
class TranslationPipelineTest {

    private static final String PROVISION_SCRIPT = """
        param(
            [Parameter(Mandatory=$true)][string]$VmName,
            [int]$CpuCount = 2
        )
        $vm = New-VM -Name $VmName -NumCpu $CpuCount -MemoryGB 8 | Start-VM
        if ($CpuCount -gt 16) { throw "Too many CPUs" }
        Frobnicate the widget
        """;

    private static final String NETWORK_WORKFLOW = """
        <workflow root-name="item1">
          <input>
            <param name="vmName" type="string"/>
          </input>
          <workflow-item name="item1" type="task" out-name="item0">
            <display-name>Attach network</display-name>
            <script>System.getModule("com.acme.net").AttachNetworkAdapter(vm, network);</script>
            <in-binding>
              <bind name="vm" type="string" export-name="vmName"/>
              <bind name="network" type="string" export-name="networkName"/>
            </in-binding>
          </workflow-item>
          <workflow-item name="item0" type="end"/>
        </workflow>
        """;

    private static RuleTable rules;

    @BeforeAll
    static void loadRules() {
        rules = new RuleTableLoader().loadDefault();
    }

    @Test
    void translate_provisionScript_accountsForEveryUnit() {
        // Given
        TranslationPipeline pipeline = pipeline(Profile.empty("profile"));

        // When
        TranslationOutcome outcome = pipeline.translate(new SourceDocument("provision.ps1", PROVISION_SCRIPT));

        // Then
        assertThat(outcome.status()).isEqualTo(TranslationOutcome.Status.TRANSLATED);
        SourceIntent intent = outcome.intent();
        assertThat(intent.kind()).isEqualTo(SourceKind.SCRIPT);
        assertThat(intent.unitCount()).isEqualTo(5);
        assertThat(intent.tasks()).extracting(ResolvedTask::ruleId)
            .containsExactly("declare-input", "declare-input", "create-vm", "guarded-throw");
        assertThat(intent.inputs()).hasSize(2);
    }

    @Test
    void translate_newVmWithMemory_rendersGibibytes() {
        TranslationOutcome outcome = pipeline(Profile.empty("profile"))
            .translate(new SourceDocument("provision.ps1", PROVISION_SCRIPT));

        ResolvedTask create = outcome.intent().tasks().get(2);
        assertThat(create.targetAction()).isEqualTo("kubevirt.core.kubevirt_vm");
        assertThat(create.params()).containsEntry("memory", "8Gi");
        assertThat(create.status()).isEqualTo(TaskStatus.RESOLVED);
    }

    @Test
    void translate_unrecognizedLine_becomesUnclassifiedGap() {
        TranslationOutcome outcome = pipeline(Profile.empty("profile"))
            .translate(new SourceDocument("provision.ps1", PROVISION_SCRIPT));

        assertThat(outcome.intent().gaps()).hasSize(1);
        Gap gap = outcome.intent().gaps().get(0);
        assertThat(gap.type()).isEqualTo(GapType.UNCLASSIFIED);
        assertThat(gap.unit().location()).isEqualTo("line 7");
        assertThat(gap.unit().rawText()).isEqualTo("Frobnicate the widget");
    }

    @Test
    void translate_networkAdapterWithoutProfile_isBlocked() {
        // When
        TranslationOutcome outcome = pipeline(Profile.empty("profile"))
            .translate(new SourceDocument("network.xml", NETWORK_WORKFLOW));

        // Then
        SourceIntent intent = outcome.intent();
        assertThat(intent.kind()).isEqualTo(SourceKind.WORKFLOW);
        assertThat(intent.blockedTasks()).hasSize(1);
        ResolvedTask task = intent.blockedTasks().get(0);
        assertThat(task.missingProfilePaths()).containsExactly("network_security.model");
        assertThat(task.blockedReason())
            .contains("network_security.model")
            .contains("network.xml:item1")
            .contains("TO FIX: Add to profile.yml:");
    }

    @Test
    void translate_networkAdapterWithProfile_isResolved() {
        Profile profile = new Profile("prod", Map.<String, Object>of("network_security", Map.of("model", "calico")));

        TranslationOutcome outcome = pipeline(profile).translate(new SourceDocument("network.xml", NETWORK_WORKFLOW));

        assertThat(outcome.intent().blockedTasks()).isEmpty();
        assertThat(outcome.intent().tasks()).extracting(ResolvedTask::ruleId)
            .containsExactly("declare-input", "network-adapter");
        assertThat(outcome.intent().tasks().get(1).params()).containsEntry("network_policy", "calico");
    }

    @Test
    void translate_callFormCreateVm_rendersMemoryAndName() {
        // When
        TranslationOutcome outcome = pipeline(Profile.empty("profile"))
            .translate(new SourceDocument("calls.ps1", "CreateVM(name=\"db01\", memoryGB=8)"));

        // Then
        assertThat(outcome.intent().tasks()).hasSize(1);
        ResolvedTask create = outcome.intent().tasks().get(0);
        assertThat(create.ruleId()).isEqualTo("create-vm");
        assertThat(create.status()).isEqualTo(TaskStatus.RESOLVED);
        assertThat(create.params()).containsEntry("name", "db01").containsEntry("memory", "8Gi");
    }

    @Test
    void translate_callFormAttachNetworkWithoutProfile_isBlockedOnNetworkModel() {
        // When
        TranslationOutcome outcome = pipeline(Profile.empty("profile"))
            .translate(new SourceDocument("calls.ps1", "AttachNetworkAdapter(vm=\"db01\", network=\"prod\")"));

        // Then
        SourceIntent intent = outcome.intent();
        assertThat(intent.tasks()).hasSize(1);
        ResolvedTask attach = intent.tasks().get(0);
        assertThat(attach.ruleId()).isEqualTo("network-adapter");
        assertThat(attach.status()).isEqualTo(TaskStatus.BLOCKED);
        assertThat(attach.name()).isEqualTo("Attach network prod to VM db01");
        assertThat(attach.params()).containsEntry("name", "db01")
            .containsEntry("networks", List.of(Map.of("name", "prod")));
        assertThat(attach.blockedReason()).contains("network_security.model");
    }

    @Test
    void translate_sameDocumentTwice_givesEqualIntents() {
        TranslationPipeline pipeline = pipeline(Profile.empty("profile"));
        SourceDocument document = new SourceDocument("provision.ps1", PROVISION_SCRIPT);

        assertThat(pipeline.translate(document)).isEqualTo(pipeline.translate(document));
    }

    @Test
    void translate_cyclicWorkflow_failsWithStructuralGap() {
        // Given
        String xml = """
            <workflow>
              <workflow-item name="a" type="task" out-name="b"><script>x = 1;</script></workflow-item>
              <workflow-item name="b" type="task" out-name="a"><script>y = 2;</script></workflow-item>
            </workflow>
            """;

        // When
        TranslationOutcome outcome = pipeline(Profile.empty("profile")).translate(new SourceDocument("cycle.xml", xml));

        // Then
        assertThat(outcome.status()).isEqualTo(TranslationOutcome.Status.FAILED);
        assertThat(outcome.intentIfTranslated()).isEmpty();
        assertThat(outcome.failure().type()).isEqualTo(GapType.STRUCTURAL);
        assertThat(outcome.failure().remediation()).contains("a, b");
    }

    @Test
    void translate_multiStatementTaskScript_emitsTaskPerStatement() {
        // Given
        String xml = """
            <workflow root-name="item1">
              <workflow-item name="item1" type="task" out-name="item0">
                <script>System.log("Sizing VM");
            if (cpuCount &gt; 16) { throw "Too many CPUs"; }
            vmSize = "large";</script>
              </workflow-item>
              <workflow-item name="item0" type="end"/>
            </workflow>
            """;

        // When
        SourceIntent intent = pipeline(Profile.empty("profile"))
            .translate(new SourceDocument("sizing.xml", xml)).intent();

        // Then
        assertThat(intent.gaps()).isEmpty();
        assertThat(intent.tasks()).extracting(ResolvedTask::ruleId)
            .containsExactly("system-log", "guarded-throw", "set-variable");
        assertThat(intent.tasks().get(0).params()).containsEntry("msg", "Sizing VM");
        assertThat(intent.tasks().get(1).params()).containsEntry("that", List.of("cpuCount <= 16"));
        assertThat(intent.tasks().get(2).params()).containsEntry("vmsize", "large");
    }

    @Test
    void translate_duplicateWorkflowItems_failsWithStructuralGap() {
        // Given
        String xml = """
            <workflow>
              <workflow-item name="item1" type="task"><script>x = 1;</script></workflow-item>
              <workflow-item name="item1" type="task"><script>y = 2;</script></workflow-item>
            </workflow>
            """;

        // When
        TranslationOutcome outcome = pipeline(Profile.empty("profile")).translate(new SourceDocument("dup.xml", xml));

        // Then
        assertThat(outcome.status()).isEqualTo(TranslationOutcome.Status.FAILED);
        assertThat(outcome.failure().type()).isEqualTo(GapType.STRUCTURAL);
        assertThat(outcome.failure().reason()).contains("'item1' is declared more than once");
    }

    @Test
    void translateAndMerge_scriptsDeclaringCpuCountInput_takeMaximumWithoutConflict() {
        // Given
        TranslationPipeline pipeline = pipeline(Profile.empty("profile"));
        SourceIntent small = pipeline.translate(new SourceDocument("small.ps1", "param([int]$cpu_count = 2)")).intent();
        SourceIntent large = pipeline.translate(new SourceDocument("large.ps1", "param([int]$cpu_count = 4)")).intent();

        // When
        MergedIntent merged = new IntentMerger().merge(List.of(small, large));

        // Then
        assertThat(merged.hasConflicts()).isFalse();
        assertThat(merged.fields()).containsEntry(IntentField.CPU_COUNT, 4);
        assertThat(merged.inputs().get("cpu_count").defaultValue()).isEqualTo("4");
    }

    @Test
    void translate_unsupportedExtension_fails() {
        TranslationOutcome outcome = pipeline(Profile.empty("profile"))
            .translate(new SourceDocument("notes.txt", "hello"));

        assertThat(outcome.status()).isEqualTo(TranslationOutcome.Status.FAILED);
        assertThat(outcome.failure().reason()).isEqualTo("No parser supports 'notes.txt'");
    }

    private static TranslationPipeline pipeline(Profile profile) {
        return new TranslationPipeline(rules, profile, SourceParserRegistry.discover());
    }
}
