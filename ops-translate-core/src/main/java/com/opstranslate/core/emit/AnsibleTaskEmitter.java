package com.opstranslate.core.emit;

import com.opstranslate.core.model.MergedIntent;
import com.opstranslate.core.model.ResolvedTask;
import com.opstranslate.core.model.SourceIntent;
import com.opstranslate.core.report.IntentSerializer;
import com.opstranslate.core.report.OutputFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders resolved tasks as an Ansible task list.
 *
 * <p>Resolved tasks become {@code - name: ... / <module>: params}. Blocked tasks become
 * {@code ansible.builtin.fail} tasks carrying the remediation text, so a playbook run
 * stops at the exact point that still needs configuration.
 */
public class AnsibleTaskEmitter {

    private static final Logger log = LoggerFactory.getLogger(AnsibleTaskEmitter.class);

    static final String FAIL_MODULE = "ansible.builtin.fail";
    static final String BLOCKED_TAG = "blocked";

    private final IntentSerializer serializer;

    public AnsibleTaskEmitter() {
        this(new IntentSerializer());
    }

    public AnsibleTaskEmitter(IntentSerializer serializer) {
        this.serializer = serializer;
    }

    /**
     * Builds the task list of one source.
     *
     * @param intent source intent
     * @return task list in unit order
     */
    public List<Map<String, Object>> tasks(SourceIntent intent) {
        return intent.tasks().stream().map(this::task).toList();
    }

    /**
     * Builds the task list of a merged intent.
     *
     * @param merged merged intent
     * @param acknowledgeConflicts true to emit despite conflict records
     * @return tasks of every source, sources in name order
     * @throws UnresolvedConflictsException if the intent has conflicts and they are not acknowledged
     */
    public List<Map<String, Object>> tasks(MergedIntent merged, boolean acknowledgeConflicts) {
        if (merged.hasConflicts()) {
            if (!acknowledgeConflicts) {
                throw new UnresolvedConflictsException(merged.conflicts());
            }
            log.warn("Emitting merged intent with {} acknowledged conflicts", merged.conflicts().size());
        }
        return merged.allTasks().stream().map(this::task).toList();
    }

    /**
     * Renders a source intent as an Ansible tasks file.
     *
     * @param intent source intent
     * @return YAML task list
     */
    public String render(SourceIntent intent) {
        return header(intent.sourceName()) + serializer.write(tasks(intent), OutputFormat.YAML);
    }

    /**
     * Renders a merged intent as an Ansible tasks file.
     *
     * @param merged merged intent
     * @param acknowledgeConflicts true to emit despite conflict records
     * @return YAML task list
     * @throws UnresolvedConflictsException if the intent has conflicts and they are not acknowledged
     */
    public String render(MergedIntent merged, boolean acknowledgeConflicts) {
        return header(String.join(", ", merged.sources()))
            + serializer.write(tasks(merged, acknowledgeConflicts), OutputFormat.YAML);
    }

    private Map<String, Object> task(ResolvedTask task) {
        Map<String, Object> node = new LinkedHashMap<>();
        List<String> tags = new ArrayList<>(task.tags());
        if (task.isBlocked()) {
            node.put("name", "BLOCKED: " + task.name());
            node.put(FAIL_MODULE, Map.of("msg", task.blockedReason()));
            tags.add(BLOCKED_TAG);
        } else {
            node.put("name", task.name());
            node.put(task.targetAction(), task.params());
        }
        if (!tags.isEmpty()) {
            node.put("tags", tags);
        }
        return node;
    }

    private static String header(String sources) {
        return "# Generated by ops-translate from " + sources + "\n";
    }
}
