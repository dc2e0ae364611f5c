package com.opstranslate.core.renderer;

import com.opstranslate.core.emit.AnsibleTaskEmitter;
import com.opstranslate.core.model.MergedIntent;
import com.opstranslate.core.model.SourceIntent;
import com.opstranslate.core.report.GapReport;
import com.opstranslate.core.report.IntentSerializer;
import com.opstranslate.core.report.OutputFormat;
import com.opstranslate.core.pipeline.RunReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns the results of a run into the set of files to render.
 *
 * <p>Layout below the output directory:
 * <pre>
 * intents/&lt;source&gt;.intent.&lt;ext&gt;    one per translated source
 * tasks/&lt;source&gt;.tasks.yml           Ansible tasks per source
 * merged-intent.&lt;ext&gt;                 when a merged intent is given
 * tasks/merged.tasks.yml             when the merged intent may be emitted
 * gap-report.&lt;ext&gt;
 * </pre>
 */
public class RunOutputAssembler {

    private static final Logger log = LoggerFactory.getLogger(RunOutputAssembler.class);

    private final IntentSerializer serializer;
    private final AnsibleTaskEmitter emitter;

    public RunOutputAssembler() {
        this.serializer = new IntentSerializer();
        this.emitter = new AnsibleTaskEmitter(serializer);
    }

    /**
     * Assembles the output files of a run.
     *
     * @param run per-document outcomes
     * @param merged merged intent, or null to skip merge output
     * @param format intent and report format
     * @param acknowledgeConflicts true to emit merged tasks despite conflicts
     * @return files in a fixed order
     */
    public GeneratedOutput assemble(RunReport run, MergedIntent merged, OutputFormat format,
                                    boolean acknowledgeConflicts) {
        String mimeType = format == OutputFormat.JSON ? "application/json" : "application/yaml";
        List<GeneratedFile> files = new ArrayList<>();

        for (SourceIntent intent : run.intents()) {
            String base = fileSafe(intent.sourceName());
            files.add(new GeneratedFile("intents/" + base + ".intent." + format.extension(),
                serializer.serialize(intent, format), mimeType));
            files.add(new GeneratedFile("tasks/" + base + ".tasks.yml", emitter.render(intent), "application/yaml"));
        }

        if (merged != null) {
            files.add(new GeneratedFile("merged-intent." + format.extension(),
                serializer.serialize(merged, format), mimeType));
            if (!merged.hasConflicts() || acknowledgeConflicts) {
                files.add(new GeneratedFile("tasks/merged.tasks.yml",
                    emitter.render(merged, acknowledgeConflicts), "application/yaml"));
            } else {
                log.warn("Merged task list not written: {} unresolved conflicts", merged.conflicts().size());
            }
        }

        files.add(new GeneratedFile("gap-report." + format.extension(),
            serializer.serialize(GapReport.of(run, merged), format), mimeType));
        return new GeneratedOutput(files);
    }

    private static String fileSafe(String sourceName) {
        return sourceName.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
