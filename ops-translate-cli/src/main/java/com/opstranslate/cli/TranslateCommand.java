package com.opstranslate.cli;

import com.opstranslate.core.config.ConfigLoader;
import com.opstranslate.core.config.TranslatorConfig;
import com.opstranslate.core.merge.FirstSeenPolicy;
import com.opstranslate.core.merge.IntentMerger;
import com.opstranslate.core.model.Gap;
import com.opstranslate.core.model.GapType;
import com.opstranslate.core.model.MergedIntent;
import com.opstranslate.core.model.SourceDocument;
import com.opstranslate.core.model.UnitReference;
import com.opstranslate.core.parser.SourceParserRegistry;
import com.opstranslate.core.pipeline.ParallelTranslator;
import com.opstranslate.core.pipeline.RunReport;
import com.opstranslate.core.pipeline.TranslationOutcome;
import com.opstranslate.core.pipeline.TranslationPipeline;
import com.opstranslate.core.profile.Profile;
import com.opstranslate.core.profile.ProfileLoader;
import com.opstranslate.core.renderer.GeneratedOutput;
import com.opstranslate.core.renderer.OutputRenderer;
import com.opstranslate.core.renderer.RenderContext;
import com.opstranslate.core.renderer.RunOutputAssembler;
import com.opstranslate.core.report.GapReport;
import com.opstranslate.core.report.OutputFormat;
import com.opstranslate.core.rules.RuleTable;
import com.opstranslate.core.rules.RuleTableLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.stream.Stream;

/**
 * Command to translate scripts and workflow exports.
 *
 * <p>Runs the full pipeline:
 * <ol>
 *   <li>Load configuration, rule table and profile</li>
 *   <li>Read the given files (directories are searched for supported files)</li>
 *   <li>Translate each file on the worker pool</li>
 *   <li>Merge the translated intents</li>
 *   <li>Render intents, task lists and the gap report</li>
 * </ol>
 *
 * <p><b>Exit codes:</b> 0 when every file translated and the merge is conflict-free or
 * acknowledged, 1 on configuration or I/O errors, 2 when files failed or conflicts are
 * left unacknowledged.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ops-translate translate provision.ps1 workflows/ --profile profile.yml -o out
 *
 * # Print everything instead of writing files
 * ops-translate translate provision.ps1 --dry-run
 * }</pre>
 */
@Command(
    name = "translate",
    description = "Translate scripts and workflows into intents, task lists and a gap report",
    mixinStandardHelpOptions = true
)
public class TranslateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(TranslateCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_INCOMPLETE = 2;

    @Spec
    private CommandSpec spec;

    @Parameters(arity = "1..*", description = "Script or workflow files, or directories containing them")
    private List<Path> inputs;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: ops-translate.yaml)")
    private Path configPath = Path.of(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(names = {"-r", "--rules"}, description = "Rule table (overrides config, default: built-in rules)")
    private Path rulesPath;

    @Option(names = {"-p", "--profile"}, description = "Profile file (overrides config)")
    private Path profilePath;

    @Option(names = {"-o", "--output"}, description = "Output directory (overrides config)")
    private Path outputDir;

    @Option(names = {"-f", "--format"}, description = "Intent and report format: yaml or json (overrides config)")
    private String format;

    @Option(names = {"--first-seen"}, description = "Which source wins conflicting input definitions: ${COMPLETION-CANDIDATES}")
    private FirstSeenPolicy firstSeen;

    @Option(names = {"--acknowledge-conflicts"}, description = "Emit the merged task list despite merge conflicts")
    private boolean acknowledgeConflicts;

    @Option(names = {"--dry-run"}, description = "Print the generated files instead of writing them")
    private boolean dryRun;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try {
            TranslatorConfig config = ConfigLoader.load(configPath);
            OutputFormat outputFormat = format != null
                ? OutputFormat.fromString(format)
                : config.output().outputFormat();

            RuleTable rules = loadRules(config);
            Profile profile = new ProfileLoader().load(profilePath != null
                ? profilePath
                : Path.of(config.translation().profile()));
            SourceParserRegistry parsers = SourceParserRegistry.discover();

            List<Path> files = collectFiles(parsers);
            if (files.isEmpty()) {
                spec.commandLine().getErr().println("No supported files found in " + inputs);
                return EXIT_ERROR;
            }

            RunReport run = translate(files, new TranslationPipeline(rules, profile, parsers),
                config.translation().parallelism());

            MergedIntent merged = null;
            if (!run.intents().isEmpty()) {
                FirstSeenPolicy policy = firstSeen != null ? firstSeen : config.merge().firstSeen();
                merged = new IntentMerger(policy).merge(run.intents());
            }

            GeneratedOutput output = new RunOutputAssembler().assemble(run, merged, outputFormat, acknowledgeConflicts);
            String directory = outputDir != null ? outputDir.toString() : config.output().directory();
            render(output, new RenderContext(directory, Map.of()));

            printSummary(out, run, merged, directory);
            boolean blockedByConflicts = merged != null && merged.hasConflicts() && !acknowledgeConflicts;
            return run.hasFailures() || blockedByConflicts ? EXIT_INCOMPLETE : EXIT_OK;
        } catch (IOException | RuntimeException e) {
            log.error("Translation failed", e);
            spec.commandLine().getErr().println("✗ Translation failed: " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    // ==================== Inputs ====================

    private RuleTable loadRules(TranslatorConfig config) {
        RuleTableLoader loader = new RuleTableLoader();
        if (rulesPath != null) {
            return loader.load(rulesPath);
        }
        if (config.translation().rules() != null) {
            return loader.load(Path.of(config.translation().rules()));
        }
        return loader.loadDefault();
    }

    private List<Path> collectFiles(SourceParserRegistry parsers) throws IOException {
        List<Path> files = new ArrayList<>();
        for (Path input : inputs) {
            if (Files.isDirectory(input)) {
                try (Stream<Path> walk = Files.walk(input)) {
                    walk.filter(Files::isRegularFile)
                        .filter(path -> parsers.parserFor(new SourceDocument(path.getFileName().toString(), "")).isPresent())
                        .sorted()
                        .forEach(files::add);
                }
            } else if (Files.isRegularFile(input)) {
                files.add(input);
            } else {
                throw new IOException("File not found: " + input);
            }
        }

        Set<String> names = new HashSet<>();
        for (Path file : files) {
            if (!names.add(file.getFileName().toString())) {
                throw new IOException("Two input files share the name " + file.getFileName()
                    + "; source names must be unique within a run");
            }
        }
        log.debug("Collected {} files", files.size());
        return files;
    }

    private RunReport translate(List<Path> files, TranslationPipeline pipeline, int parallelism) throws IOException {
        List<SourceDocument> documents = new ArrayList<>();
        List<TranslationOutcome> unreadable = new ArrayList<>();
        for (Path file : files) {
            String name = file.getFileName().toString();
            try {
                documents.add(new SourceDocument(name, readUtf8(file)));
            } catch (CharacterCodingException e) {
                log.error("{} is not valid UTF-8", file);
                unreadable.add(TranslationOutcome.failed(name, Gap.of(new UnitReference(name, "document", ""),
                    GapType.STRUCTURAL, "Document is not valid UTF-8", "Re-save the file as UTF-8")));
            }
        }

        RunReport run;
        try (ParallelTranslator translator = new ParallelTranslator(pipeline, parallelism)) {
            run = translator.translateAll(documents);
        }
        if (unreadable.isEmpty()) {
            return run;
        }
        List<TranslationOutcome> outcomes = new ArrayList<>(run.outcomes());
        outcomes.addAll(unreadable);
        return new RunReport(outcomes);
    }

    private static String readUtf8(Path file) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        return StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT)
            .decode(ByteBuffer.wrap(bytes))
            .toString();
    }

    // ==================== Output ====================

    private void render(GeneratedOutput output, RenderContext context) {
        String rendererId = dryRun ? "console" : "filesystem";
        OutputRenderer renderer = ServiceLoader.load(OutputRenderer.class).stream()
            .map(ServiceLoader.Provider::get)
            .filter(candidate -> candidate.getId().equals(rendererId))
            .findFirst()
            .orElseThrow(() -> new IllegalStateException("Renderer not available: " + rendererId));
        log.debug("Rendering {} files with {}", output.files().size(), rendererId);
        renderer.render(output, context);
    }

    private void printSummary(PrintWriter out, RunReport run, MergedIntent merged, String directory) {
        out.printf("✓ Translated %d of %d files%n", run.intents().size(), run.outcomes().size());
        run.failures().forEach(failure ->
            out.printf("✗ %s: %s%n", failure.unit().sourceName(), failure.reason()));
        run.skipped().forEach(name -> out.printf("- %s: skipped%n", name));

        GapReport report = GapReport.of(run, merged);
        report.countsByType().forEach((type, count) -> {
            if (count > 0) {
                out.printf("  %s: %d%n", type.key(), count);
            }
        });

        if (merged != null && merged.hasConflicts()) {
            out.printf("! %d merge conflicts%s%n", merged.conflicts().size(),
                acknowledgeConflicts ? " (acknowledged)" : "; merged task list not written, see gap report");
        }
        if (!dryRun) {
            out.println("✓ Output written to: " + directory);
        }
        out.flush();
    }
}
