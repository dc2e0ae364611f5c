package com.opstranslate.cli;

import com.opstranslate.core.model.Classification;
import com.opstranslate.core.parser.SourceParser;
import com.opstranslate.core.parser.SourceParserRegistry;
import com.opstranslate.core.renderer.OutputRenderer;
import com.opstranslate.core.rules.MappingRule;
import com.opstranslate.core.rules.RuleTable;
import com.opstranslate.core.rules.RuleTableLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to list available parsers, mapping rules or renderers.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ops-translate list parsers
 * ops-translate list rules --rules site-rules.yaml
 * ops-translate list renderers
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available parsers, rules, or renderers",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Type to list: parsers, rules, or renderers")
    private String type;

    @Option(names = {"-r", "--rules"}, description = "Rule table to list (default: built-in rules)")
    private Path rulesPath;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        int exitCode = switch (type.toLowerCase(Locale.ROOT)) {
            case "parsers", "parser" -> listParsers(out);
            case "rules", "rule" -> listRules(out);
            case "renderers", "renderer" -> listRenderers(out);
            default -> {
                log.error("Unknown type: {}. Use: parsers, rules, or renderers", type);
                yield 1;
            }
        };
        out.flush();
        return exitCode;
    }

    private int listParsers(PrintWriter out) {
        out.println("Available Parsers:");
        out.println();
        List<SourceParser> parsers = SourceParserRegistry.discover().parsers();
        for (SourceParser parser : parsers) {
            out.printf("  • %s (ID: %s)%n", parser.getDisplayName(), parser.getId());
            out.printf("    Source kind: %s%n", parser.getSourceKind().name().toLowerCase(Locale.ROOT));
            out.println();
        }
        if (parsers.isEmpty()) {
            out.println("  No parsers found.");
        }
        return 0;
    }

    private int listRules(PrintWriter out) {
        RuleTableLoader loader = new RuleTableLoader();
        RuleTable table = rulesPath != null ? loader.load(rulesPath) : loader.loadDefault();
        out.printf("Mapping Rules (version %s, %d rules):%n", table.version(), table.size());
        for (Classification category : Classification.values()) {
            List<MappingRule> rules = table.rulesFor(category);
            if (rules.isEmpty()) {
                continue;
            }
            out.println();
            out.println("  " + category.key() + ":");
            for (MappingRule rule : rules) {
                out.printf("    • %s -> %s%n", rule.id(), rule.targetAction());
                if (!rule.requiredProfilePaths().isEmpty()) {
                    out.printf("      requires: %s%n", String.join(", ", rule.requiredProfilePaths()));
                }
            }
        }
        return 0;
    }

    private int listRenderers(PrintWriter out) {
        out.println("Available Renderers:");
        out.println();
        boolean found = false;
        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            found = true;
            out.printf("  • %s%n", renderer.getId());
        }
        if (!found) {
            out.println("  No renderers found.");
        }
        return 0;
    }
}
