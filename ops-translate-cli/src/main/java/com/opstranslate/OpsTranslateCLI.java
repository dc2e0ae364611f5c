package com.opstranslate;

import ch.qos.logback.classic.Level;
import com.opstranslate.cli.ListCommand;
import com.opstranslate.cli.TranslateCommand;
import com.opstranslate.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for ops-translate.
 *
 * <p>ops-translate turns provisioning scripts and orchestration workflow exports into
 * normalized intents, a gap report and Ansible task lists.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code translate} - Translate scripts and workflows</li>
 *   <li>{@code list} - List available parsers, rules or renderers</li>
 *   <li>{@code validate} - Validate a rule table and a profile</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * ops-translate translate provision.ps1 create-vm.xml --profile profile.yml
 * ops-translate -v list rules
 * }</pre>
 */
@Command(
    name = "ops-translate",
    mixinStandardHelpOptions = true,
    version = "ops-translate 1.0.0-SNAPSHOT",
    description = "Translates provisioning scripts and workflows into configuration-management tasks",
    subcommands = {
        TranslateCommand.class,
        ListCommand.class,
        ValidateCommand.class
    }
)
public class OpsTranslateCLI implements Runnable {

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)",
        scope = CommandLine.ScopeType.INHERIT)
    void setVerbose(boolean verbose) {
        this.verbose = verbose;
        configureLogging();
    }

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors",
        scope = CommandLine.ScopeType.INHERIT)
    void setQuiet(boolean quiet) {
        this.quiet = quiet;
        configureLogging();
    }

    private boolean verbose;
    private boolean quiet;

    @Override
    public void run() {
        CommandLine.usage(this, System.out);
    }

    /**
     * Configures logging level based on global options.
     */
    private void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = new CommandLine(new OpsTranslateCLI()).execute(args);
        System.exit(exitCode);
    }
}
