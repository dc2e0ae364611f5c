package com.opstranslate.cli;

import com.opstranslate.core.profile.Profile;
import com.opstranslate.core.profile.ProfileException;
import com.opstranslate.core.profile.ProfileLoader;
import com.opstranslate.core.rules.MappingRule;
import com.opstranslate.core.rules.RuleTable;
import com.opstranslate.core.rules.RuleTableException;
import com.opstranslate.core.rules.RuleTableLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Callable;

/**
 * Command to validate a rule table and, optionally, check a profile against it.
 *
 * <p>Exits with 1 when the rule table or profile cannot be loaded. Profile paths that rules
 * require but the profile lacks are listed as warnings: the matching tasks would be blocked.
 */
@Command(
    name = "validate",
    description = "Validate a rule table and check a profile against it",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Spec
    private CommandSpec spec;

    @Option(names = {"-r", "--rules"}, description = "Rule table to validate (default: built-in rules)")
    private Path rulesPath;

    @Option(names = {"-p", "--profile"}, description = "Profile to check against the rule table")
    private Path profilePath;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        RuleTableLoader loader = new RuleTableLoader();
        RuleTable table;
        try {
            table = rulesPath != null ? loader.load(rulesPath) : loader.loadDefault();
        } catch (RuleTableException e) {
            log.error("Invalid rule table: {}", e.getMessage());
            spec.commandLine().getErr().println("✗ " + e.getMessage());
            return 1;
        }
        out.printf("✓ Rule table version %s: %d rules%n", table.version(), table.size());

        if (profilePath != null) {
            Profile profile;
            try {
                profile = new ProfileLoader().load(profilePath);
            } catch (ProfileException e) {
                log.error("Invalid profile: {}", e.getMessage());
                spec.commandLine().getErr().println("✗ " + e.getMessage());
                return 1;
            }
            Set<String> missing = missingPaths(table, profile);
            if (missing.isEmpty()) {
                out.printf("✓ Profile %s provides every required path%n", profile.name());
            } else {
                out.printf("! Profile %s lacks %d paths; tasks needing them will be blocked:%n",
                    profile.name(), missing.size());
                missing.forEach(path -> out.println("    " + path));
            }
        }
        out.flush();
        return 0;
    }

    private static Set<String> missingPaths(RuleTable table, Profile profile) {
        Set<String> missing = new TreeSet<>();
        for (MappingRule rule : table.allRules()) {
            rule.requiredProfilePaths().stream()
                .filter(path -> !profile.contains(path))
                .forEach(missing::add);
        }
        return missing;
    }
}
