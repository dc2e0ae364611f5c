package com.opstranslate.core.mapping;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the condition of a guarded throw into the assertion that must hold for the
 * automation to continue.
 *
 * <p>A single PowerShell ({@code -gt}, {@code -ge}, {@code -lt}, {@code -le}, {@code -eq},
 * {@code -ne}) or JavaScript ({@code >}, {@code >=}, {@code <}, {@code <=}, {@code ==},
 * {@code !=}, {@code ===}, {@code !==}) comparison is inverted in place; anything else is
 * wrapped as {@code not (...)}. PowerShell variables lose their sigil and are lowercased
 * to line up with the variable names produced by template rendering.
 */
final class ConditionNegator {

    private static final Pattern VARIABLE = Pattern.compile("\\$([A-Za-z_][\\w.]*)");
    private static final Pattern LOGICAL = Pattern.compile("(?i)\\s-(and|or|not|xor)\\s|&&|\\|\\||^\\s*!|^\\s*-not\\s");
    private static final Pattern POWERSHELL_COMPARISON = Pattern.compile("(?i)\\s-(gt|ge|lt|le|eq|ne)\\s");
    private static final Pattern SCRIPT_COMPARISON = Pattern.compile("===|!==|==|!=|>=|<=|>|<");

    private static final Map<String, String> POWERSHELL_INVERSE = Map.of(
        "gt", "<=",
        "ge", "<",
        "lt", ">=",
        "le", ">",
        "eq", "!=",
        "ne", "=="
    );

    private static final Map<String, String> SCRIPT_INVERSE = Map.of(
        "===", "!=",
        "!==", "==",
        "==", "!=",
        "!=", "==",
        ">=", "<",
        "<=", ">",
        ">", "<=",
        "<", ">="
    );

    private ConditionNegator() {
    }

    static String negate(String condition) {
        String expression = stripVariables(condition.strip());
        if (LOGICAL.matcher(expression).find()) {
            return "not (" + expression + ")";
        }

        Matcher powershell = POWERSHELL_COMPARISON.matcher(expression);
        if (powershell.find()) {
            int start = powershell.start();
            int end = powershell.end();
            String operator = powershell.group(1).toLowerCase(Locale.ROOT);
            if (!powershell.find()) {
                return expression.substring(0, start) + " " + POWERSHELL_INVERSE.get(operator) + " "
                    + expression.substring(end);
            }
            return "not (" + expression + ")";
        }

        Matcher script = SCRIPT_COMPARISON.matcher(expression);
        if (script.find()) {
            int start = script.start();
            int end = script.end();
            String operator = script.group();
            if (!script.find()) {
                return expression.substring(0, start).stripTrailing() + " " + SCRIPT_INVERSE.get(operator) + " "
                    + expression.substring(end).stripLeading();
            }
        }
        return "not (" + expression + ")";
    }

    private static String stripVariables(String expression) {
        Matcher matcher = VARIABLE.matcher(expression);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(result, Matcher.quoteReplacement(matcher.group(1).toLowerCase(Locale.ROOT)));
        }
        matcher.appendTail(result);
        return result.toString();
    }
}
