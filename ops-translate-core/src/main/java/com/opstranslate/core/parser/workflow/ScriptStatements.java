package com.opstranslate.core.parser.workflow;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Splits the JavaScript body of a workflow task into top-level statements.
 *
 * <p>A statement ends at a semicolon or a line break outside brackets, or at the brace
 * that closes a top-level block unless {@code else}, {@code catch} or {@code finally}
 * follows. A line break does not end a statement when the line ends with, or the next
 * line starts with, an operator. Comments are dropped and string literals are kept intact.
 */
final class ScriptStatements {

    private static final String CONTINUATION_CHARS = "+-*/%=,.(&|?:<>!";
    private static final Set<String> BLOCK_CONTINUATIONS = Set.of("else", "catch", "finally");

    private ScriptStatements() {
    }

    /**
     * Splits a script body.
     *
     * @param script task script, may be null
     * @return statements in source order, without blank entries
     */
    static List<String> split(String script) {
        List<String> statements = new ArrayList<>();
        if (script == null) {
            return statements;
        }
        StringBuilder current = new StringBuilder();
        int depth = 0;
        char quote = 0;
        int length = script.length();
        int i = 0;

        while (i < length) {
            char c = script.charAt(i);

            if (quote != 0) {
                current.append(c);
                if (c == '\\' && i + 1 < length) {
                    current.append(script.charAt(i + 1));
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                i++;
                continue;
            }

            if (c == '/' && i + 1 < length && script.charAt(i + 1) == '/') {
                while (i < length && script.charAt(i) != '\n') {
                    i++;
                }
                continue;
            }
            if (c == '/' && i + 1 < length && script.charAt(i + 1) == '*') {
                int end = script.indexOf("*/", i + 2);
                i = end < 0 ? length : end + 2;
                continue;
            }

            if (c == '"' || c == '\'' || c == '`') {
                quote = c;
                current.append(c);
            } else if (c == '(' || c == '{' || c == '[') {
                depth++;
                current.append(c);
            } else if (c == ')' || c == '}' || c == ']') {
                depth = Math.max(0, depth - 1);
                current.append(c);
                if (c == '}' && depth == 0 && !continuesBlock(script, i + 1)) {
                    flush(statements, current);
                }
            } else if (c == ';' && depth == 0) {
                current.append(c);
                flush(statements, current);
            } else if (c == '\n' && depth == 0) {
                if (endsStatement(current, script, i + 1)) {
                    flush(statements, current);
                } else {
                    current.append(c);
                }
            } else {
                current.append(c);
            }
            i++;
        }
        flush(statements, current);
        return statements;
    }

    private static boolean continuesBlock(String script, int from) {
        String rest = script.substring(from).stripLeading();
        for (String keyword : BLOCK_CONTINUATIONS) {
            if (rest.startsWith(keyword)
                && (rest.length() == keyword.length() || !Character.isJavaIdentifierPart(rest.charAt(keyword.length())))) {
                return true;
            }
        }
        return false;
    }

    private static boolean endsStatement(StringBuilder current, String script, int nextLineStart) {
        String soFar = current.toString().strip();
        if (soFar.isEmpty()) {
            return false;
        }
        if (CONTINUATION_CHARS.indexOf(soFar.charAt(soFar.length() - 1)) >= 0) {
            return false;
        }
        String next = script.substring(nextLineStart).stripLeading();
        if (next.startsWith("{") || continuesBlock(next, 0)) {
            return false;
        }
        return next.isEmpty() || CONTINUATION_CHARS.indexOf(next.charAt(0)) < 0 || next.startsWith("//")
            || next.startsWith("/*") || next.startsWith("!") || next.startsWith("(");
    }

    private static void flush(List<String> statements, StringBuilder current) {
        String statement = current.toString().strip();
        if (!statement.isEmpty()) {
            statements.add(statement);
        }
        current.setLength(0);
    }
}
