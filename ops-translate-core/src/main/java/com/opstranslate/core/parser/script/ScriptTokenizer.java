package com.opstranslate.core.parser.script;

import com.opstranslate.core.parser.script.ScriptToken.Type;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits one script line into typed tokens.
 *
 * <p>Recognized forms:
 * <ul>
 *   <li>{@code New-VM}, {@code CreateVM}, {@code System.getModule} → identifier</li>
 *   <li>{@code -Name} → named parameter (also used for {@code -gt}-style operators)</li>
 *   <li>{@code "db01"}, {@code 'db01'} → quoted string</li>
 *   <li>{@code $vmName} → variable reference</li>
 *   <li>{@code 8}, {@code 8GB}, {@code -1} → number</li>
 * </ul>
 * A {@code #} outside a string ends the line. Stateless and thread-safe.
 */
public final class ScriptTokenizer {

    /**
     * Tokenizes a single line.
     *
     * @param line line text
     * @return tokens in order
     * @throws ScriptSyntaxException if a string is not terminated
     */
    public List<ScriptToken> tokenize(String line) throws ScriptSyntaxException {
        List<ScriptToken> tokens = new ArrayList<>();
        int i = 0;
        int length = line.length();
        while (i < length) {
            char c = line.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '#') {
                break;
            } else if (c == '"' || c == '\'') {
                i = readQuoted(line, i, tokens);
            } else if (c == '$' && i + 1 < length && isWordStart(line.charAt(i + 1))) {
                int end = scanVariable(line, i + 1);
                tokens.add(new ScriptToken(Type.VARIABLE_REFERENCE, line.substring(i + 1, end), i));
                i = end;
            } else if (c == '-' && i + 1 < length && Character.isLetter(line.charAt(i + 1))) {
                int end = scanWord(line, i + 1, false);
                String name = line.substring(i + 1, end);
                // -Confirm:$false
                if (name.endsWith(":")) {
                    name = name.substring(0, name.length() - 1);
                }
                tokens.add(new ScriptToken(Type.NAMED_PARAMETER, name, i));
                i = end;
            } else if (c == '-' && i + 1 < length && Character.isDigit(line.charAt(i + 1)) && !followsValue(tokens)) {
                int end = scanNumber(line, i + 1);
                tokens.add(new ScriptToken(Type.NUMBER, line.substring(i, end), i));
                i = end;
            } else if (Character.isDigit(c)) {
                int end = scanNumber(line, i);
                tokens.add(new ScriptToken(Type.NUMBER, line.substring(i, end), i));
                i = end;
            } else if (isWordStart(c)) {
                int end = scanWord(line, i, true);
                tokens.add(new ScriptToken(Type.IDENTIFIER, line.substring(i, end), i));
                i = end;
            } else {
                i = readPunctuation(line, i, tokens);
            }
        }
        return tokens;
    }

    private int readQuoted(String line, int start, List<ScriptToken> tokens) throws ScriptSyntaxException {
        char quote = line.charAt(start);
        StringBuilder text = new StringBuilder();
        int i = start + 1;
        while (i < line.length()) {
            char c = line.charAt(i);
            if (quote == '"' && c == '`' && i + 1 < line.length()) {
                text.append(line.charAt(i + 1));
                i += 2;
                continue;
            }
            if (c == quote) {
                // doubled quote inside the string
                if (i + 1 < line.length() && line.charAt(i + 1) == quote) {
                    text.append(quote);
                    i += 2;
                    continue;
                }
                tokens.add(new ScriptToken(Type.QUOTED_STRING, text.toString(), start));
                return i + 1;
            }
            text.append(c);
            i++;
        }
        throw new ScriptSyntaxException("unterminated string", start);
    }

    private int readPunctuation(String line, int i, List<ScriptToken> tokens) {
        char c = line.charAt(i);
        char next = i + 1 < line.length() ? line.charAt(i + 1) : '\0';
        String pair = "" + c + next;
        if (pair.equals("==") || pair.equals("!=") || pair.equals(">=") || pair.equals("<=")
            || pair.equals("&&") || pair.equals("||")) {
            tokens.add(new ScriptToken(Type.OPERATOR, pair, i));
            return i + 2;
        }
        Type type = switch (c) {
            case '(' -> Type.LEFT_PAREN;
            case ')' -> Type.RIGHT_PAREN;
            case '{' -> Type.LEFT_BRACE;
            case '}' -> Type.RIGHT_BRACE;
            case '[' -> Type.LEFT_BRACKET;
            case ']' -> Type.RIGHT_BRACKET;
            case ',' -> Type.COMMA;
            case '=' -> Type.EQUALS;
            case '|' -> Type.PIPE;
            case ';' -> Type.SEMICOLON;
            case '<', '>', '!' -> Type.OPERATOR;
            default -> Type.SYMBOL;
        };
        tokens.add(new ScriptToken(type, String.valueOf(c), i));
        return i + 1;
    }

    private boolean followsValue(List<ScriptToken> tokens) {
        if (tokens.isEmpty()) {
            return false;
        }
        ScriptToken last = tokens.get(tokens.size() - 1);
        return last.is(Type.NUMBER) || last.is(Type.VARIABLE_REFERENCE) || last.is(Type.RIGHT_PAREN);
    }

    private static boolean isWordStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static int scanWord(String line, int start, boolean allowDashAndDot) {
        int i = start;
        while (i < line.length()) {
            char c = line.charAt(i);
            if (Character.isLetterOrDigit(c) || c == '_' || c == ':') {
                i++;
            } else if (allowDashAndDot && (c == '-' || c == '.')
                && i + 1 < line.length() && Character.isLetter(line.charAt(i + 1))) {
                i++;
            } else {
                break;
            }
        }
        return i;
    }

    private static int scanVariable(String line, int start) {
        int i = start;
        while (i < line.length()) {
            char c = line.charAt(i);
            if (Character.isLetterOrDigit(c) || c == '_' || c == ':') {
                i++;
            } else if (c == '.' && i + 1 < line.length() && Character.isLetter(line.charAt(i + 1))) {
                i++;
            } else {
                break;
            }
        }
        return i;
    }

    private static int scanNumber(String line, int start) {
        int i = start;
        while (i < line.length() && (Character.isLetterOrDigit(line.charAt(i)) || line.charAt(i) == '.')) {
            i++;
        }
        return i;
    }
}
