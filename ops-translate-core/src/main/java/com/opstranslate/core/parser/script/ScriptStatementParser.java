package com.opstranslate.core.parser.script;

import com.opstranslate.core.model.InputDefinition;
import com.opstranslate.core.model.ParameterValue;
import com.opstranslate.core.model.SourceDocument;
import com.opstranslate.core.model.SourceKind;
import com.opstranslate.core.model.SourceUnit;
import com.opstranslate.core.model.UnitKind;
import com.opstranslate.core.model.UnitShape;
import com.opstranslate.core.parser.ParsedSource;
import com.opstranslate.core.parser.base.AbstractSourceParser;
import com.opstranslate.core.parser.script.ScriptToken.Type;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Parses imperative provisioning scripts (PowerCLI) into statement units.
 *
 * <p>Lines are processed strictly in order. Supported statement forms:
 * <ul>
 *   <li>Cmdlet form: {@code New-VM -Name "db01" -MemoryGB 8 | Start-VM}</li>
 *   <li>Call form: {@code CreateVM(name="db01", memoryGB=8)}</li>
 *   <li>Assignment: {@code $vm = Get-VM -Name $vmName}</li>
 *   <li>Parameter block: {@code param([int]$CpuCount = 2, ...)}, one input unit per parameter</li>
 *   <li>Guarded throw: {@code if ($MemoryGB -gt 64) { throw "too large" }}, on one or three lines</li>
 * </ul>
 *
 * <p>Comments, blank lines and lone braces produce no unit. A line that fails to tokenize
 * or has unbalanced parentheses becomes a {@link UnitShape#MALFORMED} unit; any other
 * line outside the grammar becomes {@link UnitShape#UNRECOGNIZED}. Neither aborts the parse.
 */
public class ScriptStatementParser extends AbstractSourceParser {

    private static final Pattern PARAM_BLOCK_START = Pattern.compile("(?i)^param\\s*\\(.*");
    private static final Pattern LONE_BRACES = Pattern.compile("^[{}\\s]+$");
    private static final Pattern SCRIPT_ATTRIBUTE = Pattern.compile("(?i)^\\[CmdletBinding(\\(.*\\))?]$");
    private static final Pattern CMDLET_NAME = Pattern.compile("[A-Za-z]+-[A-Za-z][\\w-]*");

    private static final String ASSIGNMENT_IDENTIFIER = "Set-Variable";
    private static final String INPUT_IDENTIFIER = "Input";
    private static final String THROW_IDENTIFIER = "throw";

    private static final Set<String> CONDITIONAL_KEYWORDS = Set.of("if", "elseif", "else", "switch");
    private static final Set<String> CONTROL_KEYWORDS = Set.of(
        "if", "elseif", "else", "switch", "foreach", "for", "while", "do", "until",
        "try", "catch", "finally", "function", "return", "break", "continue"
    );

    private final ScriptTokenizer tokenizer = new ScriptTokenizer();

    @Override
    public String getId() {
        return "powercli-script";
    }

    @Override
    public String getDisplayName() {
        return "PowerCLI Script Parser";
    }

    @Override
    public SourceKind getSourceKind() {
        return SourceKind.SCRIPT;
    }

    @Override
    protected Set<String> getSupportedExtensions() {
        return Set.of("ps1", "psm1");
    }

    @Override
    public ParsedSource parse(SourceDocument document) {
        ParseState state = new ParseState(document.name(), splitLines(document.content()));

        while (state.index < state.lines.length) {
            String trimmed = state.lines[state.index].strip();
            if (trimmed.isEmpty() || trimmed.startsWith("#") || LONE_BRACES.matcher(trimmed).matches()
                || SCRIPT_ATTRIBUTE.matcher(trimmed).matches()) {
                state.index++;
            } else if (trimmed.startsWith("<#")) {
                skipBlockComment(state);
            } else if (PARAM_BLOCK_START.matcher(trimmed).matches()) {
                parseParamBlock(state);
            } else {
                parseStatementLine(state);
            }
        }

        log.debug("Parsed {} units and {} inputs from {}", state.units.size(), state.inputs.size(), document.name());
        return new ParsedSource(document.name(), SourceKind.SCRIPT, state.units, state.inputs);
    }

    // ==================== Line Dispatch ====================

    private void skipBlockComment(ParseState state) {
        while (state.index < state.lines.length) {
            String line = state.lines[state.index++];
            if (line.contains("#>")) {
                return;
            }
        }
    }

    private void parseStatementLine(ParseState state) {
        int lineIndex = state.index;
        String line = state.lines[lineIndex];
        String location = lineLocation(lineIndex);
        state.index++;

        List<ScriptToken> tokens;
        try {
            tokens = tokenizer.tokenize(line);
        } catch (ScriptSyntaxException e) {
            log.debug("{}:{} is malformed: {}", state.sourceName, location, e.getMessage());
            state.add(SourceUnit.opaque(state.sourceName, location, state.units.size(),
                UnitKind.STATEMENT, UnitShape.MALFORMED, line));
            return;
        }
        if (tokens.isEmpty()) {
            return;
        }
        if (!parenthesesBalanced(tokens)) {
            state.add(SourceUnit.opaque(state.sourceName, location, state.units.size(),
                UnitKind.STATEMENT, UnitShape.MALFORMED, line));
            return;
        }

        ScriptToken first = tokens.get(0);
        if (first.isKeyword("if") && tryGuardedThrow(state, tokens, lineIndex)) {
            return;
        }
        state.add(parseStatement(state, tokens, line, location));
    }

    private SourceUnit parseStatement(ParseState state, List<ScriptToken> tokens, String line, String location) {
        int position = state.units.size();
        ScriptToken first = tokens.get(0);

        if (first.isKeyword(THROW_IDENTIFIER)) {
            Map<String, ParameterValue> params = new LinkedHashMap<>();
            ParameterValue message = valueAfter(tokens, 1, line);
            if (message != null) {
                params.put("message", message);
            }
            return unit(state, location, position, UnitShape.THROW, THROW_IDENTIFIER, params, null, line);
        }

        if (first.is(Type.VARIABLE_REFERENCE) && tokens.size() > 2 && tokens.get(1).is(Type.EQUALS)) {
            return parseAssignment(state, tokens, line, location, position);
        }

        if (first.is(Type.IDENTIFIER)) {
            String keyword = first.text().toLowerCase(Locale.ROOT);
            if (CONDITIONAL_KEYWORDS.contains(keyword)) {
                return unit(state, location, position, UnitShape.CONDITIONAL, keyword, Map.of(), null, line);
            }
            if (CONTROL_KEYWORDS.contains(keyword)) {
                return SourceUnit.opaque(state.sourceName, location, position,
                    UnitKind.STATEMENT, UnitShape.UNRECOGNIZED, line);
            }
            if (tokens.size() > 1 && tokens.get(1).is(Type.LEFT_PAREN)) {
                return parseCall(state, tokens, 0, line, location, position, Map.of());
            }
            if (CMDLET_NAME.matcher(first.text()).matches()) {
                return parseCommand(state, tokens, 0, line, location, position, Map.of());
            }
        }
        if (first.is(Type.RIGHT_BRACE) && tokens.size() > 1 && tokens.get(1).isKeyword("else")) {
            return unit(state, location, position, UnitShape.CONDITIONAL, "else", Map.of(), null, line);
        }

        return SourceUnit.opaque(state.sourceName, location, position,
            UnitKind.STATEMENT, UnitShape.UNRECOGNIZED, line);
    }

    // ==================== Statement Forms ====================

    private SourceUnit parseAssignment(ParseState state, List<ScriptToken> tokens, String line,
                                       String location, int position) {
        String variable = tokens.get(0).text();
        ScriptToken rhs = tokens.get(2);
        Map<String, ParameterValue> target = Map.of("variable", ParameterValue.literal(variable));

        if (rhs.is(Type.IDENTIFIER) && tokens.size() > 3 && tokens.get(3).is(Type.LEFT_PAREN)
            && !CONTROL_KEYWORDS.contains(rhs.text().toLowerCase(Locale.ROOT))) {
            return parseCall(state, tokens, 2, line, location, position, target);
        }
        if (rhs.is(Type.IDENTIFIER) && CMDLET_NAME.matcher(rhs.text()).matches()) {
            return parseCommand(state, tokens, 2, line, location, position, target);
        }

        Map<String, ParameterValue> params = new LinkedHashMap<>();
        params.put("Name", ParameterValue.literal(variable));
        if (tokens.size() == 3 && rhs.isValue()) {
            params.put("Value", toValue(rhs));
        } else {
            params.put("Value", ParameterValue.literal(line.substring(rhs.offset()).strip()));
        }
        return unit(state, location, position, UnitShape.ASSIGNMENT, ASSIGNMENT_IDENTIFIER, params, null, line);
    }

    private SourceUnit parseCommand(ParseState state, List<ScriptToken> tokens, int start, String line,
                                    String location, int position, Map<String, ParameterValue> extra) {
        Map<String, ParameterValue> params = new LinkedHashMap<>();
        String pipedTo = null;
        int positional = 0;
        int i = start + 1;
        while (i < tokens.size()) {
            ScriptToken token = tokens.get(i);
            if (token.is(Type.PIPE)) {
                pipedTo = nextIdentifier(tokens, i + 1);
                break;
            }
            if (token.is(Type.NAMED_PARAMETER)) {
                ValueRead read = readValue(tokens, i + 1, line);
                if (read == null) {
                    // switch parameter
                    params.put(token.text(), ParameterValue.literal("true"));
                    i++;
                } else {
                    params.put(token.text(), read.value());
                    i = read.next();
                }
                continue;
            }
            ValueRead read = readValue(tokens, i, line);
            if (read != null) {
                params.put("arg" + positional++, read.value());
                i = read.next();
            } else {
                i++;
            }
        }
        params.putAll(extra);
        return unit(state, location, position, UnitShape.COMMAND, tokens.get(start).text(), params, pipedTo, line);
    }

    private SourceUnit parseCall(ParseState state, List<ScriptToken> tokens, int start, String line,
                                 String location, int position, Map<String, ParameterValue> extra) {
        Map<String, ParameterValue> params = new LinkedHashMap<>();
        int close = matchingClose(tokens, start + 1, Type.LEFT_PAREN, Type.RIGHT_PAREN);
        int positional = 0;
        int i = start + 2;
        while (i < close) {
            ScriptToken token = tokens.get(i);
            if (token.is(Type.COMMA)) {
                i++;
                continue;
            }
            if ((token.is(Type.IDENTIFIER) || token.is(Type.QUOTED_STRING))
                && i + 1 < close && tokens.get(i + 1).is(Type.EQUALS)) {
                ValueRead read = readValue(tokens, i + 2, line, false);
                if (read != null) {
                    params.put(token.text(), read.value());
                    i = read.next();
                    continue;
                }
            }
            ValueRead read = readValue(tokens, i, line, false);
            if (read != null) {
                params.put("arg" + positional++, read.value());
                i = read.next();
            } else {
                i++;
            }
        }
        String pipedTo = null;
        if (close + 1 < tokens.size() && tokens.get(close + 1).is(Type.PIPE)) {
            pipedTo = nextIdentifier(tokens, close + 2);
        }
        params.putAll(extra);
        return unit(state, location, position, UnitShape.CALL, tokens.get(start).text(), params, pipedTo, line);
    }

    // ==================== Guarded Throw ====================

    private boolean tryGuardedThrow(ParseState state, List<ScriptToken> tokens, int lineIndex) {
        String line = state.lines[lineIndex];
        if (tokens.size() < 3 || !tokens.get(1).is(Type.LEFT_PAREN)) {
            return false;
        }
        int close = matchingClose(tokens, 1, Type.LEFT_PAREN, Type.RIGHT_PAREN);
        String condition = line.substring(tokens.get(1).offset() + 1, tokens.get(close).offset()).strip();
        int after = close + 1;

        // if (cond) { throw "msg" }
        if (after + 2 < tokens.size() && tokens.get(after).is(Type.LEFT_BRACE)
            && tokens.get(after + 1).isKeyword(THROW_IDENTIFIER)
            && tokens.get(tokens.size() - 1).is(Type.RIGHT_BRACE)) {
            ParameterValue message = valueAfter(tokens, after + 2, line);
            state.add(guardedThrow(state, lineIndex, condition, message, line));
            return true;
        }

        // if (cond) {
        //     throw "msg"
        // }
        if (after == tokens.size() - 1 && tokens.get(after).is(Type.LEFT_BRACE)) {
            int throwLine = nextContentLine(state, lineIndex + 1);
            if (throwLine < 0) {
                return false;
            }
            int closeLine = nextContentLine(state, throwLine + 1);
            if (closeLine < 0 || !state.lines[closeLine].strip().equals("}")) {
                return false;
            }
            List<ScriptToken> throwTokens;
            try {
                throwTokens = tokenizer.tokenize(state.lines[throwLine]);
            } catch (ScriptSyntaxException e) {
                log.debug("Throw body at {} does not tokenize: {}", lineLocation(throwLine), e.getMessage());
                return false;
            }
            if (throwTokens.isEmpty() || !throwTokens.get(0).isKeyword(THROW_IDENTIFIER)) {
                return false;
            }
            ParameterValue message = valueAfter(throwTokens, 1, state.lines[throwLine]);
            String raw = String.join("\n", line.strip(), state.lines[throwLine].strip(), "}");
            state.add(guardedThrow(state, lineIndex, condition, message, raw));
            state.index = closeLine + 1;
            return true;
        }
        return false;
    }

    private SourceUnit guardedThrow(ParseState state, int lineIndex, String condition,
                                    ParameterValue message, String raw) {
        Map<String, ParameterValue> params = new LinkedHashMap<>();
        params.put("condition", ParameterValue.literal(condition));
        if (message != null) {
            params.put("message", message);
        }
        return unit(state, lineLocation(lineIndex), state.units.size(), UnitShape.THROW,
            THROW_IDENTIFIER, params, null, raw);
    }

    private int nextContentLine(ParseState state, int from) {
        for (int i = from; i < state.lines.length; i++) {
            String trimmed = state.lines[i].strip();
            if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
                return i;
            }
        }
        return -1;
    }

    // ==================== Parameter Block ====================

    private void parseParamBlock(ParseState state) {
        int startLine = state.index;
        List<ScriptToken> tokens = new ArrayList<>();
        List<Integer> tokenLines = new ArrayList<>();
        int depth = 0;
        boolean opened = false;
        int lineIndex = startLine;

        while (lineIndex < state.lines.length) {
            List<ScriptToken> lineTokens;
            try {
                lineTokens = tokenizer.tokenize(state.lines[lineIndex]);
            } catch (ScriptSyntaxException e) {
                log.debug("Parameter block at {} is malformed: {}", lineLocation(startLine), e.getMessage());
                addMalformedBlock(state, startLine, lineIndex);
                return;
            }
            for (ScriptToken token : lineTokens) {
                if (token.is(Type.LEFT_PAREN)) {
                    depth++;
                    opened = true;
                } else if (token.is(Type.RIGHT_PAREN)) {
                    depth--;
                }
                tokens.add(token);
                tokenLines.add(lineIndex);
            }
            lineIndex++;
            if (opened && depth == 0) {
                break;
            }
        }

        if (!opened || depth != 0) {
            addMalformedBlock(state, startLine, lineIndex - 1);
            return;
        }
        state.index = lineIndex;

        // tokens: param ( entry , entry ... )
        int entryStart = 2;
        int nesting = 0;
        for (int i = 2; i < tokens.size(); i++) {
            ScriptToken token = tokens.get(i);
            if (token.is(Type.LEFT_PAREN) || token.is(Type.LEFT_BRACKET)) {
                nesting++;
            } else if (token.is(Type.RIGHT_BRACKET)) {
                nesting--;
            } else if (token.is(Type.RIGHT_PAREN)) {
                if (nesting == 0) {
                    addParameter(state, tokens.subList(entryStart, i), tokenLines.subList(entryStart, i));
                    break;
                }
                nesting--;
            } else if (token.is(Type.COMMA) && nesting == 0) {
                addParameter(state, tokens.subList(entryStart, i), tokenLines.subList(entryStart, i));
                entryStart = i + 1;
            }
        }
    }

    private void addParameter(ParseState state, List<ScriptToken> entry, List<Integer> entryLines) {
        String type = null;
        String name = null;
        String defaultValue = null;
        boolean mandatory = false;
        int nameLine = entryLines.isEmpty() ? state.index - 1 : entryLines.get(0);

        int i = 0;
        while (i < entry.size()) {
            ScriptToken token = entry.get(i);
            if (token.is(Type.LEFT_BRACKET)) {
                int close = matchingClose(entry, i, Type.LEFT_BRACKET, Type.RIGHT_BRACKET);
                List<ScriptToken> inner = entry.subList(i + 1, close);
                if (!inner.isEmpty() && inner.get(0).isKeyword("Parameter")) {
                    mandatory = mandatory || isMandatory(inner);
                } else if (inner.size() >= 1 && inner.get(0).is(Type.IDENTIFIER)
                    && (inner.size() == 1 || inner.get(1).is(Type.LEFT_BRACKET))) {
                    StringBuilder text = new StringBuilder();
                    inner.forEach(t -> text.append(t.text()));
                    type = text.toString();
                }
                i = close + 1;
            } else if (token.is(Type.VARIABLE_REFERENCE) && name == null) {
                name = token.text();
                nameLine = entryLines.get(i);
                i++;
            } else if (token.is(Type.EQUALS) && name != null) {
                List<ScriptToken> rest = entry.subList(i + 1, entry.size());
                defaultValue = defaultText(rest);
                break;
            } else {
                i++;
            }
        }
        if (name == null) {
            return;
        }

        InputDefinition input = new InputDefinition(name, type, mandatory, defaultValue, null);
        state.inputs.add(input);

        Map<String, ParameterValue> params = new LinkedHashMap<>();
        params.put("name", ParameterValue.literal(name));
        params.put("type", ParameterValue.literal(input.type()));
        params.put("required", ParameterValue.literal(String.valueOf(mandatory)));
        if (defaultValue != null) {
            params.put("default", ParameterValue.literal(defaultValue));
        }
        state.add(unit(state, lineLocation(nameLine), state.units.size(), UnitShape.INPUT,
            INPUT_IDENTIFIER, params, null, state.lines[nameLine]));
    }

    private boolean isMandatory(List<ScriptToken> attribute) {
        for (int i = 0; i < attribute.size(); i++) {
            if (attribute.get(i).isKeyword("Mandatory")) {
                boolean explicitFalse = i + 2 < attribute.size()
                    && attribute.get(i + 1).is(Type.EQUALS)
                    && attribute.get(i + 2).text().equalsIgnoreCase("false");
                return !explicitFalse;
            }
        }
        return false;
    }

    private String defaultText(List<ScriptToken> tokens) {
        if (tokens.isEmpty()) {
            return null;
        }
        if (tokens.size() == 1 && tokens.get(0).isValue()) {
            return toValue(tokens.get(0)).text();
        }
        StringBuilder text = new StringBuilder();
        for (ScriptToken token : tokens) {
            if (text.length() > 0) {
                text.append(' ');
            }
            text.append(toValue(token).toSourceNotation());
        }
        return text.toString();
    }

    private void addMalformedBlock(ParseState state, int startLine, int endLine) {
        StringBuilder raw = new StringBuilder();
        for (int i = startLine; i <= endLine && i < state.lines.length; i++) {
            if (raw.length() > 0) {
                raw.append('\n');
            }
            raw.append(state.lines[i]);
        }
        state.add(SourceUnit.opaque(state.sourceName, lineLocation(startLine), state.units.size(),
            UnitKind.STATEMENT, UnitShape.MALFORMED, raw.toString()));
        state.index = Math.max(endLine + 1, startLine + 1);
    }

    // ==================== Token Helpers ====================

    private record ValueRead(ParameterValue value, int next) {
    }

    private ValueRead readValue(List<ScriptToken> tokens, int index, String line) {
        return readValue(tokens, index, line, true);
    }

    /**
     * Reads one parameter value starting at {@code index}.
     *
     * <p>Comma lists are only joined in cmdlet form; in call form a comma separates
     * arguments.
     */
    private ValueRead readValue(List<ScriptToken> tokens, int index, String line, boolean joinLists) {
        if (index >= tokens.size()) {
            return null;
        }
        ScriptToken token = tokens.get(index);
        if (token.is(Type.LEFT_PAREN) || token.is(Type.LEFT_BRACE)) {
            Type closeType = token.is(Type.LEFT_PAREN) ? Type.RIGHT_PAREN : Type.RIGHT_BRACE;
            int close = matchingClose(tokens, index, token.type(), closeType);
            int end = close < tokens.size() ? tokens.get(close).offset() + 1 : line.length();
            return new ValueRead(ParameterValue.literal(line.substring(token.offset(), end).strip()), close + 1);
        }
        if (!token.isValue()) {
            return null;
        }
        // -Tag "a","b"
        if (joinLists && index + 2 < tokens.size() && tokens.get(index + 1).is(Type.COMMA) && tokens.get(index + 2).isValue()) {
            StringBuilder joined = new StringBuilder(toValue(token).text());
            int i = index + 1;
            while (i + 1 < tokens.size() && tokens.get(i).is(Type.COMMA) && tokens.get(i + 1).isValue()) {
                joined.append(',').append(toValue(tokens.get(i + 1)).text());
                i += 2;
            }
            return new ValueRead(ParameterValue.literal(joined.toString()), i);
        }
        return new ValueRead(toValue(token), index + 1);
    }

    private ParameterValue valueAfter(List<ScriptToken> tokens, int index, String line) {
        ValueRead read = readValue(tokens, index, line);
        return read == null ? null : read.value();
    }

    private ParameterValue toValue(ScriptToken token) {
        return switch (token.type()) {
            case QUOTED_STRING -> ParameterValue.quoted(token.text());
            case VARIABLE_REFERENCE -> isBuiltinConstant(token.text())
                ? ParameterValue.literal(token.text().toLowerCase(Locale.ROOT))
                : ParameterValue.variable(token.text());
            default -> ParameterValue.literal(token.text());
        };
    }

    private static boolean isBuiltinConstant(String variable) {
        return variable.equalsIgnoreCase("true") || variable.equalsIgnoreCase("false")
            || variable.equalsIgnoreCase("null");
    }

    private static String nextIdentifier(List<ScriptToken> tokens, int index) {
        return index < tokens.size() && tokens.get(index).is(Type.IDENTIFIER) ? tokens.get(index).text() : null;
    }

    private static int matchingClose(List<ScriptToken> tokens, int openIndex, Type open, Type close) {
        int depth = 0;
        for (int i = openIndex; i < tokens.size(); i++) {
            if (tokens.get(i).is(open)) {
                depth++;
            } else if (tokens.get(i).is(close)) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return tokens.size() - 1;
    }

    private static boolean parenthesesBalanced(List<ScriptToken> tokens) {
        int depth = 0;
        for (ScriptToken token : tokens) {
            if (token.is(Type.LEFT_PAREN)) {
                depth++;
            } else if (token.is(Type.RIGHT_PAREN)) {
                depth--;
                if (depth < 0) {
                    return false;
                }
            }
        }
        return depth == 0;
    }

    private static SourceUnit unit(ParseState state, String location, int position, UnitShape shape,
                                   String identifier, Map<String, ParameterValue> params,
                                   String pipedTo, String raw) {
        return new SourceUnit(state.sourceName, location, position, UnitKind.STATEMENT, shape,
            identifier, params, pipedTo, raw);
    }

    /**
     * Mutable cursor for a single parse call; never shared between documents.
     */
    private static final class ParseState {
        private final String sourceName;
        private final String[] lines;
        private final List<SourceUnit> units = new ArrayList<>();
        private final List<InputDefinition> inputs = new ArrayList<>();
        private int index;

        private ParseState(String sourceName, String[] lines) {
            this.sourceName = sourceName;
            this.lines = lines;
        }

        private void add(SourceUnit unit) {
            units.add(unit);
        }
    }
}
