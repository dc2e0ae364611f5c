package com.opstranslate.core.parser.script;

import com.opstranslate.core.parser.script.ScriptToken.Type;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ScriptTokenizer}.
 */
class ScriptTokenizerTest {

    private final ScriptTokenizer tokenizer = new ScriptTokenizer();

    @Test
    void tokenize_cmdletLine_producesTypedTokens() throws ScriptSyntaxException {
        // When
        List<ScriptToken> tokens = tokenizer.tokenize("New-VM -Name \"db01\" -MemoryGB 8 -VMHost $vmHost");

        // Then
        assertThat(tokens).extracting(ScriptToken::type).containsExactly(
            Type.IDENTIFIER, Type.NAMED_PARAMETER, Type.QUOTED_STRING,
            Type.NAMED_PARAMETER, Type.NUMBER, Type.NAMED_PARAMETER, Type.VARIABLE_REFERENCE);
        assertThat(tokens).extracting(ScriptToken::text).containsExactly(
            "New-VM", "Name", "db01", "MemoryGB", "8", "VMHost", "vmHost");
    }

    @Test
    void tokenize_commentAfterCode_stopsAtHash() throws ScriptSyntaxException {
        List<ScriptToken> tokens = tokenizer.tokenize("Start-VM -VM $vm  # power on");

        assertThat(tokens).extracting(ScriptToken::text).containsExactly("Start-VM", "VM", "vm");
    }

    @Test
    void tokenize_escapedQuotes_keepsQuoteCharacters() throws ScriptSyntaxException {
        List<ScriptToken> tokens = tokenizer.tokenize("Write-Host \"say `\"hi`\"\" 'it''s'");

        assertThat(tokens.get(1).text()).isEqualTo("say \"hi\"");
        assertThat(tokens.get(2).text()).isEqualTo("it's");
    }

    @Test
    void tokenize_unterminatedString_throwsWithOffset() {
        assertThatThrownBy(() -> tokenizer.tokenize("New-VM -Name \"db01"))
            .isInstanceOf(ScriptSyntaxException.class)
            .extracting(e -> ((ScriptSyntaxException) e).getOffset())
            .isEqualTo(13);
    }

    @Test
    void tokenize_switchWithColonValue_stripsColon() throws ScriptSyntaxException {
        List<ScriptToken> tokens = tokenizer.tokenize("Remove-VM -VM $vm -Confirm:$false");

        assertThat(tokens.get(3).type()).isEqualTo(Type.NAMED_PARAMETER);
        assertThat(tokens.get(3).text()).isEqualTo("Confirm");
        assertThat(tokens.get(4).type()).isEqualTo(Type.VARIABLE_REFERENCE);
    }

    @Test
    void tokenize_negativeNumberVersusSubtraction_distinguishesByPreviousToken() throws ScriptSyntaxException {
        // Given / When
        List<ScriptToken> negative = tokenizer.tokenize("Set-Value -Offset -1");
        List<ScriptToken> subtraction = tokenizer.tokenize("$a = $b -1");

        // Then
        assertThat(negative.get(2).type()).isEqualTo(Type.NUMBER);
        assertThat(negative.get(2).text()).isEqualTo("-1");
        assertThat(subtraction).extracting(ScriptToken::type)
            .containsExactly(Type.VARIABLE_REFERENCE, Type.EQUALS, Type.VARIABLE_REFERENCE, Type.SYMBOL, Type.NUMBER);
    }

    @Test
    void tokenize_callForm_recognizesPunctuation() throws ScriptSyntaxException {
        List<ScriptToken> tokens = tokenizer.tokenize("CreateVM(name=\"db01\", memoryGB=8)");

        assertThat(tokens).extracting(ScriptToken::type).containsExactly(
            Type.IDENTIFIER, Type.LEFT_PAREN, Type.IDENTIFIER, Type.EQUALS, Type.QUOTED_STRING,
            Type.COMMA, Type.IDENTIFIER, Type.EQUALS, Type.NUMBER, Type.RIGHT_PAREN);
    }

    @Test
    void tokenize_dottedIdentifierAndOperators_readsWholeWords() throws ScriptSyntaxException {
        List<ScriptToken> tokens = tokenizer.tokenize("System.getModule(\"m\") == $x.Name");

        assertThat(tokens.get(0).text()).isEqualTo("System.getModule");
        assertThat(tokens).anySatisfy(token -> {
            assertThat(token.type()).isEqualTo(Type.OPERATOR);
            assertThat(token.text()).isEqualTo("==");
        });
        assertThat(tokens.get(tokens.size() - 1).text()).isEqualTo("x.Name");
    }
}
