package com.opstranslate.core.mapping;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConditionNegator}.
 */
class ConditionNegatorTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
        "$MemoryGB -gt 64            | memorygb <= 64",
        "$CpuCount -GE 2             | cpucount < 2",
        "$Env -eq 'prod'             | env != 'prod'",
        "$Env -ne $null              | env == null",
        "cpuCount > 32               | cpuCount <= 32",
        "vmName === ''               | vmName != ''",
        "disk <= 10                  | disk > 10",
        "$a -gt 1 -and $b -lt 2      | not (a -gt 1 -and b -lt 2)",
        "ready && approved           | not (ready && approved)",
        "!approved                   | not (!approved)",
        "isProduction(vm)            | not (isProduction(vm))"
    })
    void negate_conditions_produceAssertableExpression(String condition, String expected) {
        assertThat(ConditionNegator.negate(condition)).isEqualTo(expected);
    }
}
