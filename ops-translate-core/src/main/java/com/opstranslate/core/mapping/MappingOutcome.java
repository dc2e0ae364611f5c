package com.opstranslate.core.mapping;

import java.util.Objects;

/**
 * Result of mapping one classified unit: a partial task or a recorded miss.
 */
public sealed interface MappingOutcome permits MappingOutcome.Mapped, MappingOutcome.NoMatch {

    /**
     * A rule matched.
     *
     * @param task partially resolved task
     */
    record Mapped(PartialTask task) implements MappingOutcome {
        public Mapped {
            Objects.requireNonNull(task, "task must not be null");
        }
    }

    /**
     * No rule of the category sub-table matched. Not an error; becomes a gap.
     *
     * @param reason why nothing matched
     * @param remediation how to add a rule for the unit
     */
    record NoMatch(String reason, String remediation) implements MappingOutcome {
        public NoMatch {
            Objects.requireNonNull(reason, "reason must not be null");
            Objects.requireNonNull(remediation, "remediation must not be null");
        }
    }
}
