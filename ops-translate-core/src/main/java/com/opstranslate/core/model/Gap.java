package com.opstranslate.core.model;

import java.util.Objects;

/**
 * A unit, task or document that could not be fully translated.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * Gap gap = Gap.of(
 *     unit.reference(),
 *     GapType.NO_MATCH,
 *     "No mutation rule matches 'Move-VM'",
 *     "Add a rule for 'Move-VM' to the mutation section of the rule table"
 * );
 * }</pre>
 *
 * @param unit evidence reference
 * @param type gap category
 * @param reason what went wrong
 * @param remediation what an operator can do about it
 * @param severity severity level
 */
public record Gap(
    UnitReference unit,
    GapType type,
    String reason,
    String remediation,
    GapSeverity severity
) {
    /**
     * Compact constructor with validation.
     */
    public Gap {
        Objects.requireNonNull(unit, "unit must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        if (remediation == null) {
            remediation = "";
        }
    }

    /**
     * Creates a gap with the default severity of its type.
     *
     * @param unit evidence reference
     * @param type gap category
     * @param reason what went wrong
     * @param remediation operator guidance
     * @return new gap
     */
    public static Gap of(UnitReference unit, GapType type, String reason, String remediation) {
        return new Gap(unit, type, reason, remediation, type.defaultSeverity());
    }
}
