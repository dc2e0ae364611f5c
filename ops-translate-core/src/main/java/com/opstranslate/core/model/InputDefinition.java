package com.opstranslate.core.model;

import java.util.Objects;

/**
 * Input parameter declared by a source document.
 *
 * @param name parameter name as declared
 * @param type declared type, or {@code "any"} when the source gives none
 * @param required true when the source marks the parameter mandatory
 * @param defaultValue default value text, or null
 * @param description optional description
 */
public record InputDefinition(
    String name,
    String type,
    boolean required,
    String defaultValue,
    String description
) {
    /**
     * Compact constructor with validation.
     */
    public InputDefinition {
        Objects.requireNonNull(name, "name must not be null");
        if (type == null || type.isBlank()) {
            type = "any";
        }
    }

    /**
     * Compares the parts of a definition that change its meaning. Descriptions are ignored.
     *
     * @param other definition of the same name from another source
     * @return true if type, required flag and default agree
     */
    public boolean sameDefinitionAs(InputDefinition other) {
        return type.equalsIgnoreCase(other.type)
            && required == other.required
            && Objects.equals(defaultValue, other.defaultValue);
    }

    /**
     * Like {@link #sameDefinitionAs} but ignores the default.
     *
     * @param other definition of the same name from another source
     * @return true if type and required flag agree
     */
    public boolean sameSignatureAs(InputDefinition other) {
        return type.equalsIgnoreCase(other.type) && required == other.required;
    }

    public InputDefinition withDefaultValue(String value) {
        return new InputDefinition(name, type, required, value, description);
    }

    /**
     * Returns a compact one-line form used in conflict records.
     *
     * @return e.g. {@code "type=int, required=false, default=2"}
     */
    public String summary() {
        return "type=" + type + ", required=" + required
            + (defaultValue != null ? ", default=" + defaultValue : "");
    }
}
