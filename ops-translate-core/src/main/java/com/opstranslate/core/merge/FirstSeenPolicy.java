package com.opstranslate.core.merge;

/**
 * Decides which source counts as "first" when two sources declare the same input differently.
 *
 * <p>Either way a conflict is recorded; the policy only picks the definition kept in the
 * merged input set.
 */
public enum FirstSeenPolicy {
    /**
     * Sources are visited in source-name order. The merge result does not depend on the
     * order in which sources were handed over.
     */
    SOURCE_NAME,

    /**
     * Sources are visited in the order they were handed over, typically file import order.
     * The retained definition then depends on that order.
     */
    IMPORT_ORDER
}
