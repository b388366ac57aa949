package org.tokbench.worker.clean;

public enum RuleAction {
    /** Matched text is removed. */
    DELETE,
    /** Matched text is replaced with a single space. */
    SPACE,
    /** Arabic letter forms are replaced with their Urdu counterparts. */
    FOLD_ARABIC
}
