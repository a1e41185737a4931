package org.pragmatica.rollkit.eval;

/**
 * How a list takes part in arithmetic and comparisons.
 */
public enum ListKind {
    /**
     * Reduced to the sum of its elements before being combined.
     */
    NORMAL,

    /**
     * Never reduced; operators apply element-wise or broadcast against a scalar.
     */
    STRONG
}
