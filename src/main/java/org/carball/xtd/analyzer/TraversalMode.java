package org.carball.xtd.analyzer;

/**
 * Direction in which a reference is being followed during classification.
 */
public enum TraversalMode {
    /** From a table to a table it holds a foreign key to. */
    FORWARD,
    /** From a table to a table holding a foreign key to it. */
    BACKWARD,
    /** Anything reached once the path became ambiguous; always N:M. */
    MANY
}
