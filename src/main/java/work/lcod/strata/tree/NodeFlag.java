package work.lcod.strata.tree;

/**
 * Per-node markers. {@link #FORCE_MAP} and {@link #FORCE_ARRAY} are serialization hints;
 * {@link #IS_ROOT} is maintained by the tree itself and marks the top of a scope.
 */
public enum NodeFlag {
    /** Serialize children as an object even when every key is numeric. */
    FORCE_MAP,
    /** Serialize children as an array even when some keys are not numeric. */
    FORCE_ARRAY,
    /** The node is a scope root; its link points at the inherited tree, not at a structural parent. */
    IS_ROOT
}
