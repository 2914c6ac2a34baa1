package arbor.core.type;

/**
 * The tag of the two node variants that make up both the suite tree and the result tree: a leaf test or a suite
 * containing further nodes.
 */
public enum NodeKind {
    TEST,
    SUITE
}
