package sa.com.cloudsolutions.getterlint.analysis;

/**
 * What the traversal should do with a node.
 */
public enum NodeDecision {
    /** Neither the node nor anything below it is a candidate. */
    SKIP_SUBTREE,
    /** The node is not a candidate but its children may be. */
    SKIP_NODE_ONLY,
    /** The node is a field read that should be checked. */
    INSPECT
}
