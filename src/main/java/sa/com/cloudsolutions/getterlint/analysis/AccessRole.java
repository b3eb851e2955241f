package sa.com.cloudsolutions.getterlint.analysis;

/**
 * The syntactic role a node plays with respect to field access.
 * Each role maps to exactly one {@link NodeDecision}, which keeps the exemption policy in one place.
 */
public enum AccessRole {
    /** An assignment that writes to a field, {@code msg.inner.value = v} or {@code msg.count += 1}. */
    ASSIGNMENT_TARGET(NodeDecision.SKIP_SUBTREE),
    /** {@code msg.count++} and friends. An accessor call cannot be mutated. */
    INCREMENT_DECREMENT(NodeDecision.SKIP_SUBTREE),
    /** A field access in a pure read position. */
    PLAIN_READ(NodeDecision.INSPECT),
    /** Any other node. Its children are still visited. */
    NOT_A_SELECTOR(NodeDecision.SKIP_NODE_ONLY);

    private final NodeDecision decision;

    AccessRole(NodeDecision decision) {
        this.decision = decision;
    }

    public NodeDecision getDecision() {
        return decision;
    }
}
