package sa.com.cloudsolutions.getterlint.exception;

import com.github.javaparser.ast.Node;

/**
 * Raised when the replacement text for an accepted access cannot be produced.
 * This points at an inconsistency inside the tool rather than in the analyzed code.
 */
public class SynthesisException extends GetterLintException {
    private final transient Node node;

    public SynthesisException(String message, Node node) {
        super(message);
        this.node = node;
    }

    public Node getNode() {
        return node;
    }
}
