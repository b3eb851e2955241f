package sa.com.cloudsolutions.getterlint.analysis;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.UnaryExpr;

/**
 * Decides, by node kind, whether a node is inspected and whether the traversal descends into it.
 * The first matching rule wins.
 */
public class NodeClassifier {

    public AccessRole roleOf(Node node) {
        if (node instanceof AssignExpr assign) {
            return unwrap(assign.getTarget()).isFieldAccessExpr() ? AccessRole.ASSIGNMENT_TARGET : AccessRole.NOT_A_SELECTOR;
        }
        if (node instanceof UnaryExpr unary) {
            if (isIncrementOrDecrement(unary.getOperator()) && unwrap(unary.getExpression()).isFieldAccessExpr()) {
                return AccessRole.INCREMENT_DECREMENT;
            }
            return AccessRole.NOT_A_SELECTOR;
        }
        if (node instanceof FieldAccessExpr) {
            return AccessRole.PLAIN_READ;
        }
        return AccessRole.NOT_A_SELECTOR;
    }

    public NodeDecision classify(Node node) {
        return roleOf(node).getDecision();
    }

    /**
     * Parentheses do not change whether an expression denotes a variable: {@code (msg.count)++} still writes.
     */
    static Expression unwrap(Expression expr) {
        Expression e = expr;
        while (e.isEnclosedExpr()) {
            e = e.asEnclosedExpr().getInner();
        }
        return e;
    }

    private static boolean isIncrementOrDecrement(UnaryExpr.Operator operator) {
        return switch (operator) {
            case PREFIX_INCREMENT, PREFIX_DECREMENT, POSTFIX_INCREMENT, POSTFIX_DECREMENT -> true;
            default -> false;
        };
    }
}
