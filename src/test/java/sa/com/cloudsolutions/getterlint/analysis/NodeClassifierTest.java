package sa.com.cloudsolutions.getterlint.analysis;

import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.expr.Expression;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;

class NodeClassifierTest {
    private final NodeClassifier classifier = new NodeClassifier();

    @ParameterizedTest
    @ValueSource(strings = {"msg.name = value", "msg.inner.name = value", "msg.count += 1",
            "this.name = other.name"})
    void writesToFieldsSkipTheWholeSubtree(String code) {
        Expression expr = StaticJavaParser.parseExpression(code);
        assertEquals(AccessRole.ASSIGNMENT_TARGET, classifier.roleOf(expr));
        assertEquals(NodeDecision.SKIP_SUBTREE, classifier.classify(expr));
    }

    @ParameterizedTest
    @ValueSource(strings = {"msg.count++", "msg.count--", "++msg.count", "--msg.inner.count"})
    void incrementAndDecrementSkipTheWholeSubtree(String code) {
        Expression expr = StaticJavaParser.parseExpression(code);
        assertEquals(AccessRole.INCREMENT_DECREMENT, classifier.roleOf(expr));
        assertEquals(NodeDecision.SKIP_SUBTREE, classifier.classify(expr));
    }

    @ParameterizedTest
    @ValueSource(strings = {"value = msg.name", "values[0] = msg.name", "count++", "-msg.count", "!msg.active",
            "~msg.flags", "msg.getName()"})
    void otherNodesAreDescendedInto(String code) {
        Expression expr = StaticJavaParser.parseExpression(code);
        assertEquals(AccessRole.NOT_A_SELECTOR, classifier.roleOf(expr));
        assertEquals(NodeDecision.SKIP_NODE_ONLY, classifier.classify(expr));
    }

    @Test
    void fieldReadsAreInspected() {
        Expression expr = StaticJavaParser.parseExpression("msg.inner.name");
        assertEquals(AccessRole.PLAIN_READ, classifier.roleOf(expr));
        assertEquals(NodeDecision.INSPECT, classifier.classify(expr));

        Expression operand = StaticJavaParser.parseExpression("-msg.count").asUnaryExpr().getExpression();
        assertEquals(NodeDecision.INSPECT, classifier.classify(operand));
    }

    @Test
    void unwrapRemovesAllParentheses() {
        Expression expr = StaticJavaParser.parseExpression("((msg.count))");
        assertEquals("msg.count", NodeClassifier.unwrap(expr).toString());
    }
}
