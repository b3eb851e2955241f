package sa.com.cloudsolutions.getterlint.analysis;

import com.github.javaparser.ast.expr.Expression;

import java.util.Optional;

/**
 * Read-only view of static type information for one analysis run.
 * Implementations are best effort: anything they cannot resolve is reported as absent.
 */
public interface TypeCapabilityInfo {

    /**
     * @param expression an expression from a parsed compilation unit
     * @return the fully qualified name of the expression's static reference type,
     *      empty for primitives, arrays and anything that could not be resolved
     */
    Optional<String> typeOf(Expression expression);

    /**
     * @return true if the type, or one of its supertypes, declares a method with the given name
     */
    boolean hasMethod(String typeName, String methodName);
}
