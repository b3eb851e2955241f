package sa.com.cloudsolutions.getterlint.parser;

import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.resolution.TypeSolver;
import com.github.javaparser.resolution.declarations.ResolvedMethodDeclaration;
import com.github.javaparser.resolution.declarations.ResolvedReferenceTypeDeclaration;
import com.github.javaparser.resolution.model.SymbolReference;
import com.github.javaparser.resolution.types.ResolvedReferenceType;
import com.github.javaparser.resolution.types.ResolvedType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sa.com.cloudsolutions.getterlint.analysis.TypeCapabilityInfo;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Answers type questions with the JavaParser symbol solver.
 * <p>
 * Resolution is best effort. Partially typed code is common (missing jars, unresolvable super
 * classes) so every failure is treated as "unknown" instead of being propagated. Method names
 * are cached per type for the lifetime of this object.
 */
public class SymbolSolverCapabilityInfo implements TypeCapabilityInfo {
    private static final Logger logger = LoggerFactory.getLogger(SymbolSolverCapabilityInfo.class);

    private final TypeSolver typeSolver;
    private final Map<String, ResolvedReferenceTypeDeclaration> declarations = new HashMap<>();
    private final Map<String, Set<String>> methodNames = new HashMap<>();

    public SymbolSolverCapabilityInfo(TypeSolver typeSolver) {
        this.typeSolver = typeSolver;
    }

    @Override
    public Optional<String> typeOf(Expression expression) {
        try {
            ResolvedType type = expression.calculateResolvedType();
            if (type.isReferenceType()) {
                ResolvedReferenceType reference = type.asReferenceType();
                String name = reference.getQualifiedName();
                reference.getTypeDeclaration().ifPresent(d -> declarations.putIfAbsent(name, d));
                return Optional.of(name);
            }
        } catch (RuntimeException e) {
            logger.debug("Could not resolve the type of {} : {}", expression, e.getMessage());
        }
        return Optional.empty();
    }

    @Override
    public boolean hasMethod(String typeName, String methodName) {
        return methodNames.computeIfAbsent(typeName, this::collectMethodNames).contains(methodName);
    }

    private Set<String> collectMethodNames(String typeName) {
        Set<String> names = new HashSet<>();
        findDeclaration(typeName).ifPresent(d -> collectMethodNames(d, names, new HashSet<>()));
        return names;
    }

    private Optional<ResolvedReferenceTypeDeclaration> findDeclaration(String typeName) {
        ResolvedReferenceTypeDeclaration known = declarations.get(typeName);
        if (known != null) {
            return Optional.of(known);
        }
        try {
            SymbolReference<ResolvedReferenceTypeDeclaration> ref = typeSolver.tryToSolveType(typeName);
            if (ref.isSolved()) {
                return Optional.of(ref.getCorrespondingDeclaration());
            }
        } catch (RuntimeException e) {
            logger.debug("Could not solve type {} : {}", typeName, e.getMessage());
        }
        return Optional.empty();
    }

    /**
     * Walks the declaration and its ancestors. An ancestor that cannot be resolved only hides
     * its own methods, everything else is still collected.
     */
    private void collectMethodNames(ResolvedReferenceTypeDeclaration declaration, Set<String> names, Set<String> visited) {
        if (!visited.add(declaration.getQualifiedName())) {
            return;
        }
        try {
            for (ResolvedMethodDeclaration method : declaration.getDeclaredMethods()) {
                names.add(method.getName());
            }
        } catch (RuntimeException e) {
            logger.debug("Could not list the methods of {} : {}", declaration.getQualifiedName(), e.getMessage());
        }
        try {
            for (ResolvedReferenceType ancestor : declaration.getAncestors(true)) {
                ancestor.getTypeDeclaration().ifPresent(d -> collectMethodNames(d, names, visited));
            }
        } catch (RuntimeException e) {
            logger.debug("Could not list the ancestors of {} : {}", declaration.getQualifiedName(), e.getMessage());
        }
    }
}
