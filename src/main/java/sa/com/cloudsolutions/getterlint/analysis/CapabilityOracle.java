package sa.com.cloudsolutions.getterlint.analysis;

import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Decides whether a field read bypasses an accessor that the code generator produced.
 */
public class CapabilityOracle {
    private static final Logger logger = LoggerFactory.getLogger(CapabilityOracle.class);

    private final TypeCapabilityInfo types;
    private final RuleConfig config;

    public CapabilityOracle(TypeCapabilityInfo types, RuleConfig config) {
        this.types = types;
        this.config = config;
    }

    public boolean isUnsafeDirectRead(FieldAccessExpr access) {
        return isUnsafeDirectRead(access.getScope(), access.getNameAsString());
    }

    /**
     * @param scope the expression whose field is read
     * @param field the name of the field
     * @return true if the scope is a generated type that has an accessor for the field
     */
    public boolean isUnsafeDirectRead(Expression scope, String field) {
        if (config.isAccessorName(field)) {
            return false;
        }

        Optional<String> type = types.typeOf(scope);
        if (type.isEmpty()) {
            logger.debug("No type information for {}", scope);
            return false;
        }

        String typeName = type.get();
        if (!isManaged(typeName)) {
            return false;
        }
        return types.hasMethod(typeName, config.accessorName(field));
    }

    /**
     * A type is managed when it carries either generation's marker. Types with only the legacy
     * marker are excluded when they also carry the null unsafe marker, since their accessors are
     * no safer than the field.
     */
    public boolean isManaged(String typeName) {
        if (types.hasMethod(typeName, config.reflectionMarker())) {
            return true;
        }
        if (types.hasMethod(typeName, config.legacyMarker())) {
            return !types.hasMethod(typeName, config.nullUnsafeMarker());
        }
        return false;
    }
}
