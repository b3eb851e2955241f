package sa.com.cloudsolutions.getterlint.analysis;

import com.github.javaparser.JavaToken;
import com.github.javaparser.Position;
import com.github.javaparser.Range;
import com.github.javaparser.TokenRange;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import sa.com.cloudsolutions.getterlint.exception.SynthesisException;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the original and replacement text for an access that has to be reported.
 * <p>
 * The replacement is the original token stream with the name token of each rewritten access
 * swapped for its accessor call. Whitespace and comments between the tokens are kept as they are.
 */
public class FindingSynthesizer {
    private final RuleConfig config;

    public FindingSynthesizer(RuleConfig config) {
        this.config = config;
    }

    /**
     * @param file the file the access belongs to
     * @param access the outermost access being reported
     * @param nested other accesses inside {@code access} that should become accessor calls as well
     * @return the finding
     * @throws SynthesisException if the access carries no source positions
     */
    public Finding synthesize(String file, FieldAccessExpr access, Collection<FieldAccessExpr> nested)
            throws SynthesisException {
        TokenRange tokens = access.getTokenRange()
                .orElseThrow(() -> new SynthesisException("no tokens for " + access, access));
        Range range = access.getRange()
                .orElseThrow(() -> new SynthesisException("no position for " + access, access));
        Range suffixRange = access.getName().getRange()
                .orElseThrow(() -> new SynthesisException("no position for field " + access.getName(), access));

        Map<Position, String> replacements = new HashMap<>();
        replacements.put(suffixRange.begin, accessorCall(access));
        for (FieldAccessExpr inner : nested) {
            if (inner != access) {
                Range r = inner.getName().getRange()
                        .orElseThrow(() -> new SynthesisException("no position for field " + inner.getName(), inner));
                if (!range.contains(r)) {
                    throw new SynthesisException(inner + " is not part of " + access, inner);
                }
                replacements.put(r.begin, accessorCall(inner));
            }
        }

        StringBuilder to = new StringBuilder();
        for (JavaToken token : tokens) {
            Optional<Range> tokenRange = token.getRange();
            String replacement = tokenRange.map(r -> replacements.get(r.begin)).orElse(null);
            to.append(replacement != null ? replacement : token.getText());
        }

        return new Finding(file, range, tokens.toString(), to.toString(),
                suffixRange, access.getNameAsString(), accessorCall(access));
    }

    private String accessorCall(FieldAccessExpr access) {
        return config.accessorName(access.getNameAsString()) + "()";
    }
}
