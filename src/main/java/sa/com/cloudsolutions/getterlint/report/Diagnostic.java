package sa.com.cloudsolutions.getterlint.report;

import com.github.javaparser.Range;

import java.util.List;

/**
 * A message attached to a stretch of a source file, optionally with fixes the host can apply.
 */
public record Diagnostic(String file, Range range, String message, List<SuggestedFix> suggestedFixes) {

    public Diagnostic {
        suggestedFixes = List.copyOf(suggestedFixes);
    }

    public static Diagnostic error(String file, Range range, String message) {
        return new Diagnostic(file, range, "error: " + message, List.of());
    }

    public boolean isError() {
        return suggestedFixes.isEmpty() && message.startsWith("error: ");
    }
}
