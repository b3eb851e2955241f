package sa.com.cloudsolutions.getterlint.report;

/**
 * Receives diagnostics as the analyzer produces them.
 */
@FunctionalInterface
public interface DiagnosticReporter {
    void report(Diagnostic diagnostic);
}
