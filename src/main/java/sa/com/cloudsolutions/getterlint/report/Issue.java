package sa.com.cloudsolutions.getterlint.report;

/**
 * A finding in the shape an external aggregator consumes.
 */
public record Issue(FilePosition position, String message, InlineFix inlineFix) {
}
