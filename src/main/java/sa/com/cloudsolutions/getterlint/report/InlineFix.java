package sa.com.cloudsolutions.getterlint.report;

/**
 * A single line patch: starting at the zero based {@code startColumn} of the issue's line,
 * replace {@code length} characters with {@code newString}.
 */
public record InlineFix(int startColumn, int length, String newString) {
}
