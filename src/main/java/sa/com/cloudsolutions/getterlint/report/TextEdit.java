package sa.com.cloudsolutions.getterlint.report;

import com.github.javaparser.Range;

/**
 * Replace the text covered by {@code range}, both ends inclusive, with {@code newText}.
 */
public record TextEdit(Range range, String newText) {
}
