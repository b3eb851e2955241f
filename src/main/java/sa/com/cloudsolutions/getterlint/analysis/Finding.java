package sa.com.cloudsolutions.getterlint.analysis;

import com.github.javaparser.Range;

/**
 * A confirmed direct read of a generated field together with its replacement.
 * <p>
 * The suffix fields describe a narrower edit covering only the field name of the outermost access,
 * for hosts that patch at column granularity. See {@link sa.com.cloudsolutions.getterlint.report.Report#toSuffixEdit()}.
 *
 * @param file the source file, as given to the analyzer
 * @param range the full access expression
 * @param from the original text of the expression
 * @param to the text with the accessor calls in place
 * @param suffixRange just the field name of the outermost access
 * @param suffixFrom the field name
 * @param suffixTo the accessor call that replaces the field name
 */
public record Finding(String file, Range range, String from, String to,
                      Range suffixRange, String suffixFrom, String suffixTo) {
}
