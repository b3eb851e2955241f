package sa.com.cloudsolutions.getterlint.report;

import com.github.javaparser.Position;
import com.github.javaparser.Range;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Applies the suggested fixes of diagnostics to the text of a source file.
 */
public class FixApplier {

    private FixApplier() {}

    /**
     * @param source the original file contents
     * @param diagnostics diagnostics for this file
     * @return the contents with every text edit applied
     * @throws IllegalArgumentException if two edits overlap or an edit lies outside the text
     */
    public static String apply(String source, List<Diagnostic> diagnostics) {
        List<TextEdit> edits = new ArrayList<>();
        for (Diagnostic d : diagnostics) {
            for (SuggestedFix fix : d.suggestedFixes()) {
                edits.addAll(fix.edits());
            }
        }
        edits.sort(Comparator.comparing((TextEdit e) -> e.range().begin).reversed());

        List<Integer> lineStarts = lineStarts(source);
        StringBuilder sb = new StringBuilder(source);
        int limit = source.length();
        for (TextEdit edit : edits) {
            Range r = edit.range();
            int start = offset(lineStarts, r.begin, source);
            int end = offset(lineStarts, r.end, source) + 1;
            if (end > limit) {
                throw new IllegalArgumentException("Overlapping or out of bounds edit at " + r);
            }
            sb.replace(start, end, edit.newText());
            limit = start;
        }
        return sb.toString();
    }

    private static int offset(List<Integer> lineStarts, Position p, String source) {
        if (p.line < 1 || p.line > lineStarts.size() || p.column < 1) {
            throw new IllegalArgumentException("Position " + p + " is outside the source");
        }
        int offset = lineStarts.get(p.line - 1) + p.column - 1;
        if (offset >= source.length()) {
            throw new IllegalArgumentException("Position " + p + " is outside the source");
        }
        return offset;
    }

    /**
     * Offsets of the first character of each line. A line ends at \n, \r\n or a lone \r.
     */
    static List<Integer> lineStarts(String source) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            if (c == '\r') {
                if (i + 1 < source.length() && source.charAt(i + 1) == '\n') {
                    i++;
                }
                starts.add(i + 1);
            } else if (c == '\n') {
                starts.add(i + 1);
            }
        }
        return starts;
    }
}
