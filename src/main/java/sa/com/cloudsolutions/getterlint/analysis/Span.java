package sa.com.cloudsolutions.getterlint.analysis;

import com.github.javaparser.Position;
import com.github.javaparser.Range;

/**
 * A half open stretch of source text: {@code begin} is the first character, {@code end} the one after the last.
 */
public record Span(Position begin, Position end) {

    public Span {
        if (end.compareTo(begin) < 0) {
            throw new IllegalArgumentException("Span ends before it begins: " + begin + " " + end);
        }
    }

    /**
     * JavaParser ranges include their last character, spans do not.
     */
    public static Span of(Range range) {
        return new Span(range.begin, new Position(range.end.line, range.end.column + 1));
    }

    public boolean contains(Position position) {
        return begin.compareTo(position) <= 0 && position.compareTo(end) < 0;
    }

    public boolean overlaps(Span other) {
        return begin.compareTo(other.end) < 0 && other.begin.compareTo(end) < 0;
    }
}
