package sa.com.cloudsolutions.getterlint.analysis;

import com.github.javaparser.Position;

import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Records the spans that have already produced a finding during one run.
 * <p>
 * Registered spans never overlap, so within a file they are ordered by both their begin and
 * their end positions. That lets every query look at a single neighbouring entry.
 * Spans are never removed. A new registry is created for every run and it is not thread safe.
 */
public class ReplacedSpanRegistry {
    private final Map<String, TreeMap<Position, Span>> spans = new HashMap<>();

    /**
     * @return true if the position falls inside a span that was already replaced
     */
    public boolean isFiltered(String file, Position position) {
        TreeMap<Position, Span> fileSpans = spans.get(file);
        if (fileSpans == null) {
            return false;
        }
        Map.Entry<Position, Span> entry = fileSpans.floorEntry(position);
        return entry != null && entry.getValue().contains(position);
    }

    /**
     * @return true if any part of the span has already been replaced
     */
    public boolean isAlreadyReplaced(String file, Span span) {
        TreeMap<Position, Span> fileSpans = spans.get(file);
        if (fileSpans == null) {
            return false;
        }
        Map.Entry<Position, Span> entry = fileSpans.lowerEntry(span.end());
        return entry != null && entry.getValue().overlaps(span);
    }

    public void register(String file, Span span) {
        if (isAlreadyReplaced(file, span)) {
            throw new IllegalStateException("Span " + span + " overlaps an earlier replacement in " + file);
        }
        spans.computeIfAbsent(file, k -> new TreeMap<>()).put(span.begin(), span);
    }

    public int size() {
        return spans.values().stream().mapToInt(Map::size).sum();
    }
}
