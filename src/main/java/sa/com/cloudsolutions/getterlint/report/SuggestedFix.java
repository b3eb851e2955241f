package sa.com.cloudsolutions.getterlint.report;

import java.util.List;

public record SuggestedFix(String message, List<TextEdit> edits) {
    public SuggestedFix {
        edits = List.copyOf(edits);
    }
}
