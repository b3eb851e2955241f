package sa.com.cloudsolutions.getterlint.report;

import sa.com.cloudsolutions.getterlint.analysis.Finding;
import sa.com.cloudsolutions.getterlint.constants.Constants;

import java.util.List;

/**
 * Renders a {@link Finding} either as a {@link Diagnostic} or as an {@link Issue}.
 * Both carry exactly the same message.
 */
public class Report {
    private final Finding finding;

    public Report(Finding finding) {
        this.finding = finding;
    }

    public Finding getFinding() {
        return finding;
    }

    public String getMessage() {
        return String.format(Constants.MESSAGE_FORMAT, quote(finding.from()), quote(finding.to()));
    }

    public Diagnostic toDiagnostic() {
        String message = getMessage();
        TextEdit edit = new TextEdit(finding.range(), finding.to());
        return new Diagnostic(finding.file(), finding.range(), message,
                List.of(new SuggestedFix(message, List.of(edit))));
    }

    public Issue toIssue() {
        FilePosition position = new FilePosition(finding.file(),
                finding.range().begin.line, finding.range().begin.column);
        return new Issue(position, getMessage(),
                new InlineFix(finding.range().begin.column - 1, finding.from().length(), finding.to()));
    }

    /**
     * An edit that replaces only the field name of the outermost access with its accessor call.
     * Nested accesses that the full replacement also rewrites are left untouched.
     */
    public TextEdit toSuffixEdit() {
        return new TextEdit(finding.suffixRange(), finding.suffixTo());
    }

    /**
     * Wraps the text in double quotes, escaping it the way a Java string literal would.
     */
    static String quote(String text) {
        StringBuilder sb = new StringBuilder("\"");
        for (char c : text.toCharArray()) {
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }
}
