package sa.com.cloudsolutions.getterlint.parser;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.expr.AnnotationExpr;

import java.util.List;

/**
 * Recognizes compilation units written by a code generator.
 * Such files are left out of the analysis entirely.
 */
public class GeneratedFileFilter {
    public static final String GENERATED_ANNOTATION = "Generated";

    private final List<String> prefixes;

    public GeneratedFileFilter(List<String> prefixes) {
        this.prefixes = List.copyOf(prefixes);
    }

    public boolean isGenerated(CompilationUnit cu) {
        for (Comment comment : cu.getAllComments()) {
            String text = commentText(comment);
            for (String prefix : prefixes) {
                if (text.startsWith(prefix)) {
                    return true;
                }
            }
        }
        for (TypeDeclaration<?> type : cu.getTypes()) {
            for (AnnotationExpr annotation : type.getAnnotations()) {
                if (annotation.getName().getIdentifier().equals(GENERATED_ANNOTATION)) {
                    return true;
                }
            }
        }
        return false;
    }

    public List<CompilationUnit> retainHandWritten(List<CompilationUnit> units) {
        return units.stream().filter(cu -> !isGenerated(cu)).toList();
    }

    /**
     * The text of a comment without the leading asterisks and indentation of block comments.
     */
    static String commentText(Comment comment) {
        StringBuilder sb = new StringBuilder();
        for (String line : comment.getContent().split("\\R")) {
            String stripped = line.strip();
            while (stripped.startsWith("*")) {
                stripped = stripped.substring(1).strip();
            }
            if (!stripped.isEmpty()) {
                if (!sb.isEmpty()) {
                    sb.append('\n');
                }
                sb.append(stripped);
            }
        }
        return sb.toString();
    }
}
