package sa.com.cloudsolutions.getterlint.report;

import com.github.javaparser.Range;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FixApplierTest {

    private static Diagnostic edit(Range range, String text) {
        return new Diagnostic("A.java", range, "m", List.of(new SuggestedFix("m", List.of(new TextEdit(range, text)))));
    }

    @Test
    void editsAreAppliedFromTheEnd() {
        String source = "a = p.name;\nb = p.age + p.name;\n";
        String result = FixApplier.apply(source, List.of(
                edit(Range.range(1, 5, 1, 10), "p.getName()"),
                edit(Range.range(2, 5, 2, 9), "p.getAge()"),
                edit(Range.range(2, 13, 2, 18), "p.getName()")));

        assertEquals("a = p.getName();\nb = p.getAge() + p.getName();\n", result);
    }

    @Test
    void errorDiagnosticsAreIgnored() {
        String source = "x = p.name;";
        assertEquals(source, FixApplier.apply(source, List.of(Diagnostic.error("A.java", null, "bad"))));
    }

    @Test
    void windowsLineEndings() {
        String source = "first();\r\nreturn p.name;\r\n";
        String result = FixApplier.apply(source, List.of(edit(Range.range(2, 8, 2, 13), "p.getName()")));
        assertEquals("first();\r\nreturn p.getName();\r\n", result);
    }

    @Test
    void lineStarts() {
        assertEquals(List.of(0, 2, 5, 7), FixApplier.lineStarts("a\nb\r\nc\rd"));
        assertEquals(List.of(0), FixApplier.lineStarts(""));
    }

    @Test
    void overlappingEditsAreRejected() {
        String source = "return p.address.city;";
        List<Diagnostic> diagnostics = List.of(
                edit(Range.range(1, 8, 1, 21), "p.getAddress().getCity()"),
                edit(Range.range(1, 8, 1, 16), "p.getAddress()"));
        assertThrows(IllegalArgumentException.class, () -> FixApplier.apply(source, diagnostics));
    }

    @Test
    void editsOutsideTheSourceAreRejected() {
        List<Diagnostic> diagnostics = List.of(edit(Range.range(3, 1, 3, 4), "x"));
        assertThrows(IllegalArgumentException.class, () -> FixApplier.apply("one line", diagnostics));
    }
}
