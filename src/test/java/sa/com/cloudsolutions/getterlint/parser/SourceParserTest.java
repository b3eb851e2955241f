package sa.com.cloudsolutions.getterlint.parser;

import com.github.javaparser.ast.CompilationUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import sa.com.cloudsolutions.getterlint.TestHelper;
import sa.com.cloudsolutions.getterlint.analysis.GetterAnalyzer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SourceParserTest {

    @Test
    void parsesEveryFileUnderTheBasePath() throws IOException {
        List<CompilationUnit> units = TestHelper.parser().parseAll();
        List<String> names = units.stream()
                .map(cu -> Path.of(GetterAnalyzer.fileName(cu)).getFileName().toString())
                .toList();

        assertEquals(8, units.size());
        assertTrue(names.contains("PersonService.java"));
        assertTrue(names.contains("Person.java"));
    }

    @Test
    void unparsableFilesAreSkipped(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("Good.java"), "class Good { int x; }");
        Files.writeString(dir.resolve("Bad.java"), "class Bad { int x = ; ");
        Files.writeString(dir.resolve("notes.txt"), "class Ignored {}");

        List<CompilationUnit> units = new SourceParser(dir).parseAll();
        assertEquals(1, units.size());
        assertEquals("Good", units.get(0).getType(0).getNameAsString());
    }

    @Test
    void inMemorySourcesHaveNoFile() {
        CompilationUnit cu = TestHelper.parse("class InMemory {}");
        assertEquals(GetterAnalyzer.UNKNOWN_FILE, GetterAnalyzer.fileName(cu));
        assertTrue(TestHelper.parser().parse("class Broken {").isEmpty());
    }
}
