package sa.com.cloudsolutions.getterlint.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IssueWriterTest {
    private final ObjectMapper mapper = new ObjectMapper();

    private static final Issue ISSUE = new Issue(new FilePosition("src/Usage.java", 7, 16),
            "avoid direct access to generated field \"p.name\" use \"p.getName()\"",
            new InlineFix(15, 6, "p.getName()"));

    @Test
    void issuesBecomeAJsonArray() throws IOException {
        JsonNode root = mapper.readTree(new IssueWriter().toJson(List.of(ISSUE)));

        assertTrue(root.isArray());
        assertEquals(1, root.size());
        JsonNode issue = root.get(0);
        assertEquals("src/Usage.java", issue.at("/position/file").asText());
        assertEquals(7, issue.at("/position/line").asInt());
        assertEquals(16, issue.at("/position/column").asInt());
        assertEquals(ISSUE.message(), issue.get("message").asText());
        assertEquals(15, issue.at("/inlineFix/startColumn").asInt());
        assertEquals(6, issue.at("/inlineFix/length").asInt());
        assertEquals("p.getName()", issue.at("/inlineFix/newString").asText());
    }

    @Test
    void writesToNewDirectories(@TempDir Path dir) throws IOException {
        File target = dir.resolve("reports").resolve("issues.json").toFile();
        new IssueWriter().write(List.of(ISSUE, ISSUE), target);

        assertTrue(target.exists());
        assertEquals(2, mapper.readTree(target).size());
    }

    @Test
    void emptyList() throws IOException {
        StringWriter writer = new StringWriter();
        new IssueWriter().write(List.of(), writer);
        assertEquals(0, mapper.readTree(writer.toString()).size());
    }
}
