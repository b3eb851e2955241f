package sa.com.cloudsolutions.getterlint.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.util.List;

/**
 * Serializes issues as a JSON array so that an aggregator can apply the inline fixes without reparsing.
 */
public class IssueWriter {
    private final ObjectMapper mapper;

    public IssueWriter() {
        mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void write(List<Issue> issues, File target) throws IOException {
        File parent = target.getAbsoluteFile().getParentFile();
        if (parent != null && !parent.exists() && !parent.mkdirs()) {
            throw new IOException("Could not create " + parent);
        }
        mapper.writeValue(target, issues);
    }

    public void write(List<Issue> issues, Writer writer) throws IOException {
        mapper.writeValue(writer, issues);
    }

    public String toJson(List<Issue> issues) throws IOException {
        return mapper.writeValueAsString(issues);
    }
}
