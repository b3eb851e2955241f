package sa.com.cloudsolutions.getterlint;

import com.github.javaparser.ast.CompilationUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sa.com.cloudsolutions.getterlint.analysis.GetterAnalyzer;
import sa.com.cloudsolutions.getterlint.analysis.Mode;
import sa.com.cloudsolutions.getterlint.analysis.RuleConfig;
import sa.com.cloudsolutions.getterlint.configuration.Settings;
import sa.com.cloudsolutions.getterlint.constants.Constants;
import sa.com.cloudsolutions.getterlint.parser.SourceParser;
import sa.com.cloudsolutions.getterlint.parser.SymbolSolverCapabilityInfo;
import sa.com.cloudsolutions.getterlint.report.Diagnostic;
import sa.com.cloudsolutions.getterlint.report.FixApplier;
import sa.com.cloudsolutions.getterlint.report.Issue;
import sa.com.cloudsolutions.getterlint.report.IssueWriter;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs the analysis over the source tree named in the configuration.
 * <p>
 * Usage: {@code GetterLint [config.yml]}. Without an argument getterlint.yml is read from the classpath.
 */
public class GetterLint {
    private static final Logger logger = LoggerFactory.getLogger(GetterLint.class);

    private final SourceParser parser;
    private final GetterAnalyzer analyzer;

    public GetterLint(SourceParser parser, RuleConfig config) {
        this.parser = parser;
        this.analyzer = new GetterAnalyzer(config);
    }

    public static void main(String[] args) throws IOException {
        if (args.length > 1) {
            System.err.println("Usage: java GetterLint [config.yml]");
            System.exit(2);
        }
        if (args.length == 1) {
            Settings.loadConfigMap(new File(args[0]));
        } else {
            Settings.loadConfigMap();
        }

        GetterLint lint = new GetterLint(SourceParser.fromSettings(), RuleConfig.fromSettings());
        Mode mode = Mode.fromString(Settings.getProperty(Constants.MODE, String.class).orElse(null));
        int count = mode == Mode.AGGREGATOR
                ? lint.exportIssues(Settings.getProperty(Constants.ISSUES_OUTPUT, String.class).orElse(null))
                : lint.reportDiagnostics(Settings.getBoolean(Constants.APPLY_FIXES));

        if (count > 0 && Settings.getBoolean(Constants.FAIL_ON_FINDINGS)) {
            System.exit(1);
        }
    }

    /**
     * Logs every diagnostic and optionally rewrites the affected files.
     * @return the number of findings
     */
    public int reportDiagnostics(boolean applyFixes) throws IOException {
        List<Diagnostic> diagnostics = diagnostics();
        Map<String, List<Diagnostic>> byFile = new LinkedHashMap<>();
        int count = 0;
        for (Diagnostic d : diagnostics) {
            if (d.isError()) {
                logger.error("{}:{} {}", d.file(), d.range() == null ? "?" : d.range().begin, d.message());
            } else {
                logger.warn("{}:{}:{} {}", d.file(), d.range().begin.line, d.range().begin.column, d.message());
                byFile.computeIfAbsent(d.file(), k -> new ArrayList<>()).add(d);
                count++;
            }
        }
        if (applyFixes) {
            for (Map.Entry<String, List<Diagnostic>> entry : byFile.entrySet()) {
                applyFixes(Paths.get(entry.getKey()), entry.getValue());
            }
        }
        return count;
    }

    /**
     * Writes the issues as JSON, or logs them when no output file is given.
     * @return the number of issues
     */
    public int exportIssues(String output) throws IOException {
        List<Issue> issues = issues();
        IssueWriter writer = new IssueWriter();
        if (output == null) {
            logger.info("{}", writer.toJson(issues));
        } else {
            writer.write(issues, new File(output));
            logger.info("Wrote {} issues to {}", issues.size(), output);
        }
        return issues.size();
    }

    public List<Diagnostic> diagnostics() throws IOException {
        List<CompilationUnit> units = parser.parseAll();
        return analyzer.diagnostics(units, new SymbolSolverCapabilityInfo(parser.getTypeSolver()));
    }

    public List<Issue> issues() throws IOException {
        List<CompilationUnit> units = parser.parseAll();
        return analyzer.run(units, new SymbolSolverCapabilityInfo(parser.getTypeSolver()), Mode.AGGREGATOR,
                d -> logger.error("{}:{} {}", d.file(), Optional.ofNullable(d.range()).map(r -> r.begin).orElse(null), d.message()));
    }

    static void applyFixes(Path file, List<Diagnostic> diagnostics) throws IOException {
        String source = Files.readString(file, StandardCharsets.UTF_8);
        Files.writeString(file, FixApplier.apply(source, diagnostics), StandardCharsets.UTF_8);
        logger.info("Applied {} fixes to {}", diagnostics.size(), file);
    }
}
