package sa.com.cloudsolutions.getterlint.analysis;

import com.github.javaparser.Range;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sa.com.cloudsolutions.getterlint.exception.SynthesisException;
import sa.com.cloudsolutions.getterlint.parser.GeneratedFileFilter;
import sa.com.cloudsolutions.getterlint.report.Diagnostic;
import sa.com.cloudsolutions.getterlint.report.DiagnosticReporter;
import sa.com.cloudsolutions.getterlint.report.Issue;
import sa.com.cloudsolutions.getterlint.report.Report;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Finds reads of generated fields that should go through the generated accessor.
 * <p>
 * Every call to {@link #run} walks the hand written compilation units in pre-order. Each field access
 * is passed through the classifier, the capability oracle and the span registry before a finding is
 * synthesized. Spans can only collide within a compilation unit, so each unit gets a fresh registry.
 * All state belongs to the run, so one analyzer may be shared between threads as long as the
 * {@link TypeCapabilityInfo} given to each run is not.
 */
public class GetterAnalyzer {
    private static final Logger logger = LoggerFactory.getLogger(GetterAnalyzer.class);
    public static final String UNKNOWN_FILE = "<unknown>";

    private static final Comparator<Node> SOURCE_ORDER = (a, b) -> {
        Optional<Range> ra = a.getRange();
        Optional<Range> rb = b.getRange();
        if (ra.isPresent() && rb.isPresent()) {
            return ra.get().begin.compareTo(rb.get().begin);
        }
        if (ra.isPresent()) {
            return -1;
        }
        return rb.isPresent() ? 1 : 0;
    };

    private final RuleConfig config;
    private final NodeClassifier classifier = new NodeClassifier();
    private final GeneratedFileFilter generatedFileFilter;

    public GetterAnalyzer(RuleConfig config) {
        this.config = config;
        this.generatedFileFilter = new GeneratedFileFilter(config.generatedPrefixes());
    }

    /**
     * Analyzes the compilation units.
     *
     * @param units the parsed sources, generated files among them are skipped
     * @param types static type information for the units
     * @param mode how the findings are to be presented
     * @param reporter receives diagnostics in {@link Mode#STANDALONE} and error diagnostics in both modes
     * @return the issues in traversal order when the mode is {@link Mode#AGGREGATOR}, otherwise empty
     */
    public List<Issue> run(List<CompilationUnit> units, TypeCapabilityInfo types, Mode mode, DiagnosticReporter reporter) {
        List<CompilationUnit> handWritten = generatedFileFilter.retainHandWritten(units);
        logger.debug("Skipping {} generated files", units.size() - handWritten.size());

        Run run = new Run(types, mode, reporter);
        for (CompilationUnit cu : handWritten) {
            run.analyse(cu);
        }
        logger.info("Found {} direct field reads in {} files", run.findings, handWritten.size());
        return run.issues;
    }

    /**
     * Convenience for callers that only want the diagnostics.
     */
    public List<Diagnostic> diagnostics(List<CompilationUnit> units, TypeCapabilityInfo types) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        run(units, types, Mode.STANDALONE, diagnostics::add);
        return diagnostics;
    }

    public static String fileName(CompilationUnit cu) {
        return cu.getStorage().map(s -> s.getPath().toString()).orElse(UNKNOWN_FILE);
    }

    /**
     * State for a single pass over the sources.
     */
    private class Run {
        private final CapabilityOracle oracle;
        private final FindingSynthesizer synthesizer;
        private ReplacedSpanRegistry registry;
        private final Mode mode;
        private final DiagnosticReporter reporter;
        private final List<Issue> issues = new ArrayList<>();
        private int findings;
        private String file;

        Run(TypeCapabilityInfo types, Mode mode, DiagnosticReporter reporter) {
            this.oracle = new CapabilityOracle(types, config);
            this.synthesizer = new FindingSynthesizer(config);
            this.mode = mode;
            this.reporter = reporter;
        }

        void analyse(CompilationUnit cu) {
            file = fileName(cu);
            // units parsed from memory all share the unknown file name, so spans are kept per unit
            registry = new ReplacedSpanRegistry();
            Deque<Node> stack = new ArrayDeque<>();
            stack.push(cu);
            while (!stack.isEmpty()) {
                Node node = stack.pop();
                NodeDecision decision = classifier.classify(node);
                if (decision == NodeDecision.SKIP_SUBTREE) {
                    continue;
                }
                if (decision == NodeDecision.INSPECT) {
                    inspect((FieldAccessExpr) node);
                }
                List<Node> children = children(node);
                for (int i = children.size() - 1; i >= 0; i--) {
                    stack.push(children.get(i));
                }
            }
        }

        private void inspect(FieldAccessExpr access) {
            Optional<Range> range = access.getRange();
            if (range.isPresent() && registry.isFiltered(file, range.get().begin)) {
                return;
            }
            if (!oracle.isUnsafeDirectRead(access)) {
                return;
            }
            if (range.isPresent() && registry.isAlreadyReplaced(file, Span.of(range.get()))) {
                return;
            }

            Finding finding;
            try {
                finding = synthesizer.synthesize(file, access, nestedRewrites(access));
            } catch (SynthesisException e) {
                logger.error("Could not build a replacement for {} in {} : {}", access, file, e.getMessage());
                reporter.report(Diagnostic.error(file, range.orElse(null), e.getMessage()));
                return;
            }

            registry.register(file, Span.of(finding.range()));
            findings++;

            Report report = new Report(finding);
            switch (mode) {
                case STANDALONE -> reporter.report(report.toDiagnostic());
                case AGGREGATOR -> issues.add(report.toIssue());
            }
        }

        /**
         * Field reads inside the scope of an accepted access. They fall within its span and will be
         * suppressed later, so the replacement has to cover them now.
         */
        private List<FieldAccessExpr> nestedRewrites(FieldAccessExpr access) {
            List<FieldAccessExpr> nested = new ArrayList<>();
            Deque<Node> stack = new ArrayDeque<>();
            stack.push(access.getScope());
            while (!stack.isEmpty()) {
                Node node = stack.pop();
                NodeDecision decision = classifier.classify(node);
                if (decision == NodeDecision.SKIP_SUBTREE) {
                    continue;
                }
                if (decision == NodeDecision.INSPECT && oracle.isUnsafeDirectRead((FieldAccessExpr) node)) {
                    nested.add((FieldAccessExpr) node);
                }
                children(node).forEach(stack::push);
            }
            return nested;
        }
    }

    private static List<Node> children(Node node) {
        List<Node> children = new ArrayList<>();
        for (Node child : node.getChildNodes()) {
            if (!(child instanceof Comment)) {
                children.add(child);
            }
        }
        children.sort(SOURCE_ORDER);
        return children;
    }
}
