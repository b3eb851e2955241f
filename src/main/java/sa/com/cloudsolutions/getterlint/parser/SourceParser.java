package sa.com.cloudsolutions.getterlint.parser;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.symbolsolver.JavaSymbolSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.CombinedTypeSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.JarTypeSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.JavaParserTypeSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.ReflectionTypeSolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sa.com.cloudsolutions.getterlint.configuration.Settings;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Sets up a symbol resolving Java Parser over a source tree and parses the files in it.
 */
public class SourceParser {
    private static final Logger logger = LoggerFactory.getLogger(SourceParser.class);
    public static final String SUFFIX = ".java";

    private final Path basePath;
    private final JavaParser javaParser;
    private final CombinedTypeSolver combinedTypeSolver;

    /**
     * @param basePath the top level folder of the sources. Classes without a package live directly in it.
     * @param jarFiles additional jars that the sources depend on
     * @throws IOException if one of the jar files cannot be read
     */
    public SourceParser(Path basePath, String... jarFiles) throws IOException {
        this.basePath = basePath;
        combinedTypeSolver = new CombinedTypeSolver();
        combinedTypeSolver.add(new ReflectionTypeSolver());
        combinedTypeSolver.add(new JavaParserTypeSolver(basePath));

        for (String jarFile : jarFiles) {
            if (!jarFile.isBlank()) {
                combinedTypeSolver.add(new JarTypeSolver(jarFile.strip()));
            }
        }

        JavaSymbolSolver symbolResolver = new JavaSymbolSolver(combinedTypeSolver);
        ParserConfiguration parserConfiguration = new ParserConfiguration().setSymbolResolver(symbolResolver);
        javaParser = new JavaParser(parserConfiguration);
    }

    /**
     * Creates a parser for the base path and jar files named in the {@link Settings}.
     */
    public static SourceParser fromSettings() throws IOException {
        String base = Settings.getBasePath();
        if (base == null) {
            throw new IllegalStateException("base_path has not been configured");
        }
        return new SourceParser(Paths.get(base), Settings.getJarFiles());
    }

    /**
     * Parses every java file below the base path, in a stable order.
     * Files that do not parse are logged and left out.
     */
    public List<CompilationUnit> parseAll() throws IOException {
        List<Path> javaFiles;
        try (Stream<Path> paths = Files.walk(basePath)) {
            javaFiles = paths
                    .filter(Files::isRegularFile)
                    .filter(path -> path.toString().endsWith(SUFFIX))
                    .sorted()
                    .toList();
        }

        List<CompilationUnit> units = new ArrayList<>();
        for (Path javaFile : javaFiles) {
            parse(javaFile).ifPresent(units::add);
        }
        logger.info("Parsed {} of {} files under {}", units.size(), javaFiles.size(), basePath);
        return units;
    }

    public Optional<CompilationUnit> parse(Path javaFile) throws IOException {
        ParseResult<CompilationUnit> result = javaParser.parse(javaFile);
        if (result.isSuccessful() && result.getResult().isPresent()) {
            return result.getResult();
        }
        logger.warn("Could not parse {} : {}", javaFile, result.getProblems());
        return Optional.empty();
    }

    /**
     * Parses source held in memory. The result has no storage, its file name is reported as unknown.
     */
    public Optional<CompilationUnit> parse(String code) {
        ParseResult<CompilationUnit> result = javaParser.parse(code);
        if (result.isSuccessful()) {
            return result.getResult();
        }
        logger.warn("Could not parse source : {}", result.getProblems());
        return Optional.empty();
    }

    public CombinedTypeSolver getTypeSolver() {
        return combinedTypeSolver;
    }

    public Path getBasePath() {
        return basePath;
    }
}
