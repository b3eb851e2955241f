package sa.com.cloudsolutions.getterlint.constants;

public class Constants {
    public static final String DEFAULT_CONFIG = "getterlint.yml";

    public static final String VARIABLES = "variables";
    public static final String BASE_PATH = "base_path";
    public static final String DEPENDENCIES = "dependencies";
    public static final String JAR_FILES = "jar_files";
    public static final String MODE = "mode";
    public static final String ACCESSOR_PREFIX = "accessor_prefix";
    public static final String REFLECTION_MARKER = "markers.reflection";
    public static final String LEGACY_MARKER = "markers.legacy";
    public static final String NULL_UNSAFE_MARKER = "markers.null_unsafe";
    public static final String GENERATED_PREFIXES = "generated_prefixes";
    public static final String APPLY_FIXES = "apply_fixes";
    public static final String ISSUES_OUTPUT = "issues_output";
    public static final String FAIL_ON_FINDINGS = "fail_on_findings";

    public static final String DEFAULT_ACCESSOR_PREFIX = "get";
    public static final String DEFAULT_REFLECTION_MARKER = "getDescriptorForType";
    public static final String DEFAULT_LEGACY_MARKER = "getDefaultInstanceForType";
    public static final String DEFAULT_NULL_UNSAFE_MARKER = "getCachedSize";

    public static final String MESSAGE_FORMAT = "avoid direct access to generated field %s use %s";

    private Constants() {}
}
