package sa.com.cloudsolutions.getterlint.analysis;

import sa.com.cloudsolutions.getterlint.configuration.Settings;
import sa.com.cloudsolutions.getterlint.constants.Constants;

import java.util.Collection;
import java.util.List;

/**
 * Immutable snapshot of the rule parameters used for a single run.
 *
 * @param accessorPrefix the prefix generated accessors carry, {@code get} for {@code getName()}
 * @param reflectionMarker method whose presence identifies the current generation of generated types
 * @param legacyMarker method whose presence identifies the older generation
 * @param nullUnsafeMarker method identifying a generator variant whose accessors add no null safety
 * @param generatedPrefixes comment prefixes that mark a source file as machine generated
 */
public record RuleConfig(String accessorPrefix, String reflectionMarker, String legacyMarker,
                         String nullUnsafeMarker, List<String> generatedPrefixes) {

    public static final List<String> DEFAULT_GENERATED_PREFIXES = List.of(
            "Code generated",
            "Generated by the protocol buffer compiler",
            "Autogenerated by Thrift Compiler");

    public RuleConfig {
        generatedPrefixes = List.copyOf(generatedPrefixes);
    }

    public static RuleConfig defaults() {
        return new RuleConfig(Constants.DEFAULT_ACCESSOR_PREFIX, Constants.DEFAULT_REFLECTION_MARKER,
                Constants.DEFAULT_LEGACY_MARKER, Constants.DEFAULT_NULL_UNSAFE_MARKER, DEFAULT_GENERATED_PREFIXES);
    }

    /**
     * Builds the configuration from the loaded {@link Settings}, falling back to the defaults
     * for anything that has not been specified.
     */
    public static RuleConfig fromSettings() {
        Collection<String> prefixes = Settings.getPropertyList(Constants.GENERATED_PREFIXES, String.class);
        return new RuleConfig(
                Settings.getProperty(Constants.ACCESSOR_PREFIX, String.class).orElse(Constants.DEFAULT_ACCESSOR_PREFIX),
                Settings.getProperty(Constants.REFLECTION_MARKER, String.class).orElse(Constants.DEFAULT_REFLECTION_MARKER),
                Settings.getProperty(Constants.LEGACY_MARKER, String.class).orElse(Constants.DEFAULT_LEGACY_MARKER),
                Settings.getProperty(Constants.NULL_UNSAFE_MARKER, String.class).orElse(Constants.DEFAULT_NULL_UNSAFE_MARKER),
                prefixes.isEmpty() ? DEFAULT_GENERATED_PREFIXES : List.copyOf(prefixes));
    }

    /**
     * The accessor for a field, {@code name} becomes {@code getName}.
     */
    public String accessorName(String fieldName) {
        if (fieldName.isEmpty()) {
            return accessorPrefix;
        }
        return accessorPrefix + Character.toUpperCase(fieldName.charAt(0)) + fieldName.substring(1);
    }

    /**
     * True when the name already follows the accessor convention, e.g. {@code getName}.
     */
    public boolean isAccessorName(String name) {
        return name.length() > accessorPrefix.length()
                && name.startsWith(accessorPrefix)
                && Character.isUpperCase(name.charAt(accessorPrefix.length()));
    }
}
