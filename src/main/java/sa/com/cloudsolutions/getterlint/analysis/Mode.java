package sa.com.cloudsolutions.getterlint.analysis;

/**
 * How findings leave the analyzer.
 */
public enum Mode {
    /** Each finding becomes a diagnostic with a suggested fix, delivered to the reporter. */
    STANDALONE,
    /** Each finding becomes an issue record, returned to the caller for an external aggregator. */
    AGGREGATOR;

    public static Mode fromString(String value) {
        if (value == null || value.isBlank()) {
            return STANDALONE;
        }
        return Mode.valueOf(value.strip().toUpperCase());
    }
}
