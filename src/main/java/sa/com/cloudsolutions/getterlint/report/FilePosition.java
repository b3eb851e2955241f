package sa.com.cloudsolutions.getterlint.report;

/**
 * A one based line and column inside a file.
 */
public record FilePosition(String file, int line, int column) {
    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
