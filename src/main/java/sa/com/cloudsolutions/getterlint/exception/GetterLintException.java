package sa.com.cloudsolutions.getterlint.exception;

public class GetterLintException extends Exception {

    public GetterLintException(String message) {
        super(message);
    }

    public GetterLintException(String message, Throwable cause) {
        super(message, cause);
    }

    public GetterLintException(Throwable cause) {
        super(cause);
    }
}
