package work.lcod.flowguard.graph;

/**
 * Raised when a document cannot be treated as a flow graph at all. Carries a machine code so
 * callers can tell the malformed-input cases apart without parsing the message.
 */
public final class FatalInputException extends RuntimeException {
    private final String code;

    public FatalInputException(String code, String message) {
        super(message);
        this.code = code;
    }

    public FatalInputException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
