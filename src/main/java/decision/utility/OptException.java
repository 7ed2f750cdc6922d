package decision.utility;

public class OptException extends Exception {
    private final Enums.ErrorKind kind;

    /**
     * Custom exception class for the entire application.
     *
     * @param kind    category of the failure, used by callers to tell malformed requests apart.
     * @param message message that will be stored/printed with the exception.
     */
    public OptException(Enums.ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Enums.ErrorKind getKind() {
        return kind;
    }

    @Override
    public String toString() {
        return "OptException(" + kind + "): " + getMessage();
    }
}
