package it.unimib.datai.runinator.console;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

public final class ConsoleException extends RuntimeException {
    private final FailureKind kind;
    private final int status;
    private final String body;

    public ConsoleException(FailureKind kind, String message) {
        this(kind, 0, message, null, null);
    }

    public ConsoleException(FailureKind kind, String message, Throwable cause) {
        this(kind, 0, message, null, cause);
    }

    public ConsoleException(FailureKind kind, int status, String message, String body, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.status = status;
        this.body = body;
    }

    public FailureKind kind() {
        return kind;
    }

    /**
     * HTTP status of the failed exchange, or 0 when no response was received.
     */
    public int status() {
        return status;
    }

    public String body() {
        return body;
    }

    /**
     * Recovers the console failure behind a future's completion exception.
     */
    public static ConsoleException unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        if (current instanceof ConsoleException ce) {
            return ce;
        }
        String message = current.getMessage() == null ? current.getClass().getSimpleName() : current.getMessage();
        return new ConsoleException(FailureKind.TRANSPORT, message, current);
    }
}
