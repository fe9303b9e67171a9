package dev.mtrx.newsroom.exception;

import lombok.Getter;

import java.util.function.Function;

/**
 * Store unavailable or query failure. Wraps the driver cause and names the failed operation.
 */
@Getter
public class DatabaseException extends PipelineException {

    private final String operation;

    public DatabaseException(String operation, Throwable cause) {
        super(ErrorKind.DATABASE, "Database operation failed: " + operation
                + (cause != null && cause.getMessage() != null ? " (" + cause.getMessage() + ")" : ""), cause);
        this.operation = operation;
    }

    /**
     * Error mapper for {@code onErrorMap}: leaves pipeline exceptions untouched and wraps everything else.
     *
     * <pre>
     * articleRepository.existsByUrl(url)
     *         .onErrorMap(DatabaseException.wrap("articles.existsByUrl"));
     * </pre>
     */
    public static Function<Throwable, Throwable> wrap(String operation) {
        return error -> error instanceof PipelineException ? error : new DatabaseException(operation, error);
    }
}
