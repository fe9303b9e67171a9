package dev.mtrx.newsroom.exception;

public class ResourceNotFoundException extends PipelineException {

    public ResourceNotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }

    public ResourceNotFoundException(String resource, String field, Object value) {
        super(ErrorKind.NOT_FOUND, String.format("%s not found with %s: '%s'", resource, field, value));
    }
}
