package org.dxworks.cobolscope.exception;

public class CobolScopeException extends RuntimeException {

    public CobolScopeException(String message) {
        super(message);
    }

    public CobolScopeException(String message, Throwable cause) {
        super(message, cause);
    }
}
