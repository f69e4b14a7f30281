package org.dxworks.cobolscope.exception;

public class ModelStoreException extends CobolScopeException {

    public ModelStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
