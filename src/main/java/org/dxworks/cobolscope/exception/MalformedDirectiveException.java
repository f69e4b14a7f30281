package org.dxworks.cobolscope.exception;

public class MalformedDirectiveException extends CobolScopeException {

    public MalformedDirectiveException(String message) {
        super(message);
    }
}
