package org.dxworks.cobolscope.exception;

public class UnresolvedIncludeException extends CobolScopeException {

    private final String member;

    public UnresolvedIncludeException(String member, String library) {
        super("Copy member not found on the search path: " + member + (library != null ? " in " + library : ""));
        this.member = member;
    }

    public String getMember() {
        return member;
    }
}
