package org.dxworks.cobolscope.preprocessor;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

public final class CopyStatement implements DirectiveStatement {

    private final String member;
    private final String library;
    private final boolean suppress;
    private final List<ReplacementRule> replacing;

    public CopyStatement(String member, String library, boolean suppress, List<ReplacementRule> replacing) {
        this.member = member;
        this.library = library;
        this.suppress = suppress;
        this.replacing = Collections.unmodifiableList(replacing);
    }

    /**
     * Member name with any quotes removed.
     */
    public String getMember() {
        return member;
    }

    public Optional<String> getLibrary() {
        return Optional.ofNullable(library);
    }

    public boolean isSuppress() {
        return suppress;
    }

    public List<ReplacementRule> getReplacing() {
        return replacing;
    }
}
