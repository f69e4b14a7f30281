package org.dxworks.cobolscope.preprocessor;

import java.util.Collections;
import java.util.List;

/**
 * {@code REPLACE ... .} or {@code REPLACE OFF.}; an OFF statement has no rules.
 */
public final class ReplaceStatement implements DirectiveStatement {

    private final List<ReplacementRule> rules;

    public ReplaceStatement(List<ReplacementRule> rules) {
        this.rules = Collections.unmodifiableList(rules);
    }

    public List<ReplacementRule> getRules() {
        return rules;
    }

    public boolean isOff() {
        return rules.isEmpty();
    }
}
