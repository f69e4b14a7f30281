package org.dxworks.cobolscope.exception;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class CircularIncludeException extends CobolScopeException {

    private final List<String> cycle;

    public CircularIncludeException(List<String> cycle) {
        super("Circular COPY chain: " + String.join(" -> ", cycle));
        this.cycle = Collections.unmodifiableList(new ArrayList<>(cycle));
    }

    public List<String> getCycle() {
        return cycle;
    }
}
