package org.dxworks.cobolscope.preprocessor;

import java.util.Objects;

/**
 * A resolved copy member: its name, the file identifier used in source ranges, and its text.
 */
public final class Copybook {

    private final String name;
    private final String file;
    private final String text;

    public Copybook(String name, String file, String text) {
        this.name = Objects.requireNonNull(name, "name");
        this.file = Objects.requireNonNull(file, "file");
        this.text = Objects.requireNonNull(text, "text");
    }

    public String getName() {
        return name;
    }

    public String getFile() {
        return file;
    }

    public String getText() {
        return text;
    }
}
