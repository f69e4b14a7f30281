package org.dxworks.cobolscope.preprocessor.line;

public enum CobolLineType {
    NORMAL,
    CONTINUATION,
    COMMENT,
    BLANK,
    /** {@code >>} compiler-directing lines; they carry no program text. */
    COMPILER_DIRECTIVE;

    public boolean isCode() {
        return this == NORMAL || this == CONTINUATION;
    }
}
