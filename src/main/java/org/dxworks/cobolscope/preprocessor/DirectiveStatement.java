package org.dxworks.cobolscope.preprocessor;

/**
 * A parsed compiler-directing statement.
 */
public interface DirectiveStatement {
}
