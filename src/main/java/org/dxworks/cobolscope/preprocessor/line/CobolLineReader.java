/*
 * Copyright (C) 2017, Ulrich Wolffgang <u.wol@wwu.de>
 * All rights reserved.
 *
 * This software may be modified and distributed under the terms
 * of the BSD 3-clause license. See the LICENSE file for details.
 */

package org.dxworks.cobolscope.preprocessor.line;

import java.util.List;

/**
 * Splits physical lines into column areas and classifies them by their indicator.
 */
public interface CobolLineReader {

	CobolLine parseLine(String line, int lineNumber, String file);

	List<CobolLine> processLines(String lines, String file);

}
