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
 * Rewrites a run of already-classified lines, keeping their count, order and origin.
 */
public interface CobolLineRewriter {

    List<CobolLine> processLines(List<CobolLine> lines);
}
