package com.github.errfix;

import com.github.errfix.parser.ParseException;
import com.github.errfix.tree.Go;
import com.github.errfix.tree.RenderException;

/**
 * Turns Go source text into a mutable syntax tree and back.
 */
public interface GoSyntax {

    Go.File parse(String fileName, String source) throws ParseException;

    /**
     * Renders a tree, reproducing the original text of every untouched region.
     */
    String print(Go.File file) throws RenderException;
}
