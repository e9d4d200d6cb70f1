package com.github.errfix;

/**
 * Rewrites one source file.
 */
public interface Processor {

    /**
     * Returns the rewritten file, or a file with the same name and content when
     * nothing matched.
     */
    SourceFile process(SourceFile file) throws ErrFixException;
}
