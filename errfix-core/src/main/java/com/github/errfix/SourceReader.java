package com.github.errfix;

import java.util.stream.Stream;

/**
 * Supplies the files to process. A source that cannot be read is reported as a
 * {@link SourceFile} carrying the error rather than by failing the stream.
 */
public interface SourceReader {

    Stream<SourceFile> read() throws ErrFixException;
}
