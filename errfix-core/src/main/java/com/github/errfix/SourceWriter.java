package com.github.errfix;

import java.io.IOException;

/**
 * Receives every processed file together with the file it was produced from.
 * Called concurrently from several workers.
 */
public interface SourceWriter {

    void write(SourceFile original, SourceFile current) throws IOException;
}
