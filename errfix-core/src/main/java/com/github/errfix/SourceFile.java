package com.github.errfix;

import lombok.Value;
import org.jspecify.annotations.Nullable;

/**
 * One unit of work: a named Go source text, or the error that prevented reading it.
 */
@Value
public class SourceFile {

    String name;
    String content;

    /**
     * Set when the source could not be read; {@link #content} is empty then.
     */
    @Nullable
    Exception error;

    public static SourceFile of(String name, String content) {
        return new SourceFile(name, content, null);
    }

    public static SourceFile failed(String name, Exception error) {
        return new SourceFile(name, "", error);
    }

    public boolean hasError() {
        return error != null;
    }
}
