package com.github.errfix.tree;

/**
 * Thrown when a mutated syntax tree cannot be turned back into source text.
 */
public class RenderException extends Exception {

    public RenderException(String message) {
        super(message);
    }
}
