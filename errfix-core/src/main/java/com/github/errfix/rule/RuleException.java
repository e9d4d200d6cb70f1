package com.github.errfix.rule;

/**
 * Thrown by a {@link Rule} to abort the traversal of a file.
 */
public class RuleException extends Exception {

    public RuleException(String message) {
        super(message);
    }

    public RuleException(String message, Throwable cause) {
        super(message, cause);
    }
}
