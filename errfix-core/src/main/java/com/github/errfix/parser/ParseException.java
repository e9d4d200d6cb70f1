package com.github.errfix.parser;

/**
 * Thrown when a Go source file cannot be scanned or parsed.
 * <p>
 * The message carries the file name and the 1-based line and column of the
 * offending token, e.g. {@code foo.go:3:9: expected ';', found 'else'}.
 */
public class ParseException extends Exception {

    private final String fileName;
    private final int line;
    private final int column;

    public ParseException(String fileName, int line, int column, String message) {
        super(fileName + ":" + line + ":" + column + ": " + message);
        this.fileName = fileName;
        this.line = line;
        this.column = column;
    }

    public String getFileName() {
        return fileName;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
