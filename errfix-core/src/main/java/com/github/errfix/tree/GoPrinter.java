package com.github.errfix.tree;

/**
 * Turns a (possibly mutated) syntax tree back into source text.
 * <p>
 * Untouched regions are copied byte-for-byte from the original source, so
 * formatting and comments survive every rewrite that does not replace them.
 */
public final class GoPrinter {

    private final String source;
    private final StringBuilder out = new StringBuilder();

    private GoPrinter(String source) {
        this.source = source;
    }

    public static String print(Go.File file) throws RenderException {
        GoPrinter printer = new GoPrinter(file.getSource());
        printer.print((GoNode) file);
        return printer.out.toString();
    }

    public void print(GoNode node) throws RenderException {
        if (node.isSynthetic()) {
            node.printNew(this);
        } else {
            node.printOriginal(this);
        }
    }

    public GoPrinter append(String text) {
        out.append(text);
        return this;
    }

    /**
     * Copies the original source between two offsets.
     */
    public void copy(int from, int to) throws RenderException {
        if (from < 0 || to < from || to > source.length()) {
            throw new RenderException("invalid source range " + from + ".." + to);
        }
        out.append(source, from, to);
    }

    /**
     * Returns the offset where the comments trailing {@code from} on the same line
     * end, or {@code from} itself when the rest of the line holds none. A block
     * comment running onto the next line is not skipped.
     */
    int endOfTrailingComment(int from, int limit) {
        int result = from;
        int i = from;
        while (true) {
            while (i < limit && (source.charAt(i) == ' ' || source.charAt(i) == '\t')) {
                i++;
            }
            if (i + 1 >= limit || source.charAt(i) != '/') {
                return result;
            }
            if (source.charAt(i + 1) == '/') {
                int nl = source.indexOf('\n', i);
                return nl < 0 || nl > limit ? limit : nl;
            }
            if (source.charAt(i + 1) != '*') {
                return result;
            }
            int close = source.indexOf("*/", i + 2);
            int nl = source.indexOf('\n', i);
            if (close < 0 || close + 2 > limit || (nl >= 0 && nl < close)) {
                return result;
            }
            i = close + 2;
            result = i;
        }
    }

    /**
     * Returns the indentation of the line holding {@code offset}, or a tab when
     * the node does not start its line.
     */
    String indentationOf(int offset) {
        int lineStart = source.lastIndexOf('\n', offset - 1) + 1;
        String prefix = source.substring(lineStart, offset);
        return prefix.isBlank() ? prefix : "\t";
    }
}
