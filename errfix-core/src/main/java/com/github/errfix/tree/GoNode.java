package com.github.errfix.tree;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base class of every node in a Go syntax tree.
 * <p>
 * A parsed node remembers its original source span and the children it had right after
 * parsing. Rules mutate the tree by replacing children; the {@link GoPrinter} then copies
 * the original text of everything that is still in place and only prints what changed.
 * Nodes created by a rewrite have no span and are printed from scratch.
 */
public abstract class GoNode {

    public static final int NO_POS = -1;

    int pos = NO_POS;
    int end = NO_POS;

    @Nullable
    private List<GoNode> originalChildren;

    /**
     * Offset of the first character of this node, or {@link #NO_POS} for synthesized nodes.
     */
    public int getPos() {
        return pos;
    }

    /**
     * Offset just past the last character of this node, or {@link #NO_POS}.
     */
    public int getEnd() {
        return end;
    }

    public boolean isSynthetic() {
        return pos == NO_POS;
    }

    /**
     * Direct children in source order, without absent optional parts.
     */
    public abstract List<GoNode> children();

    /**
     * Prints a node that has no original text.
     */
    protected void printNew(GoPrinter printer) throws RenderException {
        throw new RenderException("cannot print a synthesized " + getClass().getSimpleName());
    }

    /**
     * Prints a parsed node: the original text between children is copied and every
     * child slot is printed with its current occupant.
     */
    protected void printOriginal(GoPrinter printer) throws RenderException {
        List<GoNode> before = getOriginalChildren();
        List<GoNode> now = children();
        if (before.size() != now.size()) {
            throw new RenderException("cannot print " + getClass().getSimpleName()
                    + " after its children changed from " + before.size() + " to " + now.size());
        }
        int cursor = pos;
        for (int i = 0; i < before.size(); i++) {
            GoNode slot = before.get(i);
            printer.copy(cursor, slot.pos);
            printer.print(now.get(i));
            cursor = slot.end;
        }
        printer.copy(cursor, end);
    }

    protected List<GoNode> getOriginalChildren() {
        return originalChildren != null ? originalChildren : Collections.emptyList();
    }

    void snapshot() {
        originalChildren = List.copyOf(children());
    }

    /**
     * Sets the source span; used by the parser.
     */
    public <T extends GoNode> T at(int pos, int end) {
        this.pos = pos;
        this.end = end;
        @SuppressWarnings("unchecked")
        T self = (T) this;
        return self;
    }

    /**
     * Flattens nodes, lists of nodes and {@code null}s into a child list.
     */
    protected static List<GoNode> nodes(@Nullable Object... parts) {
        List<GoNode> result = new ArrayList<>();
        for (Object part : parts) {
            if (part instanceof GoNode) {
                result.add((GoNode) part);
            } else if (part instanceof List) {
                for (Object element : (List<?>) part) {
                    if (element != null) {
                        result.add((GoNode) element);
                    }
                }
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + pos + ".." + end + "]";
    }
}
