package com.github.errfix.tree;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Depth-first, pre-order traversal of a Go syntax tree.
 * <p>
 * A node's children are read after the node has been visited, so a visitor may
 * replace children in place and the replacements are visited as well.
 */
public final class GoTreeWalker {

    private GoTreeWalker() {
    }

    @FunctionalInterface
    public interface NodeVisitor<E extends Exception> {
        void visit(GoNode node) throws E;
    }

    /**
     * Visits {@code root} and all of its descendants. An exception thrown by the
     * visitor stops the traversal and is propagated unchanged.
     */
    public static <E extends Exception> void walk(GoNode root, NodeVisitor<E> visitor) throws E {
        Deque<GoNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            GoNode node = stack.pop();
            visitor.visit(node);
            List<GoNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
    }

    /**
     * Records the current shape of every node as its original shape. Called once by
     * the parser when a file is complete.
     */
    public static void recordOriginalState(GoNode root) {
        walk(root, GoNode::snapshot);
    }
}
