package com.github.errfix.rule;

import com.github.errfix.tree.Go;
import com.github.errfix.tree.GoNode;

/**
 * A stateful rewrite of one Go file.
 * <p>
 * A rule instance is used for exactly one file: {@link #visit(GoNode)} is called for
 * every node of a depth-first traversal, then {@link #finish(Go.File)} once. A rule
 * records whether it changed anything so that unchanged files are never re-rendered.
 */
public abstract class Rule {

    private boolean changed;

    public abstract String getDisplayName();

    public abstract String getDescription();

    /**
     * Inspects one node and rewrites it in place when it matches.
     *
     * @throws RuleException to abort the traversal
     */
    public abstract void visit(GoNode node) throws RuleException;

    /**
     * Completes the rewrite after the traversal, e.g. by reconciling imports.
     *
     * @return whether the rule changed the file
     */
    public boolean finish(Go.File file) throws RuleException {
        return changed;
    }

    public boolean isChanged() {
        return changed;
    }

    protected void markChanged() {
        changed = true;
    }
}
