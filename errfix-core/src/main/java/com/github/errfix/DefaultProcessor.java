package com.github.errfix;

import com.github.errfix.parser.ParseException;
import com.github.errfix.rule.PkgErrorsRule;
import com.github.errfix.rule.Rule;
import com.github.errfix.rule.RuleException;
import com.github.errfix.tree.Go;
import com.github.errfix.tree.GoTreeWalker;
import com.github.errfix.tree.RenderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Supplier;

/**
 * Parses a file, runs every rule over the whole tree and renders the tree again
 * only when a rule changed something.
 * <p>
 * Rules are stateful, so a fresh set is obtained from the supplier for every file.
 */
public class DefaultProcessor implements Processor {

    private static final Logger LOG = LoggerFactory.getLogger(DefaultProcessor.class);

    private final GoSyntax syntax;
    private final Supplier<List<Rule>> rules;

    public DefaultProcessor() {
        this(new LosslessGoSyntax(), () -> List.of(new PkgErrorsRule()));
    }

    public DefaultProcessor(GoSyntax syntax, Supplier<List<Rule>> rules) {
        this.syntax = syntax;
        this.rules = rules;
    }

    @Override
    public SourceFile process(SourceFile file) throws ErrFixException {
        Go.File tree;
        try {
            tree = syntax.parse(file.getName(), file.getContent());
        } catch (ParseException e) {
            throw new ErrFixException("error parsing ast, " + e.getMessage(), e);
        }

        boolean changed = false;
        for (Rule rule : rules.get()) {
            try {
                GoTreeWalker.walk(tree, rule::visit);
            } catch (RuleException e) {
                throw new ErrFixException("error while traversing ast, " + e.getMessage(), e);
            }
            try {
                changed |= rule.finish(tree);
            } catch (RuleException e) {
                throw new ErrFixException("error ending traversal of ast, " + e.getMessage(), e);
            }
        }

        if (!changed) {
            LOG.debug("{}: unchanged", file.getName());
            return SourceFile.of(file.getName(), file.getContent());
        }
        try {
            String rendered = syntax.print(tree);
            LOG.debug("{}: rewritten", file.getName());
            return SourceFile.of(file.getName(), rendered);
        } catch (RenderException e) {
            throw new ErrFixException("error while generating source code based on ast, " + e.getMessage(), e);
        }
    }
}
