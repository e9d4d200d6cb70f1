package com.github.errfix;

import com.github.errfix.parser.ParseException;
import com.github.errfix.rule.PkgErrorsRule;
import com.github.errfix.rule.Rule;
import com.github.errfix.rule.RuleException;
import com.github.errfix.tree.Go;
import com.github.errfix.tree.GoNode;
import com.github.errfix.tree.RenderException;
import com.github.errfix.tree.TokenKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefaultProcessorTest {

    private static final String UNCHANGED = "package foo\n\n// nothing to do\nfunc foo() {}\n";

    @Test
    void unchangedFileKeepsItsContent() throws ErrFixException {
        SourceFile result = new DefaultProcessor().process(SourceFile.of("foo.go", UNCHANGED));

        assertThat(result.getName()).isEqualTo("foo.go");
        assertThat(result.getContent()).isEqualTo(UNCHANGED);
    }

    @Test
    void unchangedFileIsNotRendered() throws ErrFixException {
        GoSyntax failingPrinter = new LosslessGoSyntax() {
            @Override
            public String print(Go.File file) throws RenderException {
                throw new RenderException("must not be called");
            }
        };

        SourceFile result = new DefaultProcessor(failingPrinter, () -> List.of(new PkgErrorsRule()))
                .process(SourceFile.of("foo.go", UNCHANGED));

        assertThat(result.getContent()).isEqualTo(UNCHANGED);
    }

    @Test
    void everyFileGetsFreshRules() throws ErrFixException {
        List<Rule> created = new ArrayList<>();
        DefaultProcessor processor = new DefaultProcessor(new LosslessGoSyntax(), () -> {
            Rule rule = new PkgErrorsRule();
            created.add(rule);
            return List.of(rule);
        });

        SourceFile changed = processor.process(SourceFile.of("a.go", "package a\n\nfunc a() error {\n\treturn err\n}\n"));
        SourceFile unchanged = processor.process(SourceFile.of("b.go", UNCHANGED));

        assertThat(changed.getContent()).contains("errors.WithStack(err)");
        assertThat(unchanged.getContent()).isEqualTo(UNCHANGED);
        assertThat(created).hasSize(2);
        assertThat(created.get(0).isChanged()).isTrue();
        assertThat(created.get(1).isChanged()).isFalse();
    }

    @Nested
    @DisplayName("Error messages name the failing stage")
    class Failures {

        @Test
        void parseError() {
            assertThatThrownBy(() -> new DefaultProcessor().process(SourceFile.of("bad.go", "package 1\n")))
                    .isInstanceOf(ErrFixException.class)
                    .hasMessage("error parsing ast, bad.go:1:9: expected 'IDENT', found INT 1")
                    .hasCauseInstanceOf(ParseException.class);
        }

        @Test
        void visitError() {
            Rule failing = new StubRule() {
                @Override
                public void visit(GoNode node) throws RuleException {
                    throw new RuleException("boom");
                }
            };

            assertThatThrownBy(() -> processWith(failing))
                    .isInstanceOf(ErrFixException.class)
                    .hasMessage("error while traversing ast, boom");
        }

        @Test
        void finishError() {
            Rule failing = new StubRule() {
                @Override
                public boolean finish(Go.File file) throws RuleException {
                    throw new RuleException("late boom");
                }
            };

            assertThatThrownBy(() -> processWith(failing))
                    .isInstanceOf(ErrFixException.class)
                    .hasMessage("error ending traversal of ast, late boom");
        }

        @Test
        void renderError() {
            // only import declarations can be printed from scratch
            Rule breaking = new StubRule() {
                @Override
                public boolean finish(Go.File file) {
                    file.getDecls().add(new Go.GenDecl(TokenKind.VAR, GoNode.NO_POS, new ArrayList<>(), GoNode.NO_POS));
                    return true;
                }
            };

            assertThatThrownBy(() -> processWith(breaking))
                    .isInstanceOf(ErrFixException.class)
                    .hasMessage("error while generating source code based on ast, cannot print a synthesized GenDecl");
        }

        private void processWith(Rule rule) throws ErrFixException {
            new DefaultProcessor(new LosslessGoSyntax(), () -> List.of(rule)).process(SourceFile.of("foo.go", UNCHANGED));
        }
    }

    private abstract static class StubRule extends Rule {

        @Override
        public String getDisplayName() {
            return "stub";
        }

        @Override
        public String getDescription() {
            return "stub";
        }

        @Override
        public void visit(GoNode node) throws RuleException {
        }
    }
}
