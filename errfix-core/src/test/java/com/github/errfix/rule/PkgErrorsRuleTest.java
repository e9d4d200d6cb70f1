package com.github.errfix.rule;

import com.github.errfix.GoRewriteTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.github.errfix.GoAssertions.go;
import static org.assertj.core.api.Assertions.assertThat;

class PkgErrorsRuleTest implements GoRewriteTest {

    @Test
    void describesItself() {
        PkgErrorsRule rule = new PkgErrorsRule();
        assertThat(rule.getDisplayName()).isEqualTo("Use github.com/pkg/errors");
        assertThat(rule.getDescription()).contains("errors.Wrapf");
    }

    @Nested
    @DisplayName("Unchanged files")
    class Unchanged implements GoRewriteTest {

        @Test
        void emptyFunction() {
            rewriteRun(
                go(
                    """
                    package foo

                    func foo() {

                    }
                    """
                )
            );
        }

        @Test
        void nilReturnAndNilComparisonsAreLeftAlone() {
            rewriteRun(
                go(
                    """
                    package foo

                    // foo does nothing useful.
                    func foo(x int) error {
                    	if err != nil {
                    		return nil
                    	}
                    	if err == nil && x > 0 {
                    		return e
                    	}
                    	return nil  /* trailing */
                    }
                    """
                )
            );
        }

        @Test
        void nonLiteralFormatIsLeftAlone() {
            rewriteRun(
                go(
                    """
                    package foo

                    var format = "x"
                    var a = fmt.Errorf(format, 1)
                    var b = fmt.Errorf()
                    """
                )
            );
        }

        @Test
        void otherIdentifiersAreNotMatched() {
            rewriteRun(
                go(
                    """
                    package foo

                    func foo() error {
                    	e := bar()
                    	if e == ErrNotFound {
                    		return e
                    	}
                    	_, ok := e.(CustomError)
                    	return e
                    }
                    """
                )
            );
        }
    }

    @Nested
    @DisplayName("Return wrapping")
    class WithStack implements GoRewriteTest {

        @Test
        void keepsComments() {
            rewriteRun(
                go(
                    """
                    package foo

                    func foo() error {
                    	var err error
                    	// Comment A
                    	if err != nil {
                    		// Comment B
                    		return err
                    	}
                    	// Comment C
                    	return err
                    }
                    """,
                    """
                    package foo

                    import (
                    	"github.com/pkg/errors"
                    )

                    func foo() error {
                    	var err error
                    	// Comment A
                    	if err != nil {
                    		// Comment B
                    		return errors.WithStack(err)
                    	}
                    	// Comment C
                    	return errors.WithStack(err)
                    }
                    """
                )
            );
        }

        @Test
        void importGoesAfterPackageClause() {
            rewriteRun(
                go(
                    """
                    package main

                    func main() {

                    }

                    func foo() error {
                    	var err error
                    	return err
                    }
                    """,
                    """
                    package main

                    import (
                    	"github.com/pkg/errors"
                    )

                    func main() {

                    }

                    func foo() error {
                    	var err error
                    	return errors.WithStack(err)
                    }
                    """
                )
            );
        }

        @Test
        void replacesStandardErrorsImport() {
            rewriteRun(
                go(
                    """
                    package foo

                    import (
                    	"bar"
                    	"errors"
                    )

                    func foo() error {
                    	err := errors.New("error")
                    	return err
                    }
                    """,
                    """
                    package foo

                    import (
                    	"bar"
                    	"github.com/pkg/errors"
                    )

                    func foo() error {
                    	err := errors.New("error")
                    	return errors.WithStack(err)
                    }
                    """
                )
            );
        }

        @Test
        void keepsExistingImport() {
            rewriteRun(
                go(
                    """
                    package foo

                    import (
                    	"github.com/pkg/errors"
                    )

                    func foo() error {
                    	err := errors.New("error")
                    	return err
                    }
                    """,
                    """
                    package foo

                    import (
                    	"github.com/pkg/errors"
                    )

                    func foo() error {
                    	err := errors.New("error")
                    	return errors.WithStack(err)
                    }
                    """
                )
            );
        }

        @Test
        void onlyLastResultIsWrapped() {
            rewriteRun(
                go(
                    """
                    package foo

                    func foo() (int, error) {
                    	var err error
                    	return 1, err
                    }

                    func bar() (error, int) {
                    	return err, 1
                    }
                    """,
                    """
                    package foo

                    import (
                    	"github.com/pkg/errors"
                    )

                    func foo() (int, error) {
                    	var err error
                    	return 1, errors.WithStack(err)
                    }

                    func bar() (error, int) {
                    	return err, 1
                    }
                    """
                )
            );
        }

        @Test
        void singleImportBecomesGroup() {
            rewriteRun(
                go(
                    """
                    package main

                    import "bar"
                    import "foo"
                    import (
                    	"baz"
                    )

                    func foo() error {
                    	var err error
                    	return err
                    }
                    """,
                    """
                    package main

                    import (
                    	"bar"
                    	"github.com/pkg/errors"
                    )
                    import "foo"
                    import (
                    	"baz"
                    )

                    func foo() error {
                    	var err error
                    	return errors.WithStack(err)
                    }
                    """
                )
            );
        }

        @Test
        void returnInsideFunctionLiteral() {
            rewriteRun(
                go(
                    """
                    package foo

                    import "fmt"

                    var run = func() error {
                    	err := do()
                    	return err
                    }
                    """,
                    """
                    package foo

                    import (
                    	"fmt"
                    	"github.com/pkg/errors"
                    )

                    var run = func() error {
                    	err := do()
                    	return errors.WithStack(err)
                    }
                    """
                )
            );
        }
    }

    @Nested
    @DisplayName("Comparing and asserting on the cause")
    class Cause implements GoRewriteTest {

        @Test
        void comparisonsWithSentinelErrors() {
            rewriteRun(
                go(
                    """
                    package foo

                    func foo() error {
                    	var err error
                    	if err != nil {
                    		return err
                    	}
                    	if err == nil {
                    		return nil
                    	}
                    	if err != ErrNotFound {
                    		return err
                    	}
                    	if err == ErrNotFound {
                    		return nil
                    	}
                    	return err
                    }
                    """,
                    """
                    package foo

                    import (
                    	"github.com/pkg/errors"
                    )

                    func foo() error {
                    	var err error
                    	if err != nil {
                    		return errors.WithStack(err)
                    	}
                    	if err == nil {
                    		return nil
                    	}
                    	if errors.Cause(err) != ErrNotFound {
                    		return errors.WithStack(err)
                    	}
                    	if errors.Cause(err) == ErrNotFound {
                    		return nil
                    	}
                    	return errors.WithStack(err)
                    }
                    """
                )
            );
        }

        @Test
        void secondClauseOfCompoundCondition() {
            rewriteRun(
                go(
                    """
                    package foo

                    func foo() {
                    	if err := do(); err != nil && err != io.EOF {
                    		panic(1)
                    	}
                    	if err == nil || err == ErrSkip {
                    		panic(2)
                    	}
                    }
                    """,
                    """
                    package foo

                    import (
                    	"github.com/pkg/errors"
                    )

                    func foo() {
                    	if err := do(); err != nil && errors.Cause(err) != io.EOF {
                    		panic(1)
                    	}
                    	if err == nil || errors.Cause(err) == ErrSkip {
                    		panic(2)
                    	}
                    }
                    """
                )
            );
        }

        @Test
        void typeAssertionAndTypeSwitch() {
            rewriteRun(
                go(
                    """
                    package foo

                    func foo() error {
                    	var err error
                    	if e, ok := err.(CustomError); ok {
                    		return e
                    	}
                    	switch e := err.(type) {
                    	case CustomError:
                    		return e
                    	}
                    	return err
                    }
                    """,
                    """
                    package foo

                    import (
                    	"github.com/pkg/errors"
                    )

                    func foo() error {
                    	var err error
                    	if e, ok := errors.Cause(err).(CustomError); ok {
                    		return e
                    	}
                    	switch e := errors.Cause(err).(type) {
                    	case CustomError:
                    		return e
                    	}
                    	return errors.WithStack(err)
                    }
                    """
                )
            );
        }
    }

    @Nested
    @DisplayName("Error constructors")
    class Constructors implements GoRewriteTest {

        @Test
        void errorsNewOnlyTriggersImport() {
            rewriteRun(
                go(
                    """
                    package foo

                    import (
                    	"bar"
                    	"errors"
                    )

                    var ErrNotFound = errors.New("not found")
                    """,
                    """
                    package foo

                    import (
                    	"bar"
                    	"github.com/pkg/errors"
                    )

                    var ErrNotFound = errors.New("not found")
                    """
                )
            );
        }

        @Test
        void errorfAndWrapf() {
            rewriteRun(
                go(
                    """
                    package foo

                    import (
                    	"bar"
                    	"errors"
                    )

                    var ErrNotFound = fmt.Errorf("not found")
                    var ErrNotFound2 = fmt.Errorf("not found %d", 1)
                    var ErrNotFound3 = fmt.Errorf("not found %d %d", 1, 2)
                    var ErrNotFound4 = fmt.Errorf("not found: %v", err)
                    var ErrNotFound5 = fmt.Errorf("not found, %v", err)
                    var ErrNotFound6 = fmt.Errorf("not found %d: %v", 1, err)
                    var ErrNotFound7 = fmt.Errorf("not found %d %d: %v", 1, 2, err)
                    """,
                    """
                    package foo

                    import (
                    	"bar"
                    	"github.com/pkg/errors"
                    )

                    var ErrNotFound = errors.Errorf("not found")
                    var ErrNotFound2 = errors.Errorf("not found %d", 1)
                    var ErrNotFound3 = errors.Errorf("not found %d %d", 1, 2)
                    var ErrNotFound4 = errors.Wrapf(err, "not found")
                    var ErrNotFound5 = errors.Wrapf(err, "not found")
                    var ErrNotFound6 = errors.Wrapf(err, "not found %d", 1)
                    var ErrNotFound7 = errors.Wrapf(err, "not found %d %d", 1, 2)
                    """
                )
            );
        }

        @Test
        void wrapVerbIsTreatedLikeValueVerb() {
            rewriteRun(
                go(
                    """
                    package foo

                    func load(name string) error {
                    	if err := open(name); err != nil {
                    		return fmt.Errorf("open %s: %w", name, err)
                    	}
                    	return nil
                    }
                    """,
                    """
                    package foo

                    import (
                    	"github.com/pkg/errors"
                    )

                    func load(name string) error {
                    	if err := open(name); err != nil {
                    		return errors.Wrapf(err, "open %s", name)
                    	}
                    	return nil
                    }
                    """
                )
            );
        }

        @Test
        void formatIsRequotedLikeGo() {
            rewriteRun(
                go(
                    """
                    package foo

                    var a = fmt.Errorf(`raw "quoted": %v`, err)
                    var b = fmt.Errorf("caf\\u00e9\\t: %v", err)
                    var c = fmt.Errorf("only %v", x)
                    """,
                    """
                    package foo

                    import (
                    	"github.com/pkg/errors"
                    )

                    var a = errors.Wrapf(err, "raw \\"quoted\\"")
                    var b = errors.Wrapf(err, "café\\t")
                    var c = errors.Errorf("only %v", x)
                    """
                )
            );
        }

        @Test
        void errorVerbWithoutErrArgumentBecomesErrorf() {
            rewriteRun(
                go(
                    """
                    package foo

                    var a = fmt.Errorf("bad: %v", e)
                    var b = fmt.Errorf("%v")
                    """,
                    """
                    package foo

                    import (
                    	"github.com/pkg/errors"
                    )

                    var a = errors.Errorf("bad: %v", e)
                    var b = errors.Errorf("%v")
                    """
                )
            );
        }
    }

    @Nested
    @DisplayName("Import reconciliation")
    class Imports implements GoRewriteTest {

        @Test
        void aliasOfStandardErrorsImportIsKept() {
            rewriteRun(
                go(
                    """
                    package foo

                    import (
                    	"fmt"
                    	stderrors "errors"
                    )

                    var ErrX = stderrors.New("x")

                    func foo() error {
                    	return err
                    }
                    """,
                    """
                    package foo

                    import (
                    	"fmt"
                    	stderrors "github.com/pkg/errors"
                    )

                    var ErrX = stderrors.New("x")

                    func foo() error {
                    	return errors.WithStack(err)
                    }
                    """
                )
            );
        }

        @Test
        void appendsAfterTrailingCommentWithSameIndentation() {
            rewriteRun(
                go(
                    """
                    package foo

                    import (
                        "fmt" // formatting
                        "os"  // files
                    )

                    func foo() error {
                    	return err
                    }
                    """,
                    """
                    package foo

                    import (
                        "fmt" // formatting
                        "os"  // files
                        "github.com/pkg/errors"
                    )

                    func foo() error {
                    	return errors.WithStack(err)
                    }
                    """
                )
            );
        }

        @Test
        void fillsEmptyImportGroup() {
            rewriteRun(
                go(
                    """
                    package foo

                    import ()

                    func foo() error {
                    	return err
                    }
                    """,
                    """
                    package foo

                    import (
                    	"github.com/pkg/errors"
                    )

                    func foo() error {
                    	return errors.WithStack(err)
                    }
                    """
                )
            );
        }

        @Test
        void packageDocAndBuildTagsStayOnTop() {
            rewriteRun(
                go(
                    """
                    //go:build linux

                    // Package foo does things.
                    package foo

                    func foo() error {
                    	return err
                    }
                    """,
                    """
                    //go:build linux

                    // Package foo does things.
                    package foo

                    import (
                    	"github.com/pkg/errors"
                    )

                    func foo() error {
                    	return errors.WithStack(err)
                    }
                    """
                )
            );
        }

        @Test
        void conflictingNameIsNotResolved() {
            rewriteRun(
                go(
                    """
                    package foo

                    import (
                    	"example.com/lib/errors"
                    )

                    func foo() error {
                    	return err
                    }
                    """,
                    """
                    package foo

                    import (
                    	"example.com/lib/errors"
                    	"github.com/pkg/errors"
                    )

                    func foo() error {
                    	return errors.WithStack(err)
                    }
                    """
                )
            );
        }
    }
}
