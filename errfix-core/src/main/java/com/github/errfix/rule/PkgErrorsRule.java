package com.github.errfix.rule;

import com.github.errfix.tree.Go;
import com.github.errfix.tree.GoNode;
import com.github.errfix.tree.GoStrings;
import com.github.errfix.tree.TokenKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Replaces the standard, stack-less error idioms with their {@code github.com/pkg/errors}
 * counterparts.
 * <ul>
 *   <li>{@code return ..., err} becomes {@code return ..., errors.WithStack(err)}</li>
 *   <li>{@code if err == ErrX} becomes {@code if errors.Cause(err) == ErrX}, also as the
 *       second clause of {@code err != nil && err != ErrX}</li>
 *   <li>{@code err.(T)} and {@code switch err.(type)} assert on {@code errors.Cause(err)}</li>
 *   <li>{@code fmt.Errorf("...: %v", args..., err)} becomes
 *       {@code errors.Wrapf(err, "...", args...)}, any other {@code fmt.Errorf} with a
 *       literal format becomes {@code errors.Errorf}</li>
 * </ul>
 * Matching is purely syntactic on the identifier {@code err}. Any match, including a
 * plain {@code errors.New}, makes {@link #finish} import the package, replacing an
 * import of the standard {@code errors} package when there is one.
 */
public class PkgErrorsRule extends Rule {

    public static final String PKG_PATH = "github.com/pkg/errors";

    private static final String STD_ERRORS_PATH = "errors";
    private static final String ERRORS = "errors";
    private static final String WITH_STACK = "WithStack";
    private static final String CAUSE = "Cause";
    private static final String NEW = "New";
    private static final String ERRORF = "Errorf";
    private static final String WRAPF = "Wrapf";
    private static final String ERR = "err";
    private static final String NIL = "nil";

    @Override
    public String getDisplayName() {
        return "Use github.com/pkg/errors";
    }

    @Override
    public String getDescription() {
        return "Wraps returned errors with a stack trace, compares and type-asserts on the error cause "
                + "and turns fmt.Errorf into errors.Errorf or errors.Wrapf.";
    }

    @Override
    public void visit(GoNode node) {
        boolean matched = false;
        if (node instanceof Go.ReturnStmt) {
            matched = fixReturn((Go.ReturnStmt) node);
        } else if (node instanceof Go.IfStmt) {
            matched = fixIf((Go.IfStmt) node);
        } else if (node instanceof Go.TypeAssertExpr) {
            matched = fixTypeAssert((Go.TypeAssertExpr) node);
        } else if (node instanceof Go.CallExpr) {
            matched = fixCall((Go.CallExpr) node);
        }
        if (matched) {
            markChanged();
        }
    }

    @Override
    public boolean finish(Go.File file) {
        if (!isChanged()) {
            return false;
        }
        ImportCoordinator.ensureImported(file, PKG_PATH, STD_ERRORS_PATH);
        return true;
    }

    private boolean fixReturn(Go.ReturnStmt stmt) {
        List<Go.Expr> results = stmt.getResults();
        if (results.isEmpty() || !isName(results.get(results.size() - 1), ERR)) {
            return false;
        }
        Go.Expr err = results.get(results.size() - 1);
        results.set(results.size() - 1, pkgCall(WITH_STACK, err));
        return true;
    }

    private boolean fixIf(Go.IfStmt stmt) {
        if (!(stmt.getCond() instanceof Go.BinaryExpr)) {
            return false;
        }
        Go.BinaryExpr cond = (Go.BinaryExpr) stmt.getCond();
        if (comparesErr(cond, false)) {
            cond.setX(pkgCall(CAUSE, cond.getX()));
            return true;
        }
        // err != nil && err != ErrX, only the second comparison is rewritten
        if ((cond.getOp() == TokenKind.LAND || cond.getOp() == TokenKind.LOR)
                && cond.getX() instanceof Go.BinaryExpr && comparesErr((Go.BinaryExpr) cond.getX(), true)
                && cond.getY() instanceof Go.BinaryExpr && comparesErr((Go.BinaryExpr) cond.getY(), false)) {
            Go.BinaryExpr second = (Go.BinaryExpr) cond.getY();
            second.setX(pkgCall(CAUSE, second.getX()));
            return true;
        }
        return false;
    }

    private static boolean comparesErr(Go.BinaryExpr cond, boolean withNil) {
        if (!isName(cond.getX(), ERR) || (cond.getOp() != TokenKind.EQL && cond.getOp() != TokenKind.NEQ)) {
            return false;
        }
        return isName(cond.getY(), NIL) == withNil;
    }

    private boolean fixTypeAssert(Go.TypeAssertExpr expr) {
        if (!isName(expr.getX(), ERR)) {
            return false;
        }
        expr.setX(pkgCall(CAUSE, expr.getX()));
        return true;
    }

    private boolean fixCall(Go.CallExpr call) {
        if (isPkgSelector(call.getFun(), ERRORS, NEW)) {
            return true;
        }
        if (!isPkgSelector(call.getFun(), "fmt", ERRORF)) {
            return false;
        }
        List<Go.Expr> args = call.getArgs();
        if (args.isEmpty() || !(args.get(0) instanceof Go.BasicLit)) {
            return false;
        }
        Go.BasicLit lit = (Go.BasicLit) args.get(0);
        if (lit.getKind() != TokenKind.STRING) {
            return false;
        }
        Optional<String> format = GoStrings.unquote(lit.getValue());
        if (format.isEmpty()) {
            return false;
        }
        Go.Expr last = args.get(args.size() - 1);
        if (args.size() >= 2 && isName(last, ERR) && endsWithErrorVerb(format.get())) {
            String trimmed = trimRight(format.get().substring(0, format.get().length() - 2), " :,");
            List<Go.Expr> newArgs = new ArrayList<>();
            newArgs.add(last);
            newArgs.add(Go.stringLit(GoStrings.quote(trimmed)));
            newArgs.addAll(args.subList(1, args.size() - 1));
            call.setArgs(newArgs);
            call.setFun(Go.selector(ERRORS, WRAPF));
            return true;
        }
        call.setFun(Go.selector(ERRORS, ERRORF));
        return true;
    }

    private static boolean endsWithErrorVerb(String format) {
        return format.endsWith("%v") || format.endsWith("%w");
    }

    private static String trimRight(String s, String cutset) {
        int end = s.length();
        while (end > 0 && cutset.indexOf(s.charAt(end - 1)) >= 0) {
            end--;
        }
        return s.substring(0, end);
    }

    private static Go.CallExpr pkgCall(String function, Go.Expr arg) {
        return Go.call(Go.selector(ERRORS, function), arg);
    }

    private static boolean isName(Go.Expr expr, String name) {
        return expr instanceof Go.Ident && ((Go.Ident) expr).is(name);
    }

    private static boolean isPkgSelector(Go.Expr expr, String pkg, String name) {
        return expr instanceof Go.SelectorExpr && ((Go.SelectorExpr) expr).is(pkg, name);
    }
}
