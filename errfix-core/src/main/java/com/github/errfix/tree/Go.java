package com.github.errfix.tree;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.Setter;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * The node types of a Go syntax tree, mirroring the shapes of the Go grammar.
 * <p>
 * Every node is mutable. Rules replace children through the setters (or the
 * mutable lists) and the {@link GoPrinter} re-renders only what changed.
 */
public final class Go {

    private Go() {
    }

    public abstract static class Expr extends GoNode {
    }

    public abstract static class Stmt extends GoNode {
    }

    public abstract static class Decl extends GoNode {
    }

    public abstract static class Spec extends GoNode {
    }

    // factories for nodes created by rewrites

    public static Ident ident(String name) {
        return new Ident(name);
    }

    public static SelectorExpr selector(String pkg, String name) {
        return new SelectorExpr(ident(pkg), ident(name));
    }

    public static CallExpr call(Expr fun, Expr... args) {
        return new CallExpr(fun, new ArrayList<>(Arrays.asList(args)), false);
    }

    /**
     * A string literal; {@code quoted} must already carry its quotes.
     */
    public static BasicLit stringLit(String quoted) {
        return new BasicLit(TokenKind.STRING, quoted);
    }

    // ---------------------------------------------------------------- expressions

    @Getter
    @Setter
    @AllArgsConstructor
    public static class Ident extends Expr {
        private String name;

        public boolean is(String name) {
            return this.name.equals(name);
        }

        @Override
        public List<GoNode> children() {
            return Collections.emptyList();
        }

        @Override
        protected void printNew(GoPrinter printer) {
            printer.append(name);
        }
    }

    @Getter
    @Setter
    @AllArgsConstructor
    public static class BasicLit extends Expr {
        private TokenKind kind;

        /**
         * The literal exactly as written, quotes included.
         */
        private String value;

        @Override
        public List<GoNode> children() {
            return Collections.emptyList();
        }

        @Override
        protected void printNew(GoPrinter printer) {
            printer.append(value);
        }
    }

    @Getter
    @Setter
    @AllArgsConstructor
    public static class CompositeLit extends Expr {
        @Nullable
        private Expr type;
        private List<Expr> elts;

        @Override
        public List<GoNode> children() {
            return nodes(type, elts);
        }
    }

    @Getter
    @Setter
    @AllArgsConstructor
    public static class FuncLit extends Expr {
        private FuncType type;
        private BlockStmt body;

        @Override
        public List<GoNode> children() {
            return nodes(type, body);
        }
    }

    @Getter
    @Setter
    @AllArgsConstructor
    public static class ParenExpr extends Expr {
        private Expr x;

        @Override
        public List<GoNode> children() {
            return nodes(x);
        }
    }

    @Getter
    @Setter
    @AllArgsConstructor
    public static class SelectorExpr extends Expr {
        private Expr x;
        private Ident sel;

        /**
         * Whether this is {@code pkg.name} with a plain identifier on the left.
         */
        public boolean is(String pkg, String name) {
            return x instanceof Ident && ((Ident) x).is(pkg) && sel.is(name);
        }

        @Override
        public List<GoNode> children() {
            return nodes(x, sel);
        }

        @Override
        protected void printNew(GoPrinter printer) throws RenderException {
            printer.print(x);
            printer.append(".");
            printer.print(sel);
        }
    }

    /**
     * Index expression or generic instantiation, {@code x[i]} or {@code f[A, B]}.
     */
    @Getter
    @Setter
    @AllArgsConstructor
    public static class IndexExpr extends Expr {
        private Expr x;
        private List<Expr> indices;

        @Override
        public List<GoNode> children() {
            return nodes(x, indices);
        }
    }

    @Getter
    @Setter
    @AllArgsConstructor
    public static class SliceExpr extends Expr {
        private Expr x;
        @Nullable
        private Expr low;
        @Nullable
        private Expr high;
        @Nullable
        private Expr max;
        private boolean slice3;

        @Override
        public List<GoNode> children() {
            return nodes(x, low, high, max);
        }
    }

    /**
     * {@code x.(T)}; the type is {@code null} for the {@code x.(type)} guard of a type switch.
     */
    @Getter
    @Setter
    @AllArgsConstructor
    public static class TypeAssertExpr extends Expr {
        private Expr x;
        @Nullable
        private Expr type;

        @Override
        public List<GoNode> children() {
            return nodes(x, type);
        }
    }

    @Getter
    @Setter
    @AllArgsConstructor
    public static class CallExpr extends Expr {
        private Expr fun;
        private List<Expr> args;
        private boolean hasEllipsis;

        @Override
        public List<GoNode> children() {
            return nodes(fun, args);
        }

        @Override
        protected void printNew(GoPrinter printer) throws RenderException {
            printer.print(fun);
            printer.append("(");
            for (int i = 0; i < args.size(); i++) {
                if (i > 0) {
                    printer.append(", ");
                }
                printer.print(args.get(i));
            }
            printer.append(hasEllipsis ? "...)" : ")");
        }
    }

    /**
     * Pointer type or dereference, {@code *x}.
     */
    @Getter
    @Setter
    @AllArgsConstructor
    public static class StarExpr extends Expr {
        private Expr x;

        @Override
        public List<GoNode> children() {
            return nodes(x);
        }
    }

    @Getter
    @Setter
    @AllArgsConstructor
    public static class UnaryExpr extends Expr {
        private TokenKind op;
        private Expr x;

        @Override
        public List<GoNode> children() {
            return nodes(x);
        }
    }

    @Getter
    @Setter
    @AllArgsConstructor
    public static class BinaryExpr extends Expr {
        private Expr x;
        private TokenKind op;
        private Expr y;

        @Override
        public List<GoNode> children() {
            return nodes(x, y);
        }
    }

    @Getter
    @Setter
    @AllArgsConstructor
    public static class KeyValueExpr extends Expr {
        private Expr key;
        private Expr value;

        @Override
        public List<GoNode> children() {
            return nodes(key, value);
        }
    }

    /**
     * {@code ...T} in a variadic parameter, or {@code ...} as an array length.
     */
    @Getter
    @Setter
    @AllArgsConstructor
    public static class Ellipsis extends Expr {
        @Nullable
        private Expr elt;

        @Override
        public List<GoNode> children() {
            return nodes(elt);
        }
    }

    // ---------------------------------------------------------------- types

    @Getter
    @Setter
    @AllArgsConstructor
    public static class ArrayType extends Expr {
        /**
         * {@code null} for a slice type.
         */
        @Nullable
        private Expr len;
        private Expr elt;

        @Override
        public List<GoNode> children() {
            return nodes(len, elt);
        }
    }

    @Getter
    @Setter
    @AllArgsConstructor
    public static class StructType extends Expr {
        private FieldList fields;

        @Override
        public List<GoNode> children() {
            return nodes(fields);
        }
    }

    /**
     * A function signature. In a function literal the span starts at {@code func};
     * in a declaration it starts at the type parameters or parameters.
     */
    @Getter
    @Setter
    @AllArgsConstructor
    public static class FuncType extends Expr {
        @Nullable
        private FieldList typeParams;
        private FieldList params;
        @Nullable
        private FieldList results;

        @Override
        public List<GoNode> children() {
            return nodes(typeParams, params, results);
        }
    }

    @Getter
    @Setter
    @AllArgsConstructor
    public static class InterfaceType extends Expr {
        private FieldList methods;

        @Override
        public List<GoNode> children() {
            return nodes(methods);
        }
    }

    @Getter
    @Setter
    @AllArgsConstructor
    public static class MapType extends Expr {
        private Expr key;
        private Expr value;

        @Override
        public List<GoNode> children() {
            return nodes(key, value);
        }
    }

    public enum ChanDir {
        SEND, RECV, BOTH
    }

    @Getter
    @Setter
    @AllArgsConstructor
    public static class ChanType extends Expr {
        private ChanDir dir;
        private Expr value;

        @Override
        public List<GoNode> children() {
            return nodes(value);
        }
    }

    /**
     * A parameter, result, struct field, method or embedded type element.
     */
    @Getter
    @Setter
    @AllArgsConstructor
    public static class Field extends GoNode {
        private List<Ident> names;
        @Nullable
        private Expr type;
        @Nullable
        private BasicLit tag;

        @Override
        public List<GoNode> children() {
            return nodes(names, type, tag);
        }
    }

    /**
     * A delimited list of fields. A result list written as a single bare type has
     * no delimiters, and {@code opening} and {@code closing} are {@link GoNode#NO_POS}.
     */
    @Getter
    @Setter
    @AllArgsConstructor
    public static class FieldList extends GoNode {
        private List<Field> list;
        private int opening;
        private int closing;

        @Override
        public List<GoNode> children() {
            return nodes(list);
        }
    }

    // ---------------------------------------------------------------- statements

    @Getter
    @Setter
    @AllArgsConstructor
    public static class EmptyStmt extends Stmt {
        private boolean implicit;

        @Override
        public List<GoNode> children() {
            return Collections.emptyList();
        }
    }

    @Getter
    @Setter
    @AllArgsConstructor
    public static class DeclStmt extends Stmt {
        private GenDecl decl;

        @Override
        public List<GoNode> children() {
            return nodes(decl);
        }
    }

    @Getter
    @Setter
    @AllArgsConstructor
    public static class LabeledStmt extends Stmt {
        private Ident label;
        private Stmt stmt;

        @Override
        public List<GoNode> children() {
            return nodes(label, stmt);
        }
    }

    @Getter
    @Setter
    @AllArgsConstructor
    public static class ExprStmt extends Stmt {
        private Expr x;

        @Override
        public List<GoNode> children() {
            return nodes(x);
        }
    }

    @Getter
    @Setter
    @AllArgsConstructor
    public static class SendStmt extends Stmt {
        private Expr chan;
        private Expr value;

        @Override
        public List<GoNode> children() {
            return nodes(chan, value);
        }
    }

    @Getter
    @Setter
    @AllArgsConstructor
    public static class IncDecStmt extends Stmt {
        private Expr x;
        private TokenKind tok;

        @Override
        public List<GoNode> children() {
            return nodes(x);
        }
    }

    @Getter
    @Setter
    @AllArgsConstructor
    public static class AssignStmt extends Stmt {
        private List<Expr> lhs;
        private TokenKind tok;
        private List<Expr> rhs;

        @Override
        public List<GoNode> children() {
            return nodes(lhs, rhs);
        }
    }

    @Getter
    @Setter
    @AllArgsConstructor
    public static class GoStmt extends Stmt {
        private Expr call;

        @Override
        public List<GoNode> children() {
            return nodes(call);
        }
    }

    @Getter
    @Setter
    @AllArgsConstructor
    public static class DeferStmt extends Stmt {
        private Expr call;

        @Override
        public List<GoNode> children() {
            return nodes(call);
        }
    }

    @Getter
    @Setter
    @AllArgsConstructor
    public static class ReturnStmt extends Stmt {
        private List<Expr> results;

        @Override
        public List<GoNode> children() {
            return nodes(results);
        }
    }

    /**
     * {@code break}, {@code continue}, {@code goto} or {@code fallthrough}.
     */
    @Getter
    @Setter
    @AllArgsConstructor
    public static class BranchStmt extends Stmt {
        private TokenKind tok;
        @Nullable
        private Ident label;

        @Override
        public List<GoNode> children() {
            return nodes(label);
        }
    }

    @Getter
    @Setter
    @AllArgsConstructor
    public static class BlockStmt extends Stmt {
        private List<Stmt> list;

        @Override
        public List<GoNode> children() {
            return nodes(list);
        }
    }

    @Getter
    @Setter
    @AllArgsConstructor
    public static class IfStmt extends Stmt {
        @Nullable
        private Stmt init;
        private Expr cond;
        private BlockStmt body;

        /**
         * An {@link IfStmt} or a {@link BlockStmt}, or {@code null}.
         */
        @Nullable
        private Stmt els;

        @Override
        public List<GoNode> children() {
            return nodes(init, cond, body, els);
        }
    }

    /**
     * A {@code case} or {@code default} clause of an expression or type switch;
     * {@code default} has an empty expression list.
     */
    @Getter
    @Setter
    @AllArgsConstructor
    public static class CaseClause extends Stmt {
        private List<Expr> list;
        private List<Stmt> body;

        public boolean isDefault() {
            return list.isEmpty();
        }

        @Override
        public List<GoNode> children() {
            return nodes(list, body);
        }
    }

    @Getter
    @Setter
    @AllArgsConstructor
    public static class SwitchStmt extends Stmt {
        @Nullable
        private Stmt init;
        @Nullable
        private Expr tag;
        private BlockStmt body;

        @Override
        public List<GoNode> children() {
            return nodes(init, tag, body);
        }
    }

    /**
     * {@code switch x := y.(type)}; {@code assign} is an {@link ExprStmt} or
     * {@link AssignStmt} holding the {@link TypeAssertExpr} guard.
     */
    @Getter
    @Setter
    @AllArgsConstructor
    public static class TypeSwitchStmt extends Stmt {
        @Nullable
        private Stmt init;
        private Stmt assign;
        private BlockStmt body;

        @Override
        public List<GoNode> children() {
            return nodes(init, assign, body);
        }
    }

    /**
     * A {@code case} or {@code default} clause of a select statement.
     */
    @Getter
    @Setter
    @AllArgsConstructor
    public static class CommClause extends Stmt {
        @Nullable
        private Stmt comm;
        private List<Stmt> body;

        @Override
        public List<GoNode> children() {
            return nodes(comm, body);
        }
    }

    @Getter
    @Setter
    @AllArgsConstructor
    public static class SelectStmt extends Stmt {
        private BlockStmt body;

        @Override
        public List<GoNode> children() {
            return nodes(body);
        }
    }

    @Getter
    @Setter
    @AllArgsConstructor
    public static class ForStmt extends Stmt {
        @Nullable
        private Stmt init;
        @Nullable
        private Expr cond;
        @Nullable
        private Stmt post;
        private BlockStmt body;

        @Override
        public List<GoNode> children() {
            return nodes(init, cond, post, body);
        }
    }

    @Getter
    @Setter
    @AllArgsConstructor
    public static class RangeStmt extends Stmt {
        @Nullable
        private Expr key;
        @Nullable
        private Expr value;

        /**
         * {@code ASSIGN} or {@code DEFINE}, {@code null} for {@code for range x}.
         */
        @Nullable
        private TokenKind tok;
        private Expr x;
        private BlockStmt body;

        @Override
        public List<GoNode> children() {
            return nodes(key, value, x, body);
        }
    }

    // ---------------------------------------------------------------- declarations

    /**
     * An {@code import}, {@code const}, {@code type} or {@code var} declaration.
     * {@code lparen} and {@code rparen} are {@link GoNode#NO_POS} for an ungrouped one.
     */
    @Getter
    @Setter
    @AllArgsConstructor
    public static class GenDecl extends Decl {
        private TokenKind tok;
        private int lparen;
        private List<Spec> specs;
        private int rparen;

        public boolean isGrouped() {
            return lparen != NO_POS;
        }

        @Override
        public List<GoNode> children() {
            return nodes(specs);
        }

        @Override
        protected void printNew(GoPrinter printer) throws RenderException {
            if (tok != TokenKind.IMPORT) {
                super.printNew(printer);
                return;
            }
            printer.append("import (");
            for (Spec spec : specs) {
                printer.append("\n\t");
                printer.print(spec);
            }
            printer.append("\n)");
        }

        /**
         * Besides replaced specs, supports specs appended after the original ones.
         */
        @Override
        protected void printOriginal(GoPrinter printer) throws RenderException {
            List<GoNode> before = getOriginalChildren();
            if (specs.size() <= before.size()) {
                super.printOriginal(printer);
                return;
            }
            List<Spec> added = specs.subList(before.size(), specs.size());
            if (!isGrouped()) {
                GoNode only = before.get(0);
                printer.copy(pos, only.pos);
                printer.append("(\n\t");
                printer.print(specs.get(0));
                for (Spec spec : added) {
                    printer.append("\n\t");
                    printer.print(spec);
                }
                printer.append("\n)");
                printer.copy(only.end, end);
                return;
            }
            if (before.isEmpty()) {
                printer.copy(pos, lparen + 1);
                for (Spec spec : added) {
                    printer.append("\n\t");
                    printer.print(spec);
                }
                printer.append("\n");
                printer.copy(rparen, end);
                return;
            }
            int cursor = pos;
            for (int i = 0; i < before.size(); i++) {
                GoNode slot = before.get(i);
                printer.copy(cursor, slot.pos);
                printer.print(specs.get(i));
                cursor = slot.end;
            }
            GoNode last = before.get(before.size() - 1);
            int lineEnd = printer.endOfTrailingComment(last.end, rparen);
            printer.copy(cursor, lineEnd);
            String indent = printer.indentationOf(last.pos);
            for (Spec spec : added) {
                printer.append("\n").append(indent);
                printer.print(spec);
            }
            printer.copy(lineEnd, end);
        }
    }

    @Getter
    @Setter
    @AllArgsConstructor
    public static class FuncDecl extends Decl {
        @Nullable
        private FieldList recv;
        private Ident name;
        private FuncType type;

        /**
         * {@code null} for a function declared without a body.
         */
        @Nullable
        private BlockStmt body;

        @Override
        public List<GoNode> children() {
            return nodes(recv, name, type, body);
        }
    }

    @Getter
    @Setter
    @AllArgsConstructor
    public static class ImportSpec extends Spec {
        /**
         * The alias, including {@code _} and {@code .}; {@code null} when absent.
         */
        @Nullable
        private Ident name;
        private BasicLit path;

        @Override
        public List<GoNode> children() {
            return nodes(name, path);
        }

        @Override
        protected void printNew(GoPrinter printer) throws RenderException {
            if (name != null) {
                printer.print(name);
                printer.append(" ");
            }
            printer.print(path);
        }
    }

    @Getter
    @Setter
    @AllArgsConstructor
    public static class ValueSpec extends Spec {
        private List<Ident> names;
        @Nullable
        private Expr type;
        private List<Expr> values;

        @Override
        public List<GoNode> children() {
            return nodes(names, type, values);
        }
    }

    @Getter
    @Setter
    @AllArgsConstructor
    public static class TypeSpec extends Spec {
        private Ident name;
        @Nullable
        private FieldList typeParams;

        /**
         * Whether this is an alias declaration, {@code type A = B}.
         */
        private boolean assign;
        private Expr type;

        @Override
        public List<GoNode> children() {
            return nodes(name, typeParams, type);
        }
    }

    /**
     * A whole source file. Its span covers the entire source text.
     */
    @Getter
    @Setter
    @AllArgsConstructor
    public static class File extends GoNode {
        private String source;
        private String fileName;
        private Ident name;
        private List<Decl> decls;

        @Override
        public List<GoNode> children() {
            return nodes(name, decls);
        }

        /**
         * Besides replaced declarations, supports declarations inserted between the
         * original ones; each is printed on its own, separated by a blank line.
         */
        @Override
        protected void printOriginal(GoPrinter printer) throws RenderException {
            Set<GoNode> original = Collections.newSetFromMap(new IdentityHashMap<>());
            original.addAll(getOriginalChildren());
            Ident packageName = (Ident) getOriginalChildren().get(0);
            printer.copy(pos, packageName.pos);
            printer.print(name);
            int cursor = packageName.end;
            for (Decl decl : decls) {
                if (original.contains(decl)) {
                    printer.copy(cursor, decl.pos);
                    printer.print(decl);
                    cursor = decl.end;
                } else {
                    int lineEnd = printer.endOfTrailingComment(cursor, end);
                    printer.copy(cursor, lineEnd);
                    cursor = lineEnd;
                    printer.append("\n\n");
                    printer.print(decl);
                }
            }
            printer.copy(cursor, end);
        }
    }
}
