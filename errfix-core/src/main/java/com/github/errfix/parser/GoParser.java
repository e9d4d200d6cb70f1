package com.github.errfix.parser;

import com.github.errfix.tree.Go;
import com.github.errfix.tree.GoNode;
import com.github.errfix.tree.GoTreeWalker;
import com.github.errfix.tree.TokenKind;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static com.github.errfix.tree.TokenKind.*;

/**
 * Recursive descent parser for Go source files.
 * <p>
 * Every node records the span of source text it was parsed from, so that the
 * printer can reproduce untouched regions exactly. A parser instance parses one
 * file and is not reusable.
 */
public final class GoParser {

    private static final Set<TokenKind> TYPE_START = EnumSet.of(
            IDENT, LBRACK, STRUCT, MUL, FUNC, INTERFACE, MAP, CHAN, ARROW, LPAREN);

    // tokens that can follow the first identifier of a type parameter list
    private static final Set<TokenKind> TYPE_PARAM_FOLLOW = EnumSet.of(
            IDENT, COMMA, TILDE, MUL, LBRACK, INTERFACE, FUNC, MAP, CHAN, STRUCT, ARROW);

    private enum SimpleStmtMode {
        BASIC, LABEL_OK, RANGE_OK
    }

    private final String fileName;
    private final String source;
    private final GoScanner scanner;

    private List<Token> tokens = Collections.emptyList();
    private int index;
    private Token tok;
    private int prevEnd;

    // < 0 while parsing a control clause, >= 0 inside any bracketed expression
    private int exprLev;

    public GoParser(String fileName, String source) {
        this.fileName = fileName;
        this.source = source;
        this.scanner = new GoScanner(fileName, source);
    }

    public Go.File parseFile() throws ParseException {
        tokens = scanner.scan();
        index = 0;
        tok = tokens.get(0);

        expect(PACKAGE);
        Go.Ident name = parseIdent();
        expectSemi();

        List<Go.Decl> decls = new ArrayList<>();
        while (tok.getKind() != EOF) {
            decls.add(parseDecl());
            expectSemi();
        }
        Go.File file = new Go.File(source, fileName, name, decls).at(0, source.length());
        GoTreeWalker.recordOriginalState(file);
        return file;
    }

    // ---------------------------------------------------------------- token handling

    private void next() {
        if (!tok.isImplicitSemicolon()) {
            prevEnd = tok.getEnd();
        }
        if (index < tokens.size() - 1) {
            index++;
        }
        tok = tokens.get(index);
    }

    private Token peek(int ahead) {
        return tokens.get(Math.min(index + ahead, tokens.size() - 1));
    }

    private boolean is(TokenKind kind) {
        return tok.getKind() == kind;
    }

    private boolean got(TokenKind kind) {
        if (is(kind)) {
            next();
            return true;
        }
        return false;
    }

    private Token expect(TokenKind kind) throws ParseException {
        if (!is(kind)) {
            throw errorExpected("'" + kind.getText() + "'");
        }
        Token t = tok;
        next();
        return t;
    }

    private void expectSemi() throws ParseException {
        // a semicolon may be omitted before a closing ")" or "}"
        if (is(RPAREN) || is(RBRACE)) {
            return;
        }
        if (!got(SEMICOLON)) {
            throw errorExpected("';'");
        }
    }

    private ParseException errorExpected(String what) {
        return scanner.error(tok.getPos(), "expected " + what + ", found " + tok.describe());
    }

    private ParseException error(int at, String message) {
        return scanner.error(at, message);
    }

    // ---------------------------------------------------------------- declarations

    private Go.Decl parseDecl() throws ParseException {
        switch (tok.getKind()) {
            case IMPORT:
            case CONST:
            case TYPE:
            case VAR:
                return parseGenDecl();
            case FUNC:
                return parseFuncDecl();
            default:
                throw errorExpected("declaration");
        }
    }

    private Go.GenDecl parseGenDecl() throws ParseException {
        Token keyword = tok;
        next();
        List<Go.Spec> specs = new ArrayList<>();
        if (is(LPAREN)) {
            int lparen = tok.getPos();
            next();
            while (!is(RPAREN) && !is(EOF)) {
                specs.add(parseSpec(keyword.getKind()));
                expectSemi();
            }
            Token rparen = expect(RPAREN);
            return new Go.GenDecl(keyword.getKind(), lparen, specs, rparen.getPos())
                    .at(keyword.getPos(), rparen.getEnd());
        }
        Go.Spec spec = parseSpec(keyword.getKind());
        specs.add(spec);
        return new Go.GenDecl(keyword.getKind(), GoNode.NO_POS, specs, GoNode.NO_POS)
                .at(keyword.getPos(), spec.getEnd());
    }

    private Go.Spec parseSpec(TokenKind keyword) throws ParseException {
        switch (keyword) {
            case IMPORT:
                return parseImportSpec();
            case TYPE:
                return parseTypeSpec();
            default:
                return parseValueSpec();
        }
    }

    private Go.ImportSpec parseImportSpec() throws ParseException {
        int start = tok.getPos();
        Go.Ident name = null;
        if (is(IDENT)) {
            name = parseIdent();
        } else if (is(PERIOD)) {
            name = new Go.Ident(".").at(tok.getPos(), tok.getEnd());
            next();
        }
        if (!is(STRING)) {
            throw errorExpected("import path");
        }
        Go.BasicLit path = parseBasicLit();
        return new Go.ImportSpec(name, path).at(start, path.getEnd());
    }

    private Go.ValueSpec parseValueSpec() throws ParseException {
        List<Go.Ident> names = parseIdentList();
        Go.Expr type = null;
        List<Go.Expr> values = new ArrayList<>();
        if (!is(ASSIGN) && !is(SEMICOLON) && !is(RPAREN)) {
            type = parseType();
        }
        if (got(ASSIGN)) {
            values = parseExprList();
        }
        return new Go.ValueSpec(names, type, values).at(names.get(0).getPos(), prevEnd);
    }

    private Go.TypeSpec parseTypeSpec() throws ParseException {
        Go.Ident name = parseIdent();
        Go.FieldList typeParams = null;
        if (is(LBRACK) && peek(1).getKind() == IDENT && TYPE_PARAM_FOLLOW.contains(peek(2).getKind())) {
            typeParams = parseTypeParams();
        }
        boolean assign = got(ASSIGN);
        Go.Expr type = parseType();
        return new Go.TypeSpec(name, typeParams, assign, type).at(name.getPos(), type.getEnd());
    }

    private Go.FuncDecl parseFuncDecl() throws ParseException {
        int start = expect(FUNC).getPos();
        Go.FieldList recv = null;
        if (is(LPAREN)) {
            recv = parseParameters();
        }
        Go.Ident name = parseIdent();
        Go.FieldList typeParams = null;
        if (is(LBRACK)) {
            typeParams = parseTypeParams();
        }
        Go.FuncType type = parseSignature(typeParams, typeParams != null ? typeParams.getPos() : tok.getPos());
        Go.BlockStmt body = null;
        if (is(LBRACE)) {
            body = parseBlockStmt();
        }
        return new Go.FuncDecl(recv, name, type, body).at(start, body != null ? body.getEnd() : type.getEnd());
    }

    private Go.FuncType parseSignature(Go.@Nullable FieldList typeParams, int start) throws ParseException {
        Go.FieldList params = parseParameters();
        Go.FieldList results = parseResult();
        int end = results != null ? results.getEnd() : params.getEnd();
        return new Go.FuncType(typeParams, params, results).at(start, end);
    }

    // ---------------------------------------------------------------- field lists

    private Go.FieldList parseTypeParams() throws ParseException {
        Token lbrack = expect(LBRACK);
        List<Go.Field> fields = new ArrayList<>();
        while (!is(RBRACK) && !is(EOF)) {
            List<Go.Ident> names = parseIdentList();
            Go.Expr constraint = parseConstraint();
            fields.add(new Go.Field(names, constraint, null).at(names.get(0).getPos(), constraint.getEnd()));
            if (!got(COMMA)) {
                break;
            }
        }
        Token rbrack = expect(RBRACK);
        return new Go.FieldList(fields, lbrack.getPos(), rbrack.getPos()).at(lbrack.getPos(), rbrack.getEnd());
    }

    /**
     * A union of type terms, {@code ~int | string}.
     */
    private Go.Expr parseConstraint() throws ParseException {
        Go.Expr x = parseTypeTerm();
        while (is(OR)) {
            next();
            Go.Expr y = parseTypeTerm();
            x = new Go.BinaryExpr(x, OR, y).at(x.getPos(), y.getEnd());
        }
        return x;
    }

    private Go.Expr parseTypeTerm() throws ParseException {
        if (is(TILDE)) {
            int start = tok.getPos();
            next();
            Go.Expr type = parseType();
            return new Go.UnaryExpr(TILDE, type).at(start, type.getEnd());
        }
        return parseType();
    }

    private static final class ParamEntry {
        final Go.@Nullable Ident name;
        final Go.@Nullable Expr type;

        ParamEntry(Go.@Nullable Ident name, Go.@Nullable Expr type) {
            this.name = name;
            this.type = type;
        }
    }

    private Go.FieldList parseParameters() throws ParseException {
        Token lparen = expect(LPAREN);
        List<ParamEntry> entries = new ArrayList<>();
        boolean named = false;
        while (!is(RPAREN) && !is(EOF)) {
            ParamEntry entry = parseParamEntry();
            named |= entry.name != null && entry.type != null;
            entries.add(entry);
            if (!got(COMMA)) {
                break;
            }
        }
        Token rparen = expect(RPAREN);

        List<Go.Field> fields = new ArrayList<>();
        if (named) {
            // bare identifiers are names sharing the type of the next named entry
            List<Go.Ident> pending = new ArrayList<>();
            for (ParamEntry entry : entries) {
                if (entry.type == null) {
                    pending.add(entry.name);
                    continue;
                }
                if (entry.name == null) {
                    throw error(entry.type.getPos(), "mixed named and unnamed parameters");
                }
                pending.add(entry.name);
                fields.add(new Go.Field(pending, entry.type, null).at(pending.get(0).getPos(), entry.type.getEnd()));
                pending = new ArrayList<>();
            }
            if (!pending.isEmpty()) {
                throw error(pending.get(0).getPos(), "missing parameter type");
            }
        } else {
            for (ParamEntry entry : entries) {
                Go.Expr type = entry.type != null ? entry.type : entry.name;
                fields.add(new Go.Field(new ArrayList<>(), type, null).at(type.getPos(), type.getEnd()));
            }
        }
        return new Go.FieldList(fields, lparen.getPos(), rparen.getPos()).at(lparen.getPos(), rparen.getEnd());
    }

    private ParamEntry parseParamEntry() throws ParseException {
        if (is(ELLIPSIS)) {
            return new ParamEntry(null, parseVariadic());
        }
        if (!is(IDENT)) {
            return new ParamEntry(null, parseType());
        }
        Go.Ident ident = parseIdent();
        switch (tok.getKind()) {
            case COMMA:
            case RPAREN:
                return new ParamEntry(ident, null);
            case PERIOD:
                return new ParamEntry(null, parseTypeInstance(parseQualifiedIdent(ident)));
            case LBRACK:
                if (isArrayAfterName()) {
                    return new ParamEntry(ident, parseType());
                }
                return new ParamEntry(null, parseTypeInstance(ident));
            case ELLIPSIS:
                return new ParamEntry(ident, parseVariadic());
            default:
                return new ParamEntry(ident, parseType());
        }
    }

    private Go.Ellipsis parseVariadic() throws ParseException {
        int start = expect(ELLIPSIS).getPos();
        Go.Expr elt = parseType();
        return new Go.Ellipsis(elt).at(start, elt.getEnd());
    }

    /**
     * At {@code [} after an identifier: decides between {@code name [N]T} and the
     * instantiation {@code T[A]} by looking past the matching bracket.
     */
    private boolean isArrayAfterName() {
        int depth = 0;
        for (int i = index; i < tokens.size(); i++) {
            TokenKind kind = tokens.get(i).getKind();
            if (kind == LBRACK) {
                depth++;
            } else if (kind == RBRACK && --depth == 0) {
                TokenKind after = tokens.get(Math.min(i + 1, tokens.size() - 1)).getKind();
                return TYPE_START.contains(after);
            } else if (kind == EOF) {
                return false;
            }
        }
        return false;
    }

    private Go.@Nullable FieldList parseResult() throws ParseException {
        if (is(LPAREN)) {
            return parseParameters();
        }
        if (TYPE_START.contains(tok.getKind())) {
            Go.Expr type = parseType();
            List<Go.Field> fields = new ArrayList<>();
            fields.add(new Go.Field(new ArrayList<>(), type, null).at(type.getPos(), type.getEnd()));
            return new Go.FieldList(fields, GoNode.NO_POS, GoNode.NO_POS).at(type.getPos(), type.getEnd());
        }
        return null;
    }

    // ---------------------------------------------------------------- types

    private Go.Expr parseType() throws ParseException {
        int start = tok.getPos();
        switch (tok.getKind()) {
            case IDENT: {
                Go.Expr name = parseIdent();
                if (is(PERIOD)) {
                    name = parseQualifiedIdent(name);
                }
                return parseTypeInstance(name);
            }
            case LBRACK: {
                next();
                if (got(RBRACK)) {
                    Go.Expr elt = parseType();
                    return new Go.ArrayType(null, elt).at(start, elt.getEnd());
                }
                Go.Expr len;
                if (is(ELLIPSIS)) {
                    len = new Go.Ellipsis(null).at(tok.getPos(), tok.getEnd());
                    next();
                } else {
                    exprLev++;
                    len = parseExpr();
                    exprLev--;
                }
                expect(RBRACK);
                Go.Expr elt = parseType();
                return new Go.ArrayType(len, elt).at(start, elt.getEnd());
            }
            case STRUCT:
                return parseStructType();
            case MUL: {
                next();
                Go.Expr x = parseType();
                return new Go.StarExpr(x).at(start, x.getEnd());
            }
            case FUNC:
                next();
                return parseSignature(null, start);
            case INTERFACE:
                return parseInterfaceType();
            case MAP: {
                next();
                expect(LBRACK);
                Go.Expr key = parseType();
                expect(RBRACK);
                Go.Expr value = parseType();
                return new Go.MapType(key, value).at(start, value.getEnd());
            }
            case CHAN:
            case ARROW:
                return parseChanType();
            case LPAREN: {
                next();
                Go.Expr x = parseType();
                Token rparen = expect(RPAREN);
                return new Go.ParenExpr(x).at(start, rparen.getEnd());
            }
            default:
                throw errorExpected("type");
        }
    }

    private Go.Expr parseQualifiedIdent(Go.Expr pkg) throws ParseException {
        expect(PERIOD);
        Go.Ident sel = parseIdent();
        return new Go.SelectorExpr(pkg, sel).at(pkg.getPos(), sel.getEnd());
    }

    private Go.Expr parseTypeInstance(Go.Expr type) throws ParseException {
        if (!is(LBRACK)) {
            return type;
        }
        next();
        List<Go.Expr> args = new ArrayList<>();
        while (!is(RBRACK) && !is(EOF)) {
            args.add(parseType());
            if (!got(COMMA)) {
                break;
            }
        }
        Token rbrack = expect(RBRACK);
        return new Go.IndexExpr(type, args).at(type.getPos(), rbrack.getEnd());
    }

    private Go.ChanType parseChanType() throws ParseException {
        int start = tok.getPos();
        Go.ChanDir dir = Go.ChanDir.BOTH;
        if (got(CHAN)) {
            if (got(ARROW)) {
                dir = Go.ChanDir.SEND;
            }
        } else {
            expect(ARROW);
            expect(CHAN);
            dir = Go.ChanDir.RECV;
        }
        Go.Expr value = parseType();
        return new Go.ChanType(dir, value).at(start, value.getEnd());
    }

    private Go.StructType parseStructType() throws ParseException {
        int start = expect(STRUCT).getPos();
        Token lbrace = expect(LBRACE);
        List<Go.Field> fields = new ArrayList<>();
        while (!is(RBRACE) && !is(EOF)) {
            fields.add(parseFieldDecl());
            expectSemi();
        }
        Token rbrace = expect(RBRACE);
        Go.FieldList list = new Go.FieldList(fields, lbrace.getPos(), rbrace.getPos())
                .at(lbrace.getPos(), rbrace.getEnd());
        return new Go.StructType(list).at(start, rbrace.getEnd());
    }

    private Go.Field parseFieldDecl() throws ParseException {
        int start = tok.getPos();
        List<Go.Ident> names = new ArrayList<>();
        Go.Expr type;
        if (is(IDENT)) {
            TokenKind following = peek(1).getKind();
            boolean embedded = following == PERIOD || following == SEMICOLON || following == RBRACE
                    || following == STRING || (following == LBRACK && !isArrayAfterNameAt(index + 1));
            if (embedded) {
                type = parseType();
            } else {
                names = parseIdentList();
                type = parseType();
            }
        } else if (is(MUL)) {
            next();
            Go.Expr x = parseType();
            type = new Go.StarExpr(x).at(start, x.getEnd());
        } else {
            throw errorExpected("field name or embedded type");
        }
        Go.BasicLit tag = null;
        if (is(STRING)) {
            tag = parseBasicLit();
        }
        return new Go.Field(names, type, tag).at(start, prevEnd);
    }

    private boolean isArrayAfterNameAt(int at) {
        int saved = index;
        Token savedTok = tok;
        index = at;
        try {
            return isArrayAfterName();
        } finally {
            index = saved;
            tok = savedTok;
        }
    }

    private Go.InterfaceType parseInterfaceType() throws ParseException {
        int start = expect(INTERFACE).getPos();
        Token lbrace = expect(LBRACE);
        List<Go.Field> elements = new ArrayList<>();
        while (!is(RBRACE) && !is(EOF)) {
            if (is(IDENT) && peek(1).getKind() == LPAREN) {
                Go.Ident name = parseIdent();
                Go.FuncType signature = parseSignature(null, tok.getPos());
                List<Go.Ident> names = new ArrayList<>();
                names.add(name);
                elements.add(new Go.Field(names, signature, null).at(name.getPos(), signature.getEnd()));
            } else {
                Go.Expr constraint = parseConstraint();
                elements.add(new Go.Field(new ArrayList<>(), constraint, null)
                        .at(constraint.getPos(), constraint.getEnd()));
            }
            expectSemi();
        }
        Token rbrace = expect(RBRACE);
        Go.FieldList list = new Go.FieldList(elements, lbrace.getPos(), rbrace.getPos())
                .at(lbrace.getPos(), rbrace.getEnd());
        return new Go.InterfaceType(list).at(start, rbrace.getEnd());
    }

    // ---------------------------------------------------------------- expressions

    private Go.Ident parseIdent() throws ParseException {
        Token t = expect(IDENT);
        return new Go.Ident(t.getText()).at(t.getPos(), t.getEnd());
    }

    private List<Go.Ident> parseIdentList() throws ParseException {
        List<Go.Ident> names = new ArrayList<>();
        names.add(parseIdent());
        while (got(COMMA)) {
            names.add(parseIdent());
        }
        return names;
    }

    private Go.BasicLit parseBasicLit() {
        Go.BasicLit lit = new Go.BasicLit(tok.getKind(), tok.getText()).at(tok.getPos(), tok.getEnd());
        next();
        return lit;
    }

    private List<Go.Expr> parseExprList() throws ParseException {
        List<Go.Expr> list = new ArrayList<>();
        list.add(parseExpr());
        while (got(COMMA)) {
            list.add(parseExpr());
        }
        return list;
    }

    private Go.Expr parseExpr() throws ParseException {
        return parseBinaryExpr(1);
    }

    private Go.Expr parseBinaryExpr(int minPrecedence) throws ParseException {
        Go.Expr x = parseUnaryExpr();
        while (true) {
            TokenKind op = tok.getKind();
            int precedence = op.getPrecedence();
            if (precedence < minPrecedence || precedence == 0) {
                return x;
            }
            next();
            Go.Expr y = parseBinaryExpr(precedence + 1);
            x = new Go.BinaryExpr(x, op, y).at(x.getPos(), y.getEnd());
        }
    }

    private Go.Expr parseUnaryExpr() throws ParseException {
        int start = tok.getPos();
        switch (tok.getKind()) {
            case ADD:
            case SUB:
            case NOT:
            case XOR:
            case AND:
            case TILDE: {
                TokenKind op = tok.getKind();
                next();
                Go.Expr x = parseUnaryExpr();
                return new Go.UnaryExpr(op, x).at(start, x.getEnd());
            }
            case ARROW: {
                if (peek(1).getKind() == CHAN) {
                    return parsePrimarySuffix(parseChanType());
                }
                next();
                Go.Expr x = parseUnaryExpr();
                return new Go.UnaryExpr(ARROW, x).at(start, x.getEnd());
            }
            case MUL: {
                next();
                Go.Expr x = parseUnaryExpr();
                return new Go.StarExpr(x).at(start, x.getEnd());
            }
            default:
                return parsePrimaryExpr();
        }
    }

    private Go.Expr parsePrimaryExpr() throws ParseException {
        return parsePrimarySuffix(parseOperand());
    }

    private Go.Expr parsePrimarySuffix(Go.Expr operand) throws ParseException {
        Go.Expr x = operand;
        while (true) {
            switch (tok.getKind()) {
                case PERIOD:
                    next();
                    if (is(IDENT)) {
                        Go.Ident sel = parseIdent();
                        x = new Go.SelectorExpr(x, sel).at(x.getPos(), sel.getEnd());
                    } else if (is(LPAREN)) {
                        next();
                        Go.Expr type = null;
                        if (!got(TYPE)) {
                            type = parseType();
                        }
                        Token rparen = expect(RPAREN);
                        x = new Go.TypeAssertExpr(x, type).at(x.getPos(), rparen.getEnd());
                    } else {
                        throw errorExpected("selector or type assertion");
                    }
                    break;
                case LBRACK:
                    x = parseIndexOrSlice(x);
                    break;
                case LPAREN:
                    x = parseCall(x);
                    break;
                case LBRACE:
                    if (!allowsCompositeLit(x)) {
                        return x;
                    }
                    x = parseLiteralValue(x);
                    break;
                default:
                    return x;
            }
        }
    }

    private boolean allowsCompositeLit(Go.Expr x) {
        Go.Expr t = x;
        while (t instanceof Go.ParenExpr) {
            t = ((Go.ParenExpr) t).getX();
        }
        if (t instanceof Go.Ident || t instanceof Go.SelectorExpr || t instanceof Go.IndexExpr) {
            // inside a control clause "T {" starts the block, not a literal
            return exprLev >= 0;
        }
        return t instanceof Go.ArrayType || t instanceof Go.StructType || t instanceof Go.MapType;
    }

    private Go.Expr parseOperand() throws ParseException {
        int start = tok.getPos();
        switch (tok.getKind()) {
            case IDENT:
                return parseIdent();
            case INT:
            case FLOAT:
            case IMAG:
            case CHAR:
            case STRING:
                return parseBasicLit();
            case LPAREN: {
                next();
                exprLev++;
                Go.Expr x = parseExpr();
                exprLev--;
                Token rparen = expect(RPAREN);
                return new Go.ParenExpr(x).at(start, rparen.getEnd());
            }
            case FUNC: {
                next();
                Go.FuncType type = parseSignature(null, start);
                if (!is(LBRACE)) {
                    return type;
                }
                exprLev++;
                Go.BlockStmt body = parseBlockStmt();
                exprLev--;
                return new Go.FuncLit(type, body).at(start, body.getEnd());
            }
            case LBRACK:
            case STRUCT:
            case MAP:
            case CHAN:
            case INTERFACE:
                return parseType();
            default:
                throw errorExpected("operand");
        }
    }

    private Go.Expr parseIndexOrSlice(Go.Expr x) throws ParseException {
        expect(LBRACK);
        exprLev++;
        Go.Expr[] indices = new Go.Expr[3];
        int colons = 0;
        if (!is(COLON)) {
            indices[0] = parseExpr();
        }
        while (is(COLON) && colons < 2) {
            colons++;
            next();
            if (!is(COLON) && !is(RBRACK)) {
                indices[colons] = parseExpr();
            }
        }
        List<Go.Expr> list = new ArrayList<>();
        if (colons == 0) {
            list.add(indices[0]);
            while (got(COMMA)) {
                if (is(RBRACK)) {
                    break;
                }
                list.add(parseExpr());
            }
        }
        exprLev--;
        Token rbrack = expect(RBRACK);
        if (colons > 0) {
            return new Go.SliceExpr(x, indices[0], indices[1], indices[2], colons == 2)
                    .at(x.getPos(), rbrack.getEnd());
        }
        return new Go.IndexExpr(x, list).at(x.getPos(), rbrack.getEnd());
    }

    private Go.CallExpr parseCall(Go.Expr fun) throws ParseException {
        expect(LPAREN);
        exprLev++;
        List<Go.Expr> args = new ArrayList<>();
        boolean ellipsis = false;
        while (!is(RPAREN) && !is(EOF)) {
            args.add(parseExpr());
            if (got(ELLIPSIS)) {
                ellipsis = true;
            }
            if (!got(COMMA)) {
                break;
            }
        }
        exprLev--;
        Token rparen = expect(RPAREN);
        return new Go.CallExpr(fun, args, ellipsis).at(fun.getPos(), rparen.getEnd());
    }

    private Go.CompositeLit parseLiteralValue(Go.@Nullable Expr type) throws ParseException {
        Token lbrace = expect(LBRACE);
        exprLev++;
        List<Go.Expr> elts = new ArrayList<>();
        while (!is(RBRACE) && !is(EOF)) {
            elts.add(parseElement());
            if (!got(COMMA)) {
                break;
            }
        }
        exprLev--;
        Token rbrace = expect(RBRACE);
        int start = type != null ? type.getPos() : lbrace.getPos();
        return new Go.CompositeLit(type, elts).at(start, rbrace.getEnd());
    }

    private Go.Expr parseElement() throws ParseException {
        Go.Expr x = parseElementValue();
        if (got(COLON)) {
            Go.Expr value = parseElementValue();
            return new Go.KeyValueExpr(x, value).at(x.getPos(), value.getEnd());
        }
        return x;
    }

    private Go.Expr parseElementValue() throws ParseException {
        if (is(LBRACE)) {
            return parseLiteralValue(null);
        }
        return parseExpr();
    }

    // ---------------------------------------------------------------- statements

    private List<Go.Stmt> parseStmtList() throws ParseException {
        List<Go.Stmt> list = new ArrayList<>();
        while (!is(CASE) && !is(DEFAULT) && !is(RBRACE) && !is(EOF)) {
            list.add(parseStmt());
        }
        return list;
    }

    private Go.BlockStmt parseBlockStmt() throws ParseException {
        Token lbrace = expect(LBRACE);
        List<Go.Stmt> list = parseStmtList();
        Token rbrace = expect(RBRACE);
        return new Go.BlockStmt(list).at(lbrace.getPos(), rbrace.getEnd());
    }

    private Go.Stmt parseStmt() throws ParseException {
        int start = tok.getPos();
        switch (tok.getKind()) {
            case CONST:
            case TYPE:
            case VAR: {
                Go.GenDecl decl = parseGenDecl();
                expectSemi();
                return new Go.DeclStmt(decl).at(decl.getPos(), decl.getEnd());
            }
            case IDENT:
            case INT:
            case FLOAT:
            case IMAG:
            case CHAR:
            case STRING:
            case FUNC:
            case LPAREN:
            case LBRACK:
            case STRUCT:
            case MAP:
            case CHAN:
            case INTERFACE:
            case ADD:
            case SUB:
            case MUL:
            case AND:
            case XOR:
            case ARROW:
            case NOT:
            case TILDE: {
                Go.Stmt s = parseSimpleStmt(SimpleStmtMode.LABEL_OK);
                if (!(s instanceof Go.LabeledStmt)) {
                    expectSemi();
                }
                return s;
            }
            case GO:
            case DEFER: {
                TokenKind keyword = tok.getKind();
                next();
                Go.Expr call = parseExpr();
                if (!(call instanceof Go.CallExpr)) {
                    throw error(call.getPos(), "expression in " + keyword.getText() + " must be function call");
                }
                expectSemi();
                Go.Stmt s = keyword == GO ? new Go.GoStmt(call) : new Go.DeferStmt(call);
                return s.at(start, call.getEnd());
            }
            case RETURN: {
                next();
                List<Go.Expr> results = new ArrayList<>();
                if (!is(SEMICOLON) && !is(RBRACE)) {
                    results = parseExprList();
                }
                Go.ReturnStmt s = new Go.ReturnStmt(results).at(start, prevEnd);
                expectSemi();
                return s;
            }
            case BREAK:
            case CONTINUE:
            case GOTO:
            case FALLTHROUGH: {
                TokenKind keyword = tok.getKind();
                next();
                Go.Ident label = null;
                if (keyword != FALLTHROUGH && is(IDENT)) {
                    label = parseIdent();
                }
                Go.BranchStmt s = new Go.BranchStmt(keyword, label).at(start, prevEnd);
                expectSemi();
                return s;
            }
            case LBRACE: {
                Go.BlockStmt block = parseBlockStmt();
                expectSemi();
                return block;
            }
            case IF:
                return parseIfStmt();
            case SWITCH: {
                Go.Stmt s = parseSwitchStmt();
                expectSemi();
                return s;
            }
            case SELECT: {
                Go.Stmt s = parseSelectStmt();
                expectSemi();
                return s;
            }
            case FOR: {
                Go.Stmt s = parseForStmt();
                expectSemi();
                return s;
            }
            case SEMICOLON: {
                Go.EmptyStmt s = new Go.EmptyStmt(tok.isImplicitSemicolon()).at(tok.getPos(), tok.getEnd());
                next();
                return s;
            }
            case RBRACE:
                // a label right before a closing brace labels an empty statement
                return new Go.EmptyStmt(true).at(tok.getPos(), tok.getPos());
            default:
                throw errorExpected("statement");
        }
    }

    private Go.Stmt parseSimpleStmt(SimpleStmtMode mode) throws ParseException {
        int start = tok.getPos();
        List<Go.Expr> lhs = parseExprList();

        if (tok.getKind().isAssignOp()) {
            TokenKind op = tok.getKind();
            next();
            List<Go.Expr> rhs = new ArrayList<>();
            if (mode == SimpleStmtMode.RANGE_OK && is(RANGE) && (op == DEFINE || op == ASSIGN)) {
                int rangePos = tok.getPos();
                next();
                Go.Expr x = parseExpr();
                rhs.add(new Go.UnaryExpr(RANGE, x).at(rangePos, x.getEnd()));
            } else {
                rhs = parseExprList();
            }
            return new Go.AssignStmt(lhs, op, rhs).at(start, prevEnd);
        }

        if (lhs.size() > 1) {
            throw error(lhs.get(0).getPos(), "expected 1 expression");
        }
        Go.Expr x = lhs.get(0);
        switch (tok.getKind()) {
            case COLON:
                if (mode == SimpleStmtMode.LABEL_OK && x instanceof Go.Ident) {
                    next();
                    Go.Stmt stmt = parseStmt();
                    return new Go.LabeledStmt((Go.Ident) x, stmt).at(start, Math.max(stmt.getEnd(), x.getEnd()));
                }
                return new Go.ExprStmt(x).at(x.getPos(), x.getEnd());
            case ARROW: {
                next();
                Go.Expr value = parseExpr();
                return new Go.SendStmt(x, value).at(start, value.getEnd());
            }
            case INC:
            case DEC: {
                Go.IncDecStmt s = new Go.IncDecStmt(x, tok.getKind()).at(start, tok.getEnd());
                next();
                return s;
            }
            default:
                return new Go.ExprStmt(x).at(x.getPos(), x.getEnd());
        }
    }

    private Go.Expr toCondition(Go.@Nullable Stmt s, String context) throws ParseException {
        if (s == null) {
            throw errorExpected("condition in " + context);
        }
        if (!(s instanceof Go.ExprStmt)) {
            throw error(s.getPos(), "cannot use statement as value in " + context);
        }
        return ((Go.ExprStmt) s).getX();
    }

    private Go.IfStmt parseIfStmt() throws ParseException {
        int start = expect(IF).getPos();
        if (is(LBRACE)) {
            throw error(tok.getPos(), "missing condition in if statement");
        }
        int outer = exprLev;
        exprLev = -1;
        Go.Stmt init = null;
        Go.Stmt condStmt = null;
        if (!is(SEMICOLON)) {
            condStmt = parseSimpleStmt(SimpleStmtMode.BASIC);
        }
        if (is(SEMICOLON)) {
            next();
            init = condStmt;
            if (is(LBRACE)) {
                throw error(tok.getPos(), "missing condition in if statement");
            }
            condStmt = parseSimpleStmt(SimpleStmtMode.BASIC);
        }
        Go.Expr cond = toCondition(condStmt, "if statement");
        exprLev = outer;

        Go.BlockStmt body = parseBlockStmt();
        Go.Stmt els = null;
        if (got(ELSE)) {
            if (is(IF)) {
                els = parseIfStmt();
            } else if (is(LBRACE)) {
                els = parseBlockStmt();
                expectSemi();
            } else {
                throw errorExpected("if statement or block");
            }
        } else {
            expectSemi();
        }
        return new Go.IfStmt(init, cond, body, els).at(start, els != null ? els.getEnd() : body.getEnd());
    }

    private Go.Stmt parseSwitchStmt() throws ParseException {
        int start = expect(SWITCH).getPos();
        Go.Stmt s1 = null;
        Go.Stmt s2 = null;
        if (!is(LBRACE)) {
            int outer = exprLev;
            exprLev = -1;
            if (!is(SEMICOLON)) {
                s2 = parseSimpleStmt(SimpleStmtMode.BASIC);
            }
            if (is(SEMICOLON)) {
                next();
                s1 = s2;
                s2 = null;
                if (!is(LBRACE)) {
                    s2 = parseSimpleStmt(SimpleStmtMode.BASIC);
                }
            }
            exprLev = outer;
        }
        boolean typeSwitch = isTypeSwitchGuard(s2);
        Token lbrace = expect(LBRACE);
        List<Go.Stmt> clauses = new ArrayList<>();
        while (is(CASE) || is(DEFAULT)) {
            clauses.add(parseCaseClause());
        }
        Token rbrace = expect(RBRACE);
        Go.BlockStmt body = new Go.BlockStmt(clauses).at(lbrace.getPos(), rbrace.getEnd());
        if (typeSwitch) {
            return new Go.TypeSwitchStmt(s1, s2, body).at(start, body.getEnd());
        }
        Go.Expr tag = s2 != null ? toCondition(s2, "switch expression") : null;
        return new Go.SwitchStmt(s1, tag, body).at(start, body.getEnd());
    }

    private static boolean isTypeSwitchGuard(Go.@Nullable Stmt s) {
        Go.Expr x = null;
        if (s instanceof Go.ExprStmt) {
            x = ((Go.ExprStmt) s).getX();
        } else if (s instanceof Go.AssignStmt) {
            Go.AssignStmt assign = (Go.AssignStmt) s;
            if (assign.getTok() == DEFINE && assign.getLhs().size() == 1 && assign.getRhs().size() == 1) {
                x = assign.getRhs().get(0);
            }
        }
        return x instanceof Go.TypeAssertExpr && ((Go.TypeAssertExpr) x).getType() == null;
    }

    private Go.CaseClause parseCaseClause() throws ParseException {
        int start = tok.getPos();
        List<Go.Expr> list = new ArrayList<>();
        if (got(CASE)) {
            list = parseExprList();
        } else {
            expect(DEFAULT);
        }
        Token colon = expect(COLON);
        List<Go.Stmt> body = parseStmtList();
        int end = body.isEmpty() ? colon.getEnd() : body.get(body.size() - 1).getEnd();
        return new Go.CaseClause(list, body).at(start, end);
    }

    private Go.SelectStmt parseSelectStmt() throws ParseException {
        int start = expect(SELECT).getPos();
        Token lbrace = expect(LBRACE);
        List<Go.Stmt> clauses = new ArrayList<>();
        while (is(CASE) || is(DEFAULT)) {
            clauses.add(parseCommClause());
        }
        Token rbrace = expect(RBRACE);
        Go.BlockStmt body = new Go.BlockStmt(clauses).at(lbrace.getPos(), rbrace.getEnd());
        return new Go.SelectStmt(body).at(start, body.getEnd());
    }

    private Go.CommClause parseCommClause() throws ParseException {
        int start = tok.getPos();
        Go.Stmt comm = null;
        if (got(CASE)) {
            int commStart = tok.getPos();
            List<Go.Expr> lhs = parseExprList();
            if (is(ARROW)) {
                if (lhs.size() > 1) {
                    throw error(lhs.get(0).getPos(), "expected 1 expression");
                }
                next();
                Go.Expr value = parseExpr();
                comm = new Go.SendStmt(lhs.get(0), value).at(commStart, value.getEnd());
            } else if (is(ASSIGN) || is(DEFINE)) {
                TokenKind op = tok.getKind();
                next();
                Go.Expr rhs = parseExpr();
                List<Go.Expr> rhsList = new ArrayList<>();
                rhsList.add(rhs);
                comm = new Go.AssignStmt(lhs, op, rhsList).at(commStart, rhs.getEnd());
            } else {
                if (lhs.size() > 1) {
                    throw error(lhs.get(0).getPos(), "expected 1 expression");
                }
                comm = new Go.ExprStmt(lhs.get(0)).at(commStart, lhs.get(0).getEnd());
            }
        } else {
            expect(DEFAULT);
        }
        Token colon = expect(COLON);
        List<Go.Stmt> body = parseStmtList();
        int end = body.isEmpty() ? colon.getEnd() : body.get(body.size() - 1).getEnd();
        return new Go.CommClause(comm, body).at(start, end);
    }

    private Go.Stmt parseForStmt() throws ParseException {
        int start = expect(FOR).getPos();
        Go.Stmt s1 = null;
        Go.Stmt s2 = null;
        Go.Stmt s3 = null;
        Go.Expr bareRange = null;
        if (!is(LBRACE)) {
            int outer = exprLev;
            exprLev = -1;
            if (is(RANGE)) {
                // for range x
                next();
                bareRange = parseExpr();
            } else if (!is(SEMICOLON)) {
                s2 = parseSimpleStmt(SimpleStmtMode.RANGE_OK);
            }
            if (bareRange == null && rangeOf(s2) == null && is(SEMICOLON)) {
                next();
                s1 = s2;
                s2 = null;
                if (!is(SEMICOLON)) {
                    s2 = parseSimpleStmt(SimpleStmtMode.BASIC);
                }
                expect(SEMICOLON);
                if (!is(LBRACE)) {
                    s3 = parseSimpleStmt(SimpleStmtMode.BASIC);
                }
            }
            exprLev = outer;
        }
        Go.BlockStmt body = parseBlockStmt();

        if (bareRange != null) {
            return new Go.RangeStmt(null, null, null, bareRange, body).at(start, body.getEnd());
        }
        Go.Expr range = rangeOf(s2);
        if (range != null) {
            Go.AssignStmt assign = (Go.AssignStmt) s2;
            List<Go.Expr> lhs = assign.getLhs();
            if (lhs.size() > 2) {
                throw error(lhs.get(0).getPos(), "range clause permits at most two iteration variables");
            }
            Go.Expr key = lhs.get(0);
            Go.Expr value = lhs.size() > 1 ? lhs.get(1) : null;
            return new Go.RangeStmt(key, value, assign.getTok(), range, body).at(start, body.getEnd());
        }
        Go.Expr cond = s2 != null ? toCondition(s2, "for statement") : null;
        return new Go.ForStmt(s1, cond, s3, body).at(start, body.getEnd());
    }

    private static Go.@Nullable Expr rangeOf(Go.@Nullable Stmt s) {
        if (!(s instanceof Go.AssignStmt)) {
            return null;
        }
        List<Go.Expr> rhs = ((Go.AssignStmt) s).getRhs();
        if (rhs.size() == 1 && rhs.get(0) instanceof Go.UnaryExpr
                && ((Go.UnaryExpr) rhs.get(0)).getOp() == RANGE) {
            return ((Go.UnaryExpr) rhs.get(0)).getX();
        }
        return null;
    }
}
