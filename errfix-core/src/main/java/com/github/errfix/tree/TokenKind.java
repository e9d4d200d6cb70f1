package com.github.errfix.tree;

import java.util.HashMap;
import java.util.Map;

/**
 * Lexical token kinds of the Go language.
 */
public enum TokenKind {
    EOF("EOF"),
    IDENT("IDENT"),
    INT("INT"),
    FLOAT("FLOAT"),
    IMAG("IMAG"),
    CHAR("CHAR"),
    STRING("STRING"),

    ADD("+", 4),
    SUB("-", 4),
    MUL("*", 5),
    QUO("/", 5),
    REM("%", 5),
    AND("&", 5),
    OR("|", 4),
    XOR("^", 4),
    SHL("<<", 5),
    SHR(">>", 5),
    AND_NOT("&^", 5),

    ADD_ASSIGN("+="),
    SUB_ASSIGN("-="),
    MUL_ASSIGN("*="),
    QUO_ASSIGN("/="),
    REM_ASSIGN("%="),
    AND_ASSIGN("&="),
    OR_ASSIGN("|="),
    XOR_ASSIGN("^="),
    SHL_ASSIGN("<<="),
    SHR_ASSIGN(">>="),
    AND_NOT_ASSIGN("&^="),

    LAND("&&", 2),
    LOR("||", 1),
    ARROW("<-"),
    INC("++"),
    DEC("--"),

    EQL("==", 3),
    LSS("<", 3),
    GTR(">", 3),
    ASSIGN("="),
    NOT("!"),
    NEQ("!=", 3),
    LEQ("<=", 3),
    GEQ(">=", 3),
    DEFINE(":="),
    ELLIPSIS("..."),
    TILDE("~"),

    LPAREN("("),
    LBRACK("["),
    LBRACE("{"),
    COMMA(","),
    PERIOD("."),
    RPAREN(")"),
    RBRACK("]"),
    RBRACE("}"),
    SEMICOLON(";"),
    COLON(":"),

    BREAK("break"),
    CASE("case"),
    CHAN("chan"),
    CONST("const"),
    CONTINUE("continue"),
    DEFAULT("default"),
    DEFER("defer"),
    ELSE("else"),
    FALLTHROUGH("fallthrough"),
    FOR("for"),
    FUNC("func"),
    GO("go"),
    GOTO("goto"),
    IF("if"),
    IMPORT("import"),
    INTERFACE("interface"),
    MAP("map"),
    PACKAGE("package"),
    RANGE("range"),
    RETURN("return"),
    SELECT("select"),
    STRUCT("struct"),
    SWITCH("switch"),
    TYPE("type"),
    VAR("var");

    private static final Map<String, TokenKind> KEYWORDS = new HashMap<>();

    static {
        for (TokenKind kind : values()) {
            if (kind.ordinal() >= BREAK.ordinal()) {
                KEYWORDS.put(kind.text, kind);
            }
        }
    }

    private final String text;
    private final int precedence;

    TokenKind(String text) {
        this(text, 0);
    }

    TokenKind(String text, int precedence) {
        this.text = text;
        this.precedence = precedence;
    }

    public String getText() {
        return text;
    }

    /**
     * Binary operator precedence, 0 for tokens that are not binary operators.
     */
    public int getPrecedence() {
        return precedence;
    }

    public boolean isLiteral() {
        return this == INT || this == FLOAT || this == IMAG || this == CHAR || this == STRING;
    }

    public boolean isAssignOp() {
        return this == ASSIGN || this == DEFINE
                || (ordinal() >= ADD_ASSIGN.ordinal() && ordinal() <= AND_NOT_ASSIGN.ordinal());
    }

    public static TokenKind keyword(String ident) {
        return KEYWORDS.get(ident);
    }

    @Override
    public String toString() {
        return text;
    }
}
