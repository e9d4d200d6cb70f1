package com.github.errfix.parser;

import com.github.errfix.tree.TokenKind;
import lombok.Value;

/**
 * A scanned token. {@code pos} and {@code end} are offsets into the source text;
 * an automatically inserted semicolon has an empty span and the text {@code "\n"}.
 */
@Value
public class Token {
    TokenKind kind;
    int pos;
    int end;
    String text;

    boolean isImplicitSemicolon() {
        return kind == TokenKind.SEMICOLON && !";".equals(text);
    }

    String describe() {
        switch (kind) {
            case IDENT:
            case INT:
            case FLOAT:
            case IMAG:
            case CHAR:
            case STRING:
                return kind.name() + " " + text;
            case SEMICOLON:
                return isImplicitSemicolon() ? "newline" : "';'";
            case EOF:
                return "EOF";
            default:
                return "'" + kind.getText() + "'";
        }
    }
}
