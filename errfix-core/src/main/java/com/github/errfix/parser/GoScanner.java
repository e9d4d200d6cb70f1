package com.github.errfix.parser;

import com.github.errfix.tree.TokenKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizes Go source text.
 * <p>
 * Comments are skipped; they stay in the source text and reach the output through
 * the printer, which copies everything between tokens verbatim. Semicolons are
 * inserted after a line's final token following the rules of the Go specification.
 */
public final class GoScanner {

    private final String fileName;
    private final String src;
    private int offset;
    private boolean insertSemi;
    private final List<Token> tokens = new ArrayList<>();

    public GoScanner(String fileName, String src) {
        this.fileName = fileName;
        this.src = src;
    }

    /**
     * Scans the whole source. The returned list always ends with an {@code EOF} token.
     */
    public List<Token> scan() throws ParseException {
        // a leading byte order mark is ignored
        if (src.startsWith("\uFEFF")) {
            offset = 1;
        }
        while (true) {
            skipWhitespace();
            if (offset >= src.length()) {
                if (insertSemi) {
                    emit(TokenKind.SEMICOLON, offset, offset, "EOF");
                }
                emit(TokenKind.EOF, offset, offset, "");
                return tokens;
            }
            char c = src.charAt(offset);
            if (c == '\n') {
                // only reached when a semicolon is due, see skipWhitespace
                emit(TokenKind.SEMICOLON, offset, offset, "\n");
                offset++;
                continue;
            }
            if (c == '/' && peek(1) == '/') {
                skipLineComment();
                continue;
            }
            if (c == '/' && peek(1) == '*') {
                skipBlockComment();
                continue;
            }
            scanToken(c);
        }
    }

    /**
     * Builds a positioned error for an offset in this source.
     */
    ParseException error(int at, String message) {
        int line = 1;
        int lineStart = 0;
        int limit = Math.min(at, src.length());
        for (int i = 0; i < limit; i++) {
            if (src.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        return new ParseException(fileName, line, limit - lineStart + 1, message);
    }

    private void skipWhitespace() {
        while (offset < src.length()) {
            char c = src.charAt(offset);
            if (c == ' ' || c == '\t' || c == '\r' || (c == '\n' && !insertSemi)) {
                offset++;
            } else {
                return;
            }
        }
    }

    private void skipLineComment() {
        int nl = src.indexOf('\n', offset);
        int stop = nl < 0 ? src.length() : nl;
        offset = stop;
        // the newline (or EOF) ending the comment is handled by the main loop
    }

    private void skipBlockComment() throws ParseException {
        int start = offset;
        int close = src.indexOf("*/", offset + 2);
        if (close < 0) {
            throw error(start, "comment not terminated");
        }
        boolean hasNewline = src.substring(offset, close).indexOf('\n') >= 0;
        offset = close + 2;
        if (hasNewline && insertSemi) {
            emit(TokenKind.SEMICOLON, start, start, "\n");
        }
    }

    private void scanToken(char c) throws ParseException {
        int start = offset;
        if (isLetter(c)) {
            while (offset < src.length() && (isLetter(src.charAt(offset)) || isDigit(src.charAt(offset)))) {
                offset++;
            }
            String word = src.substring(start, offset);
            TokenKind keyword = TokenKind.keyword(word);
            emit(keyword != null ? keyword : TokenKind.IDENT, start, offset, word);
            return;
        }
        if (isDigit(c) || (c == '.' && isDigit(peek(1)))) {
            scanNumber(start);
            return;
        }
        switch (c) {
            case '"':
                scanInterpretedString(start);
                return;
            case '`':
                scanRawString(start);
                return;
            case '\'':
                scanRune(start);
                return;
            default:
                scanOperator(c, start);
        }
    }

    private void scanNumber(int start) {
        boolean hex = src.charAt(offset) == '0' && (peek(1) == 'x' || peek(1) == 'X');
        boolean isFloat = false;
        while (offset < src.length()) {
            char ch = src.charAt(offset);
            if (isDigit(ch) || isLetter(ch)) {
                offset++;
            } else if (ch == '.') {
                isFloat = true;
                offset++;
            } else if ((ch == '+' || ch == '-') && isExponent(src.charAt(offset - 1), hex)) {
                isFloat = true;
                offset++;
            } else {
                break;
            }
        }
        String text = src.substring(start, offset);
        TokenKind kind;
        if (text.endsWith("i")) {
            kind = TokenKind.IMAG;
        } else if (isFloat || (!hex && (text.indexOf('e') >= 0 || text.indexOf('E') >= 0))
                || (hex && (text.indexOf('p') >= 0 || text.indexOf('P') >= 0))) {
            kind = TokenKind.FLOAT;
        } else {
            kind = TokenKind.INT;
        }
        emit(kind, start, offset, text);
    }

    private static boolean isExponent(char previous, boolean hex) {
        return hex ? (previous == 'p' || previous == 'P') : (previous == 'e' || previous == 'E');
    }

    private void scanInterpretedString(int start) throws ParseException {
        offset++;
        while (true) {
            if (offset >= src.length() || src.charAt(offset) == '\n') {
                throw error(start, "string literal not terminated");
            }
            char ch = src.charAt(offset++);
            if (ch == '"') {
                break;
            }
            if (ch == '\\') {
                // the escaped character is consumed as-is; GoStrings validates escapes when needed
                if (offset >= src.length()) {
                    throw error(start, "string literal not terminated");
                }
                offset++;
            }
        }
        emit(TokenKind.STRING, start, offset, src.substring(start, offset));
    }

    private void scanRawString(int start) throws ParseException {
        int close = src.indexOf('`', offset + 1);
        if (close < 0) {
            throw error(start, "raw string literal not terminated");
        }
        offset = close + 1;
        emit(TokenKind.STRING, start, offset, src.substring(start, offset));
    }

    private void scanRune(int start) throws ParseException {
        offset++;
        while (true) {
            if (offset >= src.length() || src.charAt(offset) == '\n') {
                throw error(start, "rune literal not terminated");
            }
            char ch = src.charAt(offset++);
            if (ch == '\'') {
                break;
            }
            if (ch == '\\') {
                if (offset >= src.length()) {
                    throw error(start, "rune literal not terminated");
                }
                offset++;
            }
        }
        emit(TokenKind.CHAR, start, offset, src.substring(start, offset));
    }

    private void scanOperator(char c, int start) throws ParseException {
        TokenKind kind;
        switch (c) {
            case '(': kind = TokenKind.LPAREN; break;
            case ')': kind = TokenKind.RPAREN; break;
            case '[': kind = TokenKind.LBRACK; break;
            case ']': kind = TokenKind.RBRACK; break;
            case '{': kind = TokenKind.LBRACE; break;
            case '}': kind = TokenKind.RBRACE; break;
            case ',': kind = TokenKind.COMMA; break;
            case ';': kind = TokenKind.SEMICOLON; break;
            case '~': kind = TokenKind.TILDE; break;
            case '.':
                kind = peek(1) == '.' && peek(2) == '.' ? TokenKind.ELLIPSIS : TokenKind.PERIOD;
                break;
            case ':':
                kind = peek(1) == '=' ? TokenKind.DEFINE : TokenKind.COLON;
                break;
            case '+':
                kind = peek(1) == '+' ? TokenKind.INC : peek(1) == '=' ? TokenKind.ADD_ASSIGN : TokenKind.ADD;
                break;
            case '-':
                kind = peek(1) == '-' ? TokenKind.DEC : peek(1) == '=' ? TokenKind.SUB_ASSIGN : TokenKind.SUB;
                break;
            case '*':
                kind = peek(1) == '=' ? TokenKind.MUL_ASSIGN : TokenKind.MUL;
                break;
            case '/':
                kind = peek(1) == '=' ? TokenKind.QUO_ASSIGN : TokenKind.QUO;
                break;
            case '%':
                kind = peek(1) == '=' ? TokenKind.REM_ASSIGN : TokenKind.REM;
                break;
            case '^':
                kind = peek(1) == '=' ? TokenKind.XOR_ASSIGN : TokenKind.XOR;
                break;
            case '=':
                kind = peek(1) == '=' ? TokenKind.EQL : TokenKind.ASSIGN;
                break;
            case '!':
                kind = peek(1) == '=' ? TokenKind.NEQ : TokenKind.NOT;
                break;
            case '<':
                if (peek(1) == '-') {
                    kind = TokenKind.ARROW;
                } else if (peek(1) == '<') {
                    kind = peek(2) == '=' ? TokenKind.SHL_ASSIGN : TokenKind.SHL;
                } else {
                    kind = peek(1) == '=' ? TokenKind.LEQ : TokenKind.LSS;
                }
                break;
            case '>':
                if (peek(1) == '>') {
                    kind = peek(2) == '=' ? TokenKind.SHR_ASSIGN : TokenKind.SHR;
                } else {
                    kind = peek(1) == '=' ? TokenKind.GEQ : TokenKind.GTR;
                }
                break;
            case '&':
                if (peek(1) == '^') {
                    kind = peek(2) == '=' ? TokenKind.AND_NOT_ASSIGN : TokenKind.AND_NOT;
                } else if (peek(1) == '&') {
                    kind = TokenKind.LAND;
                } else {
                    kind = peek(1) == '=' ? TokenKind.AND_ASSIGN : TokenKind.AND;
                }
                break;
            case '|':
                if (peek(1) == '|') {
                    kind = TokenKind.LOR;
                } else {
                    kind = peek(1) == '=' ? TokenKind.OR_ASSIGN : TokenKind.OR;
                }
                break;
            default:
                throw error(start, "illegal character " + describeChar(c));
        }
        offset += kind.getText().length();
        emit(kind, start, offset, kind.getText());
    }

    private void emit(TokenKind kind, int pos, int end, String text) {
        tokens.add(new Token(kind, pos, end, text));
        switch (kind) {
            case IDENT:
            case INT:
            case FLOAT:
            case IMAG:
            case CHAR:
            case STRING:
            case BREAK:
            case CONTINUE:
            case FALLTHROUGH:
            case RETURN:
            case INC:
            case DEC:
            case RPAREN:
            case RBRACK:
            case RBRACE:
                insertSemi = true;
                break;
            default:
                insertSemi = false;
        }
    }

    private char peek(int ahead) {
        int at = offset + ahead;
        return at < src.length() ? src.charAt(at) : '\0';
    }

    private static boolean isLetter(char c) {
        return c == '_' || Character.isLetter(c);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static String describeChar(char c) {
        return "U+" + String.format("%04X", (int) c);
    }
}
