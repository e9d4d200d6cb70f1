package com.github.errfix.tree;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Go string literal helpers.
 */
public final class GoStrings {

    private GoStrings() {
    }

    /**
     * Decodes an interpreted ({@code "..."}) or raw ({@code `...`}) string literal.
     * Returns empty for anything that is not a well-formed literal.
     */
    public static Optional<String> unquote(String literal) {
        if (literal.length() < 2) {
            return Optional.empty();
        }
        char quote = literal.charAt(0);
        if (literal.charAt(literal.length() - 1) != quote) {
            return Optional.empty();
        }
        String body = literal.substring(1, literal.length() - 1);
        if (quote == '`') {
            if (body.indexOf('`') >= 0) {
                return Optional.empty();
            }
            // carriage returns are discarded from raw strings
            return Optional.of(body.replace("\r", ""));
        }
        if (quote != '"') {
            return Optional.empty();
        }
        return unescape(body);
    }

    private static Optional<String> unescape(String body) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c == '"' || c == '\n') {
                return Optional.empty();
            }
            if (c != '\\') {
                int cp = body.codePointAt(i);
                writeUtf8(bytes, cp);
                i += Character.charCount(cp);
                continue;
            }
            if (i + 1 >= body.length()) {
                return Optional.empty();
            }
            char e = body.charAt(i + 1);
            i += 2;
            switch (e) {
                case 'a': bytes.write(0x07); break;
                case 'b': bytes.write('\b'); break;
                case 'f': bytes.write('\f'); break;
                case 'n': bytes.write('\n'); break;
                case 'r': bytes.write('\r'); break;
                case 't': bytes.write('\t'); break;
                case 'v': bytes.write(0x0b); break;
                case '\\': bytes.write('\\'); break;
                case '"': bytes.write('"'); break;
                case 'x': {
                    Integer value = parseDigits(body, i, 2, 16);
                    if (value == null) {
                        return Optional.empty();
                    }
                    bytes.write(value);
                    i += 2;
                    break;
                }
                case 'u':
                case 'U': {
                    int width = e == 'u' ? 4 : 8;
                    Integer value = parseDigits(body, i, width, 16);
                    if (value == null || value > Character.MAX_CODE_POINT
                            || (value >= 0xD800 && value < 0xE000)) {
                        return Optional.empty();
                    }
                    writeUtf8(bytes, value);
                    i += width;
                    break;
                }
                default: {
                    if (e < '0' || e > '7') {
                        return Optional.empty();
                    }
                    Integer value = parseDigits(body, i - 1, 3, 8);
                    if (value == null || value > 255) {
                        return Optional.empty();
                    }
                    bytes.write(value);
                    i += 2;
                }
            }
        }
        return Optional.of(bytes.toString(StandardCharsets.UTF_8));
    }

    private static Integer parseDigits(String s, int from, int count, int radix) {
        if (from + count > s.length()) {
            return null;
        }
        int value = 0;
        for (int k = from; k < from + count; k++) {
            int digit = Character.digit(s.charAt(k), radix);
            if (digit < 0) {
                return null;
            }
            value = value * radix + digit;
        }
        return value;
    }

    private static void writeUtf8(ByteArrayOutputStream out, int codePoint) {
        byte[] encoded = new String(Character.toChars(codePoint)).getBytes(StandardCharsets.UTF_8);
        out.write(encoded, 0, encoded.length);
    }

    /**
     * Quotes a string the way Go's {@code %q} verb does: printable characters are kept,
     * everything else is escaped.
     */
    public static String quote(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append('"');
        value.codePoints().forEach(cp -> appendEscaped(sb, cp));
        sb.append('"');
        return sb.toString();
    }

    private static void appendEscaped(StringBuilder sb, int cp) {
        switch (cp) {
            case '"': sb.append("\\\""); return;
            case '\\': sb.append("\\\\"); return;
            case 0x07: sb.append("\\a"); return;
            case '\b': sb.append("\\b"); return;
            case '\f': sb.append("\\f"); return;
            case '\n': sb.append("\\n"); return;
            case '\r': sb.append("\\r"); return;
            case '\t': sb.append("\\t"); return;
            case 0x0b: sb.append("\\v"); return;
            default:
        }
        if (cp < 0x20 || cp == 0x7f) {
            sb.append(String.format("\\x%02x", cp));
        } else if (isPrintable(cp)) {
            sb.appendCodePoint(cp);
        } else if (cp < 0x10000) {
            sb.append(String.format("\\u%04x", cp));
        } else {
            sb.append(String.format("\\U%08x", cp));
        }
    }

    private static boolean isPrintable(int cp) {
        if (cp == ' ') {
            return true;
        }
        switch (Character.getType(cp)) {
            case Character.UPPERCASE_LETTER:
            case Character.LOWERCASE_LETTER:
            case Character.TITLECASE_LETTER:
            case Character.MODIFIER_LETTER:
            case Character.OTHER_LETTER:
            case Character.NON_SPACING_MARK:
            case Character.ENCLOSING_MARK:
            case Character.COMBINING_SPACING_MARK:
            case Character.DECIMAL_DIGIT_NUMBER:
            case Character.LETTER_NUMBER:
            case Character.OTHER_NUMBER:
            case Character.CONNECTOR_PUNCTUATION:
            case Character.DASH_PUNCTUATION:
            case Character.START_PUNCTUATION:
            case Character.END_PUNCTUATION:
            case Character.INITIAL_QUOTE_PUNCTUATION:
            case Character.FINAL_QUOTE_PUNCTUATION:
            case Character.OTHER_PUNCTUATION:
            case Character.MATH_SYMBOL:
            case Character.CURRENCY_SYMBOL:
            case Character.MODIFIER_SYMBOL:
            case Character.OTHER_SYMBOL:
                return true;
            default:
                return false;
        }
    }
}
