package de.entwicklertraining.request.engine.streaming;

import org.json.JSONException;

/**
 * Syntax check for strict JSON text.
 *
 * <p>{@link org.json.JSONTokener} accepts unquoted keys, single-quoted strings, trailing commas and
 * hex numbers. Payloads are run through this check first so that only standard JSON reaches it.
 */
final class StrictJsonSyntax {

    private static final int MAX_DEPTH = 512;

    private final String text;
    private int pos;

    private StrictJsonSyntax(String text) {
        this.text = text;
    }

    /**
     * @throws JSONException if {@code text} is not exactly one JSON value, optionally surrounded by whitespace
     */
    static void check(String text) {
        StrictJsonSyntax syntax = new StrictJsonSyntax(text);
        syntax.skipWhitespace();
        syntax.value(0);
        syntax.skipWhitespace();
        if (syntax.pos != text.length()) {
            throw syntax.error("Unexpected trailing content");
        }
    }

    private void value(int depth) {
        if (depth > MAX_DEPTH) {
            throw error("Nesting too deep");
        }
        if (pos >= text.length()) {
            throw error("Unexpected end of input");
        }
        char c = text.charAt(pos);
        switch (c) {
            case '{' -> object(depth + 1);
            case '[' -> array(depth + 1);
            case '"' -> string();
            case 't' -> literal("true");
            case 'f' -> literal("false");
            case 'n' -> literal("null");
            default -> {
                if (c == '-' || isDigit(c)) {
                    number();
                } else {
                    throw error("Unexpected character '" + c + "'");
                }
            }
        }
    }

    private void object(int depth) {
        pos++;
        skipWhitespace();
        if (peek() == '}') {
            pos++;
            return;
        }
        while (true) {
            if (peek() != '"') {
                throw error("Expected a quoted key");
            }
            string();
            skipWhitespace();
            expect(':');
            skipWhitespace();
            value(depth);
            skipWhitespace();
            char c = peek();
            pos++;
            if (c == '}') {
                return;
            }
            if (c != ',') {
                throw error("Expected ',' or '}'");
            }
            skipWhitespace();
        }
    }

    private void array(int depth) {
        pos++;
        skipWhitespace();
        if (peek() == ']') {
            pos++;
            return;
        }
        while (true) {
            value(depth);
            skipWhitespace();
            char c = peek();
            pos++;
            if (c == ']') {
                return;
            }
            if (c != ',') {
                throw error("Expected ',' or ']'");
            }
            skipWhitespace();
        }
    }

    private void string() {
        pos++;
        while (pos < text.length()) {
            char c = text.charAt(pos++);
            if (c == '"') {
                return;
            }
            if (c < 0x20) {
                throw error("Control character in string");
            }
            if (c == '\\') {
                char escaped = peek();
                pos++;
                if (escaped == 'u') {
                    for (int i = 0; i < 4; i++) {
                        if (Character.digit(peek(), 16) < 0) {
                            throw error("Invalid unicode escape");
                        }
                        pos++;
                    }
                } else if ("\"\\/bfnrt".indexOf(escaped) < 0) {
                    throw error("Invalid escape");
                }
            }
        }
        throw error("Unterminated string");
    }

    private void number() {
        if (peek() == '-') {
            pos++;
        }
        if (peek() == '0') {
            pos++;
        } else if (isDigit(peek())) {
            digits();
        } else {
            throw error("Invalid number");
        }
        if (peek() == '.') {
            pos++;
            if (!isDigit(peek())) {
                throw error("Invalid fraction");
            }
            digits();
        }
        if (peek() == 'e' || peek() == 'E') {
            pos++;
            if (peek() == '+' || peek() == '-') {
                pos++;
            }
            if (!isDigit(peek())) {
                throw error("Invalid exponent");
            }
            digits();
        }
    }

    private void digits() {
        while (isDigit(peek())) {
            pos++;
        }
    }

    private void literal(String word) {
        if (!text.startsWith(word, pos)) {
            throw error("Unexpected token");
        }
        pos += word.length();
    }

    private void expect(char expected) {
        if (peek() != expected) {
            throw error("Expected '" + expected + "'");
        }
        pos++;
    }

    private void skipWhitespace() {
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c != ' ' && c != '\t' && c != '\n' && c != '\r') {
                return;
            }
            pos++;
        }
    }

    // 0 marks the end of input
    private char peek() {
        return pos < text.length() ? text.charAt(pos) : 0;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private JSONException error(String message) {
        return new JSONException(message + " at " + pos);
    }
}
