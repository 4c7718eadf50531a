/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package expressions;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits expression text into tokens. Only numeric literals, names, the operators + - * / ** and parentheses are
 * recognized; any other character is rejected.
 */
final class Tokenizer {

    enum TokenType {
        NUMBER, NAME, PLUS, MINUS, STAR, SLASH, POWER, LPAREN, RPAREN, END;
    }

    static final class Token {

        final TokenType type;

        final String text;

        final int position;

        Token(TokenType type, String text, int position) {
            this.type = type;
            this.text = text;
            this.position = position;
        }

        @Override
        public String toString() {
            return type == TokenType.END ? "end of expression" : "'" + text + "'";
        }
    }

    private final String text;

    private int pos;

    Tokenizer(String text) {
        this.text = text;
    }

    List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            while (pos < text.length() && Character.isWhitespace(text.charAt(pos)))
                pos++;
            if (pos == text.length()) {
                tokens.add(new Token(TokenType.END, "", pos));
                return tokens;
            }
            char c = text.charAt(pos);
            int start = pos;
            if (isDigit(c) || (c == '.' && pos + 1 < text.length() && isDigit(text.charAt(pos + 1))))
                tokens.add(new Token(TokenType.NUMBER, number(), start));
            else if (Character.isLetter(c) || c == '_')
                tokens.add(new Token(TokenType.NAME, name(), start));
            else if (c == '*' && pos + 1 < text.length() && text.charAt(pos + 1) == '*') {
                pos += 2;
                tokens.add(new Token(TokenType.POWER, "**", start));
            } else {
                TokenType type = single(c);
                if (type == null)
                    throw new ExpressionException(text, start, "Unsupported character '" + c + "'");
                pos++;
                tokens.add(new Token(type, String.valueOf(c), start));
            }
        }
    }

    private static TokenType single(char c) {
        switch (c) {
        case '+':
            return TokenType.PLUS;
        case '-':
            return TokenType.MINUS;
        case '*':
            return TokenType.STAR;
        case '/':
            return TokenType.SLASH;
        case '(':
            return TokenType.LPAREN;
        case ')':
            return TokenType.RPAREN;
        default:
            return null;
        }
    }

    private String number() {
        int start = pos;
        digits();
        if (pos < text.length() && text.charAt(pos) == '.') {
            pos++;
            digits();
        }
        if (pos < text.length() && (text.charAt(pos) == 'e' || text.charAt(pos) == 'E')) {
            int mark = pos++;
            if (pos < text.length() && (text.charAt(pos) == '+' || text.charAt(pos) == '-'))
                pos++;
            if (pos == text.length() || !isDigit(text.charAt(pos)))
                throw new ExpressionException(text, mark, "Malformed exponent in numeric literal");
            digits();
        }
        if (pos < text.length() && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '_' || text.charAt(pos) == '.'))
            throw new ExpressionException(text, start, "Invalid numeric literal '" + text.substring(start, pos + 1) + "'");
        return text.substring(start, pos);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private void digits() {
        while (pos < text.length() && isDigit(text.charAt(pos)))
            pos++;
    }

    private String name() {
        int start = pos;
        while (pos < text.length() && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '_'))
            pos++;
        return text.substring(start, pos);
    }
}
