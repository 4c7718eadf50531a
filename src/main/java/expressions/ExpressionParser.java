/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package expressions;

import java.util.List;
import java.util.function.BinaryOperator;

import expressions.Tokenizer.Token;
import expressions.Tokenizer.TokenType;

/**
 * Recursive-descent parser building an expression tree. Grammar:
 *
 * <pre>
 * expression := additive END
 * additive   := term (('+' | '-') term)*
 * term       := unary (('*' | '/') unary)*
 * unary      := ('-' | '+') unary | power
 * power      := primary ('**' unary)?
 * primary    := NUMBER | NAME | '(' additive ')'
 * </pre>
 *
 * so that {@code **} is right-associative and binds tighter than a unary minus on its left, as in {@code -x**2}.
 */
final class ExpressionParser {

    private final String text;

    private final VariableBinding binding;

    private List<Token> tokens;

    private int index;

    ExpressionParser(String text, VariableBinding binding) {
        this.text = text;
        this.binding = binding;
    }

    Node parse() {
        tokens = new Tokenizer(text).tokenize();
        index = 0;
        if (peek().type == TokenType.END)
            throw new ExpressionException(text, "Empty expression");
        Node node = additive();
        Token t = peek();
        if (t.type != TokenType.END)
            throw new ExpressionException(text, t.position, "Unexpected " + t);
        return node;
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token next() {
        return tokens.get(index++);
    }

    private boolean accept(TokenType type) {
        if (peek().type != type)
            return false;
        index++;
        return true;
    }

    private Node additive() {
        Node node = term();
        while (true) {
            if (peek().type == TokenType.PLUS) {
                int position = next().position;
                node = fold(position, Node::add, node, term());
            } else if (peek().type == TokenType.MINUS) {
                int position = next().position;
                node = fold(position, Node::subtract, node, term());
            } else
                return node;
        }
    }

    private Node term() {
        Node node = unary();
        while (true) {
            if (peek().type == TokenType.STAR) {
                int position = next().position;
                node = fold(position, Node::multiply, node, unary());
            } else if (peek().type == TokenType.SLASH) {
                int position = next().position;
                Node divisor = unary();
                node = fold(position, Node::divide, node, divisor);
            } else
                return node;
        }
    }

    private Node unary() {
        if (accept(TokenType.MINUS))
            return Node.negate(unary());
        if (accept(TokenType.PLUS))
            return unary();
        return power();
    }

    private Node power() {
        Node base = primary();
        if (peek().type == TokenType.POWER) {
            int position = next().position;
            Node exponent = unary();
            return fold(position, Node::power, base, exponent);
        }
        return base;
    }

    private Node primary() {
        Token t = next();
        switch (t.type) {
        case NUMBER:
            double value = Double.parseDouble(t.text);
            if (!Double.isFinite(value))
                throw new ExpressionException(text, t.position, "Number " + t.text + " is out of range");
            return Node.constant(value);
        case NAME:
            if (peek().type == TokenType.LPAREN)
                throw new ExpressionException(text, t.position, "Function calls are not supported ('" + t.text + "')");
            int position = binding.positionOf(t.text);
            if (position < 0)
                throw new ExpressionException(text, t.position, "Name '" + t.text + "' is not a declared variable");
            return Node.variable(t.text, position);
        case LPAREN:
            Node node = additive();
            Token closing = next();
            if (closing.type != TokenType.RPAREN)
                throw new ExpressionException(text, closing.position, "Expected ')' but found " + closing);
            return node;
        default:
            throw new ExpressionException(text, t.position, "Unexpected " + t);
        }
    }

    /**
     * Applies a folding factory, turning constant arithmetic errors into expression errors located at the operator.
     */
    private Node fold(int position, BinaryOperator<Node> factory, Node left, Node right) {
        try {
            return factory.apply(left, right);
        } catch (ArithmeticException e) {
            throw new ExpressionException(text, position, "Invalid constant arithmetic: " + e.getMessage());
        }
    }
}
