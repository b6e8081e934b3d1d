package org.csu.pyast.compiler.parser.ast;

import java.math.BigInteger;

/**
 * AST 节点: 整数字面量, arbitrary precision
 */
public record IntLiteralNode(BigInteger value) implements ExpressionNode {

    public IntLiteralNode(long value) {
        this(BigInteger.valueOf(value));
    }
}
