package org.csu.pyast.compiler.parser.ast;

/**
 * AST 节点: 一元运算 ("not", "-", "+")
 */
public record UnaryOpNode(String operator, ExpressionNode operand) implements ExpressionNode {
}
