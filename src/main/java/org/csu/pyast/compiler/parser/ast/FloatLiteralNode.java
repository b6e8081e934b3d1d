package org.csu.pyast.compiler.parser.ast;

/**
 * AST 节点: 浮点数字面量
 */
public record FloatLiteralNode(double value) implements ExpressionNode {
}
