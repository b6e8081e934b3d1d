package org.csu.pyast.compiler.parser.ast;

/**
 * AST 节点: 字符串字面量
 *
 * @param text the source text between the quotes, escapes not decoded
 * @param interpolated true for f-strings; their embedded expressions are not parsed
 */
public record StringLiteralNode(String text, boolean interpolated) implements ExpressionNode {
}
