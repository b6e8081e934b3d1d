package org.csu.pyast.compiler.parser.ast;

/**
 * AST 节点: 表示一个标识符 (变量名, 函数名等)
 */
public record IdentifierNode(String name) implements ExpressionNode {
}
