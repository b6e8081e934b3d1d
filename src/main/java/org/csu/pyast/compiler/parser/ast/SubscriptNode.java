package org.csu.pyast.compiler.parser.ast;

/**
 * AST 节点: 下标访问 (e.g., items[0])
 */
public record SubscriptNode(ExpressionNode value, ExpressionNode index) implements ExpressionNode {
}
