package org.csu.pyast.compiler.parser.ast;

/**
 * AST 节点: 属性访问 (e.g., obj.attr)
 */
public record AttributeNode(ExpressionNode value, String attribute) implements ExpressionNode {
}
