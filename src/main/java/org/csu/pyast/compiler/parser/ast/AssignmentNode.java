package org.csu.pyast.compiler.parser.ast;

/**
 * AST 节点: 赋值语句, target is an identifier, attribute or subscript
 */
public record AssignmentNode(ExpressionNode target, ExpressionNode value) implements StatementNode {
}
