package org.csu.pyast.compiler.parser.ast;

/**
 * @param value the returned expression, null for a bare 'return'
 */
public record ReturnNode(ExpressionNode value) implements StatementNode {
}
