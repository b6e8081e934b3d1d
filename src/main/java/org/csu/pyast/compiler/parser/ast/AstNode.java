package org.csu.pyast.compiler.parser.ast;

/**
 * @description: 所有 AST 节点的根类型
 *
 * The node set is closed: statements (including bare expressions), and function parameters.
 * Nodes are immutable and own their children exclusively.
 */
public sealed interface AstNode permits StatementNode, ParameterNode {
}
