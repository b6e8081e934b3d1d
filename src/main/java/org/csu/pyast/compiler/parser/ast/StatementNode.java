package org.csu.pyast.compiler.parser.ast;

/**
 * A node that may appear in a module forest or in a block body. Every expression may stand
 * alone as a statement.
 */
public sealed interface StatementNode extends AstNode permits ExpressionNode,
        AssignmentNode, FunctionDefNode, ClassDefNode, ReturnNode, ImportNode, FromImportNode,
        IfNode, WhileNode, ForNode, PassNode, BreakNode, ContinueNode {
}
