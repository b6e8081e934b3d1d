package org.csu.pyast.compiler.parser.ast;

public sealed interface ExpressionNode extends StatementNode permits
        IntLiteralNode, FloatLiteralNode, StringLiteralNode, BoolLiteralNode, NoneLiteralNode,
        IdentifierNode, BinaryOpNode, UnaryOpNode, FunctionCallNode, AttributeNode,
        ListNode, DictNode, SubscriptNode {

    /**
     * @return true if this expression may appear on the left of '=' or after 'for'
     */
    default boolean isAssignable() {
        return this instanceof IdentifierNode
                || this instanceof AttributeNode
                || this instanceof SubscriptNode;
    }
}
