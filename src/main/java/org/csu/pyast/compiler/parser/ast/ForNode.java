package org.csu.pyast.compiler.parser.ast;

import java.util.List;

/**
 * AST 节点: for target in iterable
 */
public record ForNode(
        ExpressionNode target,
        ExpressionNode iterable,
        List<StatementNode> body
) implements StatementNode {

    public ForNode {
        body = List.copyOf(body);
    }
}
