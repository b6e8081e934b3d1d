package org.csu.pyast.compiler.parser.ast;

import java.util.List;

/**
 * AST 节点: if 语句
 *
 * An elif clause is stored as a nested IfNode, the only statement of {@code elseBody}.
 */
public record IfNode(
        ExpressionNode condition,
        List<StatementNode> thenBody,
        List<StatementNode> elseBody
) implements StatementNode {

    public IfNode {
        thenBody = List.copyOf(thenBody);
        elseBody = List.copyOf(elseBody);
    }
}
