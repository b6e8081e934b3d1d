package org.csu.pyast.compiler.parser.ast;

import java.util.List;

/**
 * AST 节点: 类定义 (class)
 */
public record ClassDefNode(
        String name,
        List<ExpressionNode> bases,
        List<StatementNode> body
) implements StatementNode {

    public ClassDefNode {
        bases = List.copyOf(bases);
        body = List.copyOf(body);
    }
}
