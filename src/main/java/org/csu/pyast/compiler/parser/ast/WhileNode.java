package org.csu.pyast.compiler.parser.ast;

import java.util.List;

public record WhileNode(ExpressionNode condition, List<StatementNode> body) implements StatementNode {

    public WhileNode {
        body = List.copyOf(body);
    }
}
