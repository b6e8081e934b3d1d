package org.csu.pyast.compiler.parser.ast;

import java.util.List;

/**
 * AST 节点: 列表字面量
 */
public record ListNode(List<ExpressionNode> elements) implements ExpressionNode {

    public ListNode {
        elements = List.copyOf(elements);
    }
}
