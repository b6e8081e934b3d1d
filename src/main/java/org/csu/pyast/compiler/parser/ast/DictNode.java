package org.csu.pyast.compiler.parser.ast;

import java.util.List;

/**
 * AST 节点: 字典字面量, entries in source order (duplicate keys are kept)
 */
public record DictNode(List<Entry> entries) implements ExpressionNode {

    public DictNode {
        entries = List.copyOf(entries);
    }

    public record Entry(ExpressionNode key, ExpressionNode value) {
    }
}
