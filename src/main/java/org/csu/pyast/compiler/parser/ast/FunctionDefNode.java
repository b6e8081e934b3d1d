package org.csu.pyast.compiler.parser.ast;

import java.util.List;

/**
 * AST 节点: 函数定义 (def)
 */
public record FunctionDefNode(
        String name,
        List<ParameterNode> parameters,
        List<StatementNode> body
) implements StatementNode {

    public FunctionDefNode {
        parameters = List.copyOf(parameters);
        body = List.copyOf(body);
    }
}
