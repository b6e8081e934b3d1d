package org.csu.pyast.compiler.parser.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * AST 节点: 函数调用 (e.g., print(x, sep=", "))
 *
 * @param callee the called expression
 * @param arguments positional arguments in source order
 * @param keywordArguments keyword arguments in source order, names unique
 */
public record FunctionCallNode(
        ExpressionNode callee,
        List<ExpressionNode> arguments,
        Map<String, ExpressionNode> keywordArguments
) implements ExpressionNode {

    public FunctionCallNode {
        arguments = List.copyOf(arguments);
        keywordArguments = Collections.unmodifiableMap(new LinkedHashMap<>(keywordArguments));
    }
}
