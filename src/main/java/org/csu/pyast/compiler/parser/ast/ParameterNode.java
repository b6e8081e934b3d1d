package org.csu.pyast.compiler.parser.ast;

/**
 * AST 节点: 函数形参
 *
 * @param name 参数名
 * @param defaultValue 默认值, null if absent
 * @param keywordOnly true if declared after a bare '*'
 */
public record ParameterNode(String name, ExpressionNode defaultValue, boolean keywordOnly) implements AstNode {
}
