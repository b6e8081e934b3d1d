package org.csu.pyast.compiler.parser.ast;

/**
 * AST 节点: 表示一个二元运算表达式 (e.g., a + b, x not in y)
 *
 * @param operator the operator symbol as written; "not in" and "is not" are single operators
 */
public record BinaryOpNode(
        String operator,
        ExpressionNode left,
        ExpressionNode right
) implements ExpressionNode {
}
