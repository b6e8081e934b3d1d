package org.csu.pyast.compiler.parser.ast;

public record BoolLiteralNode(boolean value) implements ExpressionNode {
}
