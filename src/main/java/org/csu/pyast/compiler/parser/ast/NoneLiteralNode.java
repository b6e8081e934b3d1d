package org.csu.pyast.compiler.parser.ast;

public record NoneLiteralNode() implements ExpressionNode {
}
