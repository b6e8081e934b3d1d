package org.csu.pyast.compiler.parser.ast;

public record ContinueNode() implements StatementNode {
}
