package org.csu.pyast.compiler.parser.ast;

public record BreakNode() implements StatementNode {
}
