package org.csu.pyast.compiler.parser.ast;

public record PassNode() implements StatementNode {
}
