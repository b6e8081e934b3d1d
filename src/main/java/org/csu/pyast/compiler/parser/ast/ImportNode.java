package org.csu.pyast.compiler.parser.ast;

/**
 * AST 节点: import module [as alias]
 *
 * @param module dotted module name
 * @param alias null if absent
 */
public record ImportNode(String module, String alias) implements StatementNode {
}
