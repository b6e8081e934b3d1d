package org.csu.pyast.compiler.parser.ast;

import java.util.List;

/**
 * AST 节点: from module import name [as alias], ...
 */
public record FromImportNode(String module, List<ImportedName> names) implements StatementNode {

    public FromImportNode {
        names = List.copyOf(names);
    }

    /**
     * @param alias null if absent
     */
    public record ImportedName(String name, String alias) {
    }
}
