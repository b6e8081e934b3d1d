package org.csu.pyast.compiler.lexer;

/**
 * @param type 词法单元的类型 (种别码)
 * @param lexeme 词法单元的原始文本 (词素值); structural tokens carry an empty lexeme
 * @param line 所在的行号
 * @param column 所在的列号
 */
public record Token(TokenType type, String lexeme, int line, int column) {

    /**
     * Text used in "found ..." error messages.
     */
    public String describe() {
        if (type.isStructural()) {
            return type.name();
        }
        return "'" + lexeme + "'";
    }

    @Override
    public String toString() {
        return String.format("Token[Type=%-15s, Lexeme='%s', Position=%d:%d]",
                type, lexeme, line, column);
    }
}
