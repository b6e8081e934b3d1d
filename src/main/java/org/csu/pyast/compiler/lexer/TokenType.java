package org.csu.pyast.compiler.lexer;

/**
 * @description: 定义词法单元（Token）的类型，即“种别码”
 */
public enum TokenType {
    // ---- 常量 (Constants) ----
    INTEGER_CONST,    // 123
    FLOAT_CONST,      // 1.5, 1e10, .5
    STRING_CONST,     // 'hello', "hello", """hello"""
    FSTRING_CONST,    // f"hello {name}", kept as opaque text
    TRUE,             // "True"
    FALSE,            // "False"
    NONE,             // "None"

    // ---- 标识符 (Identifier) ----
    IDENTIFIER,

    // ---- 关键字 (Keywords) ----
    DEF,
    CLASS,
    RETURN,
    IMPORT,
    FROM,
    AS,
    IF,
    ELIF,
    ELSE,
    WHILE,
    FOR,
    PASS,
    BREAK,
    CONTINUE,
    AND,
    OR,
    NOT,
    IN,
    IS,
    LAMBDA,

    // ---- 算术运算符 ----
    PLUS,             // +
    MINUS,            // -
    ASTERISK,         // *
    SLASH,            // /
    DOUBLE_SLASH,     // //
    PERCENT,          // %
    DOUBLE_ASTERISK,  // **

    // ---- 比较运算符 ----
    EQUAL,            // ==
    NOT_EQUAL,        // !=
    LESS,             // <
    LESS_EQUAL,       // <=
    GREATER,          // >
    GREATER_EQUAL,    // >=

    ASSIGN,           // =

    // ---- 分隔符 (Delimiters) ----
    LPAREN,           // (
    RPAREN,           // )
    LBRACKET,         // [
    RBRACKET,         // ]
    LBRACE,           // {
    RBRACE,           // }
    COMMA,            // ,
    COLON,            // :
    DOT,              // .

    // ---- 结构 Token ----
    INDENT,
    DEDENT,
    NEWLINE,
    END;              // 输入结束

    public boolean isStructural() {
        return this == INDENT || this == DEDENT || this == NEWLINE || this == END;
    }
}
