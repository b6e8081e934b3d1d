package org.csu.pyast.common.exception;

import lombok.Getter;
import org.csu.pyast.compiler.lexer.Token;

/**
 * @description: 语法分析阶段的异常, 携带出错 Token 的位置
 */
@Getter
public class ParseException extends RuntimeException {

    private final int line;
    private final int column;

    public ParseException(Token token, String expected) {
        super(String.format("Syntax Error at line %d, column %d: Expected %s, but found %s",
                token.line(),
                token.column(),
                expected,
                token.describe()));
        this.line = token.line();
        this.column = token.column();
    }

    private ParseException(String message, int line, int column) {
        super(message);
        this.line = line;
        this.column = column;
    }

    /**
     * For errors that are not an expected-vs-found mismatch, e.g. a duplicate keyword argument.
     */
    public static ParseException at(Token token, String detail) {
        return new ParseException(String.format("Syntax Error at line %d, column %d: %s",
                token.line(), token.column(), detail), token.line(), token.column());
    }
}
