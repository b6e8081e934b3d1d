package org.csu.pyast.common.exception;

import lombok.Getter;

/**
 * @description: 词法分析阶段的异常 (非法字符, 未闭合字符串, 缩进不一致等)
 */
@Getter
public class LexerException extends RuntimeException {

    private final int line;
    private final int column;

    public LexerException(String message, int line, int column) {
        super(String.format("Lexical Error at line %d, column %d: %s", line, column, message));
        this.line = line;
        this.column = column;
    }
}
