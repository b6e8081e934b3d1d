package org.csu.pyast.compiler.lexer;

import org.csu.pyast.common.exception.LexerException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * @description: 词法分析器 (Lexer/Scanner)
 *
 * Splits source text into tokens. Besides literals, names and operators it produces the
 * structural tokens of an indentation-delimited grammar: INDENT and DEDENT from an indentation
 * stack, NEWLINE at the end of every logical line, and END after all input.
 * Newlines and indentation are ignored while inside ( [ or {.
 *
 * An instance holds mutable scanning state and is meant for a single call to {@link #tokenize()}.
 */
public class Lexer {

    private static final int TAB_WIDTH = 8;
    private static final String STRING_PREFIX_CHARS = "rRbBuUfF";
    // 合法的两字母前缀, 比较时忽略大小写
    private static final Set<String> TWO_LETTER_PREFIXES = Set.of("rb", "br", "rf", "fr");

    // 关键字映射表, case-sensitive
    private static final Map<String, TokenType> keywords;

    static {
        keywords = new HashMap<>();
        keywords.put("def", TokenType.DEF);
        keywords.put("class", TokenType.CLASS);
        keywords.put("return", TokenType.RETURN);
        keywords.put("import", TokenType.IMPORT);
        keywords.put("from", TokenType.FROM);
        keywords.put("as", TokenType.AS);
        keywords.put("if", TokenType.IF);
        keywords.put("elif", TokenType.ELIF);
        keywords.put("else", TokenType.ELSE);
        keywords.put("while", TokenType.WHILE);
        keywords.put("for", TokenType.FOR);
        keywords.put("pass", TokenType.PASS);
        keywords.put("break", TokenType.BREAK);
        keywords.put("continue", TokenType.CONTINUE);
        keywords.put("True", TokenType.TRUE);
        keywords.put("False", TokenType.FALSE);
        keywords.put("None", TokenType.NONE);
        keywords.put("and", TokenType.AND);
        keywords.put("or", TokenType.OR);
        keywords.put("not", TokenType.NOT);
        keywords.put("in", TokenType.IN);
        keywords.put("is", TokenType.IS);
        keywords.put("lambda", TokenType.LAMBDA);
    }

    private final String input;
    private int position = 0; // 当前读取的位置
    private int line = 1;     // 当前行号
    private int column = 1;   // 当前列号

    private final Deque<Integer> indentStack = new ArrayDeque<>();
    private int bracketDepth = 0;
    private boolean atLineStart = true;
    private final List<Token> tokens = new ArrayList<>();

    public Lexer(String input) {
        this.input = input;
        this.indentStack.push(0);
    }

    /**
     * 主方法，执行词法分析并返回所有Token
     * @return Token列表, always terminated by END
     * @throws LexerException on the first malformed construct
     */
    public List<Token> tokenize() {
        while (true) {
            if (atLineStart && !readIndentation()) {
                continue;
            }
            skipWhitespace();
            if (isAtEnd()) {
                break;
            }
            if (peek() == '\n') {
                tokens.add(new Token(TokenType.NEWLINE, "", line, column));
                consumeNewline();
                atLineStart = true;
                continue;
            }
            tokens.add(nextToken());
        }

        if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).type() != TokenType.NEWLINE) {
            tokens.add(new Token(TokenType.NEWLINE, "", line, column));
        }
        while (indentStack.peek() > 0) {
            indentStack.pop();
            tokens.add(new Token(TokenType.DEDENT, "", line, column));
        }
        tokens.add(new Token(TokenType.END, "", line, column));
        return tokens;
    }

    /**
     * Measures the leading whitespace of a physical line and emits INDENT/DEDENT tokens.
     * @return false if the line was blank or comment-only and has been skipped
     */
    private boolean readIndentation() {
        int width = 0;
        while (!isAtEnd()) {
            char ch = peek();
            if (ch == ' ') {
                width++;
            } else if (ch == '\t') {
                width = (width / TAB_WIDTH + 1) * TAB_WIDTH;
            } else if (ch == '\f') {
                width = 0;
            } else {
                break;
            }
            advance();
        }

        if (isAtEnd()) {
            atLineStart = false;
            return true;
        }
        char ch = peek();
        if (ch == '#' || ch == '\r' || ch == '\n') {
            skipComment();
            if (peek() == '\r') {
                advance();
            }
            if (peek() == '\n') {
                consumeNewline();
            }
            return false;
        }

        atLineStart = false;
        int current = indentStack.peek();
        if (width > current) {
            indentStack.push(width);
            tokens.add(new Token(TokenType.INDENT, "", line, column));
        } else if (width < current) {
            while (width < indentStack.peek()) {
                indentStack.pop();
                tokens.add(new Token(TokenType.DEDENT, "", line, column));
            }
            if (width != indentStack.peek()) {
                throw new LexerException("unindent does not match any outer indentation level", line, column);
            }
        }
        return true;
    }

    /**
     * 获取下一个Token
     * @return 解析出的下一个Token
     */
    private Token nextToken() {
        char currentChar = peek();

        // 识别标识符, 关键字或带前缀的字符串 (f"...", r'...')
        if (isLetter(currentChar)) {
            int prefixLength = stringPrefixLength();
            if (prefixLength > 0) {
                return readString(prefixLength);
            }
            return readIdentifierOrKeyword();
        }

        // 识别数字
        if (isDigit(currentChar) || (currentChar == '.' && isDigit(peekNext()))) {
            return readNumber();
        }

        // 识别字符串
        if (currentChar == '\'' || currentChar == '"') {
            return readString(0);
        }

        // 识别运算符和分隔符
        switch (currentChar) {
            case '+':
                return consumeAndReturn(TokenType.PLUS, "+");
            case '-':
                return consumeAndReturn(TokenType.MINUS, "-");
            case '%':
                return consumeAndReturn(TokenType.PERCENT, "%");
            case '*':
                if (peekNext() == '*') {
                    return consumeAndReturn(TokenType.DOUBLE_ASTERISK, "**");
                }
                return consumeAndReturn(TokenType.ASTERISK, "*");
            case '/':
                if (peekNext() == '/') {
                    return consumeAndReturn(TokenType.DOUBLE_SLASH, "//");
                }
                return consumeAndReturn(TokenType.SLASH, "/");
            case '=':
                if (peekNext() == '=') {
                    return consumeAndReturn(TokenType.EQUAL, "==");
                }
                return consumeAndReturn(TokenType.ASSIGN, "=");
            case '!':
                if (peekNext() == '=') {
                    return consumeAndReturn(TokenType.NOT_EQUAL, "!=");
                }
                throw new LexerException("unrecognized character '!'", line, column);
            case '<':
                if (peekNext() == '=') {
                    return consumeAndReturn(TokenType.LESS_EQUAL, "<=");
                }
                return consumeAndReturn(TokenType.LESS, "<");
            case '>':
                if (peekNext() == '=') {
                    return consumeAndReturn(TokenType.GREATER_EQUAL, ">=");
                }
                return consumeAndReturn(TokenType.GREATER, ">");
            case '(':
                bracketDepth++;
                return consumeAndReturn(TokenType.LPAREN, "(");
            case '[':
                bracketDepth++;
                return consumeAndReturn(TokenType.LBRACKET, "[");
            case '{':
                bracketDepth++;
                return consumeAndReturn(TokenType.LBRACE, "{");
            case ')':
                return closeBracket(TokenType.RPAREN, ")");
            case ']':
                return closeBracket(TokenType.RBRACKET, "]");
            case '}':
                return closeBracket(TokenType.RBRACE, "}");
            case ',':
                return consumeAndReturn(TokenType.COMMA, ",");
            case ':':
                return consumeAndReturn(TokenType.COLON, ":");
            case '.':
                return consumeAndReturn(TokenType.DOT, ".");
            default:
                throw new LexerException("unrecognized character '" + currentChar + "'", line, column);
        }
    }

    private Token closeBracket(TokenType type, String lexeme) {
        if (bracketDepth == 0) {
            throw new LexerException("unmatched '" + lexeme + "'", line, column);
        }
        bracketDepth--;
        return consumeAndReturn(type, lexeme);
    }

    private Token readIdentifierOrKeyword() {
        int startPos = position;
        int startCol = column;
        while (isLetterOrDigit(peek())) {
            advance();
        }
        String text = input.substring(startPos, position);
        TokenType type = keywords.getOrDefault(text, TokenType.IDENTIFIER);
        return new Token(type, text, line, startCol);
    }

    private Token readNumber() {
        int startPos = position;
        int startCol = column;
        boolean isFloat = false;
        while (isDigit(peek())) {
            advance();
        }

        // 小数部分: "1.5", "1." and ".5" are all floats
        if (peek() == '.') {
            advance();
            isFloat = true;
            while (isDigit(peek())) {
                advance();
            }
        }

        // 指数部分
        if (peek() == 'e' || peek() == 'E') {
            advance();
            if (peek() == '+' || peek() == '-') {
                advance();
            }
            if (!isDigit(peek())) {
                throw new LexerException("malformed numeric literal '" + input.substring(startPos, position) + "'",
                        line, startCol);
            }
            while (isDigit(peek())) {
                advance();
            }
            isFloat = true;
        }

        if (isLetter(peek())) {
            while (isLetterOrDigit(peek())) {
                advance();
            }
            throw new LexerException("malformed numeric literal '" + input.substring(startPos, position) + "'",
                    line, startCol);
        }

        String number = input.substring(startPos, position);
        return new Token(isFloat ? TokenType.FLOAT_CONST : TokenType.INTEGER_CONST, number, line, startCol);
    }

    /**
     * Reads a quoted string, optionally preceded by a prefix such as f, r or rb.
     * The text between the quotes is kept verbatim; escape sequences are not decoded.
     */
    private Token readString(int prefixLength) {
        int startLine = line;
        int startCol = column;
        boolean interpolated = input.substring(position, position + prefixLength).toLowerCase().contains("f");
        for (int i = 0; i < prefixLength; i++) {
            advance();
        }

        char quote = peek();
        boolean triple = peekAt(1) == quote && peekAt(2) == quote;
        int delimiterLength = triple ? 3 : 1;
        for (int i = 0; i < delimiterLength; i++) {
            advance();
        }

        int startPos = position;
        while (true) {
            if (isAtEnd()) {
                throw new LexerException("unterminated string literal", startLine, startCol);
            }
            char ch = peek();
            if (ch == '\\') {
                advance();
                if (isAtEnd()) {
                    throw new LexerException("unterminated string literal", startLine, startCol);
                }
                if (peek() == '\n') {
                    consumeNewline();
                } else {
                    advance();
                }
            } else if (ch == '\n') {
                if (!triple) {
                    throw new LexerException("unterminated string literal", startLine, startCol);
                }
                consumeNewline();
            } else if (ch == quote && (!triple || (peekAt(1) == quote && peekAt(2) == quote))) {
                break;
            } else {
                advance();
            }
        }

        String text = input.substring(startPos, position);
        for (int i = 0; i < delimiterLength; i++) {
            advance();
        }
        return new Token(interpolated ? TokenType.FSTRING_CONST : TokenType.STRING_CONST, text, startLine, startCol);
    }

    /**
     * @return the length of a string prefix at the current position, or 0 if the letters
     *         here start an identifier
     */
    private int stringPrefixLength() {
        if (STRING_PREFIX_CHARS.indexOf(peek()) < 0) {
            return 0;
        }
        if (isQuote(peekAt(1))) {
            return 1;
        }
        String pair = ("" + peek() + peekAt(1)).toLowerCase();
        if (TWO_LETTER_PREFIXES.contains(pair) && isQuote(peekAt(2))) {
            return 2;
        }
        return 0;
    }

    // --- 辅助方法 ---

    /**
     * Skips blanks, comments and explicit line joins. Newlines are skipped only inside brackets.
     */
    private void skipWhitespace() {
        while (!isAtEnd()) {
            char ch = peek();
            if (ch == ' ' || ch == '\t' || ch == '\r' || ch == '\f') {
                advance();
            } else if (ch == '#') {
                skipComment();
            } else if (ch == '\\' && (peekNext() == '\n' || (peekNext() == '\r' && peekAt(2) == '\n'))) {
                advance();
                if (peek() == '\r') {
                    advance();
                }
                consumeNewline();
            } else if (ch == '\n' && bracketDepth > 0) {
                consumeNewline();
            } else {
                break;
            }
        }
    }

    private void skipComment() {
        if (peek() != '#') {
            return;
        }
        while (!isAtEnd() && peek() != '\n') {
            advance();
        }
    }

    private boolean isAtEnd() {
        return position >= input.length();
    }

    private char peek() {
        return peekAt(0);
    }

    private char peekNext() {
        return peekAt(1);
    }

    private char peekAt(int offset) {
        if (position + offset >= input.length()) return '\0'; // 文件结束符
        return input.charAt(position + offset);
    }

    private void advance() {
        position++;
        column++;
    }

    private void consumeNewline() {
        position++;
        line++;
        column = 1;
    }

    private Token consumeAndReturn(TokenType type, String lexeme) {
        Token token = new Token(type, lexeme, line, column);
        for (int i = 0; i < lexeme.length(); i++) {
            advance();
        }
        return token;
    }

    private boolean isQuote(char c) {
        return c == '\'' || c == '"';
    }

    private boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isLetterOrDigit(char c) {
        return isLetter(c) || isDigit(c);
    }
}
