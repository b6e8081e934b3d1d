package org.csu.pyast.compiler.parser;

import org.csu.pyast.common.exception.ParseException;
import org.csu.pyast.compiler.lexer.Token;
import org.csu.pyast.compiler.lexer.TokenType;
import org.csu.pyast.compiler.parser.ast.*;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * @description: 语法分析器
 * 采用递归下降法，将Token流转换为抽象语法树(AST)
 *
 * Expression precedence, lowest first: or, and, not, comparison (chainable), + -,
 * * / // %, unary + -, ** (right associative), postfix call/subscript/attribute, primary.
 * Parsing stops at the first error; no partial tree is returned.
 */
public class Parser {

    private final List<Token> tokens;
    private int position = 0;

    public Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * @return the module forest: top-level statements in source order
     * @throws ParseException at the first token that does not fit the grammar
     */
    public List<StatementNode> parse() {
        List<StatementNode> statements = new ArrayList<>();
        while (!isAtEnd()) {
            statements.add(parseStatement());
        }
        return statements;
    }

    private StatementNode parseStatement() {
        if (check(TokenType.INDENT) || check(TokenType.DEDENT) || check(TokenType.NEWLINE)) {
            throw new ParseException(peek(), "a statement");
        }
        if (match(TokenType.DEF)) {
            return parseFunctionDef();
        }
        if (match(TokenType.CLASS)) {
            return parseClassDef();
        }
        if (match(TokenType.IF)) {
            return parseIfStatement();
        }
        if (match(TokenType.WHILE)) {
            return parseWhileStatement();
        }
        if (match(TokenType.FOR)) {
            return parseForStatement();
        }

        StatementNode statement = parseSimpleStatement();
        consume(TokenType.NEWLINE, "NEWLINE at the end of the statement");
        return statement;
    }

    private StatementNode parseSimpleStatement() {
        if (match(TokenType.RETURN)) {
            ExpressionNode value = check(TokenType.NEWLINE) ? null : parseExpression();
            return new ReturnNode(value);
        }
        if (match(TokenType.IMPORT)) {
            return parseImport();
        }
        if (match(TokenType.FROM)) {
            return parseFromImport();
        }
        if (match(TokenType.PASS)) {
            return new PassNode();
        }
        if (match(TokenType.BREAK)) {
            return new BreakNode();
        }
        if (match(TokenType.CONTINUE)) {
            return new ContinueNode();
        }
        return parseExpressionStatement();
    }

    /**
     * An expression statement, or an assignment once '=' follows the parsed expression.
     */
    private StatementNode parseExpressionStatement() {
        ExpressionNode expression = parseExpression();
        if (match(TokenType.ASSIGN)) {
            Token assign = previous();
            if (!expression.isAssignable()) {
                throw ParseException.at(assign,
                        "invalid assignment target, expected an identifier, attribute or subscript before '='");
            }
            ExpressionNode value = parseExpression();
            return new AssignmentNode(expression, value);
        }
        return expression;
    }

    // ---- 复合语句 ----

    /**
     * Parses ':' and the body that follows it: an indented block, or one simple statement
     * on the same line.
     */
    private List<StatementNode> parseBlock() {
        consume(TokenType.COLON, "':'");
        if (!match(TokenType.NEWLINE)) {
            StatementNode statement = parseSimpleStatement();
            consume(TokenType.NEWLINE, "NEWLINE at the end of the statement");
            return List.of(statement);
        }
        consume(TokenType.INDENT, "an indented block");
        List<StatementNode> body = new ArrayList<>();
        do {
            body.add(parseStatement());
        } while (!check(TokenType.DEDENT) && !isAtEnd());
        consume(TokenType.DEDENT, "the end of the indented block");
        return body;
    }

    private FunctionDefNode parseFunctionDef() {
        String name = consume(TokenType.IDENTIFIER, "function name").lexeme();
        consume(TokenType.LPAREN, "'(' after function name");
        List<ParameterNode> parameters = parseParameters();
        consume(TokenType.RPAREN, "')' after parameters");
        List<StatementNode> body = parseBlock();
        return new FunctionDefNode(name, parameters, body);
    }

    private List<ParameterNode> parseParameters() {
        List<ParameterNode> parameters = new ArrayList<>();
        Set<String> names = new HashSet<>();
        boolean keywordOnly = false;
        boolean seenDefault = false;
        while (!check(TokenType.RPAREN)) {
            if (match(TokenType.ASTERISK)) {
                Token star = previous();
                if (keywordOnly) {
                    throw ParseException.at(star, "'*' may appear only once in a parameter list");
                }
                if (check(TokenType.IDENTIFIER)) {
                    throw ParseException.at(star, "variadic parameters ('*name') are not supported");
                }
                keywordOnly = true;
                if (!check(TokenType.RPAREN)) {
                    consume(TokenType.COMMA, "',' after '*'");
                }
                if (check(TokenType.RPAREN)) {
                    throw ParseException.at(star, "named parameters must follow bare '*'");
                }
                continue;
            }

            Token nameToken = consume(TokenType.IDENTIFIER, "parameter name");
            String name = nameToken.lexeme();
            if (!names.add(name)) {
                throw ParseException.at(nameToken, "duplicate parameter '" + name + "' in function definition");
            }
            ExpressionNode defaultValue = null;
            if (match(TokenType.ASSIGN)) {
                defaultValue = parseExpression();
                seenDefault = true;
            } else if (seenDefault && !keywordOnly) {
                throw ParseException.at(nameToken, "non-default parameter '" + name + "' follows default parameter");
            }
            parameters.add(new ParameterNode(name, defaultValue, keywordOnly));

            if (!match(TokenType.COMMA)) {
                break;
            }
        }
        return parameters;
    }

    private ClassDefNode parseClassDef() {
        String name = consume(TokenType.IDENTIFIER, "class name").lexeme();
        List<ExpressionNode> bases = new ArrayList<>();
        if (match(TokenType.LPAREN)) {
            while (!check(TokenType.RPAREN)) {
                bases.add(parseExpression());
                if (!match(TokenType.COMMA)) {
                    break;
                }
            }
            consume(TokenType.RPAREN, "')' after base classes");
        }
        List<StatementNode> body = parseBlock();
        return new ClassDefNode(name, bases, body);
    }

    /**
     * Called after 'if' or 'elif'. An elif clause becomes a nested IfNode that is the only
     * statement of the else body; a trailing else belongs to the innermost IfNode.
     */
    private IfNode parseIfStatement() {
        ExpressionNode condition = parseExpression();
        List<StatementNode> thenBody = parseBlock();
        List<StatementNode> elseBody = List.of();
        if (match(TokenType.ELIF)) {
            elseBody = List.of(parseIfStatement());
        } else if (match(TokenType.ELSE)) {
            elseBody = parseBlock();
        }
        return new IfNode(condition, thenBody, elseBody);
    }

    private WhileNode parseWhileStatement() {
        ExpressionNode condition = parseExpression();
        List<StatementNode> body = parseBlock();
        return new WhileNode(condition, body);
    }

    private ForNode parseForStatement() {
        // 目标只解析到后缀表达式, 否则 "x in items" 会被当作比较运算
        Token targetStart = peek();
        ExpressionNode target = parsePostfixExpression();
        if (!target.isAssignable()) {
            throw ParseException.at(targetStart, "invalid loop target, expected an identifier, attribute or subscript");
        }
        consume(TokenType.IN, "'in' after loop target");
        ExpressionNode iterable = parseExpression();
        List<StatementNode> body = parseBlock();
        return new ForNode(target, iterable, body);
    }

    // ---- import ----

    private ImportNode parseImport() {
        String module = parseDottedName();
        String alias = null;
        if (match(TokenType.AS)) {
            alias = consume(TokenType.IDENTIFIER, "alias after 'as'").lexeme();
        }
        return new ImportNode(module, alias);
    }

    private FromImportNode parseFromImport() {
        String module = parseDottedName();
        consume(TokenType.IMPORT, "'import' after module name");
        List<FromImportNode.ImportedName> names = new ArrayList<>();
        if (match(TokenType.ASTERISK)) {
            names.add(new FromImportNode.ImportedName("*", null));
            return new FromImportNode(module, names);
        }

        boolean parenthesized = match(TokenType.LPAREN);
        do {
            String name = consume(TokenType.IDENTIFIER, "imported name").lexeme();
            String alias = null;
            if (match(TokenType.AS)) {
                alias = consume(TokenType.IDENTIFIER, "alias after 'as'").lexeme();
            }
            names.add(new FromImportNode.ImportedName(name, alias));
        } while (match(TokenType.COMMA) && !(parenthesized && check(TokenType.RPAREN)));
        if (parenthesized) {
            consume(TokenType.RPAREN, "')' after imported names");
        }
        return new FromImportNode(module, names);
    }

    private String parseDottedName() {
        StringBuilder name = new StringBuilder(consume(TokenType.IDENTIFIER, "module name").lexeme());
        while (match(TokenType.DOT)) {
            name.append('.').append(consume(TokenType.IDENTIFIER, "name after '.'").lexeme());
        }
        return name.toString();
    }

    // ---- 表达式 ----

    private ExpressionNode parseExpression() {
        return parseOrExpression();
    }

    private ExpressionNode parseOrExpression() {
        ExpressionNode left = parseAndExpression();
        while (match(TokenType.OR)) {
            String operator = previous().lexeme();
            ExpressionNode right = parseAndExpression();
            left = new BinaryOpNode(operator, left, right);
        }
        return left;
    }

    private ExpressionNode parseAndExpression() {
        ExpressionNode left = parseNotExpression();
        while (match(TokenType.AND)) {
            String operator = previous().lexeme();
            ExpressionNode right = parseNotExpression();
            left = new BinaryOpNode(operator, left, right);
        }
        return left;
    }

    private ExpressionNode parseNotExpression() {
        if (match(TokenType.NOT)) {
            return new UnaryOpNode("not", parseNotExpression());
        }
        return parseComparison();
    }

    /**
     * Chained comparisons fold to the left: a < b < c is (a < b) < c.
     */
    private ExpressionNode parseComparison() {
        ExpressionNode left = parseAdditiveExpression();
        while (true) {
            String operator;
            if (match(TokenType.EQUAL, TokenType.NOT_EQUAL, TokenType.LESS, TokenType.LESS_EQUAL,
                    TokenType.GREATER, TokenType.GREATER_EQUAL, TokenType.IN)) {
                operator = previous().lexeme();
            } else if (match(TokenType.IS)) {
                operator = match(TokenType.NOT) ? "is not" : "is";
            } else if (check(TokenType.NOT) && checkNext(TokenType.IN)) {
                advance();
                advance();
                operator = "not in";
            } else {
                break;
            }
            ExpressionNode right = parseAdditiveExpression();
            left = new BinaryOpNode(operator, left, right);
        }
        return left;
    }

    private ExpressionNode parseAdditiveExpression() {
        ExpressionNode left = parseMultiplicativeExpression();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            String operator = previous().lexeme();
            ExpressionNode right = parseMultiplicativeExpression();
            left = new BinaryOpNode(operator, left, right);
        }
        return left;
    }

    private ExpressionNode parseMultiplicativeExpression() {
        ExpressionNode left = parseUnaryExpression();
        while (match(TokenType.ASTERISK, TokenType.SLASH, TokenType.DOUBLE_SLASH, TokenType.PERCENT)) {
            String operator = previous().lexeme();
            ExpressionNode right = parseUnaryExpression();
            left = new BinaryOpNode(operator, left, right);
        }
        return left;
    }

    private ExpressionNode parseUnaryExpression() {
        if (match(TokenType.PLUS, TokenType.MINUS)) {
            String operator = previous().lexeme();
            return new UnaryOpNode(operator, parseUnaryExpression());
        }
        return parsePowerExpression();
    }

    /**
     * '**' binds tighter than a unary operator on its left and looser than one on its right,
     * so -2 ** -1 is -(2 ** (-1)).
     */
    private ExpressionNode parsePowerExpression() {
        ExpressionNode base = parsePostfixExpression();
        if (match(TokenType.DOUBLE_ASTERISK)) {
            ExpressionNode exponent = parseUnaryExpression();
            return new BinaryOpNode("**", base, exponent);
        }
        return base;
    }

    private ExpressionNode parsePostfixExpression() {
        ExpressionNode expression = parsePrimaryExpression();
        while (true) {
            if (match(TokenType.LPAREN)) {
                expression = parseCallArguments(expression);
            } else if (match(TokenType.LBRACKET)) {
                ExpressionNode index = parseExpression();
                consume(TokenType.RBRACKET, "']' after subscript");
                expression = new SubscriptNode(expression, index);
            } else if (match(TokenType.DOT)) {
                String attribute = consume(TokenType.IDENTIFIER, "attribute name after '.'").lexeme();
                expression = new AttributeNode(expression, attribute);
            } else {
                return expression;
            }
        }
    }

    /**
     * Positional arguments come first; after the first name=value every argument must be a
     * keyword argument, and a keyword may be given only once.
     */
    private FunctionCallNode parseCallArguments(ExpressionNode callee) {
        List<ExpressionNode> arguments = new ArrayList<>();
        Map<String, ExpressionNode> keywordArguments = new LinkedHashMap<>();
        Set<String> keywordNames = new HashSet<>();
        while (!check(TokenType.RPAREN)) {
            if (check(TokenType.IDENTIFIER) && checkNext(TokenType.ASSIGN)) {
                Token nameToken = advance();
                advance(); // consume '='
                if (!keywordNames.add(nameToken.lexeme())) {
                    throw ParseException.at(nameToken, "keyword argument repeated: '" + nameToken.lexeme() + "'");
                }
                keywordArguments.put(nameToken.lexeme(), parseExpression());
            } else {
                if (!keywordNames.isEmpty()) {
                    throw ParseException.at(peek(), "positional argument follows keyword argument");
                }
                arguments.add(parseExpression());
            }
            if (!match(TokenType.COMMA)) {
                break;
            }
        }
        consume(TokenType.RPAREN, "')' after arguments");
        return new FunctionCallNode(callee, arguments, keywordArguments);
    }

    private ExpressionNode parsePrimaryExpression() {
        if (match(TokenType.INTEGER_CONST)) {
            return new IntLiteralNode(new BigInteger(previous().lexeme()));
        }
        if (match(TokenType.FLOAT_CONST)) {
            return new FloatLiteralNode(Double.parseDouble(previous().lexeme()));
        }
        if (match(TokenType.STRING_CONST)) {
            return new StringLiteralNode(previous().lexeme(), false);
        }
        if (match(TokenType.FSTRING_CONST)) {
            return new StringLiteralNode(previous().lexeme(), true);
        }
        if (match(TokenType.TRUE)) {
            return new BoolLiteralNode(true);
        }
        if (match(TokenType.FALSE)) {
            return new BoolLiteralNode(false);
        }
        if (match(TokenType.NONE)) {
            return new NoneLiteralNode();
        }
        if (match(TokenType.IDENTIFIER)) {
            return new IdentifierNode(previous().lexeme());
        }
        if (match(TokenType.LPAREN)) {
            ExpressionNode expr = parseExpression();
            consume(TokenType.RPAREN, "')' after expression");
            return expr;
        }
        if (match(TokenType.LBRACKET)) {
            return parseListLiteral();
        }
        if (match(TokenType.LBRACE)) {
            return parseDictLiteral();
        }
        throw new ParseException(peek(), "an expression");
    }

    private ListNode parseListLiteral() {
        List<ExpressionNode> elements = new ArrayList<>();
        while (!check(TokenType.RBRACKET)) {
            elements.add(parseExpression());
            if (!match(TokenType.COMMA)) {
                break;
            }
        }
        consume(TokenType.RBRACKET, "']' after list elements");
        return new ListNode(elements);
    }

    private DictNode parseDictLiteral() {
        List<DictNode.Entry> entries = new ArrayList<>();
        while (!check(TokenType.RBRACE)) {
            ExpressionNode key = parseExpression();
            consume(TokenType.COLON, "':' after dictionary key");
            ExpressionNode value = parseExpression();
            entries.add(new DictNode.Entry(key, value));
            if (!match(TokenType.COMMA)) {
                break;
            }
        }
        consume(TokenType.RBRACE, "'}' after dictionary entries");
        return new DictNode(entries);
    }

    // --- 辅助方法 ---

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String expected) {
        if (check(type)) return advance();
        throw new ParseException(peek(), expected);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    private boolean checkNext(TokenType type) {
        if (position + 1 >= tokens.size()) return false;
        return tokens.get(position + 1).type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) position++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.END;
    }

    private Token peek() {
        return tokens.get(position);
    }

    private Token previous() {
        return tokens.get(position - 1);
    }
}
