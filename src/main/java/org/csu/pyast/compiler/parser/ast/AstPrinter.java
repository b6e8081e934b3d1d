package org.csu.pyast.compiler.parser.ast;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * @description: 将 AST 格式化为带缩进的文本, 用于调试输出
 *
 * Every node prints a tag line at the current indentation, then labelled child groups at
 * indentation + 2 whose members sit at indentation + 4. The output is one-way: it is not meant
 * to be parsed back.
 */
public final class AstPrinter {

    private static final int STEP = 2;

    private AstPrinter() {
    }

    /**
     * 格式化整个模块 (顶层语句列表)
     */
    public static String print(List<? extends StatementNode> forest) {
        StringBuilder sb = new StringBuilder();
        for (StatementNode node : forest) {
            render(node, 0, sb);
        }
        return sb.toString();
    }

    public static String print(AstNode node, int indent) {
        StringBuilder sb = new StringBuilder();
        render(node, indent, sb);
        return sb.toString();
    }

    // 分派覆盖 sealed 层次中的全部变体 (由 AstPrinterTest.testEveryNodeVariantRenders 检查),
    // 末尾的 IllegalStateException 分支只在新增变体而未补充渲染时可达
    private static void render(AstNode node, int indent, StringBuilder sb) {
        if (node instanceof ParameterNode parameter) {
            renderParameter(parameter, indent, sb);
        } else if (node instanceof ExpressionNode expression) {
            renderExpression(expression, indent, sb);
        } else {
            renderStatement((StatementNode) node, indent, sb);
        }
    }

    private static void renderStatement(StatementNode node, int indent, StringBuilder sb) {
        if (node instanceof AssignmentNode assignment) {
            line(sb, indent, "Assignment");
            child(sb, indent, "Target:", assignment.target());
            child(sb, indent, "Value:", assignment.value());
        } else if (node instanceof FunctionDefNode function) {
            line(sb, indent, "FunctionDef(" + function.name() + ")");
            group(sb, indent, "Parameters:", function.parameters());
            group(sb, indent, "Body:", function.body());
        } else if (node instanceof ClassDefNode classDef) {
            line(sb, indent, "ClassDef(" + classDef.name() + ")");
            if (!classDef.bases().isEmpty()) {
                group(sb, indent, "Bases:", classDef.bases());
            }
            group(sb, indent, "Body:", classDef.body());
        } else if (node instanceof ReturnNode returnNode) {
            line(sb, indent, "Return");
            if (returnNode.value() != null) {
                render(returnNode.value(), indent + STEP, sb);
            }
        } else if (node instanceof ImportNode importNode) {
            line(sb, indent, "Import(" + withAlias(importNode.module(), importNode.alias()) + ")");
        } else if (node instanceof FromImportNode fromImport) {
            line(sb, indent, "FromImport(" + fromImport.module() + ")");
            line(sb, indent + STEP, "Names:");
            for (FromImportNode.ImportedName name : fromImport.names()) {
                line(sb, indent + 2 * STEP, withAlias(name.name(), name.alias()));
            }
        } else if (node instanceof IfNode ifNode) {
            line(sb, indent, "If");
            child(sb, indent, "Condition:", ifNode.condition());
            group(sb, indent, "Then:", ifNode.thenBody());
            if (!ifNode.elseBody().isEmpty()) {
                group(sb, indent, "Else:", ifNode.elseBody());
            }
        } else if (node instanceof WhileNode whileNode) {
            line(sb, indent, "While");
            child(sb, indent, "Condition:", whileNode.condition());
            group(sb, indent, "Body:", whileNode.body());
        } else if (node instanceof ForNode forNode) {
            line(sb, indent, "For");
            child(sb, indent, "Target:", forNode.target());
            child(sb, indent, "Iterable:", forNode.iterable());
            group(sb, indent, "Body:", forNode.body());
        } else if (node instanceof PassNode) {
            line(sb, indent, "Pass");
        } else if (node instanceof BreakNode) {
            line(sb, indent, "Break");
        } else if (node instanceof ContinueNode) {
            line(sb, indent, "Continue");
        } else {
            throw new IllegalStateException("Unhandled statement node: " + node);
        }
    }

    private static void renderExpression(ExpressionNode node, int indent, StringBuilder sb) {
        if (node instanceof IntLiteralNode literal) {
            line(sb, indent, "IntLiteral(" + literal.value() + ")");
        } else if (node instanceof FloatLiteralNode literal) {
            line(sb, indent, "FloatLiteral(" + formatFloat(literal.value()) + ")");
        } else if (node instanceof StringLiteralNode literal) {
            String tag = literal.interpolated() ? "FString" : "StringLiteral";
            line(sb, indent, tag + "(\"" + literal.text() + "\")");
        } else if (node instanceof BoolLiteralNode literal) {
            line(sb, indent, "BoolLiteral(" + (literal.value() ? "True" : "False") + ")");
        } else if (node instanceof NoneLiteralNode) {
            line(sb, indent, "None");
        } else if (node instanceof IdentifierNode identifier) {
            line(sb, indent, "Identifier(" + identifier.name() + ")");
        } else if (node instanceof BinaryOpNode binary) {
            line(sb, indent, "BinaryOp(" + binary.operator() + ")");
            render(binary.left(), indent + STEP, sb);
            render(binary.right(), indent + STEP, sb);
        } else if (node instanceof UnaryOpNode unary) {
            line(sb, indent, "UnaryOp(" + unary.operator() + ")");
            render(unary.operand(), indent + STEP, sb);
        } else if (node instanceof FunctionCallNode call) {
            line(sb, indent, "FunctionCall");
            child(sb, indent, "Callable:", call.callee());
            if (!call.arguments().isEmpty()) {
                group(sb, indent, "Arguments:", call.arguments());
            }
            if (!call.keywordArguments().isEmpty()) {
                line(sb, indent + STEP, "Keyword Arguments:");
                for (Map.Entry<String, ExpressionNode> entry : call.keywordArguments().entrySet()) {
                    line(sb, indent + 2 * STEP, entry.getKey() + ":");
                    render(entry.getValue(), indent + 3 * STEP, sb);
                }
            }
        } else if (node instanceof AttributeNode attribute) {
            line(sb, indent, "Attribute(" + attribute.attribute() + ")");
            child(sb, indent, "Value:", attribute.value());
        } else if (node instanceof SubscriptNode subscript) {
            line(sb, indent, "Subscript");
            child(sb, indent, "Value:", subscript.value());
            child(sb, indent, "Index:", subscript.index());
        } else if (node instanceof ListNode list) {
            line(sb, indent, "List");
            if (!list.elements().isEmpty()) {
                group(sb, indent, "Elements:", list.elements());
            }
        } else if (node instanceof DictNode dict) {
            line(sb, indent, "Dict");
            if (!dict.entries().isEmpty()) {
                line(sb, indent + STEP, "Items:");
                for (DictNode.Entry entry : dict.entries()) {
                    line(sb, indent + 2 * STEP, "Key:");
                    render(entry.key(), indent + 3 * STEP, sb);
                    line(sb, indent + 2 * STEP, "Value:");
                    render(entry.value(), indent + 3 * STEP, sb);
                }
            }
        } else {
            throw new IllegalStateException("Unhandled expression node: " + node);
        }
    }

    private static void renderParameter(ParameterNode parameter, int indent, StringBuilder sb) {
        String info = parameter.keywordOnly() ? parameter.name() + ", keyword-only" : parameter.name();
        line(sb, indent, "Parameter(" + info + ")");
        if (parameter.defaultValue() != null) {
            child(sb, indent, "Default Value:", parameter.defaultValue());
        }
    }

    // --- 辅助方法 ---

    private static void line(StringBuilder sb, int indent, String text) {
        sb.append(" ".repeat(indent)).append(text).append('\n');
    }

    private static void child(StringBuilder sb, int indent, String label, AstNode node) {
        line(sb, indent + STEP, label);
        render(node, indent + 2 * STEP, sb);
    }

    private static void group(StringBuilder sb, int indent, String label, List<? extends AstNode> nodes) {
        line(sb, indent + STEP, label);
        for (AstNode node : nodes) {
            render(node, indent + 2 * STEP, sb);
        }
    }

    private static String withAlias(String name, String alias) {
        return alias == null ? name : name + " as " + alias;
    }

    /**
     * Shortest round-trip digits, positional notation between 1e-4 and 1e16 and scientific
     * notation ("1e+16", "1.5e-05") outside it.
     */
    static String formatFloat(double value) {
        if (Double.isNaN(value)) {
            return "nan";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        BigDecimal decimal = new BigDecimal(Double.toString(value)).stripTrailingZeros();
        double magnitude = Math.abs(value);
        if (magnitude == 0 || (magnitude >= 1e-4 && magnitude < 1e16)) {
            String plain = decimal.toPlainString();
            return plain.contains(".") ? plain : plain + ".0";
        }
        int exponent = decimal.precision() - decimal.scale() - 1;
        String mantissa = decimal.movePointLeft(exponent).toPlainString();
        return String.format("%se%s%02d", mantissa, exponent < 0 ? "-" : "+", Math.abs(exponent));
    }
}
