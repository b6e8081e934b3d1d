package org.csu.pyast.compiler.parser.ast;

import org.csu.pyast.compiler.lexer.Lexer;
import org.csu.pyast.compiler.parser.Parser;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @description: AstPrinter 的单元测试, 检查格式化输出的每一行
 */
public class AstPrinterTest {

    private static String lines(String... lines) {
        return String.join("\n", lines) + "\n";
    }

    private static String render(String source) {
        List<StatementNode> forest = new Parser(new Lexer(source).tokenize()).parse();
        String text = AstPrinter.print(forest);
        System.out.println("Input source:\n" + source + "\nRendered:\n" + text);
        return text;
    }

    @Test
    void testAssignment() {
        System.out.println("--- Running test: testAssignment ---");
        assertEquals(lines(
                "Assignment",
                "  Target:",
                "    Identifier(x)",
                "  Value:",
                "    BinaryOp(+)",
                "      IntLiteral(1)",
                "      IntLiteral(2)"), render("x = 1 + 2\n"));
    }

    @Test
    void testFunctionDefinition() {
        System.out.println("--- Running test: testFunctionDefinition ---");
        assertEquals(lines(
                "FunctionDef(f)",
                "  Parameters:",
                "    Parameter(a)",
                "    Parameter(b)",
                "      Default Value:",
                "        IntLiteral(2)",
                "    Parameter(c, keyword-only)",
                "  Body:",
                "    Return",
                "      Identifier(a)"), render("def f(a, b=2, *, c):\n    return a\n"));
    }

    @Test
    void testDictionary() {
        System.out.println("--- Running test: testDictionary ---");
        assertEquals(lines(
                "Assignment",
                "  Target:",
                "    Identifier(d)",
                "  Value:",
                "    Dict",
                "      Items:",
                "        Key:",
                "          IntLiteral(1)",
                "        Value:",
                "          StringLiteral(\"a\")",
                "        Key:",
                "          IntLiteral(2)",
                "        Value:",
                "          StringLiteral(\"b\")"), render("d = {1: \"a\", 2: \"b\"}\n"));
    }

    @Test
    void testImports() {
        System.out.println("--- Running test: testImports ---");
        assertEquals(lines(
                "Import(numpy as np)",
                "Import(sys)",
                "FromImport(math)",
                "  Names:",
                "    sqrt as s",
                "    pi"), render("import numpy as np\nimport sys\nfrom math import sqrt as s, pi\n"));
    }

    @Test
    void testFunctionCall() {
        System.out.println("--- Running test: testFunctionCall ---");
        assertEquals(lines(
                "FunctionCall",
                "  Callable:",
                "    Attribute(log)",
                "      Value:",
                "        Identifier(logger)",
                "  Arguments:",
                "    FString(\"{x}\")",
                "    FloatLiteral(0.5)",
                "  Keyword Arguments:",
                "    sep:",
                "      StringLiteral(\", \")",
                "    end:",
                "      None"), render("logger.log(f\"{x}\", .5, sep=\", \", end=None)\n"));
        assertEquals(lines(
                "FunctionCall",
                "  Callable:",
                "    Identifier(run)"), render("run()\n"));
    }

    @Test
    void testIfElifElse() {
        System.out.println("--- Running test: testIfElifElse ---");
        String source = "if not a:\n    pass\nelif b is None:\n    break\nelse:\n    continue\n";
        assertEquals(lines(
                "If",
                "  Condition:",
                "    UnaryOp(not)",
                "      Identifier(a)",
                "  Then:",
                "    Pass",
                "  Else:",
                "    If",
                "      Condition:",
                "        BinaryOp(is)",
                "          Identifier(b)",
                "          None",
                "      Then:",
                "        Break",
                "      Else:",
                "        Continue"), render(source));
    }

    @Test
    void testLoopsAndContainers() {
        System.out.println("--- Running test: testLoopsAndContainers ---");
        String source = "for item in [1, True]:\n    items[0] = item\nwhile x:\n    x = []\n";
        assertEquals(lines(
                "For",
                "  Target:",
                "    Identifier(item)",
                "  Iterable:",
                "    List",
                "      Elements:",
                "        IntLiteral(1)",
                "        BoolLiteral(True)",
                "  Body:",
                "    Assignment",
                "      Target:",
                "        Subscript",
                "          Value:",
                "            Identifier(items)",
                "          Index:",
                "            IntLiteral(0)",
                "      Value:",
                "        Identifier(item)",
                "While",
                "  Condition:",
                "    Identifier(x)",
                "  Body:",
                "    Assignment",
                "      Target:",
                "        Identifier(x)",
                "      Value:",
                "        List"), render(source));
    }

    @Test
    void testClassDefinition() {
        System.out.println("--- Running test: testClassDefinition ---");
        assertEquals(lines(
                "ClassDef(Point)",
                "  Bases:",
                "    Identifier(Base)",
                "  Body:",
                "    Assignment",
                "      Target:",
                "        Identifier(dims)",
                "      Value:",
                "        Dict",
                "ClassDef(Empty)",
                "  Body:",
                "    Pass"), render("class Point(Base):\n    dims = {}\nclass Empty:\n    pass\n"));
    }

    @Test
    void testStartingIndentation() {
        System.out.println("--- Running test: testStartingIndentation ---");
        AstNode node = new ReturnNode(new UnaryOpNode("-", new IntLiteralNode(3)));
        assertEquals(lines(
                "    Return",
                "      UnaryOp(-)",
                "        IntLiteral(3)"), AstPrinter.print(node, 4));
        assertEquals(lines("Return"), AstPrinter.print(new ReturnNode(null), 0));
    }

    @Test
    void testRenderingIsDeterministic() {
        System.out.println("--- Running test: testRenderingIsDeterministic ---");
        Map<String, ExpressionNode> keywords = new LinkedHashMap<>();
        keywords.put("b", new IntLiteralNode(2));
        keywords.put("a", new IntLiteralNode(1));
        List<StatementNode> forest = List.of(
                new FunctionCallNode(new IdentifierNode("f"), List.of(), keywords),
                new ImportNode("os", null));
        String first = AstPrinter.print(forest);
        String second = AstPrinter.print(forest);
        assertEquals(first, second);
        assertTrue(first.indexOf("    b:") < first.indexOf("    a:"));
    }

    @Test
    void testFloatFormatting() {
        System.out.println("--- Running test: testFloatFormatting ---");
        assertEquals("1.5", AstPrinter.formatFloat(1.5));
        assertEquals("100.0", AstPrinter.formatFloat(100.0));
        assertEquals("0.0", AstPrinter.formatFloat(0.0));
        assertEquals("0.0001", AstPrinter.formatFloat(0.0001));
        assertEquals("10000000000.0", AstPrinter.formatFloat(1e10));
        assertEquals("1e+16", AstPrinter.formatFloat(1e16));
        assertEquals("1.5e-05", AstPrinter.formatFloat(1.5e-5));
        assertEquals("-2.5", AstPrinter.formatFloat(-2.5));
    }

    /**
     * Exhaustiveness guard for {@link AstPrinter}: walks the sealed hierarchy and requires a
     * rendered sample for every concrete node type, so a new variant without a rendering branch
     * fails here instead of reaching the printer's fallback at runtime.
     */
    @Test
    void testEveryNodeVariantRenders() {
        System.out.println("--- Running test: testEveryNodeVariantRenders ---");
        IdentifierNode x = new IdentifierNode("x");
        List<AstNode> samples = List.of(
                new IntLiteralNode(1),
                new FloatLiteralNode(1.0),
                new StringLiteralNode("s", false),
                new BoolLiteralNode(false),
                new NoneLiteralNode(),
                x,
                new BinaryOpNode("+", x, x),
                new UnaryOpNode("-", x),
                new FunctionCallNode(x, List.of(x), Map.of("k", x)),
                new AttributeNode(x, "y"),
                new ListNode(List.of(x)),
                new DictNode(List.of(new DictNode.Entry(x, x))),
                new SubscriptNode(x, x),
                new AssignmentNode(x, x),
                new ParameterNode("p", x, true),
                new FunctionDefNode("f", List.of(new ParameterNode("p", null, false)), List.of(new PassNode())),
                new ClassDefNode("C", List.of(x), List.of(new PassNode())),
                new ReturnNode(x),
                new ImportNode("m", "n"),
                new FromImportNode("m", List.of(new FromImportNode.ImportedName("a", null))),
                new IfNode(x, List.of(new PassNode()), List.of(new PassNode())),
                new WhileNode(x, List.of(new BreakNode())),
                new ForNode(x, x, List.of(new ContinueNode())),
                new PassNode(),
                new BreakNode(),
                new ContinueNode());

        Set<Class<?>> covered = new HashSet<>();
        for (AstNode node : samples) {
            String text = AstPrinter.print(node, 0);
            assertFalse(text.isBlank(), node.toString());
            covered.add(node.getClass());
        }

        // 遍历 sealed 层次结构, 确认每个具体节点类型都有样例
        Deque<Class<?>> pending = new ArrayDeque<>(List.of(AstNode.class));
        while (!pending.isEmpty()) {
            Class<?> type = pending.pop();
            if (type.isSealed()) {
                pending.addAll(List.of(type.getPermittedSubclasses()));
            } else {
                assertTrue(covered.contains(type), "no rendering sample for " + type.getSimpleName());
            }
        }
    }

    @Test
    void testNodesAreImmutable() {
        System.out.println("--- Running test: testNodesAreImmutable ---");
        ListNode list = new ListNode(new java.util.ArrayList<>(List.of(new IntLiteralNode(1))));
        assertThrows(UnsupportedOperationException.class, () -> list.elements().add(new IntLiteralNode(2)));
        FunctionCallNode call = new FunctionCallNode(new IdentifierNode("f"), List.of(), new LinkedHashMap<>());
        assertThrows(UnsupportedOperationException.class,
                () -> call.keywordArguments().put("k", new IntLiteralNode(1)));
    }
}
