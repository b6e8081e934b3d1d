package org.csu.pyast.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 命令行入口的集成测试: 读取文件, 打印 AST, 返回退出码
 */
public class AstDumperTest {

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream outBuffer;
    private ByteArrayOutputStream errBuffer;

    @BeforeEach
    void setUp() {
        outBuffer = new ByteArrayOutputStream();
        errBuffer = new ByteArrayOutputStream();
    }

    private int run(String... args) {
        PrintStream out = new PrintStream(outBuffer, true, StandardCharsets.UTF_8);
        PrintStream err = new PrintStream(errBuffer, true, StandardCharsets.UTF_8);
        int status = AstDumper.run(args, out, err);
        System.out.println("stdout:\n" + stdout());
        System.out.println("stderr:\n" + stderr());
        return status;
    }

    private String stdout() {
        return outBuffer.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return errBuffer.toString(StandardCharsets.UTF_8);
    }

    private Path writeSource(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    void testSuccessfulRun() throws IOException {
        System.out.println("--- Running test: testSuccessfulRun ---");
        Path file = writeSource("ok.py", "import sys\nx = 1 + 2\n");

        assertEquals(AstDumper.EXIT_OK, run(file.toString()));

        String[] lines = stdout().split("\\R");
        assertEquals("Abstract Syntax Tree for " + file + ":", lines[0]);
        assertEquals("-".repeat(50), lines[1]);
        assertEquals("Import(sys)", lines[2]);
        assertEquals("Assignment", lines[3]);
        assertEquals("      IntLiteral(2)", lines[lines.length - 1]);
        assertTrue(stderr().isEmpty());
    }

    @Test
    void testEmptyFilePrintsOnlyHeader() throws IOException {
        System.out.println("--- Running test: testEmptyFilePrintsOnlyHeader ---");
        Path file = writeSource("empty.py", "");
        assertEquals(AstDumper.EXIT_OK, run(file.toString()));
        assertEquals(2, stdout().split("\\R").length);
    }

    @Test
    void testMissingFile() {
        System.out.println("--- Running test: testMissingFile ---");
        Path missing = tempDir.resolve("missing.py");
        assertEquals(AstDumper.EXIT_ERROR, run(missing.toString()));
        assertTrue(stderr().contains("Error: Could not open file " + missing));
        assertTrue(stdout().isEmpty());
    }

    @Test
    void testSyntaxError() throws IOException {
        System.out.println("--- Running test: testSyntaxError ---");
        Path file = writeSource("bad_syntax.py", "if x\n    pass\n");
        assertEquals(AstDumper.EXIT_ERROR, run(file.toString()));
        assertTrue(stderr().startsWith("Syntax Error at line 1, column 5: Expected ':'"), stderr());
        assertTrue(stdout().isEmpty());
    }

    @Test
    void testLexicalError() throws IOException {
        System.out.println("--- Running test: testLexicalError ---");
        Path file = writeSource("bad_indent.py", "if a:\n  if b:\n      x = 1\n   y = 2\n");
        assertEquals(AstDumper.EXIT_ERROR, run(file.toString()));
        assertTrue(stderr().startsWith("Lexical Error at line 4"), stderr());
    }

    @Test
    void testDeeplyNestedInputIsAnInternalError() throws IOException {
        System.out.println("--- Running test: testDeeplyNestedInputIsAnInternalError ---");
        int depth = 50000;
        Path file = writeSource("deep.py", "x = " + "(".repeat(depth) + "1" + ")".repeat(depth) + "\n");

        PrintStream out = new PrintStream(outBuffer, true, StandardCharsets.UTF_8);
        PrintStream err = new PrintStream(errBuffer, true, StandardCharsets.UTF_8);
        assertEquals(AstDumper.EXIT_ERROR, AstDumper.run(new String[]{file.toString()}, out, err));
        assertTrue(stderr().startsWith("Internal Error:"), stderr());
        assertTrue(stdout().isEmpty());
    }

    @Test
    void testUsage() {
        System.out.println("--- Running test: testUsage ---");
        assertEquals(AstDumper.EXIT_USAGE, run());
        assertTrue(stderr().startsWith("Usage:"));
        assertEquals(AstDumper.EXIT_USAGE, run("a.py", "b.py"));
    }
}
