package org.csu.pyast.cli;

import org.csu.pyast.common.exception.LexerException;
import org.csu.pyast.common.exception.ParseException;
import org.csu.pyast.compiler.lexer.Lexer;
import org.csu.pyast.compiler.lexer.Token;
import org.csu.pyast.compiler.parser.Parser;
import org.csu.pyast.compiler.parser.ast.AstPrinter;
import org.csu.pyast.compiler.parser.ast.StatementNode;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;

/**
 * @description: 命令行入口, 读取一个源文件并打印它的抽象语法树
 *
 * Usage: AstDumper &lt;source-file&gt;. Exit status 0 on success, 1 on any error, 2 on bad usage.
 */
public class AstDumper {

    public static final int EXIT_OK = 0;
    public static final int EXIT_ERROR = 1;
    public static final int EXIT_USAGE = 2;

    private static final String SEPARATOR = "-".repeat(50);

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Runs the whole pipeline: read, tokenize, parse, print.
     * @return the process exit status
     */
    public static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length != 1) {
            err.println("Usage: AstDumper <source-file>");
            return EXIT_USAGE;
        }
        String fileName = args[0];

        String source;
        try {
            source = Files.readString(Path.of(fileName), StandardCharsets.UTF_8);
        } catch (IOException | InvalidPathException e) {
            err.println("Error: Could not open file " + fileName);
            return EXIT_ERROR;
        }

        try {
            List<Token> tokens = new Lexer(source).tokenize();
            List<StatementNode> forest = new Parser(tokens).parse();

            out.println("Abstract Syntax Tree for " + fileName + ":");
            out.println(SEPARATOR);
            out.print(AstPrinter.print(forest));
            return EXIT_OK;
        } catch (LexerException | ParseException e) {
            err.println(e.getMessage());
            return EXIT_ERROR;
        } catch (RuntimeException e) {
            err.println("Internal Error: " + e.getMessage());
            return EXIT_ERROR;
        } catch (StackOverflowError e) {
            // 递归下降的深度受线程栈限制
            err.println("Internal Error: input is nested too deeply to parse");
            return EXIT_ERROR;
        }
    }
}
