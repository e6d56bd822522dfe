package lambda;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;

public class Lambda {
    private static final String USAGE = "usage: jlambda [-a] [-s] [-t threshold] [script]";

    private static boolean hadError = false;
    private static String currFilename = "";
    private static boolean printAst = false;
    private static boolean printSource = false;
    private static int threshold = PrettyPrinter.DEFAULT_THRESHOLD;

    public static void main(String[] args) throws IOException {
        String script = null;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
            case "-a": printAst = true;    break;
            case "-s": printSource = true; break;
            case "-t":
                if (i + 1 >= args.length)
                    usage();
                threshold = parseThreshold(args[++i]);
                break;
            default:
                if (script != null || args[i].startsWith("-"))
                    usage();
                script = args[i];
                break;
            }
        }
        if (script != null)
            runFile(script);
        else
            runPrompt();
    }

    private static void usage() {
        System.out.println(USAGE);
        System.exit(64);
    }

    private static int parseThreshold(String arg) {
        int n;
        try {
            n = Integer.parseInt(arg);
        } catch (NumberFormatException e) {
            n = -1;
        }
        if (n < 0) {
            System.err.println("invalid threshold '" + arg + "'");
            usage();
        }
        return n;
    }

    private static void runFile(String path) throws IOException {
        currFilename = path;
        byte[] bytes = Files.readAllBytes(Paths.get(path));
        run(new String(bytes, StandardCharsets.UTF_8), System.out);
        if (hadError)
            System.exit(65);
    }

    private static void runPrompt() throws IOException {
        currFilename = "stdin";
        var input = new InputStreamReader(System.in, StandardCharsets.UTF_8);
        var reader = new BufferedReader(input);

        for (;;) {
            System.out.print(">>> ");
            String line = reader.readLine();
            if (line == null)
                break;
            if (line.isBlank())
                continue;
            run(line, System.out);
            hadError = false;
        }
    }

    // returns false when the source could not be parsed
    static boolean run(String source, PrintStream out) {
        try {
            List<Token> tokens = new Scanner(source).scanTokens();
            Parser.Result result = new Parser(tokens).parse();
            if (printAst)
                out.println(new ASTPrinter().print(result.term));
            if (printSource)
                out.println(new SourcePrinter().print(result.term, result.freeVars));
            out.println(new PrettyPrinter(threshold).format(result.term, result.freeVars));
            return true;
        } catch (LexError error) {
            report(error.line, error.column, "", error.getMessage());
        } catch (ParseError error) {
            if (error.token == null)
                report(-1, -1, error.where(), error.getMessage());
            else
                report(error.token.line, error.token.column, error.where(), error.getMessage());
        }
        hadError = true;
        return false;
    }

    private static void report(int line, int column, String where, String message) {
        System.err.print(currFilename);
        if (line > 0)
            System.err.print(":" + line + ":" + column);
        System.err.print(": error: ");
        if (!where.isEmpty())
            System.err.print(where + ": ");
        System.err.println(message);
    }
}
