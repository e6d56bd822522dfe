package lambda;

import java.util.List;

/**
 * Renders a term for reading, e.g. {@code λx. λy. x(y)}. Free variables are
 * prefixed with {@code $}. The output is not meant to be parsed again.
 * <p>
 * Parentheses follow a length heuristic: a lambda body or the function side
 * of an application is wrapped only when its text is longer than the
 * threshold. The argument of an application is always wrapped.
 */
public class PrettyPrinter implements Term.Visitor<String> {
    public static final int DEFAULT_THRESHOLD = 10;

    private final int threshold;
    private Environment env;

    public PrettyPrinter() {
        this(DEFAULT_THRESHOLD);
    }

    public PrettyPrinter(int threshold) {
        if (threshold < 0)
            throw new IllegalArgumentException("negative threshold: " + threshold);
        this.threshold = threshold;
    }

    public String format(Term term, List<String> freeVars) {
        env = new Environment(freeVars);
        return print(term);
    }

    private String print(Term term) {
        return term.accept(this);
    }

    @Override
    public String visitVariableTerm(Term.Variable term) {
        String name = env.nameOf(term);
        return term.isFree() ? "$" + name : name;
    }

    @Override
    public String visitLambdaTerm(Term.Lambda term) {
        env.push(term.param);
        String body;
        try {
            body = print(term.body);
        } finally {
            env.pop();
        }
        return "λ" + term.param + ". " + wrapIfLong(body);
    }

    @Override
    public String visitApplicationTerm(Term.Application term) {
        String function = print(term.function);
        String argument = print(term.argument);
        return wrapIfLong(function) + parenthesize(argument);
    }

    private String wrapIfLong(String s) {
        if (s.codePointCount(0, s.length()) > threshold)
            return parenthesize(s);
        return s;
    }

    static String parenthesize(String s) {
        return isParenthesized(s) ? s : "(" + s + ")";
    }

    // true when the opening paren is closed by the last character
    static boolean isParenthesized(String s) {
        if (s.isEmpty() || s.charAt(0) != '(')
            return false;
        int depth = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '(')
                depth++;
            else if (c == ')')
                depth--;
            if (depth == 0)
                return i == s.length() - 1;
        }
        return false;
    }
}
