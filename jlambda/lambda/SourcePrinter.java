package lambda;

import java.util.List;

/**
 * Renders a term back into the input syntax, {@code \x.{body}} and
 * {@code <f|a>}. Parsing the output of a term produced by {@link Parser}
 * gives back an equal term and the same free variable table.
 */
public class SourcePrinter implements Term.Visitor<String> {
    private Environment env;

    public String print(Term term, List<String> freeVars) {
        env = new Environment(freeVars);
        return print(term);
    }

    private String print(Term term) {
        return term.accept(this);
    }

    @Override
    public String visitVariableTerm(Term.Variable term) {
        return env.nameOf(term);
    }

    @Override
    public String visitLambdaTerm(Term.Lambda term) {
        env.push(term.param);
        try {
            return "\\" + term.param + ".{" + print(term.body) + "}";
        } finally {
            env.pop();
        }
    }

    @Override
    public String visitApplicationTerm(Term.Application term) {
        return "<" + print(term.function) + "|" + print(term.argument) + ">";
    }
}
