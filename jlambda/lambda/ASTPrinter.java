package lambda;

class ASTPrinter implements Term.Visitor<String> {
    public String print(Term term) { return term.accept(this); }

    @Override public String visitVariableTerm(Term.Variable term)       { return "Variable(" + term.index + ")"; }
    @Override public String visitLambdaTerm(Term.Lambda term)           { return "Lambda(\"" + term.param + "\", " + print(term.body) + ")"; }
    @Override public String visitApplicationTerm(Term.Application term) { return "Application(" + print(term.function) + ", " + print(term.argument) + ")"; }
}
