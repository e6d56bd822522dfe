package lambda;

import java.util.ArrayList;
import java.util.List;
import java.util.Stack;
import static lambda.Token.Type.*;

/**
 * Recursive descent parser for
 * <pre>
 * term        := IDENT | lambda | application
 * lambda      := '\' IDENT '.' '{' term '}'
 * application := '&lt;' term '|' term '&gt;'
 * </pre>
 * Names are resolved while parsing: bound variables become de Bruijn
 * indices, unbound ones get a slot in the free variable table. A name keeps
 * the same slot for the whole parse.
 */
public class Parser {
    public static class Result {
        public final Term term;
        public final List<String> freeVars;

        Result(Term term, List<String> freeVars) {
            this.term = term;
            this.freeVars = freeVars;
        }
    }

    private final List<Token> tokens;
    private final Stack<String> binders = new Stack<>();
    private final List<String> freeVars = new ArrayList<>();
    private int curr = 0;

    public Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    public Result parse() {
        Term term = term();
        if (!isAtEnd())
            throw error(peek(), "expected end of input");
        return new Result(term, freeVars);
    }

    private Term term() {
        if (match(IDENT))  return variable(previous());
        if (match(LAMBDA)) return lambda();
        if (match(BRA))    return application();
        throw error(peek(), "unexpected token");
    }

    private Term variable(Token name) {
        for (int i = binders.size() - 1; i >= 0; i--) {
            if (binders.get(i).equals(name.lexeme))
                return new Term.Variable(binders.size() - i);
        }
        int slot = freeVars.indexOf(name.lexeme);
        if (slot == -1) {
            freeVars.add(name.lexeme);
            slot = freeVars.size() - 1;
        }
        return new Term.Variable(-(slot + 1));
    }

    private Term lambda() {
        Token param = consume(IDENT, "expected parameter name after '\\'");
        consume(DOT, "expected '.' after parameter in lambda");
        consume(LEFT_BRACE, "expected '{' after '.' in lambda");
        binders.push(param.lexeme);
        Term body;
        try {
            body = term();
        } finally {
            binders.pop();
        }
        consume(RIGHT_BRACE, "expected '}' after lambda body");
        return new Term.Lambda(param.lexeme, body);
    }

    private Term application() {
        Term function = term();
        consume(DELIM, "expected '|' after function in application");
        Term argument = term();
        consume(KET, "expected '>' after argument in application");
        return new Term.Application(function, argument);
    }

    private boolean match(Token.Type type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private Token consume(Token.Type type, String message) {
        if (check(type))
            return advance();
        throw error(peek(), message);
    }

    private boolean check(Token.Type type) {
        if (isAtEnd())
            return false;
        return peek().type == type;
    }

    private ParseError error(Token token, String message) {
        return new ParseError(token, message);
    }

    private Token advance() {
        if (!isAtEnd())
            curr++;
        return previous();
    }

    private boolean isAtEnd() {
        return curr >= tokens.size();
    }

    // null once the input is exhausted
    private Token peek() {
        return isAtEnd() ? null : tokens.get(curr);
    }

    private Token previous() {
        return tokens.get(curr - 1);
    }
}
