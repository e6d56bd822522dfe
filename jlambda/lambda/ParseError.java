package lambda;

public class ParseError extends RuntimeException {
    // null when the input ran out
    final Token token;

    ParseError(Token token, String message) {
        super(message);
        this.token = token;
    }

    String where() {
        return token == null ? "at end" : "at '" + token.lexeme + "'";
    }
}
