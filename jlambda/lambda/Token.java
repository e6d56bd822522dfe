package lambda;

import java.util.Objects;

public class Token {
    public enum Type {
        // single character
        LAMBDA, DOT, LEFT_BRACE, RIGHT_BRACE,
        BRA, DELIM, KET,

        // identifiers
        IDENT
    }

    final Type type;
    final String lexeme;
    final int line;
    final int column;

    Token(Type type, String lexeme, int line, int column) {
        this.type = type;
        this.lexeme = lexeme;
        this.line = line;
        this.column = column;
    }

    // spans are for diagnostics only and take no part in equality
    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Token))
            return false;
        Token other = (Token) o;
        return type == other.type && lexeme.equals(other.lexeme);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, lexeme);
    }

    public String toString() {
        return type == Type.IDENT ? type + " " + lexeme : type.toString();
    }
}
