package lambda;

import java.util.ArrayList;
import java.util.List;
import static lambda.Token.Type.*;

public class Scanner {
    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0, curr = 0, line = 1, lineStart = 0;

    public Scanner(String source) {
        this.source = source;
    }

    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = curr;
            scanToken();
        }
        return tokens;
    }

    private boolean isAtEnd() {
        return curr >= source.length();
    }

    private void scanToken() {
        int c = advance();
        switch (c) {
        case '\\': addToken(LAMBDA);      break;
        case '.':  addToken(DOT);         break;
        case '{':  addToken(LEFT_BRACE);  break;
        case '}':  addToken(RIGHT_BRACE); break;
        case '<':  addToken(BRA);         break;
        case '|':  addToken(DELIM);       break;
        case '>':  addToken(KET);         break;

        case '\n':
            line++;
            lineStart = curr;
            break;

        default:
            if (isAlpha(c))
                ident();
            else if (!isWhitespace(c))
                throw new LexError(c, line, column(start));
            break;
        }
    }

    private int advance() {
        int c = source.codePointAt(curr);
        curr += Character.charCount(c);
        return c;
    }

    private int peek() {
        if (isAtEnd())
            return '\0';
        return source.codePointAt(curr);
    }

    private void addToken(Token.Type type) {
        String text = source.substring(start, curr);
        tokens.add(new Token(type, text, line, column(start)));
    }

    private int column(int offset) {
        return source.codePointCount(lineStart, offset) + 1;
    }

    private static boolean isWhitespace(int c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c);
    }

    private static boolean isAlpha(int c) {
        return (c >= 'a' && c <= 'z')
            || (c >= 'A' && c <= 'Z')
            || c == '_';
    }

    private static boolean isAlphaNumeric(int c) {
        return isAlpha(c) || (c >= '0' && c <= '9');
    }

    private void ident() {
        while (isAlphaNumeric(peek()))
            advance();
        addToken(IDENT);
    }
}
