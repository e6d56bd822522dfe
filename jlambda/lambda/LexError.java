package lambda;

public class LexError extends RuntimeException {
    final int character;
    final int line;
    final int column;

    LexError(int character, int line, int column) {
        super("unexpected character '" + Character.toString(character) + "'");
        this.character = character;
        this.line = line;
        this.column = column;
    }
}
