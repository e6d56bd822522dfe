package lambda;

public class InvalidTermError extends RuntimeException {
    final int index;

    InvalidTermError(int index, String message) {
        super(message);
        this.index = index;
    }
}
