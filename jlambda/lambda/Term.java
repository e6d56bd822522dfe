package lambda;

import java.util.Objects;

/**
 * A lambda term in de Bruijn form. Bound variables count enclosing lambdas
 * outward starting at 1, free variables are stored as {@code -(slot + 1)}
 * into the free variable table produced alongside the term.
 * <p>
 * Equality is structural and ignores parameter names, so alpha-equivalent
 * terms are equal.
 */
public abstract class Term {
    public interface Visitor<T> {
        T visitVariableTerm(Variable term);
        T visitLambdaTerm(Lambda term);
        T visitApplicationTerm(Application term);
    }

    public static class Variable extends Term {
        final int index;

        public Variable(int index) {
            this.index = index;
        }

        public boolean isFree() {
            return index < 0;
        }

        // slot in the free variable table, only meaningful when isFree()
        public int freeSlot() {
            return -index - 1;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitVariableTerm(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Variable && ((Variable) o).index == index;
        }

        @Override
        public int hashCode() {
            return Integer.hashCode(index);
        }
    }

    public static class Lambda extends Term {
        final String param;
        final Term body;

        public Lambda(String param, Term body) {
            this.param = param;
            this.body = Objects.requireNonNull(body);
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitLambdaTerm(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Lambda && ((Lambda) o).body.equals(body);
        }

        @Override
        public int hashCode() {
            return 31 * body.hashCode() + 1;
        }
    }

    public static class Application extends Term {
        final Term function;
        final Term argument;

        public Application(Term function, Term argument) {
            this.function = Objects.requireNonNull(function);
            this.argument = Objects.requireNonNull(argument);
        }

        @Override
        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitApplicationTerm(this);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Application))
                return false;
            var other = (Application) o;
            return other.function.equals(function) && other.argument.equals(argument);
        }

        @Override
        public int hashCode() {
            return Objects.hash(function, argument);
        }
    }

    public abstract <T> T accept(Visitor<T> visitor);

    @Override
    public String toString() {
        return new ASTPrinter().print(this);
    }
}
