package lambda;

import java.util.List;
import java.util.Stack;

// binder names currently in scope while walking a term, plus the free table
class Environment {
    private final Stack<String> binders = new Stack<>();
    private final List<String> freeVars;

    Environment(List<String> freeVars) {
        this.freeVars = freeVars;
    }

    void push(String param) { binders.push(param); }
    void pop()              { binders.pop(); }

    String nameOf(Term.Variable var) {
        if (var.isFree()) {
            int slot = var.freeSlot();
            if (slot >= freeVars.size())
                throw new InvalidTermError(var.index,
                        "free variable slot " + slot + " out of range (" + freeVars.size() + " free variables)");
            return freeVars.get(slot);
        }
        if (var.index == 0 || var.index > binders.size())
            throw new InvalidTermError(var.index,
                    "variable index " + var.index + " with " + binders.size() + " enclosing binders");
        return binders.get(binders.size() - var.index);
    }
}
