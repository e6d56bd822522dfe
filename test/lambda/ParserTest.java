package lambda;

import java.util.Arrays;
import java.util.Collections;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class ParserTest {
    private static Parser.Result parse(String source) {
        return new Parser(new Scanner(source).scanTokens()).parse();
    }

    private static ParseError parseError(String source) {
        return assertThrows(ParseError.class, () -> parse(source));
    }

    private static Term var(int index) {
        return new Term.Variable(index);
    }

    @Test
    void resolvesNestedBinders() {
        Parser.Result result = parse("\\x.{\\y.{<x|y>}}");
        Term expected = new Term.Lambda("x",
                new Term.Lambda("y", new Term.Application(var(2), var(1))));
        assertEquals(expected, result.term);
        assertEquals(Collections.emptyList(), result.freeVars);
        assertEquals("Lambda(\"x\", Lambda(\"y\", Application(Variable(2), Variable(1))))",
                result.term.toString());
    }

    @Test
    void innermostBinderWins() {
        Term term = parse("\\x.{\\x.{x}}").term;
        var inner = (Term.Lambda) ((Term.Lambda) term).body;
        assertEquals(var(1), inner.body);
    }

    @Test
    void shadowedBinderIsVisibleAgainOutside() {
        Term term = parse("\\x.{<\\x.{x}|x>}").term;
        Term expected = new Term.Lambda("x",
                new Term.Application(new Term.Lambda("x", var(1)), var(1)));
        assertEquals(expected, term);
    }

    @Test
    void repeatedFreeVariableSharesSlot() {
        Parser.Result result = parse("<x|x>");
        assertEquals(Collections.singletonList("x"), result.freeVars);
        assertEquals(new Term.Application(var(-1), var(-1)), result.term);
    }

    @Test
    void freeVariablesInOrderOfFirstAppearance() {
        Parser.Result result = parse("<<a|b>|\\c.{<a|<c|d>>}>");
        assertEquals(Arrays.asList("a", "b", "d"), result.freeVars);
        Term expected = new Term.Application(
                new Term.Application(var(-1), var(-2)),
                new Term.Lambda("c", new Term.Application(var(-1), new Term.Application(var(1), var(-3)))));
        assertEquals(expected, result.term);
    }

    @Test
    void nameBoundInOnePlaceIsFreeElsewhere() {
        Parser.Result result = parse("<\\x.{x}|x>");
        assertEquals(Collections.singletonList("x"), result.freeVars);
        assertEquals(new Term.Application(new Term.Lambda("x", var(1)), var(-1)), result.term);
    }

    @Test
    void alphaEquivalentTermsAreEqual() {
        assertEquals(parse("\\x.{\\y.{<y|x>}}").term, parse("\\a.{\\b.{<b|a>}}").term);
        assertNotEquals(parse("\\x.{\\y.{<y|x>}}").term, parse("\\a.{\\b.{<a|b>}}").term);
    }

    @Test
    void singleVariable() {
        Parser.Result result = parse("  foo ");
        assertEquals(var(-1), result.term);
        assertEquals(Collections.singletonList("foo"), result.freeVars);
    }

    @Test
    void missingKetIsReported() {
        ParseError error = parseError("<x|y");
        assertTrue(error.getMessage().contains("'>'"), error.getMessage());
        assertNull(error.token);
        assertEquals("at end", error.where());
    }

    @Test
    void missingDelimiterIsReported() {
        ParseError error = parseError("<x y>");
        assertTrue(error.getMessage().contains("'|'"), error.getMessage());
        assertEquals("at 'y'", error.where());
    }

    @Test
    void missingDotIsReported() {
        ParseError error = parseError("\\x{x}");
        assertTrue(error.getMessage().contains("'.'"), error.getMessage());
        assertEquals(Token.Type.LEFT_BRACE, error.token.type);
    }

    @Test
    void missingBraceAfterDotIsReported() {
        ParseError error = parseError("\\x.x");
        assertTrue(error.getMessage().contains("'{'"), error.getMessage());
    }

    @Test
    void unclosedBodyIsReported() {
        ParseError error = parseError("\\x.{x");
        assertTrue(error.getMessage().contains("'}'"), error.getMessage());
        assertEquals("at end", error.where());
    }

    @Test
    void lambdaNeedsParameterName() {
        ParseError error = parseError("\\.{x}");
        assertEquals("expected parameter name after '\\'", error.getMessage());
    }

    @Test
    void emptyInputIsUnexpected() {
        ParseError error = parseError("");
        assertEquals("unexpected token", error.getMessage());
        assertEquals("at end", error.where());
    }

    @Test
    void strayPunctuationIsUnexpected() {
        ParseError error = parseError("|");
        assertEquals("unexpected token", error.getMessage());
        assertEquals("at '|'", error.where());
    }

    @Test
    void trailingTokensAreRejected() {
        ParseError error = parseError("x y");
        assertEquals("expected end of input", error.getMessage());
        assertEquals("at 'y'", error.where());
    }
}
