package org.prover.smt;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SmtSyntaxValidatorTest {

    private final SmtSyntaxValidator validator = new SmtSyntaxValidator();

    @Test
    void acceptsWellFormedScript() {
        SmtValidationResult result = validator.validate("(declare-const x Int)\n(assert (> x 0))\n(check-sat)\n");

        assertTrue(result.valid());
    }

    @Test
    void rejectsUnclosedParenthesis() {
        SmtValidationResult result = validator.validate("(assert (> x 0)\n(check-sat)");

        assertFalse(result.valid());
        assertEquals(SyntaxErrorKind.UNBALANCED_PARENTHESES, result.kind());
    }

    @Test
    void rejectsPrematureClose() {
        SmtValidationResult result = validator.validate("(check-sat))(");

        assertEquals(SyntaxErrorKind.UNBALANCED_PARENTHESES, result.kind());
    }

    @Test
    void rejectsMissingCheckSat() {
        SmtValidationResult result = validator.validate("(declare-const x Int)\n(assert (> x 0))\n");

        assertEquals(SyntaxErrorKind.MISSING_CHECK_SAT, result.kind());
    }

    @Test
    void rejectsUndeclaredSymbol() {
        SmtValidationResult result = validator.validate("(assert (> y 0))\n(check-sat)\n");

        assertEquals(SyntaxErrorKind.UNDECLARED_SYMBOL, result.kind());
        assertEquals("y", result.symbol());
    }

    @Test
    void symbolsDeclaredAfterUseAreRejected() {
        SmtValidationResult result = validator.validate("(assert (> y 0))\n(declare-const y Int)\n(check-sat)\n");

        assertEquals(SyntaxErrorKind.UNDECLARED_SYMBOL, result.kind());
    }

    @Test
    void quantifierAndLetBindersAreInScope() {
        assertTrue(validator.validate("(assert (forall ((x Int)) (>= (* x x) 0)))\n(check-sat)\n").valid());
        assertTrue(validator.validate("(assert (let ((a 1)) (> a 0)))\n(check-sat)\n").valid());
    }

    @Test
    void parenthesesInCommentsAndStringsAreIgnored() {
        assertTrue(validator.validate("; ((( commento\n(check-sat)\n").valid());
        assertTrue(validator.validate("(declare-const s String)\n(assert (= s \"(\"))\n(check-sat)\n").valid());
    }

    @Test
    void quotedSymbolMatchesDeclaration() {
        assertTrue(validator.validate("(declare-const |my var| Int)\n(assert (> |my var| 0))\n(check-sat)\n").valid());
    }

    @Test
    void emptyTextIsRejected() {
        assertFalse(validator.validate("   ").valid());
    }
}
