package work.strata.engine.protocol;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static work.strata.engine.support.EngineTestSupport.bool;
import static work.strata.engine.support.EngineTestSupport.floating;
import static work.strata.engine.support.EngineTestSupport.integer;
import static work.strata.engine.support.EngineTestSupport.ints;
import static work.strata.engine.support.EngineTestSupport.record;
import static work.strata.engine.support.EngineTestSupport.str;

import java.util.List;
import org.junit.jupiter.api.Test;

class ValueOperationsTest {
    private static Value apply(Operator op, Value lhs, Value rhs) {
        return ValueOperations.apply(op, lhs, rhs, Span.of(1, 2));
    }

    @Test
    void integerArithmeticStaysIntegral() {
        assertEquals(integer(7), apply(Operator.ADD, integer(3), integer(4)));
        assertEquals(integer(-1), apply(Operator.SUB, integer(3), integer(4)));
        assertEquals(integer(12), apply(Operator.MUL, integer(3), integer(4)));
        assertEquals(integer(1), apply(Operator.MOD, integer(7), integer(3)));
        assertEquals(integer(8), apply(Operator.POW, integer(2), integer(3)));
    }

    @Test
    void divisionIsExactWhenPossible() {
        assertEquals(integer(3), apply(Operator.DIV, integer(9), integer(3)));
        assertEquals(floating(2.5), apply(Operator.DIV, integer(5), integer(2)));
    }

    @Test
    void mixedNumbersPromoteToFloat() {
        assertEquals(floating(3.5), apply(Operator.ADD, integer(1), floating(2.5)));
    }

    @Test
    void additionConcatenatesStringsAndLists() {
        assertEquals(str("foobar"), apply(Operator.ADD, str("foo"), str("bar")));
        assertEquals(ints(1, 2, 3), apply(Operator.ADD, ints(1), ints(2, 3)));
    }

    @Test
    void divisionByZeroIsReportedAtTheOperator() {
        var error = assertThrows(ShellError.class, () -> apply(Operator.DIV, integer(1), integer(0)));
        assertEquals(ShellError.Kind.DIVISION_BY_ZERO, error.kind());
        assertEquals(Span.of(1, 2), error.span());
    }

    @Test
    void overflowIsAnError() {
        var error = assertThrows(ShellError.class, () -> apply(Operator.ADD, integer(Long.MAX_VALUE), integer(1)));
        assertEquals(ShellError.Kind.OPERATOR_OVERFLOW, error.kind());
    }

    @Test
    void dividingTheSmallestIntegerByMinusOneOverflows() {
        var error = assertThrows(ShellError.class, () -> apply(Operator.DIV, integer(Long.MIN_VALUE), integer(-1)));
        assertEquals(ShellError.Kind.OPERATOR_OVERFLOW, error.kind());
        assertEquals(integer(Long.MIN_VALUE / 2), apply(Operator.DIV, integer(Long.MIN_VALUE), integer(2)));
    }

    @Test
    void mismatchedOperandsLabelBothSides() {
        var lhs = Value.string("a", Span.of(0, 1));
        var rhs = Value.integer(1, Span.of(4, 5));
        var error = assertThrows(ShellError.class, () -> ValueOperations.apply(Operator.SUB, lhs, rhs, Span.of(2, 3)));
        assertEquals(ShellError.Kind.OPERATOR_MISMATCH, error.kind());
        assertEquals(3, error.labels().size());
        assertEquals("string", error.labels().get(1).text());
        assertEquals(Span.of(4, 5), error.labels().get(2).span());
    }

    @Test
    void equalityCrossesNumericTypes() {
        assertEquals(bool(true), apply(Operator.EQ, integer(1), floating(1.0)));
        assertEquals(bool(true), apply(Operator.NE, str("a"), str("b")));
    }

    @Test
    void comparisonsOrderNumbersAndStrings() {
        assertEquals(bool(true), apply(Operator.LT, integer(1), floating(1.5)));
        assertEquals(bool(true), apply(Operator.GE, str("b"), str("a")));
        assertThrows(ShellError.class, () -> apply(Operator.LT, str("a"), integer(1)));
    }

    @Test
    void membershipChecksListsRangesStringsAndRecords() {
        assertEquals(bool(true), apply(Operator.IN, integer(2), ints(1, 2, 3)));
        var range = Value.Range.of(integer(1), null, integer(10), true, Span.unknown());
        assertEquals(bool(false), apply(Operator.IN, integer(11), range));
        assertEquals(bool(true), apply(Operator.IN, str("ell"), str("hello")));
        assertEquals(bool(true), apply(Operator.IN, str("a"), record(List.of("a"), integer(1))));
        assertEquals(bool(true), apply(Operator.NOT_IN, integer(5), ints(1, 2)));
    }

    @Test
    void regexLikeContainsMatchesSubstrings() {
        assertEquals(bool(true), apply(Operator.CONTAINS, str("strata"), str("rat")));
        assertEquals(bool(true), apply(Operator.NOT_CONTAINS, str("strata"), str("xyz")));
    }

    @Test
    void errorOperandsAreRethrown() {
        var carried = ShellError.divisionByZero(Span.of(8, 9));
        var thrown = assertThrows(ShellError.class, () -> apply(Operator.ADD, Value.error(carried), integer(1)));
        assertEquals(carried, thrown);
    }
}
