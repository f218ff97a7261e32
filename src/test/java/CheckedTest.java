import io.geekya215.interval.checked.Checked;
import io.geekya215.interval.checked.CheckedType;
import io.geekya215.interval.checked.NumericKind;
import io.geekya215.interval.checked.Scalar;
import io.geekya215.interval.exception.ArithmeticAbortError;
import io.geekya215.interval.exception.Violation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CheckedTest {
    static void assertAborts(Violation expected, Executable executable) {
        ArithmeticAbortError error = assertThrows(ArithmeticAbortError.class, executable);
        assertEquals(expected, error.violation());
    }

    @Test
    void testArithmetic() {
        assertTrue(Checked.of(2).plus(3).isEqualTo(5));
        assertTrue(Checked.of(2).minus(3).isEqualTo(-1));
        assertTrue(Checked.of(-7).dividedBy(2).isEqualTo(-3));
        assertTrue(Checked.of(7).remainder(Checked.of(4)).isEqualTo(3));
        assertTrue(Checked.of(6).times(Checked.of(7)).isEqualTo(42));
        assertTrue(Checked.of(5).negate().isEqualTo(-5));
    }

    @Test
    void testResultKindIsPromoted() {
        Checked sum = Checked.of(5).plus(3L);
        assertEquals(NumericKind.LONG, sum.kind());
        assertEquals(8, sum.longValue());

        Checked product = Checked.of(3).times(Checked.of(0.5));
        assertEquals(NumericKind.DOUBLE, product.kind());
        assertEquals(1.5, product.doubleValue());

        assertEquals(NumericKind.UINT, Checked.ofUnsigned(5).plus(1).kind());
    }

    @Test
    void testOverflowAborts() {
        assertAborts(Violation.OVERFLOW, () -> Checked.of(Integer.MAX_VALUE).plus(1));
        assertAborts(Violation.OVERFLOW, () -> Checked.of(Long.MAX_VALUE).plus(1));
        assertAborts(Violation.OVERFLOW, () -> Checked.of(Integer.MIN_VALUE).minus(1));
        assertAborts(Violation.OVERFLOW, () -> Checked.of(Integer.MIN_VALUE).negate());
        assertAborts(Violation.OVERFLOW, () -> Checked.of(1).dividedBy(0));
        assertAborts(Violation.OVERFLOW, () -> Checked.ofUnsigned(0).minus(1));
        assertAborts(Violation.OVERFLOW, () -> Checked.of(Double.MAX_VALUE).times(2));
    }

    @Test
    void testAbortMessageNamesOperatorAndOperands() {
        ArithmeticAbortError error = assertThrows(ArithmeticAbortError.class, () -> Checked.of(Integer.MAX_VALUE).plus(1));
        assertTrue(error.getMessage().contains("Overflow on binary operator: int(2147483647) + int(1)"));
    }

    @Test
    void testCheckedCast() {
        Checked narrowed = Checked.of(5).to(NumericKind.UBYTE);
        assertEquals(NumericKind.UBYTE, narrowed.kind());
        assertEquals(5, narrowed.longValue());
        assertTrue(Checked.of(2.0).to(NumericKind.INT).isEqualTo(2));

        assertAborts(Violation.BAD_CAST, () -> Checked.of(-1).to(NumericKind.UINT));
        assertAborts(Violation.BAD_CAST, () -> Checked.of(0.5).to(NumericKind.INT));
        assertAborts(Violation.BAD_CAST, () -> Checked.of(300).to(NumericKind.BYTE));
    }

    @Test
    void testAssignStoresIntoOwnType() {
        Checked target = Checked.of(0);
        Checked stored = target.assign(Checked.of(7L));
        assertEquals(NumericKind.INT, stored.kind());
        assertTrue(stored.isEqualTo(7));

        assertAborts(Violation.BAD_CAST, () -> target.assign(Checked.of(Long.MAX_VALUE)));
    }

    @Test
    void testDomainBounds() {
        CheckedType percent = CheckedType.of(NumericKind.INT).withDomain(0, 100);
        assertTrue(percent.checked(100).isEqualTo(100));

        assertAborts(Violation.UPPER_BOUND, () -> percent.checked(101));
        assertAborts(Violation.LOWER_BOUND, () -> percent.checked(-1));
        assertAborts(Violation.UPPER_BOUND, () -> percent.checked(60).plus(41));

        // a promoted result leaves the narrowed domain behind
        Checked widened = percent.checked(60).plus(41L);
        assertEquals(NumericKind.LONG, widened.kind());
        assertTrue(widened.isEqualTo(101));
    }

    @Test
    void testInfiniteLiteralIsOutsideNaturalDomain() {
        assertAborts(Violation.UPPER_BOUND, () -> Checked.of(Double.POSITIVE_INFINITY));
        assertAborts(Violation.LOWER_BOUND, () -> Checked.of(Double.NEGATIVE_INFINITY));
    }

    @Test
    void testNegativeSignedAgainstUnsignedAbortsForEveryPairing() {
        List<Scalar> negatives = List.of(Scalar.ofByte((byte) -1), Scalar.ofShort((short) -1), Scalar.of(-1), Scalar.of(-1L));
        List<Scalar> unsigned = List.of(Scalar.ofUnsignedByte((byte) 0), Scalar.ofUnsignedShort((short) 0),
                Scalar.ofUnsignedInt(0), Scalar.ofUnsignedLong(0L));

        for (Scalar negative : negatives) {
            for (Scalar value : unsigned) {
                assertAborts(Violation.SIGN_MISMATCH_COMPARISON, () -> Checked.of(negative).isEqualTo(value));
                assertAborts(Violation.SIGN_MISMATCH_COMPARISON, () -> Checked.of(negative).compareTo(value));
                assertAborts(Violation.SIGN_MISMATCH_COMPARISON, () -> Checked.of(value).compareTo(Checked.of(negative)));
            }
        }
    }

    @Test
    void testNonNegativeSignedAgainstUnsignedCompares() {
        assertTrue(Checked.of(3).isEqualTo(Scalar.ofUnsignedInt(3)));
        assertTrue(Checked.ofUnsigned(7).isGreaterThan(Checked.of(3)));
        assertTrue(Checked.ofUnsigned(-1L).isGreaterThan(Checked.of(Long.MAX_VALUE)));
        assertTrue(Checked.of(-2).isLessThan(Checked.of(-1L)));
    }

    @Test
    void testNaNOrderingAborts() {
        Checked nan = Checked.of(Double.NaN);
        assertFalse(nan.isEqualTo(Scalar.ofDouble(Double.NaN)));
        assertAborts(Violation.SIGN_MISMATCH_COMPARISON, () -> nan.compareTo(0));
    }

    @Test
    void testEqualsAcrossKinds() {
        assertEquals(Checked.of(2), Checked.of(2L));
        assertEquals(Checked.of(2).hashCode(), Checked.of(2L).hashCode());
        assertEquals(Checked.of(2), Checked.of(2.0));
        assertEquals(Checked.of(2).hashCode(), Checked.of(2.0).hashCode());
        assertNotEquals(Checked.of(2), Checked.of(3));
    }
}
