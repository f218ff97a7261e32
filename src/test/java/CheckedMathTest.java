import io.geekya215.interval.checked.CheckedMath;
import io.geekya215.interval.checked.NumericKind;
import io.geekya215.interval.checked.Op;
import io.geekya215.interval.checked.Scalar;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CheckedMathTest {
    @Test
    void testCheckedBinaryIntegral() {
        assertEquals(Scalar.of(3), CheckedMath.checkedBinary(Op.ADD, Scalar.of(1), Scalar.of(2)));
        assertEquals(Scalar.of(-3), CheckedMath.checkedBinary(Op.DIVIDE, Scalar.of(7), Scalar.of(-2)));
        assertEquals(Scalar.of(-1), CheckedMath.checkedBinary(Op.REMAINDER, Scalar.of(-7), Scalar.of(2)));
        assertNull(CheckedMath.checkedBinary(Op.ADD, Scalar.of(Integer.MAX_VALUE), Scalar.of(1)));
        assertNull(CheckedMath.checkedBinary(Op.MULTIPLY, Scalar.of(Long.MAX_VALUE), Scalar.of(2)));
        assertNull(CheckedMath.checkedBinary(Op.DIVIDE, Scalar.of(Long.MIN_VALUE), Scalar.of(-1L)));
        assertNull(CheckedMath.checkedBinary(Op.DIVIDE, Scalar.of(1), Scalar.of(0)));
        assertNull(CheckedMath.checkedBinary(Op.REMAINDER, Scalar.of(1), Scalar.of(0)));
    }

    @Test
    void testCheckedBinaryMixedSignedness() {
        assertEquals(Scalar.ofUnsignedInt(4), CheckedMath.checkedBinary(Op.ADD, Scalar.ofUnsignedInt(5), Scalar.of(-1)));
        assertNull(CheckedMath.checkedBinary(Op.ADD, Scalar.ofUnsignedInt(0), Scalar.of(-1)));
        assertNull(CheckedMath.checkedBinary(Op.DIVIDE, Scalar.of(-6), Scalar.ofUnsignedInt(3)));
        assertEquals(Scalar.of(-5L), CheckedMath.checkedBinary(Op.SUBTRACT, Scalar.ofUnsignedInt(5), Scalar.of(10L)));
    }

    @Test
    void testCheckedBinaryFloating() {
        assertEquals(Scalar.ofDouble(2.5), CheckedMath.checkedBinary(Op.MULTIPLY, Scalar.ofDouble(0.5), Scalar.of(5)));
        assertNull(CheckedMath.checkedBinary(Op.MULTIPLY, Scalar.ofDouble(Double.MAX_VALUE), Scalar.of(2)));
        assertNull(CheckedMath.checkedBinary(Op.DIVIDE, Scalar.ofDouble(1.0), Scalar.of(0)));
        assertNull(CheckedMath.checkedBinary(Op.MULTIPLY, Scalar.ofFloat(Float.MAX_VALUE), Scalar.ofFloat(2f)));
        Scalar infinite = CheckedMath.checkedBinary(Op.ADD, Scalar.ofDouble(Double.POSITIVE_INFINITY), Scalar.of(1));
        assertNotNull(infinite);
        assertTrue(infinite.isInfinite());
    }

    @Test
    void testWrapping() {
        assertEquals(Scalar.of(Integer.MIN_VALUE), CheckedMath.wrappingBinary(Op.ADD, Scalar.of(Integer.MAX_VALUE), Scalar.of(1)));
        assertEquals(Scalar.ofUnsignedInt(-1), CheckedMath.wrappingBinary(Op.SUBTRACT, Scalar.ofUnsignedInt(0), Scalar.of(1)));
        assertThrows(ArithmeticException.class, () -> CheckedMath.wrappingBinary(Op.DIVIDE, Scalar.of(1), Scalar.of(0)));
        assertEquals(Scalar.of(Integer.MIN_VALUE), CheckedMath.wrappingUnary(Op.NEGATE, Scalar.of(Integer.MIN_VALUE)));
    }

    @Test
    void testCheckedUnary() {
        assertNull(CheckedMath.checkedUnary(Op.NEGATE, Scalar.of(Integer.MIN_VALUE)));
        assertNull(CheckedMath.checkedUnary(Op.NEGATE, Scalar.ofUnsignedInt(3)));
        assertEquals(Scalar.ofUnsignedInt(0), CheckedMath.checkedUnary(Op.NEGATE, Scalar.ofUnsignedInt(0)));
        assertEquals(Scalar.of(-3), CheckedMath.checkedUnary(Op.NEGATE, Scalar.ofUnsignedByte((byte) 3)));
        assertEquals(Scalar.of(-1), CheckedMath.checkedUnary(Op.COMPLEMENT, Scalar.of(0)));
        assertThrows(IllegalArgumentException.class, () -> CheckedMath.checkedUnary(Op.COMPLEMENT, Scalar.ofDouble(1.0)));
    }

    @Test
    void testConvert() {
        assertEquals(Scalar.of(2), CheckedMath.convert(Scalar.ofDouble(2.0), NumericKind.INT));
        assertEquals(Scalar.ofUnsignedByte((byte) 0xFF), CheckedMath.convert(Scalar.of(255), NumericKind.UBYTE));
        assertEquals(Scalar.ofFloat(0.5f), CheckedMath.convert(Scalar.ofDouble(0.5), NumericKind.FLOAT));
        assertNull(CheckedMath.convert(Scalar.of(300), NumericKind.UBYTE));
        assertNull(CheckedMath.convert(Scalar.of(-1), NumericKind.UINT));
        assertNull(CheckedMath.convert(Scalar.ofDouble(2.5), NumericKind.INT));
        assertNull(CheckedMath.convert(Scalar.ofDouble(Double.NaN), NumericKind.INT));
        assertNull(CheckedMath.convert(Scalar.ofDouble(0.1), NumericKind.FLOAT));
        assertNull(CheckedMath.convert(Scalar.of((1L << 53) + 1), NumericKind.DOUBLE));
        assertNull(CheckedMath.convert(Scalar.ofDouble(1e300), NumericKind.FLOAT));
    }

    @Test
    void testSignMismatch() {
        assertTrue(CheckedMath.isSignMismatch(Scalar.of(-1), Scalar.ofUnsignedInt(0)));
        assertTrue(CheckedMath.isSignMismatch(Scalar.ofUnsignedByte((byte) 0), Scalar.of(-1L)));
        assertFalse(CheckedMath.isSignMismatch(Scalar.of(1), Scalar.ofUnsignedInt(0)));
        assertFalse(CheckedMath.isSignMismatch(Scalar.of(-1), Scalar.of(0L)));
        assertFalse(CheckedMath.isSignMismatch(Scalar.ofDouble(-1.0), Scalar.ofUnsignedInt(0)));
    }

    @Test
    void testCompareUsesMathematicalValues() {
        assertTrue(CheckedMath.compare(Scalar.of(-1), Scalar.ofUnsignedInt(-1)) < 0);
        assertTrue(CheckedMath.compare(Scalar.ofUnsignedLong(-1L), Scalar.of(Long.MAX_VALUE)) > 0);
        assertTrue(CheckedMath.compare(Scalar.ofDouble(0.5), Scalar.of(1)) < 0);
        assertTrue(CheckedMath.compare(Scalar.ofDouble(Double.NaN), Scalar.of(0)) > 0);
        assertTrue(CheckedMath.compare(Scalar.ofDouble(Double.NEGATIVE_INFINITY), Scalar.of(Long.MIN_VALUE)) < 0);
        assertTrue(CheckedMath.equal(Scalar.ofDouble(2.0), Scalar.of(2)));
        assertTrue(CheckedMath.equal(Scalar.ofDouble(-0.0), Scalar.of(0)));
        assertFalse(CheckedMath.equal(Scalar.ofDouble(Double.NaN), Scalar.ofDouble(Double.NaN)));
    }

    @Test
    void testOverflowSign() {
        assertEquals(1, CheckedMath.overflowSign(Op.ADD, Scalar.of(Integer.MAX_VALUE), Scalar.of(1)));
        assertEquals(-1, CheckedMath.overflowSign(Op.MULTIPLY, Scalar.of(Integer.MIN_VALUE), Scalar.of(2)));
        assertEquals(-1, CheckedMath.overflowSign(Op.DIVIDE, Scalar.of(-5), Scalar.of(0)));
        assertEquals(1, CheckedMath.overflowSign(Op.NEGATE, Scalar.of(Integer.MIN_VALUE)));
    }
}
