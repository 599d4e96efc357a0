package pytype.lib.common.math.pyint;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.Random;
import java.util.concurrent.ForkJoinPool;
import java.util.function.BinaryOperator;

import org.junit.AfterClass;
import org.junit.Assert;
import org.junit.Test;

import pytype.lib.common.math.pyint.DecimalDigits.DigitArraySink;

public class IntTest extends CommonTestBase {

    private static final Int INT_MAX  = Int.fromInt(Integer.MAX_VALUE);
    private static final Int INT_MIN  = Int.fromInt(Integer.MIN_VALUE);
    private static final Int LONG_MAX = Int.fromLong(Long.MAX_VALUE);
    private static final Int LONG_MIN = Int.fromLong(Long.MIN_VALUE);

    private static ForkJoinPool pool = new ForkJoinPool(4);

    @AfterClass
    public static void shutdownPool() {
        pool.shutdown();
    }

    @Test
    public void constants() {
        Assert.assertEquals("0", Int.ZERO.toString());
        Assert.assertEquals("1", Int.ONE.toString());
        Assert.assertEquals("2", Int.TWO.toString());
        Assert.assertEquals("10", Int.TEN.toString());
        Assert.assertEquals("-1", Int.MINUS_ONE.toString());
        Assert.assertEquals(""+Integer.MAX_VALUE, INT_MAX.toString());
        Assert.assertEquals(""+Integer.MIN_VALUE, INT_MIN.toString());
        Assert.assertEquals(""+Long.MAX_VALUE, LONG_MAX.toString());
        Assert.assertEquals(""+Long.MIN_VALUE, LONG_MIN.toString());
    }

    @Test
    public void canonicalForm() {
        checkDebugStr("Int {digits=1, negative=false, length=1, data=[1]}", "1", "00000000000000000001");
        checkDebugStr("Int {digits=1, negative=true, length=1, data=[1]}", "-1", "-0000000000000000000000000000000000001");
        checkDebugStr("Int {digits=1, negative=false, length=0, data=[]}", "0", "0000000000000000000000000000000000000");
        checkDebugStr("Int {digits=1, negative=false, length=0, data=[]}", "0", "-0");
        checkDebugStr("Int {digits=1, negative=false, length=0, data=[]}", "0", "+0");

        checkDebugStr("Int {digits=2, negative=false, length=1, data=[10]}", "10");
        checkDebugStr("Int {digits=9, negative=false, length=1, data=[100000000]}", "100000000");
        checkDebugStr("Int {digits=10, negative=false, length=2, data=[0, 1]}", "1000000000");
        checkDebugStr("Int {digits=19, negative=true, length=3, data=[854775808, 223372036, 9]}", "-9223372036854775808");
        checkDebugStr("Int {digits=92, negative=false, length=11, data=[1, 0, 0, 0, 0, 0, 0, 0, 0, 0, 10]}",
                "1" + "0".repeat(90) + "1");

        Assert.assertEquals(Int.fromLong(Long.MIN_VALUE).toDebugString(), Int.fromString("-9223372036854775808").toDebugString());
    }

    private static void checkDebugStr(String expected, String input) {
        checkDebugStr(expected, input, input);
    }

    private static void checkDebugStr(String expected, String expectedStr, String input) {
        Int value = Int.fromString(input);
        Assert.assertEquals(expected, value.toDebugString());
        Assert.assertEquals(expectedStr, value.toString());
    }

    @Test
    public void stringSigned() {
        checkString("-15");
        checkString("-999999999");
        checkString("-999999999222");
        checkString("-111222333000666777");
        checkString("-111222333444555666777888999");
        checkString("-1112223334445556667778889990");
        checkString("3", "+3");
        checkString("11122233344455566677788899900", "+11122233344455566677788899900");
        checkString("0", "0");
    }

    private static void checkString(String input) {
        checkString(input, input);
    }

    private static void checkString(String expected, String input) {
        Int value = Int.fromString(input);
        Assert.assertEquals(expected, value.toString());

        var out = new ByteArrayOutputStream();
        if (value.isNegative()) {
            out.write('-');
        }
        Assert.assertTrue(value.stream(DigitArraySink.of(out)));
        Assert.assertEquals(expected, out.toString(StandardCharsets.UTF_8));
        Assert.assertEquals(expected, new String(value.toByteArray(/*includeSign*/ true), StandardCharsets.US_ASCII));
        Assert.assertEquals(expected.length() - (value.isNegative() ? 1 : 0), value.countDigits());
    }

    @Test
    public void stringRange() {
        String str = "xx-12345678901234567890yy";
        Assert.assertEquals("-12345678901234567890", Int.fromString(str, 2, 23).toString());
        Assert.assertEquals("45", Int.fromString(str, 6, 8).toString());
    }

    @Test
    public void invalidFormat() {
        checkInvalidFormat("");
        checkInvalidFormat("-");
        checkInvalidFormat("+");
        checkInvalidFormat("12a4");
        checkInvalidFormat("--1");
        checkInvalidFormat(" 1");
        checkInvalidFormat("1 ");
        checkInvalidFormat("1_000");
    }

    private static void checkInvalidFormat(String input) {
        try {
            Int.fromString(input);
            Assert.fail("Expecting NumberFormatException for '" + input + "'");
        } catch (NumberFormatException e) {
            System.out.println(e);
        }
    }

    @Test
    public void addLargeCarry() {
        var a = Int.fromString("18446744073709551617");
        Assert.assertEquals(Int.fromString("36893488147419103234"), a.add(a));
        Assert.assertEquals("1000000000000000000", Int.fromString("999999999999999999").add(Int.ONE).toString());
        Assert.assertEquals("0", Int.fromString("-999999999999999999").add(Int.fromString("999999999999999999")).toString());
    }

    @Test
    public void addSubtractSigned() {
        long[] values = { 0, 1, -1, 3, -3, 4, -4, 999_999_999, -999_999_999, 1_000_000_000, -1_000_000_000,
                Long.MAX_VALUE, Long.MIN_VALUE, Long.MAX_VALUE / 3, Long.MIN_VALUE / 7 };
        for (long lhs : values) {
            for (long rhs : values) {
                checkBinary(lhs, rhs, BigInteger::add, Int::add);
                checkBinary(lhs, rhs, BigInteger::subtract, Int::subtract);
                checkBinary(lhs, rhs, BigInteger::multiply, Int::multiply);
            }
        }
    }

    private static void checkBinary(long lhs, long rhs, BinaryOperator<BigInteger> expected, BinaryOperator<Int> actual) {
        var result = actual.apply(Int.fromLong(lhs), Int.fromLong(rhs));
        checkSame(expected.apply(BigInteger.valueOf(lhs), BigInteger.valueOf(rhs)), result);
    }

    @Test
    public void arithmeticRandom() {
        var rnd = new Random(1);
        for (int i = 0; i < 2_000; i++) {
            String lhs = i % 2 == 0 ? randomSignedString(rnd, 1, 120) : randomEdgyString(rnd, 1, 120);
            String rhs = i % 3 == 0 ? randomSignedString(rnd, 1, 60) : randomEdgyString(rnd, 1, 140);
            checkArithmetic(lhs, rhs);
            checkArithmetic(rhs, lhs);
        }
    }

    private static void checkArithmetic(String lhsStr, String rhsStr) {
        var lhs = Int.fromString(lhsStr);
        var rhs = Int.fromString(rhsStr);
        var bigLhs = new BigInteger(lhsStr);
        var bigRhs = new BigInteger(rhsStr);

        checkSame(bigLhs.add(bigRhs), lhs.add(rhs));
        checkSame(bigLhs.subtract(bigRhs), lhs.subtract(rhs));
        checkSame(bigLhs.multiply(bigRhs), lhs.multiply(rhs));
        checkSame(bigLhs.multiply(bigRhs), Int.multiplySimple(lhs, rhs));
        checkSame(bigLhs.negate(), lhs.negate());
        checkSame(bigLhs.abs(), lhs.abs());
        Assert.assertEquals(bigLhs.compareTo(bigRhs), lhs.compareTo(rhs));

        if (!rhs.isZero()) {
            var qr = lhs.divideAndRemainder(rhs);
            var bigQr = bigLhs.divideAndRemainder(bigRhs);
            checkSame(bigQr[0], qr[0]);
            checkSame(bigQr[1], qr[1]);
            Assert.assertEquals(lhs, qr[0].multiply(rhs).add(qr[1]));
            checkSame(floorDiv(bigLhs, bigRhs), lhs.floorDivide(rhs));
            checkSame(floorMod(bigLhs, bigRhs), lhs.floorMod(rhs));
        }
    }

    private static BigInteger floorDiv(BigInteger lhs, BigInteger rhs) {
        var qr = lhs.divideAndRemainder(rhs);
        return qr[1].signum() != 0 && qr[1].signum() != rhs.signum() ? qr[0].subtract(BigInteger.ONE) : qr[0];
    }

    private static BigInteger floorMod(BigInteger lhs, BigInteger rhs) {
        var r = lhs.remainder(rhs);
        return r.signum() != 0 && r.signum() != rhs.signum() ? r.add(rhs) : r;
    }

    @Test
    public void algebraicLaws() {
        var rnd = new Random(2);
        for (int i = 0; i < 300; i++) {
            var a = Int.fromString(randomEdgyString(rnd, 1, 80));
            var b = Int.fromString(randomEdgyString(rnd, 1, 80));
            var c = Int.fromString(randomSignedString(rnd, 1, 80));
            Assert.assertEquals(a.add(b), b.add(a));
            Assert.assertEquals(a.multiply(b), b.multiply(a));
            Assert.assertEquals(a.add(b).add(c), a.add(b.add(c)));
            Assert.assertEquals(a.multiply(b).multiply(c), a.multiply(b.multiply(c)));
            Assert.assertEquals(a.subtract(b), a.add(b.negate()));
            Assert.assertEquals(a, a.increment().decrement());
            Assert.assertEquals(a, a.decrement().increment());
        }
    }

    @Test
    public void divisionSigns() {
        // truncating division, remainder follows the dividend
        checkDivide(7, 2, 3, 1);
        checkDivide(-7, 2, -3, -1);
        checkDivide(7, -2, -3, 1);
        checkDivide(-7, -2, 3, -1);
        checkDivide(6, 3, 2, 0);
        checkDivide(-6, 3, -2, 0);
        checkDivide(0, -5, 0, 0);
        checkDivide(2, 5, 0, 2);
        checkDivide(-2, 5, 0, -2);

        // flooring division, remainder follows the divisor
        Assert.assertEquals("-4", Int.fromInt(-7).floorDivide(Int.TWO).toString());
        Assert.assertEquals("1", Int.fromInt(-7).floorMod(Int.TWO).toString());
        Assert.assertEquals("-4", Int.fromInt(7).floorDivide(Int.fromInt(-2)).toString());
        Assert.assertEquals("-1", Int.fromInt(7).floorMod(Int.fromInt(-2)).toString());
        Assert.assertEquals("3", Int.fromInt(7).floorDivide(Int.TWO).toString());
    }

    private static void checkDivide(long lhs, long rhs, long quotient, long remainder) {
        var a = Int.fromLong(lhs);
        var b = Int.fromLong(rhs);
        Assert.assertEquals(quotient, a.divide(b).toLong());
        Assert.assertEquals(remainder, a.remainder(b).toLong());
    }

    @Test
    public void divisionByZero() {
        var values = new Int[] { Int.ZERO, Int.ONE, Int.fromString("-" + "7".repeat(50)) };
        for (var value : values) {
            try {
                value.divide(Int.ZERO);
                Assert.fail("Expecting ArithmeticException");
            } catch (ArithmeticException e) {
                System.out.println(e);
            }
            try {
                value.remainder(Int.ZERO);
                Assert.fail("Expecting ArithmeticException");
            } catch (ArithmeticException e) {
                System.out.println(e);
            }
        }
    }

    @Test
    public void incrementDecrement() {
        Assert.assertEquals("100000000000000", Int.fromString("99999999999999").increment().toString());
        Assert.assertEquals("99999999999999", Int.fromString("100000000000000").decrement().toString());

        Assert.assertEquals("Int {digits=19, negative=false, length=3, data=[0, 0, 1]}",
                Int.fromString("999999999999999999").increment().toDebugString());
        Assert.assertEquals("Int {digits=18, negative=false, length=2, data=[999999999, 999999999]}",
                Int.fromString("1000000000000000000").decrement().toDebugString());
        Assert.assertEquals("Int {digits=18, negative=true, length=2, data=[999999999, 999999999]}",
                Int.fromString("-1000000000000000000").increment().toDebugString());
        Assert.assertEquals("Int {digits=19, negative=true, length=3, data=[0, 0, 1]}",
                Int.fromString("-999999999999999999").decrement().toDebugString());

        Assert.assertEquals(Int.ONE, Int.ZERO.increment());
        Assert.assertEquals(Int.MINUS_ONE, Int.ZERO.decrement());
        Assert.assertEquals(Int.ZERO, Int.ONE.decrement());
        Assert.assertEquals(Int.ZERO, Int.MINUS_ONE.increment());
        Assert.assertEquals("-2", Int.MINUS_ONE.decrement().toString());

        var x = Int.fromInt(-5);
        for (long expected = -4; expected <= 5; expected++) {
            x = x.increment();
            Assert.assertEquals(expected, x.toLong());
        }

        var y = Int.fromLong(Long.MAX_VALUE);
        checkSame(BigInteger.valueOf(Long.MAX_VALUE).add(BigInteger.ONE), y.increment());
        checkSame(BigInteger.valueOf(Long.MIN_VALUE).subtract(BigInteger.ONE), LONG_MIN.decrement());
    }

    @Test
    public void noWriteThrough() {
        var a = Int.fromString("999999999999999999");
        var b = a.increment();
        Assert.assertEquals("999999999999999999", a.toString());
        Assert.assertEquals("1000000000000000000", b.toString());

        var c = a.negate();
        var d = c.decrement();
        Assert.assertEquals("999999999999999999", a.toString());
        Assert.assertEquals("-999999999999999999", c.toString());
        Assert.assertEquals("-1000000000000000000", d.toString());

        var e = Int.ZERO.add(a);
        var f = e.add(Int.ONE);
        Assert.assertEquals("999999999999999999", e.toString());
        Assert.assertEquals("1000000000000000000", f.toString());
        Assert.assertEquals("1", Int.ONE.toString());
    }

    @Test
    public void compareTo() {
        long[] values = { 0, 1, -1, 100, -100, 999_999_999, 1_000_000_000, -1_000_000_001, Long.MAX_VALUE, Long.MIN_VALUE };
        for (long lhs : values) {
            for (long rhs : values) {
                Assert.assertEquals(Long.compare(lhs, rhs), Int.fromLong(lhs).compareTo(Int.fromLong(rhs)));
                Assert.assertEquals(Long.compare(lhs, rhs), Int.fromLong(lhs).compareTo(rhs));
                Assert.assertEquals(BigInteger.valueOf(lhs).abs().compareTo(BigInteger.valueOf(rhs).abs()),
                        Integer.signum(Int.fromLong(lhs).compareToAbs(Int.fromLong(rhs))));
            }
        }
        Assert.assertTrue(Int.fromString("1" + "0".repeat(30)).compareTo(Long.MAX_VALUE) > 0);
        Assert.assertTrue(Int.fromString("-1" + "0".repeat(30)).compareTo(Long.MIN_VALUE) < 0);
        Assert.assertEquals(0, Int.fromString("-" + "5".repeat(40)).compareToAbs(Int.fromString("5".repeat(40))));
    }

    @Test
    public void equalsHashCode() {
        var set = new HashSet<Int>();
        set.add(Int.fromString("123456789123456789123456789"));
        set.add(Int.fromString("-123456789123456789123456789"));
        set.add(Int.fromString("000123456789123456789123456789"));
        set.add(Int.fromString("-0"));
        set.add(Int.ZERO);
        Assert.assertEquals(3, set.size());
        Assert.assertTrue(set.contains(Int.fromString("123456789123456789123456789")));

        var a = Int.fromString("98765432109876543210");
        var b = Int.fromString("98765432109876543209").increment();
        Assert.assertEquals(a, b);
        Assert.assertEquals(a.hashCode(), b.hashCode());
        Assert.assertNotEquals(a, a.negate());
        Assert.assertNotEquals(a, "98765432109876543210");
    }

    @Test
    public void nativeInt() {
        checkInt(0);
        checkInt(1);
        checkInt(-1);
        checkInt(999_999_999);
        checkInt(1_000_000_000);
        checkInt(Integer.MAX_VALUE);
        checkInt(Integer.MIN_VALUE);
        checkInt(Integer.MIN_VALUE + 1);

        Assert.assertFalse(INT_MAX.increment().isInt());
        Assert.assertFalse(INT_MIN.decrement().isInt());
        checkOverflow(() -> INT_MAX.increment().toInt());
        checkOverflow(() -> INT_MIN.decrement().toInt());
    }

    private static void checkInt(int value) {
        var x = Int.fromInt(value);
        Assert.assertTrue(x.isInt());
        Assert.assertEquals(value, x.toInt());
        Assert.assertEquals(String.valueOf(value), x.toString());
    }

    @Test
    public void nativeLong() {
        checkLong(0);
        checkLong(-1);
        checkLong(1_000_000_000_000_000_000L);
        checkLong(999_999_999_999_999_999L);
        checkLong(Long.MAX_VALUE);
        checkLong(Long.MIN_VALUE);
        checkLong(Long.MIN_VALUE + 1);

        Assert.assertFalse(LONG_MAX.increment().isLong());
        Assert.assertFalse(LONG_MIN.decrement().isLong());
        Assert.assertTrue(LONG_MIN.isLong());
        checkOverflow(() -> LONG_MAX.increment().toLong());
        checkOverflow(() -> LONG_MIN.decrement().toLong());
        checkOverflow(() -> Int.fromString("1" + "0".repeat(40)).toLong());
    }

    private static void checkLong(long value) {
        var x = Int.fromLong(value);
        Assert.assertTrue(x.isLong());
        Assert.assertEquals(value, x.toLong());
        Assert.assertEquals(String.valueOf(value), x.toString());
        Assert.assertEquals(x, Int.valueOf(value));
    }

    private static void checkOverflow(Runnable fn) {
        try {
            fn.run();
            Assert.fail("Expecting ArithmeticException");
        } catch (ArithmeticException e) {
            System.out.println(e);
        }
    }

    @Test
    public void parity() {
        Assert.assertTrue(Int.ZERO.isEven());
        Assert.assertTrue(Int.fromString("-1000000000").isEven());
        Assert.assertTrue(Int.fromString("1000000001").isOdd());
        Assert.assertTrue(Int.fromString("-77777777777777777777").isOdd());
    }

    @Test
    public void multiplyKaratsuba() {
        var rnd = new Random(3);
        for (int i = 0; i < 40; i++) {
            String lhs = randomSignedString(rnd, 1, 2_000);
            String rhs = randomEdgyString(rnd, 1, 2_000);
            var expected = new BigInteger(lhs).multiply(new BigInteger(rhs));
            for (int threshold : new int[] { 1, 2, 3, 7, Int.KARATSUBA_THRESHOLD }) {
                checkSame(expected, Int.multiplyKaratsuba(Int.fromString(lhs), Int.fromString(rhs), threshold));
            }
        }
        try {
            Int.multiplyKaratsuba(Int.ONE, Int.ONE, 0);
            Assert.fail("Expecting IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            System.out.println(e);
        }
    }

    @Test
    public void parallelMultiply() {
        var rnd = new Random(4);
        for (int i = 0; i < 20; i++) {
            String lhs = randomSignedString(rnd, 100, 5_000);
            String rhs = randomSignedString(rnd, 100, 5_000);
            var expected = new BigInteger(lhs).multiply(new BigInteger(rhs));
            checkSame(expected, Int.parallelMultiply(Int.fromString(lhs), Int.fromString(rhs), pool));
            checkSame(expected, Int.parallelMultiply(Int.fromString(lhs), Int.fromString(rhs), 2, 3, pool));
        }
        Assert.assertEquals(Int.ZERO, Int.parallelMultiply(Int.ZERO, Int.fromString("5".repeat(1000)), pool));
    }
}
