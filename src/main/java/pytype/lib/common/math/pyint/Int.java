/*
MIT License

Copyright (c) 2024 Philipp Grasboeck

Permission is hereby granted, free of charge, to any person obtaining a copy
of this software and associated documentation files (the "Software"), to deal
in the Software without restriction, including without limitation the rights
to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
copies of the Software, and to permit persons to whom the Software is
furnished to do so, subject to the following conditions:

The above copyright notice and this permission notice shall be included in all
copies or substantial portions of the Software.

THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
SOFTWARE.
*/

package pytype.lib.common.math.pyint;

import java.util.Arrays;
import java.util.Random;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ThreadLocalRandom;

import pytype.lib.common.math.pyint.DecimalDigits.DigitArraySink;
import pytype.lib.common.math.pyint.DecimalDigits.DigitStreamable;

/**
 * Arbitrary-precision signed integer in the spirit of Python's {@code int}.
 *
 * The magnitude is stored in base 10^9, least significant limb first,
 * which makes decimal conversion cheap. Instances are immutable:
 * every operation returns a new value and never touches its operands,
 * so values may be shared freely between threads.
 *
 * Division truncates toward zero and the remainder takes the sign of the dividend,
 * i.e. {@code a.divide(b).multiply(b).add(a.remainder(b)).equals(a)} always holds.
 * Python's flooring semantics are available as {@link #floorDivide(Int)} and {@link #floorMod(Int)}.
 */
public final class Int implements Comparable<Int>, DigitStreamable {

    public static final Int ZERO      = new Int(0, Limbs.EMPTY);
    public static final Int ONE       = new Int(1, new int[] { 1 });
    public static final Int TWO       = new Int(1, new int[] { 2 });
    public static final Int TEN       = new Int(1, new int[] { 10 });
    public static final Int MINUS_ONE = new Int(-1, new int[] { 1 });

    public static final int KARATSUBA_THRESHOLD = Limbs.KARATSUBA_THRESHOLD;

    private static final int[] INT_MAX  = Limbs.fromUnsignedLong(Integer.MAX_VALUE);
    private static final int[] INT_MIN  = Limbs.fromUnsignedLong(-(long) Integer.MIN_VALUE);
    private static final int[] LONG_MAX = Limbs.fromUnsignedLong(Long.MAX_VALUE);
    private static final int[] LONG_MIN = Limbs.fromUnsignedLong(Long.MIN_VALUE); // unsigned 2^63

    private final int signum;
    private final int[] mag; // integers from 000_000_000 to 999_999_999
    private int hash; // cached value, 0 means not computed yet

    private Int(int signum, int[] mag) {
        assert Limbs.isCanonical(mag);
        assert (signum == 0) == (mag.length == 0) && -1 <= signum && signum <= 1;
        this.signum = signum;
        this.mag = mag;
    }

    // takes ownership of mag, which may carry leading zero limbs
    static Int of(int signum, int[] mag) {
        mag = Limbs.trim(mag);
        if (mag.length == 0) {
            return ZERO;
        }
        assert signum != 0;
        return new Int(signum < 0 ? -1 : 1, mag);
    }

    int[] magnitude() {
        return mag;
    }

    /* ===============
     * factory methods
     * ===============
     */

    public static Int fromInt(int value) {
        return fromLong(value);
    }

    public static Int fromLong(long value) {
        if (value == 0) {
            return ZERO;
        }
        // -Long.MIN_VALUE overflows back to itself, which is 2^63 when taken as unsigned
        return new Int(Long.signum(value), Limbs.fromUnsignedLong(value < 0 ? -value : value));
    }

    public static Int valueOf(long value) {
        return fromLong(value);
    }

    public static Int fromString(CharSequence str) {
        return Radix.parse(str, 0, str.length(), 10);
    }

    /**
     * Parses an optionally signed number in the given radix.
     * Letters are case-insensitive. Radix 0 detects a "0x", "0o" or "0b" prefix
     * and otherwise parses decimal, rejecting leading zeros on a non-zero number as in "010".
     *
     * @throws NumberFormatException on empty input, digits outside the radix, or radix out of [2, 36]
     */
    public static Int fromString(CharSequence str, int radix) {
        return Radix.parse(str, 0, str.length(), radix);
    }

    public static Int fromString(CharSequence str, int fromIndex, int toIndex) {
        return Radix.parse(str, fromIndex, toIndex, 10);
    }

    /**
     * Returns a positive number with exactly {@code digits} decimal digits,
     * i.e. the leading digit is never zero. Not suitable for cryptography.
     */
    public static Int random(int digits) {
        return random(digits, ThreadLocalRandom.current());
    }

    public static Int random(int digits, Random rnd) {
        return IntMath.random(digits, rnd);
    }

    public static Int factorial(int n) {
        return IntMath.factorial(n);
    }

    /**
     * Hyperoperation H<sub>n</sub>(a, b): level 1 is addition, 2 multiplication,
     * 3 exponentiation, 4 tetration and so forth, with
     * H<sub>n</sub>(a, b) = H<sub>n-1</sub>(a, H<sub>n</sub>(a, b - 1)) and H<sub>n</sub>(a, 0) = 1 for n >= 3.
     * Any level answers at once where the result does not depend on it,
     * e.g. H<sub>n</sub>(2, 2) = 4 and H<sub>n</sub>(1, b) = 1.
     *
     * @throws IllegalArgumentException if {@code n < 1}, {@code b < 0}, or {@code a < 0} with {@code n >= 4} and {@code b >= 2}
     * @throws ArithmeticException if the result is too large to be represented
     */
    public static Int hyperoperation(int n, Int a, Int b) {
        return IntMath.hyperoperation(n, a, b);
    }

    /* ==========
     * properties
     * ==========
     */

    public int signum() {
        return signum;
    }

    public boolean isZero() {
        return signum == 0;
    }

    @Override
    public boolean isNegative() {
        return signum < 0;
    }

    public boolean isEven() {
        return Limbs.isEven(mag);
    }

    public boolean isOdd() {
        return !isEven();
    }

    //does not include sign
    @Override
    public int countDigits() {
        return Limbs.countDigits(mag);
    }

    public boolean isInt() {
        return Limbs.compare(mag, signum < 0 ? INT_MIN : INT_MAX) <= 0;
    }

    public boolean isLong() {
        return Limbs.compare(mag, signum < 0 ? LONG_MIN : LONG_MAX) <= 0;
    }

    /**
     * @throws ArithmeticException if the value is out of int range
     */
    public int toInt() {
        if (!isInt()) {
            throw new ArithmeticException("Int out of int range: " + this);
        }
        long abs = Limbs.toUnsignedLong(mag);
        return (int) (signum < 0 ? -abs : abs);
    }

    /**
     * @throws ArithmeticException if the value is out of long range
     */
    public long toLong() {
        if (!isLong()) {
            throw new ArithmeticException("Int out of long range: " + this);
        }
        long abs = Limbs.toUnsignedLong(mag); // 2^63 comes back as Long.MIN_VALUE, which is just right
        return signum < 0 ? -abs : abs;
    }

    /* ==========
     * conversion
     * ==========
     */

    @Override
    public String toString() {
        return Radix.render(signum < 0, mag, 10);
    }

    /**
     * Renders the value in the given radix with lower case letters,
     * a leading '-' for negative values and no leading zeroes.
     *
     * @throws NumberFormatException if radix is out of [2, 36]
     */
    public String toString(int radix) {
        return Radix.render(signum < 0, mag, radix);
    }

    public byte[] toByteArray(boolean includeSign) {
        return Radix.toDecimalBytes(includeSign && signum < 0, mag);
    }

    //does not include sign
    @Override
    public boolean stream(DigitArraySink sink) {
        if (mag.length == 0) {
            return sink.accept(new byte[] { '0' }, 0, 1);
        }
        byte[] dest = new byte[Limbs.SIZE];
        int top = mag.length - 1;
        int skip = Limbs.SIZE - Radix.decimalLength(mag[top]);

        Radix.formatDecimal(dest, mag[top], 0, Limbs.SIZE);
        if (!sink.accept(dest, skip, Limbs.SIZE - skip)) {
            return false;
        }
        for (int i = top - 1; i >= 0; --i) {
            Radix.formatDecimal(dest, mag[i], 0, Limbs.SIZE);
            if (!sink.accept(dest, 0, Limbs.SIZE)) {
                return false;
            }
        }
        return true;
    }

    public String toDebugString() {
        var sb = new StringBuilder();

        sb.append("Int");
        sb.append(" {digits=").append(countDigits());
        sb.append(", negative=").append(isNegative());
        sb.append(", length=").append(mag.length);
        sb.append(", data=").append(Arrays.toString(mag));
        sb.append("}");

        return sb.toString();
    }

    /* ==========
     * comparison
     * ==========
     */

    @Override
    public int compareTo(Int o) {
        int cmp = Integer.compare(signum, o.signum);
        return cmp != 0 ? cmp : signum * Limbs.compare(mag, o.mag);
    }

    public int compareTo(long o) {
        return compareTo(fromLong(o));
    }

    public int compareToAbs(Int o) {
        return Limbs.compare(mag, o.mag);
    }

    public boolean equals(Int o) {
        return signum == o.signum && Arrays.equals(mag, o.mag);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Int o && equals(o);
    }

    @Override
    public int hashCode() {
        int result = hash;
        if (result == 0) {
            result = 31 * Arrays.hashCode(mag) + signum;
            hash = result;
        }
        return result;
    }

    /* =========================
     * sign and unit adjustments
     * =========================
     */

    public Int negate() {
        return signum == 0 ? this : new Int(-signum, mag.clone());
    }

    public Int abs() {
        return signum < 0 ? negate() : this;
    }

    /**
     * Returns {@code this + 1}. Only the trailing run of 999_999_999 limbs is rewritten,
     * which is much cheaper than {@code add(ONE)} on long numbers.
     */
    public Int increment() {
        if (signum >= 0) {
            return new Int(1, Limbs.increment(mag));
        } else { // magnitude shrinks towards zero
            return of(-1, Limbs.decrement(mag));
        }
    }

    public Int decrement() {
        if (signum > 0) {
            return of(1, Limbs.decrement(mag));
        } else { // zero becomes -1
            return new Int(-1, Limbs.increment(mag));
        }
    }

    /* ==========
     * arithmetic
     * ==========
     */

    public Int add(Int rhs) {
        if (rhs.signum == 0) {
            return this;
        } else if (signum == 0) {
            return rhs;
        }
        if (signum == rhs.signum) {
            // (-3) + (-4) = -7
            // (+3) + (+4) = +7
            return new Int(signum, Limbs.add(mag, rhs.mag));
        } else {
            // (-3) + (+4) = +1
            // (+3) + (-4) = -1
            // (-4) + (+3) = -1
            // (+4) + (-3) = +1
            return subtractForward(this, rhs, rhs.signum);
        }
    }

    public Int subtract(Int rhs) {
        if (rhs.signum == 0) {
            return this;
        } else if (signum == 0) {
            return rhs.negate();
        }
        if (signum != rhs.signum) {
            // (-3) - (+4) = -7
            // (+3) - (-4) = +7
            return new Int(signum, Limbs.add(mag, rhs.mag));
        } else {
            // (-3) - (-4) = +1
            // (+3) - (+4) = -1
            // (-4) - (-3) = -1
            // (+4) - (+3) = +1
            return subtractForward(this, rhs, -rhs.signum);
        }
    }

    // |lhs| - |rhs| with lhs's sign, or |rhs| - |lhs| with rhsSign when rhs is bigger
    private static Int subtractForward(Int lhs, Int rhs, int rhsSign) {
        int cmp = Limbs.compare(lhs.mag, rhs.mag);
        if (cmp == 0) {
            return ZERO;
        }
        return cmp > 0
                ? new Int(lhs.signum, Limbs.subtract(lhs.mag, rhs.mag))
                : new Int(rhsSign, Limbs.subtract(rhs.mag, lhs.mag));
    }

    public Int multiply(Int rhs) {
        if (signum == 0 || rhs.signum == 0) {
            return ZERO;
        }
        return new Int(signum * rhs.signum, Limbs.multiply(mag, rhs.mag));
    }

    Int multiply(int rhs) {
        if (rhs < 0 || rhs > Limbs.BASE) {
            return multiply(fromInt(rhs));
        }
        return of(signum, Limbs.multiplySmall(mag, rhs));
    }

    public static Int multiplySimple(Int lhs, Int rhs) {
        return of(lhs.signum * rhs.signum, Limbs.multiplySimple(lhs.mag, rhs.mag));
    }

    public static Int multiplyKaratsuba(Int lhs, Int rhs, int threshold) {
        if (threshold < 1) {
            throw new IllegalArgumentException("Illegal threshold: " + threshold);
        }
        return of(lhs.signum * rhs.signum, Limbs.multiplyKaratsuba(lhs.mag, rhs.mag, threshold));
    }

    /**
     * Karatsuba multiplication with the three partial products forked onto the pool,
     * down to a depth derived from the pool's parallelism.
     */
    public static Int parallelMultiply(Int lhs, Int rhs, ForkJoinPool pool) {
        return parallelMultiply(lhs, rhs, KARATSUBA_THRESHOLD, Limbs.maxDepth(pool), pool);
    }

    public static Int parallelMultiply(Int lhs, Int rhs, int threshold, int maxDepth, ForkJoinPool pool) {
        if (threshold < 1) {
            throw new IllegalArgumentException("Illegal threshold: " + threshold);
        }
        if (maxDepth < 1) {
            throw new IllegalArgumentException("Illegal maxDepth: " + maxDepth);
        }
        int[] product = Limbs.parallelMultiplyKaratsuba(lhs.mag, rhs.mag, threshold, maxDepth, pool);
        return of(lhs.signum * rhs.signum, product);
    }

    /**
     * Returns {quotient, remainder} of the truncating division.
     *
     * @throws ArithmeticException if divisor is zero
     */
    public Int[] divideAndRemainder(Int divisor) {
        if (divisor.signum == 0) {
            throw new ArithmeticException("Division by zero");
        }
        int[][] result = Limbs.divide(mag, divisor.mag);
        return new Int[] { of(signum * divisor.signum, result[0]), of(signum, result[1]) };
    }

    public Int divide(Int divisor) {
        return divideAndRemainder(divisor)[0];
    }

    public Int remainder(Int divisor) {
        return divideAndRemainder(divisor)[1];
    }

    // returns the truncated remainder of |this| / divisor, for 0 < divisor
    int remainderAbs(int divisor) {
        return Limbs.remainder(mag, divisor);
    }

    public Int floorDivide(Int divisor) {
        Int[] result = divideAndRemainder(divisor);
        return result[1].signum != 0 && result[1].signum != divisor.signum ? result[0].decrement() : result[0];
    }

    public Int floorMod(Int divisor) {
        Int rest = remainder(divisor);
        return rest.signum != 0 && rest.signum != divisor.signum ? rest.add(divisor) : rest;
    }

    /* ===================
     * extended operations
     * ===================
     */

    public Int pow(int exponent) {
        return IntMath.pow(this, exponent);
    }

    public Int pow(Int exponent) {
        return IntMath.pow(this, exponent);
    }

    /**
     * Same result as {@code pow(exponent).remainder(modulus)}, reducing after every multiplication.
     *
     * @throws IllegalArgumentException if exponent is negative
     * @throws ArithmeticException if modulus is zero
     */
    public Int modPow(Int exponent, Int modulus) {
        return IntMath.modPow(this, exponent, modulus);
    }

    public Int factorial() {
        if (signum < 0) {
            throw new IllegalArgumentException("Factorial of negative number: " + this);
        }
        if (!isInt()) {
            throw new ArithmeticException("Factorial argument out of int range: " + this);
        }
        return IntMath.factorial(toInt());
    }

    public boolean isProbablePrime() {
        return Primes.isProbablePrime(this);
    }

    /**
     * Smallest probable prime greater than this, 2 for anything below 2.
     */
    public Int nextPrime() {
        return Primes.nextPrime(this);
    }

    // integer square root, rounded down
    public Int sqrt() {
        return IntMath.sqrt(this);
    }

    public Int gcd(Int rhs) {
        return IntMath.gcd(this, rhs);
    }
}
