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
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinTask;
import java.util.concurrent.RecursiveTask;
import java.util.function.Supplier;

/**
 * Magnitude kernels over limb arrays in base 10^9, least significant limb first.
 *
 * Unless noted otherwise, each array passed in or returned is canonical:
 * it has no most significant zero limbs, and zero is the empty array.
 * Input arrays are never modified. Returned arrays are fresh, except that
 * trim() hands back its argument when there is nothing to strip,
 * so each {@link Int} exclusively owns its limbs.
 *
 * We can safely perform "999_999_999 + 999_999_999" without int overflow.
 * We can safely perform "999_999_999 * 999_999_999" without long overflow.
 */
final class Limbs {

    static final int BASE = 1_000_000_000;
    static final long BASE1 = BASE;
    static final int SIZE = 9;
    static final int KARATSUBA_THRESHOLD = 40;
    static final int[] EMPTY = {};

    private Limbs() {
    }

    /* =============
     * normalization
     * =============
     */

    static int[] trim(int[] a) {
        return trim(a, a.length);
    }

    // strips most significant zero limbs of the first `length` limbs
    static int[] trim(int[] a, int length) {
        while (length > 0 && a[length - 1] == 0) {
            --length;
        }
        return length == a.length ? a : length == 0 ? EMPTY : Arrays.copyOf(a, length);
    }

    static boolean isCanonical(int[] a) {
        for (int limb : a) {
            if (limb < 0 || limb >= BASE) {
                return false;
            }
        }
        return a.length == 0 || a[a.length - 1] != 0;
    }

    // treats value as unsigned, which makes -Long.MIN_VALUE work
    static int[] fromUnsignedLong(long value) {
        if (value == 0) {
            return EMPTY;
        }
        long high = Long.divideUnsigned(value, BASE1);
        int low = (int) Long.remainderUnsigned(value, BASE1);
        if (high == 0) {
            return new int[] { low };
        } else if (high < BASE1) {
            return new int[] { low, (int) high };
        } else {
            return new int[] { low, (int) (high % BASE1), (int) (high / BASE1) };
        }
    }

    // caller must make sure the value fits, result is taken as unsigned
    static long toUnsignedLong(int[] a) {
        assert a.length <= 3;
        long result = 0;
        for (int i = a.length - 1; i >= 0; --i) {
            result = result * BASE1 + a[i];
        }
        return result;
    }

    static int compare(int[] a, int[] b) {
        if (a == b) {
            return 0;
        }
        int cmp = Integer.compare(a.length, b.length);
        if (cmp != 0) {
            return cmp;
        }
        for (int i = a.length - 1; i >= 0; --i) {
            cmp = Integer.compare(a[i], b[i]);
            if (cmp != 0) {
                return cmp;
            }
        }
        return 0;
    }

    static boolean isEven(int[] a) {
        return a.length == 0 || (a[0] & 1) == 0; // BASE is even
    }

    static int countDigits(int[] a) {
        return a.length == 0 ? 1 : Radix.decimalLength(a[a.length - 1]) + SIZE * (a.length - 1);
    }

    /* ========================
     * addition and subtraction
     * ========================
     */

    static int[] add(int[] a, int[] b) {
        if (a.length < b.length) {
            int[] tmp = a;
            a = b;
            b = tmp;
        }
        if (b.length == 0) {
            return a.clone();
        }

        int[] result = new int[a.length + 1]; // always need one more space for 999_999_999 + 1 case!
        int accumulator = 0;
        int i = 0;

        for (; i < b.length; i++) {
            accumulator = a[i] + b[i] + AddWithCarry.carry(accumulator);
            result[i] = AddWithCarry.value(accumulator);
        }
        for (; i < a.length; i++) {
            accumulator = a[i] + AddWithCarry.carry(accumulator);
            result[i] = AddWithCarry.value(accumulator);
        }
        result[i] = AddWithCarry.carry(accumulator);

        return trim(result);
    }

    // requires a >= b
    static int[] subtract(int[] a, int[] b) {
        assert compare(a, b) >= 0;
        if (b.length == 0) {
            return a.clone();
        }

        int[] result = new int[a.length];
        int accumulator = 0;
        int i = 0;

        for (; i < b.length; i++) {
            accumulator = a[i] - b[i] + SubtractWithCarry.carry(accumulator);
            result[i] = SubtractWithCarry.value(accumulator);
        }
        for (; i < a.length; i++) {
            accumulator = a[i] + SubtractWithCarry.carry(accumulator);
            result[i] = SubtractWithCarry.value(accumulator);
        }

        assert SubtractWithCarry.carry(accumulator) == 0;
        return trim(result);
    }

    // adds value * BASE^shift into result, which must be large enough to hold the sum
    private static void addInPlace(int[] result, int[] value, int shift) {
        int accumulator = 0;
        int k = shift;

        for (int i = 0; i < value.length; i++, k++) {
            accumulator = result[k] + value[i] + AddWithCarry.carry(accumulator);
            result[k] = AddWithCarry.value(accumulator);
        }
        for (; AddWithCarry.carry(accumulator) > 0; k++) {
            accumulator = result[k] + 1;
            result[k] = AddWithCarry.value(accumulator);
        }
    }

    /* ============================
     * increment and decrement by 1
     * ============================
     */

    // only the trailing run of 999_999_999 limbs is touched
    static int[] increment(int[] a) {
        int i = 0;
        while (i < a.length && a[i] == BASE - 1) {
            i++;
        }
        int[] result = Arrays.copyOf(a, i < a.length ? a.length : a.length + 1);
        Arrays.fill(result, 0, i, 0);
        result[i]++;
        return result;
    }

    // only the trailing run of zero limbs is touched, requires a > 0
    static int[] decrement(int[] a) {
        assert a.length > 0;
        int i = 0;
        while (a[i] == 0) {
            i++;
        }
        int[] result = a.clone();
        Arrays.fill(result, 0, i, BASE - 1);
        result[i]--;
        return i == result.length - 1 ? trim(result) : result;
    }

    /* ==============
     * multiplication
     * ==============
     */

    // requires 0 <= m <= BASE
    static int[] multiplySmall(int[] a, int m) {
        assert 0 <= m && m <= BASE;
        if (a.length == 0 || m == 0) {
            return EMPTY;
        }
        int[] result = new int[a.length + 1];
        long carry = 0;

        for (int i = 0; i < a.length; i++) {
            long product = (long) a[i] * m + carry;
            result[i] = (int) (product % BASE1);
            carry = product / BASE1;
        }
        result[a.length] = (int) carry;

        return trim(result);
    }

    /*
     * a[0..length) = a * m + add, growing into a[length] if needed.
     * Returns the new length. The array must have room for one more limb.
     */
    static int multiplyAddInPlace(int[] a, int length, int m, int add) {
        assert 0 < m && m <= BASE;
        long carry = add;

        for (int i = 0; i < length; i++) {
            long product = (long) a[i] * m + carry;
            a[i] = (int) (product % BASE1);
            carry = product / BASE1;
        }
        if (carry > 0) {
            assert carry < BASE1;
            a[length++] = (int) carry;
        }
        return length;
    }

    static int[] multiply(int[] a, int[] b) {
        return multiplyKaratsuba(a, b, KARATSUBA_THRESHOLD);
    }

    static int[] multiplySimple(int[] a, int[] b) {
        if (a.length == 0 || b.length == 0) {
            return EMPTY;
        }
        if (a.length == 1 && b.length == 1) {
            return fromUnsignedLong((long) a[0] * b[0]); // we must multiply in long, not int.
        }
        int[] result = new int[a.length + b.length];
        if (a.length >= b.length) {
            // the inner loop runs over the longer operand
            multiplyCore(result, a, b);
        } else {
            multiplyCore(result, b, a);
        }
        return trim(result);
    }

    // "grade school" multiplication algorithm aka "long multiplication"
    private static void multiplyCore(int[] result, int[] lhs, int[] rhs) {
        for (int i = 0; i < rhs.length; i++) {
            long rhsValue = rhs[i]; // force multiplication in long
            if (rhsValue == 0) {
                continue;
            }
            long carry = 0;
            int k = i;

            for (int j = 0; j < lhs.length; j++, k++) {
                long product = rhsValue * lhs[j] + result[k] + carry;
                result[k] = (int) (product % BASE1);
                carry = product / BASE1;
            }

            assert result[k] == 0;
            result[k] = (int) carry;
        }
    }

    static int[] multiplyKaratsuba(int[] a, int[] b, int threshold) {
        assert threshold >= 1;
        if (a.length <= threshold || b.length <= threshold) {
            return multiplySimple(a, b);
        }

        int half = (Math.max(a.length, b.length) + 1) >> 1;
        int[] a0 = lowerPart(a, half);
        int[] a1 = upperPart(a, half);
        int[] b0 = lowerPart(b, half);
        int[] b1 = upperPart(b, half);

        int[] z0 = multiplyKaratsuba(a0, b0, threshold);
        int[] z2 = multiplyKaratsuba(a1, b1, threshold);
        int[] z1 = multiplyKaratsuba(add(a0, a1), add(b0, b1), threshold);

        return combineKaratsuba(z0, z1, z2, half, a.length + b.length);
    }

    static int[] parallelMultiplyKaratsuba(int[] a, int[] b, int threshold, int maxDepth, ForkJoinPool pool) {
        assert threshold >= 1 && maxDepth >= 1;
        return parallelMultiplyKaratsuba(0, a, b, threshold, maxDepth, pool);
    }

    private static int[] parallelMultiplyKaratsuba(int depth, int[] a, int[] b, int threshold, int maxDepth, ForkJoinPool pool) {
        if (a.length <= threshold || b.length <= threshold) {
            return multiplySimple(a, b);
        } else if (depth >= maxDepth) {
            return multiplyKaratsuba(a, b, threshold);
        }

        int half = (Math.max(a.length, b.length) + 1) >> 1;
        int[] a0 = lowerPart(a, half);
        int[] a1 = upperPart(a, half);
        int[] b0 = lowerPart(b, half);
        int[] b1 = upperPart(b, half);

        var _z0 = submit(pool, () -> parallelMultiplyKaratsuba(depth + 1, a0, b0, threshold, maxDepth, pool));
        var _z2 = submit(pool, () -> parallelMultiplyKaratsuba(depth + 1, a1, b1, threshold, maxDepth, pool));
        var _z1 = submit(pool, () -> parallelMultiplyKaratsuba(depth + 1, add(a0, a1), add(b0, b1), threshold, maxDepth, pool));

        return combineKaratsuba(_z0.join(), _z1.join(), _z2.join(), half, a.length + b.length);
    }

    /*
     * z1 enters as (a0 + a1) * (b0 + b1), so `z1 -= (z0 + z2)` gives a0*b1 + a1*b0.
     * Then add up z0, z1 expanded to the half power and z2 expanded to the full power.
     */
    private static int[] combineKaratsuba(int[] z0, int[] z1, int[] z2, int half, int length) {
        z1 = subtract(subtract(z1, z0), z2);
        int[] result = new int[length];
        addInPlace(result, z0, 0);
        addInPlace(result, z1, half);
        addInPlace(result, z2, half << 1);
        return trim(result);
    }

    private static int[] lowerPart(int[] a, int half) {
        return a.length <= half ? a : trim(Arrays.copyOf(a, half));
    }

    private static int[] upperPart(int[] a, int half) {
        return a.length <= half ? EMPTY : Arrays.copyOfRange(a, half, a.length);
    }

    @SuppressWarnings("serial")
    private static ForkJoinTask<int[]> submit(ForkJoinPool pool, Supplier<int[]> fn) {
        return pool.submit(new RecursiveTask<int[]>() {

            @Override
            protected int[] compute() {
                return fn.get();
            }
        });
    }

    static int maxDepth(ForkJoinPool pool) {
        int parallelism = pool.getParallelism();
        return (32 - Integer.numberOfLeadingZeros(parallelism)) << 1; // e.g. 4=>6, 8=>8, 16=>10
    }

    /* ========
     * division
     * ========
     */

    /*
     * Divides a[0..length) in-place, returns the remainder.
     * Note: divisor cannot be long, otherwise the "carry * BASE1" multiplication might overflow.
     */
    static int divideInPlace(int[] a, int length, int divisor) {
        assert divisor > 0;
        long carry = 0;

        for (int i = length - 1; i >= 0; --i) {
            long value = a[i] + carry * BASE1;
            a[i] = (int) (value / divisor);
            carry = value % divisor;
        }

        return (int) carry;
    }

    static int remainder(int[] a, int divisor) {
        assert divisor > 0;
        long carry = 0;

        for (int i = a.length - 1; i >= 0; --i) {
            carry = (a[i] + carry * BASE1) % divisor;
        }

        return (int) carry;
    }

    /**
     * Returns {quotient, remainder} with a = quotient * b + remainder and remainder < b.
     *
     * Multi-limb divisors use Knuth's Algorithm D (TAOCP Vol. 2, 4.3.1),
     * normalized by multiplying both operands with BASE / (b[top] + 1).
     */
    static int[][] divide(int[] a, int[] b) {
        if (b.length == 0) {
            throw new ArithmeticException("Division by zero");
        }
        if (compare(a, b) < 0) {
            return new int[][] { EMPTY, a.clone() };
        }
        if (b.length == 1) {
            int[] quotient = a.clone();
            int remainder = divideInPlace(quotient, quotient.length, b[0]);
            return new int[][] { trim(quotient), remainder == 0 ? EMPTY : new int[] { remainder } };
        }

        int n = b.length;
        int m = a.length - n;
        int d = (int) (BASE1 / (b[n - 1] + 1L));
        int[] u = Arrays.copyOf(multiplySmall(a, d), a.length + 1);
        int[] v = multiplySmall(b, d);
        assert v.length == n && v[n - 1] >= BASE / 2;

        int[] quotient = new int[m + 1];
        long vTop = v[n - 1];
        long vNext = v[n - 2];

        for (int j = m; j >= 0; --j) {
            long numerator = u[j + n] * BASE1 + u[j + n - 1];
            long qhat = numerator / vTop;
            long rhat = numerator % vTop;

            while (qhat >= BASE1 || qhat * vNext > rhat * BASE1 + u[j + n - 2]) {
                qhat--;
                rhat += vTop;
                if (rhat >= BASE1) {
                    break;
                }
            }

            // u[j..j+n] -= qhat * v
            long carry = 0;
            int accumulator = 0;
            for (int i = 0; i < n; i++) {
                long product = qhat * v[i] + carry;
                carry = product / BASE1;
                accumulator = u[i + j] - (int) (product % BASE1) + SubtractWithCarry.carry(accumulator);
                u[i + j] = SubtractWithCarry.value(accumulator);
            }
            long top = u[j + n] - carry + SubtractWithCarry.carry(accumulator);

            if (top < 0) {
                // qhat was one too large, add v back
                qhat--;
                accumulator = 0;
                for (int i = 0; i < n; i++) {
                    accumulator = u[i + j] + v[i] + AddWithCarry.carry(accumulator);
                    u[i + j] = AddWithCarry.value(accumulator);
                }
                top += AddWithCarry.carry(accumulator);
            }

            assert 0 <= top && top < BASE1 : top;
            u[j + n] = (int) top;
            quotient[j] = (int) qhat;
        }

        int rest = divideInPlace(u, n, d); // undo normalization
        assert rest == 0;
        return new int[][] { trim(quotient), trim(u, n) };
    }

    private static class AddWithCarry {

        static int value(int accumulator) {
            return accumulator < BASE ? accumulator : accumulator - BASE;
        }

        static int carry(int accumulator) {
            return accumulator < BASE ? 0 : 1;
        }
    }

    private static class SubtractWithCarry {

        static int value(int accumulator) {
            return accumulator >= 0 ? accumulator : accumulator + BASE;
        }

        static int carry(int accumulator) {
            return accumulator >= 0 ? 0 : -1;
        }
    }
}
