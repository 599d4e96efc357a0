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

import java.util.Random;

/**
 * Operations composed from the core arithmetic of {@link Int}.
 */
final class IntMath {

    // POWERS_OF_TEN[i] == 10^i, up to BASE
    private static final int[] POWERS_OF_TEN = {
            1, 10, 100, 1_000, 10_000, 100_000, 1_000_000, 10_000_000, 100_000_000, 1_000_000_000,
    };

    private static final Int FOUR = Int.fromInt(4);

    // below this range width the factorial product tree multiplies linearly
    private static final int PRODUCT_LEAF = 16;

    private IntMath() {
    }

    static Int pow(Int base, int exponent) {
        if (exponent < 0) {
            throw new IllegalArgumentException("Negative exponent: " + exponent);
        }
        var result = Int.ONE;

        while (exponent > 0) {
            if ((exponent & 1) != 0) {
                result = result.multiply(base);
            }
            exponent >>= 1;
            if (exponent > 0) {
                base = base.multiply(base); // square
            }
        }

        return result;
    }

    static Int pow(Int base, Int exponent) {
        if (exponent.isNegative()) {
            throw new IllegalArgumentException("Negative exponent: " + exponent);
        }
        // the only bases where a huge exponent still yields a representable result
        if (base.isZero()) {
            return exponent.isZero() ? Int.ONE : Int.ZERO;
        } else if (base.compareToAbs(Int.ONE) == 0) {
            return base.isNegative() && exponent.isOdd() ? Int.MINUS_ONE : Int.ONE;
        }
        if (!exponent.isInt()) {
            throw new ArithmeticException("Exponent out of int range: " + exponent);
        }
        return pow(base, exponent.toInt());
    }

    /*
     * Works on |base| and |modulus|, then applies the sign of base^exponent,
     * which is what the truncating remainder of the full power would carry.
     */
    static Int modPow(Int base, Int exponent, Int modulus) {
        if (exponent.isNegative()) {
            throw new IllegalArgumentException("Negative exponent: " + exponent);
        }
        if (modulus.isZero()) {
            throw new ArithmeticException("Division by zero");
        }
        var m = modulus.abs();
        if (m.equals(Int.ONE)) {
            return Int.ZERO;
        }

        var result = Int.ONE;
        var square = base.abs().remainder(m);
        var e = exponent;

        while (!e.isZero()) {
            if (e.isOdd()) {
                result = result.multiply(square).remainder(m);
            }
            e = e.divide(Int.TWO);
            if (!e.isZero()) {
                square = square.multiply(square).remainder(m);
            }
        }

        return base.isNegative() && exponent.isOdd() ? result.negate() : result;
    }

    static Int factorial(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("Factorial of negative number: " + n);
        }
        return n < 2 ? Int.ONE : product(2, n);
    }

    // product of all integers in [from, to], split pairwise so both halves stay balanced
    private static Int product(int from, int to) {
        if (to - from < PRODUCT_LEAF) {
            var result = Int.fromInt(from);
            for (int i = from + 1; i <= to && i > 0; i++) { // i > 0 guards against overflow at Integer.MAX_VALUE
                result = result.multiply(i);
            }
            return result;
        }
        int middle = (from + to) >>> 1;
        return product(from, middle).multiply(product(middle + 1, to));
    }

    static Int random(int digits, Random rnd) {
        if (digits < 1) {
            throw new IllegalArgumentException("Digit count must be at least 1: " + digits);
        }
        int length = (digits + Limbs.SIZE - 1) / Limbs.SIZE;
        int topDigits = digits - Limbs.SIZE * (length - 1);
        int[] mag = new int[length];

        for (int i = 0; i < length - 1; i++) {
            mag[i] = rnd.nextInt(Limbs.BASE);
        }
        int low = POWERS_OF_TEN[topDigits - 1]; // leading digit must not be zero
        mag[length - 1] = low + rnd.nextInt(POWERS_OF_TEN[topDigits] - low);

        return Int.of(1, mag);
    }

    static Int hyperoperation(int n, Int a, Int b) {
        if (n < 1) {
            throw new IllegalArgumentException("Hyperoperation level must be at least 1: " + n);
        }
        if (b.isNegative()) {
            throw new IllegalArgumentException("Negative hyperoperation argument: " + b);
        }
        if (n == 1) {
            return a.add(b);
        } else if (n == 2) {
            return a.multiply(b);
        } else if (n == 3) {
            return pow(a, b);
        }

        // from here on H(n, a, b) = H(n-1, a, H(n, a, b-1)) with H(n, a, 0) = 1
        if (b.isZero()) {
            return Int.ONE;
        } else if (b.equals(Int.ONE) || a.equals(Int.ONE)) {
            return a;
        } else if (a.isZero()) {
            return b.isEven() ? Int.ONE : Int.ZERO; // alternates between 0^1 and 0^0
        } else if (a.isNegative()) {
            // H(4, a, 2) = a^a already needs a negative exponent
            throw new IllegalArgumentException("Negative hyperoperation base above level 3: " + a);
        } else if (a.equals(Int.TWO) && b.equals(Int.TWO)) {
            return FOUR; // on every level
        }

        // a, b >= 2 and not both 2: H(6, 2, 3) = H(4, 2, 65536) is already far beyond any memory
        if (n > 5) {
            throw new ArithmeticException("Hyperoperation result too large: H" + n + "(" + a + ", " + b + ")");
        }

        // level 4 stops within a few rounds, once pow() sees an exponent out of int range
        var result = a;
        for (var i = Int.ONE; i.compareTo(b) < 0; i = i.increment()) {
            result = n == 4 ? pow(a, result) : hyperoperation(4, a, result);
        }
        return result;
    }

    // Newton's iteration, starting above the root at 10^ceil(digits/2)
    static Int sqrt(Int n) {
        if (n.isNegative()) {
            throw new IllegalArgumentException("Square root of negative number: " + n);
        }
        if (n.isZero()) {
            return Int.ZERO;
        }
        var x = pow(Int.TEN, (n.countDigits() + 1) >> 1);
        while (true) {
            var y = x.add(n.divide(x)).divide(Int.TWO);
            if (y.compareTo(x) >= 0) {
                return x;
            }
            x = y;
        }
    }

    static Int gcd(Int a, Int b) {
        a = a.abs();
        b = b.abs();
        while (!b.isZero()) {
            var rest = a.remainder(b);
            a = b;
            b = rest;
        }
        return a;
    }
}
