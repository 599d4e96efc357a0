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

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Conversion between limb arrays and their textual form in radix 2 to 36.
 *
 * Decimal is the fast path: with base 10^9 each limb is exactly 9 decimal digits.
 * Any other radix is processed in chunks of as many digits as fit below 10^9,
 * so one limb-wide multiply-add (parse) or division (render) handles a whole chunk.
 */
final class Radix {

    static final int MIN_RADIX = 2;
    static final int MAX_RADIX = 36;

    private static final char[] DIGITS = "0123456789abcdefghijklmnopqrstuvwxyz".toCharArray();

    // CHUNK_POWER[radix] == radix ^ CHUNK_DIGITS[radix] <= BASE
    private static final int[] CHUNK_DIGITS = new int[MAX_RADIX + 1];
    private static final int[] CHUNK_POWER = new int[MAX_RADIX + 1];

    static {
        for (int radix = MIN_RADIX; radix <= MAX_RADIX; radix++) {
            int digits = 0;
            long power = 1;
            while (power * radix <= Limbs.BASE) {
                power *= radix;
                digits++;
            }
            CHUNK_DIGITS[radix] = digits;
            CHUNK_POWER[radix] = (int) power;
        }
    }

    private Radix() {
    }

    static void checkRadix(int radix) {
        if (radix < MIN_RADIX || radix > MAX_RADIX) {
            throw new NumberFormatException("Radix out of range [" + MIN_RADIX + ", " + MAX_RADIX + "]: " + radix);
        }
    }

    /* =======
     * parsing
     * =======
     */

    /**
     * Parses an optionally signed number. Radix 0 detects a "0x", "0o" or "0b" prefix
     * and falls back to decimal, where leading zeros are only allowed for zero itself.
     * With radix 16, 8 or 2 the matching prefix is optional.
     */
    static Int parse(CharSequence str, int fromIndex, int toIndex, int radix) {
        Objects.checkFromToIndex(fromIndex, toIndex, str.length());
        if (radix != 0) {
            checkRadix(radix);
        }
        if (fromIndex >= toIndex) {
            throw new NumberFormatException("Empty input string");
        }

        char c = str.charAt(fromIndex);
        boolean negative = false;
        if (c == '-') {
            negative = true;
            fromIndex++;
        } else if (c == '+') {
            fromIndex++;
        }

        int prefixRadix = prefixRadix(str, fromIndex, toIndex);
        if (prefixRadix != 0 && (radix == 0 || radix == prefixRadix)) {
            radix = prefixRadix;
            fromIndex += 2;
        } else if (radix == 0) {
            radix = 10;
            if (fromIndex < toIndex && str.charAt(fromIndex) == '0' && hasNonZeroDigit(str, fromIndex, toIndex)) {
                throw new NumberFormatException("Leading zeros in decimal number with radix 0: " + str);
            }
        }

        while (fromIndex < toIndex - 1 && str.charAt(fromIndex) == '0') {
            fromIndex++;
        }

        if (fromIndex == toIndex) {
            throw new NumberFormatException("No digits in input string");
        }

        int[] magnitude = radix == 10
                ? parseDecimal(str, fromIndex, toIndex)
                : parseRadix(str, fromIndex, toIndex, radix);

        return Int.of(negative ? -1 : 1, magnitude);
    }

    private static boolean hasNonZeroDigit(CharSequence str, int fromIndex, int toIndex) {
        for (int i = fromIndex; i < toIndex; i++) {
            char c = str.charAt(i);
            if (c >= '1' && c <= '9') {
                return true;
            }
        }
        return false;
    }

    private static int prefixRadix(CharSequence str, int fromIndex, int toIndex) {
        if (toIndex - fromIndex <= 2 || str.charAt(fromIndex) != '0') {
            return 0;
        }
        return switch (str.charAt(fromIndex + 1)) {
            case 'x', 'X' -> 16;
            case 'o', 'O' -> 8;
            case 'b', 'B' -> 2;
            default -> 0;
        };
    }

    private static int[] parseDecimal(CharSequence str, int fromIndex, int toIndex) {
        int digits = toIndex - fromIndex;
        int[] result = new int[(digits + Limbs.SIZE - 1) / Limbs.SIZE];

        for (int i = toIndex, j = 0; i > fromIndex; j++) {
            int end = i;
            i = Math.max(fromIndex, i - Limbs.SIZE);
            result[j] = parseChunk(str, i, end, 10);
        }

        return Limbs.trim(result);
    }

    private static int[] parseRadix(CharSequence str, int fromIndex, int toIndex, int radix) {
        int digits = toIndex - fromIndex;
        int chunk = CHUNK_DIGITS[radix];
        int power = CHUNK_POWER[radix];
        int[] result = new int[(int) (digits * Math.log(radix) / Math.log(Limbs.BASE)) + 2];
        int length = 0;

        // the first chunk takes the odd digits, so that all others are full
        int first = digits % chunk == 0 ? chunk : digits % chunk;
        for (int i = fromIndex, end = fromIndex + first; i < toIndex; i = end, end += chunk) {
            length = Limbs.multiplyAddInPlace(result, length, power, parseChunk(str, i, end, radix));
        }

        return Limbs.trim(result, length);
    }

    private static int parseChunk(CharSequence str, int fromIndex, int toIndex, int radix) {
        assert fromIndex < toIndex;
        int result = 0;

        for (int i = fromIndex; i < toIndex; i++) {
            char c = str.charAt(i);
            int digit = digit(c);
            if (digit < 0 || digit >= radix) {
                throw new NumberFormatException("Non-digit character '" + c + "' at index " + i + " for radix " + radix);
            }
            result = result * radix + digit;
        }

        return result;
    }

    static int digit(char c) {
        if ('0' <= c && c <= '9') {
            return c - '0';
        } else if ('a' <= c && c <= 'z') {
            return c - 'a' + 10;
        } else if ('A' <= c && c <= 'Z') {
            return c - 'A' + 10;
        }
        return -1;
    }

    /* =========
     * rendering
     * =========
     */

    static String render(boolean negative, int[] magnitude, int radix) {
        checkRadix(radix);
        return radix == 10
                ? new String(toDecimalBytes(negative, magnitude), StandardCharsets.ISO_8859_1)
                : renderRadix(negative, magnitude, radix);
    }

    static byte[] toDecimalBytes(boolean negative, int[] magnitude) {
        int sign = negative ? 1 : 0;
        byte[] dest = new byte[sign + Limbs.countDigits(magnitude)];
        int right = dest.length;

        // least significant limb goes to the right
        for (int limb : magnitude) {
            int left = Math.max(sign, right - Limbs.SIZE);
            formatDecimal(dest, limb, left, right);
            right = left;
        }
        if (magnitude.length == 0) {
            dest[0] = '0';
        }
        if (negative) {
            dest[0] = '-';
        }

        return dest;
    }

    private static String renderRadix(boolean negative, int[] magnitude, int radix) {
        if (magnitude.length == 0) {
            return "0";
        }
        int chunk = CHUNK_DIGITS[radix];
        int power = CHUNK_POWER[radix];
        int[] work = magnitude.clone(); // divideInPlace() is destructive
        int length = work.length;
        char[] dest = new char[1 + 30 * length]; // a limb has less than 2^30, i.e. at most 30 digits in any radix
        int pos = dest.length;

        while (length > 0) {
            int rest = Limbs.divideInPlace(work, length, power);
            while (length > 0 && work[length - 1] == 0) {
                --length;
            }
            // all but the most significant chunk are zero-padded
            for (int k = 0; k < chunk && (length > 0 || rest > 0); k++) {
                dest[--pos] = DIGITS[rest % radix];
                rest /= radix;
            }
        }
        if (negative) {
            dest[--pos] = '-';
        }

        return new String(dest, pos, dest.length - pos);
    }

    // writes n zero-padded into dest[left..right)
    static void formatDecimal(byte[] dest, int n, int left, int right) {
        for (int i = right - 1; i >= left; --i) {
            if (n == 0) {
                dest[i] = '0';
            } else {
                int div10 = div10(n);
                dest[i] = (byte) (n - mul10(div10) + '0');
                n = div10;
            }
        }
    }

    static int decimalLength(int n) {
        assert 0 <= n && n < Limbs.BASE;
        return n < 100_000 ?         n <        100 ? n <        10 ? 1 : 2 : n <       1_000 ? 3
             : n <  10_000 ? 4 : 5 : n < 10_000_000 ? n < 1_000_000 ? 6 : 7 : n < 100_000_000 ? 8 : 9;
    }

    // "magic number" reciprocal, the JIT doesn't seem to do this well
    private static int div10(int input) {
        assert input >> 31 == 0; // so we don't need the subtraction part
        return (int) ((input * 0x66666667L) >> 34);
    }

    private static int mul10(int input) {
        return (input + (input << 2)) << 1;
    }
}
