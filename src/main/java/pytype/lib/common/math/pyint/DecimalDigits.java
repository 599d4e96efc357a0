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

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;

/**
 * Decimal digit streaming.
 * Digits travel as unsigned 8-bit ASCII bytes, without the sign.
 */
public final class DecimalDigits {

    private DecimalDigits() {
    }

    public interface DigitSink {

        boolean accept(char c);
    }

    public interface DigitArraySink {

        /**
         * Receives the next digits. Returning false stops the stream.
         */
        boolean accept(byte[] array, int offset, int length);

        static DigitArraySink of(DigitSink sink) {
            return (array, offset, length) -> {
                for (int i = offset; i < offset + length; i++) {
                    if (!sink.accept((char) array[i])) {
                        return false;
                    }
                }
                return true;
            };
        }

        static DigitArraySink of(OutputStream out) {
            return (array, offset, length) -> {
                try {
                    out.write(array, offset, length);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
                return true;
            };
        }
    }

    public interface DigitStreamable {

        /**
         * Streams the decimal digits, most significant first.
         * Returns false if the sink stopped the stream early.
         */
        boolean stream(DigitArraySink sink);

        int countDigits();

        default boolean isNegative() {
            return false;
        }
    }
}
