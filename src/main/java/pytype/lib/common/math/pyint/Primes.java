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

/**
 * Primality testing: trial division by the primes below 1000,
 * then Miller-Rabin with a fixed set of witnesses.
 *
 * The 13 witnesses 2..41 make the test deterministic below 3.3 * 10^24;
 * above that a composite passing all of them is possible in theory but not known to occur in practice.
 */
final class Primes {

    static final int[] WITNESSES = { 2, 3, 5, 7, 11, 13, 17, 19, 23, 29, 31, 37, 41 };

    private static final int SIEVE_LIMIT = 1000;
    private static final int[] SMALL_PRIMES = sieve(SIEVE_LIMIT);

    private Primes() {
    }

    private static int[] sieve(int limit) {
        boolean[] composite = new boolean[limit];
        int[] primes = new int[limit];
        int count = 0;
        for (int i = 2; i < limit; i++) {
            if (!composite[i]) {
                primes[count++] = i;
                for (int j = i * i; j < limit; j += i) {
                    composite[j] = true;
                }
            }
        }
        return Arrays.copyOf(primes, count);
    }

    static boolean isProbablePrime(Int n) {
        if (n.compareTo(2) < 0) {
            return false;
        }
        if (n.compareTo(SIEVE_LIMIT) < 0) {
            return Arrays.binarySearch(SMALL_PRIMES, n.toInt()) >= 0;
        }
        for (int p : SMALL_PRIMES) {
            if (n.remainderAbs(p) == 0) {
                return false;
            }
        }
        return millerRabin(n);
    }

    // requires n odd and greater than every witness
    private static boolean millerRabin(Int n) {
        var nMinusOne = n.decrement();
        var d = nMinusOne;
        int s = 0;
        while (d.isEven()) {
            d = d.divide(Int.TWO);
            s++;
        }

        witness:
        for (int a : WITNESSES) {
            var x = Int.fromInt(a).modPow(d, n);
            if (x.equals(Int.ONE) || x.equals(nMinusOne)) {
                continue;
            }
            for (int r = 1; r < s; r++) {
                x = x.multiply(x).remainder(n);
                if (x.equals(nMinusOne)) {
                    continue witness;
                }
            }
            return false;
        }
        return true;
    }

    // scans odd candidates upwards, the scan has no hard bound but primes are dense enough
    static Int nextPrime(Int n) {
        if (n.compareTo(2) < 0) {
            return Int.TWO;
        }
        var candidate = n.increment();
        if (candidate.isEven()) {
            candidate = candidate.increment();
        }
        while (!isProbablePrime(candidate)) {
            candidate = candidate.add(Int.TWO);
        }
        return candidate;
    }
}
