package pytype.lib.common.math.pyint;

import java.math.BigInteger;
import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Threads;
import org.openjdk.jmh.annotations.Warmup;

/**
 * Counting loops over a large value, where only the lowest limbs change.
 */
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@BenchmarkMode(Mode.AverageTime)
@Measurement(iterations = 3, time = 3, timeUnit = TimeUnit.SECONDS)
@Warmup(iterations = 3, time = 3, timeUnit = TimeUnit.SECONDS)
@Threads(1)
@Fork(1)
@State(Scope.Benchmark)
public class IntIncrementBenchmark {

    private static final int STEPS = 1_000;

    @Param({"20", "1000", "10000"})
    public int digits;

    private BigInteger bigInteger;
    private Int value;

    @Setup
    public void setup() {
        value = Int.random(digits);
        bigInteger = new BigInteger(value.toString());
    }

    @Benchmark
    public BigInteger incrementJdkBigInteger() {
        var x = bigInteger;
        for (int i = 0; i < STEPS; i++) {
            x = x.add(BigInteger.ONE);
        }
        return x;
    }

    @Benchmark
    public Int incrementInt() {
        var x = value;
        for (int i = 0; i < STEPS; i++) {
            x = x.increment();
        }
        return x;
    }

    @Benchmark
    public Int addOneInt() {
        var x = value;
        for (int i = 0; i < STEPS; i++) {
            x = x.add(Int.ONE);
        }
        return x;
    }

    @Benchmark
    public Int decrementInt() {
        var x = value;
        for (int i = 0; i < STEPS; i++) {
            x = x.decrement();
        }
        return x;
    }
}
