package pytype.lib.common.math.pyint;

import java.math.BigInteger;
import java.util.concurrent.TimeUnit;
import java.util.function.BinaryOperator;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Threads;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

@OutputTimeUnit(TimeUnit.MICROSECONDS)
@BenchmarkMode(Mode.AverageTime)
@Measurement(iterations = 3, time = 3, timeUnit = TimeUnit.SECONDS)
@Warmup(iterations = 3, time = 3, timeUnit = TimeUnit.SECONDS)
@Threads(1)
@Fork(1)
@State(Scope.Benchmark)
public class IntArithmeticBenchmark {

    private static class Args {

        private static final String[] STRING = { // lhs > rhs
                "58903457894375873489578943534", "589034583485345",
                "58903457894375873489578943534432949234823472374263462343526", "589034583485345492349238423842374237462346",
                "5".repeat(10_000), "6".repeat(100),
                "5".repeat(100_000), "6".repeat(50_000),
        };

        private static final BigInteger[] BIG_INTEGER = IntMultiplyBenchmark.parse(STRING, BigInteger::new, BigInteger.class);
        private static final Int[] INT = IntMultiplyBenchmark.parse(STRING, Int::fromString, Int.class);
    }

    @Param({"false", "true"})
    public boolean reversed;

    @Benchmark
    public void addJdkBigInteger(Blackhole blackhole) {
        perform(Args.BIG_INTEGER, BigInteger::add, blackhole);
    }

    @Benchmark
    public void subtractJdkBigInteger(Blackhole blackhole) {
        perform(Args.BIG_INTEGER, BigInteger::subtract, blackhole);
    }

    @Benchmark
    public void divideJdkBigInteger(Blackhole blackhole) {
        perform(Args.BIG_INTEGER, BigInteger::divide, blackhole);
    }

    @Benchmark
    public void addInt(Blackhole blackhole) {
        perform(Args.INT, Int::add, blackhole);
    }

    @Benchmark
    public void subtractInt(Blackhole blackhole) {
        perform(Args.INT, Int::subtract, blackhole);
    }

    @Benchmark
    public void divideInt(Blackhole blackhole) {
        perform(Args.INT, Int::divide, blackhole);
    }

    private <T> void perform(T[] args, BinaryOperator<T> operator, Blackhole blackhole) {
        for (int j = 0; j < args.length;) {
            T lhs = args[j++];
            T rhs = args[j++];
            blackhole.consume(reversed ? operator.apply(rhs, lhs) : operator.apply(lhs, rhs));
        }
    }
}
