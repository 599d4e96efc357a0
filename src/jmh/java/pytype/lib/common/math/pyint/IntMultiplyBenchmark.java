package pytype.lib.common.math.pyint;

import java.lang.reflect.Array;
import java.math.BigInteger;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.function.BinaryOperator;
import java.util.function.Function;

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
import org.openjdk.jmh.annotations.TearDown;
import org.openjdk.jmh.annotations.Threads;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

@OutputTimeUnit(TimeUnit.MILLISECONDS)
@BenchmarkMode({Mode.AverageTime, Mode.SingleShotTime})
@Measurement(iterations = 3, time = 3, timeUnit = TimeUnit.SECONDS)
@Warmup(iterations = 3, time = 3, timeUnit = TimeUnit.SECONDS)
@Threads(1)
@Fork(1)
@State(Scope.Benchmark)
public class IntMultiplyBenchmark {

    private static class Args {

        private static final String[] STRING = {
                "589034583485345", "58903457894375873489578943534",
                "589034583485345492349238423842374237462346", "58903457894375873489578943534432949234823472374263462343526",
                "5".repeat(10_000), "6".repeat(100),
                "5".repeat(100_000), "6".repeat(50_000),
                "8".repeat(400_000), "3".repeat(150_000),
        };

        private static final BigInteger[] BIG_INTEGER = parse(STRING, BigInteger::new, BigInteger.class);
        private static final Int[] INT = parse(STRING, Int::fromString, Int.class);
    }

//    @Param({"10", "40", "80"})
    @Param({"40"})
    public int karatsubaThreshold;

    @Param({"8"})
    public int maxDepth;

    private ForkJoinPool forkJoinPool;

    @Setup
    public void setup() {
        forkJoinPool = new ForkJoinPool();
    }

    @TearDown
    public void tearDown() {
        forkJoinPool.shutdown();
    }

    @Benchmark
    public void multiplyJdkBigInteger(Blackhole blackhole) {
        perform(Args.BIG_INTEGER, BigInteger::multiply, blackhole);
    }

    @Benchmark
    public void parseAndMultiplyJdkBigInteger(Blackhole blackhole) {
        parseAndPerform(Args.STRING, BigInteger::new, BigInteger::multiply, blackhole);
    }

    @Benchmark
    public void multiplySimpleInt(Blackhole blackhole) {
        perform(Args.INT, Int::multiplySimple, blackhole);
    }

    @Benchmark
    public void multiplyKaratsubaInt(Blackhole blackhole) {
        BinaryOperator<Int> operator = (lhs, rhs) -> Int.multiplyKaratsuba(lhs, rhs, karatsubaThreshold);
        perform(Args.INT, operator, blackhole);
    }

    @Benchmark
    public void parseAndMultiplyKaratsubaInt(Blackhole blackhole) {
        BinaryOperator<Int> operator = (lhs, rhs) -> Int.multiplyKaratsuba(lhs, rhs, karatsubaThreshold);
        parseAndPerform(Args.STRING, Int::fromString, operator, blackhole);
    }

    @Benchmark
    public void parallelMultiplyInt(Blackhole blackhole) {
        BinaryOperator<Int> operator = (lhs, rhs) -> Int.parallelMultiply(lhs, rhs, karatsubaThreshold, maxDepth, forkJoinPool);
        perform(Args.INT, operator, blackhole);
    }

    private static <T> void parseAndPerform(String[] ARGS, Function<String, T> factory, BinaryOperator<T> operator, Blackhole blackhole) {
        operator = symm(operator);

        for (int j = 0; j < ARGS.length;) {
            T lhs = factory.apply(ARGS[j++]);
            T rhs = factory.apply(ARGS[j++]);
            blackhole.consume(operator.apply(lhs, rhs));
        }
    }

    private static <T> void perform(T[] args, BinaryOperator<T> operator, Blackhole blackhole) {
        operator = symm(operator);

        for (int j = 0; j < args.length;) {
            T lhs = args[j++];
            T rhs = args[j++];
            blackhole.consume(operator.apply(lhs, rhs));
        }
    }

    private static <T> BinaryOperator<T> symm(BinaryOperator<T> operator) {
        return (lhs, rhs) -> {
            operator.apply(rhs, lhs);
            return operator.apply(lhs, rhs);
        };
    }

    static <T> T[] parse(String[] ARGS, Function<String, T> factory, Class<T> cls) {
        @SuppressWarnings("unchecked")
        T[] result = (T[]) Array.newInstance(cls, ARGS.length);

        for (int i = 0; i < result.length; i++) {
            result[i] = factory.apply(ARGS[i]);
        }

        return result;
    }
}
