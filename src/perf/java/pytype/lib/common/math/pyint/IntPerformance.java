package pytype.lib.common.math.pyint;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.function.BinaryOperator;
import java.util.function.Consumer;
import java.util.function.Function;

import org.junit.After;
import org.junit.Test;

/**
 * Rough timings against {@link BigInteger}. Run with assertions disabled.
 */
public class IntPerformance extends CommonTestBase {

    private static final String[] BINARY_ARGS_BIG = {
            "589034583485345", "58903457894375873489578943534",
            "589034583485345492349238423842374237462346", "58903457894375873489578943534432949234823472374263462343526",
            "5".repeat(10_000), "6".repeat(5_000),
    };

    private static final String[] BINARY_ARGS_BIG_LEFT = {
            "58903457894375873489578943534", "423432432",
            "589034583485345492349238423842374237462346", "423423",
            "589034583485345492349238423842374237462346", "-423423",
            "-589034583485345492349238333333333333333333333333423842374237462346", "-423423",
            "5".repeat(10_000), "6".repeat(3_000),
    };

    private static final String[] BINARY_ARGS_LONG = {
            "43", "661",
            "4313", "89",
            "4313423423", "89",
            "9456467577", "893",
            "1456467577", "13",
    };

    private static final String[] UNARY_ARGS_BIG = {
            "0",
            "58903457894375873489578943534",
            "8".repeat(10_000),
            "-" + "7".repeat(10_000),
    };

    @Override
    boolean isPerformanceTest() {
        return true;
    }

    @Test
    public void pow() {
        int REPEATS = 100;
        var ARGS = BINARY_ARGS_LONG;
        boolean symm = false;
        binary(symm, "Int", "pow", Int::fromString, (lhs, rhs) -> lhs.pow(rhs.toInt()), REPEATS, ARGS);
        binary(symm, "BigInteger", "pow", BigInteger::new, (lhs, rhs) -> lhs.pow(rhs.intValue()), REPEATS, ARGS);
    }

    @Test
    public void divide() {
        int REPEATS = 1_000;
        var ARGS = BINARY_ARGS_BIG_LEFT;
        boolean symm = false;
        binary(symm, "Int", "divide", Int::fromString, Int::divide, REPEATS, ARGS);
        binary(symm, "BigInteger", "divide", BigInteger::new, BigInteger::divide, REPEATS, ARGS);
    }

    @Test
    public void multiply() {
        int REPEATS = 10;
        var ARGS = BINARY_ARGS_BIG;
        binary("Int", "multiplySimple", Int::fromString, Int::multiplySimple, REPEATS, ARGS);
        binary("Int", "multiply", Int::fromString, Int::multiply, REPEATS, ARGS);
        binary("BigInteger", "multiply", BigInteger::new, BigInteger::multiply, REPEATS, ARGS);
    }

    @Test
    public void add() {
        int REPEATS = 100;
        var ARGS = BINARY_ARGS_BIG;
        binary("Int", "add", Int::fromString, Int::add, REPEATS, ARGS);
        binary("BigInteger", "add", BigInteger::new, BigInteger::add, REPEATS, ARGS);
    }

    @Test
    public void incrementDecrement() {
        int REPEATS = 10_000;
        var ARGS = UNARY_ARGS_BIG;
        unary("Int", "increment", Int::fromString, Int::increment, REPEATS, ARGS);
        unary("Int", "add(ONE)", Int::fromString, x -> x.add(Int.ONE), REPEATS, ARGS);
        unary("Int", "decrement", Int::fromString, Int::decrement, REPEATS, ARGS);
        unary("Int", "subtract(ONE)", Int::fromString, x -> x.subtract(Int.ONE), REPEATS, ARGS);
        unary("BigInteger", "add(ONE)", BigInteger::new, x -> x.add(BigInteger.ONE), REPEATS, ARGS);
    }

    @Test
    public void numberToString() {
        int REPEATS = 100;
        var ARGS = UNARY_ARGS_BIG;
        unary("Int", "toString", Int::fromString, Object::toString, REPEATS, ARGS);
        unary("Int", "toString(16)", Int::fromString, x -> x.toString(16), REPEATS, ARGS);
        unary("BigInteger", "toString", BigInteger::new, Object::toString, REPEATS, ARGS);
        unary("BigInteger", "toString(16)", BigInteger::new, x -> x.toString(16), REPEATS, ARGS);
    }

    @Test
    public void streamDigits() {
        int REPEATS = 100;
        var ARGS = UNARY_ARGS_BIG;
        unary("Int", "streamDigits", Int::fromString, Streams::take, REPEATS, ARGS);
        unary("BigInteger", "streamDigits", BigInteger::new, Streams::take, REPEATS, ARGS);
    }

    @Test
    public void primes() {
        int REPEATS = 10;
        String[] ARGS = { "1" + "0".repeat(20), "1" + "0".repeat(50), "1" + "0".repeat(100) };
        unary("Int", "nextPrime", Int::fromString, Int::nextPrime, REPEATS, ARGS);
        unary("BigInteger", "nextProbablePrime", BigInteger::new, BigInteger::nextProbablePrime, REPEATS, ARGS);
    }

    private static class Streams {

        private static boolean accept(byte[] a, int offset, int length) {
            // ignore data, we only test streaming perf itself
            return true;
        }

        private static void take(Int value) {
            value.stream(Streams::accept);
        }

        private static void take(BigInteger value) {
            byte[] bytes = value.toString().getBytes(StandardCharsets.UTF_8);
            accept(bytes, 0, bytes.length);
        }
    }

    private static <T> void binary(String impl, String op, Function<String, T> factory, BinaryOperator<T> operator, int REPEATS, String[] ARGS) {
        binary(/*symm*/ true, impl, op, factory, operator, REPEATS, ARGS);
    }

    private static <T> void binary(boolean symm, String impl, String op, Function<String, T> factory, BinaryOperator<T> operator, int REPEATS, String[] ARGS) {
        long t0 = System.nanoTime();
        long top = 0;

        if (symm) {
            operator = symm(operator);
        }

        for (int i = 0; i < REPEATS; i++) {
            for (int j = 0; j < ARGS.length;) {
                T lhs = factory.apply(ARGS[j++]);
                T rhs = factory.apply(ARGS[j++]);

                long t1 = System.nanoTime();
                T result = operator.apply(lhs, rhs);
                t1 = System.nanoTime() - t1;

                assert result != null;
                top += t1;
            }
        }

        t0 = System.nanoTime() - t0;
        print(impl, op, t0, top);
    }

    private static <T> BinaryOperator<T> symm(BinaryOperator<T> operator) {
        return (lhs, rhs) -> {
            operator.apply(rhs, lhs);
            return operator.apply(lhs, rhs);
        };
    }

    private static <T> void unary(String impl, String op, Function<String, T> factory, Consumer<T> action, int REPEATS, String[] ARGS) {
        long t0 = System.nanoTime();
        long top = 0;

        for (int i = 0; i < REPEATS; i++) {
            for (String arg : ARGS) {
                T value = factory.apply(arg);

                long t1 = System.nanoTime();
                action.accept(value);
                t1 = System.nanoTime() - t1;

                top += t1;
            }
        }

        t0 = System.nanoTime() - t0;
        print(impl, op, t0, top);
    }

    private static void print(String impl, String op, long total, long inOp) {
        System.out.printf(Locale.ROOT, "%12s %25s %,15d total %,15d op %,15d diff\n", impl, op, total / 1000, inOp / 1000, (total - inOp) / 1000);
    }

    @After
    public void after() {
        System.out.println("=".repeat(120));
    }
}
