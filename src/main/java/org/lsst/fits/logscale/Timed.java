package org.lsst.fits.logscale;

import java.util.concurrent.Callable;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Utility for timing pipeline steps.
 *
 * @param <T> The type of the timed result
 */
public final class Timed<T> {

    private static final Logger LOG = Logger.getLogger(Timed.class.getName());

    private final T value;
    private final long elapsedMillis;

    private Timed(T value, long elapsedMillis) {
        this.value = value;
        this.elapsedMillis = elapsedMillis;
    }

    public T getValue() {
        return value;
    }

    public long getElapsedMillis() {
        return elapsedMillis;
    }

    /**
     * Run a step and keep its elapsed time alongside the result.
     *
     * @param <T> The type of the step result
     * @param step The step to run
     * @return The result together with the elapsed milliseconds
     */
    public static <T> Timed<T> measure(Supplier<T> step) {
        long start = System.nanoTime();
        T value = step.get();
        return new Timed<>(value, (System.nanoTime() - start) / 1_000_000);
    }

    /**
     * Run a step, logging the elapsed time. The message is a format string
     * whose last argument is the time in milliseconds. Checked exceptions
     * thrown by the step are rethrown unchanged.
     */
    public static <T> T execute(Level logLevel, Callable<T> step, String message, Object... args) {
        long start = System.nanoTime();
        try {
            return step.call();
        } catch (Exception x) {
            return Timed.sneakyThrow(x);
        } finally {
            long elapsed = (System.nanoTime() - start) / 1_000_000;
            LOG.log(logLevel, () -> String.format(message, append(args, elapsed)));
        }
    }

    @SuppressWarnings("unchecked")
    private static <X extends Exception, R> R sneakyThrow(Exception t) throws X {
        throw (X) t;
    }

    private static Object[] append(Object[] args, Object arg) {
        Object[] result = new Object[args.length + 1];
        System.arraycopy(args, 0, result, 0, args.length);
        result[args.length] = arg;
        return result;
    }
}
