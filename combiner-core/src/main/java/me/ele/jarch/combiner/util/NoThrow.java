package me.ele.jarch.combiner.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code NoThrow} calls a function and catch any exception.
 * Only for releasing resources, where writing to the log is all that can be done.
 */
public class NoThrow {
    private static final Logger logger = LoggerFactory.getLogger(NoThrow.class);

    @FunctionalInterface public interface NormalFunc {
        void invoke() throws Throwable;
    }

    /**
     * Invoke the input {@code NormalFunc}, catch Throwable and log it.
     *
     * @param normalFunc A lambda with neither input nor returning value
     */
    public static void call(NormalFunc normalFunc) {
        try {
            normalFunc.invoke();
        } catch (Throwable t) {  //NOSONAR
            logger.error(t.getMessage(), t);
        }
    }

    @FunctionalInterface public interface ExceptionFunc {
        void invoke(Throwable e);
    }

    /**
     * Invoke the input {@code NormalFunc}, catch Throwable and call {@code ExceptionFunc}
     */
    public static void execute(NormalFunc normalFunc, ExceptionFunc exceptionFunc) {
        try {
            normalFunc.invoke();
        } catch (Throwable e) { // NOSONAR
            exceptionFunc.invoke(e);
        }
    }
}
