package se.kth.patchmerge.util;

import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A wrapper around an SLF4J logger that only builds log messages for enabled levels. Messages are passed as
 * suppliers, which matters for the per-node trace output of the merge stages.
 *
 * @author Simon Larsén
 */
public class LazyLogger {
    private final Logger logger;

    public LazyLogger(Class<?> cls) {
        logger = LoggerFactory.getLogger(cls);
    }

    public void trace(Supplier<String> messageSupplier) {
        if (logger.isTraceEnabled()) {
            logger.trace(messageSupplier.get());
        }
    }

    public void debug(Supplier<String> messageSupplier) {
        if (logger.isDebugEnabled()) {
            logger.debug(messageSupplier.get());
        }
    }

    public void debug(Supplier<String> messageSupplier, Throwable cause) {
        if (logger.isDebugEnabled()) {
            logger.debug(messageSupplier.get(), cause);
        }
    }

    public void info(Supplier<String> messageSupplier) {
        if (logger.isInfoEnabled()) {
            logger.info(messageSupplier.get());
        }
    }

    public void warn(Supplier<String> messageSupplier) {
        if (logger.isWarnEnabled()) {
            logger.warn(messageSupplier.get());
        }
    }

    public void error(Supplier<String> messageSupplier) {
        if (logger.isErrorEnabled()) {
            logger.error(messageSupplier.get());
        }
    }

    public void error(Supplier<String> messageSupplier, Throwable cause) {
        if (logger.isErrorEnabled()) {
            logger.error(messageSupplier.get(), cause);
        }
    }
}
