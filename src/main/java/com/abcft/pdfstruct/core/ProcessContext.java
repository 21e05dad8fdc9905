package com.abcft.pdfstruct.core;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.ParameterizedMessage;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Per-document processing context handed to every stage and to the reconstruction algorithm.
 *
 * <p>Diagnostics go through the context instead of a process-wide logger: each warning is logged
 * and kept so that callers can inspect what was degraded. A context belongs to one document run and
 * may be used from the extractor worker threads of that run.</p>
 */
public class ProcessContext {

    private final String name;
    private final Logger logger;
    private final List<String> warnings = new CopyOnWriteArrayList<>();

    public ProcessContext(String name) {
        this(name, LogManager.getLogger(ProcessContext.class));
    }

    public ProcessContext(String name, Logger logger) {
        this.name = name;
        this.logger = logger;
    }

    public String getName() {
        return name;
    }

    public Logger getLogger() {
        return logger;
    }

    public void info(String format, Object... args) {
        logger.info("[{}] {}", name, format(format, args));
    }

    public void debug(String format, Object... args) {
        if (logger.isDebugEnabled()) {
            logger.debug("[{}] {}", name, format(format, args));
        }
    }

    /**
     * Logs and records a warning.
     */
    public void warn(String format, Object... args) {
        String message = format(format, args);
        warnings.add(message);
        logger.warn("[{}] {}", name, message);
    }

    /**
     * Logs and records a warning caused by an exception.
     */
    public void warn(Throwable cause, String format, Object... args) {
        String message = format(format, args);
        warnings.add(message + ": " + cause);
        logger.warn("[" + name + "] " + message, cause);
    }

    public void error(Throwable cause, String format, Object... args) {
        logger.error("[" + name + "] " + format(format, args), cause);
    }

    /**
     * @return a snapshot of the recorded warnings, oldest first.
     */
    public List<String> getWarnings() {
        return new ArrayList<>(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    private static String format(String format, Object... args) {
        if (args == null || args.length == 0) {
            return format;
        }
        return ParameterizedMessage.format(format, args);
    }

}
