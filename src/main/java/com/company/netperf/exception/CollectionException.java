package com.company.netperf.exception;

/**
 * An external command failed, exited non-zero or timed out. Measuring code
 * catches this and degrades to a sentinel value instead of propagating it.
 */
public class CollectionException extends RuntimeException {

    private static final int EXCERPT_LENGTH = 50;

    public CollectionException(String message) {
        super(message);
    }

    public CollectionException(String message, Throwable cause) {
        super(message, cause);
    }

    public static CollectionException timedOut(String command) {
        return new CollectionException("Command timed out: " + excerpt(command));
    }

    public static CollectionException failed(String command, int exitCode) {
        return new CollectionException("Command failed with exit code " + exitCode + ": " + excerpt(command));
    }

    public static CollectionException failed(String command, Throwable cause) {
        return new CollectionException("Command failed: " + excerpt(command) + " (" + cause.getMessage() + ")", cause);
    }

    public static CollectionException stageFailed(String stage, int exitCode, String command) {
        return new CollectionException("Pipeline stage '" + stage + "' failed with exit code "
                + exitCode + ": " + excerpt(command));
    }

    static String excerpt(String command) {
        if (command == null) {
            return "";
        }
        return command.length() <= EXCERPT_LENGTH ? command : command.substring(0, EXCERPT_LENGTH) + "...";
    }
}
