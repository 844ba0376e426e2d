package org.broadinstitute.mutator.exceptions;

import java.nio.file.Path;

/**
 * <p/>
 * Class UserException.
 * <p/>
 * This exception is for errors that are due to user mistakes, such as non-existent or malformed files.
 */
public class UserException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public UserException() {
        super();
    }

    public UserException(final String msg) {
        super(msg);
    }

    public UserException(final String message, final Throwable throwable) {
        super(message, throwable);
    }

    protected static String getMessage(final Throwable t) {
        final String message = t.getMessage();
        return message != null ? message : t.getClass().getName();
    }

    /**
     * Subtypes of UserException for common kinds of errors
     */

    /**
     * <p/>
     * Class UserException.CouldNotReadInputFile
     * <p/>
     * For generic errors opening/reading from input files
     */
    public static class CouldNotReadInputFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CouldNotReadInputFile(final Path file) {
            super(String.format("Couldn't read file %s", file.toAbsolutePath().toUri()));
        }

        public CouldNotReadInputFile(final Path file, final String message) {
            super(String.format("Couldn't read file %s. Error was: %s", file.toAbsolutePath().toUri(), message));
        }

        public CouldNotReadInputFile(final Path file, final String message, final Throwable cause) {
            super(String.format("Couldn't read file %s. Error was: %s", file.toAbsolutePath().toUri(), message), cause);
        }
    }

    /**
     * <p/>
     * Class UserException.CouldNotCreateOutputFile
     * <p/>
     * For generic errors writing to output files
     */
    public static class CouldNotCreateOutputFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CouldNotCreateOutputFile(final Path file, final String message) {
            super(String.format("Couldn't write file %s because %s", file.toAbsolutePath().toUri(), message));
        }

        public CouldNotCreateOutputFile(final Path file, final String message, final Throwable cause) {
            super(String.format("Couldn't write file %s because %s with exception %s", file.toAbsolutePath().toUri(), message, getMessage(cause)), cause);
        }
    }

    public static class MalformedFile extends UserException {
        private static final long serialVersionUID = 0L;

        public MalformedFile(final Path file, final String message) {
            super(String.format("File %s is malformed: %s", file.toAbsolutePath().toUri(), message));
        }

        public MalformedFile(final Path file, final String message, final Throwable cause) {
            super(String.format("File %s is malformed: %s caused by %s", file.toAbsolutePath().toUri(), message, getMessage(cause)), cause);
        }
    }

    public static class BadInput extends UserException {
        private static final long serialVersionUID = 0L;

        public BadInput(final String message) {
            super("Bad input: " + message);
        }

        public BadInput(final String message, final Throwable cause) {
            super("Bad input: " + message, cause);
        }
    }
}
