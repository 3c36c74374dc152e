package org.broadinstitute.abc.exceptions;

/**
 * Fatal failure of a sampling round that is not an error raised by the evaluation function itself.
 * Errors thrown by the evaluation function propagate to the caller unchanged; nothing in the samplers retries.
 */
public class SamplingException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public SamplingException(final String message) {
        super(message);
    }

    public SamplingException(final String message, final Throwable cause) {
        super(message, cause);
    }

    /**
     * A pool worker terminated while results were still outstanding.
     */
    public static final class WorkerFailure extends SamplingException {
        private static final long serialVersionUID = 1L;

        public WorkerFailure(final String workerName, final int outstandingResults) {
            super(String.format("Worker %s is dead with %d result(s) outstanding.", workerName, outstandingResults));
        }

        public WorkerFailure(final String workerName, final int outstandingResults, final Throwable cause) {
            super(String.format("Worker %s died with %d result(s) outstanding: %s",
                    workerName, outstandingResults, cause.getMessage()), cause);
        }
    }

    /**
     * The evaluation task or its arguments could not be transmitted to a worker.
     */
    public static final class Transport extends SamplingException {
        private static final long serialVersionUID = 1L;

        public Transport(final String what, final Throwable cause) {
            super("Cannot transmit " + what + " to a remote worker: " + cause.getMessage(), cause);
        }
    }
}
