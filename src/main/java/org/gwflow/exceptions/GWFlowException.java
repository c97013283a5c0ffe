package org.gwflow.exceptions;

/**
 * <p/>
 * Class GWFlowException.
 * <p/>
 * Root of the exceptions raised while building or running reparameterised proposals.  Argument validation
 * failures are reported as {@link IllegalArgumentException}s instead; the subtypes here describe failures that
 * callers are expected to distinguish.
 */
public class GWFlowException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public GWFlowException(final String msg) {
        super(msg);
    }

    public GWFlowException(final String message, final Throwable throwable) {
        super(message, throwable);
    }

    /*
      Subtypes of GWFlowException for common kinds of errors
     */

    /**
     * <p/>
     * Malformed or incomplete reparameterisation coverage, or inconsistent ordering of dependent
     * reparameterisations.  Raised at construction time and never retried.
     */
    public static class ConfigurationException extends GWFlowException {
        private static final long serialVersionUID = 0L;

        public ConfigurationException(final String message) {
            super(message);
        }

        public ConfigurationException(final String message, final Throwable throwable) {
            super(message, throwable);
        }
    }

    /**
     * <p/>
     * A transform was invoked outside its valid domain, or produced a non-finite log-Jacobian.
     * Recoverable at the call site by discarding the offending candidate.
     */
    public static class DomainException extends GWFlowException {
        private static final long serialVersionUID = 0L;

        private final String parameterName;
        private final double value;

        public DomainException(final String parameterName, final double value) {
            this(parameterName, value, "value is outside the domain of the transform");
        }

        public DomainException(final String parameterName, final double value, final String reason) {
            super(String.format("Parameter %s = %s: %s", parameterName, value, reason));
            this.parameterName = parameterName;
            this.value = value;
        }

        public String getParameterName() {
            return parameterName;
        }

        public double getValue() {
            return value;
        }
    }

    /**
     * <p/>
     * The retry budget of a proposal was exhausted before enough valid candidates were drawn.
     */
    public static class ProposalExhaustedException extends GWFlowException {
        private static final long serialVersionUID = 0L;

        private final int retryLimit;

        public ProposalExhaustedException(final int retryLimit, final int numRequested, final int numAccepted,
                                          final Throwable lastFailure) {
            super(String.format("Proposal exhausted after %d retries: %d of %d requested points were valid. Last failure: %s",
                    retryLimit, numAccepted, numRequested, lastFailure == null ? "none" : lastFailure.getMessage()), lastFailure);
            this.retryLimit = retryLimit;
        }

        public int getRetryLimit() {
            return retryLimit;
        }
    }
}
