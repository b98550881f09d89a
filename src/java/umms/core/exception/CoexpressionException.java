package umms.core.exception;

/**
 * Base class of the fatal errors raised while building a co-expression network.
 * A run stops at the first one; downstream stages assume complete upstream matrices.
 */
public class CoexpressionException extends RuntimeException {

	private static final long serialVersionUID = 4412093318870155L;

	public CoexpressionException(String message) {
		super(message);
	}

	public CoexpressionException(String message, Throwable cause) {
		super(message, cause);
	}
}
