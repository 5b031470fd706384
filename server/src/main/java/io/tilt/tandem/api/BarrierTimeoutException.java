package io.tilt.tandem.api;

/** Raised when the barrier was not complete within the caller's timeout */
public class BarrierTimeoutException extends CoordinatorException {

	private static final long serialVersionUID = 7739915026548721130L;

	public BarrierTimeoutException(final String message) {
		super(ErrorKind.BARRIER_TIMEOUT, message);
	}

}
