package io.tilt.tandem.api;

/** Raised when the worker is not registered */
public class UnknownWorkerException extends CoordinatorException {

	private static final long serialVersionUID = -6011902183760216254L;

	public UnknownWorkerException(final String message) {
		super(ErrorKind.UNKNOWN_WORKER, message);
	}

}
