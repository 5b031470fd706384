package io.tilt.tandem.api;

/** Raised when a live worker already holds the id */
public class DuplicateWorkerException extends CoordinatorException {

	private static final long serialVersionUID = 4425836207519781341L;

	public DuplicateWorkerException(final String message) {
		super(ErrorKind.DUPLICATE_WORKER, message);
	}

}
