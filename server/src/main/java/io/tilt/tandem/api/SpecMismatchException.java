package io.tilt.tandem.api;

/** Raised when the id is registered with a different definition */
public class SpecMismatchException extends CoordinatorException {

	private static final long serialVersionUID = -2319551820370093125L;

	public SpecMismatchException(final String message) {
		super(ErrorKind.SPEC_MISMATCH, message);
	}

}
