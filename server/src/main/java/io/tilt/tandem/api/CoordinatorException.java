/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements. See the NOTICE file distributed with this
 * work for additional information regarding copyright ownership. The ASF
 * licenses this file to You under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations under
 * the License.
 */
package io.tilt.tandem.api;

import org.apache.commons.lang.Validate;

/**
 * A coordinator operation that cannot be honored in the current state.
 * Arguments failing validation are reported with {@linkplain IllegalArgumentException} instead.
 */
public class CoordinatorException extends IllegalStateException {

	private static final long serialVersionUID = 3814720995123398581L;

	private final ErrorKind kind;

	public CoordinatorException(final ErrorKind kind, final String message) {
		super(message);
		Validate.notNull(kind);
		this.kind = kind;
	}

	public CoordinatorException(final ErrorKind kind, final String message, final Throwable cause) {
		super(message, cause);
		Validate.notNull(kind);
		this.kind = kind;
	}

	public ErrorKind getKind() {
		return kind;
	}

	/**
	 * Rebuilds the exception for an error received over the wire
	 * @param kind	as replied
	 * @param message	as replied
	 * @return a runtime exception whose type matches the kind
	 */
	public static RuntimeException of(final ErrorKind kind, final String message) {
		switch (kind) {
		case INVALID_ARGUMENT:
			return new IllegalArgumentException(message);
		case UNKNOWN_WORKER:
			return new UnknownWorkerException(message);
		case DUPLICATE_WORKER:
			return new DuplicateWorkerException(message);
		case SPEC_MISMATCH:
			return new SpecMismatchException(message);
		case BARRIER_TIMEOUT:
			return new BarrierTimeoutException(message);
		default:
			return new CoordinatorException(kind, message);
		}
	}

	/** @return the kind a thrown exception is replied with */
	public static ErrorKind kindOf(final Throwable t) {
		if (t instanceof CoordinatorException) {
			return ((CoordinatorException) t).getKind();
		} else if (t instanceof IllegalArgumentException) {
			return ErrorKind.INVALID_ARGUMENT;
		} else if (t instanceof java.io.IOException || t instanceof java.io.UncheckedIOException) {
			return ErrorKind.IO_FAILURE;
		} else {
			return ErrorKind.INTERNAL;
		}
	}

}
