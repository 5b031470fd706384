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

/**
 * Failure taxonomy of the coordinator's operations, with its restful analog.
 */
public enum ErrorKind {

	// the dataset or checkpoint does not exist
	NOT_FOUND(404),
	// the caller never registered or was already evicted
	UNKNOWN_WORKER(404),
	// a live worker already holds that id
	DUPLICATE_WORKER(409),
	// an entity with that id was registered with different content
	SPEC_MISMATCH(409),
	// admission stopped at the configured worker limit
	CAPACITY_EXCEEDED(429),
	// the caller's wait expired before the barrier was complete
	BARRIER_TIMEOUT(408),
	// the operation does not apply to the entity's current state
	FAILED_PRECONDITION(412),
	// the caller went away or was interrupted while waiting
	CANCELLED(503),
	// lacks of vital information or has invalid data
	INVALID_ARGUMENT(400),
	// storage could not be written or read
	IO_FAILURE(500),
	// anything else going wrong at the coordinator
	INTERNAL(500),
	;

	final int httpCode;
	ErrorKind(final int code) {
		this.httpCode = code;
	}
	/** @return an http status code, restful analog */
	public int getHttpCode() {
		return httpCode;
	}

	public String toString() {
		return httpCode + "-" + this.name();
	}
}
