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
package io.tilt.tandem.domain;

import org.apache.commons.lang.Validate;
import org.joda.time.DateTimeUtils;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A heartbeat is a sign that the worker must be considered alive.
 * It replaces whatever status and resources were known for the worker.
 *
 * @author Cristian Gonzalez
 * @since Nov 5, 2015
 */
public class Heartbeat {

	private final String workerId;
	/* as stamped by the worker: informational only */
	private final long timestampMs;
	private final WorkerStatus status;
	private final ResourceUsage resources;

	@JsonCreator
	public Heartbeat(
			@JsonProperty("workerId") final String workerId,
			@JsonProperty("timestampMs") final long timestampMs,
			@JsonProperty("status") final WorkerStatus status,
			@JsonProperty("resources") final ResourceUsage resources) {
		this.workerId = workerId;
		this.timestampMs = timestampMs;
		this.status = status == null ? WorkerStatus.idle() : status;
		this.resources = resources == null ? ResourceUsage.none() : resources;
	}

	public static Builder builder(final String workerId) {
		Validate.notEmpty(workerId);
		return new Builder(workerId);
	}

	public static class Builder {
		private final String workerId;
		private WorkerStatus status;
		private ResourceUsage resources;

		private Builder(final String workerId) {
			this.workerId = workerId;
		}
		public Builder status(final WorkerStatus status) {
			this.status = status;
			return this;
		}
		public Builder resources(final ResourceUsage resources) {
			this.resources = resources;
			return this;
		}
		public Heartbeat build() {
			return new Heartbeat(workerId, DateTimeUtils.currentTimeMillis(), status, resources);
		}
	}

	public String getWorkerId() {
		return workerId;
	}
	public long getTimestampMs() {
		return timestampMs;
	}
	public WorkerStatus getStatus() {
		return status;
	}
	public ResourceUsage getResources() {
		return resources;
	}

	@Override
	public String toString() {
		return workerId + " " + status;
	}
}
