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

import java.io.Serializable;

import org.apache.commons.lang.builder.EqualsBuilder;
import org.apache.commons.lang.builder.HashCodeBuilder;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * What a worker tells about itself when asking for admission.
 */
public class WorkerInfo implements Serializable {

	private static final long serialVersionUID = -1407416355093829710L;

	private final String workerId;
	private final String hostname;
	private final int port;
	private final int gpuCount;
	private final long memoryBytes;

	@JsonCreator
	public WorkerInfo(
			@JsonProperty("workerId") final String workerId,
			@JsonProperty("hostname") final String hostname,
			@JsonProperty("port") final int port,
			@JsonProperty("gpuCount") final int gpuCount,
			@JsonProperty("memoryBytes") final long memoryBytes) {
		this.workerId = workerId;
		this.hostname = hostname;
		this.port = port;
		this.gpuCount = gpuCount;
		this.memoryBytes = memoryBytes;
	}

	public String getWorkerId() {
		return workerId;
	}
	public String getHostname() {
		return hostname;
	}
	public int getPort() {
		return port;
	}
	public int getGpuCount() {
		return gpuCount;
	}
	public long getMemoryBytes() {
		return memoryBytes;
	}

	@Override
	public boolean equals(final Object obj) {
		if (obj instanceof WorkerInfo) {
			final WorkerInfo o = (WorkerInfo) obj;
			return new EqualsBuilder()
					.append(workerId, o.workerId)
					.append(hostname, o.hostname)
					.append(port, o.port)
					.append(gpuCount, o.gpuCount)
					.append(memoryBytes, o.memoryBytes)
					.isEquals();
		}
		return false;
	}

	@Override
	public int hashCode() {
		return new HashCodeBuilder().append(workerId).append(hostname).append(port).toHashCode();
	}

	@Override
	public String toString() {
		return workerId + "@" + hostname + ":" + port;
	}
}
