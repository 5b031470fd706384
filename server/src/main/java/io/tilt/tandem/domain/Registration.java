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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Admission reply: the rank assigned for the session and the world size at that instant.
 */
public class Registration {

	private final String workerId;
	private final int rank;
	private final int worldSize;
	private final long heartbeatIntervalMs;

	@JsonCreator
	public Registration(
			@JsonProperty("workerId") final String workerId,
			@JsonProperty("rank") final int rank,
			@JsonProperty("worldSize") final int worldSize,
			@JsonProperty("heartbeatIntervalMs") final long heartbeatIntervalMs) {
		this.workerId = workerId;
		this.rank = rank;
		this.worldSize = worldSize;
		this.heartbeatIntervalMs = heartbeatIntervalMs;
	}

	public String getWorkerId() {
		return workerId;
	}
	public int getRank() {
		return rank;
	}
	public int getWorldSize() {
		return worldSize;
	}
	public long getHeartbeatIntervalMs() {
		return heartbeatIntervalMs;
	}

	@Override
	public String toString() {
		return workerId + " rank " + rank + "/" + worldSize;
	}
}
