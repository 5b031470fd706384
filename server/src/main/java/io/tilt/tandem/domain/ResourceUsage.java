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

import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Host and accelerator usage snapshot sent along each heartbeat.
 */
public class ResourceUsage {

	private static final ResourceUsage NONE = new ResourceUsage(0, 0, null);

	private final double cpuPercent;
	private final long memoryUsedBytes;
	private final List<AcceleratorUsage> accelerators;

	@JsonCreator
	public ResourceUsage(
			@JsonProperty("cpuPercent") final double cpuPercent,
			@JsonProperty("memoryUsedBytes") final long memoryUsedBytes,
			@JsonProperty("accelerators") final List<AcceleratorUsage> accelerators) {
		this.cpuPercent = cpuPercent;
		this.memoryUsedBytes = memoryUsedBytes;
		this.accelerators = accelerators == null ? Collections.emptyList() : accelerators;
	}

	public static ResourceUsage none() {
		return NONE;
	}

	public double getCpuPercent() {
		return cpuPercent;
	}
	public long getMemoryUsedBytes() {
		return memoryUsedBytes;
	}
	public List<AcceleratorUsage> getAccelerators() {
		return accelerators;
	}
}
