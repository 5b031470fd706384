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

import org.joda.time.DateTimeUtils;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A worker's report of a checkpoint it completed locally.
 * The coordinator only books it: bytes never travel with it.
 */
public class CheckpointRecord implements Serializable {

	private static final long serialVersionUID = 5307766106201427409L;

	private final String checkpointId;
	private final String workerId;
	private final long step;
	private final int epoch;
	private final String storagePath;
	private final long sizeBytes;
	private final long timestampMs;
	private final CheckpointType type;

	@JsonCreator
	public CheckpointRecord(
			@JsonProperty("checkpointId") final String checkpointId,
			@JsonProperty("workerId") final String workerId,
			@JsonProperty("step") final long step,
			@JsonProperty("epoch") final int epoch,
			@JsonProperty("storagePath") final String storagePath,
			@JsonProperty("sizeBytes") final long sizeBytes,
			@JsonProperty("timestampMs") final long timestampMs,
			@JsonProperty("type") final CheckpointType type) {
		this.checkpointId = checkpointId;
		this.workerId = workerId;
		this.step = step;
		this.epoch = epoch;
		this.storagePath = storagePath;
		this.sizeBytes = sizeBytes;
		this.timestampMs = timestampMs;
		this.type = type == null ? CheckpointType.FULL : type;
	}

	public static CheckpointRecord full(
			final String checkpointId, 
			final String workerId, 
			final long step, 
			final int epoch,
			final String storagePath, 
			final long sizeBytes) {
		return new CheckpointRecord(checkpointId, workerId, step, epoch, storagePath, sizeBytes,
				DateTimeUtils.currentTimeMillis(), CheckpointType.FULL);
	}

	public String getCheckpointId() {
		return checkpointId;
	}
	public String getWorkerId() {
		return workerId;
	}
	public long getStep() {
		return step;
	}
	public int getEpoch() {
		return epoch;
	}
	public String getStoragePath() {
		return storagePath;
	}
	public long getSizeBytes() {
		return sizeBytes;
	}
	public long getTimestampMs() {
		return timestampMs;
	}
	public CheckpointType getType() {
		return type;
	}

	@Override
	public String toString() {
		return checkpointId + " (" + workerId + " s:" + step + " e:" + epoch + ")";
	}
}
