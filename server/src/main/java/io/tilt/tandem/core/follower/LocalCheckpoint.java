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
package io.tilt.tandem.core.follower;

import java.nio.file.Path;

import org.apache.commons.lang.builder.EqualsBuilder;
import org.apache.commons.lang.builder.HashCodeBuilder;

import io.tilt.tandem.domain.CheckpointRecord;
import io.tilt.tandem.utils.LogUtils;

/**
 * A checkpoint durably written to the worker's local directory.
 */
public class LocalCheckpoint implements Comparable<LocalCheckpoint> {

	// found at startup with no record of its epoch
	public static final int UNKNOWN_EPOCH = -1;

	private final String checkpointId;
	private final long step;
	private final int epoch;
	private final Path path;
	private final long sizeBytes;
	private final long createdAtMs;

	public LocalCheckpoint(
			final String checkpointId,
			final long step,
			final int epoch,
			final Path path,
			final long sizeBytes,
			final long createdAtMs) {
		this.checkpointId = checkpointId;
		this.step = step;
		this.epoch = epoch;
		this.path = path;
		this.sizeBytes = sizeBytes;
		this.createdAtMs = createdAtMs;
	}

	/** @return the coordinator's bookkeeping of this checkpoint */
	public CheckpointRecord toRecord(final String workerId) {
		return CheckpointRecord.full(checkpointId, workerId, step, Math.max(0, epoch),
				path.toAbsolutePath().toString(), sizeBytes);
	}

	public String getCheckpointId() {
		return checkpointId;
	}
	public long getStep() {
		return step;
	}
	public int getEpoch() {
		return epoch;
	}
	public Path getPath() {
		return path;
	}
	public long getSizeBytes() {
		return sizeBytes;
	}
	public long getCreatedAtMs() {
		return createdAtMs;
	}

	@Override
	public int compareTo(final LocalCheckpoint o) {
		return Long.compare(step, o.step);
	}

	@Override
	public boolean equals(final Object obj) {
		if (obj instanceof LocalCheckpoint) {
			final LocalCheckpoint other = (LocalCheckpoint) obj;
			return new EqualsBuilder()
					.append(checkpointId, other.checkpointId)
					.append(step, other.step)
					.append(path, other.path)
					.append(createdAtMs, other.createdAtMs)
					.isEquals();
		}
		return false;
	}

	@Override
	public int hashCode() {
		return new HashCodeBuilder()
				.append(checkpointId)
				.append(step)
				.toHashCode();
	}

	@Override
	public String toString() {
		return checkpointId + "(e:" + epoch + ", " + LogUtils.humanBytes(sizeBytes) + ")";
	}

}
