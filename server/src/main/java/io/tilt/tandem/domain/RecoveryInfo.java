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
 * Where a restarting job should resume, from the most advanced checkpoint reported.
 */
public class RecoveryInfo {

	private final boolean hasCheckpoint;
	private final CheckpointRecord checkpoint;
	private final long resumeStep;
	private final int resumeEpoch;

	@JsonCreator
	public RecoveryInfo(
			@JsonProperty("hasCheckpoint") final boolean hasCheckpoint,
			@JsonProperty("checkpoint") final CheckpointRecord checkpoint,
			@JsonProperty("resumeStep") final long resumeStep,
			@JsonProperty("resumeEpoch") final int resumeEpoch) {
		this.hasCheckpoint = hasCheckpoint;
		this.checkpoint = checkpoint;
		this.resumeStep = resumeStep;
		this.resumeEpoch = resumeEpoch;
	}

	public static RecoveryInfo none() {
		return new RecoveryInfo(false, null, 0, 0);
	}

	public static RecoveryInfo from(final CheckpointRecord latest) {
		return new RecoveryInfo(true, latest, latest.getStep(), latest.getEpoch());
	}

	public boolean isHasCheckpoint() {
		return hasCheckpoint;
	}
	public CheckpointRecord getCheckpoint() {
		return checkpoint;
	}
	public long getResumeStep() {
		return resumeStep;
	}
	public int getResumeEpoch() {
		return resumeEpoch;
	}
}
