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
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * What a worker is doing, as reported in its heartbeats.
 * Each state carries only the fields that make sense for it.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "state")
@JsonSubTypes({
	@JsonSubTypes.Type(value = WorkerStatus.LoadingData.class, name = "LOADING_DATA"),
	@JsonSubTypes.Type(value = WorkerStatus.Training.class, name = "TRAINING"),
	@JsonSubTypes.Type(value = WorkerStatus.Checkpointing.class, name = "CHECKPOINTING"),
	@JsonSubTypes.Type(value = WorkerStatus.Idle.class, name = "IDLE")
})
public abstract class WorkerStatus {

	public abstract WorkerState getState();

	/** @return the training step when the state has one, -1 otherwise */
	public long step() {
		return -1;
	}
	/** @return the epoch when the state has one, -1 otherwise */
	public int epoch() {
		return -1;
	}
	/** @return the running task when the state has one, null otherwise */
	public String task() {
		return null;
	}

	public static WorkerStatus loading(final int epoch, final String task) {
		return new LoadingData(epoch, task);
	}
	public static WorkerStatus training(final long step, final int epoch, final String task) {
		return new Training(step, epoch, task);
	}
	public static WorkerStatus checkpointing(final long step, final int epoch) {
		return new Checkpointing(step, epoch);
	}
	public static WorkerStatus idle() {
		return new Idle();
	}

	@Override
	public String toString() {
		final StringBuilder sb = new StringBuilder(getState().name());
		if (step() >= 0) {
			sb.append(" s:").append(step());
		}
		if (epoch() >= 0) {
			sb.append(" e:").append(epoch());
		}
		if (task() != null) {
			sb.append(" t:").append(task());
		}
		return sb.toString();
	}

	public static class LoadingData extends WorkerStatus {
		private final int currentEpoch;
		private final String currentTask;

		@JsonCreator
		public LoadingData(
				@JsonProperty("currentEpoch") final int currentEpoch,
				@JsonProperty("currentTask") final String currentTask) {
			this.currentEpoch = currentEpoch;
			this.currentTask = currentTask;
		}
		@Override
		public WorkerState getState() {
			return WorkerState.LOADING_DATA;
		}
		public int getCurrentEpoch() {
			return currentEpoch;
		}
		public String getCurrentTask() {
			return currentTask;
		}
		@Override
		public int epoch() {
			return currentEpoch;
		}
		@Override
		public String task() {
			return currentTask;
		}
	}

	public static class Training extends WorkerStatus {
		private final long currentStep;
		private final int currentEpoch;
		private final String currentTask;

		@JsonCreator
		public Training(
				@JsonProperty("currentStep") final long currentStep,
				@JsonProperty("currentEpoch") final int currentEpoch,
				@JsonProperty("currentTask") final String currentTask) {
			this.currentStep = currentStep;
			this.currentEpoch = currentEpoch;
			this.currentTask = currentTask;
		}
		@Override
		public WorkerState getState() {
			return WorkerState.TRAINING;
		}
		public long getCurrentStep() {
			return currentStep;
		}
		public int getCurrentEpoch() {
			return currentEpoch;
		}
		public String getCurrentTask() {
			return currentTask;
		}
		@Override
		public long step() {
			return currentStep;
		}
		@Override
		public int epoch() {
			return currentEpoch;
		}
		@Override
		public String task() {
			return currentTask;
		}
	}

	public static class Checkpointing extends WorkerStatus {
		private final long currentStep;
		private final int currentEpoch;

		@JsonCreator
		public Checkpointing(
				@JsonProperty("currentStep") final long currentStep,
				@JsonProperty("currentEpoch") final int currentEpoch) {
			this.currentStep = currentStep;
			this.currentEpoch = currentEpoch;
		}
		@Override
		public WorkerState getState() {
			return WorkerState.CHECKPOINTING;
		}
		public long getCurrentStep() {
			return currentStep;
		}
		public int getCurrentEpoch() {
			return currentEpoch;
		}
		@Override
		public long step() {
			return currentStep;
		}
		@Override
		public int epoch() {
			return currentEpoch;
		}
	}

	public static class Idle extends WorkerStatus {
		@Override
		public WorkerState getState() {
			return WorkerState.IDLE;
		}
	}

}
