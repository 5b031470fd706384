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

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * What's known about a worker from its heartbeats. Replaced at each heartbeat.
 */
public class WorkerLiveness {

	private final String workerId;
	private final WorkerStatus status;
	private final ResourceUsage resources;
	/* reception time at the coordinator */
	private final long lastSeen;
	private final long beats;
	private final boolean dead;

	public WorkerLiveness(
			final String workerId,
			final WorkerStatus status,
			final ResourceUsage resources,
			final long lastSeen,
			final long beats,
			final boolean dead) {
		this.workerId = workerId;
		this.status = status;
		this.resources = resources;
		this.lastSeen = lastSeen;
		this.beats = beats;
		this.dead = dead;
	}

	/* a worker just admitted: idle until it tells otherwise */
	public static WorkerLiveness admitted(final String workerId, final long now) {
		return new WorkerLiveness(workerId, WorkerStatus.idle(), ResourceUsage.none(), now, 0, false);
	}

	public WorkerLiveness beat(final Heartbeat hb, final long now) {
		return new WorkerLiveness(workerId, hb.getStatus(), hb.getResources(), now, beats + 1, false);
	}

	public WorkerLiveness died() {
		return new WorkerLiveness(workerId, status, resources, lastSeen, beats, true);
	}

	public String getWorkerId() {
		return workerId;
	}
	public WorkerState getState() {
		return dead ? WorkerState.DEAD : status.getState();
	}
	public WorkerStatus getStatus() {
		return status;
	}
	public ResourceUsage getResources() {
		return resources;
	}
	public long getLastSeen() {
		return lastSeen;
	}
	public long getBeats() {
		return beats;
	}
	@JsonIgnore
	public boolean isDead() {
		return dead;
	}

	@Override
	public String toString() {
		return workerId + " " + getState() + " (#" + beats + ")";
	}
}
