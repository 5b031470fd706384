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
package io.tilt.tandem.core.leader;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

import org.apache.commons.lang.Validate;
import org.joda.time.DateTimeUtils;

import io.tilt.tandem.api.CoordinatorException;
import io.tilt.tandem.api.ErrorKind;
import io.tilt.tandem.domain.BarrierReply;

/**
 * A rendezvous point for a fixed number of participants, fixed at its creation.
 * Arrivals park on a future, completed for all at once when the last participant arrives.
 * Each barrier has its own lock.
 *
 * @author Cristian Gonzalez
 */
public class Barrier {

	public enum Status {
		WAITING,
		COMPLETE,
	}

	private final String barrierId;
	private final long step;
	private final int participants;
	private final long createdAt;
	private final Consumer<Barrier> onComplete;

	private final ReentrantLock lock = new ReentrantLock();
	/* worker -> its single arrival, in arrival order */
	private final Map<String, CompletableFuture<BarrierReply>> arrivals = new LinkedHashMap<>();
	/* worker -> callers parked on its arrival */
	private final Map<String, Integer> waiters = new HashMap<>();
	private final Map<String, BarrierReply> released = new LinkedHashMap<>();
	private Status status = Status.WAITING;
	private long completedAt;
	private long lastActivity;
	private boolean discarded;

	Barrier(final String barrierId, final long step, final int participants, final Consumer<Barrier> onComplete) {
		Validate.isTrue(participants > 0, "a barrier needs participants");
		this.barrierId = barrierId;
		this.step = step;
		this.participants = participants;
		this.onComplete = onComplete;
		this.createdAt = DateTimeUtils.currentTimeMillis();
		this.lastActivity = createdAt;
	}

	/**
	 * @return the worker's arrival, already done when the barrier is complete,
	 * or null if the barrier was discarded and must be created again: dropped by the janitor,
	 * or released and now called at another step
	 */
	CompletableFuture<BarrierReply> arrive(final String workerId, final long step) {
		Map<CompletableFuture<BarrierReply>, BarrierReply> release = null;
		final CompletableFuture<BarrierReply> arrival;
		lock.lock();
		try {
			if (discarded) {
				return null;
			}
			if (status == Status.COMPLETE && step != this.step) {
				// the id moves on to its next phase
				discarded = true;
				return null;
			}
			if (step != this.step) {
				throw new CoordinatorException(ErrorKind.FAILED_PRECONDITION,
						"barrier " + barrierId + " is at step " + this.step + ", not " + step);
			}
			lastActivity = DateTimeUtils.currentTimeMillis();
			if (status == Status.COMPLETE) {
				final BarrierReply reply = released.get(workerId);
				if (reply == null) {
					throw new CoordinatorException(ErrorKind.FAILED_PRECONDITION,
							"barrier " + barrierId + " already released without worker: " + workerId);
				}
				return CompletableFuture.completedFuture(reply);
			}
			final CompletableFuture<BarrierReply> existing = arrivals.get(workerId);
			if (existing != null) {
				arrival = existing;
			} else {
				arrival = new CompletableFuture<>();
				arrivals.put(workerId, arrival);
			}
			waiters.merge(workerId, 1, Integer::sum);
			if (arrivals.size() == participants) {
				release = complete();
			}
		} finally {
			lock.unlock();
		}
		if (release != null) {
			// outside the lock: completions run the callers' continuations
			release.forEach(CompletableFuture::complete);
			onComplete.accept(this);
		}
		return arrival;
	}

	/* orders are 1-indexed by arrival */
	private Map<CompletableFuture<BarrierReply>, BarrierReply> complete() {
		status = Status.COMPLETE;
		completedAt = DateTimeUtils.currentTimeMillis();
		final Map<CompletableFuture<BarrierReply>, BarrierReply> release = new LinkedHashMap<>(arrivals.size());
		int order = 1;
		for (Map.Entry<String, CompletableFuture<BarrierReply>> e : arrivals.entrySet()) {
			final BarrierReply reply = new BarrierReply(barrierId, step, order++, participants);
			released.put(e.getKey(), reply);
			release.put(e.getValue(), reply);
		}
		waiters.clear();
		return release;
	}

	/**
	 * A caller stops waiting: timed out or gone. The worker's arrival is withdrawn
	 * when no other call of the same worker is still parked on it.
	 * @return FALSE if the barrier was already complete so the caller got released
	 */
	boolean withdraw(final String workerId, final CompletableFuture<BarrierReply> arrival) {
		lock.lock();
		try {
			if (status == Status.COMPLETE || arrival.isDone()) {
				return false;
			}
			if (arrivals.get(workerId) == arrival) {
				final int left = waiters.merge(workerId, -1, Integer::sum);
				if (left <= 0) {
					waiters.remove(workerId);
					arrivals.remove(workerId);
					arrival.cancel(false);
				}
				lastActivity = DateTimeUtils.currentTimeMillis();
			}
			return true;
		} finally {
			lock.unlock();
		}
	}

	/* drops the barrier if it's been released or abandoned long enough */
	boolean discardIf(final long now, final long completedRetention, final long abandonedRetention) {
		lock.lock();
		try {
			if (status == Status.COMPLETE) {
				discarded = now - completedAt > completedRetention;
			} else {
				discarded = arrivals.isEmpty() && now - lastActivity > abandonedRetention;
			}
			return discarded;
		} finally {
			lock.unlock();
		}
	}

	public Map<String, Object> toMap() {
		lock.lock();
		try {
			final Map<String, Object> map = new LinkedHashMap<>(8);
			map.put("barrier-id", barrierId);
			map.put("step", step);
			map.put("status", status);
			map.put("participants", participants);
			map.put("arrived", new ArrayList<>(status == Status.COMPLETE ? released.keySet() : arrivals.keySet()));
			map.put("created-at", createdAt);
			if (status == Status.COMPLETE) {
				map.put("completed-at", completedAt);
				map.put("latency-ms", completedAt - createdAt);
			}
			return map;
		} finally {
			lock.unlock();
		}
	}

	public String getBarrierId() {
		return barrierId;
	}
	public long getStep() {
		return step;
	}
	public int getParticipants() {
		return participants;
	}
	public long getCreatedAt() {
		return createdAt;
	}

	public Status getStatus() {
		lock.lock();
		try {
			return status;
		} finally {
			lock.unlock();
		}
	}

	public long getCompletedAt() {
		lock.lock();
		try {
			return completedAt;
		} finally {
			lock.unlock();
		}
	}

	public List<String> getArrived() {
		lock.lock();
		try {
			return Collections.unmodifiableList(new ArrayList<>(arrivals.keySet()));
		} finally {
			lock.unlock();
		}
	}

	@Override
	public String toString() {
		return barrierId + "@" + step + " (" + participants + ")";
	}

}
