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

import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.commons.lang.StringUtils;
import org.apache.commons.lang.Validate;
import org.joda.time.DateTimeUtils;

import com.google.common.collect.EvictingQueue;

import io.tilt.tandem.api.Config;
import io.tilt.tandem.api.UnknownWorkerException;
import io.tilt.tandem.core.impl.ServiceImpl;
import io.tilt.tandem.core.task.Scheduler;
import io.tilt.tandem.core.task.Scheduler.Action;
import io.tilt.tandem.core.task.Scheduler.Agent;
import io.tilt.tandem.core.task.Scheduler.Frequency;
import io.tilt.tandem.domain.Heartbeat;
import io.tilt.tandem.domain.WorkerLiveness;
import io.tilt.tandem.domain.WorkerRecord;
import io.tilt.tandem.utils.LogUtils;

/**
 * Ingests heartbeats and keeps the latest status of each worker.
 * A periodic sweep flags as dead the workers silent for longer than the heartbeat timeout
 * and evicts them from the registry, so they stop counting for barriers and shards.
 * <p>
 * Liveness is advisory: a partitioned but alive worker will be evicted all the same.
 *
 * @author Cristian Gonzalez
 * @since Dec 2, 2015
 */
public class LivenessTracker extends ServiceImpl implements WorkerRegistry.Listener {

	private static final int RECENTLY_DEAD_SIZE = 50;

	private final Config config;
	private final WorkerRegistry registry;
	private final Scheduler scheduler;
	private final Agent sweeper;

	private final Map<String, WorkerLiveness> entries;
	private final EvictingQueue<WorkerLiveness> recentlyDead;
	private final AtomicLong deadCount;
	private final AtomicLong heartbeats;

	public LivenessTracker(final Config config, final WorkerRegistry registry, final Scheduler scheduler) {
		this.config = requireNonNull(config);
		this.registry = requireNonNull(registry);
		this.scheduler = requireNonNull(scheduler);
		this.entries = new ConcurrentHashMap<>();
		this.recentlyDead = EvictingQueue.create(RECENTLY_DEAD_SIZE);
		this.deadCount = new AtomicLong();
		this.heartbeats = new AtomicLong();
		this.sweeper = scheduler.getAgentFactory()
				.create(Action.LIVENESS_SWEEP, Frequency.PERIODIC, () -> sweep())
				.delayed(config.beatToMs(config.getLiveness().getSweepStartDelay()))
				.every(config.beatToMs(config.getLiveness().getSweepFrequency()))
				.build();
		registry.addListener(this);
	}

	@Override
	public void start() {
		logger.info("{}: Starting. Scheduling sweep for workers silent over {} ms", getName(),
				config.beatToMs(config.getLiveness().getHeartbeatTimeout()));
		scheduler.schedule(sweeper);
	}

	@Override
	public void stop() {
		logger.info("{}: Stopping", getName());
		this.scheduler.stop(sweeper);
	}

	@Override
	public void onAdmitted(final WorkerRecord record) {
		// silent workers must also expire
		entries.put(record.getWorkerId(), WorkerLiveness.admitted(record.getWorkerId(), now()));
	}

	@Override
	public void onRemoved(final WorkerRecord record, final WorkerRegistry.RemovalCause cause) {
		entries.remove(record.getWorkerId());
	}

	/**
	 * Overwrites what's known about the worker.
	 * @param hb	the heartbeat
	 * @return reception time
	 * @throws UnknownWorkerException	for workers never registered or already evicted
	 */
	public long heartbeat(final Heartbeat hb) {
		Validate.notNull(hb, "heartbeat required");
		Validate.isTrue(StringUtils.isNotBlank(hb.getWorkerId()), "worker id required");
		if (!registry.contains(hb.getWorkerId())) {
			throw new UnknownWorkerException("heartbeat from unregistered worker: " + hb.getWorkerId());
		}
		final long now = now();
		final WorkerLiveness updated = entries.compute(hb.getWorkerId(), (id, prev) -> prev == null
				? WorkerLiveness.admitted(id, now).beat(hb, now)
				: prev.beat(hb, now));
		heartbeats.incrementAndGet();
		if (logger.isDebugEnabled()) {
			logger.debug("{}: {} {}", getName(), LogUtils.HB_CHAR, updated);
		}
		return now;
	}

	/** Flags and evicts workers gone silent. Run by the scheduler. */
	public void sweep() {
		final long now = now();
		final long timeout = config.beatToMs(config.getLiveness().getHeartbeatTimeout());
		for (WorkerLiveness entry : new ArrayList<>(entries.values())) {
			if (!registry.contains(entry.getWorkerId())) {
				// heartbeat raced with an eviction
				entries.remove(entry.getWorkerId(), entry);
			} else if (now - entry.getLastSeen() > timeout && !entry.isDead()) {
				final WorkerLiveness dead = entry.died();
				if (!entries.replace(entry.getWorkerId(), entry, dead)) {
					// a heartbeat just came in
					continue;
				}
				deadCount.incrementAndGet();
				synchronized (recentlyDead) {
					recentlyDead.add(dead);
				}
				logger.warn("{}: {} Worker {} silent for {} ms, found dead", getName(), LogUtils.CRASH,
						entry.getWorkerId(), now - entry.getLastSeen());
				if (config.getLiveness().isEvictDeadWorkers()) {
					registry.evict(entry.getWorkerId());
				}
			}
		}
	}

	public WorkerLiveness status(final String workerId) {
		final WorkerLiveness entry = workerId == null ? null : entries.get(workerId);
		if (entry == null) {
			throw new UnknownWorkerException("no liveness for worker: " + workerId);
		}
		return entry;
	}

	/** @return snapshot of the known workers */
	public List<WorkerLiveness> entries() {
		return new ArrayList<>(entries.values());
	}

	public List<WorkerLiveness> recentlyDead() {
		synchronized (recentlyDead) {
			return new ArrayList<>(recentlyDead);
		}
	}

	public long getDeadCount() {
		return deadCount.get();
	}

	public long getHeartbeats() {
		return heartbeats.get();
	}

	private static long now() {
		return DateTimeUtils.currentTimeMillis();
	}

}
