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
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

import org.apache.commons.lang.StringUtils;
import org.apache.commons.lang.Validate;
import org.joda.time.DateTime;
import org.joda.time.DateTimeUtils;
import org.joda.time.DateTimeZone;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.tilt.tandem.api.Config;
import io.tilt.tandem.api.CoordinatorException;
import io.tilt.tandem.api.DuplicateWorkerException;
import io.tilt.tandem.api.ErrorKind;
import io.tilt.tandem.api.UnknownWorkerException;
import io.tilt.tandem.domain.Registration;
import io.tilt.tandem.domain.WorkerInfo;
import io.tilt.tandem.domain.WorkerRecord;

/**
 * Admission control of workers. Each admitted worker gets the smallest rank available,
 * held until it leaves: ranks of departed workers are reserved for a grace period before
 * they can be handed out again.
 * <p>
 * Ranks cover exactly [0, world size) only while nobody has left the session:
 * a departure opens a hole the next admission fills once the reservation expires.
 * <p>
 * All mutations go through a single lock, so that every reply sees a consistent world.
 *
 * @author Cristian Gonzalez
 */
public class WorkerRegistry {

	private final Logger logger = LoggerFactory.getLogger(getClass());

	/* reacts to admissions and departures */
	public interface Listener {
		default void onAdmitted(WorkerRecord record) {}
		default void onRemoved(WorkerRecord record, RemovalCause cause) {}
	}

	public enum RemovalCause {
		/* the worker said goodbye */
		DEREGISTERED,
		/* the worker went silent */
		EXPIRED,
	}

	private final Config config;
	private final ReentrantLock lock = new ReentrantLock();
	private final Map<String, WorkerRecord> workers = new HashMap<>();
	/* rank -> expiration of its reservation */
	private final Map<Integer, Long> reserved = new TreeMap<>();
	private final List<Listener> listeners = new CopyOnWriteArrayList<>();
	private long admissions;

	public WorkerRegistry(final Config config) {
		this.config = requireNonNull(config);
	}

	public void addListener(final Listener listener) {
		listeners.add(requireNonNull(listener));
	}

	/**
	 * Admits a worker into the session.
	 * @param info	the worker's self description
	 * @return the rank assigned and world size including the new worker
	 * @throws DuplicateWorkerException	when a live worker holds the same id
	 * @throws CoordinatorException	when the worker limit is reached
	 */
	public Registration register(final WorkerInfo info) {
		validate(info);
		final WorkerRecord record;
		final int worldSize;
		lock.lock();
		try {
			if (workers.containsKey(info.getWorkerId())) {
				throw new DuplicateWorkerException("worker already registered: " + info.getWorkerId());
			}
			if (workers.size() >= config.getRegistry().getMaxWorkers()) {
				throw new CoordinatorException(ErrorKind.CAPACITY_EXCEEDED,
						"worker limit reached: " + config.getRegistry().getMaxWorkers());
			}
			record = new WorkerRecord(info, nextRank(), new DateTime(DateTimeUtils.currentTimeMillis(), DateTimeZone.UTC));
			workers.put(info.getWorkerId(), record);
			worldSize = workers.size();
			admissions++;
		} finally {
			lock.unlock();
		}
		logger.info("{}: Admitted worker {} with rank {} (world size: {})", getClass().getSimpleName(),
				info, record.getRank(), worldSize);
		listeners.forEach(l -> l.onAdmitted(record));
		return new Registration(info.getWorkerId(), record.getRank(), worldSize,
				config.beatToMs(config.getLiveness().getHeartbeatFrequency()));
	}

	private void validate(final WorkerInfo info) {
		Validate.notNull(info, "worker info required");
		Validate.isTrue(StringUtils.isNotBlank(info.getWorkerId()), "worker id required");
		Validate.isTrue(StringUtils.isNotBlank(info.getHostname()), "hostname required");
		Validate.isTrue(info.getPort() >= 0 && info.getPort() <= 65535, "invalid port: " + info.getPort());
		Validate.isTrue(info.getGpuCount() >= 0, "invalid gpu count: " + info.getGpuCount());
		Validate.isTrue(info.getMemoryBytes() >= 0, "invalid memory: " + info.getMemoryBytes());
	}

	/* smallest rank neither held by a live worker nor reserved */
	private int nextRank() {
		final long now = DateTimeUtils.currentTimeMillis();
		final Iterator<Long> it = reserved.values().iterator();
		while (it.hasNext()) {
			if (it.next() <= now) {
				it.remove();
			}
		}
		final TreeSet<Integer> taken = new TreeSet<>(reserved.keySet());
		workers.values().forEach(w -> taken.add(w.getRank()));
		int rank = 0;
		for (Integer t : taken) {
			if (t != rank) {
				break;
			}
			rank++;
		}
		return rank;
	}

	/**
	 * @param workerId	of the leaving worker
	 * @return false if the worker was not registered
	 */
	public boolean deregister(final String workerId) {
		return remove(workerId, RemovalCause.DEREGISTERED);
	}

	/** Removes a worker found dead, same as a deregistration */
	public boolean evict(final String workerId) {
		return remove(workerId, RemovalCause.EXPIRED);
	}

	private boolean remove(final String workerId, final RemovalCause cause) {
		Validate.notNull(workerId);
		final WorkerRecord removed;
		lock.lock();
		try {
			removed = workers.remove(workerId);
			if (removed != null) {
				final long grace = config.beatToMs(config.getRegistry().getRankReleaseGrace());
				if (grace > 0) {
					reserved.put(removed.getRank(), DateTimeUtils.currentTimeMillis() + grace);
				}
			}
		} finally {
			lock.unlock();
		}
		if (removed == null) {
			logger.info("{}: Ignoring removal of unknown worker: {}", getClass().getSimpleName(), workerId);
			return false;
		}
		logger.info("{}: Removed worker {} ({}), rank {} released", getClass().getSimpleName(),
				removed, cause, removed.getRank());
		listeners.forEach(l -> l.onRemoved(removed, cause));
		return true;
	}

	public WorkerRecord get(final String workerId) {
		lock.lock();
		try {
			final WorkerRecord record = workers.get(workerId);
			if (record == null) {
				throw new UnknownWorkerException("worker not registered: " + workerId);
			}
			return record;
		} finally {
			lock.unlock();
		}
	}

	public int rankOf(final String workerId) {
		return get(workerId).getRank();
	}

	public boolean contains(final String workerId) {
		lock.lock();
		try {
			return workerId != null && workers.containsKey(workerId);
		} finally {
			lock.unlock();
		}
	}

	public int worldSize() {
		lock.lock();
		try {
			return workers.size();
		} finally {
			lock.unlock();
		}
	}

	/** @return live workers sorted by rank */
	public List<WorkerRecord> workers() {
		lock.lock();
		try {
			final List<WorkerRecord> list = new ArrayList<>(workers.values());
			Collections.sort(list);
			return list;
		} finally {
			lock.unlock();
		}
	}

	/**
	 * The worker's position within the live workers ordered by rank,
	 * and how many they are, both read at once.
	 * @return an array of {position, world size}
	 */
	public int[] positionOf(final String workerId) {
		lock.lock();
		try {
			final WorkerRecord record = workers.get(workerId);
			if (record == null) {
				throw new UnknownWorkerException("worker not registered: " + workerId);
			}
			int position = 0;
			for (WorkerRecord w : workers.values()) {
				if (w.getRank() < record.getRank()) {
					position++;
				}
			}
			return new int[] { position, workers.size() };
		} finally {
			lock.unlock();
		}
	}

	public long getAdmissions() {
		lock.lock();
		try {
			return admissions;
		} finally {
			lock.unlock();
		}
	}

}
