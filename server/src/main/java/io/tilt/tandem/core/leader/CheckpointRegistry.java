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
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;

import org.apache.commons.lang.StringUtils;
import org.apache.commons.lang.Validate;
import org.joda.time.DateTimeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.tilt.tandem.api.Config;
import io.tilt.tandem.domain.CheckpointRecord;
import io.tilt.tandem.domain.RecoveryInfo;
import io.tilt.tandem.utils.LogUtils;

/**
 * Bookkeeping of the checkpoints workers report, for observability and recovery.
 * Never touches checkpoint bytes.
 *
 * @author Cristian Gonzalez
 */
public class CheckpointRegistry {

	private final Logger logger = LoggerFactory.getLogger(getClass());

	public static final long THROUGHPUT_WINDOW_MS = 60_000;

	private static final Comparator<CheckpointRecord> BY_PROGRESS = Comparator
			.comparingLong(CheckpointRecord::getStep)
			.thenComparingLong(CheckpointRecord::getTimestampMs);

	private final Config config;
	private final Map<String, CheckpointRecord> records;
	/* reception times within the last throughput window */
	private final ConcurrentLinkedDeque<Long> receptions;

	public CheckpointRegistry(final Config config) {
		this.config = requireNonNull(config);
		this.records = new ConcurrentHashMap<>();
		this.receptions = new ConcurrentLinkedDeque<>();
	}

	/**
	 * Books the record, overwriting any previous one with the same id.
	 * @param record	as reported by the worker
	 */
	public void notifyCheckpoint(final CheckpointRecord record) {
		Validate.notNull(record, "checkpoint record required");
		Validate.isTrue(StringUtils.isNotBlank(record.getCheckpointId()), "checkpoint id required");
		Validate.isTrue(StringUtils.isNotBlank(record.getWorkerId()), "worker id required");
		Validate.isTrue(record.getStep() >= 0, "invalid step: " + record.getStep());
		Validate.isTrue(record.getEpoch() >= 0, "invalid epoch: " + record.getEpoch());
		Validate.isTrue(record.getSizeBytes() >= 0, "invalid size: " + record.getSizeBytes());

		records.put(record.getCheckpointId(), record);
		receptions.addLast(DateTimeUtils.currentTimeMillis());
		pruneReceptions();
		logger.info("{}: Checkpoint {} at {} ({})", getClass().getSimpleName(), record,
				record.getStoragePath(), LogUtils.humanBytes(record.getSizeBytes()));
		trim();
	}

	/* oldest notifications go first */
	private void trim() {
		final int max = config.getCheckpoint().getMaxRecords();
		if (records.size() > max) {
			final List<CheckpointRecord> all = new ArrayList<>(records.values());
			all.sort(Comparator.comparingLong(CheckpointRecord::getTimestampMs));
			for (int i = 0; i < all.size() - max; i++) {
				records.remove(all.get(i).getCheckpointId(), all.get(i));
			}
		}
	}

	/** @return records, newest first */
	public List<CheckpointRecord> records() {
		final List<CheckpointRecord> list = new ArrayList<>(records.values());
		list.sort(Comparator.comparingLong(CheckpointRecord::getTimestampMs).reversed());
		return list;
	}

	/** @return the most advanced record by step, latest reported on ties */
	public Optional<CheckpointRecord> latest() {
		return records.values().stream().max(BY_PROGRESS);
	}

	public RecoveryInfo recovery() {
		return latest().map(RecoveryInfo::from).orElseGet(RecoveryInfo::none);
	}

	/** @return notifications received during the last window, up to the throughput window */
	public long notificationsWithin(final long windowMs) {
		pruneReceptions();
		final long since = DateTimeUtils.currentTimeMillis() - windowMs;
		return receptions.stream().filter(at -> at >= since).count();
	}

	private void pruneReceptions() {
		final long since = DateTimeUtils.currentTimeMillis() - THROUGHPUT_WINDOW_MS;
		Long head;
		while ((head = receptions.peekFirst()) != null && head < since) {
			receptions.pollFirst();
		}
	}

	public int size() {
		return records.size();
	}

}
