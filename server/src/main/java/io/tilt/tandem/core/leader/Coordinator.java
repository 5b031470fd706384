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

import java.util.function.Supplier;

import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.tilt.tandem.api.BarrierTimeoutException;
import io.tilt.tandem.api.Config;
import io.tilt.tandem.core.leader.BarrierCoordinator.Ticket;
import io.tilt.tandem.core.monitor.OperationStats;
import io.tilt.tandem.core.monitor.OperationStats.Operation;
import io.tilt.tandem.domain.BarrierReply;
import io.tilt.tandem.domain.CheckpointRecord;
import io.tilt.tandem.domain.DatasetAck;
import io.tilt.tandem.domain.DatasetSpec;
import io.tilt.tandem.domain.Heartbeat;
import io.tilt.tandem.domain.HeartbeatAck;
import io.tilt.tandem.domain.RecoveryInfo;
import io.tilt.tandem.domain.Registration;
import io.tilt.tandem.domain.ShardAssignment;
import io.tilt.tandem.domain.WorkerInfo;

/**
 * Entry point to the coordinator's operations, whatever the transport.
 * Counts and times every call.
 *
 * @author Cristian Gonzalez
 */
public class Coordinator {

	private final Logger logger = LoggerFactory.getLogger(getClass());

	private final Config config;
	private final WorkerRegistry registry;
	private final DatasetShardPlanner planner;
	private final LivenessTracker liveness;
	private final BarrierCoordinator barriers;
	private final CheckpointRegistry checkpoints;
	private final OperationStats stats;
	private final DateTime startTime;

	public Coordinator(
			final Config config,
			final WorkerRegistry registry,
			final DatasetShardPlanner planner,
			final LivenessTracker liveness,
			final BarrierCoordinator barriers,
			final CheckpointRegistry checkpoints,
			final OperationStats stats) {
		this.config = requireNonNull(config);
		this.registry = requireNonNull(registry);
		this.planner = requireNonNull(planner);
		this.liveness = requireNonNull(liveness);
		this.barriers = requireNonNull(barriers);
		this.checkpoints = requireNonNull(checkpoints);
		this.stats = requireNonNull(stats);
		this.startTime = new DateTime(DateTimeZone.UTC);
	}

	public Registration registerWorker(final WorkerInfo info) {
		return call(Operation.REGISTER_WORKER, () -> registry.register(info));
	}

	/** @return FALSE if the worker was not registered */
	public boolean deregisterWorker(final String workerId) {
		return call(Operation.DEREGISTER_WORKER, () -> registry.deregister(workerId));
	}

	public DatasetAck registerDataset(final DatasetSpec spec) {
		return call(Operation.REGISTER_DATASET, () -> {
			final boolean created = planner.registerDataset(spec);
			return new DatasetAck(spec.getDatasetId(), created, spec.getTotalBlocks());
		});
	}

	public ShardAssignment getShard(final String workerId, final String datasetId, final int epoch) {
		return call(Operation.GET_SHARD, () -> planner.getShard(workerId, datasetId, epoch));
	}

	public HeartbeatAck heartbeat(final Heartbeat heartbeat) {
		return call(Operation.HEARTBEAT, () -> new HeartbeatAck(liveness.heartbeat(heartbeat)));
	}

	public void notifyCheckpoint(final CheckpointRecord record) {
		call(Operation.NOTIFY_CHECKPOINT, () -> {
			checkpoints.notifyCheckpoint(record);
			return null;
		});
	}

	public RecoveryInfo latestCheckpoint() {
		return call(Operation.LATEST_CHECKPOINT, checkpoints::recovery);
	}

	/** Blocks the calling thread until released, timed out or interrupted */
	public BarrierReply waitBarrier(final String workerId, final String barrierId, final long step, final long timeoutMs) {
		return call(Operation.WAIT_BARRIER, () -> barriers.waitBarrier(workerId, barrierId, step, timeoutMs));
	}

	/** Non blocking version for asynchronous transports */
	public Ticket arriveBarrier(final String workerId, final String barrierId, final long step) {
		return call(Operation.WAIT_BARRIER, () -> barriers.arrive(workerId, barrierId, step));
	}

	private <T> T call(final Operation op, final Supplier<T> supplier) {
		stats.mark(op);
		final long start = System.currentTimeMillis();
		try {
			return supplier.get();
		} catch (BarrierTimeoutException e) {
			stats.markFailure();
			throw e;
		} catch (RuntimeException e) {
			stats.markFailure();
			logger.warn("{}: {} failed: {}", getClass().getSimpleName(), op, e.getMessage());
			throw e;
		} finally {
			if (op != Operation.WAIT_BARRIER) {
				stats.record(op, System.currentTimeMillis() - start);
			}
		}
	}

	public Config getConfig() {
		return config;
	}
	public WorkerRegistry getRegistry() {
		return registry;
	}
	public DatasetShardPlanner getPlanner() {
		return planner;
	}
	public LivenessTracker getLiveness() {
		return liveness;
	}
	public BarrierCoordinator getBarriers() {
		return barriers;
	}
	public CheckpointRegistry getCheckpoints() {
		return checkpoints;
	}
	public OperationStats getStats() {
		return stats;
	}
	public DateTime getStartTime() {
		return startTime;
	}

}
