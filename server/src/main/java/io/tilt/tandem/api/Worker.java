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
package io.tilt.tandem.api;

import static java.util.Objects.requireNonNull;

import java.io.IOException;
import java.util.function.Supplier;

import org.apache.commons.lang.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;

import io.tilt.tandem.core.follower.CheckpointManager;
import io.tilt.tandem.core.follower.Heartpump;
import io.tilt.tandem.core.follower.LocalCheckpoint;
import io.tilt.tandem.core.task.Scheduler;
import io.tilt.tandem.core.task.impl.AgentFactoryImpl;
import io.tilt.tandem.core.task.impl.SchedulerImpl;
import io.tilt.tandem.domain.BarrierReply;
import io.tilt.tandem.domain.DatasetAck;
import io.tilt.tandem.domain.DatasetSpec;
import io.tilt.tandem.domain.RecoveryInfo;
import io.tilt.tandem.domain.Registration;
import io.tilt.tandem.domain.ResourceUsage;
import io.tilt.tandem.domain.ShardAssignment;
import io.tilt.tandem.domain.WorkerInfo;
import io.tilt.tandem.domain.WorkerStatus;

/**
 * A training process's side of the coordinator: registration, heartbeats,
 * data shards, barriers and checkpoints kept locally and booked remotely.
 * <p>
 * Registration failures are fatal, heartbeat and checkpoint notification failures are only logged.
 *
 * @author Cristian Gonzalez
 */
public class Worker {

	private static final Logger logger = LoggerFactory.getLogger(Worker.class);

	private final Config config;
	private final Client client;
	private final WorkerInfo info;
	private final CheckpointManager checkpoints;

	private volatile WorkerStatus status = WorkerStatus.idle();
	private volatile Supplier<ResourceUsage> resources = ResourceUsage::none;

	private Registration registration;
	private Scheduler scheduler;
	private Heartpump heartpump;

	public Worker(final Config config, final Client client, final WorkerInfo info) {
		this.config = requireNonNull(config);
		this.client = requireNonNull(client);
		this.info = requireNonNull(info);
		this.checkpoints = new CheckpointManager(config);
	}

	/**
	 * Registers at the coordinator and starts heartbeating.
	 * @return the rank and world size assigned
	 * @throws DuplicateWorkerException	when another live worker holds the same id
	 */
	public synchronized Registration start() {
		Validate.isTrue(registration == null, "worker already started");
		checkpoints.init();
		final Registration reg;
		try {
			reg = client.registerWorker(info);
		} catch (RuntimeException e) {
			logger.error("{}: Registration of {} failed: {}", getClass().getSimpleName(), info, e.toString());
			checkpoints.destroy();
			throw e;
		}
		logger.info("{}: Registered as {}", getClass().getSimpleName(), reg);
		this.scheduler = new SchedulerImpl(config, new AgentFactoryImpl(), "w-" + info.getWorkerId());
		this.scheduler.init();
		this.heartpump = new Heartpump(client, scheduler, info.getWorkerId(), reg.getHeartbeatIntervalMs(),
				() -> status, () -> resources.get());
		this.heartpump.init();
		this.registration = reg;
		return reg;
	}

	/** @param status	reported from the next heartbeat on */
	public void setStatus(final WorkerStatus status) {
		this.status = requireNonNull(status);
	}

	public void setResources(final Supplier<ResourceUsage> resources) {
		this.resources = requireNonNull(resources);
	}

	public DatasetAck registerDataset(final DatasetSpec spec) {
		return client.registerDataset(spec);
	}

	public ShardAssignment getShard(final String datasetId, final int epoch) {
		return client.getShard(info.getWorkerId(), datasetId, epoch);
	}

	/** @throws BarrierTimeoutException when the others didn't arrive in time */
	public BarrierReply waitBarrier(final String barrierId, final long step, final long timeoutMs) {
		return client.waitBarrier(info.getWorkerId(), barrierId, step, timeoutMs);
	}

	/**
	 * Saves the checkpoint locally and notifies the coordinator.
	 * @return the durable checkpoint
	 * @throws IOException	when the local write failed, the coordinator is not notified then
	 */
	public LocalCheckpoint checkpoint(final byte[] data, final long step, final int epoch) throws IOException {
		final WorkerStatus previous = status;
		setStatus(WorkerStatus.checkpointing(step, epoch));
		try {
			final LocalCheckpoint saved = checkpoints.save(data, step, epoch);
			notifyCheckpoint(saved);
			return saved;
		} finally {
			setStatus(previous);
		}
	}

	/** Same as {@linkplain #checkpoint(byte[], long, int)} without waiting the write */
	public ListenableFuture<LocalCheckpoint> checkpointAsync(final byte[] data, final long step, final int epoch)
			throws IOException {
		final ListenableFuture<LocalCheckpoint> future = checkpoints.saveAsync(data, step, epoch);
		Futures.addCallback(future, new FutureCallback<LocalCheckpoint>() {
			@Override
			public void onSuccess(final LocalCheckpoint saved) {
				notifyCheckpoint(saved);
			}
			@Override
			public void onFailure(final Throwable t) {
				logger.debug("{}: Coordinator not notified of failed checkpoint at step {}",
						Worker.class.getSimpleName(), step);
			}
		}, MoreExecutors.directExecutor());
		return future;
	}

	private void notifyCheckpoint(final LocalCheckpoint saved) {
		try {
			client.notifyCheckpoint(saved.toRecord(info.getWorkerId()));
		} catch (RuntimeException e) {
			logger.warn("{}: Coordinator not notified of checkpoint {}: {}", getClass().getSimpleName(),
					saved, e.toString());
		}
	}

	/** @return where to resume training from, by the coordinator's bookkeeping */
	public RecoveryInfo recover() {
		return client.latestCheckpoint();
	}

	/**
	 * Stops heartbeating, drains pending checkpoint writes and leaves the coordinator.
	 * Repeated calls do nothing.
	 */
	public synchronized void shutdown() {
		if (registration == null) {
			return;
		}
		heartpump.destroy();
		checkpoints.destroy();
		scheduler.destroy();
		try {
			client.deregisterWorker(info.getWorkerId());
		} catch (RuntimeException e) {
			logger.warn("{}: Could not deregister worker {}: {}", getClass().getSimpleName(),
					info.getWorkerId(), e.toString());
		}
		registration = null;
	}

	public Registration getRegistration() {
		return registration;
	}
	public CheckpointManager getCheckpoints() {
		return checkpoints;
	}
	public Heartpump getHeartpump() {
		return heartpump;
	}
	public WorkerInfo getInfo() {
		return info;
	}

}
