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

import static java.util.Objects.requireNonNull;

import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

import org.apache.commons.lang.Validate;

import io.tilt.tandem.api.Client;
import io.tilt.tandem.api.UnknownWorkerException;
import io.tilt.tandem.core.impl.ServiceImpl;
import io.tilt.tandem.core.task.Scheduler;
import io.tilt.tandem.core.task.Scheduler.Action;
import io.tilt.tandem.core.task.Scheduler.Agent;
import io.tilt.tandem.core.task.Scheduler.Frequency;
import io.tilt.tandem.domain.Heartbeat;
import io.tilt.tandem.domain.HeartbeatAck;
import io.tilt.tandem.domain.ResourceUsage;
import io.tilt.tandem.domain.WorkerStatus;
import io.tilt.tandem.utils.LogUtils;

/**
 * Reports the worker's status and resources to the coordinator at a fixed rate.
 * A failed beat is logged and the next one goes on schedule.
 *
 * @author Cristian Gonzalez
 * @since Nov 17, 2015
 */
public class Heartpump extends ServiceImpl {

	private final Client client;
	private final Scheduler scheduler;
	private final String workerId;
	private final Supplier<WorkerStatus> status;
	private final Supplier<ResourceUsage> resources;
	private final Agent pump;

	private final AtomicLong sent;
	private final AtomicLong failed;
	private volatile long lastServerTimestamp;

	public Heartpump(
			final Client client,
			final Scheduler scheduler,
			final String workerId,
			final long intervalMs,
			final Supplier<WorkerStatus> status,
			final Supplier<ResourceUsage> resources) {
		Validate.notNull(workerId);
		Validate.isTrue(intervalMs > 0, "heartbeat interval must be positive");
		this.client = requireNonNull(client);
		this.scheduler = requireNonNull(scheduler);
		this.workerId = workerId;
		this.status = requireNonNull(status);
		this.resources = requireNonNull(resources);
		this.sent = new AtomicLong();
		this.failed = new AtomicLong();
		this.pump = scheduler.getAgentFactory()
				.create(Action.HEARTBEAT_REPORT, Frequency.PERIODIC, () -> beat())
				.every(intervalMs)
				.build();
	}

	@Override
	public void start() {
		logger.info("{}: Starting heartbeats for worker {} every {} ms", getName(), workerId, pump.getPeriodicDelay());
		scheduler.schedule(pump);
	}

	@Override
	public void stop() {
		logger.info("{}: Stopping heartbeats for worker {} after {} sent ({} failed)", getName(), workerId,
				sent.get(), failed.get());
		scheduler.stop(pump);
	}

	/** Sends one heartbeat now */
	public boolean beat() {
		try {
			final Heartbeat hb = Heartbeat.builder(workerId)
					.status(status.get())
					.resources(resources.get())
					.build();
			final HeartbeatAck ack = client.heartbeat(hb);
			lastServerTimestamp = ack.getServerTimestampMs();
			sent.incrementAndGet();
			if (logger.isDebugEnabled()) {
				logger.debug("{}: {} Sent {}", getName(), LogUtils.HB_CHAR, hb);
			}
			return true;
		} catch (UnknownWorkerException e) {
			failed.incrementAndGet();
			logger.error("{}: {} Worker {} no longer registered at the coordinator: {}", getName(),
					LogUtils.HB_CHAR, workerId, e.getMessage());
		} catch (RuntimeException e) {
			failed.incrementAndGet();
			logger.warn("{}: {} Heartbeat failed, next one on schedule: {}", getName(), LogUtils.HB_CHAR,
					e.toString());
		}
		return false;
	}

	public long getSent() {
		return sent.get();
	}
	public long getFailed() {
		return failed.get();
	}
	public long getLastServerTimestamp() {
		return lastServerTimestamp;
	}

}
