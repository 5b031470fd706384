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
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.apache.commons.lang.StringUtils;
import org.apache.commons.lang.Validate;
import org.joda.time.DateTimeUtils;

import io.tilt.tandem.api.BarrierTimeoutException;
import io.tilt.tandem.api.Config;
import io.tilt.tandem.api.CoordinatorException;
import io.tilt.tandem.api.ErrorKind;
import io.tilt.tandem.api.UnknownWorkerException;
import io.tilt.tandem.core.impl.ServiceImpl;
import io.tilt.tandem.core.monitor.OperationStats;
import io.tilt.tandem.core.monitor.OperationStats.Operation;
import io.tilt.tandem.core.task.Scheduler;
import io.tilt.tandem.core.task.Scheduler.Action;
import io.tilt.tandem.core.task.Scheduler.Agent;
import io.tilt.tandem.core.task.Scheduler.Frequency;
import io.tilt.tandem.domain.BarrierReply;
import io.tilt.tandem.utils.LogUtils;

/**
 * Rendezvous of the registered workers. The first arrival creates the barrier and fixes its
 * participants to the world size at that moment. Callers park until all participants arrive,
 * or their own timeout expires: a timed out caller is withdrawn and the rest keep waiting.
 * <p>
 * Barriers are independent of each other. Released barriers are kept for a while to answer
 * duplicate calls with the original reply, then a janitor drops them.
 *
 * @author Cristian Gonzalez
 */
public class BarrierCoordinator extends ServiceImpl {

	private final Config config;
	private final WorkerRegistry registry;
	private final Scheduler scheduler;
	private final OperationStats stats;
	private final Agent janitor;
	private final Map<String, Barrier> barriers;

	/** A caller's arrival, to be waited or withdrawn */
	public static final class Ticket {
		private final Barrier barrier;
		private final String workerId;
		private final CompletableFuture<BarrierReply> arrival;

		private Ticket(final Barrier barrier, final String workerId, final CompletableFuture<BarrierReply> arrival) {
			this.barrier = barrier;
			this.workerId = workerId;
			this.arrival = arrival;
		}
		public CompletableFuture<BarrierReply> getArrival() {
			return arrival;
		}
		/** @return FALSE if too late: the barrier was released */
		public boolean withdraw() {
			return barrier.withdraw(workerId, arrival);
		}
		public Barrier getBarrier() {
			return barrier;
		}
	}

	public BarrierCoordinator(
			final Config config,
			final WorkerRegistry registry,
			final Scheduler scheduler,
			final OperationStats stats) {
		this.config = requireNonNull(config);
		this.registry = requireNonNull(registry);
		this.scheduler = requireNonNull(scheduler);
		this.stats = requireNonNull(stats);
		this.barriers = new ConcurrentHashMap<>();
		this.janitor = scheduler.getAgentFactory()
				.create(Action.BARRIER_JANITOR, Frequency.PERIODIC, () -> cleanup())
				.delayed(config.beatToMs(config.getBarrier().getJanitorFrequency()))
				.every(config.beatToMs(config.getBarrier().getJanitorFrequency()))
				.build();
	}

	@Override
	public void start() {
		logger.info("{}: Starting. Default barrier timeout: {} ms", getName(),
				config.getBarrier().getDefaultTimeoutMs());
		scheduler.schedule(janitor);
	}

	@Override
	public void stop() {
		logger.info("{}: Stopping", getName());
		scheduler.stop(janitor);
		for (Barrier barrier : barriers.values()) {
			if (barrier.getStatus() == Barrier.Status.WAITING) {
				logger.warn("{}: Abandoning barrier {} with arrivals: {}", getName(), barrier, barrier.getArrived());
			}
		}
	}

	/**
	 * Non blocking arrival: the ticket's future completes when the barrier releases.
	 * Callers giving up must withdraw the ticket.
	 */
	public Ticket arrive(final String workerId, final String barrierId, final long step) {
		Validate.isTrue(StringUtils.isNotBlank(workerId), "worker id required");
		Validate.isTrue(StringUtils.isNotBlank(barrierId), "barrier id required");
		Validate.isTrue(step >= 0, "invalid step: " + step);
		if (!registry.contains(workerId)) {
			throw new UnknownWorkerException("barrier call from unregistered worker: " + workerId);
		}
		while (true) {
			final Barrier barrier = barriers.computeIfAbsent(barrierId, id -> create(id, step));
			final CompletableFuture<BarrierReply> arrival = barrier.arrive(workerId, step);
			if (arrival != null) {
				if (logger.isDebugEnabled()) {
					logger.debug("{}: {} Worker {} arrived at {}", getName(), LogUtils.BARRIER_CHAR, workerId, barrier);
				}
				return new Ticket(barrier, workerId, arrival);
			}
			// dropped by the janitor or released at a previous step
			if (barriers.get(barrierId) == barrier) {
				barriers.replace(barrierId, barrier, create(barrierId, step));
			}
		}
	}

	private Barrier create(final String barrierId, final long step) {
		final int participants = Math.max(1, registry.worldSize());
		logger.info("{}: {} Barrier {} at step {} created for {} participants", getName(), LogUtils.BARRIER_CHAR,
				barrierId, step, participants);
		return new Barrier(barrierId, step, participants, this::released);
	}

	private void released(final Barrier barrier) {
		final long latency = barrier.getCompletedAt() - barrier.getCreatedAt();
		stats.record(Operation.BARRIER_RELEASE, latency);
		logger.info("{}: {} Barrier {} released after {} ms", getName(), LogUtils.BARRIER_CHAR, barrier, latency);
	}

	/**
	 * Blocks until every participant arrives.
	 * @param timeoutMs	zero for the configured default
	 * @return the caller's arrival order and the participant count
	 * @throws BarrierTimeoutException	when the timeout expires first
	 * @throws CoordinatorException	CANCELLED when the calling thread is interrupted
	 */
	public BarrierReply waitBarrier(final String workerId, final String barrierId, final long step, final long timeoutMs) {
		Validate.isTrue(timeoutMs >= 0, "invalid barrier timeout: " + timeoutMs);
		final long timeout = timeoutMs > 0 ? timeoutMs : config.getBarrier().getDefaultTimeoutMs();
		final Ticket ticket = arrive(workerId, barrierId, step);
		try {
			return ticket.getArrival().get(timeout, TimeUnit.MILLISECONDS);
		} catch (TimeoutException e) {
			if (ticket.withdraw()) {
				logger.warn("{}: Worker {} timed out after {} ms at barrier {} ({} of {} arrived)", getName(),
						workerId, timeout, barrierId, ticket.getBarrier().getArrived().size(),
						ticket.getBarrier().getParticipants());
				throw new BarrierTimeoutException("barrier " + barrierId + " not complete after " + timeout + " ms");
			}
			return ticket.getArrival().join();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			if (ticket.withdraw()) {
				throw new CoordinatorException(ErrorKind.CANCELLED, "barrier wait interrupted: " + barrierId, e);
			}
			return ticket.getArrival().join();
		} catch (CancellationException e) {
			throw new CoordinatorException(ErrorKind.CANCELLED, "barrier wait cancelled: " + barrierId, e);
		} catch (ExecutionException e) {
			throw new IllegalStateException("barrier wait failed: " + barrierId, e.getCause());
		}
	}

	/** Drops released barriers past their retention and abandoned ones. Run by the scheduler. */
	public void cleanup() {
		final long now = DateTimeUtils.currentTimeMillis();
		final long completed = config.beatToMs(config.getBarrier().getCompletedRetention());
		final long abandoned = config.beatToMs(config.getBarrier().getAbandonedRetention());
		for (Barrier barrier : new ArrayList<>(barriers.values())) {
			if (barrier.discardIf(now, completed, abandoned)) {
				barriers.remove(barrier.getBarrierId(), barrier);
				logger.info("{}: Dropped {} barrier {}", getName(), barrier.getStatus().name().toLowerCase(), barrier);
			}
		}
	}

	public Barrier get(final String barrierId) {
		final Barrier barrier = barrierId == null ? null : barriers.get(barrierId);
		if (barrier == null) {
			throw new CoordinatorException(ErrorKind.NOT_FOUND, "barrier not found: " + barrierId);
		}
		return barrier;
	}

	public List<Barrier> barriers() {
		return new ArrayList<>(barriers.values());
	}

}
