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

import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import javax.inject.Singleton;
import javax.ws.rs.Consumes;
import javax.ws.rs.DELETE;
import javax.ws.rs.GET;
import javax.ws.rs.POST;
import javax.ws.rs.Path;
import javax.ws.rs.PathParam;
import javax.ws.rs.Produces;
import javax.ws.rs.QueryParam;
import javax.ws.rs.container.AsyncResponse;
import javax.ws.rs.container.ConnectionCallback;
import javax.ws.rs.container.Suspended;
import javax.ws.rs.core.MediaType;
import javax.ws.rs.core.Response;

import org.apache.commons.lang.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import io.tilt.tandem.core.leader.BarrierCoordinator.Ticket;
import io.tilt.tandem.core.leader.Coordinator;
import io.tilt.tandem.domain.Ack;
import io.tilt.tandem.domain.BarrierRequest;
import io.tilt.tandem.domain.CheckpointRecord;
import io.tilt.tandem.domain.DatasetSpec;
import io.tilt.tandem.domain.ErrorReply;
import io.tilt.tandem.domain.Heartbeat;
import io.tilt.tandem.domain.WorkerInfo;

/**
 * Restful surface of the coordinator's operations, used by {@linkplain Client}.
 * Failures are replied with an {@linkplain ErrorReply} and the http status of its kind.
 *
 * @author Cristian Gonzalez
 */
@Path("coordinator")
@Singleton
@Component
public class CoordinatorEndpoint {

	private static final Logger logger = LoggerFactory.getLogger(CoordinatorEndpoint.class);

	@Autowired
	private Coordinator coordinator;
	@Autowired
	private Config config;

	@POST
	@Path("/workers")
	@Consumes(MediaType.APPLICATION_JSON)
	@Produces(MediaType.APPLICATION_JSON)
	public Response registerWorker(final WorkerInfo info) {
		return reply("registering worker", () -> coordinator.registerWorker(info));
	}

	@DELETE
	@Path("/workers/{workerId}")
	@Produces(MediaType.APPLICATION_JSON)
	public Response deregisterWorker(@PathParam("workerId") final String workerId) {
		return reply("deregistering worker", () -> coordinator.deregisterWorker(workerId)
				? Ack.ok("deregistered: " + workerId)
				: new Ack(false, "not registered: " + workerId));
	}

	@POST
	@Path("/datasets")
	@Consumes(MediaType.APPLICATION_JSON)
	@Produces(MediaType.APPLICATION_JSON)
	public Response registerDataset(final DatasetSpec spec) {
		return reply("registering dataset", () -> coordinator.registerDataset(spec));
	}

	@GET
	@Path("/datasets/{datasetId}/shard")
	@Produces(MediaType.APPLICATION_JSON)
	public Response getShard(
			@PathParam("datasetId") final String datasetId,
			@QueryParam("worker") final String workerId,
			@QueryParam("epoch") final int epoch) {
		return reply("assigning shard", () -> coordinator.getShard(workerId, datasetId, epoch));
	}

	@POST
	@Path("/heartbeats")
	@Consumes(MediaType.APPLICATION_JSON)
	@Produces(MediaType.APPLICATION_JSON)
	public Response heartbeat(final Heartbeat heartbeat) {
		return reply("receiving heartbeat", () -> coordinator.heartbeat(heartbeat));
	}

	@POST
	@Path("/checkpoints")
	@Consumes(MediaType.APPLICATION_JSON)
	@Produces(MediaType.APPLICATION_JSON)
	public Response notifyCheckpoint(final CheckpointRecord record) {
		return reply("notifying checkpoint", () -> {
			coordinator.notifyCheckpoint(record);
			return Ack.ok("checkpoint registered: " + record.getCheckpointId());
		});
	}

	@GET
	@Path("/checkpoints/latest")
	@Produces(MediaType.APPLICATION_JSON)
	public Response latestCheckpoint() {
		return reply("reading latest checkpoint", () -> coordinator.latestCheckpoint());
	}

	/**
	 * Parks the request without holding a server thread, until the barrier releases,
	 * the caller's timeout expires or the caller disconnects.
	 */
	@POST
	@Path("/barriers/{barrierId}")
	@Consumes(MediaType.APPLICATION_JSON)
	@Produces(MediaType.APPLICATION_JSON)
	public void waitBarrier(
			@PathParam("barrierId") final String barrierId,
			final BarrierRequest request,
			@Suspended final AsyncResponse async) {
		final Ticket ticket;
		try {
			if (request == null) {
				throw new IllegalArgumentException("barrier request required");
			}
			Validate.isTrue(request.getTimeoutMs() >= 0, "invalid barrier timeout: " + request.getTimeoutMs());
			ticket = coordinator.arriveBarrier(request.getWorkerId(), barrierId, request.getStep());
		} catch (RuntimeException e) {
			async.resume(error("arriving barrier", e));
			return;
		}
		final long timeout = request.getTimeoutMs() > 0
				? request.getTimeoutMs() : config.getBarrier().getDefaultTimeoutMs();
		async.setTimeoutHandler(ar -> {
			if (ticket.withdraw()) {
				logger.warn("{}: Worker {} timed out after {} ms at barrier {}", getClass().getSimpleName(),
						request.getWorkerId(), timeout, barrierId);
				ar.resume(error(ErrorKind.BARRIER_TIMEOUT,
						"barrier " + barrierId + " not complete after " + timeout + " ms"));
			}
		});
		async.register((ConnectionCallback) ar -> {
			if (ticket.withdraw()) {
				logger.info("{}: Worker {} left barrier {}", getClass().getSimpleName(),
						request.getWorkerId(), barrierId);
			}
		});
		async.setTimeout(timeout, TimeUnit.MILLISECONDS);
		ticket.getArrival().whenComplete((reply, e) -> {
			if (e instanceof CancellationException) {
				// withdrawn: the timeout already replied or the caller is gone
				return;
			} else if (e != null) {
				async.resume(error("waiting barrier", e));
			} else {
				async.resume(Response.ok(reply).build());
			}
		});
	}

	private Response reply(final String action, final Supplier<Object> operation) {
		try {
			return Response.ok(operation.get()).build();
		} catch (RuntimeException e) {
			return error(action, e);
		}
	}

	private static Response error(final String action, final Throwable t) {
		final ErrorKind kind = CoordinatorException.kindOf(t);
		if (kind == ErrorKind.INTERNAL) {
			logger.error("{}: Unexpected while {}", CoordinatorEndpoint.class.getSimpleName(), action, t);
		} else if (logger.isDebugEnabled()) {
			logger.debug("{}: {} while {}: {}", CoordinatorEndpoint.class.getSimpleName(), kind, action, t.getMessage());
		}
		return error(kind, t.getMessage());
	}

	private static Response error(final ErrorKind kind, final String message) {
		return Response.status(kind.getHttpCode())
				.type(MediaType.APPLICATION_JSON)
				.entity(new ErrorReply(kind, message))
				.build();
	}

}
