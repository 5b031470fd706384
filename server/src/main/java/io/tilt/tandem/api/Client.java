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

import java.io.Closeable;

import javax.ws.rs.ProcessingException;
import javax.ws.rs.client.ClientBuilder;
import javax.ws.rs.client.Entity;
import javax.ws.rs.client.Invocation;
import javax.ws.rs.client.WebTarget;
import javax.ws.rs.core.MediaType;
import javax.ws.rs.core.Response;

import org.apache.commons.lang.StringUtils;
import org.apache.commons.lang.Validate;
import org.glassfish.jersey.client.ClientProperties;
import org.glassfish.jersey.jackson.JacksonFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.tilt.tandem.domain.Ack;
import io.tilt.tandem.domain.BarrierReply;
import io.tilt.tandem.domain.BarrierRequest;
import io.tilt.tandem.domain.CheckpointRecord;
import io.tilt.tandem.domain.DatasetAck;
import io.tilt.tandem.domain.DatasetSpec;
import io.tilt.tandem.domain.ErrorReply;
import io.tilt.tandem.domain.Heartbeat;
import io.tilt.tandem.domain.HeartbeatAck;
import io.tilt.tandem.domain.RecoveryInfo;
import io.tilt.tandem.domain.Registration;
import io.tilt.tandem.domain.ShardAssignment;
import io.tilt.tandem.domain.WorkerInfo;

/**
 * Remote access to a coordinator's operations.
 * Error replies are thrown back as the exception the coordinator raised: {@linkplain CoordinatorException}
 * subtypes or {@linkplain IllegalArgumentException}. An unreachable coordinator raises {@linkplain ProcessingException}.
 * Thread safe.
 *
 * @author Cristian Gonzalez
 */
public class Client implements Closeable {

	private static final Logger logger = LoggerFactory.getLogger(Client.class);

	private static final int CONNECT_TIMEOUT_MS = 5_000;
	private static final int READ_TIMEOUT_MS = 30_000;
	// extra wait on top of the barrier timeout, for the reply to travel
	private static final long BARRIER_READ_GRACE_MS = 5_000;

	private final javax.ws.rs.client.Client client;
	private final WebTarget base;

	/** @param baseUrl	like http://host:port/context */
	public Client(final String baseUrl) {
		Validate.isTrue(StringUtils.isNotBlank(baseUrl), "base url required");
		this.client = ClientBuilder.newBuilder()
				.register(ObjectMapperProvider.class)
				.register(JacksonFeature.class)
				.property(ClientProperties.CONNECT_TIMEOUT, CONNECT_TIMEOUT_MS)
				.property(ClientProperties.READ_TIMEOUT, READ_TIMEOUT_MS)
				.build();
		this.base = client.target(baseUrl).path("coordinator");
	}

	public Registration registerWorker(final WorkerInfo info) {
		return read(json("workers").post(Entity.json(info)), Registration.class);
	}

	/** @return FALSE if the worker was not registered */
	public boolean deregisterWorker(final String workerId) {
		return read(json("workers", workerId).delete(), Ack.class).isSuccess();
	}

	public DatasetAck registerDataset(final DatasetSpec spec) {
		return read(json("datasets").post(Entity.json(spec)), DatasetAck.class);
	}

	public ShardAssignment getShard(final String workerId, final String datasetId, final int epoch) {
		final Invocation.Builder req = base.path("datasets").path(datasetId).path("shard")
				.queryParam("worker", workerId)
				.queryParam("epoch", epoch)
				.request(MediaType.APPLICATION_JSON);
		return read(req.get(), ShardAssignment.class);
	}

	public HeartbeatAck heartbeat(final Heartbeat heartbeat) {
		return read(json("heartbeats").post(Entity.json(heartbeat)), HeartbeatAck.class);
	}

	public void notifyCheckpoint(final CheckpointRecord record) {
		read(json("checkpoints").post(Entity.json(record)), Ack.class);
	}

	public RecoveryInfo latestCheckpoint() {
		return read(json("checkpoints", "latest").get(), RecoveryInfo.class);
	}

	/**
	 * Blocks until the barrier releases.
	 * @param timeoutMs		zero for the coordinator's default
	 * @throws BarrierTimeoutException	when the timeout expires first
	 */
	public BarrierReply waitBarrier(final String workerId, final String barrierId, final long step, final long timeoutMs) {
		final Invocation.Builder req = json("barriers", barrierId);
		if (timeoutMs > 0) {
			req.property(ClientProperties.READ_TIMEOUT, (int) Math.min(Integer.MAX_VALUE, timeoutMs + BARRIER_READ_GRACE_MS));
		} else {
			// the coordinator's default may be long
			req.property(ClientProperties.READ_TIMEOUT, 0);
		}
		return read(req.post(Entity.json(new BarrierRequest(workerId, step, timeoutMs))), BarrierReply.class);
	}

	private Invocation.Builder json(final String... path) {
		WebTarget target = base;
		for (String p : path) {
			target = target.path(p);
		}
		return target.request(MediaType.APPLICATION_JSON);
	}

	private <T> T read(final Response response, final Class<T> type) {
		try {
			if (response.getStatusInfo().getFamily() == Response.Status.Family.SUCCESSFUL) {
				return response.readEntity(type);
			}
			final ErrorReply error = readError(response);
			if (logger.isDebugEnabled()) {
				logger.debug("{}: Replied {}", getClass().getSimpleName(), error);
			}
			throw CoordinatorException.of(error.getKind(), error.getMessage());
		} finally {
			response.close();
		}
	}

	private ErrorReply readError(final Response response) {
		try {
			final ErrorReply error = response.readEntity(ErrorReply.class);
			if (error != null && error.getKind() != null) {
				return error;
			}
		} catch (ProcessingException e) {
			logger.warn("{}: Unreadable error reply with status {}", getClass().getSimpleName(), response.getStatus(), e);
		}
		return new ErrorReply(ErrorKind.INTERNAL, "status " + response.getStatus());
	}

	@Override
	public void close() {
		client.close();
	}

}
