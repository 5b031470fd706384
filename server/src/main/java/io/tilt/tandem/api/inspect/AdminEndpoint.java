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
package io.tilt.tandem.api.inspect;

import java.util.LinkedHashMap;
import java.util.Map;

import javax.inject.Singleton;
import javax.ws.rs.DefaultValue;
import javax.ws.rs.GET;
import javax.ws.rs.Path;
import javax.ws.rs.Produces;
import javax.ws.rs.QueryParam;
import javax.ws.rs.core.MediaType;
import javax.ws.rs.core.Response;

import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import io.tilt.tandem.api.Config;
import io.tilt.tandem.core.Service;
import io.tilt.tandem.core.leader.Coordinator;
import io.tilt.tandem.core.monitor.RecentEventsAppender;

@Path("admin")
@Singleton
@Component
public class AdminEndpoint {

	@Autowired
	private SystemStateMonitor monitor;
	@Autowired
	private Coordinator coordinator;
	@Autowired
	private Config config;

	@GET
	@Path("/config")
	@Produces(MediaType.APPLICATION_JSON)
	public Response config() throws Exception {
		return Response.accepted(config.toJson()).build();
	}

	@GET
	@Path("/snapshot")
	@Produces(MediaType.APPLICATION_JSON)
	public Response snapshot() {
		return Response.accepted(monitor.snapshotToJson()).build();
	}

	@GET
	@Path("/workers")
	@Produces(MediaType.APPLICATION_JSON)
	public Response workers() {
		return Response.accepted(monitor.workersToJson()).build();
	}

	@GET
	@Path("/datasets")
	@Produces(MediaType.APPLICATION_JSON)
	public Response datasets() {
		return Response.accepted(monitor.datasetsToJson()).build();
	}

	@GET
	@Path("/checkpoints")
	@Produces(MediaType.APPLICATION_JSON)
	public Response checkpoints() {
		return Response.accepted(monitor.checkpointsToJson()).build();
	}

	@GET
	@Path("/barriers")
	@Produces(MediaType.APPLICATION_JSON)
	public Response barriers() {
		return Response.accepted(monitor.barriersToJson()).build();
	}

	@GET
	@Path("/metrics")
	@Produces(MediaType.APPLICATION_JSON)
	public Response metrics() {
		return Response.accepted(monitor.metricsToJson()).build();
	}

	@GET
	@Path("/schedule")
	@Produces(MediaType.APPLICATION_JSON)
	public Response schedule() {
		return Response.accepted(monitor.scheduleToJson()).build();
	}

	/** @return 200 while the background services run, 503 otherwise */
	@GET
	@Path("/health")
	@Produces(MediaType.APPLICATION_JSON)
	public Response health() {
		final boolean up = coordinator.getLiveness().getState() == Service.State.STARTED
				&& coordinator.getBarriers().getState() == Service.State.STARTED;
		final Map<String, Object> map = new LinkedHashMap<>(4);
		map.put("status", up ? "UP" : "DOWN");
		map.put("workers", coordinator.getRegistry().worldSize());
		map.put("dead-workers", coordinator.getLiveness().getDeadCount());
		map.put("reporting-ratio", monitor.reportingRatio());
		return Response.status(up ? Response.Status.OK : Response.Status.SERVICE_UNAVAILABLE)
				.entity(map)
				.build();
	}

	@GET
	@Path("/logs")
	@Produces(MediaType.TEXT_PLAIN)
	public Response logs(@QueryParam("max") @DefaultValue("100") final int max) {
		return Response.ok(StringUtils.join(RecentEventsAppender.recent(Math.max(0, max)), '\n')).build();
	}

}
