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

import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.math3.util.Precision;
import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.tilt.tandem.api.Config;
import io.tilt.tandem.api.ObjectMapperProvider;
import io.tilt.tandem.api.config.BootstrapConfiguration;
import io.tilt.tandem.core.leader.Barrier;
import io.tilt.tandem.core.leader.CheckpointRegistry;
import io.tilt.tandem.core.leader.Coordinator;
import io.tilt.tandem.core.monitor.OperationStats.Operation;
import io.tilt.tandem.core.task.Scheduler;
import io.tilt.tandem.core.task.Scheduler.Agent;
import io.tilt.tandem.domain.DatasetSpec;
import io.tilt.tandem.domain.WorkerLiveness;
import io.tilt.tandem.domain.WorkerRecord;

/**
 * Read only views built at request about the system state
 * JSON format.
 *
 * @author Cristian Gonzalez
 * @since Nov 6, 2016
 */
public class SystemStateMonitor {

	private final Coordinator coordinator;
	private final Scheduler scheduler;
	private final Config config;

	private static final ObjectMapper mapper = ObjectMapperProvider.getMapper();

	public SystemStateMonitor(final Coordinator coordinator, final Scheduler scheduler, final Config config) {
		this.coordinator = requireNonNull(coordinator);
		this.scheduler = requireNonNull(scheduler);
		this.config = requireNonNull(config);
	}

	private String toJson(final Object o) {
		try {
			return mapper.writeValueAsString(o);
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("unserializable view", e);
		}
	}

	/**
	 * Everything a dashboard needs in one document:
	 * coordinator, workers, datasets, checkpoints, barriers and metrics.
	 * @return			a String in json format
	 */
	public String snapshotToJson() {
		return toJson(buildSnapshot());
	}

	public String workersToJson() {
		return toJson(buildWorkers());
	}

	public String datasetsToJson() {
		return toJson(buildDatasets());
	}

	public String checkpointsToJson() {
		return toJson(coordinator.getCheckpoints().records());
	}

	public String barriersToJson() {
		return toJson(buildBarriers());
	}

	public String metricsToJson() {
		return toJson(buildMetrics());
	}

	/**
	 * @return the scheduled agents and their latest run
	 */
	public String scheduleToJson() {
		return toJson(buildSchedule());
	}

	public Map<String, Object> buildSnapshot() {
		final Map<String, Object> map = new LinkedHashMap<>(6);
		map.put("coordinator", buildCoordinator());
		map.put("workers", buildWorkers());
		map.put("datasets", buildDatasets());
		map.put("checkpoints", coordinator.getCheckpoints().records());
		map.put("barriers", buildBarriers());
		map.put("metrics", buildMetrics());
		return map;
	}

	private Map<String, Object> buildCoordinator() {
		final BootstrapConfiguration bs = config.getBootstrap();
		final Map<String, Object> map = new LinkedHashMap<>(6);
		map.put("connected", true);
		map.put("namespace", bs.getNamespace());
		map.put("address", bs.isEnableWebserver() ? bs.getWebServerHostPort() : null);
		map.put("version", BootstrapConfiguration.VERSION);
		map.put("started", coordinator.getStartTime());
		map.put("uptime", (new DateTime(DateTimeZone.UTC).getMillis() - coordinator.getStartTime().getMillis()) / 1000);
		return map;
	}

	public List<Map<String, Object>> buildWorkers() {
		final Map<String, WorkerLiveness> liveness = new LinkedHashMap<>();
		coordinator.getLiveness().entries().forEach(e -> liveness.put(e.getWorkerId(), e));
		final List<Map<String, Object>> list = new ArrayList<>();
		for (WorkerRecord record : coordinator.getRegistry().workers()) {
			final Map<String, Object> map = new LinkedHashMap<>(8);
			map.put("worker-id", record.getWorkerId());
			map.put("rank", record.getRank());
			map.put("hostname", record.getInfo().getHostname());
			map.put("port", record.getInfo().getPort());
			map.put("gpu-count", record.getInfo().getGpuCount());
			map.put("registered-at", record.getRegisteredAt());
			final WorkerLiveness live = liveness.get(record.getWorkerId());
			if (live != null) {
				map.put("state", live.getState());
				map.put("status", live.getStatus());
				map.put("resources", live.getResources());
				map.put("last-seen", live.getLastSeen());
				map.put("heartbeats", live.getBeats());
			}
			list.add(map);
		}
		return list;
	}

	private List<Map<String, Object>> buildDatasets() {
		final List<Map<String, Object>> list = new ArrayList<>();
		for (DatasetSpec spec : coordinator.getPlanner().datasets()) {
			final Map<String, Object> map = new LinkedHashMap<>(4);
			map.put("spec", spec);
			map.put("total-blocks", spec.getTotalBlocks());
			list.add(map);
		}
		return list;
	}

	private List<Map<String, Object>> buildBarriers() {
		final List<Map<String, Object>> list = new ArrayList<>();
		for (Barrier barrier : coordinator.getBarriers().barriers()) {
			list.add(barrier.toMap());
		}
		return list;
	}

	public Map<String, Object> buildMetrics() {
		final Map<String, Object> map = new LinkedHashMap<>(10);
		map.put("active-workers", coordinator.getRegistry().worldSize());
		map.put("total-workers", coordinator.getRegistry().getAdmissions());
		map.put("dead-workers", coordinator.getLiveness().getDeadCount());
		map.put("coordinator-rps", coordinator.getStats().requestsPerSecond());
		map.put("checkpoint-throughput-per-min", coordinator.getCheckpoints()
				.notificationsWithin(CheckpointRegistry.THROUGHPUT_WINDOW_MS));
		map.put("barrier-latency-p99-ms", coordinator.getStats().percentile(Operation.BARRIER_RELEASE, 99));
		map.put("shard-assignment-p99-ms", coordinator.getStats().percentile(Operation.GET_SHARD, 99));
		map.put("cached-shuffles", coordinator.getPlanner().getCachedPermutations());
		map.put("heartbeats", coordinator.getLiveness().getHeartbeats());
		map.put("operations", coordinator.getStats().toMap());
		return map;
	}

	private List<Map<String, Object>> buildSchedule() {
		final List<Map<String, Object>> list = new ArrayList<>();
		final long now = System.currentTimeMillis();
		for (Agent agent : scheduler.getAgents()) {
			final Map<String, Object> map = new LinkedHashMap<>(6);
			map.put("action", agent.getAction());
			map.put("frequency", agent.getFrequency());
			map.put("period-ms", agent.getPeriodicDelay());
			map.put("runs", agent.getCounter());
			if (agent.getLastTimestamp() > 0) {
				map.put("last-run-ago-ms", now - agent.getLastTimestamp());
				map.put("last-duration-ms", agent.getLastSuccessfulDuration());
			}
			if (agent.getLastException() != null) {
				map.put("last-exception", agent.getLastException().toString());
			}
			list.add(map);
		}
		return list;
	}

	/** @return the ratio of live workers reporting, 1 when there's none */
	public double reportingRatio() {
		final int size = coordinator.getRegistry().worldSize();
		if (size == 0) {
			return 1d;
		}
		final long reporting = coordinator.getLiveness().entries().stream().filter(e -> e.getBeats() > 0).count();
		return Precision.round((double) reporting / size, 2);
	}

}
