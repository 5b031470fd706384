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

import java.io.File;
import java.io.IOException;
import java.util.Properties;

import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import io.tilt.tandem.api.config.BarrierSettings;
import io.tilt.tandem.api.config.BootstrapConfiguration;
import io.tilt.tandem.api.config.CheckpointSettings;
import io.tilt.tandem.api.config.LivenessSettings;
import io.tilt.tandem.api.config.MonitorSettings;
import io.tilt.tandem.api.config.RegistrySettings;
import io.tilt.tandem.api.config.SchedulerSettings;
import io.tilt.tandem.api.config.ShardingSettings;
import io.tilt.tandem.utils.Defaulter;

/**
 * All there's subject to vary on the coordinator's behaviour.
 * Every section gets its static defaults, overriden by the given properties or the JVM's, 
 * keyed as "section.fieldName", like: "barrier.defaultTimeoutMs"
 * 
 * @author Cristian Gonzalez
 * @since Nov 19, 2016
 */
public class Config {

	protected static final ObjectMapper objectMapper = ObjectMapperProvider.createMapper();
	static {
		objectMapper.configure(SerializationFeature.INDENT_OUTPUT, true);
	}

	@JsonIgnore
	private final DateTime loadTime = new DateTime(DateTimeZone.UTC);

	private BootstrapConfiguration bootstrap;
	private SchedulerSettings scheduler;
	private RegistrySettings registry;
	private ShardingSettings sharding;
	private LivenessSettings liveness;
	private BarrierSettings barrier;
	private CheckpointSettings checkpoint;
	private MonitorSettings monitor;

	private void init() {
		this.bootstrap = new BootstrapConfiguration();
		this.scheduler = new SchedulerSettings();
		this.registry = new RegistrySettings();
		this.sharding = new ShardingSettings();
		this.liveness = new LivenessSettings();
		this.barrier = new BarrierSettings();
		this.checkpoint = new CheckpointSettings();
		this.monitor = new MonitorSettings();
	}
	public Config() {
		init();
		loadFromPropOrSystem(null);
	}
	public Config(final Properties prop) {
		init();
		loadFromPropOrSystem(prop);
	}
	public Config(final String webServerHostPort) {
		init();
		loadFromPropOrSystem(null);
		getBootstrap().setWebServerHostPort(webServerHostPort);
	}

	private void loadFromPropOrSystem(Properties prop) {
		if (prop == null) {
			prop = new Properties();
		}
		Defaulter.apply(prop, "bootstrap.", this.getBootstrap());
		Defaulter.apply(prop, "scheduler.", this.getScheduler());
		Defaulter.apply(prop, "registry.", this.getRegistry());
		Defaulter.apply(prop, "sharding.", this.getSharding());
		Defaulter.apply(prop, "liveness.", this.getLiveness());
		Defaulter.apply(prop, "barrier.", this.getBarrier());
		Defaulter.apply(prop, "checkpoint.", this.getCheckpoint());
		Defaulter.apply(prop, "monitor.", this.getMonitor());
	}

	public String toJson() {
		try {
			return objectMapper.writeValueAsString(this);
		} catch (JsonProcessingException e) {
			return "{\"error\":\"true\"}";
		}
	}
	public void toJsonFile(final String filepath) throws IOException {
		objectMapper.writeValue(new File(filepath), this);
	}

	public static Config fromString(final String json) throws IOException {
		return objectMapper.readValue(json, Config.class);
	}
	public static Config fromJsonFile(final String filepath) throws IOException {
		return fromJsonFile(new File(filepath));
	}
	public static Config fromJsonFile(final File jsonFormatConfig) throws IOException {
		return objectMapper.readValue(jsonFormatConfig, Config.class);
	}

	@Override
	public String toString() {
		return toJson();
	}

	public long beatToMs(final long beats) {
		return bootstrap.getBeatUnitMs() * beats;
	}

	@JsonIgnore
	public DateTime getLoadTime() {
		return this.loadTime;
	}

	public BootstrapConfiguration getBootstrap() {
		return this.bootstrap;
	}
	public void setBootstrap(BootstrapConfiguration bootstrap) {
		this.bootstrap = bootstrap;
	}
	public SchedulerSettings getScheduler() {
		return scheduler;
	}
	public void setScheduler(SchedulerSettings scheduler) {
		this.scheduler = scheduler;
	}
	public RegistrySettings getRegistry() {
		return registry;
	}
	public void setRegistry(RegistrySettings registry) {
		this.registry = registry;
	}
	public ShardingSettings getSharding() {
		return sharding;
	}
	public void setSharding(ShardingSettings sharding) {
		this.sharding = sharding;
	}
	public LivenessSettings getLiveness() {
		return liveness;
	}
	public void setLiveness(LivenessSettings liveness) {
		this.liveness = liveness;
	}
	public BarrierSettings getBarrier() {
		return barrier;
	}
	public void setBarrier(BarrierSettings barrier) {
		this.barrier = barrier;
	}
	public CheckpointSettings getCheckpoint() {
		return checkpoint;
	}
	public void setCheckpoint(CheckpointSettings checkpoint) {
		this.checkpoint = checkpoint;
	}
	public MonitorSettings getMonitor() {
		return monitor;
	}
	public void setMonitor(MonitorSettings monitor) {
		this.monitor = monitor;
	}

}
