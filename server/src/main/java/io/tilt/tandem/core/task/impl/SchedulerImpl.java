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
package io.tilt.tandem.core.task.impl;

import static java.util.concurrent.TimeUnit.MILLISECONDS;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;

import org.apache.commons.lang.Validate;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import io.tilt.tandem.api.Config;
import io.tilt.tandem.api.config.SchedulerSettings;
import io.tilt.tandem.core.impl.ServiceImpl;
import io.tilt.tandem.core.task.Scheduler;

/**
 * @author Cristian Gonzalez
 * @since Dec 28, 2015
 */
public class SchedulerImpl extends ServiceImpl implements Scheduler {

	/* for scheduling and stopping tasks */
	private final Map<Action, Agent> agentsByAction;
	private final Map<Agent, ScheduledFuture<?>> futuresByAgent;

	private final AgentFactory agentFactory;
	private final String logName;
	private final ScheduledThreadPoolExecutor executor;

	public SchedulerImpl(final Config config, final AgentFactory agentFactory) {
		this(config, agentFactory, config.getBootstrap().getNamespace());
	}

	public SchedulerImpl(final Config config, final AgentFactory agentFactory, final String logName) {
		Validate.notNull(config);
		Validate.notNull(agentFactory);
		this.logName = logName;
		this.agentFactory = agentFactory;
		this.executor = new ScheduledThreadPoolExecutor(config.getScheduler().getMaxConcurrency(),
			new ThreadFactoryBuilder()
				.setDaemon(true)
				.setNameFormat(SchedulerSettings.THREAD_NAME_SCHEDULER + "-" + logName + "-%d")
				.build());
		executor.setRemoveOnCancelPolicy(true);
		executor.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
		executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
		this.agentsByAction = new ConcurrentHashMap<>();
		this.futuresByAgent = new ConcurrentHashMap<>();
	}

	@Override
	public Agent get(final Action action) {
		return agentsByAction.get(action);
	}

	@Override
	public Collection<Agent> getAgents() {
		return new ArrayList<>(agentsByAction.values());
	}

	@Override
	public void forward(final Agent agent) {
		Validate.notNull(agent);
		logger.info("{}: ({}) Forwarding task's execution {}", getName(), logName, agent);
		executor.execute(agent::execute);
	}

	@Override
	public synchronized void stop(final Agent agent) {
		Validate.notNull(agent);
		final ScheduledFuture<?> future = futuresByAgent.remove(agent);
		if (future != null) {
			final boolean cancelled = future.cancel(false);
			logger.info("{}: ({}) Stopping - Agent {} Cancelled = {}", getName(), logName, 
					agent.getAction().name(), cancelled);
		} else {
			logger.warn("{}: ({}) Stopping - Agent {} not found, finished or never scheduled", getName(), 
					logName, agent.getAction().name());
		}
		agentsByAction.remove(agent.getAction(), agent);
		this.executor.purge();
	}

	@Override
	public synchronized void schedule(final Agent agent) {
		Validate.notNull(agent);
		Validate.isTrue(!executor.isShutdown(), "scheduler already shutdown");
		final Agent previous = agentsByAction.get(agent.getAction());
		if (previous != null) {
			stop(previous);
		}
		logger.debug("{}: ({}) Saving Agent = {} ", getName(), logName, agent);
		ScheduledFuture<?> future = null;
		if (agent.getFrequency() == Frequency.PERIODIC) {
			future = executor.scheduleWithFixedDelay(agent::execute, agent.getDelay(),
				agent.getPeriodicDelay(), agent.getTimeUnit());
		} else if (agent.getFrequency() == Frequency.ONCE) {
			executor.execute(agent::execute);
		} else if (agent.getFrequency() == Frequency.ONCE_DELAYED) {
			future = executor.schedule(agent::execute, agent.getDelay(), MILLISECONDS);
		}
		if (future != null) {
			futuresByAgent.put(agent, future);
		}
		agentsByAction.put(agent.getAction(), agent);
	}

	@Override
	public void start() {
		logger.info("{}: ({}) Ready with {} threads", getName(), logName, executor.getCorePoolSize());
	}

	@Override
	public void stop() {
		this.executor.shutdownNow();
		agentsByAction.clear();
		futuresByAgent.clear();
	}

	@Override
	public AgentFactory getAgentFactory() {
		return this.agentFactory;
	}

}
