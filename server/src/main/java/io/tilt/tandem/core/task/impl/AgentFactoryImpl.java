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

import java.util.concurrent.TimeUnit;

import org.apache.commons.lang.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.tilt.tandem.core.task.Scheduler.Action;
import io.tilt.tandem.core.task.Scheduler.Agent;
import io.tilt.tandem.core.task.Scheduler.AgentFactory;
import io.tilt.tandem.core.task.Scheduler.Frequency;

/**
 * The factory builds the agent it is: a prototype instance with no task creates the real ones.
 */
public class AgentFactoryImpl implements Agent, AgentFactory {

	private final Logger logger = LoggerFactory.getLogger(getClass());

	private final Action action;
	private final Frequency frequency;
	private final Runnable task;

	private long delay;
	private long periodicDelay;

	private volatile long lastTimestamp;
	private volatile long lastSuccessfulDuration;
	private volatile long counter;
	private volatile Exception lastException;

	public AgentFactoryImpl() {
		this.action = null;
		this.frequency = null;
		this.task = null;
	}

	protected AgentFactoryImpl(final Action action, final Frequency frequency, final Runnable task) {
		Validate.notNull(action);
		Validate.notNull(frequency);
		Validate.notNull(task);
		this.action = action;
		this.frequency = frequency;
		this.task = task;
	}

	@Override
	public AgentFactory create(final Action action, final Frequency frequency, final Runnable task) {
		return new AgentFactoryImpl(action, frequency, task);
	}

	@Override
	public AgentFactory every(final long periodicDelay) {
		Validate.isTrue(periodicDelay > 0, "period must be positive");
		this.periodicDelay = periodicDelay;
		return this;
	}

	@Override
	public AgentFactory delayed(final long firstDelayMs) {
		this.delay = firstDelayMs;
		return this;
	}

	@Override
	public Agent build() {
		Validate.notNull(task, "the prototype factory cannot be built");
		Validate.isTrue(frequency != Frequency.PERIODIC || periodicDelay > 0, "a periodic agent needs a period");
		return this;
	}

	@Override
	public void execute() {
		final long start = System.currentTimeMillis();
		try {
			counter++;
			task.run();
			lastSuccessfulDuration = System.currentTimeMillis() - start;
			if (logger.isDebugEnabled()) {
				logger.debug("Agent: {} t: {} lrd: {} [#{}]", action, lastSuccessfulDuration, 
						start - lastTimestamp, counter);
			}
		} catch (Exception e) {
			logger.error("Untrapped exception on Agent: {}", action.name(), e);
			this.lastException = e;
		} finally {
			this.lastTimestamp = start;
		}
	}

	@Override
	public Action getAction() {
		return action;
	}
	@Override
	public Frequency getFrequency() {
		return frequency;
	}
	@Override
	public Runnable getTask() {
		return task;
	}
	@Override
	public long getDelay() {
		return delay;
	}
	@Override
	public long getPeriodicDelay() {
		return periodicDelay;
	}
	@Override
	public TimeUnit getTimeUnit() {
		return TimeUnit.MILLISECONDS;
	}
	@Override
	public long getCounter() {
		return counter;
	}
	@Override
	public long getLastTimestamp() {
		return lastTimestamp;
	}
	@Override
	public long getLastSuccessfulDuration() {
		return lastSuccessfulDuration;
	}
	@Override
	public Exception getLastException() {
		return lastException;
	}

	@Override
	public String toString() {
		return new StringBuilder("Ag:")
				.append(action)
				.append("(F: ").append(frequency)
				.append(",").append(delay)
				.append(",").append(periodicDelay)
				.append(")")
				.toString();
	}
}
