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
package io.tilt.tandem.core.task;

import java.util.Collection;
import java.util.concurrent.TimeUnit;

import io.tilt.tandem.core.Service;

/**
 * Centralization of background one-shot and scheduled tasks.
 * 
 * @author Cristian Gonzalez
 * @since Nov 27, 2015
 */
public interface Scheduler extends Service {

	/* what an agent is about: one agent per action at a time */
	public enum Action {
		/* coordinator: flags and evicts workers gone silent */
		LIVENESS_SWEEP,
		/* coordinator: drops released and abandoned barriers */
		BARRIER_JANITOR,
		/* worker: sends the status to the coordinator */
		HEARTBEAT_REPORT,
		/* for anything not worth an action of its own */
		ANONYMOUS,
		;
	}

	/* for agents only */
	public enum Frequency {
		ONCE, ONCE_DELAYED, PERIODIC,
	}

	/* basic timed unit of work for a thread pool */
	/* for better traceability, isolation, metrics, data output exposure */
	public interface Agent {
		Action getAction();

		Frequency getFrequency();

		Runnable getTask();

		void execute();

		long getDelay();

		long getPeriodicDelay();

		TimeUnit getTimeUnit();

		long getCounter();

		long getLastTimestamp();

		long getLastSuccessfulDuration();

		Exception getLastException();
	}

	public interface AgentFactory {
		AgentFactory create(Action action, Frequency frequency, Runnable task);

		AgentFactory every(long periodicDelay);

		AgentFactory delayed(long firstDelayMs);

		Agent build();
	}

	AgentFactory getAgentFactory();

	/* schedule this to run in the pool */
	void schedule(Agent agent);

	/* stop the agent of running */
	void stop(Agent agent);

	/* forward to execute it now, leaving future schedules intact */
	void forward(Agent agent);

	/* query */
	Agent get(Action action);

	Collection<Agent> getAgents();

}
