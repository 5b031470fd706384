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
package io.tilt.tandem.core.impl;

import java.util.concurrent.locks.ReentrantLock;

import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.tilt.tandem.core.Service;

/**
 * Facility to avoid concurrency on services
 * 
 * @author Cristian Gonzalez
 * @since Dec 3, 2015
 */
public abstract class ServiceImpl implements Service {

	protected final Logger logger = LoggerFactory.getLogger(getClass());

	private final DateTime creation;
	private DateTime start;
	private DateTime stop;
	private volatile State state;

	private final ReentrantLock singleLock = new ReentrantLock();
	private volatile boolean inService;

	public ServiceImpl() {
		state = State.INITIALIZING;
		this.creation = new DateTime(DateTimeZone.UTC);
	}

	@Override
	public final void init() {
		singleLock.lock();
		try {
			if (inService) {
				logger.error("{}: service already started !!", getName());
				return;
			}
			logger.info("{}: Starting service", getName());
			this.start = new DateTime(DateTimeZone.UTC);
			state = State.STARTING;
			start();
			state = State.STARTED;
			this.inService = true;
			logger.info("{}: Service start took: {} msec", getName(), getDiff(this.start));
		} catch (RuntimeException e) {
			state = State.INIT_ERROR;
			logger.error("{}: Unexpected at service start(): ", getName(), e);
			start = null;
			throw e;
		} finally {
			singleLock.unlock();
		}
	}

	/* mostly callable from spring */
	@Override
	public final void destroy() {
		singleLock.lock();
		try {
			if (!inService) {
				logger.warn("{}: service already stopped or never started", getName());
				return;
			}
			state = State.STOPPING;
			logger.info("{}: Shutting down service", getName());
			this.stop = new DateTime(DateTimeZone.UTC);
			stop();
			state = State.STOPPED;
			this.inService = false;
			logger.info("{}: Service shutdown took: {} msec", getName(), getDiff(this.stop));
		} catch (RuntimeException e) {
			state = State.DESTROY_ERROR;
			logger.error("{}: Unexpected at service stop(): ", getName(), e);
			stop = null;
		} finally {
			if (state == State.STOPPED) {
				state = State.DESTROYED;
			}
			singleLock.unlock();
		}
	}

	public String getName() {
		return getClass().getSimpleName();
	}

	@Override
	public State getState() {
		return state;
	}

	/* callable from here only */
	@Override
	public void start() {
		logger.warn("{}: Service without start implementation !", getName());
	}

	/* callable from here only */
	@Override
	public void stop() {
		logger.warn("{}: Service without stop implementation !", getName());
	}

	@Override
	public boolean inService() {
		return inService;
	}

	public long getMillisSinceCreation() {
		return getDiff(creation);
	}

	private long getDiff(DateTime dt) {
		return new DateTime(DateTimeZone.UTC).getMillis() - dt.getMillis();
	}

	public DateTime getCreation() {
		return creation;
	}

}
