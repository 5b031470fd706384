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
package io.tilt.tandem.core.monitor;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.AppenderSkeleton;
import org.apache.log4j.Level;
import org.apache.log4j.spi.LoggingEvent;
import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;

import com.google.common.collect.EvictingQueue;

/**
 * Keeps the latest log events in memory for the admin log view.
 * To be declared in the log4j configuration, like:
 * <pre>
 * log4j.appender.recent=io.tilt.tandem.core.monitor.RecentEventsAppender
 * log4j.appender.recent.Capacity=500
 * log4j.appender.recent.Threshold=INFO
 * </pre>
 * All instances share the same buffer.
 */
public class RecentEventsAppender extends AppenderSkeleton {

	private static final int DEFAULT_CAPACITY = 500;

	private static EvictingQueue<String> buffer = EvictingQueue.create(DEFAULT_CAPACITY);

	public RecentEventsAppender() {
		super();
	}

	/** @param capacity	events kept, the oldest go first */
	public void setCapacity(final int capacity) {
		synchronized (RecentEventsAppender.class) {
			final EvictingQueue<String> resized = EvictingQueue.create(capacity);
			resized.addAll(buffer);
			buffer = resized;
		}
	}

	@Override
	protected void append(final LoggingEvent event) {
		final String line = format(event);
		synchronized (RecentEventsAppender.class) {
			buffer.add(line);
		}
	}

	private String format(final LoggingEvent event) {
		if (layout != null) {
			return layout.format(event);
		}
		final StringBuilder sb = new StringBuilder()
				.append(new DateTime(event.getTimeStamp(), DateTimeZone.UTC)).append(' ')
				.append(event.getLevel()).append(' ')
				.append(event.getThreadName()).append(' ')
				.append(event.getRenderedMessage());
		if (event.getThrowableInformation() != null && event.getLevel().isGreaterOrEqual(Level.WARN)) {
			sb.append(" (").append(event.getThrowableInformation().getThrowable()).append(')');
		}
		return sb.toString();
	}

	/**
	 * @param max	how many events at most
	 * @return latest events, oldest first
	 */
	public static List<String> recent(final int max) {
		synchronized (RecentEventsAppender.class) {
			final List<String> all = new ArrayList<>(buffer);
			return all.size() <= max ? all : new ArrayList<>(all.subList(all.size() - max, all.size()));
		}
	}

	public static void clear() {
		synchronized (RecentEventsAppender.class) {
			buffer.clear();
		}
	}

	@Override
	public void close() {
		this.closed = true;
	}

	@Override
	public boolean requiresLayout() {
		return false;
	}

}
