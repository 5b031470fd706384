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

import static java.util.Objects.requireNonNull;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.util.Precision;
import org.joda.time.DateTimeUtils;

import io.tilt.tandem.api.Config;

/**
 * Request counting and latency percentiles of the coordinator's operations,
 * over a sliding window of the latest samples of each operation.
 */
public class OperationStats {

	public enum Operation {
		REGISTER_WORKER,
		DEREGISTER_WORKER,
		REGISTER_DATASET,
		GET_SHARD,
		HEARTBEAT,
		NOTIFY_CHECKPOINT,
		LATEST_CHECKPOINT,
		WAIT_BARRIER,
		/* first arrival to release of a barrier */
		BARRIER_RELEASE,
		;
	}

	private final Map<Operation, DescriptiveStatistics> latencies;
	private final Map<Operation, AtomicLong> counters;
	private final AtomicLong failures;

	/* requests per second of the last window, as a ring of second buckets */
	private final long[] bucketSecond;
	private final long[] bucketCount;

	public OperationStats(final Config config) {
		requireNonNull(config);
		this.latencies = new EnumMap<>(Operation.class);
		this.counters = new EnumMap<>(Operation.class);
		for (Operation op : Operation.values()) {
			latencies.put(op, new DescriptiveStatistics(config.getMonitor().getStatsWindowSize()));
			counters.put(op, new AtomicLong());
		}
		this.failures = new AtomicLong();
		final int window = Math.max(1, config.getMonitor().getRateWindowSeconds());
		this.bucketSecond = new long[window];
		this.bucketCount = new long[window];
	}

	/** Counts a request arrived to the coordinator */
	public void mark(final Operation op) {
		counters.get(op).incrementAndGet();
		final long second = DateTimeUtils.currentTimeMillis() / 1000;
		synchronized (bucketCount) {
			final int idx = (int) (second % bucketCount.length);
			if (bucketSecond[idx] != second) {
				bucketSecond[idx] = second;
				bucketCount[idx] = 0;
			}
			bucketCount[idx]++;
		}
	}

	public void markFailure() {
		failures.incrementAndGet();
	}

	public void record(final Operation op, final long millis) {
		final DescriptiveStatistics stats = latencies.get(op);
		synchronized (stats) {
			stats.addValue(millis);
		}
	}

	/** @return requests per second averaged over the rate window */
	public double requestsPerSecond() {
		final long second = DateTimeUtils.currentTimeMillis() / 1000;
		long sum = 0;
		synchronized (bucketCount) {
			for (int i = 0; i < bucketCount.length; i++) {
				if (second - bucketSecond[i] < bucketCount.length) {
					sum += bucketCount[i];
				}
			}
		}
		return Precision.round((double) sum / bucketCount.length, 2);
	}

	/** @return the percentile of the operation's latest latencies, 0 without samples */
	public double percentile(final Operation op, final double percentile) {
		final DescriptiveStatistics stats = latencies.get(op);
		synchronized (stats) {
			return stats.getN() == 0 ? 0d : Precision.round(stats.getPercentile(percentile), 2);
		}
	}

	public long count(final Operation op) {
		return counters.get(op).get();
	}

	public long getFailures() {
		return failures.get();
	}

	public Map<String, Object> toMap() {
		final Map<String, Object> map = new LinkedHashMap<>();
		for (Operation op : Operation.values()) {
			final DescriptiveStatistics stats = latencies.get(op);
			final Map<String, Object> brief = new LinkedHashMap<>(4);
			brief.put("count", count(op));
			synchronized (stats) {
				if (stats.getN() > 0) {
					brief.put("mean-ms", Precision.round(stats.getMean(), 2));
					brief.put("p99-ms", Precision.round(stats.getPercentile(99), 2));
					brief.put("max-ms", stats.getMax());
				}
			}
			map.put(op.name().toLowerCase(), brief);
		}
		map.put("failures", getFailures());
		return map;
	}

}
