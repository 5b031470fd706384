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
package io.tilt.tandem.core.leader;

import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;

import org.apache.commons.lang.StringUtils;
import org.apache.commons.lang.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.hash.Hashing;

import io.tilt.tandem.api.Config;
import io.tilt.tandem.api.CoordinatorException;
import io.tilt.tandem.api.ErrorKind;
import io.tilt.tandem.api.SpecMismatchException;
import io.tilt.tandem.domain.DatasetSpec;
import io.tilt.tandem.domain.SampleRange;
import io.tilt.tandem.domain.ShardAssignment;

/**
 * Deterministic partitioning of datasets among the live workers.
 * <p>
 * The samples of a dataset are split into as many near-equal contiguous partitions as live
 * workers, the remainder going one sample each to the last partitions. A worker's partition is
 * its position among the live ranks. Shuffled datasets apply a permutation seeded by the dataset's
 * seed and the epoch before slicing, so the same epoch always yields the same order and
 * different epochs yield different ones. Every sample lands in exactly one partition.
 *
 * @author Cristian Gonzalez
 */
public class DatasetShardPlanner {

	private final Logger logger = LoggerFactory.getLogger(getClass());

	private final Config config;
	private final WorkerRegistry registry;
	private final ConcurrentMap<String, DatasetSpec> datasets;
	/* "dataset/epoch" -> permuted sample indices */
	private final Cache<String, int[]> permutations;

	public DatasetShardPlanner(final Config config, final WorkerRegistry registry) {
		this.config = requireNonNull(config);
		this.registry = requireNonNull(registry);
		this.datasets = new ConcurrentHashMap<>();
		this.permutations = CacheBuilder.newBuilder()
				.maximumSize(config.getSharding().getShuffleCacheSize())
				.recordStats()
				.build();
	}

	/**
	 * @param spec	the dataset to be sharded
	 * @return TRUE if created, FALSE if an identical spec was already registered
	 * @throws SpecMismatchException	when the id is taken by a different spec
	 */
	public boolean registerDataset(final DatasetSpec spec) {
		Validate.notNull(spec, "dataset spec required");
		Validate.isTrue(StringUtils.isNotBlank(spec.getDatasetId()), "dataset id required");
		Validate.isTrue(spec.getTotalSamples() >= 0, "invalid total samples: " + spec.getTotalSamples());
		Validate.isTrue(spec.getShardSize() > 0, "invalid shard size: " + spec.getShardSize());
		Validate.isTrue(!spec.isShuffle() || spec.getTotalSamples() <= config.getSharding().getMaxShuffledSamples(),
				"too many samples to shuffle: " + spec.getTotalSamples());

		final DatasetSpec previous = datasets.putIfAbsent(spec.getDatasetId(), spec);
		if (previous == null) {
			logger.info("{}: Registered dataset {} ({} blocks)", getClass().getSimpleName(), spec,
					spec.getTotalBlocks());
			return true;
		} else if (previous.equals(spec)) {
			logger.debug("{}: Dataset {} already registered", getClass().getSimpleName(), spec.getDatasetId());
			return false;
		} else {
			throw new SpecMismatchException("dataset " + spec.getDatasetId()
				+ " already registered with a different spec: " + previous);
		}
	}

	public DatasetSpec get(final String datasetId) {
		final DatasetSpec spec = datasetId == null ? null : datasets.get(datasetId);
		if (spec == null) {
			throw new CoordinatorException(ErrorKind.NOT_FOUND, "dataset not found: " + datasetId);
		}
		return spec;
	}

	/** @return registered datasets by id */
	public List<DatasetSpec> datasets() {
		final List<DatasetSpec> list = new ArrayList<>(datasets.values());
		list.sort((a, b) -> a.getDatasetId().compareTo(b.getDatasetId()));
		return list;
	}

	/**
	 * @param workerId	a registered worker
	 * @param datasetId	a registered dataset
	 * @param epoch	non negative
	 * @return the samples the worker must consume on that epoch
	 */
	public ShardAssignment getShard(final String workerId, final String datasetId, final int epoch) {
		Validate.isTrue(StringUtils.isNotBlank(workerId), "worker id required");
		Validate.isTrue(epoch >= 0, "invalid epoch: " + epoch);
		final DatasetSpec spec = get(datasetId);
		final int[] position = registry.positionOf(workerId);
		final ShardAssignment assignment = plan(spec, epoch, position[0], position[1]);
		if (logger.isDebugEnabled()) {
			logger.debug("{}: Assigned {} to {}", getClass().getSimpleName(), assignment, workerId);
		}
		return assignment;
	}

	/**
	 * Pure function of its arguments.
	 * @param spec	the dataset
	 * @param epoch	the epoch, changes the order of shuffled datasets
	 * @param partition	index of the requested partition within [0, partitions)
	 * @param partitions	how many partitions, the world size
	 * @return the requested partition
	 */
	public ShardAssignment plan(final DatasetSpec spec, final int epoch, final int partition, final int partitions) {
		Validate.isTrue(partitions > 0 && partition >= 0 && partition < partitions,
				"invalid partition: " + partition + "/" + partitions);
		final long total = spec.getTotalSamples();
		final long start = partitionStart(total, partitions, partition);
		final long end = partitionStart(total, partitions, partition + 1);
		final List<SampleRange> ranges;
		if (start == end) {
			ranges = Collections.emptyList();
		} else if (!spec.isShuffle()) {
			ranges = Collections.singletonList(new SampleRange(start, end));
		} else {
			ranges = coalesce(permutation(spec, epoch), (int) start, (int) end);
		}
		final List<String> paths = StringUtils.isBlank(spec.getPath())
				? Collections.emptyList() : Collections.singletonList(spec.getPath());
		return new ShardAssignment(spec.getDatasetId(), epoch, partition, partitions, end - start, ranges, paths);
	}

	/*
	 * base = N / W, and the last N % W partitions take one sample more,
	 * so the i-th starts after i bases plus the extra samples of the partitions before it
	 */
	static long partitionStart(final long total, final int partitions, final int index) {
		final long base = total / partitions;
		final long remainder = total % partitions;
		final long firstLarger = partitions - remainder;
		return index * base + Math.max(0, index - firstLarger);
	}

	/* runs of consecutive indices within the slice, in permutation order */
	private static List<SampleRange> coalesce(final int[] permutation, final int from, final int to) {
		final List<SampleRange> ranges = new ArrayList<>();
		long runStart = permutation[from];
		long runEnd = runStart + 1;
		for (int i = from + 1; i < to; i++) {
			if (permutation[i] == runEnd) {
				runEnd++;
			} else {
				ranges.add(new SampleRange(runStart, runEnd));
				runStart = permutation[i];
				runEnd = runStart + 1;
			}
		}
		ranges.add(new SampleRange(runStart, runEnd));
		return ranges;
	}

	private int[] permutation(final DatasetSpec spec, final int epoch) {
		try {
			return permutations.get(spec.getDatasetId() + "/" + epoch, () -> shuffle(spec, epoch));
		} catch (ExecutionException e) {
			throw new IllegalStateException("cannot shuffle dataset: " + spec.getDatasetId(), e.getCause());
		}
	}

	/* Fisher-Yates over the sample indices, seeded by hash(seed, epoch) */
	static int[] shuffle(final DatasetSpec spec, final int epoch) {
		final int size = (int) spec.getTotalSamples();
		final int[] indices = new int[size];
		for (int i = 0; i < size; i++) {
			indices[i] = i;
		}
		final Random random = new Random(epochSeed(spec.getSeed(), epoch));
		for (int i = size - 1; i > 0; i--) {
			final int j = random.nextInt(i + 1);
			final int tmp = indices[i];
			indices[i] = indices[j];
			indices[j] = tmp;
		}
		return indices;
	}

	static long epochSeed(final long seed, final int epoch) {
		return Hashing.murmur3_128().newHasher()
				.putLong(seed)
				.putInt(epoch)
				.hash()
				.asLong();
	}

	public long getCachedPermutations() {
		return permutations.size();
	}

}
