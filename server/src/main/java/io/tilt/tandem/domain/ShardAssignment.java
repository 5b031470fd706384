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
package io.tilt.tandem.domain;

import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The portion of a dataset a worker must consume on an epoch.
 * Computed on demand, never stored: same inputs always give the same assignment.
 */
public class ShardAssignment {

	private final String datasetId;
	private final int epoch;
	/* the caller's partition index */
	private final int shardId;
	private final int totalShards;
	private final long sampleCount;
	private final List<SampleRange> ranges;
	private final List<String> filePaths;

	@JsonCreator
	public ShardAssignment(
			@JsonProperty("datasetId") final String datasetId,
			@JsonProperty("epoch") final int epoch,
			@JsonProperty("shardId") final int shardId,
			@JsonProperty("totalShards") final int totalShards,
			@JsonProperty("sampleCount") final long sampleCount,
			@JsonProperty("ranges") final List<SampleRange> ranges,
			@JsonProperty("filePaths") final List<String> filePaths) {
		this.datasetId = datasetId;
		this.epoch = epoch;
		this.shardId = shardId;
		this.totalShards = totalShards;
		this.sampleCount = sampleCount;
		this.ranges = ranges == null ? Collections.emptyList() : Collections.unmodifiableList(ranges);
		this.filePaths = filePaths == null ? Collections.emptyList() : Collections.unmodifiableList(filePaths);
	}

	public String getDatasetId() {
		return datasetId;
	}
	public int getEpoch() {
		return epoch;
	}
	public int getShardId() {
		return shardId;
	}
	public int getTotalShards() {
		return totalShards;
	}
	public long getSampleCount() {
		return sampleCount;
	}
	public List<SampleRange> getRanges() {
		return ranges;
	}
	public List<String> getFilePaths() {
		return filePaths;
	}

	@Override
	public String toString() {
		return datasetId + " e" + epoch + " shard " + shardId + "/" + totalShards + " (" + sampleCount + " samples)";
	}
}
