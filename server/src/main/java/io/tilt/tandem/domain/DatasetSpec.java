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

import java.io.Serializable;

import org.apache.commons.lang.builder.EqualsBuilder;
import org.apache.commons.lang.builder.HashCodeBuilder;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Immutable description of a dataset to be partitioned among workers.
 * Two specs are equal only when every field matches.
 */
public class DatasetSpec implements Serializable {

	private static final long serialVersionUID = 6720916325401917853L;

	private final String datasetId;
	private final String path;
	private final String format;
	private final long totalSamples;
	private final long shardSize;
	private final boolean shuffle;
	private final long seed;

	@JsonCreator
	public DatasetSpec(
			@JsonProperty("datasetId") final String datasetId,
			@JsonProperty("path") final String path,
			@JsonProperty("format") final String format,
			@JsonProperty("totalSamples") final long totalSamples,
			@JsonProperty("shardSize") final long shardSize,
			@JsonProperty("shuffle") final boolean shuffle,
			@JsonProperty("seed") final long seed) {
		this.datasetId = datasetId;
		this.path = path;
		this.format = format;
		this.totalSamples = totalSamples;
		this.shardSize = shardSize;
		this.shuffle = shuffle;
		this.seed = seed;
	}

	public static Builder builder(final String datasetId) {
		return new Builder(datasetId);
	}

	public static class Builder {
		private final String datasetId;
		private String path = "";
		private String format = "";
		private long totalSamples;
		private long shardSize = 1;
		private boolean shuffle;
		private long seed;

		private Builder(final String datasetId) {
			this.datasetId = datasetId;
		}
		public Builder path(final String path) {
			this.path = path;
			return this;
		}
		public Builder format(final String format) {
			this.format = format;
			return this;
		}
		public Builder samples(final long totalSamples, final long shardSize) {
			this.totalSamples = totalSamples;
			this.shardSize = shardSize;
			return this;
		}
		public Builder shuffled(final long seed) {
			this.shuffle = true;
			this.seed = seed;
			return this;
		}
		public DatasetSpec build() {
			return new DatasetSpec(datasetId, path, format, totalSamples, shardSize, shuffle, seed);
		}
	}

	public String getDatasetId() {
		return datasetId;
	}
	public String getPath() {
		return path;
	}
	public String getFormat() {
		return format;
	}
	public long getTotalSamples() {
		return totalSamples;
	}
	public long getShardSize() {
		return shardSize;
	}
	public boolean isShuffle() {
		return shuffle;
	}
	public long getSeed() {
		return seed;
	}

	/** @return blocks of shard size needed to hold every sample */
	@JsonIgnore
	public long getTotalBlocks() {
		return shardSize <= 0 ? 0 : (totalSamples + shardSize - 1) / shardSize;
	}

	@Override
	public boolean equals(final Object obj) {
		if (obj instanceof DatasetSpec) {
			final DatasetSpec o = (DatasetSpec) obj;
			return new EqualsBuilder()
					.append(datasetId, o.datasetId)
					.append(path, o.path)
					.append(format, o.format)
					.append(totalSamples, o.totalSamples)
					.append(shardSize, o.shardSize)
					.append(shuffle, o.shuffle)
					.append(seed, o.seed)
					.isEquals();
		}
		return false;
	}

	@Override
	public int hashCode() {
		return new HashCodeBuilder()
				.append(datasetId)
				.append(totalSamples)
				.append(shardSize)
				.append(seed)
				.toHashCode();
	}

	@Override
	public String toString() {
		return datasetId + "(" + totalSamples + " samples" + (shuffle ? ", shuffled" : "") + ")";
	}
}
