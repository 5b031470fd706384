package io.tilt.tandem.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public class DatasetAck {

	private final String datasetId;
	/* false when an identical spec was already registered */
	private final boolean created;
	private final long totalBlocks;

	@JsonCreator
	public DatasetAck(
			@JsonProperty("datasetId") final String datasetId,
			@JsonProperty("created") final boolean created,
			@JsonProperty("totalBlocks") final long totalBlocks) {
		this.datasetId = datasetId;
		this.created = created;
		this.totalBlocks = totalBlocks;
	}

	public String getDatasetId() {
		return datasetId;
	}
	public boolean isCreated() {
		return created;
	}
	public long getTotalBlocks() {
		return totalBlocks;
	}
}
