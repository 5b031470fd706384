package io.tilt.tandem.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public class BarrierRequest {

	private final String workerId;
	private final long step;
	/* zero or less for the coordinator's default */
	private final long timeoutMs;

	@JsonCreator
	public BarrierRequest(
			@JsonProperty("workerId") final String workerId,
			@JsonProperty("step") final long step,
			@JsonProperty("timeoutMs") final long timeoutMs) {
		this.workerId = workerId;
		this.step = step;
		this.timeoutMs = timeoutMs;
	}

	public String getWorkerId() {
		return workerId;
	}
	public long getStep() {
		return step;
	}
	public long getTimeoutMs() {
		return timeoutMs;
	}
}
