package io.tilt.tandem.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public class HeartbeatAck {

	private final long serverTimestampMs;

	@JsonCreator
	public HeartbeatAck(@JsonProperty("serverTimestampMs") final long serverTimestampMs) {
		this.serverTimestampMs = serverTimestampMs;
	}

	public long getServerTimestampMs() {
		return serverTimestampMs;
	}
}
