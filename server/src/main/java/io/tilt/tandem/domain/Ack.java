package io.tilt.tandem.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public class Ack {

	private final boolean success;
	private final String message;

	@JsonCreator
	public Ack(@JsonProperty("success") final boolean success, @JsonProperty("message") final String message) {
		this.success = success;
		this.message = message;
	}

	public static Ack ok(final String message) {
		return new Ack(true, message);
	}

	public boolean isSuccess() {
		return success;
	}
	public String getMessage() {
		return message;
	}
}
