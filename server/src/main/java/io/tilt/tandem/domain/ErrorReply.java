package io.tilt.tandem.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.tilt.tandem.api.ErrorKind;

/** Body of every failed call, the status line carries the kind's http code */
public class ErrorReply {

	private final ErrorKind kind;
	private final String message;

	@JsonCreator
	public ErrorReply(@JsonProperty("kind") final ErrorKind kind, @JsonProperty("message") final String message) {
		this.kind = kind;
		this.message = message;
	}

	public ErrorKind getKind() {
		return kind;
	}
	public String getMessage() {
		return message;
	}

	@Override
	public String toString() {
		return kind + ": " + message;
	}
}
