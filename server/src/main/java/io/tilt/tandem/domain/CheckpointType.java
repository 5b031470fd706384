package io.tilt.tandem.domain;

public enum CheckpointType {
	/* model and optimizer state: the only kind written today */
	FULL,
	INCREMENTAL,
	OPTIMIZER_ONLY,
	MODEL_ONLY,
	;
}
