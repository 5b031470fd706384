package io.tilt.tandem.domain;

public enum WorkerState {
	LOADING_DATA,
	TRAINING,
	CHECKPOINTING,
	IDLE,
	/* never reported by workers: set by the liveness sweep */
	DEAD,
	;
}
