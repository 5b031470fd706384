package io.tilt.tandem.api.config;

public class LivenessSettings {

	/* pace suggested to workers at registration, in beats */
	protected static final long HEARTBEAT_FREQUENCY = 10;
	private long heartbeatFrequency;

	/* 30 seconds of silence and the worker is dead */
	protected static final long HEARTBEAT_TIMEOUT = 60;
	private long heartbeatTimeout;

	protected static final long SWEEP_START_DELAY = 4;
	private long sweepStartDelay;
	protected static final long SWEEP_FREQUENCY = 2;
	private long sweepFrequency;

	/* dead workers are evicted from the registry, or just flagged */
	protected static final boolean EVICT_DEAD_WORKERS = true;
	private boolean evictDeadWorkers;

	public long getHeartbeatFrequency() {
		return heartbeatFrequency;
	}
	public void setHeartbeatFrequency(long heartbeatFrequency) {
		this.heartbeatFrequency = heartbeatFrequency;
	}
	public long getHeartbeatTimeout() {
		return heartbeatTimeout;
	}
	public void setHeartbeatTimeout(long heartbeatTimeout) {
		this.heartbeatTimeout = heartbeatTimeout;
	}
	public long getSweepStartDelay() {
		return sweepStartDelay;
	}
	public void setSweepStartDelay(long sweepStartDelay) {
		this.sweepStartDelay = sweepStartDelay;
	}
	public long getSweepFrequency() {
		return sweepFrequency;
	}
	public void setSweepFrequency(long sweepFrequency) {
		this.sweepFrequency = sweepFrequency;
	}
	public boolean isEvictDeadWorkers() {
		return evictDeadWorkers;
	}
	public void setEvictDeadWorkers(boolean evictDeadWorkers) {
		this.evictDeadWorkers = evictDeadWorkers;
	}

}
