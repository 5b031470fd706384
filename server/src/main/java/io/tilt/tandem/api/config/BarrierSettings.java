package io.tilt.tandem.api.config;

public class BarrierSettings {

	/* applied when the caller sends no timeout */
	protected static final long DEFAULT_TIMEOUT_MS = 300_000;
	private long defaultTimeoutMs;

	/* a released barrier answers late duplicates during this many beats */
	protected static final long COMPLETED_RETENTION = 10;
	private long completedRetention;
	/* a barrier nobody waits on anymore is dropped after this many beats */
	protected static final long ABANDONED_RETENTION = 240;
	private long abandonedRetention;

	protected static final long JANITOR_FREQUENCY = 4;
	private long janitorFrequency;

	public long getDefaultTimeoutMs() {
		return defaultTimeoutMs;
	}
	public void setDefaultTimeoutMs(long defaultTimeoutMs) {
		this.defaultTimeoutMs = defaultTimeoutMs;
	}
	public long getCompletedRetention() {
		return completedRetention;
	}
	public void setCompletedRetention(long completedRetention) {
		this.completedRetention = completedRetention;
	}
	public long getAbandonedRetention() {
		return abandonedRetention;
	}
	public void setAbandonedRetention(long abandonedRetention) {
		this.abandonedRetention = abandonedRetention;
	}
	public long getJanitorFrequency() {
		return janitorFrequency;
	}
	public void setJanitorFrequency(long janitorFrequency) {
		this.janitorFrequency = janitorFrequency;
	}

}
