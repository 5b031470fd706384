package io.tilt.tandem.api.config;

public class ShardingSettings {

	/* dataset epochs whose shuffled order is kept in memory */
	protected static final int SHUFFLE_CACHE_SIZE = 16;
	private int shuffleCacheSize;

	/* a shuffled order costs 4 bytes per sample */
	protected static final long MAX_SHUFFLED_SAMPLES = 100_000_000;
	private long maxShuffledSamples;

	public int getShuffleCacheSize() {
		return shuffleCacheSize;
	}
	public void setShuffleCacheSize(int shuffleCacheSize) {
		this.shuffleCacheSize = shuffleCacheSize;
	}
	public long getMaxShuffledSamples() {
		return maxShuffledSamples;
	}
	public void setMaxShuffledSamples(long maxShuffledSamples) {
		this.maxShuffledSamples = maxShuffledSamples;
	}

}
