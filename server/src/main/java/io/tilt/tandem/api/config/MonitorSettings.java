package io.tilt.tandem.api.config;

public class MonitorSettings {

	/* latest samples per operation considered for percentiles */
	protected static final int STATS_WINDOW_SIZE = 1000;
	private int statsWindowSize;

	/* seconds of request history used for the request rate */
	protected static final int RATE_WINDOW_SECONDS = 60;
	private int rateWindowSeconds;

	public int getStatsWindowSize() {
		return statsWindowSize;
	}
	public void setStatsWindowSize(int statsWindowSize) {
		this.statsWindowSize = statsWindowSize;
	}
	public int getRateWindowSeconds() {
		return rateWindowSeconds;
	}
	public void setRateWindowSeconds(int rateWindowSeconds) {
		this.rateWindowSeconds = rateWindowSeconds;
	}

}
