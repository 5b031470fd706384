package io.tilt.tandem.api.config;

public class RegistrySettings {

	/* admission stops beyond this many live workers */
	protected static final int MAX_WORKERS = 10000;
	private int maxWorkers;

	/*
	 * beats a departed worker's rank stays reserved before it's handed out again,
	 * so a restarting worker is not raced by a newcomer for its old slot
	 */
	protected static final long RANK_RELEASE_GRACE = 10;
	private long rankReleaseGrace;

	public int getMaxWorkers() {
		return maxWorkers;
	}
	public void setMaxWorkers(int maxWorkers) {
		this.maxWorkers = maxWorkers;
	}
	public long getRankReleaseGrace() {
		return rankReleaseGrace;
	}
	public void setRankReleaseGrace(long rankReleaseGrace) {
		this.rankReleaseGrace = rankReleaseGrace;
	}

}
