package io.tilt.tandem.api.config;

public class SchedulerSettings {

	public static final String PNAME = "TD";
	public static final String THREAD_NAME_SCHEDULER = PNAME + "Sch";
	public static final String THREAD_NAME_CHECKPOINT_WRITER = PNAME + "CkW";
	public static final String THREAD_NAME_HEARTPUMP = PNAME + "HbP";
	public static final String THREAD_NAME_WEBSERVER_WORKER = PNAME + "WebW";

	protected static final int MAX_CONCURRENCY = 4;
	private int maxConcurrency;

	public int getMaxConcurrency() {
		return this.maxConcurrency;
	}

	public void setMaxConcurrency(int maxConcurrency) {
		this.maxConcurrency = maxConcurrency;
	}

}
