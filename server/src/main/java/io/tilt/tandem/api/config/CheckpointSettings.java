package io.tilt.tandem.api.config;

public class CheckpointSettings {

	public static final String FILE_PREFIX = "checkpoint-";
	public static final String FILE_SUFFIX = ".ckpt";
	public static final String TEMP_SUFFIX = ".tmp";

	protected static final String DIRECTORY = "/tmp/tandem/checkpoints";
	private String directory;

	/* newest checkpoints kept on disk by step */
	protected static final int KEEP_COUNT = 5;
	private int keepCount;

	protected static final int WRITER_THREADS = 2;
	private int writerThreads;
	/* async saves waiting for a writer beyond this many block the caller */
	protected static final int WRITER_QUEUE_CAPACITY = 8;
	private int writerQueueCapacity;

	/* checkpoint notifications remembered by the coordinator */
	protected static final int MAX_RECORDS = 1000;
	private int maxRecords;

	public String getDirectory() {
		return directory;
	}
	public void setDirectory(String directory) {
		this.directory = directory;
	}
	public int getKeepCount() {
		return keepCount;
	}
	public void setKeepCount(int keepCount) {
		this.keepCount = keepCount;
	}
	public int getWriterThreads() {
		return writerThreads;
	}
	public void setWriterThreads(int writerThreads) {
		this.writerThreads = writerThreads;
	}
	public int getWriterQueueCapacity() {
		return writerQueueCapacity;
	}
	public void setWriterQueueCapacity(int writerQueueCapacity) {
		this.writerQueueCapacity = writerQueueCapacity;
	}
	public int getMaxRecords() {
		return maxRecords;
	}
	public void setMaxRecords(int maxRecords) {
		this.maxRecords = maxRecords;
	}

}
