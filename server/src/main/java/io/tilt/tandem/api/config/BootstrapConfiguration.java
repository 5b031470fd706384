package io.tilt.tandem.api.config;

import org.apache.commons.lang.StringUtils;
import org.apache.commons.lang.Validate;

public class BootstrapConfiguration {

	public static final String VERSION = "0.1.0";

	/* processes in the same JVM are told apart by it */
	protected static final String NAMESPACE = "default";
	private String namespace;

	// this sets the pace of all time-synchronized processes
	protected static final long BEAT_UNIT_MS = 500;
	private long beatUnitMs;

	protected static final boolean ENABLE_WEBSERVER = true;
	private boolean enableWebserver;
	protected static final int WEB_SERVER_PORT = 57580;
	public static final String WEB_SERVER_HOST_PORT = "localhost:" + WEB_SERVER_PORT;
	private String webServerHostPort;
	protected static final String WEB_SERVER_CONTEXT_PATH = "tandem";
	private String webServerContextPath;
	protected static final int WEB_SERVER_WORKER_THREADS = 16;
	private int webServerWorkerThreads;

	public void validate() {
		Validate.isTrue(StringUtils.isNotBlank(namespace), "a namespace is required");
		Validate.isTrue(beatUnitMs > 0, "beat unit must be positive");
		if (enableWebserver) {
			Validate.isTrue(StringUtils.contains(webServerHostPort, ':'), 
					"web server host:port malformed: " + webServerHostPort);
		}
	}

	public String getNamespace() {
		return namespace;
	}
	public void setNamespace(String namespace) {
		this.namespace = namespace;
	}
	public long getBeatUnitMs() {
		return beatUnitMs;
	}
	public void setBeatUnitMs(long beatUnitMs) {
		this.beatUnitMs = beatUnitMs;
	}
	public boolean isEnableWebserver() {
		return enableWebserver;
	}
	public void setEnableWebserver(boolean enableWebserver) {
		this.enableWebserver = enableWebserver;
	}
	public String getWebServerHostPort() {
		return webServerHostPort;
	}
	public void setWebServerHostPort(String webServerHostPort) {
		this.webServerHostPort = webServerHostPort;
	}
	public String getWebServerContextPath() {
		return webServerContextPath;
	}
	public void setWebServerContextPath(String webServerContextPath) {
		this.webServerContextPath = webServerContextPath;
	}
	public int getWebServerWorkerThreads() {
		return webServerWorkerThreads;
	}
	public void setWebServerWorkerThreads(int webServerWorkerThreads) {
		this.webServerWorkerThreads = webServerWorkerThreads;
	}

}
