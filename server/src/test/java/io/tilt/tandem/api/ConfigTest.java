package io.tilt.tandem.api;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import java.util.Properties;

import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class ConfigTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	@After
	public void tearDown() {
		System.clearProperty("liveness.heartbeatTimeout");
	}

	@Test
	public void test_static_defaults() {
		final Config config = new Config();
		assertEquals("default", config.getBootstrap().getNamespace());
		assertTrue(config.getBootstrap().isEnableWebserver());
		assertEquals(300_000, config.getBarrier().getDefaultTimeoutMs());
		assertEquals(1000, config.getMonitor().getStatsWindowSize());
		assertTrue(config.getCheckpoint().getKeepCount() > 0);
	}

	@Test
	public void test_properties_override_defaults() {
		final Properties props = new Properties();
		props.setProperty("bootstrap.namespace", "fleet-a");
		props.setProperty("barrier.defaultTimeoutMs", "1500");
		props.setProperty("bootstrap.enableWebserver", "false");
		final Config config = new Config(props);
		assertEquals("fleet-a", config.getBootstrap().getNamespace());
		assertEquals(1500, config.getBarrier().getDefaultTimeoutMs());
		assertFalse(config.getBootstrap().isEnableWebserver());
	}

	@Test
	public void test_system_property_below_given_properties() {
		final long defaultTimeout = new Config().getLiveness().getHeartbeatTimeout();
		System.setProperty("liveness.heartbeatTimeout", String.valueOf(defaultTimeout + 1));
		assertEquals(defaultTimeout + 1, new Config().getLiveness().getHeartbeatTimeout());

		final Properties props = new Properties();
		props.setProperty("liveness.heartbeatTimeout", String.valueOf(defaultTimeout + 2));
		assertEquals(defaultTimeout + 2, new Config(props).getLiveness().getHeartbeatTimeout());
	}

	@Test
	public void test_unparseable_property_keeps_default() {
		final Properties props = new Properties();
		props.setProperty("barrier.defaultTimeoutMs", "soon");
		assertEquals(300_000, new Config(props).getBarrier().getDefaultTimeoutMs());
	}

	@Test
	public void test_json_file() throws IOException {
		final Config config = new Config();
		config.getBootstrap().setNamespace("from-file");
		config.getCheckpoint().setKeepCount(9);
		final File file = new File(folder.getRoot(), "tandem.json");
		config.toJsonFile(file.getAbsolutePath());

		final Config read = Config.fromJsonFile(file);
		assertEquals("from-file", read.getBootstrap().getNamespace());
		assertEquals(9, read.getCheckpoint().getKeepCount());
		assertEquals(config.getBarrier().getDefaultTimeoutMs(), read.getBarrier().getDefaultTimeoutMs());
		assertEquals("from-file", Config.fromString(config.toJson()).getBootstrap().getNamespace());
	}

}
