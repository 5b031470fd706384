package io.tilt.tandem.core.leader;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.joda.time.DateTimeUtils;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import io.tilt.tandem.TestUtils;
import io.tilt.tandem.api.Config;
import io.tilt.tandem.domain.CheckpointRecord;
import io.tilt.tandem.domain.CheckpointType;
import io.tilt.tandem.domain.RecoveryInfo;

public class CheckpointRegistryTest {

	private static final long T0 = 2_000_000;

	private Config config;
	private CheckpointRegistry registry;

	@Before
	public void setup() {
		DateTimeUtils.setCurrentMillisFixed(T0);
		config = TestUtils.prototypeConfig();
		registry = new CheckpointRegistry(config);
	}

	@After
	public void tearDown() {
		DateTimeUtils.setCurrentMillisSystem();
	}

	private static CheckpointRecord record(final String id, final long step, final long ts) {
		return new CheckpointRecord(id, "w0", step, 1, "/ckpt/" + id, 1024, ts, CheckpointType.FULL);
	}

	@Test
	public void test_empty_registry_has_no_recovery() {
		final RecoveryInfo info = registry.recovery();
		assertFalse(info.isHasCheckpoint());
		assertEquals(0, info.getResumeStep());
		assertFalse(registry.latest().isPresent());
	}

	@Test
	public void test_latest_is_the_highest_step() {
		registry.notifyCheckpoint(record("c-300", 300, 10));
		registry.notifyCheckpoint(record("c-500", 500, 5));
		registry.notifyCheckpoint(record("c-400", 400, 20));
		final RecoveryInfo info = registry.recovery();
		assertTrue(info.isHasCheckpoint());
		assertEquals(500, info.getResumeStep());
		assertEquals("c-500", info.getCheckpoint().getCheckpointId());

		final List<CheckpointRecord> records = registry.records();
		assertEquals("c-400", records.get(0).getCheckpointId());
		assertEquals("c-500", records.get(2).getCheckpointId());
	}

	@Test
	public void test_same_id_overwrites() {
		registry.notifyCheckpoint(record("c", 1, 1));
		registry.notifyCheckpoint(record("c", 2, 2));
		assertEquals(1, registry.size());
		assertEquals(2, registry.latest().get().getStep());
	}

	@Test
	public void test_invalid_records() {
		assertInvalid(record("", 1, 1));
		assertInvalid(new CheckpointRecord("c", "", 1, 1, "/p", 1, 1, null));
		assertInvalid(record("c", -1, 1));
		assertInvalid(new CheckpointRecord("c", "w0", 1, -1, "/p", 1, 1, null));
		assertInvalid(new CheckpointRecord("c", "w0", 1, 1, "/p", -1, 1, null));
		assertEquals(0, registry.size());
	}

	private void assertInvalid(final CheckpointRecord r) {
		try {
			registry.notifyCheckpoint(r);
			org.junit.Assert.fail("invalid record accepted: " + r);
		} catch (IllegalArgumentException e) {
			assertTrue(e.getMessage() != null);
		}
	}

	@Test
	public void test_records_bounded_by_oldest_timestamp() {
		config.getCheckpoint().setMaxRecords(3);
		for (int i = 0; i < 5; i++) {
			registry.notifyCheckpoint(record("c-" + i, i * 10, 100 + i));
		}
		assertEquals(3, registry.size());
		assertEquals("c-2", registry.records().get(2).getCheckpointId());
	}

	@Test
	public void test_throughput_counts_the_last_window() {
		registry.notifyCheckpoint(record("a", 1, 1));
		DateTimeUtils.setCurrentMillisFixed(T0 + 30_000);
		registry.notifyCheckpoint(record("b", 2, 2));
		assertEquals(2, registry.notificationsWithin(CheckpointRegistry.THROUGHPUT_WINDOW_MS));
		DateTimeUtils.setCurrentMillisFixed(T0 + 61_000);
		assertEquals(1, registry.notificationsWithin(CheckpointRegistry.THROUGHPUT_WINDOW_MS));
		DateTimeUtils.setCurrentMillisFixed(T0 + 200_000);
		assertEquals(0, registry.notificationsWithin(CheckpointRegistry.THROUGHPUT_WINDOW_MS));
	}

}
