package io.tilt.tandem.core.leader;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.joda.time.DateTimeUtils;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import io.tilt.tandem.TestUtils;
import io.tilt.tandem.api.Config;
import io.tilt.tandem.api.CoordinatorException;
import io.tilt.tandem.api.DuplicateWorkerException;
import io.tilt.tandem.api.ErrorKind;
import io.tilt.tandem.api.UnknownWorkerException;
import io.tilt.tandem.domain.Registration;
import io.tilt.tandem.domain.WorkerInfo;
import io.tilt.tandem.domain.WorkerRecord;

public class WorkerRegistryTest {

	private Config config;
	private WorkerRegistry registry;

	@Before
	public void setup() {
		DateTimeUtils.setCurrentMillisFixed(1_000_000);
		config = TestUtils.prototypeConfig();
		registry = new WorkerRegistry(config);
	}

	@After
	public void tearDown() {
		DateTimeUtils.setCurrentMillisSystem();
	}

	@Test
	public void test_four_workers_get_consecutive_ranks() {
		for (int i = 0; i < 4; i++) {
			final Registration reg = registry.register(TestUtils.worker("w" + i));
			assertEquals(i, reg.getRank());
			assertEquals(i + 1, reg.getWorldSize());
			assertEquals(config.beatToMs(config.getLiveness().getHeartbeatFrequency()), reg.getHeartbeatIntervalMs());
		}
		assertEquals(4, registry.worldSize());
		final List<WorkerRecord> workers = registry.workers();
		for (int i = 0; i < 4; i++) {
			assertEquals(i, workers.get(i).getRank());
		}
	}

	@Test
	public void test_duplicate_id_is_rejected() {
		registry.register(TestUtils.worker("w0"));
		try {
			registry.register(TestUtils.worker("w0"));
			fail("duplicate admitted");
		} catch (DuplicateWorkerException e) {
			assertEquals(ErrorKind.DUPLICATE_WORKER, e.getKind());
		}
		assertEquals(1, registry.worldSize());
	}

	@Test(expected = IllegalArgumentException.class)
	public void test_invalid_info_is_rejected() {
		registry.register(new WorkerInfo("", "host", 1, 0, 0));
	}

	@Test
	public void test_capacity_limit() {
		config.getRegistry().setMaxWorkers(2);
		registry.register(TestUtils.worker("w0"));
		registry.register(TestUtils.worker("w1"));
		try {
			registry.register(TestUtils.worker("w2"));
			fail("over capacity admitted");
		} catch (CoordinatorException e) {
			assertEquals(ErrorKind.CAPACITY_EXCEEDED, e.getKind());
		}
	}

	@Test
	public void test_released_rank_is_reserved_for_a_while() {
		registry.register(TestUtils.worker("w0"));
		registry.register(TestUtils.worker("w1"));
		registry.register(TestUtils.worker("w2"));
		assertTrue(registry.deregister("w1"));
		assertFalse(registry.deregister("w1"));

		// within the grace the hole is skipped
		assertEquals(3, registry.register(TestUtils.worker("w3")).getRank());

		DateTimeUtils.setCurrentMillisFixed(1_000_000 + config.beatToMs(config.getRegistry().getRankReleaseGrace()) + 1);
		assertEquals(1, registry.register(TestUtils.worker("w4")).getRank());
	}

	@Test
	public void test_position_ignores_rank_holes() {
		config.getRegistry().setRankReleaseGrace(0);
		registry.register(TestUtils.worker("w0"));
		registry.register(TestUtils.worker("w1"));
		registry.register(TestUtils.worker("w2"));
		registry.deregister("w1");
		assertArrayEquals(new int[] { 0, 2 }, registry.positionOf("w0"));
		assertArrayEquals(new int[] { 1, 2 }, registry.positionOf("w2"));
		assertEquals(2, registry.rankOf("w2"));
	}

	@Test(expected = UnknownWorkerException.class)
	public void test_unknown_worker_lookup() {
		registry.get("nobody");
	}

	@Test
	public void test_listeners_are_told() {
		final WorkerRegistry.Listener listener = mock(WorkerRegistry.Listener.class);
		registry.addListener(listener);
		registry.register(TestUtils.worker("w0"));
		verify(listener).onAdmitted(any(WorkerRecord.class));
		registry.evict("w0");
		verify(listener).onRemoved(any(WorkerRecord.class), eq(WorkerRegistry.RemovalCause.EXPIRED));
		registry.evict("w0");
		verify(listener, never()).onRemoved(any(WorkerRecord.class), eq(WorkerRegistry.RemovalCause.DEREGISTERED));
	}

	@Test
	public void test_concurrent_registrations_get_unique_ranks() throws Exception {
		final int size = 64;
		final ExecutorService pool = Executors.newFixedThreadPool(8);
		final CountDownLatch go = new CountDownLatch(1);
		final Set<Integer> ranks = ConcurrentHashMap.newKeySet();
		for (int i = 0; i < size; i++) {
			final String id = "w" + i;
			pool.execute(() -> {
				try {
					go.await();
					ranks.add(registry.register(TestUtils.worker(id)).getRank());
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
				}
			});
		}
		go.countDown();
		pool.shutdown();
		assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
		final Set<Integer> expected = new HashSet<>();
		for (int i = 0; i < size; i++) {
			expected.add(i);
		}
		assertEquals(expected, ranks);
		assertEquals(size, registry.getAdmissions());
	}

}
