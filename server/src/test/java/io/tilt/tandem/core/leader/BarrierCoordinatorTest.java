package io.tilt.tandem.core.leader;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.joda.time.DateTimeUtils;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import io.tilt.tandem.TestUtils;
import io.tilt.tandem.api.BarrierTimeoutException;
import io.tilt.tandem.api.Config;
import io.tilt.tandem.api.CoordinatorException;
import io.tilt.tandem.api.ErrorKind;
import io.tilt.tandem.api.UnknownWorkerException;
import io.tilt.tandem.core.leader.BarrierCoordinator.Ticket;
import io.tilt.tandem.core.monitor.OperationStats;
import io.tilt.tandem.domain.BarrierReply;

public class BarrierCoordinatorTest {

	private Config config;
	private WorkerRegistry registry;
	private OperationStats stats;
	private BarrierCoordinator barriers;
	private ExecutorService pool;

	@Before
	public void setup() {
		config = TestUtils.prototypeConfig();
		registry = new WorkerRegistry(config);
		stats = new OperationStats(config);
		barriers = new BarrierCoordinator(config, registry, TestUtils.idleScheduler(), stats);
		pool = Executors.newCachedThreadPool();
	}

	@After
	public void tearDown() {
		pool.shutdownNow();
		DateTimeUtils.setCurrentMillisSystem();
	}

	private void register(final int workers) {
		for (int i = 0; i < workers; i++) {
			registry.register(TestUtils.worker("w" + i));
		}
	}

	@Test
	public void test_all_participants_released_once_with_their_order() throws Exception {
		register(4);
		final List<Future<BarrierReply>> calls = new ArrayList<>();
		for (int i = 0; i < 4; i++) {
			final String id = "w" + i;
			calls.add(pool.submit(() -> barriers.waitBarrier(id, "epoch-1", 100, 10_000)));
		}
		final Set<Integer> orders = new HashSet<>();
		for (Future<BarrierReply> call : calls) {
			final BarrierReply reply = call.get(10, TimeUnit.SECONDS);
			assertEquals(4, reply.getParticipants());
			assertEquals("epoch-1", reply.getBarrierId());
			orders.add(reply.getArrivalOrder());
		}
		assertEquals(new HashSet<>(Arrays.asList(1, 2, 3, 4)), orders);
		@SuppressWarnings("unchecked")
		final Map<String, Object> release = (Map<String, Object>) stats.toMap().get("barrier_release");
		assertTrue(release.containsKey("p99-ms"));
	}

	@Test
	public void test_release_happens_at_the_last_arrival() {
		register(3);
		final Ticket t0 = barriers.arrive("w0", "b", 1);
		final Ticket t1 = barriers.arrive("w1", "b", 1);
		assertFalse(t0.getArrival().isDone());
		assertFalse(t1.getArrival().isDone());
		assertEquals(Barrier.Status.WAITING, barriers.get("b").getStatus());

		final Ticket t2 = barriers.arrive("w2", "b", 1);
		assertTrue(t0.getArrival().isDone());
		assertEquals(1, t0.getArrival().join().getArrivalOrder());
		assertEquals(2, t1.getArrival().join().getArrivalOrder());
		assertEquals(3, t2.getArrival().join().getArrivalOrder());
		assertEquals(Barrier.Status.COMPLETE, barriers.get("b").getStatus());
	}

	@Test
	public void test_duplicate_calls_resolve_to_a_single_arrival() {
		register(2);
		final Ticket first = barriers.arrive("w0", "b", 1);
		final Ticket again = barriers.arrive("w0", "b", 1);
		assertSame(first.getArrival(), again.getArrival());
		assertFalse(first.getArrival().isDone());
		barriers.arrive("w1", "b", 1);
		assertEquals(1, again.getArrival().join().getArrivalOrder());

		// late duplicate gets the original reply
		final BarrierReply late = barriers.waitBarrier("w1", "b", 1, 1000);
		assertEquals(2, late.getArrivalOrder());
	}

	@Test
	public void test_timed_out_caller_is_withdrawn_and_others_still_complete() throws Exception {
		register(2);
		try {
			barriers.waitBarrier("w0", "b", 5, 200);
			fail("barrier released with a missing participant");
		} catch (BarrierTimeoutException e) {
			assertEquals(ErrorKind.BARRIER_TIMEOUT, e.getKind());
		}
		assertTrue(barriers.get("b").getArrived().isEmpty());

		final Future<BarrierReply> w1 = pool.submit(() -> barriers.waitBarrier("w1", "b", 5, 10_000));
		final Future<BarrierReply> w0 = pool.submit(() -> barriers.waitBarrier("w0", "b", 5, 10_000));
		assertEquals(2, w1.get(10, TimeUnit.SECONDS).getParticipants());
		assertEquals(2, w0.get(10, TimeUnit.SECONDS).getParticipants());
	}

	@Test
	public void test_same_barrier_id_for_consecutive_phases() throws Exception {
		register(2);
		for (long step = 1; step <= 3; step++) {
			final long at = step;
			final Future<BarrierReply> w0 = pool.submit(() -> barriers.waitBarrier("w0", "epoch_end", at, 10_000));
			final Future<BarrierReply> w1 = pool.submit(() -> barriers.waitBarrier("w1", "epoch_end", at, 10_000));
			final Set<Integer> orders = new HashSet<>();
			for (Future<BarrierReply> call : Arrays.asList(w0, w1)) {
				final BarrierReply reply = call.get(10, TimeUnit.SECONDS);
				assertEquals(at, reply.getStep());
				assertEquals(2, reply.getParticipants());
				orders.add(reply.getArrivalOrder());
			}
			assertEquals(new HashSet<>(Arrays.asList(1, 2)), orders);
		}
		assertEquals(1, barriers.barriers().size());
		assertEquals(3, barriers.get("epoch_end").getStep());
	}

	@Test
	public void test_released_barrier_is_replaced_at_a_new_step() {
		register(2);
		barriers.arrive("w0", "sync", 1);
		barriers.arrive("w1", "sync", 1);
		final Barrier first = barriers.get("sync");
		assertEquals(Barrier.Status.COMPLETE, first.getStatus());

		final Ticket next = barriers.arrive("w1", "sync", 2);
		assertFalse(next.getArrival().isDone());
		final Barrier second = barriers.get("sync");
		assertNotSame(first, second);
		assertEquals(Barrier.Status.WAITING, second.getStatus());

		// the previous phase is gone, and a stale step can't join the open one
		try {
			barriers.arrive("w0", "sync", 1);
			fail("stale step accepted");
		} catch (CoordinatorException e) {
			assertEquals(ErrorKind.FAILED_PRECONDITION, e.getKind());
		}
		barriers.arrive("w0", "sync", 2);
		assertEquals(1, next.getArrival().join().getArrivalOrder());
	}

	@Test
	public void test_withdrawn_ticket_after_release_is_too_late() {
		register(1);
		final Ticket t = barriers.arrive("w0", "solo", 0);
		assertTrue(t.getArrival().isDone());
		assertFalse(t.withdraw());
	}

	@Test
	public void test_rejections() {
		register(2);
		try {
			barriers.arrive("stranger", "b", 1);
			fail("unregistered caller accepted");
		} catch (UnknownWorkerException e) {
			assertEquals(ErrorKind.UNKNOWN_WORKER, e.getKind());
		}
		barriers.arrive("w0", "b", 1);
		try {
			barriers.arrive("w1", "b", 2);
			fail("step mismatch accepted");
		} catch (CoordinatorException e) {
			assertEquals(ErrorKind.FAILED_PRECONDITION, e.getKind());
		}
		barriers.arrive("w1", "b", 1);

		// joined after the barrier was created and released
		registry.register(TestUtils.worker("w2"));
		try {
			barriers.arrive("w2", "b", 1);
			fail("non participant accepted on a released barrier");
		} catch (CoordinatorException e) {
			assertEquals(ErrorKind.FAILED_PRECONDITION, e.getKind());
		}
	}

	@Test(expected = IllegalArgumentException.class)
	public void test_empty_barrier_id() {
		register(1);
		barriers.arrive("w0", " ", 1);
	}

	@Test(expected = IllegalArgumentException.class)
	public void test_negative_timeout() {
		register(1);
		barriers.waitBarrier("w0", "b", 1, -1);
	}

	@Test
	public void test_barriers_are_independent() {
		register(2);
		final Ticket a = barriers.arrive("w0", "a", 1);
		final Ticket b0 = barriers.arrive("w0", "b", 7);
		barriers.arrive("w1", "b", 7);
		assertTrue(b0.getArrival().isDone());
		assertFalse(a.getArrival().isDone());
		assertEquals(2, barriers.barriers().size());
	}

	@Test
	public void test_janitor_drops_released_and_abandoned_barriers() {
		DateTimeUtils.setCurrentMillisFixed(1_000_000);
		register(2);
		barriers.arrive("w0", "done", 1);
		barriers.arrive("w1", "done", 1);
		final Ticket left = barriers.arrive("w0", "abandoned", 1);
		left.withdraw();

		barriers.cleanup();
		assertEquals(2, barriers.barriers().size());

		DateTimeUtils.setCurrentMillisFixed(1_000_001 + config.beatToMs(config.getBarrier().getCompletedRetention()));
		barriers.cleanup();
		assertEquals(1, barriers.barriers().size());
		assertEquals("abandoned", barriers.barriers().get(0).getBarrierId());

		DateTimeUtils.setCurrentMillisFixed(1_000_001 + config.beatToMs(config.getBarrier().getAbandonedRetention()));
		barriers.cleanup();
		assertTrue(barriers.barriers().isEmpty());
		try {
			barriers.get("done");
			fail("dropped barrier found");
		} catch (CoordinatorException e) {
			assertEquals(ErrorKind.NOT_FOUND, e.getKind());
		}
		// the id can be used again
		assertFalse(barriers.arrive("w0", "done", 2).getArrival().isDone());
	}

}
