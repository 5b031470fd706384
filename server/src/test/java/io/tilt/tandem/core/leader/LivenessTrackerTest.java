package io.tilt.tandem.core.leader;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;

import org.joda.time.DateTimeUtils;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import io.tilt.tandem.TestUtils;
import io.tilt.tandem.api.Config;
import io.tilt.tandem.api.UnknownWorkerException;
import io.tilt.tandem.core.task.Scheduler;
import io.tilt.tandem.core.task.Scheduler.Agent;
import io.tilt.tandem.domain.Heartbeat;
import io.tilt.tandem.domain.ResourceUsage;
import io.tilt.tandem.domain.WorkerLiveness;
import io.tilt.tandem.domain.WorkerState;
import io.tilt.tandem.domain.WorkerStatus;

public class LivenessTrackerTest {

	private static final long T0 = 5_000_000;

	private Config config;
	private WorkerRegistry registry;
	private Scheduler scheduler;
	private LivenessTracker tracker;
	private long timeout;

	@Before
	public void setup() {
		DateTimeUtils.setCurrentMillisFixed(T0);
		config = TestUtils.prototypeConfig();
		timeout = config.beatToMs(config.getLiveness().getHeartbeatTimeout());
		registry = new WorkerRegistry(config);
		scheduler = TestUtils.idleScheduler();
		tracker = new LivenessTracker(config, registry, scheduler);
	}

	@After
	public void tearDown() {
		DateTimeUtils.setCurrentMillisSystem();
	}

	@Test
	public void test_sweeper_is_scheduled_at_start() {
		tracker.init();
		verify(scheduler).schedule(any(Agent.class));
		tracker.destroy();
		verify(scheduler).stop(any(Agent.class));
	}

	@Test
	public void test_heartbeat_updates_status() {
		registry.register(TestUtils.worker("w0"));
		DateTimeUtils.setCurrentMillisFixed(T0 + 100);
		final long received = tracker.heartbeat(Heartbeat.builder("w0")
				.status(WorkerStatus.training(120, 2, "resnet"))
				.resources(ResourceUsage.none())
				.build());
		assertEquals(T0 + 100, received);
		final WorkerLiveness live = tracker.status("w0");
		assertEquals(WorkerState.TRAINING, live.getState());
		assertEquals(120, live.getStatus().step());
		assertEquals(T0 + 100, live.getLastSeen());
		assertEquals(1, live.getBeats());
		assertEquals(1, tracker.getHeartbeats());
	}

	@Test(expected = UnknownWorkerException.class)
	public void test_heartbeat_from_stranger() {
		tracker.heartbeat(Heartbeat.builder("nobody").build());
	}

	@Test
	public void test_silent_worker_is_found_dead_and_evicted() {
		registry.register(TestUtils.worker("w0"));
		registry.register(TestUtils.worker("w1"));

		DateTimeUtils.setCurrentMillisFixed(T0 + timeout);
		tracker.heartbeat(Heartbeat.builder("w1").build());
		tracker.sweep();
		assertEquals(0, tracker.getDeadCount());

		DateTimeUtils.setCurrentMillisFixed(T0 + timeout + 1);
		tracker.sweep();
		assertEquals(1, tracker.getDeadCount());
		assertFalse(registry.contains("w0"));
		assertTrue(registry.contains("w1"));
		assertEquals(1, registry.worldSize());
		assertEquals("w0", tracker.recentlyDead().get(0).getWorkerId());
		assertEquals(WorkerState.DEAD, tracker.recentlyDead().get(0).getState());
		assertEquals(1, tracker.entries().size());

		// evicted, so it's a stranger now
		try {
			tracker.heartbeat(Heartbeat.builder("w0").build());
			fail("evicted worker accepted");
		} catch (UnknownWorkerException e) {
			assertTrue(e.getMessage().contains("w0"));
		}
	}

	@Test
	public void test_dead_worker_kept_when_eviction_disabled() {
		config.getLiveness().setEvictDeadWorkers(false);
		registry.register(TestUtils.worker("w0"));
		DateTimeUtils.setCurrentMillisFixed(T0 + timeout + 1);
		tracker.sweep();
		tracker.sweep();
		assertEquals(1, tracker.getDeadCount());
		assertTrue(registry.contains("w0"));
		assertEquals(WorkerState.DEAD, tracker.status("w0").getState());

		// back from the dead
		tracker.heartbeat(Heartbeat.builder("w0").status(WorkerStatus.idle()).build());
		assertEquals(WorkerState.IDLE, tracker.status("w0").getState());
	}

	@Test
	public void test_deregistration_drops_liveness() {
		registry.register(TestUtils.worker("w0"));
		assertEquals(1, tracker.entries().size());
		registry.deregister("w0");
		assertTrue(tracker.entries().isEmpty());
		assertEquals(0, tracker.getDeadCount());
	}

}
