package io.tilt.tandem.core.task.impl;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import io.tilt.tandem.TestUtils;
import io.tilt.tandem.core.task.Scheduler.Action;
import io.tilt.tandem.core.task.Scheduler.Agent;
import io.tilt.tandem.core.task.Scheduler.Frequency;

public class SchedulerImplTest {

	private SchedulerImpl scheduler;

	@Before
	public void setup() {
		scheduler = new SchedulerImpl(TestUtils.prototypeConfig(), new AgentFactoryImpl(), "test");
		scheduler.init();
	}

	@After
	public void tearDown() {
		scheduler.destroy();
	}

	@Test
	public void test_periodic_agent_survives_failures() throws InterruptedException {
		final CountDownLatch runs = new CountDownLatch(3);
		final Agent agent = scheduler.getAgentFactory()
				.create(Action.LIVENESS_SWEEP, Frequency.PERIODIC, () -> {
					runs.countDown();
					throw new IllegalStateException("sweep failed");
				})
				.every(20)
				.build();
		scheduler.schedule(agent);
		assertTrue(runs.await(5, TimeUnit.SECONDS));
		assertTrue(agent.getCounter() >= 3);
		assertTrue(agent.getLastException() instanceof IllegalStateException);
		assertSame(agent, scheduler.get(Action.LIVENESS_SWEEP));
	}

	@Test
	public void test_stopped_agent_runs_no_more() throws InterruptedException {
		final AtomicInteger count = new AtomicInteger();
		final CountDownLatch first = new CountDownLatch(1);
		final Agent agent = scheduler.getAgentFactory()
				.create(Action.HEARTBEAT_REPORT, Frequency.PERIODIC, () -> {
					count.incrementAndGet();
					first.countDown();
				})
				.every(10)
				.build();
		scheduler.schedule(agent);
		assertTrue(first.await(5, TimeUnit.SECONDS));
		scheduler.stop(agent);
		// an execution may be in flight while cancelling
		Thread.sleep(50);
		final int stopped = count.get();
		Thread.sleep(100);
		assertEquals(stopped, count.get());
		assertNull(scheduler.get(Action.HEARTBEAT_REPORT));
	}

	@Test
	public void test_one_agent_per_action() throws InterruptedException {
		final AtomicInteger replaced = new AtomicInteger();
		final CountDownLatch replacing = new CountDownLatch(1);
		final Agent first = scheduler.getAgentFactory()
				.create(Action.BARRIER_JANITOR, Frequency.ONCE_DELAYED, replaced::incrementAndGet)
				.delayed(300)
				.build();
		final Agent second = scheduler.getAgentFactory()
				.create(Action.BARRIER_JANITOR, Frequency.ONCE_DELAYED, replacing::countDown)
				.delayed(10)
				.build();
		scheduler.schedule(first);
		scheduler.schedule(second);
		assertTrue(replacing.await(5, TimeUnit.SECONDS));
		Thread.sleep(400);
		assertEquals(0, replaced.get());
		assertEquals(1, scheduler.getAgents().size());
	}

	@Test
	public void test_forward_runs_now() throws InterruptedException {
		final CountDownLatch ran = new CountDownLatch(1);
		final Agent agent = scheduler.getAgentFactory()
				.create(Action.ANONYMOUS, Frequency.ONCE_DELAYED, ran::countDown)
				.delayed(60_000)
				.build();
		scheduler.schedule(agent);
		scheduler.forward(agent);
		assertTrue(ran.await(5, TimeUnit.SECONDS));
	}

}
