package io.tilt.tandem.api;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import javax.ws.rs.client.ClientBuilder;
import javax.ws.rs.core.Response;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import io.tilt.tandem.TestUtils;
import io.tilt.tandem.domain.BarrierReply;
import io.tilt.tandem.domain.CheckpointRecord;
import io.tilt.tandem.domain.DatasetAck;
import io.tilt.tandem.domain.DatasetSpec;
import io.tilt.tandem.domain.Heartbeat;
import io.tilt.tandem.domain.HeartbeatAck;
import io.tilt.tandem.domain.RecoveryInfo;
import io.tilt.tandem.domain.Registration;
import io.tilt.tandem.domain.ShardAssignment;
import io.tilt.tandem.domain.WorkerStatus;

public class ServerClientTest {

	private Server server;
	private Client client;

	@Before
	public void setup() {
		final Config config = TestUtils.prototypeConfig();
		config.getBootstrap().setEnableWebserver(true);
		config.getBootstrap().setWebServerHostPort("localhost:" + TestUtils.freePort());
		server = new Server(config);
		client = server.getClient();
	}

	@After
	public void tearDown() {
		client.close();
		server.shutdown();
	}

	private void registerFleet(final int size) {
		for (int i = 0; i < size; i++) {
			final Registration reg = client.registerWorker(TestUtils.worker("w" + i));
			assertEquals(i, reg.getRank());
			assertEquals(i + 1, reg.getWorldSize());
		}
	}

	@Test
	public void test_registration_and_duplicates() {
		registerFleet(4);
		try {
			client.registerWorker(TestUtils.worker("w2"));
			fail("duplicate admitted");
		} catch (DuplicateWorkerException e) {
			assertEquals(ErrorKind.DUPLICATE_WORKER, e.getKind());
		}
		try {
			client.registerWorker(TestUtils.worker(""));
			fail("blank id admitted");
		} catch (IllegalArgumentException e) {
			assertNotNull(e.getMessage());
		}
		assertTrue(client.deregisterWorker("w3"));
		assertFalse(client.deregisterWorker("w3"));
		assertEquals(3, server.getCoordinator().getRegistry().worldSize());
	}

	@Test
	public void test_shards_over_the_wire() {
		registerFleet(4);
		final DatasetSpec spec = DatasetSpec.builder("ds")
				.samples(10_000, 100)
				.shuffled(7)
				.build();
		final DatasetAck ack = client.registerDataset(spec);
		assertTrue(ack.isCreated());
		assertFalse(client.registerDataset(spec).isCreated());

		long total = 0;
		final Set<Integer> shardIds = new HashSet<>();
		for (int i = 0; i < 4; i++) {
			final ShardAssignment shard = client.getShard("w" + i, "ds", 0);
			assertEquals(4, shard.getTotalShards());
			shardIds.add(shard.getShardId());
			total += shard.getSampleCount();
		}
		assertEquals(4, shardIds.size());
		assertEquals(10_000, total);

		try {
			client.getShard("w0", "missing", 0);
			fail("shard of a missing dataset");
		} catch (CoordinatorException e) {
			assertEquals(ErrorKind.NOT_FOUND, e.getKind());
		}
		try {
			client.getShard("stranger", "ds", 0);
			fail("shard for a stranger");
		} catch (UnknownWorkerException e) {
			assertEquals(ErrorKind.UNKNOWN_WORKER, e.getKind());
		}
	}

	@Test
	public void test_heartbeats_and_checkpoints() {
		registerFleet(2);
		final HeartbeatAck ack = client.heartbeat(Heartbeat.builder("w1")
				.status(WorkerStatus.training(120, 1, "train"))
				.build());
		assertTrue(ack.getServerTimestampMs() > 0);
		try {
			client.heartbeat(Heartbeat.builder("stranger").build());
			fail("heartbeat of a stranger");
		} catch (UnknownWorkerException e) {
			assertEquals(ErrorKind.UNKNOWN_WORKER, e.getKind());
		}

		assertFalse(client.latestCheckpoint().isHasCheckpoint());
		client.notifyCheckpoint(CheckpointRecord.full("checkpoint-100", "w0", 100, 1, "/tmp/c100", 1024));
		client.notifyCheckpoint(CheckpointRecord.full("checkpoint-200", "w0", 200, 2, "/tmp/c200", 1024));
		final RecoveryInfo info = client.latestCheckpoint();
		assertTrue(info.isHasCheckpoint());
		assertEquals(200, info.getResumeStep());
		assertEquals(2, info.getResumeEpoch());
		assertEquals("checkpoint-200", info.getCheckpoint().getCheckpointId());
	}

	@Test
	public void test_barrier_over_the_wire() throws Exception {
		registerFleet(3);
		final ExecutorService pool = Executors.newFixedThreadPool(3);
		try {
			final List<Future<BarrierReply>> replies = new ArrayList<>();
			for (int i = 0; i < 3; i++) {
				final String id = "w" + i;
				replies.add(pool.submit(() -> client.waitBarrier(id, "epoch-1", 500, 10_000)));
			}
			final Set<Integer> orders = new HashSet<>();
			for (Future<BarrierReply> f : replies) {
				final BarrierReply reply = f.get(15, TimeUnit.SECONDS);
				assertEquals("epoch-1", reply.getBarrierId());
				assertEquals(3, reply.getParticipants());
				orders.add(reply.getArrivalOrder());
			}
			assertEquals(3, orders.size());
		} finally {
			pool.shutdownNow();
		}
	}

	@Test
	public void test_barrier_timeout_over_the_wire() {
		registerFleet(2);
		final long start = System.currentTimeMillis();
		try {
			client.waitBarrier("w0", "lonely", 1, 300);
			fail("barrier released without everyone");
		} catch (BarrierTimeoutException e) {
			assertEquals(ErrorKind.BARRIER_TIMEOUT, e.getKind());
			assertTrue(System.currentTimeMillis() - start >= 250);
		}
		try {
			client.waitBarrier("w1", "lonely", 2, 300);
			fail("step mismatch accepted");
		} catch (CoordinatorException e) {
			assertEquals(ErrorKind.FAILED_PRECONDITION, e.getKind());
		}
	}

	@Test
	public void test_admin_views() throws Exception {
		registerFleet(1);
		final javax.ws.rs.client.Client raw = ClientBuilder.newClient();
		try {
			final String base = server.getBaseUri().toString() + "/admin/";
			final Response health = raw.target(base + "health").request().get();
			assertEquals(200, health.getStatus());
			assertTrue(health.readEntity(String.class).contains("UP"));

			final String snapshot = raw.target(base + "snapshot").request().get(String.class);
			assertTrue(snapshot.contains("\"w0\""));
			assertTrue(snapshot.contains("tandem-test"));
			final JsonNode coordinator = new ObjectMapper().readTree(snapshot).get("coordinator");
			assertNotNull(coordinator);
			for (String key : new String[] {"connected", "address", "uptime", "version"}) {
				assertTrue("missing " + key, coordinator.has(key));
			}
			assertTrue(coordinator.get("connected").asBoolean());
			assertTrue(coordinator.get("uptime").isIntegralNumber());
			assertTrue(coordinator.get("uptime").asLong() >= 0);

			final String metrics = raw.target(base + "metrics").request().get(String.class);
			assertTrue(metrics.contains("active-workers"));
		} finally {
			raw.close();
		}
	}

	@Test
	public void test_shutdown_is_repeatable() {
		server.shutdown();
		server.shutdown();
		try {
			server.getCoordinator();
			fail("coordinator available after shutdown");
		} catch (IllegalStateException e) {
			assertNotNull(e.getMessage());
		}
	}

}
