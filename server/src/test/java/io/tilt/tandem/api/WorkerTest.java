package io.tilt.tandem.api;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.IOException;

import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import io.tilt.tandem.TestUtils;
import io.tilt.tandem.core.follower.LocalCheckpoint;
import io.tilt.tandem.domain.DatasetSpec;
import io.tilt.tandem.domain.RecoveryInfo;
import io.tilt.tandem.domain.Registration;
import io.tilt.tandem.domain.ShardAssignment;
import io.tilt.tandem.domain.WorkerStatus;

public class WorkerTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private Server server;
	private Client client;
	private Config workerConfig;

	@Before
	public void setup() throws IOException {
		final Config config = TestUtils.prototypeConfig();
		config.getBootstrap().setEnableWebserver(true);
		config.getBootstrap().setWebServerHostPort("localhost:" + TestUtils.freePort());
		server = new Server(config);
		client = server.getClient();

		workerConfig = TestUtils.prototypeConfig();
		workerConfig.getCheckpoint().setDirectory(folder.newFolder("w0").getAbsolutePath());
	}

	@After
	public void tearDown() {
		client.close();
		server.shutdown();
	}

	@Test
	public void test_worker_lifecycle() throws Exception {
		final Worker worker = new Worker(workerConfig, client, TestUtils.worker("w0"));
		final Registration reg = worker.start();
		assertEquals(0, reg.getRank());
		assertEquals(1, reg.getWorldSize());
		assertEquals(reg, worker.getRegistration());

		worker.registerDataset(DatasetSpec.builder("ds").samples(1000, 10).build());
		final ShardAssignment shard = worker.getShard("ds", 0);
		assertEquals(1000, shard.getSampleCount());

		worker.setStatus(WorkerStatus.training(10, 0, "train"));
		assertTrue(worker.getHeartpump().beat());
		assertEquals(1, worker.waitBarrier("solo", 10, 1000).getParticipants());

		final byte[] weights = new byte[] { 4, 8, 15, 16, 23, 42 };
		final LocalCheckpoint saved = worker.checkpoint(weights, 10, 0);
		worker.checkpointAsync(weights, 20, 1).get();
		worker.getCheckpoints().waitPending();
		assertArrayEquals(weights, worker.getCheckpoints().load(saved.getStep()));

		final RecoveryInfo recovery = worker.recover();
		assertTrue(recovery.isHasCheckpoint());
		assertEquals(20, recovery.getResumeStep());
		assertEquals(1, recovery.getResumeEpoch());

		worker.shutdown();
		assertNull(worker.getRegistration());
		assertFalse(server.getCoordinator().getRegistry().contains("w0"));
		// repeated
		worker.shutdown();
	}

	@Test
	public void test_duplicate_worker_fails_to_start() throws IOException {
		final Worker first = new Worker(workerConfig, client, TestUtils.worker("w0"));
		first.start();
		try {
			final Config other = TestUtils.prototypeConfig();
			other.getCheckpoint().setDirectory(folder.newFolder("w0-copy").getAbsolutePath());
			new Worker(other, client, TestUtils.worker("w0")).start();
			fail("duplicate worker started");
		} catch (DuplicateWorkerException e) {
			assertEquals(ErrorKind.DUPLICATE_WORKER, e.getKind());
		} finally {
			first.shutdown();
		}
	}

}
