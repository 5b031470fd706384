/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements. See the NOTICE file distributed with this
 * work for additional information regarding copyright ownership. The ASF
 * licenses this file to You under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations under
 * the License.
 */
package io.tilt.tandem.sampler;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.apache.commons.lang.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.tilt.tandem.api.BarrierTimeoutException;
import io.tilt.tandem.api.Client;
import io.tilt.tandem.api.Config;
import io.tilt.tandem.api.Server;
import io.tilt.tandem.api.Worker;
import io.tilt.tandem.domain.DatasetSpec;
import io.tilt.tandem.domain.Registration;
import io.tilt.tandem.domain.ShardAssignment;
import io.tilt.tandem.domain.WorkerInfo;
import io.tilt.tandem.domain.WorkerStatus;
import io.tilt.tandem.utils.LogUtils;

/**
 * Emulates a data parallel training job: a coordinator and a fleet of workers
 * consuming their shards, synchronizing at each epoch's end and checkpointing.
 *
 * @author Cristian Gonzalez
 */
public class TrainingFleetEmulator {

	private static final Logger logger = LoggerFactory.getLogger(TrainingFleetEmulator.class);

	private static final String DATASET_ID = "imagenet-mini";
	private static final long STEPS_PER_EPOCH = 20;

	private final int workers;
	private final int epochs;
	private final Config config;

	public TrainingFleetEmulator(final int workers, final int epochs) {
		Validate.isTrue(workers > 0 && epochs > 0);
		this.workers = workers;
		this.epochs = epochs;
		this.config = new Config();
		config.getBootstrap().setNamespace("fleet-emulator");
		config.getBootstrap().setBeatUnitMs(100);
	}

	public static void main(String[] args) throws Exception {
		final int workers = args != null && args.length > 0 ? Integer.parseInt(args[0]) : 4;
		final int epochs = args != null && args.length > 1 ? Integer.parseInt(args[1]) : 3;
		new TrainingFleetEmulator(workers, epochs).run();
	}

	public void run() throws Exception {
		final Server server = new Server(config);
		final ExecutorService fleet = Executors.newFixedThreadPool(workers);
		try {
			final List<Worker> started = new ArrayList<>();
			for (int i = 0; i < workers; i++) {
				final Config own = new Config();
				own.getCheckpoint().setDirectory(config.getCheckpoint().getDirectory() + "/worker-" + i);
				final Worker worker = new Worker(own, new Client(server.getBaseUri().toString()),
						new WorkerInfo("worker-" + i, "localhost", 29500 + i, 8, 64L << 30));
				final Registration reg = worker.start();
				logger.info("{}: {} joined with rank {}", getClass().getSimpleName(), reg.getWorkerId(), reg.getRank());
				started.add(worker);
			}
			final List<Future<?>> runs = new ArrayList<>();
			for (Worker worker : started) {
				runs.add(fleet.submit(() -> {
					train(worker);
					return null;
				}));
			}
			for (Future<?> run : runs) {
				run.get();
			}
			logger.info(LogUtils.titleLine(LogUtils.HYPHEN_CHAR, "job done"));
			logger.info("{}: Resume point: {}", getClass().getSimpleName(), started.get(0).recover());
			started.forEach(Worker::shutdown);
		} finally {
			fleet.shutdownNow();
			fleet.awaitTermination(10, TimeUnit.SECONDS);
			server.shutdown();
		}
	}

	private void train(final Worker worker) throws IOException {
		worker.registerDataset(DatasetSpec.builder(DATASET_ID)
				.path("s3://datasets/imagenet-mini")
				.format("parquet")
				.samples(100_000, 1_000)
				.shuffled(42)
				.build());
		final String id = worker.getInfo().getWorkerId();
		long step = 0;
		for (int epoch = 0; epoch < epochs; epoch++) {
			worker.setStatus(WorkerStatus.loading(epoch, DATASET_ID));
			final ShardAssignment shard = worker.getShard(DATASET_ID, epoch);
			logger.info("{}: {} epoch {} got {}", getClass().getSimpleName(), id, epoch, shard);
			for (int s = 0; s < STEPS_PER_EPOCH; s++, step++) {
				worker.setStatus(WorkerStatus.training(step, epoch, DATASET_ID));
				sleep(50);
			}
			try {
				worker.waitBarrier("epoch-" + epoch, step, 30_000);
			} catch (BarrierTimeoutException e) {
				logger.warn("{}: {} gave up waiting the rest at epoch {}", getClass().getSimpleName(), id, epoch);
			}
			if (worker.getRegistration().getRank() == 0) {
				worker.checkpoint(fakeWeights(step), step, epoch);
			}
		}
		worker.setStatus(WorkerStatus.idle());
	}

	private static byte[] fakeWeights(final long step) {
		final ByteBuffer buffer = ByteBuffer.allocate(64 * 1024);
		while (buffer.remaining() >= Long.BYTES) {
			buffer.putLong(step);
		}
		return buffer.array();
	}

	private static void sleep(final long ms) {
		try {
			Thread.sleep(ms);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException("training interrupted", e);
		}
	}

}
