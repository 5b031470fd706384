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
package io.tilt.tandem.core.follower;

import static java.util.Objects.requireNonNull;

import java.io.File;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.apache.commons.lang.Validate;
import org.joda.time.DateTimeUtils;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import io.tilt.tandem.api.Config;
import io.tilt.tandem.api.CoordinatorException;
import io.tilt.tandem.api.ErrorKind;
import io.tilt.tandem.api.config.CheckpointSettings;
import io.tilt.tandem.api.config.SchedulerSettings;
import io.tilt.tandem.core.impl.ServiceImpl;
import io.tilt.tandem.utils.LogUtils;

/**
 * Durable checkpoint storage at the worker's local directory, one file per step:
 * <code>checkpoint-STEP.ckpt</code>, the raw payload with no header.
 * <p>
 * Files are written to a temporary, forced to disk and atomically renamed, so readers never see
 * a partial checkpoint. The directory is then forced too, where the platform allows it. Only the latest <code>keepCount</code> checkpoints by step are kept, while
 * a checkpoint being read keeps its file until its last reader closes.
 * <p>
 * Asynchronous saves go to a bounded writer pool: callers block when all the writers are busy
 * and the queue is full. {@linkplain #waitPending()} is the only fence.
 * Must be started with {@linkplain #init()} to index a previously used directory.
 *
 * @author Cristian Gonzalez
 */
public class CheckpointManager extends ServiceImpl {

	private static final Pattern FILE_PATTERN = Pattern.compile(
			Pattern.quote(CheckpointSettings.FILE_PREFIX) + "(\\d+)" + Pattern.quote(CheckpointSettings.FILE_SUFFIX));
	private static final long DRAIN_TIMEOUT_MS = 60_000;

	private final Path directory;
	private final int keepCount;
	private final ListeningExecutorService writers;
	private final Semaphore slots;

	// guarded by itself
	private final TreeMap<Long, LocalCheckpoint> index;
	// guarded by index: open readers per file, and files to delete when their last reader closes
	private final Map<Path, Integer> readers;
	private final Set<Path> doomed;

	private final Set<ListenableFuture<LocalCheckpoint>> pending;
	// guarded by itself, failures since the last fence
	private final List<Throwable> failures;

	public CheckpointManager(final Config config) {
		this(config.getCheckpoint());
	}

	public CheckpointManager(final CheckpointSettings settings) {
		this(settings, MoreExecutors.listeningDecorator(Executors.newFixedThreadPool(settings.getWriterThreads(),
				new ThreadFactoryBuilder()
					.setDaemon(true)
					.setNameFormat(SchedulerSettings.THREAD_NAME_CHECKPOINT_WRITER + "-%d")
					.build())));
	}

	/* writers must run at most writerThreads tasks at once */
	CheckpointManager(final CheckpointSettings settings, final ListeningExecutorService writers) {
		requireNonNull(settings);
		Validate.isTrue(settings.getKeepCount() > 0, "keep count must be positive");
		Validate.isTrue(settings.getWriterThreads() > 0, "writer threads must be positive");
		Validate.isTrue(settings.getWriterQueueCapacity() >= 0, "writer queue capacity cannot be negative");
		this.directory = Paths.get(settings.getDirectory());
		this.keepCount = settings.getKeepCount();
		this.writers = requireNonNull(writers);
		this.slots = new Semaphore(settings.getWriterThreads() + settings.getWriterQueueCapacity(), true);
		this.index = new TreeMap<>();
		this.readers = new HashMap<>();
		this.doomed = new HashSet<>();
		this.pending = ConcurrentHashMap.newKeySet();
		this.failures = new ArrayList<>();
	}

	/** Indexes existing checkpoints and removes stale temporaries */
	@Override
	public void start() {
		try {
			FileUtils.forceMkdir(directory.toFile());
			final File[] files = directory.toFile().listFiles();
			int found = 0;
			for (File file : files == null ? new File[0] : files) {
				if (file.getName().endsWith(CheckpointSettings.TEMP_SUFFIX)) {
					logger.info("{}: Removing stale temporary {}", getName(), file);
					Files.deleteIfExists(file.toPath());
					continue;
				}
				final Matcher m = FILE_PATTERN.matcher(file.getName());
				if (file.isFile() && m.matches()) {
					final long step = Long.parseLong(m.group(1));
					synchronized (index) {
						index.put(step, new LocalCheckpoint(checkpointId(step), step, LocalCheckpoint.UNKNOWN_EPOCH,
								file.toPath(), file.length(), file.lastModified()));
					}
					found++;
				}
			}
			synchronized (index) {
				applyRetention();
			}
			logger.info("{}: Using directory {} with {} existing checkpoints (keeping {})", getName(),
					directory.toAbsolutePath(), found, keepCount);
		} catch (IOException e) {
			throw new UncheckedIOException("unusable checkpoint directory: " + directory, e);
		}
	}

	/** Waits the queued writes for a while, then stops the writers */
	@Override
	public void stop() {
		writers.shutdown();
		try {
			if (!writers.awaitTermination(DRAIN_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
				logger.warn("{}: Abandoning {} checkpoint writes", getName(), writers.shutdownNow().size());
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			writers.shutdownNow();
		}
	}

	public static String checkpointId(final long step) {
		return CheckpointSettings.FILE_PREFIX + step;
	}

	/**
	 * Writes the checkpoint in the caller's thread.
	 * @return the durable checkpoint, once renamed into place
	 * @throws IOException	when the checkpoint could not be written, leaving no partial file
	 */
	public LocalCheckpoint save(final byte[] data, final long step, final int epoch) throws IOException {
		Validate.notNull(data, "checkpoint data required");
		Validate.isTrue(step >= 0, "invalid step: " + step);
		return register(write(data, step, epoch));
	}

	public ListenableFuture<LocalCheckpoint> saveAsync(final byte[] data, final long step) throws IOException {
		return saveAsync(data, step, LocalCheckpoint.UNKNOWN_EPOCH);
	}

	/**
	 * Copies the payload and queues its writing. Blocks while the writer pool and its queue are full.
	 * @return a future failing with the IOException of the write, if any
	 * @throws InterruptedIOException	when interrupted waiting for a free slot
	 */
	public ListenableFuture<LocalCheckpoint> saveAsync(final byte[] data, final long step, final int epoch)
			throws IOException {
		Validate.notNull(data, "checkpoint data required");
		Validate.isTrue(step >= 0, "invalid step: " + step);
		if (writers.isShutdown()) {
			throw new IllegalStateException("checkpoint manager already closed");
		}
		final byte[] copy = data.clone();
		try {
			slots.acquire();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new InterruptedIOException("interrupted waiting a checkpoint writer for step " + step);
		}
		final ListenableFuture<LocalCheckpoint> future;
		try {
			future = writers.submit(() -> register(write(copy, step, epoch)));
		} catch (RuntimeException e) {
			slots.release();
			throw e;
		}
		pending.add(future);
		Futures.addCallback(future, new FutureCallback<LocalCheckpoint>() {
			@Override
			public void onSuccess(final LocalCheckpoint result) {
				done();
			}
			@Override
			public void onFailure(final Throwable t) {
				logger.error("{}: Checkpoint write failed for step {}", getName(), step, t);
				synchronized (failures) {
					failures.add(t);
				}
				done();
			}
			private void done() {
				pending.remove(future);
				slots.release();
			}
		}, MoreExecutors.directExecutor());
		return future;
	}

	/**
	 * Blocks until every write queued so far completes.
	 * @throws IOException	when any write failed since the last call: the first one as cause,
	 * the rest suppressed
	 */
	public void waitPending() throws IOException {
		final List<ListenableFuture<LocalCheckpoint>> snapshot = new ArrayList<>(pending);
		try {
			Futures.successfulAsList(snapshot).get();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new InterruptedIOException("interrupted waiting pending checkpoint writes");
		} catch (ExecutionException e) {
			throw new IllegalStateException("unexpected while waiting pending writes", e.getCause());
		}
		final List<Throwable> failed;
		synchronized (failures) {
			failed = new ArrayList<>(failures);
			failures.clear();
		}
		if (!failed.isEmpty()) {
			final IOException e = new IOException(failed.size() + " checkpoint writes failed", failed.get(0));
			failed.subList(1, failed.size()).forEach(e::addSuppressed);
			throw e;
		}
	}

	private LocalCheckpoint write(final byte[] data, final long step, final int epoch) throws IOException {
		final long start = System.currentTimeMillis();
		final Path target = directory.resolve(checkpointId(step) + CheckpointSettings.FILE_SUFFIX);
		final Path temp = Files.createTempFile(directory, checkpointId(step) + "-", CheckpointSettings.TEMP_SUFFIX);
		try {
			try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE,
					StandardOpenOption.TRUNCATE_EXISTING)) {
				final ByteBuffer buffer = ByteBuffer.wrap(data);
				while (buffer.hasRemaining()) {
					channel.write(buffer);
				}
				channel.force(true);
			}
			Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
		} catch (IOException | RuntimeException e) {
			try {
				Files.deleteIfExists(temp);
			} catch (IOException d) {
				e.addSuppressed(d);
			}
			throw e;
		}
		syncDirectory(directory);
		if (logger.isDebugEnabled()) {
			logger.debug("{}: Wrote {} ({}) in {} ms", getName(), target.getFileName(),
					LogUtils.humanBytes(data.length), System.currentTimeMillis() - start);
		}
		return new LocalCheckpoint(checkpointId(step), step, epoch, target, data.length,
				DateTimeUtils.currentTimeMillis());
	}

	/**
	 * Forces the directory entries to disk, so a renamed file survives a crash.
	 * Not every platform can open a directory for that: those only get the rename.
	 * @return TRUE if the directory was forced
	 */
	boolean syncDirectory(final Path dir) {
		try (FileChannel channel = FileChannel.open(dir, StandardOpenOption.READ)) {
			channel.force(true);
			return true;
		} catch (IOException e) {
			logger.warn("{}: Cannot sync directory {}: {}", getName(), dir, e.toString());
			return false;
		}
	}

	private LocalCheckpoint register(final LocalCheckpoint checkpoint) {
		synchronized (index) {
			// a rewritten step's file is live again
			doomed.remove(checkpoint.getPath());
			index.put(checkpoint.getStep(), checkpoint);
			applyRetention();
		}
		logger.info("{}: Saved checkpoint {}", getName(), checkpoint);
		return checkpoint;
	}

	/* guarded by index */
	private void applyRetention() {
		while (index.size() > keepCount) {
			final LocalCheckpoint evicted = index.pollFirstEntry().getValue();
			if (readers.containsKey(evicted.getPath())) {
				logger.info("{}: Evicted checkpoint {}, file kept until read", getName(), evicted);
				doomed.add(evicted.getPath());
			} else {
				logger.info("{}: Evicted checkpoint {}", getName(), evicted);
				delete(evicted.getPath());
			}
		}
	}

	private void delete(final Path path) {
		try {
			Files.deleteIfExists(path);
		} catch (IOException e) {
			logger.warn("{}: Could not delete evicted checkpoint file {}", getName(), path, e);
		}
	}

	/**
	 * Opens the checkpoint for reading, its file will survive eviction until the stream is closed.
	 * @throws CoordinatorException	NOT_FOUND when there's no such checkpoint
	 */
	public InputStream openStream(final long step) throws IOException {
		final LocalCheckpoint checkpoint;
		synchronized (index) {
			checkpoint = getByStep(step);
			readers.merge(checkpoint.getPath(), 1, Integer::sum);
		}
		final Path path = checkpoint.getPath();
		final InputStream in;
		try {
			in = Files.newInputStream(path);
		} catch (IOException | RuntimeException e) {
			unpin(path);
			throw e;
		}
		final AtomicBoolean closed = new AtomicBoolean();
		return new FilterInputStream(in) {
			@Override
			public void close() throws IOException {
				try {
					super.close();
				} finally {
					if (closed.compareAndSet(false, true)) {
						unpin(path);
					}
				}
			}
		};
	}

	private void unpin(final Path path) {
		synchronized (index) {
			final Integer left = readers.computeIfPresent(path, (p, count) -> count > 1 ? count - 1 : null);
			if (left == null && doomed.remove(path)) {
				delete(path);
			}
		}
	}

	/** @throws CoordinatorException	NOT_FOUND when there's no such checkpoint */
	public byte[] load(final long step) throws IOException {
		try (InputStream in = openStream(step)) {
			return IOUtils.toByteArray(in);
		}
	}

	/** @throws CoordinatorException	NOT_FOUND when there's no such checkpoint */
	public byte[] load(final String checkpointId) throws IOException {
		final Optional<LocalCheckpoint> found;
		synchronized (index) {
			found = index.values().stream().filter(c -> c.getCheckpointId().equals(checkpointId)).findFirst();
		}
		return load(found.orElseThrow(() -> notFound(checkpointId)).getStep());
	}

	/** @throws CoordinatorException	NOT_FOUND when there's no such checkpoint */
	public LocalCheckpoint getByStep(final long step) {
		synchronized (index) {
			final LocalCheckpoint checkpoint = index.get(step);
			if (checkpoint == null) {
				throw notFound(checkpointId(step));
			}
			return checkpoint;
		}
	}

	private static CoordinatorException notFound(final String checkpointId) {
		return new CoordinatorException(ErrorKind.NOT_FOUND, "checkpoint not found: " + checkpointId);
	}

	/** @return the checkpoint with the highest step */
	public Optional<LocalCheckpoint> latest() {
		synchronized (index) {
			return index.isEmpty() ? Optional.empty() : Optional.of(index.lastEntry().getValue());
		}
	}

	/** @return the checkpoints kept, ordered by step */
	public List<LocalCheckpoint> allCheckpoints() {
		synchronized (index) {
			return ImmutableList.copyOf(index.values());
		}
	}

	public int getPendingCount() {
		return pending.size();
	}

	public Path getDirectory() {
		return directory;
	}

}
