package io.tilt.tandem.core.leader;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import io.tilt.tandem.TestUtils;
import io.tilt.tandem.api.CoordinatorException;
import io.tilt.tandem.api.ErrorKind;
import io.tilt.tandem.api.SpecMismatchException;
import io.tilt.tandem.api.UnknownWorkerException;
import io.tilt.tandem.domain.DatasetSpec;
import io.tilt.tandem.domain.SampleRange;
import io.tilt.tandem.domain.ShardAssignment;

public class DatasetShardPlannerTest {

	private WorkerRegistry registry;
	private DatasetShardPlanner planner;

	@Before
	public void setup() {
		registry = new WorkerRegistry(TestUtils.prototypeConfig());
		planner = new DatasetShardPlanner(TestUtils.prototypeConfig(), registry);
	}

	private static DatasetSpec plain(final String id, final long total) {
		return DatasetSpec.builder(id).path("/data/" + id).format("parquet").samples(total, 1000).build();
	}

	private static DatasetSpec shuffled(final String id, final long total, final long seed) {
		return DatasetSpec.builder(id).path("/data/" + id).format("parquet").samples(total, 1000).shuffled(seed).build();
	}

	@Test
	public void test_even_split_over_four_workers() {
		for (int i = 0; i < 4; i++) {
			registry.register(TestUtils.worker("w" + i));
		}
		assertTrue(planner.registerDataset(plain("d", 10_000)));

		final ShardAssignment first = planner.getShard("w0", "d", 0);
		assertEquals(0, first.getShardId());
		assertEquals(4, first.getTotalShards());
		assertEquals(2500, first.getSampleCount());
		assertEquals(new SampleRange(0, 2500), first.getRanges().get(0));

		final ShardAssignment last = planner.getShard("w3", "d", 0);
		assertEquals(new SampleRange(7500, 10_000), last.getRanges().get(0));
		assertEquals(1, last.getFilePaths().size());
	}

	@Test
	public void test_partitions_cover_without_overlap() {
		assertCoverage(plain("a", 10_003), 7, 0);
		assertCoverage(plain("b", 10), 4, 0);
		assertCoverage(plain("c", 3), 5, 0);
		assertCoverage(shuffled("d", 10_003, 7), 7, 0);
		assertCoverage(shuffled("d", 10_003, 7), 7, 1);
		assertCoverage(shuffled("e", 10, 1), 4, 3);
	}

	private void assertCoverage(final DatasetSpec spec, final int partitions, final int epoch) {
		final BitSet seen = new BitSet();
		long counted = 0;
		long min = Long.MAX_VALUE;
		long max = 0;
		for (int p = 0; p < partitions; p++) {
			final ShardAssignment a = planner.plan(spec, epoch, p, partitions);
			long size = 0;
			for (SampleRange r : a.getRanges()) {
				for (long s = r.getStart(); s < r.getEnd(); s++) {
					assertFalse("sample " + s + " assigned twice", seen.get((int) s));
					seen.set((int) s);
				}
				size += r.size();
			}
			assertEquals(a.getSampleCount(), size);
			counted += size;
			min = Math.min(min, size);
			max = Math.max(max, size);
		}
		assertEquals(spec.getTotalSamples(), counted);
		assertEquals(spec.getTotalSamples(), seen.cardinality());
		assertTrue("unbalanced partitions", max - min <= 1);
	}

	@Test
	public void test_assignment_is_deterministic() {
		final DatasetSpec spec = shuffled("d", 5000, 42);
		final ShardAssignment a = planner.plan(spec, 2, 1, 3);
		final DatasetShardPlanner other = new DatasetShardPlanner(TestUtils.prototypeConfig(), registry);
		final ShardAssignment b = other.plan(spec, 2, 1, 3);
		assertEquals(a.getRanges(), b.getRanges());
		assertEquals(a.getRanges(), planner.plan(spec, 2, 1, 3).getRanges());
	}

	@Test
	public void test_shuffle_changes_by_epoch() {
		final DatasetSpec spec = shuffled("d", 5000, 42);
		final List<SampleRange> e0 = planner.plan(spec, 0, 0, 2).getRanges();
		final List<SampleRange> e1 = planner.plan(spec, 1, 0, 2).getRanges();
		assertNotEquals(e0, e1);
		assertTrue(planner.getCachedPermutations() >= 2);
	}

	@Test
	public void test_reregistration() {
		assertTrue(planner.registerDataset(plain("d", 100)));
		assertFalse(planner.registerDataset(plain("d", 100)));
		try {
			planner.registerDataset(plain("d", 200));
			fail("mismatching spec accepted");
		} catch (SpecMismatchException e) {
			assertEquals(ErrorKind.SPEC_MISMATCH, e.getKind());
		}
		assertEquals(100, planner.get("d").getTotalSamples());
		assertEquals(1, planner.datasets().size());
	}

	@Test
	public void test_unknown_dataset_and_worker() {
		registry.register(TestUtils.worker("w0"));
		try {
			planner.getShard("w0", "missing", 0);
			fail("unknown dataset served");
		} catch (CoordinatorException e) {
			assertEquals(ErrorKind.NOT_FOUND, e.getKind());
		}
		planner.registerDataset(plain("d", 100));
		try {
			planner.getShard("stranger", "d", 0);
			fail("unknown worker served");
		} catch (UnknownWorkerException e) {
			assertEquals(ErrorKind.UNKNOWN_WORKER, e.getKind());
		}
	}

	@Test(expected = IllegalArgumentException.class)
	public void test_negative_epoch() {
		registry.register(TestUtils.worker("w0"));
		planner.registerDataset(plain("d", 100));
		planner.getShard("w0", "d", -1);
	}

	@Test
	public void test_partition_start_puts_extra_samples_last() {
		final List<Long> starts = new ArrayList<>();
		for (int i = 0; i <= 4; i++) {
			starts.add(DatasetShardPlanner.partitionStart(10, 4, i));
		}
		// sizes 2, 2, 3, 3
		assertEquals(java.util.Arrays.asList(0L, 2L, 4L, 7L, 10L), starts);
	}

}
