package io.tilt.tandem.utils;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Properties;

import org.junit.Test;

public class DefaulterTest {

	public static class Sample {
		public static final String CONSTANT = "untouched";

		protected static final long SHARD_SIZE = 1000;
		private long shardSize;
		protected static final boolean SHUFFLE_SAMPLES = true;
		private boolean shuffleSamples;
		protected static final String DATASET_ID = "imagenet";
		private String datasetId;
		protected static final double LOAD_FACTOR = 0.5d;
		private double loadFactor;
	}

	@Test
	public void test_proper_case() {
		assertEquals("helloWorld", Defaulter.properCaseIt("HELLO_WORLD"));
		assertEquals("beatUnitMs", Defaulter.properCaseIt("BEAT_UNIT_MS"));
		assertEquals("constant", Defaulter.properCaseIt("CONSTANT"));
		assertEquals("leadingDelim", Defaulter.properCaseIt("_LEADING_DELIM"));
	}

	@Test
	public void test_static_defaults_applied() {
		final Sample sample = new Sample();
		assertTrue(Defaulter.apply(new Properties(), "sample.", sample));
		assertEquals(1000, sample.shardSize);
		assertTrue(sample.shuffleSamples);
		assertEquals("imagenet", sample.datasetId);
		assertEquals(0.5d, sample.loadFactor, 0d);
		assertEquals("untouched", Sample.CONSTANT);
	}

	@Test
	public void test_properties_win() {
		final Properties props = new Properties();
		props.setProperty("sample.shardSize", "250");
		props.setProperty("sample.shuffleSamples", "false");
		props.setProperty("sample.datasetId", "cifar");
		// other prefixes are ignored
		props.setProperty("other.loadFactor", "0.9");
		final Sample sample = new Sample();
		Defaulter.apply(props, "sample.", sample);
		assertEquals(250, sample.shardSize);
		assertFalse(sample.shuffleSamples);
		assertEquals("cifar", sample.datasetId);
		assertEquals(0.5d, sample.loadFactor, 0d);
	}

	@Test
	public void test_bad_property_falls_back_to_static() {
		final Properties props = new Properties();
		props.setProperty("sample.shardSize", "a thousand");
		final Sample sample = new Sample();
		Defaulter.apply(props, "sample.", sample);
		assertEquals(1000, sample.shardSize);
	}

}
