package com.elphel.spatialstats.stats;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.elphel.spatialstats.common.EProperties;

class StatisticsParametersTest {

	@Test
	void defaults() {
		StatisticsParameters sp = new StatisticsParameters();
		int [] shape = {4, 7};
		assertArrayEquals(new double [] {2.0, 3.5}, sp.resolveCutoff(shape), 0.0);
		assertArrayEquals(new boolean [] {false, false}, sp.resolvePeriodic(shape));
		assertNull(sp.resolveMasks(shape));
		assertEquals(true, sp.normalize);
		assertEquals(true, sp.display);
	}

	@Test
	void infiniteCutoffFallsBackPerAxis() {
		StatisticsParameters sp = new StatisticsParameters().setCutoff(1.0, Double.POSITIVE_INFINITY, 0.0);
		assertArrayEquals(new double [] {1.0, 2.5, 0.0}, sp.resolveCutoff(new int [] {6, 5, 3}), 0.0);
	}

	@Test
	void laterMaskOptionOverridesEarlier() {
		DoubleGrid m1 = DoubleGrid.of(new double [] {1, 0, 1});
		DoubleGrid m =  DoubleGrid.of(new double [] {0, 1, 1});
		Map<String, Object> options = new LinkedHashMap<String, Object>();
		options.put("mask1", m1);
		options.put("mask", m);
		StatisticsParameters sp = StatisticsParameters.fromOptions(options);
		assertSame(m, sp.mask1);
		assertSame(m, sp.mask2);
	}

	@Test
	void missingMaskIsAllOnes() {
		StatisticsParameters sp = new StatisticsParameters().setMask2(DoubleGrid.of(new double [] {0, 3, 1}));
		DoubleGrid [] masks = sp.resolveMasks(new int [] {3});
		assertArrayEquals(new double [] {1, 1, 1}, masks[0].getData(), 0.0);
		assertArrayEquals(new double [] {0, 1, 1}, masks[1].getData(), 0.0);
	}

	@Test
	void propertiesRoundTrip() {
		StatisticsParameters sp = new StatisticsParameters()
				.setNormalize(false)
				.setDisplay(false)
				.setCutoff(3.0, Double.POSITIVE_INFINITY)
				.setPeriodic(true, false)
				.setThreadsMax(3);
		EProperties properties = new EProperties();
		sp.setProperties("STATS.", properties);
		assertEquals(false, properties.getProperty("STATS.normalize", true));
		assertEquals(3,     properties.getProperty("STATS.threads_max", 1));
		assertArrayEquals(new double [] {3.0, Double.POSITIVE_INFINITY}, EProperties.parseDoubles(properties.getProperty("STATS.cutoff")), 0.0);

		StatisticsParameters restored = new StatisticsParameters();
		restored.getProperties("STATS.", properties);
		assertFalse(restored.normalize);
		assertFalse(restored.display);
		assertArrayEquals(sp.cutoff, restored.cutoff, 0.0);
		assertArrayEquals(sp.periodic, restored.periodic);
		assertEquals(3, restored.threads_max);
	}

	@Test
	void unsetArraysAreNotPersisted() {
		EProperties properties = new EProperties();
		properties.setProperty("STATS.cutoff", "1.0");
		new StatisticsParameters().setProperties("STATS.", properties);
		assertNull(properties.getProperty("STATS.cutoff"));
		assertNull(properties.getProperty("STATS.periodic"));
	}

	@Test
	void cloneCopiesArrays() throws CloneNotSupportedException {
		StatisticsParameters sp = new StatisticsParameters().setCutoff(2.0).setPeriodic(true);
		StatisticsParameters copy = sp.clone();
		assertNotSame(sp.cutoff, copy.cutoff);
		copy.cutoff[0] = 5.0;
		assertEquals(2.0, sp.cutoff[0], 0.0);
		assertArrayEquals(sp.periodic, copy.periodic);
	}
}
