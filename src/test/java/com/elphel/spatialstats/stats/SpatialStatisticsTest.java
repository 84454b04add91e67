package com.elphel.spatialstats.stats;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.elphel.spatialstats.exceptions.InvalidOptionException;
import com.elphel.spatialstats.exceptions.ShapeMismatchException;
import com.elphel.spatialstats.fft.DirectCorrelation;

class SpatialStatisticsTest {
	private static final double TOLERANCE = 1e-9;

	private static Map<String, Object> options(Object... pairs) {
		Map<String, Object> map = new LinkedHashMap<String, Object>();
		for (int i = 0; i < pairs.length; i += 2) {
			map.put((String) pairs[i], pairs[i + 1]);
		}
		return map;
	}

	@Test
	void circularAutocorrelationOfShortSignal() {
		DoubleGrid a = DoubleGrid.of(new double [] {1, 0, 1, 1, 0});
		StatisticsResult result = SpatialStatistics.compute(a, null,
				options("periodic", true, "normalize", false, "mask", null));
		assertEquals(3.0, result.getAtLag(0), TOLERANCE);
		assertEquals(1.0, result.getAtLag(1), TOLERANCE);
		assertEquals(1.0, result.getAtLag(-1), TOLERANCE);
		assertArrayEquals(new int [] {0, 1, 2, -2, -1}, result.getLags(0).toArray());
	}

	@Test
	void selfCrossEqualsAuto() {
		int [] shape = {6, 5};
		DoubleGrid a = DirectCorrelation.random(shape, 21);
		DoubleGrid copy = new DoubleGrid(shape, a.getData());
		StatisticsParameters sp = new StatisticsParameters().setPeriodic(false, true).setCutoff(2);
		StatisticsResult cross = SpatialStatistics.compute(a, copy, sp);
		StatisticsResult auto =  SpatialStatistics.compute(a, null, sp);
		assertEquals(auto.getTensor(), cross.getTensor());
	}

	@Test
	void defaultCutoffTruncatesNothing() {
		int [] shape = {4, 5, 3};
		DoubleGrid a = DirectCorrelation.random(shape, 22);
		assertArrayEquals(shape, SpatialStatistics.compute(a, null, options()).getTensor().getShape());
		StatisticsResult halves = SpatialStatistics.compute(a, null, options("cutoff", new double [] {2, 2.5, 1.5}));
		assertArrayEquals(shape, halves.getTensor().getShape());
		StatisticsResult infinite = SpatialStatistics.compute(a, null, options("cutoff", Double.POSITIVE_INFINITY));
		assertArrayEquals(shape, infinite.getTensor().getShape());
	}

	@Test
	void scalarCutoffAppliesToAllAxes() {
		DoubleGrid a = DirectCorrelation.random(new int [] {7, 8}, 23);
		StatisticsResult result = SpatialStatistics.compute(a, null, options("cutoff", 1));
		assertArrayEquals(new int [] {3, 3}, result.getTensor().getShape());
		assertArrayEquals(new int [] {0, 1, -1}, result.getLags(1).toArray());
	}

	@Test
	void singleMaskIsBroadcastWithOnes() {
		int [] shape = {6, 6};
		DoubleGrid a = DirectCorrelation.random(shape, 24);
		DoubleGrid b = DirectCorrelation.random(shape, 25);
		DoubleGrid m = DirectCorrelation.randomBinary(shape, 0.6, 26);
		StatisticsResult implicit = SpatialStatistics.compute(a, b, options("mask1", m));
		StatisticsResult explicit = SpatialStatistics.compute(a, b, options("mask1", m, "mask2", DoubleGrid.ones(shape)));
		assertEquals(explicit.getTensor(), implicit.getTensor());
	}

	@Test
	void optionNamesAreCaseSensitive() {
		DoubleGrid a = DirectCorrelation.random(new int [] {5}, 27);
		DoubleGrid m = DoubleGrid.of(new double [] {1, 1, 0, 1, 1});
		InvalidOptionException e = assertThrows(InvalidOptionException.class,
				() -> SpatialStatistics.compute(a, null, options("MASK1", m)));
		assertEquals("MASK1", e.getOption());
		assertTrue(e.getMessage().contains("MASK1 is not a valid parameter."));
	}

	@Test
	void unknownOptionListsValidOnes() {
		DoubleGrid a = DoubleGrid.of(new double [] {1, 2, 3});
		InvalidOptionException e = assertThrows(InvalidOptionException.class,
				() -> SpatialStatistics.compute(a, null, options("normalise", true)));
		assertEquals("normalise", e.getOption());
		for (String [] option : StatisticsParameters.OPTIONS) {
			assertTrue(e.getMessage().contains(option[0]), option[0]);
			assertTrue(e.getMessage().contains(option[1]), option[1]);
		}
	}

	@Test
	void wrongOptionValuesFail() {
		DoubleGrid a = DoubleGrid.of(new double [][] {{1, 2, 3}, {4, 5, 6}});
		assertThrows(InvalidOptionException.class, () -> SpatialStatistics.compute(a, null, options("normalize", "yes")));
		assertThrows(InvalidOptionException.class, () -> SpatialStatistics.compute(a, null, options("periodic", new boolean [] {true, false, true})));
		assertThrows(InvalidOptionException.class, () -> SpatialStatistics.compute(a, null, options("cutoff", new double [] {1, 2, 3})));
		assertThrows(InvalidOptionException.class, () -> SpatialStatistics.compute(a, null, options("cutoff", -1.0)));
		assertThrows(InvalidOptionException.class, () -> SpatialStatistics.compute(a, null, options("mask", new double [] {1, 1})));
	}

	@Test
	void fieldShapesMustMatch() {
		DoubleGrid a = DoubleGrid.of(new double [][] {{1, 2, 3}, {4, 5, 6}});
		DoubleGrid b = DoubleGrid.of(new double [][] {{1, 2}, {3, 4}, {5, 6}});
		assertThrows(ShapeMismatchException.class, () -> SpatialStatistics.compute(a, b, options()));
	}

	@Test
	void crossCorrelation3dWithMixedBoundaries() {
		int [] shape = {4, 3, 5};
		boolean [] periodic = {true, false, false};
		DoubleGrid a = DirectCorrelation.random(shape, 28);
		DoubleGrid b = DirectCorrelation.random(shape, 29);
		StatisticsParameters sp = new StatisticsParameters().setPeriodic(periodic).setNormalize(false).setThreadsMax(2);
		StatisticsResult result = SpatialStatistics.crossCorrelation(a, b, sp);
		assertArrayEquals(DirectCorrelation.correlate(periodic, a, b), result.getTensor().getData(), TOLERANCE);
		assertEquals(3, result.getDimensions());
	}
}
