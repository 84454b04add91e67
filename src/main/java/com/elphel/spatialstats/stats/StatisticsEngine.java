package com.elphel.spatialstats.stats;
/**
 **
 ** StatisticsEngine - normalized two-point statistics of one or two fields
 **
 ** Copyright (C) 2021 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  StatisticsEngine.java is free software: you can redistribute it and/or modify
 **  it under the terms of the GNU General Public License as published by
 **  the Free Software Foundation, either version 3 of the License, or
 **  (at your option) any later version.
 **
 **  This program is distributed in the hope that it will be useful,
 **  but WITHOUT ANY WARRANTY; without even the implied warranty of
 **  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 **  GNU General Public License for more details.
 **
 **  You should have received a copy of the GNU General Public License
 **  along with this program.  If not, see <http://www.gnu.org/licenses/>.
 ** -----------------------------------------------------------------------------**
 **
 */

import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.elphel.spatialstats.exceptions.ShapeMismatchException;
import com.elphel.spatialstats.fft.BoundaryConvolver;

/**
 * Numerator is the correlation of the (masked) fields, denominator is the number of sampled pairs for each lag:
 * the grid size when all axes are periodic, otherwise the correlation of the masks (or of all-ones grids).
 * Lags without sampled pairs are set to NaN.
 */
public class StatisticsEngine {
	/** Logger for this class. */
	private static final Logger LOGGER =
			LoggerFactory.getLogger(StatisticsEngine.class);

	private final BoundaryConvolver convolver;

	public StatisticsEngine() {
		this(new BoundaryConvolver());
	}

	public StatisticsEngine(BoundaryConvolver convolver) {
		this.convolver = convolver;
	}

	/**
	 * Auto- or cross-correlation. Two fields with identical samples are treated as a single one.
	 * @param field1 first field
	 * @param field2 second field or null
	 * @return mode to use
	 * @throws ShapeMismatchException if the fields have different shapes
	 */
	public static CorrelationMode selectMode(
			DoubleGrid field1,
			DoubleGrid field2) {
		if ((field2 == null) || (field2.getNumElements() == 0)) {
			return CorrelationMode.AUTO;
		}
		if (!field1.sameShape(field2)) {
			throw new ShapeMismatchException("The size of the input signals are not the same", field1.getShape(), field2.getShape());
		}
		if (field1.valuesEqual(field2)) {
			LOGGER.info("Both fields "+Arrays.toString(field1.getShape())+" have identical samples, computing autocorrelation");
			return CorrelationMode.AUTO;
		}
		return CorrelationMode.CROSS;
	}

	/**
	 * Correlation tensor of the same shape as the field(s), lags in FFT order, not truncated.
	 * All parameters are validated before any transform.
	 * @param field1 first field
	 * @param field2 second field or null for autocorrelation
	 * @param sp parameters
	 * @return correlation tensor
	 * @throws ShapeMismatchException for fields or masks of different shapes
	 * @throws com.elphel.spatialstats.exceptions.InvalidOptionException for inconsistent parameters
	 */
	public DoubleGrid compute(
			DoubleGrid           field1,
			DoubleGrid           field2,
			StatisticsParameters sp) {
		int [] shape = field1.getShape();
		CorrelationMode mode = selectMode(field1, field2);
		boolean [] periodic = sp.resolvePeriodic(shape);
		DoubleGrid [] masks = sp.resolveMasks(shape);
		sp.resolveCutoff(shape); // only validated here
		if (LOGGER.isDebugEnabled()) {
			LOGGER.debug(mode+" correlation of "+Arrays.toString(shape)+", periodic="+Arrays.toString(periodic)+
					", masked="+(masks != null)+", normalize="+sp.normalize);
		}
		DoubleGrid numerator;
		if (mode == CorrelationMode.AUTO) {
			if (masks == null) {
				numerator = convolver.convolve(periodic, field1);
			} else {
				numerator = convolver.convolve(periodic, masks[0].multiply(field1));
			}
		} else {
			if (masks == null) {
				numerator = convolver.convolve(periodic, field1, field2);
			} else {
				numerator = convolver.convolve(periodic, masks[0].multiply(field1), masks[1].multiply(field2));
			}
		}
		if (!sp.normalize) {
			return numerator;
		}
		if (masks == null) {
			if (allTrue(periodic)) {
				return scale(numerator, 1.0 / field1.getNumElements());
			}
			return divide(numerator, convolver.countOverlaps(periodic, DoubleGrid.ones(shape), null));
		}
		if (mode == CorrelationMode.AUTO) {
			return divide(numerator, convolver.countOverlaps(periodic, masks[0], null));
		}
		return divide(numerator, convolver.countOverlaps(periodic, masks[0], masks[1]));
	}

	/**
	 * Element-wise ratio, NaN where the denominator is zero
	 */
	static DoubleGrid divide(
			DoubleGrid numerator,
			DoubleGrid denominator) {
		double [] num = numerator.dataRef();
		double [] den = denominator.dataRef();
		double [] result = new double [num.length];
		int num_empty = 0;
		for (int i = 0; i < num.length; i++) {
			if (den[i] == 0.0) {
				result[i] = Double.NaN;
				num_empty++;
			} else {
				result[i] = num[i] / den[i];
			}
		}
		if ((num_empty > 0) && LOGGER.isDebugEnabled()) {
			LOGGER.debug(num_empty+" lags have no sampled pairs");
		}
		return DoubleGrid.wrap(numerator.getShape(), result);
	}

	private static DoubleGrid scale(
			DoubleGrid grid,
			double     k) {
		double [] data = grid.getData();
		for (int i = 0; i < data.length; i++) data[i] *= k;
		return DoubleGrid.wrap(grid.getShape(), data);
	}

	private static boolean allTrue(boolean [] flags) {
		for (boolean b : flags) if (!b) return false;
		return true;
	}
}
