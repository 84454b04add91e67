package com.elphel.spatialstats.fft;
/**
 **
 ** BoundaryConvolver - FFT correlation of grids with periodic or finite
 ** (non-wrapping) extent selected per axis
 **
 ** Copyright (C) 2021 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  BoundaryConvolver.java is free software: you can redistribute it and/or modify
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

import com.elphel.spatialstats.stats.DoubleGrid;
import com.elphel.spatialstats.stats.LagIndexer;

/**
 * Computes T[r] = sum over x of A[x + r] * B[x] for every lag r of the grid, as IFFT(FFT(A) * conj(FFT(B))).
 * Periodic axes are transformed at their natural length (lags wrap around), non-periodic axes are zero-padded
 * so that no product wraps (see {@link #paddedShape(int[], boolean[])}), and the result is cropped back to the
 * input shape in FFT order: the position j of an axis of length n holds lag {@link LagIndexer#lag(int, int)}.
 */
public class BoundaryConvolver {
	/** Logger for this class. */
	private static final Logger LOGGER =
			LoggerFactory.getLogger(BoundaryConvolver.class);

	public static final long MAX_TRANSFORM_LENGTH = Integer.MAX_VALUE - 8; // largest double[] a JVM allocates

	private final FourierTransform fft;
	private final long             max_transform_length;

	public BoundaryConvolver() {
		this(new FourierTransform());
	}

	public BoundaryConvolver(int threadsMax) {
		this(new FourierTransform(threadsMax));
	}

	public BoundaryConvolver(FourierTransform fft) {
		this(fft, MAX_TRANSFORM_LENGTH);
	}

	BoundaryConvolver(FourierTransform fft, long max_transform_length) {
		this.fft = fft;
		this.max_transform_length = max_transform_length;
	}

	/**
	 * Transform shape for a grid. Periodic axes keep their length. Finite axes need at least 2*n-1 samples
	 * so that no product wraps; they are padded to a power of two unless the padded grid would exceed
	 * max_length elements, then to exactly 2*n-1 (transformed with Bluestein).
	 * @param shape grid shape
	 * @param periodic boundary per axis
	 * @param max_length maximal number of elements of the transform
	 * @return transform size per axis
	 * @throws IllegalArgumentException if even the minimal transform has more than max_length elements
	 */
	public static int [] paddedShape(
			int []     shape,
			boolean [] periodic,
			long       max_length) {
		long [] min_size = new long [shape.length];
		long [] padded =   new long [shape.length];
		for (int i = 0; i < shape.length; i++) {
			min_size[i] = periodic[i] ? shape[i] : (2L * shape[i] - 1);
			long p2 = Long.highestOneBit(min_size[i]);
			padded[i] = (periodic[i] || (p2 == min_size[i])) ? min_size[i] : (p2 << 1);
		}
		if (numElements(padded) > max_length) {
			padded = min_size;
		}
		long len = numElements(padded);
		if (len > max_length) {
			throw new IllegalArgumentException ("Grid "+Arrays.toString(shape)+" with periodic axes "+Arrays.toString(periodic)+
					" needs a transform of "+((len == Long.MAX_VALUE) ? "too many" : (""+len))+" elements, maximum is "+max_length);
		}
		int [] result = new int [shape.length];
		for (int i = 0; i < shape.length; i++) {
			result[i] = (int) padded[i];
		}
		return result;
	}

	public static int [] paddedShape(
			int []     shape,
			boolean [] periodic) {
		return paddedShape(shape, periodic, MAX_TRANSFORM_LENGTH);
	}

	// Long.MAX_VALUE once the product exceeds the int range
	private static long numElements(long [] shape) {
		long n = 1;
		for (long l : shape) {
			if ((l > Integer.MAX_VALUE) || ((n *= l) > Integer.MAX_VALUE)) return Long.MAX_VALUE;
		}
		return n;
	}

	/**
	 * Self-correlation of a grid
	 * @param periodic boundary per axis, true - periodic
	 * @param a grid
	 * @return correlation sums in FFT order, same shape as a
	 */
	public DoubleGrid convolve(
			boolean [] periodic,
			DoubleGrid a) {
		return convolve(periodic, a, null);
	}

	/**
	 * Cross-correlation of two grids of the same shape (not checked here)
	 * @param periodic boundary per axis, true - periodic
	 * @param a first grid, sampled at x + r
	 * @param b second grid, sampled at x, null for self-correlation of a
	 * @return correlation sums in FFT order, same shape as a
	 */
	public DoubleGrid convolve(
			boolean [] periodic,
			DoubleGrid a,
			DoubleGrid b) {
		int [] shape = a.getShape();
		if (periodic.length != shape.length) {
			throw new IllegalArgumentException ("periodic has "+periodic.length+" elements for a "+shape.length+"-dimensional grid");
		}
		int [] padded = paddedShape(shape, periodic, max_transform_length);
		int padded_len = DoubleGrid.getNumElements(padded);
		double [] a_re = embed(a.getData(), shape, padded, padded_len);
		double [] a_im = new double [padded_len];
		fft.transform(a_re, a_im, padded, false);
		if (b == null) {
			for (int i = 0; i < padded_len; i++) {
				a_re[i] = a_re[i] * a_re[i] + a_im[i] * a_im[i];
				a_im[i] = 0.0;
			}
		} else {
			double [] b_re = embed(b.getData(), shape, padded, padded_len);
			double [] b_im = new double [padded_len];
			fft.transform(b_re, b_im, padded, false);
			for (int i = 0; i < padded_len; i++) {
				double re = a_re[i] * b_re[i] + a_im[i] * b_im[i]; // a * conj(b)
				double im = a_im[i] * b_re[i] - a_re[i] * b_im[i];
				a_re[i] = re;
				a_im[i] = im;
			}
		}
		fft.transform(a_re, a_im, padded, true);
		double [] result = new double [a.getNumElements()];
		double max_imag = crop(a_re, a_im, padded, shape, result);
		if (LOGGER.isDebugEnabled()) {
			LOGGER.debug(((b == null)? "Self" : "Cross")+"-correlation of "+Arrays.toString(shape)+
					", transform size "+Arrays.toString(padded)+", imaginary residue "+max_imag);
		}
		return new DoubleGrid(shape, result);
	}

	/**
	 * Number of lag-r pairs with both samples populated
	 * @param periodic boundary per axis
	 * @param mask1 indicator (0.0/1.0) grid of the first field
	 * @param mask2 indicator grid of the second field, null to use mask1
	 * @return non-negative integer counts in FFT order
	 */
	public DoubleGrid countOverlaps(
			boolean [] periodic,
			DoubleGrid mask1,
			DoubleGrid mask2) {
		double [] counts = convolve(periodic, mask1, mask2).getData();
		for (int i = 0; i < counts.length; i++) {
			counts[i] = Math.max(0.0, Math.rint(counts[i])); // pair counts are integers
		}
		return new DoubleGrid(mask1.getShape(), counts);
	}

	private static double [] embed(
			double [] data,
			int []    shape,
			int []    padded,
			int       padded_len) {
		if (Arrays.equals(shape, padded)) return data;
		double [] result = new double [padded_len];
		int row = shape[shape.length - 1];
		int num_rows = data.length / row;
		int [] indx = new int [shape.length]; // indx[last] stays 0
		for (int nrow = 0; nrow < num_rows; nrow++) {
			int dst = 0;
			for (int axis = 0; axis < shape.length; axis++) {
				dst = dst * padded[axis] + indx[axis];
			}
			System.arraycopy(data, nrow * row, result, dst, row);
			for (int axis = shape.length - 2; axis >= 0; axis--) {
				if (++indx[axis] < shape[axis]) break;
				indx[axis] = 0;
			}
		}
		return result;
	}

	/**
	 * Copy real parts of the lags of the original extent from the padded result
	 * @return maximal absolute value of the dropped imaginary parts
	 */
	private static double crop(
			double [] re,
			double [] im,
			int []    padded,
			int []    shape,
			double [] result) {
		int [][] src_pos = new int [shape.length][];
		for (int axis = 0; axis < shape.length; axis++) {
			src_pos[axis] = new int [shape[axis]];
			for (int j = 0; j < shape[axis]; j++) {
				int lag = LagIndexer.lag(shape[axis], j);
				src_pos[axis][j] = (lag < 0) ? (lag + padded[axis]) : lag;
			}
		}
		double max_imag = 0.0;
		int [] indx = new int [shape.length];
		for (int i = 0; i < result.length; i++) {
			int src = 0;
			for (int axis = 0; axis < shape.length; axis++) {
				src = src * padded[axis] + src_pos[axis][indx[axis]];
			}
			result[i] = re[src];
			max_imag = Math.max(max_imag, Math.abs(im[src]));
			for (int axis = shape.length - 1; axis >= 0; axis--) {
				if (++indx[axis] < shape[axis]) break;
				indx[axis] = 0;
			}
		}
		return max_imag;
	}
}
