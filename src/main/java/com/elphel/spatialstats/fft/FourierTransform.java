package com.elphel.spatialstats.fft;
/**
 **
 ** FourierTransform - N-dimensional complex DFT of arbitrary axis lengths
 **
 ** Power-of-two lengths use Apache Commons Math radix-2 transform, other lengths
 ** are reduced to it with the Bluestein (chirp-z) algorithm:
 ** Bluestein, Leo. "A linear filtering approach to the computation of discrete Fourier transform."
 ** IEEE Transactions on Audio and Electroacoustics 18.4 (1970): 451-455.
 **
 ** Copyright (C) 2021 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  FourierTransform.java is free software: you can redistribute it and/or modify
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

import java.util.concurrent.ConcurrentHashMap;

import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;
import org.apache.commons.math3.util.ArithmeticUtils;

import com.elphel.spatialstats.common.MultiThreading;

/**
 * Complex DFT along every axis of a row-major array. Forward transform is not scaled,
 * inverse is scaled by 1/n (standard normalization), so inverse(forward(x)) == x.
 * Line plans are cached per length, instances are safe to share between threads.
 */
public class FourierTransform {
	public static final int MIN_PARALLEL_SIZE = 1 << 15; // smaller arrays are transformed in the caller thread

	private final int threadsMax;
	private final ConcurrentHashMap<Integer, LineTransform> plans = new ConcurrentHashMap<Integer, LineTransform>();

	public FourierTransform() {
		this(MultiThreading.THREADS_MAX);
	}

	public FourierTransform(int threadsMax) {
		this.threadsMax = threadsMax;
	}

	/**
	 * Smallest power of two not less than n
	 */
	public static int efficientSize(int n) {
		if (n > (1 << 30)) {
			throw new IllegalArgumentException ("Transform length "+n+" is too large");
		}
		int size = 1;
		while (size < n) size <<= 1;
		return size;
	}

	/**
	 * Transform all axes in place
	 * @param re real parts, row-major
	 * @param im imaginary parts, row-major
	 * @param shape axis lengths
	 * @param inverse false - forward transform, true - inverse
	 */
	public void transform(
			double [] re,
			double [] im,
			int []    shape,
			boolean   inverse) {
		for (int axis = 0; axis < shape.length; axis++) {
			transformAxis(re, im, shape, axis, inverse);
		}
	}

	/**
	 * Transform all lines parallel to the axis, in place
	 */
	public void transformAxis(
			final double [] re,
			final double [] im,
			final int []    shape,
			final int       axis,
			final boolean   inverse) {
		final int n = shape[axis];
		if (n == 1) return; // DFT of a single sample is the sample itself
		int stride = 1;
		for (int i = axis + 1; i < shape.length; i++) stride *= shape[i];
		final int line_stride = stride;
		final int num_lines =   re.length / n;
		final LineTransform plan = getPlan(n);
		MultiThreading.runTasks(
				num_lines,
				(re.length < MIN_PARALLEL_SIZE) ? 1 : threadsMax,
				nLine -> {
					int outer = nLine / line_stride;
					int inner = nLine % line_stride;
					int base = outer * n * line_stride + inner;
					double [][] line = new double [2][n];
					for (int j = 0; j < n; j++) {
						line[0][j] = re[base + j * line_stride];
						line[1][j] = im[base + j * line_stride];
					}
					plan.transform(line, inverse);
					for (int j = 0; j < n; j++) {
						re[base + j * line_stride] = line[0][j];
						im[base + j * line_stride] = line[1][j];
					}
				});
	}

	LineTransform getPlan(int n) {
		LineTransform plan = plans.get(n);
		if (plan == null) {
			plan = ArithmeticUtils.isPowerOfTwo(n) ? new LineTransform(n) : new BluesteinTransform(n);
			LineTransform prev = plans.putIfAbsent(n, plan);
			if (prev != null) plan = prev;
		}
		return plan;
	}

	/**
	 * 1D transform of a power-of-two length
	 */
	static class LineTransform {
		final int n;
		LineTransform(int n) {
			this.n = n;
		}
		/**
		 * @param dataRI {re[], im[]} of length n, transformed in place
		 */
		void transform(double [][] dataRI, boolean inverse) {
			FastFourierTransformer.transformInPlace(
					dataRI,
					DftNormalization.STANDARD,
					inverse ? TransformType.INVERSE : TransformType.FORWARD);
		}
	}

	/**
	 * 1D transform of any length as a circular convolution with a chirp, done with power-of-two transforms
	 */
	static class BluesteinTransform extends LineTransform {
		final int       m;        // power-of-two convolution length, >= 2*n-1
		final double [] chirp_re; // exp(-i*pi*k^2/n)
		final double [] chirp_im;
		final double [][] chirp_fft; // transform of the conjugated chirp, wrapped to length m

		BluesteinTransform(int n) {
			super(n);
			this.m = efficientSize(2 * n - 1);
			chirp_re = new double [n];
			chirp_im = new double [n];
			long n2 = 2L * n;
			for (int k = 0; k < n; k++) {
				// k^2 mod 2n keeps the angle small and exact for large k
				double angle = Math.PI * (((long) k * k) % n2) / n;
				chirp_re[k] =  Math.cos(angle);
				chirp_im[k] = -Math.sin(angle);
			}
			chirp_fft = new double [2][m];
			chirp_fft[0][0] =  chirp_re[0];
			chirp_fft[1][0] = -chirp_im[0];
			for (int k = 1; k < n; k++) {
				chirp_fft[0][k] =      chirp_re[k];
				chirp_fft[1][k] =     -chirp_im[k];
				chirp_fft[0][m - k] =  chirp_re[k];
				chirp_fft[1][m - k] = -chirp_im[k];
			}
			FastFourierTransformer.transformInPlace(chirp_fft, DftNormalization.STANDARD, TransformType.FORWARD);
		}

		@Override
		void transform(double [][] dataRI, boolean inverse) {
			double [] re = dataRI[0];
			double [] im = dataRI[1];
			// inverse DFT(x) = conj(DFT(conj(x)))/n
			double sign = inverse ? -1.0 : 1.0;
			double [][] a = new double [2][m];
			for (int k = 0; k < n; k++) {
				double xr = re[k];
				double xi = sign * im[k];
				a[0][k] = xr * chirp_re[k] - xi * chirp_im[k];
				a[1][k] = xr * chirp_im[k] + xi * chirp_re[k];
			}
			FastFourierTransformer.transformInPlace(a, DftNormalization.STANDARD, TransformType.FORWARD);
			for (int k = 0; k < m; k++) {
				double ar = a[0][k];
				double ai = a[1][k];
				a[0][k] = ar * chirp_fft[0][k] - ai * chirp_fft[1][k];
				a[1][k] = ar * chirp_fft[1][k] + ai * chirp_fft[0][k];
			}
			FastFourierTransformer.transformInPlace(a, DftNormalization.STANDARD, TransformType.INVERSE);
			double scale = inverse ? (1.0 / n) : 1.0;
			for (int k = 0; k < n; k++) {
				double cr = a[0][k];
				double ci = a[1][k];
				re[k] =         scale * (cr * chirp_re[k] - ci * chirp_im[k]);
				im[k] = sign * scale * (cr * chirp_im[k] + ci * chirp_re[k]);
			}
		}
	}
}
