package com.elphel.spatialstats.fft;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Random;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class FourierTransformTest {
	private static final double TOLERANCE = 1e-9;

	// direct O(n^2) forward DFT
	private static double [][] dft(double [] re, double [] im) {
		int n = re.length;
		double [][] out = new double [2][n];
		for (int k = 0; k < n; k++) {
			for (int j = 0; j < n; j++) {
				double a = -2 * Math.PI * ((long) j * k % n) / n;
				out[0][k] += re[j] * Math.cos(a) - im[j] * Math.sin(a);
				out[1][k] += re[j] * Math.sin(a) + im[j] * Math.cos(a);
			}
		}
		return out;
	}

	@ParameterizedTest
	@ValueSource(ints = {1, 2, 3, 5, 6, 7, 8, 12, 17, 32})
	void forwardMatchesDirectDft(int n) {
		Random rnd = new Random(n);
		double [] re = new double [n];
		double [] im = new double [n];
		for (int i = 0; i < n; i++) {
			re[i] = rnd.nextGaussian();
			im[i] = rnd.nextGaussian();
		}
		double [][] expected = dft(re, im);
		new FourierTransform(1).transform(re, im, new int [] {n}, false);
		assertArrayEquals(expected[0], re, TOLERANCE);
		assertArrayEquals(expected[1], im, TOLERANCE);
	}

	@ParameterizedTest
	@ValueSource(ints = {4, 9, 10, 15})
	void inverseRestoresInput(int n) {
		int [] shape = {n, 3};
		Random rnd = new Random(100 + n);
		double [] re = new double [3 * n];
		double [] im = new double [3 * n];
		for (int i = 0; i < re.length; i++) re[i] = rnd.nextDouble();
		double [] original = re.clone();
		FourierTransform fft = new FourierTransform(1);
		fft.transform(re, im, shape, false);
		fft.transform(re, im, shape, true);
		assertArrayEquals(original, re, TOLERANCE);
		assertArrayEquals(new double [re.length], im, TOLERANCE);
	}

	@Test
	void transformsEveryAxisOf2dArray() {
		// 2D DFT of a single impulse at (1, 2) in a 3 x 4 array: exp(-2*pi*i*(k0/3 + 2*k1/4))
		int [] shape = {3, 4};
		double [] re = new double [12];
		double [] im = new double [12];
		re[1 * 4 + 2] = 1.0;
		new FourierTransform(1).transform(re, im, shape, false);
		for (int k0 = 0; k0 < 3; k0++) {
			for (int k1 = 0; k1 < 4; k1++) {
				double a = -2 * Math.PI * (k0 / 3.0 + 2.0 * k1 / 4.0);
				assertEquals(Math.cos(a), re[k0 * 4 + k1], TOLERANCE);
				assertEquals(Math.sin(a), im[k0 * 4 + k1], TOLERANCE);
			}
		}
	}

	@Test
	void parallelTransformGivesSameResult() {
		int [] shape = {60, 600}; // above MIN_PARALLEL_SIZE
		Random rnd = new Random(7);
		double [] re1 = new double [shape[0] * shape[1]];
		for (int i = 0; i < re1.length; i++) re1[i] = rnd.nextDouble();
		double [] im1 = new double [re1.length];
		double [] re4 = re1.clone();
		double [] im4 = new double [re1.length];
		new FourierTransform(1).transform(re1, im1, shape, false);
		new FourierTransform(4).transform(re4, im4, shape, false);
		assertArrayEquals(re1, re4, 0.0);
		assertArrayEquals(im1, im4, 0.0);
	}

	@Test
	void efficientSizeIsNextPowerOfTwo() {
		assertEquals(1,  FourierTransform.efficientSize(1));
		assertEquals(8,  FourierTransform.efficientSize(5));
		assertEquals(8,  FourierTransform.efficientSize(8));
		assertEquals(16, FourierTransform.efficientSize(9));
	}

	@Test
	void powerOfTwoLengthsSkipBluestein() {
		FourierTransform fft = new FourierTransform(1);
		assertFalse(fft.getPlan(8)  instanceof FourierTransform.BluesteinTransform);
		assertTrue (fft.getPlan(12) instanceof FourierTransform.BluesteinTransform);
		assertSame(fft.getPlan(8), fft.getPlan(8));
	}
}
