package com.elphel.spatialstats.stats;

import java.util.Arrays;

/**
 * Signed spatial lags of the positions along one axis of a correlation tensor, in the tensor storage order
 * (FFT order: 0, positive lags ascending, then negative lags from the largest magnitude to -1). The sequence
 * is not monotonic, use {@link #ascendingOrder()} to walk it by increasing lag.
 */
public class LagAxis {
	private final int [] lags;

	public LagAxis(int [] lags) {
		this.lags = lags.clone();
	}

	public int size() {
		return lags.length;
	}

	public int get(int position) {
		return lags[position];
	}

	public int [] toArray() {
		return lags.clone();
	}

	/**
	 * @return storage position of the lag, -1 if this axis does not contain it
	 */
	public int positionOf(int lag) {
		for (int i = 0; i < lags.length; i++) {
			if (lags[i] == lag) return i;
		}
		return -1;
	}

	/**
	 * Storage positions sorted by increasing lag, the fftshift permutation used for viewing.
	 */
	public int [] ascendingOrder() {
		int n_neg = 0;
		for (int l : lags) if (l < 0) n_neg++;
		int [] order = new int [lags.length];
		// negative lags are stored after the non-negative ones, already in ascending order
		int indx = 0;
		for (int i = lags.length - n_neg; i < lags.length; i++) order[indx++] = i;
		for (int i = 0; i < lags.length - n_neg; i++) order[indx++] = i;
		return order;
	}

	public int getMin() {
		int min = 0;
		for (int l : lags) min = Math.min(min, l);
		return min;
	}

	public int getMax() {
		int max = 0;
		for (int l : lags) max = Math.max(max, l);
		return max;
	}

	@Override
	public boolean equals(Object o) {
		return (o instanceof LagAxis) && Arrays.equals(lags, ((LagAxis) o).lags);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(lags);
	}

	@Override
	public String toString() {
		return Arrays.toString(lags);
	}
}
