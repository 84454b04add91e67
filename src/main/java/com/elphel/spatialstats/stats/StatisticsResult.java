package com.elphel.spatialstats.stats;

/**
 * Correlation tensor with the lag coordinates of each of its axes
 */
public class StatisticsResult {
	private final DoubleGrid  tensor;
	private final LagAxis []  lags;

	public StatisticsResult(DoubleGrid tensor, LagAxis [] lags) {
		if (lags.length != tensor.getDimensions()) {
			throw new IllegalArgumentException ("Tensor has "+tensor.getDimensions()+" axes, but "+lags.length+" lag axes are provided");
		}
		for (int i = 0; i < lags.length; i++) {
			if (lags[i].size() != tensor.size(i)) {
				throw new IllegalArgumentException ("Lag axis "+i+" has "+lags[i].size()+" lags, tensor axis length is "+tensor.size(i));
			}
		}
		this.tensor = tensor;
		this.lags =   lags.clone();
	}

	public DoubleGrid getTensor() {
		return tensor;
	}

	public LagAxis getLags(int axis) {
		return lags[axis];
	}

	public LagAxis [] getLags() {
		return lags.clone();
	}

	public int getDimensions() {
		return lags.length;
	}

	/**
	 * Value at the lag vector, one lag per axis
	 * @throws IllegalArgumentException if the lag was truncated or never existed
	 */
	public double getAtLag(int... lag) {
		if (lag.length != lags.length) {
			throw new IllegalArgumentException ("Expected "+lags.length+" lag components, got "+lag.length);
		}
		int [] position = new int [lag.length];
		for (int i = 0; i < lag.length; i++) {
			position[i] = lags[i].positionOf(lag[i]);
			if (position[i] < 0) {
				throw new IllegalArgumentException ("Lag "+lag[i]+" is not available on axis "+i+", available lags: "+lags[i]);
			}
		}
		return tensor.get(position);
	}
}
