package com.elphel.spatialstats.stats;

import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assigns signed lags to the FFT-ordered positions of a correlation tensor and removes the positions with
 * lags exceeding the cutoff.
 */
public class LagIndexer {
	/** Logger for this class. */
	private static final Logger LOGGER =
			LoggerFactory.getLogger(LagIndexer.class);

	/**
	 * Lag of the storage position along an axis of length n:
	 * 0, 1, ... n-floor(n/2)-1, then -floor(n/2), ... -1
	 */
	public static int lag(int n, int position) {
		return (position < (n - n / 2)) ? position : (position - n);
	}

	public static int [] lags(int n) {
		int [] lags = new int [n];
		for (int i = 0; i < n; i++) {
			lags[i] = lag(n, i);
		}
		return lags;
	}

	/**
	 * Default cutoff for the axis, retains every lag
	 */
	public static double defaultCutoff(int n) {
		return n / 2.0;
	}

	/**
	 * Index the tensor axes and drop every hyperplane whose |lag| exceeds the cutoff of its axis. Keep-masks
	 * of all axes are computed from the full lag sequences before anything is removed.
	 * @param tensor correlation tensor in FFT order
	 * @param cutoff maximal retained |lag| per axis
	 * @return truncated tensor with its lag coordinates
	 */
	public static StatisticsResult indexAndTruncate(
			DoubleGrid tensor,
			double []  cutoff) {
		int [] shape = tensor.getShape();
		if (cutoff.length != shape.length) {
			throw new IllegalArgumentException ("cutoff has "+cutoff.length+" elements for a "+shape.length+"-dimensional tensor");
		}
		int [][] keep = new int [shape.length][]; // retained positions per axis
		LagAxis [] lag_axes = new LagAxis [shape.length];
		int [] new_shape = new int [shape.length];
		for (int axis = 0; axis < shape.length; axis++) {
			int [] all_lags = lags(shape[axis]);
			int [] kept =      new int [all_lags.length];
			int [] kept_lags = new int [all_lags.length];
			int num_kept = 0;
			for (int i = 0; i < all_lags.length; i++) {
				if (Math.abs(all_lags[i]) <= cutoff[axis]) {
					kept[num_kept] =      i;
					kept_lags[num_kept] = all_lags[i];
					num_kept++;
				}
			}
			keep[axis] =     Arrays.copyOf(kept, num_kept);
			lag_axes[axis] = new LagAxis(Arrays.copyOf(kept_lags, num_kept));
			new_shape[axis] = num_kept;
		}
		DoubleGrid truncated = Arrays.equals(shape, new_shape) ? tensor : crop(tensor, keep, new_shape);
		if (LOGGER.isDebugEnabled()) {
			LOGGER.debug("Truncated tensor "+Arrays.toString(shape)+" to "+Arrays.toString(new_shape)+
					" with cutoff "+Arrays.toString(cutoff));
		}
		return new StatisticsResult(truncated, lag_axes);
	}

	private static DoubleGrid crop(
			DoubleGrid tensor,
			int [][]   keep,
			int []     new_shape) {
		int [] shape = tensor.getShape();
		double [] src = tensor.dataRef();
		double [] dst = new double [DoubleGrid.getNumElements(new_shape)];
		int [] out_indx = new int [new_shape.length];
		for (int i = 0; i < dst.length; i++) {
			int src_indx = 0;
			for (int axis = 0; axis < shape.length; axis++) {
				src_indx = src_indx * shape[axis] + keep[axis][out_indx[axis]];
			}
			dst[i] = src[src_indx];
			// advance row-major counter
			for (int axis = new_shape.length - 1; axis >= 0; axis--) {
				if (++out_indx[axis] < new_shape[axis]) break;
				out_indx[axis] = 0;
			}
		}
		return DoubleGrid.wrap(new_shape, dst);
	}
}
