package com.elphel.spatialstats.stats;
/**
 **
 ** DoubleGrid - real-valued samples on a regular 1D, 2D or 3D grid
 **
 ** Copyright (C) 2021 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  DoubleGrid.java is free software: you can redistribute it and/or modify
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

/**
 * Immutable N-dimensional (N = 1..3) array of doubles, stored row-major: the last axis is the fastest.
 * Used for the input fields, the masks and the correlation tensors.
 */
public class DoubleGrid {
	public static final int MAX_DIMENSIONS = 3;

	private final int []    shape;
	private final double [] data;

	/**
	 * Create grid from a flat row-major array
	 * @param shape axis lengths, 1 to 3 axes, all positive
	 * @param data samples, data.length should be equal to the product of shape elements. Copied.
	 */
	public DoubleGrid(int [] shape, double [] data) {
		this(checkShape(shape).clone(), data.clone(), true);
		if (data.length != getNumElements(shape)) {
			throw new IllegalArgumentException ("data.length ("+data.length+") != number of grid elements ("+
					getNumElements(shape)+") for shape "+Arrays.toString(shape));
		}
	}

	/**
	 * Zero-filled grid
	 * @param shape axis lengths, 1 to 3 axes, all positive
	 */
	public DoubleGrid(int [] shape) {
		this(checkShape(shape).clone(), new double [getNumElements(shape)], true);
	}

	// no copy, no checks
	private DoubleGrid(int [] shape, double [] data, boolean owned) {
		this.shape = shape;
		this.data =  data;
	}

	static DoubleGrid wrap(int [] shape, double [] data) {
		return new DoubleGrid(shape.clone(), data, true);
	}

	public static DoubleGrid of(double [] data) {
		return new DoubleGrid(new int [] {data.length}, data);
	}

	public static DoubleGrid of(double [][] data) {
		int n0 = data.length;
		int n1 = (n0 > 0) ? data[0].length : 0;
		double [] flat = new double [n0 * n1];
		for (int i = 0; i < n0; i++) {
			if (data[i].length != n1) {
				throw new IllegalArgumentException ("Not a rectangular array: row "+i+" has "+data[i].length+" elements, expected "+n1);
			}
			System.arraycopy(data[i], 0, flat, i * n1, n1);
		}
		return new DoubleGrid(new int [] {n0, n1}, flat);
	}

	public static DoubleGrid of(double [][][] data) {
		int n0 = data.length;
		int n1 = (n0 > 0) ? data[0].length : 0;
		int n2 = (n1 > 0) ? data[0][0].length : 0;
		double [] flat = new double [n0 * n1 * n2];
		for (int i = 0; i < n0; i++) {
			if (data[i].length != n1) {
				throw new IllegalArgumentException ("Not a rectangular array: plane "+i+" has "+data[i].length+" rows, expected "+n1);
			}
			for (int j = 0; j < n1; j++) {
				if (data[i][j].length != n2) {
					throw new IllegalArgumentException ("Not a rectangular array: row ["+i+"]["+j+"] has "+data[i][j].length+" elements, expected "+n2);
				}
				System.arraycopy(data[i][j], 0, flat, (i * n1 + j) * n2, n2);
			}
		}
		return new DoubleGrid(new int [] {n0, n1, n2}, flat);
	}

	public static DoubleGrid ones(int [] shape) {
		double [] data = new double [getNumElements(checkShape(shape))];
		Arrays.fill(data, 1.0);
		return new DoubleGrid(shape.clone(), data, true);
	}

	public static int [] checkShape(int [] shape) {
		if ((shape == null) || (shape.length < 1) || (shape.length > MAX_DIMENSIONS)) {
			throw new IllegalArgumentException ("Only 1, 2 and 3 dimensional grids are supported, got shape "+
					Arrays.toString(shape));
		}
		for (int n : shape) {
			if (n < 1) {
				throw new IllegalArgumentException ("Grid axes should have positive lengths, got shape "+Arrays.toString(shape));
			}
		}
		return shape;
	}

	public static int getNumElements(int [] shape) {
		int n = 1;
		try {
			for (int l : shape) n = Math.multiplyExact(n, l);
		} catch (ArithmeticException e) {
			throw new IllegalArgumentException ("Grid "+Arrays.toString(shape)+" has more than "+Integer.MAX_VALUE+" elements", e);
		}
		return n;
	}

	public int [] getShape() {
		return shape.clone();
	}

	public int getDimensions() {
		return shape.length;
	}

	public int size(int axis) {
		return shape[axis];
	}

	public int getNumElements() {
		return data.length;
	}

	/**
	 * @return copy of the row-major samples
	 */
	public double [] getData() {
		return data.clone();
	}

	// shared, callers in this package must not modify it
	double [] dataRef() {
		return data;
	}

	public int index(int... indices) {
		if (indices.length != shape.length) {
			throw new IllegalArgumentException ("Expected "+shape.length+" indices, got "+indices.length);
		}
		int indx = 0;
		for (int i = 0; i < shape.length; i++) {
			if ((indices[i] < 0) || (indices[i] >= shape[i])) {
				throw new IndexOutOfBoundsException ("Index "+indices[i]+" is out of range for axis "+i+" of length "+shape[i]);
			}
			indx = indx * shape[i] + indices[i];
		}
		return indx;
	}

	public double get(int... indices) {
		return data[index(indices)];
	}

	// row-major position, for 1D grids the same as get(int...)
	public double get(int linear_index) {
		return data[linear_index];
	}

	public boolean sameShape(DoubleGrid other) {
		return Arrays.equals(shape, other.shape);
	}

	/**
	 * Element-wise exact comparison. NaN samples are never equal, so grids containing NaN do not match.
	 */
	public boolean valuesEqual(DoubleGrid other) {
		if (!sameShape(other)) return false;
		for (int i = 0; i < data.length; i++) {
			if (data[i] != other.data[i]) return false;
		}
		return true;
	}

	public DoubleGrid multiply(DoubleGrid other) {
		if (!sameShape(other)) {
			throw new IllegalArgumentException ("Can not multiply grids of shapes "+Arrays.toString(shape)+" and "+
					Arrays.toString(other.shape));
		}
		double [] product = new double [data.length];
		for (int i = 0; i < data.length; i++) {
			product[i] = data[i] * other.data[i];
		}
		return new DoubleGrid(shape, product, true);
	}

	/**
	 * Coerce to an indicator grid: 1.0 for every non-zero sample, 0.0 otherwise
	 */
	public DoubleGrid toMask() {
		double [] mask = new double [data.length];
		for (int i = 0; i < data.length; i++) {
			mask[i] = (data[i] != 0.0) ? 1.0 : 0.0;
		}
		return new DoubleGrid(shape, mask, true);
	}

	public double sum() {
		double s = 0.0;
		for (double d : data) s += d;
		return s;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof DoubleGrid)) return false;
		DoubleGrid other = (DoubleGrid) o;
		return Arrays.equals(shape, other.shape) && Arrays.equals(data, other.data);
	}

	@Override
	public int hashCode() {
		return 31 * Arrays.hashCode(shape) + Arrays.hashCode(data);
	}

	@Override
	public String toString() {
		return "DoubleGrid"+Arrays.toString(shape);
	}
}
