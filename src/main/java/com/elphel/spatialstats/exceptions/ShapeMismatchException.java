package com.elphel.spatialstats.exceptions;

import java.util.Arrays;

/**
 * Two grids that have to be sampled on the same lattice (two fields, a field and its mask, two masks)
 * have different shapes.
 */
public class ShapeMismatchException extends IllegalArgumentException {
	private static final long serialVersionUID = 3811276560287129391L;

	public ShapeMismatchException(String message) {
		super(message);
	}

	public ShapeMismatchException(String what, int [] shape1, int [] shape2) {
		super(what+": "+Arrays.toString(shape1)+" != "+Arrays.toString(shape2));
	}
}
