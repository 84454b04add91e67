package com.elphel.spatialstats.stats;
/**
 **
 ** StatisticsParameters - Class for handling configuration parameters
 ** of the spatial statistics
 **
 ** Copyright (C) 2021 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  StatisticsParameters.java is free software: you can redistribute it and/or modify
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
import java.util.Map;
import java.util.Properties;

import com.elphel.spatialstats.common.EProperties;
import com.elphel.spatialstats.common.MultiThreading;
import com.elphel.spatialstats.exceptions.InvalidOptionException;
import com.elphel.spatialstats.exceptions.ShapeMismatchException;

public class StatisticsParameters {
	public static final String OPTION_NORMALIZE = "normalize";
	public static final String OPTION_DISPLAY =   "display";
	public static final String OPTION_CUTOFF =    "cutoff";
	public static final String OPTION_PERIODIC =  "periodic";
	public static final String OPTION_MASK1 =     "mask1";
	public static final String OPTION_MASK2 =     "mask2";
	public static final String OPTION_MASK =      "mask";

	public static final String [][] OPTIONS = {
			{OPTION_NORMALIZE, "Boolean"},
			{OPTION_DISPLAY,   "Boolean"},
			{OPTION_CUTOFF,    "Number or double[]/int[] with one element per axis"},
			{OPTION_PERIODIC,  "Boolean or boolean[] with one element per axis"},
			{OPTION_MASK1,     "DoubleGrid of the first field shape"},
			{OPTION_MASK2,     "DoubleGrid of the second field shape"},
			{OPTION_MASK,      "DoubleGrid, sets both mask1 and mask2"}};

	public boolean    normalize =   true;  // divide by the number of sampled pairs for each lag
	public boolean    display =     true;  // show result, used by the viewers only
	public double []  cutoff =      null;  // maximal |lag| per axis (or single for all), null or infinity - axis length/2
	public boolean [] periodic =    null;  // periodic boundary per axis (or single for all), null - none
	public DoubleGrid mask1 =       null;  // populated samples of the first field
	public DoubleGrid mask2 =       null;  // populated samples of the second field
	public int        threads_max = MultiThreading.THREADS_MAX;

	public StatisticsParameters() {
	}

	public StatisticsParameters(
			boolean    normalize,
			boolean    display,
			double []  cutoff,
			boolean [] periodic,
			DoubleGrid mask1,
			DoubleGrid mask2,
			int        threads_max) {
		this.normalize =   normalize;
		this.display =     display;
		this.cutoff =      (cutoff == null) ? null : cutoff.clone();
		this.periodic =    (periodic == null) ? null : periodic.clone();
		this.mask1 =       mask1;
		this.mask2 =       mask2;
		this.threads_max = threads_max;
	}

	public StatisticsParameters setNormalize(boolean normalize) {
		this.normalize = normalize;
		return this;
	}

	public StatisticsParameters setDisplay(boolean display) {
		this.display = display;
		return this;
	}

	public StatisticsParameters setCutoff(double... cutoff) {
		this.cutoff = cutoff.clone();
		return this;
	}

	public StatisticsParameters setPeriodic(boolean... periodic) {
		this.periodic = periodic.clone();
		return this;
	}

	public StatisticsParameters setMask(DoubleGrid mask) {
		this.mask1 = mask;
		this.mask2 = mask;
		return this;
	}

	public StatisticsParameters setMask1(DoubleGrid mask1) {
		this.mask1 = mask1;
		return this;
	}

	public StatisticsParameters setMask2(DoubleGrid mask2) {
		this.mask2 = mask2;
		return this;
	}

	public StatisticsParameters setThreadsMax(int threads_max) {
		this.threads_max = threads_max;
		return this;
	}

	/**
	 * Build parameters from named options, applied in the map iteration order (a later "mask" overrides an
	 * earlier "mask1"). Names are case-sensitive.
	 * @param options option name to value, see {@link #OPTIONS}
	 * @return new parameters, defaults for the options not mentioned
	 * @throws InvalidOptionException for an unknown name or a value of the wrong kind
	 */
	public static StatisticsParameters fromOptions(Map<String, ?> options) {
		StatisticsParameters sp = new StatisticsParameters();
		if (options == null) return sp;
		for (Map.Entry<String, ?> entry : options.entrySet()) {
			String name = entry.getKey();
			Object value = entry.getValue();
			String key = (name == null) ? "" : name;
			switch (key) {
			case OPTION_NORMALIZE:
				sp.normalize = toBoolean(name, value);
				break;
			case OPTION_DISPLAY:
				sp.display = toBoolean(name, value);
				break;
			case OPTION_CUTOFF:
				sp.cutoff = toDoubles(name, value);
				break;
			case OPTION_PERIODIC:
				sp.periodic = toBooleans(name, value);
				break;
			case OPTION_MASK1:
				sp.mask1 = toGrid(name, value);
				break;
			case OPTION_MASK2:
				sp.mask2 = toGrid(name, value);
				break;
			case OPTION_MASK:
				sp.setMask(toGrid(name, value));
				break;
			default:
				throw invalid(name, name+" is not a valid parameter.");
			}
		}
		return sp;
	}

	public static String describeOptions() {
		StringBuilder sb = new StringBuilder("Spatial statistics accept the following options:");
		for (String [] option : OPTIONS) {
			sb.append("\n:: ").append(option[0]).append(" - type :: ").append(option[1]);
		}
		return sb.toString();
	}

	private static InvalidOptionException invalid(String name, String message) {
		return new InvalidOptionException(name, message+"\n"+describeOptions());
	}

	private static boolean toBoolean(String name, Object value) {
		if (value instanceof Boolean) return (Boolean) value;
		throw invalid(name, "Option "+name+" expects a Boolean, got "+kindOf(value)+".");
	}

	private static double [] toDoubles(String name, Object value) {
		if (value instanceof Number) return new double [] {((Number) value).doubleValue()};
		if (value instanceof double[]) return ((double[]) value).clone();
		if (value instanceof int[]) {
			int [] iv = (int []) value;
			double [] dv = new double [iv.length];
			for (int i = 0; i < iv.length; i++) dv[i] = iv[i];
			return dv;
		}
		throw invalid(name, "Option "+name+" expects a Number or a numeric array, got "+kindOf(value)+".");
	}

	private static boolean [] toBooleans(String name, Object value) {
		if (value instanceof Boolean) return new boolean [] {(Boolean) value};
		if (value instanceof boolean[]) return ((boolean[]) value).clone();
		throw invalid(name, "Option "+name+" expects a Boolean or boolean[], got "+kindOf(value)+".");
	}

	private static DoubleGrid toGrid(String name, Object value) {
		if ((value == null) || (value instanceof DoubleGrid)) return (DoubleGrid) value; // null - no mask
		throw invalid(name, "Option "+name+" expects a DoubleGrid, got "+kindOf(value)+".");
	}

	private static String kindOf(Object value) {
		return (value == null) ? "null" : value.getClass().getSimpleName();
	}

	/**
	 * Per-axis cutoff for a grid: a single value is used for all axes, infinite values (and a missing cutoff)
	 * are replaced with half of the axis length.
	 * @throws InvalidOptionException for a wrong number of elements, negative or NaN cutoff
	 */
	public double [] resolveCutoff(int [] shape) {
		double [] resolved = new double [shape.length];
		for (int i = 0; i < shape.length; i++) {
			resolved[i] = Double.POSITIVE_INFINITY;
		}
		if (cutoff != null) {
			if ((cutoff.length != 1) && (cutoff.length != shape.length)) {
				throw invalid(OPTION_CUTOFF, "Option "+OPTION_CUTOFF+" has "+cutoff.length+" elements for a "+
						shape.length+"-dimensional field.");
			}
			for (int i = 0; i < shape.length; i++) {
				resolved[i] = (cutoff.length == 1) ? cutoff[0] : cutoff[i];
				if (Double.isNaN(resolved[i]) || (resolved[i] < 0)) {
					throw invalid(OPTION_CUTOFF, "Option "+OPTION_CUTOFF+" should be non-negative, got "+resolved[i]+".");
				}
			}
		}
		for (int i = 0; i < shape.length; i++) {
			if (Double.isInfinite(resolved[i])) {
				resolved[i] = LagIndexer.defaultCutoff(shape[i]);
			}
		}
		return resolved;
	}

	/**
	 * Per-axis boundary for a grid, a single value is used for all axes
	 * @throws InvalidOptionException for a wrong number of elements
	 */
	public boolean [] resolvePeriodic(int [] shape) {
		boolean [] resolved = new boolean [shape.length];
		if (periodic != null) {
			if ((periodic.length != 1) && (periodic.length != shape.length)) {
				throw invalid(OPTION_PERIODIC, "Option "+OPTION_PERIODIC+" has "+periodic.length+" elements for a "+
						shape.length+"-dimensional field.");
			}
			for (int i = 0; i < shape.length; i++) {
				resolved[i] = (periodic.length == 1) ? periodic[0] : periodic[i];
			}
		}
		return resolved;
	}

	/**
	 * Masks coerced to 0.0/1.0, a missing one replaced by all ones
	 * @param shape field shape
	 * @return {mask1, mask2} or null when neither mask is set
	 * @throws ShapeMismatchException if masks differ in shape from each other or from the field
	 */
	public DoubleGrid [] resolveMasks(int [] shape) {
		if ((mask1 == null) && (mask2 == null)) return null;
		if ((mask1 != null) && (mask2 != null) && !mask1.sameShape(mask2)) {
			throw new ShapeMismatchException("The size of Mask1 and Mask2 are not the same", mask1.getShape(), mask2.getShape());
		}
		DoubleGrid [] masks = new DoubleGrid [2];
		masks[0] = (mask1 != null) ? mask1.toMask() : DoubleGrid.ones(mask2.getShape());
		masks[1] = (mask2 != null) ? mask2.toMask() : DoubleGrid.ones(mask1.getShape());
		if (!Arrays.equals(masks[0].getShape(), shape)) {
			throw new ShapeMismatchException("The size of the masks and the input signals are not the same", masks[0].getShape(), shape);
		}
		return masks;
	}

	public void setProperties(String prefix,Properties properties){
		properties.setProperty(prefix+"normalize",   this.normalize+"");
		properties.setProperty(prefix+"display",     this.display+"");
		if (this.cutoff != null)   properties.setProperty(prefix+"cutoff",   EProperties.join(this.cutoff));
		else                       properties.remove(prefix+"cutoff");
		if (this.periodic != null) properties.setProperty(prefix+"periodic", EProperties.join(this.periodic));
		else                       properties.remove(prefix+"periodic");
		properties.setProperty(prefix+"threads_max", this.threads_max+"");
	}

	public void getProperties(String prefix,Properties properties){
		if (properties.getProperty(prefix+"normalize")!=null)   this.normalize=Boolean.parseBoolean(properties.getProperty(prefix+"normalize"));
		if (properties.getProperty(prefix+"display")!=null)     this.display=Boolean.parseBoolean(properties.getProperty(prefix+"display"));
		if (properties.getProperty(prefix+"cutoff")!=null)      this.cutoff=EProperties.parseDoubles(properties.getProperty(prefix+"cutoff"));
		if (properties.getProperty(prefix+"periodic")!=null)    this.periodic=EProperties.parseBooleans(properties.getProperty(prefix+"periodic"));
		if (properties.getProperty(prefix+"threads_max")!=null) this.threads_max=Integer.parseInt(properties.getProperty(prefix+"threads_max"));
	}

	@Override
	public StatisticsParameters clone() throws CloneNotSupportedException {
		return new StatisticsParameters(
				normalize,
				display,
				cutoff,
				periodic,
				mask1,
				mask2,
				threads_max);
	}
}
