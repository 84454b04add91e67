package com.elphel.spatialstats.common;

import java.util.Properties;

public class EProperties extends Properties{
	private static final long serialVersionUID = -425120416815883046L;
	public int getProperty(String key, int value){
		return Integer.parseInt(getProperty(key, ""+value));
	}
	public double getProperty(String key, double value){
		return Double.parseDouble(getProperty(key, ""+value));
	}
	public boolean getProperty(String key, boolean value){
		return Boolean.parseBoolean(getProperty(key, ""+value));
	}

	// per-axis values are stored comma-separated, "1.5,2.0,Infinity"
	public static String join(double [] values) {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < values.length; i++) {
			if (i > 0) sb.append(',');
			sb.append(values[i]);
		}
		return sb.toString();
	}
	public static String join(boolean [] values) {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < values.length; i++) {
			if (i > 0) sb.append(',');
			sb.append(values[i]);
		}
		return sb.toString();
	}
	public static double [] parseDoubles(String s) {
		String [] items = s.split(",");
		double [] values = new double [items.length];
		for (int i = 0; i < items.length; i++) {
			values[i] = Double.parseDouble(items[i].trim());
		}
		return values;
	}
	public static boolean [] parseBooleans(String s) {
		String [] items = s.split(",");
		boolean [] values = new boolean [items.length];
		for (int i = 0; i < items.length; i++) {
			values[i] = Boolean.parseBoolean(items[i].trim());
		}
		return values;
	}
}
