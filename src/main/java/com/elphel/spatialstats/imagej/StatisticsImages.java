package com.elphel.spatialstats.imagej;
/**
 **
 ** StatisticsImages - conversion between ImageJ images and statistics grids
 **
 ** Copyright (C) 2021 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  StatisticsImages.java is free software: you can redistribute it and/or modify
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

import java.awt.GraphicsEnvironment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.elphel.spatialstats.stats.DoubleGrid;
import com.elphel.spatialstats.stats.LagAxis;
import com.elphel.spatialstats.stats.StatisticsParameters;
import com.elphel.spatialstats.stats.StatisticsResult;

import ij.ImagePlus;
import ij.ImageStack;
import ij.measure.Calibration;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;

/**
 * Grid axes map to the image as {y, x} for 2D grids and {slice, y, x} for 3D ones,
 * a 1D grid is a single row.
 */
public class StatisticsImages {
	/** Logger for this class. */
	private static final Logger LOGGER =
			LoggerFactory.getLogger(StatisticsImages.class);

	/**
	 * Read calibrated pixel values of an image (2D grid) or of a stack (3D grid)
	 * @param imp source image, any type
	 * @return field grid
	 */
	public static DoubleGrid fieldFromImage(ImagePlus imp) {
		int width =  imp.getWidth();
		int height = imp.getHeight();
		int num_slices = imp.getStackSize();
		ImageStack stack = imp.getStack();
		double [] data = new double [num_slices * height * width];
		for (int nslice = 0; nslice < num_slices; nslice++) {
			ImageProcessor ip = stack.getProcessor(nslice + 1);
			int base = nslice * height * width;
			for (int y = 0; y < height; y++) {
				for (int x = 0; x < width; x++) {
					data[base + y * width + x] = ip.getPixelValue(x, y);
				}
			}
		}
		int [] shape = (num_slices > 1) ? (new int [] {num_slices, height, width}) : (new int [] {height, width});
		return new DoubleGrid(shape, data);
	}

	/**
	 * Float image of the statistics with every axis ordered by increasing lag, lag 0 at the calibration origin
	 * @param result statistics
	 * @param title image title
	 * @return image (or stack for 3D statistics), not shown
	 */
	public static ImagePlus toImagePlus(
			StatisticsResult result,
			String           title) {
		DoubleGrid tensor = result.getTensor();
		LagAxis [] lags = result.getLags();
		int dims = lags.length;
		LagAxis x_lags =                   lags[dims - 1];
		LagAxis y_lags = (dims > 1)      ? lags[dims - 2] : null;
		LagAxis z_lags = (dims > 2)      ? lags[0] : null;
		int [] x_order =                   x_lags.ascendingOrder();
		int [] y_order = (y_lags != null)? y_lags.ascendingOrder() : new int [] {0};
		int [] z_order = (z_lags != null)? z_lags.ascendingOrder() : new int [] {0};
		int width =  x_order.length;
		int height = y_order.length;
		ImageStack stack = new ImageStack(width, height);
		int [] indices = new int [dims];
		for (int z = 0; z < z_order.length; z++) {
			float [] pixels = new float [width * height];
			for (int y = 0; y < height; y++) {
				for (int x = 0; x < width; x++) {
					indices[dims - 1] = x_order[x];
					if (dims > 1) indices[dims - 2] = y_order[y];
					if (dims > 2) indices[0] =        z_order[z];
					pixels[y * width + x] = (float) tensor.get(indices);
				}
			}
			FloatProcessor fp = new FloatProcessor(width, height, pixels);
			fp.resetMinAndMax();
			String label = (z_lags != null) ? ("lag "+z_lags.get(z_order[z])) : title;
			stack.addSlice(label, fp);
		}
		ImagePlus imp = new ImagePlus(title, stack);
		Calibration cal = imp.getCalibration();
		cal.xOrigin =  -x_lags.getMin();
		if (y_lags != null) cal.yOrigin = -y_lags.getMin();
		if (z_lags != null) cal.zOrigin = -z_lags.getMin();
		imp.setCalibration(cal);
		return imp;
	}

	/**
	 * Show the statistics if the parameters ask for it and there is a display
	 * @return shown image, null if nothing was shown
	 */
	public static ImagePlus show(
			StatisticsResult     result,
			StatisticsParameters sp,
			String               title) {
		if (!sp.display) {
			return null;
		}
		if (GraphicsEnvironment.isHeadless()) {
			LOGGER.debug("Headless environment, not showing "+title);
			return null;
		}
		ImagePlus imp = toImagePlus(result, title);
		imp.show();
		return imp;
	}
}
