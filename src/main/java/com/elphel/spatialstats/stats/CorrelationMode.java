package com.elphel.spatialstats.stats;

public enum CorrelationMode {
	AUTO,  // one field, or two fields with identical samples
	CROSS
}
