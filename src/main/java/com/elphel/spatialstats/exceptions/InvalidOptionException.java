package com.elphel.spatialstats.exceptions;

public class InvalidOptionException extends IllegalArgumentException {
	private static final long serialVersionUID = -6417795313740954702L;

	private final String option;

	public InvalidOptionException(String option, String message) {
		super(message);
		this.option = option;
	}

	/**
	 * @return name of the offending option as supplied by the caller
	 */
	public String getOption() {
		return option;
	}
}
