package edu.harvard.hms.dbmi.avillach.vfilter.exception;

/**
 * Wraps a failure of the backing variant store while a filter is being evaluated. Retrying is left to the caller.
 */
public class FilterExecutionException extends RuntimeException {

	private static final long serialVersionUID = -6630125310958374106L;

	public FilterExecutionException(String message) {
		super(message);
	}

	public FilterExecutionException(String message, Throwable cause) {
		super(message, cause);
	}
}
