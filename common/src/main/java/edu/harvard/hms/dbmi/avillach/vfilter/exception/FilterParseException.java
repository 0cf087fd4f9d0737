package edu.harvard.hms.dbmi.avillach.vfilter.exception;

/**
 * Thrown when a filter expression, or part of one, cannot be understood. The offending fragment is kept verbatim so that it can
 * be reported back to the caller as-is. A filter that fails to parse will fail the same way every time, so these are never
 * retried.
 */
public class FilterParseException extends RuntimeException {

	private static final long serialVersionUID = 4120956137719361427L;

	private final String fragment;

	public FilterParseException(String fragment, String message) {
		super(message + ": " + fragment);
		this.fragment = fragment;
	}

	public FilterParseException(String fragment, String message, Throwable cause) {
		super(message + ": " + fragment, cause);
		this.fragment = fragment;
	}

	public String getFragment() {
		return fragment;
	}
}
