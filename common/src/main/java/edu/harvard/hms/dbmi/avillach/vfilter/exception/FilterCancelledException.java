package edu.harvard.hms.dbmi.avillach.vfilter.exception;

public class FilterCancelledException extends FilterExecutionException {

	private static final long serialVersionUID = 2873361902452117838L;

	public FilterCancelledException(String checkpoint) {
		super("Filter evaluation was cancelled or timed out at " + checkpoint);
	}
}
