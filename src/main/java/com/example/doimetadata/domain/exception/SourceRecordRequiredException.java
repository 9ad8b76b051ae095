package com.example.doimetadata.domain.exception;

/**
 * Raised when the pipeline is invoked without a dataset record to read from.
 */
public class SourceRecordRequiredException extends DomainException {

	/**
	 * Creates the exception with a predefined error message.
	 */
    public SourceRecordRequiredException() {
        super("A dataset record is required to build DOI metadata.");
    }
}
