package dev.fileops.engine;

import java.io.InterruptedIOException;

/**
 * Raised between filesystem steps once cancellation has been requested.
 */
public class OperationCancelledException extends InterruptedIOException {

	private static final long serialVersionUID = 1L;

	public OperationCancelledException(String message) {
		super(message);
	}

}
