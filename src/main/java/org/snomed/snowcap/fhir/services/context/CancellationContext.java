package org.snomed.snowcap.fhir.services.context;

import org.snomed.snowcap.fhir.exceptions.OperationCancelledException;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Deadline and cancel flag shared between a caller and a running operation.
 * Operations call {@link #checkpoint()} between units of work.
 */
public class CancellationContext {

	private final long deadlineNanos;
	private final AtomicBoolean cancelled = new AtomicBoolean();

	private CancellationContext(long deadlineNanos) {
		this.deadlineNanos = deadlineNanos;
	}

	public static CancellationContext create() {
		return new CancellationContext(0);
	}

	public static CancellationContext withTimeout(Duration timeout) {
		return new CancellationContext(System.nanoTime() + timeout.toNanos());
	}

	/**
	 * @param timeoutSeconds zero or less means no deadline
	 */
	public static CancellationContext withTimeoutSeconds(int timeoutSeconds) {
		return timeoutSeconds > 0 ? withTimeout(Duration.ofSeconds(timeoutSeconds)) : create();
	}

	public void cancel() {
		cancelled.set(true);
	}

	public boolean isCancelled() {
		return cancelled.get() || (deadlineNanos != 0 && System.nanoTime() - deadlineNanos > 0);
	}

	public void checkpoint() {
		if (cancelled.get()) {
			throw new OperationCancelledException("Operation cancelled.");
		}
		if (deadlineNanos != 0 && System.nanoTime() - deadlineNanos > 0) {
			throw new OperationCancelledException("Operation timed out.");
		}
	}
}
