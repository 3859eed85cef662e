package com.leaprnd.weakrx;

import org.jetbrains.annotations.NonBlocking;

/**
 * A resource that can be released. Implementations must make {@link #dispose()}
 * idempotent and must never throw from it.
 */
@FunctionalInterface
public interface Disposable {

	@NonBlocking
	void dispose();

	/**
	 * @return True if and only if {@link #dispose()} has taken effect. Resources
	 *         that cannot tell always return false.
	 */
	default boolean isDisposed() {
		return false;
	}

}
