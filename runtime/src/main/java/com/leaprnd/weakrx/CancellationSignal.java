package com.leaprnd.weakrx;

/**
 * A one-shot signal that requests cancellation of whatever registered with it.
 */
public interface CancellationSignal {

	static CancellationSignal none() {
		return NoCancellationSignal.NO_CANCELLATION_SIGNAL;
	}

	/**
	 * @return False if and only if this signal will never be triggered, in which
	 *         case registering with it is pointless.
	 */
	boolean canBeTriggered();

	boolean isTriggered();

	/**
	 * Arranges for the provided callback to be run once this signal is triggered.
	 * If this signal has already been triggered, the callback is run immediately on
	 * the calling thread.
	 *
	 * @return A {@link Disposable} that unregisters the callback. Once it has been
	 *         disposed, the callback will not be run unless it is already running.
	 */
	Disposable register(Runnable callback);

}
