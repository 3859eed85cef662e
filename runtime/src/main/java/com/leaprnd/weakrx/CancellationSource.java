package com.leaprnd.weakrx;

import org.slf4j.Logger;

import java.util.Set;
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;

import static java.util.Objects.requireNonNull;
import static java.util.concurrent.ConcurrentHashMap.newKeySet;
import static java.util.concurrent.atomic.AtomicIntegerFieldUpdater.newUpdater;
import static org.slf4j.LoggerFactory.getLogger;

/**
 * Triggers a {@link CancellationSignal} exactly once. Every registered callback
 * runs at most once, whether it races with {@link #cancel()} or with the
 * disposal of its own registration.
 */
public final class CancellationSource {

	private static final AtomicIntegerFieldUpdater<CancellationSource> CANCELLED = newUpdater(
		CancellationSource.class,
		"cancelled"
	);

	private static final Logger LOGGER = getLogger(CancellationSource.class);

	private final Set<Registration> registrations = newKeySet();
	private final CancellationSignal signal = new Signal();

	private volatile int cancelled = 0;

	private final class Registration implements Disposable {

		private static final AtomicIntegerFieldUpdater<Registration> DONE = newUpdater(Registration.class, "done");

		private final Runnable callback;

		private volatile int done = 0;

		private Registration(Runnable callback) {
			this.callback = callback;
		}

		private boolean tryToFinish() {
			if (DONE.compareAndSet(this, 0, 1)) {
				registrations.remove(this);
				return true;
			}
			return false;
		}

		public void fire() {
			if (tryToFinish()) {
				callback.run();
			}
		}

		@Override
		public void dispose() {
			tryToFinish();
		}

		@Override
		public boolean isDisposed() {
			return done != 0;
		}

	}

	private final class Signal implements CancellationSignal {

		@Override
		public boolean canBeTriggered() {
			return true;
		}

		@Override
		public boolean isTriggered() {
			return isCancelled();
		}

		@Override
		public Disposable register(Runnable callback) {
			final var registration = new Registration(requireNonNull(callback, "callback"));
			registrations.add(registration);
			if (isCancelled()) {
				registration.fire();
			}
			return registration;
		}

		@Override
		public String toString() {
			return "CancellationSignal[" + (isCancelled() ? "triggered" : "pending") + "]";
		}

	}

	public CancellationSignal signal() {
		return signal;
	}

	public boolean isCancelled() {
		return cancelled != 0;
	}

	/**
	 * Runs every callback currently registered. A callback that throws is logged
	 * and does not prevent the others from running.
	 *
	 * @return True if and only if this invocation triggered the signal.
	 */
	public boolean cancel() {
		if (!CANCELLED.compareAndSet(this, 0, 1)) {
			return false;
		}
		for (final var registration : registrations) {
			try {
				registration.fire();
			} catch (Throwable throwable) {
				LOGGER.error("Could not run cancellation callback of {}!", signal, throwable);
			}
		}
		return true;
	}

}
