package com.leaprnd.weakrx;

import static java.util.Objects.requireNonNull;

/**
 * Subscribes a {@link WeakObserver} so that its subscription lasts until the
 * source terminates, the target is collected or a {@link CancellationSignal} is
 * triggered, whichever comes first.
 */
public final class CancellationBridge {

	private CancellationBridge() {}

	/**
	 * Does nothing at all if the signal has already been triggered: no
	 * subscription is made and no notification is delivered.
	 */
	public static <T> void subscribe(Observable<T> source, WeakObserver<?, T> observer, CancellationSignal signal) {
		requireNonNull(source, "source");
		requireNonNull(observer, "observer");
		requireNonNull(signal, "signal");
		if (!signal.canBeTriggered()) {
			observer.setSubscription(source.subscribe(observer));
			return;
		}
		if (signal.isTriggered()) {
			return;
		}
		final var registration = new SingleAssignmentDisposable();
		final var subscription = source.subscribe(observer::onNext, error -> {
			registration.dispose();
			observer.onError(error);
		}, () -> {
			registration.dispose();
			observer.onCompleted();
		});
		// terminating the observer for any reason also unregisters it from the signal
		observer.setSubscription(() -> {
			subscription.dispose();
			registration.dispose();
		});
		registration.set(signal.register(observer::dispose));
	}

}
