package com.leaprnd.weakrx;

import static java.util.Objects.requireNonNull;

enum NoCancellationSignal implements CancellationSignal {

	NO_CANCELLATION_SIGNAL;

	private static final Disposable NO_REGISTRATION = () -> {};

	@Override
	public boolean canBeTriggered() {
		return false;
	}

	@Override
	public boolean isTriggered() {
		return false;
	}

	@Override
	public Disposable register(Runnable callback) {
		requireNonNull(callback, "callback");
		return NO_REGISTRATION;
	}

}
