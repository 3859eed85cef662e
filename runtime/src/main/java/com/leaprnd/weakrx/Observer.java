package com.leaprnd.weakrx;

import org.jetbrains.annotations.NonBlocking;

/**
 * Receives the notifications of an {@link Observable}. For any one subscription
 * the notifications never overlap, and at most one of {@link #onError(Throwable)}
 * and {@link #onCompleted()} is delivered.
 */
public interface Observer<T> {

	@NonBlocking
	void onNext(T value);

	@NonBlocking
	void onError(Throwable error);

	@NonBlocking
	void onCompleted();

}
