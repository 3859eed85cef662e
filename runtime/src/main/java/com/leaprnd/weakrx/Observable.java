package com.leaprnd.weakrx;

import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

public interface Observable<T> {

	/**
	 * Starts delivering notifications to the provided {@link Observer}. The source
	 * may deliver notifications, including a terminal one, before this method
	 * returns.
	 *
	 * @return A {@link Disposable} that stops the delivery when disposed.
	 */
	Disposable subscribe(Observer<? super T> observer);

	default Disposable subscribe(Consumer<? super T> onNext, Consumer<? super Throwable> onError, Runnable onCompleted) {
		requireNonNull(onNext, "onNext");
		requireNonNull(onError, "onError");
		requireNonNull(onCompleted, "onCompleted");
		return subscribe(new Observer<T>() {

			@Override
			public void onNext(T value) {
				onNext.accept(value);
			}

			@Override
			public void onError(Throwable error) {
				onError.accept(error);
			}

			@Override
			public void onCompleted() {
				onCompleted.run();
			}

		});
	}

}
