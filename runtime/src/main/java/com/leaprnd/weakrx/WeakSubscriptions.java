package com.leaprnd.weakrx;

import java.util.function.BiConsumer;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/**
 * Subscribes callbacks acting on a target object to an {@link Observable}
 * without the subscription keeping the target alive. Once the target has been
 * garbage collected, the subscription is disposed the next time the source
 * delivers a value.
 */
public final class WeakSubscriptions {

	private WeakSubscriptions() {}

	/**
	 * Subscribes an element handler to the provided {@link Observable}.
	 *
	 * @return A {@link Disposable} that terminates the subscription.
	 */
	public static <R, T> Disposable weakSubscribe(
		Observable<T> source,
		R target,
		BiConsumer<? super R, ? super T> onNext
	) {
		requireNonNull(source, "source");
		return subscribe(source, WeakObserver.create(target, onNext));
	}

	/**
	 * Subscribes an element handler and an error handler to the provided {@link Observable}.
	 *
	 * @return A {@link Disposable} that terminates the subscription.
	 */
	public static <R, T> Disposable weakSubscribe(
		Observable<T> source,
		R target,
		BiConsumer<? super R, ? super T> onNext,
		BiConsumer<? super R, ? super Throwable> onError
	) {
		requireNonNull(source, "source");
		return subscribe(source, WeakObserver.create(target, onNext, onError));
	}

	/**
	 * Subscribes an element handler and a completion handler to the provided {@link Observable}.
	 *
	 * @return A {@link Disposable} that terminates the subscription.
	 */
	public static <R, T> Disposable weakSubscribe(
		Observable<T> source,
		R target,
		BiConsumer<? super R, ? super T> onNext,
		Consumer<? super R> onCompleted
	) {
		requireNonNull(source, "source");
		return subscribe(source, WeakObserver.create(target, onNext, onCompleted));
	}

	/**
	 * Subscribes an element handler, an error handler and a completion handler to the provided {@link Observable}.
	 *
	 * @return A {@link Disposable} that terminates the subscription.
	 */
	public static <R, T> Disposable weakSubscribe(
		Observable<T> source,
		R target,
		BiConsumer<? super R, ? super T> onNext,
		BiConsumer<? super R, ? super Throwable> onError,
		Consumer<? super R> onCompleted
	) {
		requireNonNull(source, "source");
		return subscribe(source, WeakObserver.create(target, onNext, onError, onCompleted));
	}

	/**
	 * Subscribes an element handler to the provided {@link Observable} until the provided
	 * {@link CancellationSignal} is triggered.
	 */
	public static <R, T> void weakSubscribe(
		Observable<T> source,
		R target,
		BiConsumer<? super R, ? super T> onNext,
		CancellationSignal signal
	) {
		requireNonNull(source, "source");
		requireNonNull(signal, "signal");
		CancellationBridge.subscribe(source, WeakObserver.create(target, onNext), signal);
	}

	/**
	 * Subscribes an element handler and an error handler to the provided {@link Observable} until the provided
	 * {@link CancellationSignal} is triggered.
	 */
	public static <R, T> void weakSubscribe(
		Observable<T> source,
		R target,
		BiConsumer<? super R, ? super T> onNext,
		BiConsumer<? super R, ? super Throwable> onError,
		CancellationSignal signal
	) {
		requireNonNull(source, "source");
		requireNonNull(signal, "signal");
		CancellationBridge.subscribe(source, WeakObserver.create(target, onNext, onError), signal);
	}

	/**
	 * Subscribes an element handler and a completion handler to the provided {@link Observable} until the provided
	 * {@link CancellationSignal} is triggered.
	 */
	public static <R, T> void weakSubscribe(
		Observable<T> source,
		R target,
		BiConsumer<? super R, ? super T> onNext,
		Consumer<? super R> onCompleted,
		CancellationSignal signal
	) {
		requireNonNull(source, "source");
		requireNonNull(signal, "signal");
		CancellationBridge.subscribe(source, WeakObserver.create(target, onNext, onCompleted), signal);
	}

	/**
	 * Subscribes an element handler, an error handler and a completion handler to the provided {@link Observable} until the provided
	 * {@link CancellationSignal} is triggered.
	 */
	public static <R, T> void weakSubscribe(
		Observable<T> source,
		R target,
		BiConsumer<? super R, ? super T> onNext,
		BiConsumer<? super R, ? super Throwable> onError,
		Consumer<? super R> onCompleted,
		CancellationSignal signal
	) {
		requireNonNull(source, "source");
		requireNonNull(signal, "signal");
		CancellationBridge.subscribe(source, WeakObserver.create(target, onNext, onError, onCompleted), signal);
	}

	private static <R, T> Disposable subscribe(Observable<T> source, WeakObserver<R, T> observer) {
		observer.setSubscription(source.subscribe(observer));
		return observer;
	}

}
