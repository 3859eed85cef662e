package com.leaprnd.weakrx;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.lang.ref.Reference;
import java.lang.ref.WeakReference;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

import static com.leaprnd.weakrx.WeakObserver.State.ACTIVE;
import static com.leaprnd.weakrx.WeakObserver.State.TERMINATED;
import static java.util.Objects.requireNonNull;
import static org.slf4j.LoggerFactory.getLogger;

/**
 * An {@link Observer} that forwards notifications to callbacks acting on a
 * target object. Only a weak reference to the target is kept, so subscribing
 * does not extend the lifetime of the target. If the target is garbage
 * collected, the observer disposes itself, and with it the subscription, the
 * next time a value is delivered.
 *
 * @param <R> The type of the target object.
 * @param <T> The type of the values.
 */
public final class WeakObserver<R, T> implements Observer<T>, Disposable {

	private static final VarHandle STATE_UPDATER;

	static {
		try {
			STATE_UPDATER = MethodHandles.lookup().findVarHandle(WeakObserver.class, "state", State.class);
		} catch (ReflectiveOperationException exception) {
			throw new ExceptionInInitializerError(exception);
		}
	}

	enum State {
		ACTIVE,
		TERMINATED
	}

	private static final Logger LOGGER = getLogger(WeakObserver.class);

	private static final BiConsumer<Object, Throwable> RETHROW = (target, error) -> {
		throw Exceptions.rethrow(error);
	};

	private static final Consumer<Object> NO_OP = target -> {};

	private final WeakReference<R> target;
	private final BiConsumer<? super R, ? super T> onNext;
	private final BiConsumer<? super R, ? super Throwable> onError;
	private final Consumer<? super R> onCompleted;
	private final SingleAssignmentDisposable subscription = new SingleAssignmentDisposable();

	@NotNull
	private volatile State state = ACTIVE;

	private WeakObserver(
		R target,
		BiConsumer<? super R, ? super T> onNext,
		BiConsumer<? super R, ? super Throwable> onError,
		Consumer<? super R> onCompleted
	) {
		this.target = new WeakReference<>(requireNonNull(target, "target"));
		this.onNext = requireNonNull(onNext, "onNext");
		this.onError = requireNonNull(onError, "onError");
		this.onCompleted = requireNonNull(onCompleted, "onCompleted");
	}

	/**
	 * Errors are rethrown on the delivering thread and completion is ignored.
	 */
	public static <R, T> WeakObserver<R, T> create(R target, BiConsumer<? super R, ? super T> onNext) {
		return new WeakObserver<>(target, onNext, RETHROW, NO_OP);
	}

	/**
	 * Completion is ignored.
	 */
	public static <R, T> WeakObserver<R, T> create(
		R target,
		BiConsumer<? super R, ? super T> onNext,
		BiConsumer<? super R, ? super Throwable> onError
	) {
		return new WeakObserver<>(target, onNext, onError, NO_OP);
	}

	/**
	 * Errors are rethrown on the delivering thread.
	 */
	public static <R, T> WeakObserver<R, T> create(
		R target,
		BiConsumer<? super R, ? super T> onNext,
		Consumer<? super R> onCompleted
	) {
		return new WeakObserver<>(target, onNext, RETHROW, onCompleted);
	}

	public static <R, T> WeakObserver<R, T> create(
		R target,
		BiConsumer<? super R, ? super T> onNext,
		BiConsumer<? super R, ? super Throwable> onError,
		Consumer<? super R> onCompleted
	) {
		return new WeakObserver<>(target, onNext, onError, onCompleted);
	}

	/**
	 * Ties the subscription returned by {@link Observable#subscribe(Observer)} to
	 * the lifetime of this observer. If this observer has already terminated, the
	 * subscription is disposed immediately.
	 *
	 * @throws IllegalStateException If a subscription has already been set.
	 */
	public void setSubscription(Disposable newSubscription) {
		subscription.set(newSubscription);
	}

	@Override
	public void onNext(T value) {
		if (state != ACTIVE) {
			return;
		}
		final var strongTarget = target.get();
		if (strongTarget == null) {
			if (tryToTerminate()) {
				LOGGER.debug("The target of {} was garbage collected; disposing its subscription", this);
				subscription.dispose();
			}
			return;
		}
		try {
			onNext.accept(strongTarget, value);
		} finally {
			Reference.reachabilityFence(strongTarget);
		}
	}

	@Override
	public void onError(Throwable error) {
		requireNonNull(error, "error");
		if (!tryToTerminate()) {
			return;
		}
		final var strongTarget = target.get();
		try {
			if (strongTarget != null) {
				onError.accept(strongTarget, error);
			}
		} finally {
			Reference.reachabilityFence(strongTarget);
			subscription.dispose();
		}
	}

	@Override
	public void onCompleted() {
		if (!tryToTerminate()) {
			return;
		}
		final var strongTarget = target.get();
		try {
			if (strongTarget != null) {
				onCompleted.accept(strongTarget);
			}
		} finally {
			Reference.reachabilityFence(strongTarget);
			subscription.dispose();
		}
	}

	@Override
	public void dispose() {
		if (tryToTerminate()) {
			subscription.dispose();
		}
	}

	private boolean tryToTerminate() {
		return STATE_UPDATER.compareAndSet(this, ACTIVE, TERMINATED);
	}

	@Override
	public boolean isDisposed() {
		return state == TERMINATED;
	}

	public boolean isTargetAlive() {
		return !target.refersTo(null);
	}

	@Override
	public String toString() {
		return "WeakObserver[" + state + "]";
	}

}
