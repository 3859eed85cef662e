package com.leaprnd.weakrx;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;

import static com.leaprnd.weakrx.SingleAssignmentDisposable.Disposed.DISPOSED;
import static java.util.Objects.requireNonNull;

/**
 * Holds at most one {@link Disposable}, which may be assigned before or after
 * this holder is disposed. A resource assigned after {@link #dispose()} is
 * disposed immediately instead of being stored.
 */
public final class SingleAssignmentDisposable implements Disposable {

	private static final VarHandle RESOURCE_UPDATER;

	static {
		try {
			RESOURCE_UPDATER = MethodHandles
				.lookup()
				.findVarHandle(SingleAssignmentDisposable.class, "resource", Disposable.class);
		} catch (ReflectiveOperationException exception) {
			throw new ExceptionInInitializerError(exception);
		}
	}

	enum Disposed implements Disposable {

		DISPOSED;

		@Override
		public void dispose() {}

		@Override
		public boolean isDisposed() {
			return true;
		}

	}

	// null while empty, DISPOSED once disposed
	private volatile Disposable resource;

	public void set(Disposable newResource) {
		requireNonNull(newResource, "resource");
		final var oldResource = (Disposable) RESOURCE_UPDATER.compareAndExchange(this, (Disposable) null, newResource);
		if (oldResource == null) {
			return;
		}
		if (oldResource == DISPOSED) {
			newResource.dispose();
			return;
		}
		throw new IllegalStateException("A resource has already been assigned!");
	}

	/**
	 * @return The assigned resource or null if no resource has been assigned yet
	 *         or if this holder has been disposed.
	 */
	public Disposable get() {
		final var current = resource;
		return current == DISPOSED ? null : current;
	}

	@Override
	public void dispose() {
		final var oldResource = (Disposable) RESOURCE_UPDATER.getAndSet(this, (Disposable) DISPOSED);
		if (oldResource != null && oldResource != DISPOSED) {
			oldResource.dispose();
		}
	}

	@Override
	public boolean isDisposed() {
		return resource == DISPOSED;
	}

}
