package com.leaprnd.weakrx;

import org.opentest4j.AssertionFailedError;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

/**
 * Runs each action on its own thread, releasing them all at once, and rethrows
 * whatever any of them threw.
 */
final class Concurrently {

	private Concurrently() {}

	private static class AtomicException extends AtomicReference<Throwable> {

		public void store(Throwable newException) {
			final var oldException = compareAndExchange(null, newException);
			if (oldException != null) {
				oldException.addSuppressed(newException);
			}
		}

		public void rethrow() {
			final var exception = get();
			if (exception == null) {
				return;
			}
			throw new AssertionFailedError("A concurrent action failed!", exception);
		}

	}

	public static void run(Executor executor, Runnable... actions) {
		final var ready = new CountDownLatch(actions.length);
		final var start = new CountDownLatch(1);
		final var finish = new CountDownLatch(actions.length);
		final var exceptions = new AtomicException();
		for (final var action : actions) {
			executor.execute(() -> {
				try {
					ready.countDown();
					assertTrue(start.await(5, SECONDS), "The action(s) never started!");
					action.run();
				} catch (Throwable exception) {
					exceptions.store(exception);
				} finally {
					finish.countDown();
				}
			});
		}
		try {
			assertTrue(ready.await(5, SECONDS), "The action(s) never became ready!");
			start.countDown();
			assertTrue(finish.await(5, SECONDS), "The action(s) never finished!");
		} catch (InterruptedException exception) {
			fail(exception);
		}
		exceptions.rethrow();
	}

	public static Runnable repeat(int times, Runnable action) {
		return () -> {
			for (int index = 0; index < times; index ++) {
				action.run();
			}
		};
	}

}
