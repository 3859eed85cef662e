package com.leaprnd.weakrx;

final class Exceptions {

	private Exceptions() {}

	/**
	 * Throws the provided {@link Throwable} as is, without wrapping it, even when it
	 * is a checked exception.
	 */
	public static RuntimeException rethrow(Throwable toThrow) {
		if (toThrow instanceof RuntimeException runtimeException) {
			throw runtimeException;
		}
		if (toThrow instanceof Error error) {
			throw error;
		}
		throw Exceptions.<RuntimeException>sneakyThrow(toThrow);
	}

	@SuppressWarnings("unchecked")
	private static <T extends Throwable> RuntimeException sneakyThrow(Throwable toThrow) throws T {
		throw (T) toThrow;
	}

}
