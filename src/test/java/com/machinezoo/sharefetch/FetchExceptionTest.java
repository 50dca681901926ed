// Part of Sharefetch
package com.machinezoo.sharefetch;

import static org.hamcrest.MatcherAssert.*;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import java.util.concurrent.*;
import org.junit.jupiter.api.*;

public class FetchExceptionTest {
	@Test
	public void wrap() {
		ArithmeticException cause = new ArithmeticException();
		FetchException ex = FetchException.wrap("k", cause);
		assertEquals("k", ex.key());
		assertSame(cause, ex.getCause());
		assertThat(ex.getMessage(), containsString("k"));
	}
	@Test
	public void unwrapFutureExceptions() {
		ArithmeticException cause = new ArithmeticException();
		assertSame(cause, FetchException.wrap("k", new CompletionException(new ExecutionException(cause))).getCause());
	}
	@Test
	public void passThrough() {
		// Fallback that itself went through a cache already reports FetchException. It is not wrapped twice.
		FetchException inner = new FetchException("inner", new ArithmeticException());
		assertSame(inner, FetchException.wrap("outer", new CompletionException(inner)));
	}
}
