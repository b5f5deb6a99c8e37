package io.faultline.scope;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ThreadLocalHubContextTest {

  @Test
  void unboundThreadFallsBack() {
    ThreadLocalHubContext context = new ThreadLocalHubContext();
    Hub fallback = new Hub();

    assertNull(context.current());
    assertFalse(context.isBound());
    assertSame(fallback, context.currentOr(fallback));
  }

  @Test
  void bindingsNestAndRestore() {
    ThreadLocalHubContext context = new ThreadLocalHubContext();
    Hub outer = new Hub();
    Hub inner = new Hub();

    context.runWith(outer, () -> {
      assertSame(outer, context.current());
      context.runWith(inner, () -> assertSame(inner, context.current()));
      assertSame(outer, context.current());
    });

    assertFalse(context.isBound());
  }

  @Test
  void bindingIsRemovedWhenTaskThrows() {
    ThreadLocalHubContext context = new ThreadLocalHubContext();

    assertThrows(IllegalStateException.class, () -> context.runWith(new Hub(), () -> {
      throw new IllegalStateException("boom");
    }));

    assertFalse(context.isBound());
  }

  @Test
  void callWithReturnsResult() {
    ThreadLocalHubContext context = new ThreadLocalHubContext();
    Hub hub = new Hub();

    Hub seen = context.callWith(hub, context::current);

    assertSame(hub, seen);
  }

  @Test
  void bindingIsInvisibleToOtherThreads() throws Exception {
    ThreadLocalHubContext context = new ThreadLocalHubContext();
    Hub hub = new Hub();

    Boolean otherThreadBound = context.callWith(hub,
        () -> CompletableFuture.supplyAsync(context::isBound).join());

    assertFalse(otherThreadBound);
    assertFalse(CompletableFuture.supplyAsync(context::isBound).get(5, TimeUnit.SECONDS));
  }
}
