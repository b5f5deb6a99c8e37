package io.faultline.scope;

import io.faultline.Breadcrumb;
import io.faultline.Event;
import io.faultline.Level;
import io.faultline.User;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HubTest {

  @Test
  void globalScopeIsNeverPopped() {
    Hub hub = new Hub();
    Scope global = hub.getScope();

    assertNull(hub.popScope());
    assertSame(global, hub.getScope());
    assertEquals(1, hub.stackSize());
  }

  @Test
  void pushedScopeStartsAsCopyOfParent() {
    Hub hub = new Hub();
    hub.setTag("env", "test");

    Scope pushed = hub.pushScope();
    pushed.setTag("inner", "yes");

    assertEquals(2, hub.stackSize());
    assertEquals(Map.of("env", "test", "inner", "yes"), pushed.getTags());
    assertSame(pushed, hub.popScope());
    assertEquals(Map.of("env", "test"), hub.getScope().getTags());
  }

  @Test
  void withScopePopsAfterCallback() {
    Hub hub = new Hub();

    hub.withScope(scope -> {
      scope.setTag("temporary", "1");
      assertEquals(2, hub.stackSize());
    });

    assertEquals(1, hub.stackSize());
    assertTrue(hub.getScope().getTags().isEmpty());
  }

  @Test
  void withScopePopsWhenCallbackThrows() {
    Hub hub = new Hub();

    IllegalStateException thrown = assertThrows(IllegalStateException.class,
        () -> hub.withScope(scope -> {
          throw new IllegalStateException("boom");
        }));

    assertEquals("boom", thrown.getMessage());
    assertEquals(1, hub.stackSize());
  }

  @Test
  void foldLetsNearerScopesWin() {
    Hub hub = new Hub();
    hub.setTag("who", "global");
    hub.setTag("global-only", "g");
    hub.setUser(User.ofId("global-user"));
    hub.setLevel(Level.INFO);
    hub.pushScope();
    hub.setTag("who", "inner");
    hub.setLevel(Level.WARNING);

    Event event = hub.applyToEvent(Event.ofMessage("hello"));

    assertEquals("inner", event.tags().get("who"));
    assertEquals("g", event.tags().get("global-only"));
    assertEquals("global-user", event.user().id());
    assertEquals(Level.WARNING, event.level());
    assertEquals("hello", event.message());
  }

  @Test
  void foldDoesNotDuplicateInheritedBreadcrumbs() {
    Hub hub = new Hub();
    hub.addBreadcrumb(Breadcrumb.of("first"));
    hub.pushScope();
    hub.addBreadcrumb(Breadcrumb.of("second"));

    Event event = hub.applyToEvent(Event.ofMessage("m"));

    assertEquals(List.of("first", "second"),
        event.breadcrumbs().stream().map(Breadcrumb::message).toList());
  }

  @Test
  void foldKeepsMostRecentBreadcrumbsUpToCapacity() {
    Hub hub = new Hub(2);
    hub.addBreadcrumb(Breadcrumb.of("a"));
    hub.addBreadcrumb(Breadcrumb.of("b"));
    hub.pushScope();
    hub.addBreadcrumb(Breadcrumb.of("c"));

    Event event = hub.applyToEvent(Event.ofMessage("m"));

    assertEquals(List.of("b", "c"),
        event.breadcrumbs().stream().map(Breadcrumb::message).toList());
  }

  @Test
  void foldOrdersBreadcrumbsByTimestampBeforeTrimming() {
    Hub hub = new Hub(2);
    Scope global = hub.getScope();
    global.addBreadcrumb(crumb("a", 1));
    hub.pushScope();
    global.addBreadcrumb(crumb("b", 3));
    hub.addBreadcrumb(crumb("c", 2));

    Event event = hub.applyToEvent(Event.ofMessage("m"));

    assertEquals(List.of("c", "b"),
        event.breadcrumbs().stream().map(Breadcrumb::message).toList());
  }

  private static Breadcrumb crumb(String message, long epochSecond) {
    return Breadcrumb.builder().message(message).timestamp(Instant.ofEpochSecond(epochSecond)).build();
  }

  @Test
  void captureContextCallbackHasTheFinalWord() {
    Hub hub = new Hub();
    hub.setTag("source", "scope");
    hub.setLevel(Level.INFO);

    Event event = hub.applyToEvent(Event.ofMessage("m"), scope -> {
      scope.setTag("source", "capture");
      scope.setLevel(Level.FATAL);
    });

    assertEquals("capture", event.tags().get("source"));
    assertEquals(Level.FATAL, event.level());
    assertEquals("scope", hub.getScope().getTags().get("source"));
  }

  @Test
  void partialScopeAppliesOnlyGivenFields() {
    Hub hub = new Hub();
    hub.setUser(User.ofId("kept"));
    hub.setLevel(Level.ERROR);

    PartialScope partial = CaptureContext.partial()
        .tag("attempt", "2")
        .extra("cart", "c-1")
        .fingerprint(List.of("payments"))
        .build();
    Event event = hub.applyToEvent(Event.ofMessage("m"), partial);

    assertEquals("2", event.tags().get("attempt"));
    assertEquals("c-1", event.extra().get("cart"));
    assertEquals(List.of("payments"), event.fingerprint());
    assertEquals("kept", event.user().id());
    assertEquals(Level.ERROR, event.level());
  }

  @Test
  void failingCaptureContextIsSkipped() {
    Hub hub = new Hub();
    hub.setTag("k", "v");

    Event event = hub.applyToEvent(Event.ofMessage("m"), scope -> {
      scope.setTag("partial", "yes");
      throw new IllegalStateException("broken");
    });

    assertEquals(Map.of("k", "v"), event.tags());
  }

  @Test
  void forkIsIndependentInBothDirections() {
    Hub hub = new Hub();
    hub.setTag("shared", "1");
    hub.addBreadcrumb(Breadcrumb.of("shared crumb"));

    Hub fork = hub.fork();
    fork.setTag("fork", "only");
    fork.addBreadcrumb(Breadcrumb.of("fork crumb"));
    hub.setTag("main", "only");

    assertEquals(Map.of("shared", "1", "main", "only"), hub.getScope().getTags());
    assertEquals(Map.of("shared", "1", "fork", "only"), fork.getScope().getTags());
    assertEquals(1, hub.getScope().getBreadcrumbs().size());
    assertEquals(2, fork.getScope().getBreadcrumbs().size());
    assertEquals(1, fork.stackSize());
    assertEquals(hub.getMaxBreadcrumbs(), fork.getMaxBreadcrumbs());
  }

  @Test
  void forkStartsFromCurrentTopScope() {
    Hub hub = new Hub();
    hub.pushScope().setTag("pushed", "yes");

    Hub fork = hub.fork();
    hub.popScope();

    assertEquals("yes", fork.getScope().getTags().get("pushed"));
    assertNull(fork.popScope());
  }

  @Test
  void configureScopeMutatesCurrentScope() {
    Hub hub = new Hub();
    hub.pushScope();

    hub.configureScope(scope -> scope.setExtra("k", 1));

    assertEquals(Map.of("k", 1), hub.getScope().getExtras());
    hub.popScope();
    assertTrue(hub.getScope().getExtras().isEmpty());
  }

  @Test
  void pushedScopeInheritsUserUntilItSetsItsOwn() {
    Hub hub = new Hub();
    hub.setUser(User.ofId("123"));

    Scope child = hub.pushScope();
    assertEquals("123", child.applyToEvent(Event.builder().build()).user().id());

    child.setUser(User.ofId("456"));
    assertEquals("456", hub.applyToEvent(Event.builder().build()).user().id());
    hub.popScope();
    assertEquals("123", hub.applyToEvent(Event.builder().build()).user().id());
  }

  @Test
  void childContextFoldsWithInheritedTags() {
    Hub hub = new Hub();
    hub.setTags(Map.of("k", "v"));
    Scope child = hub.pushScope();
    child.setContext("device", Map.of("model", "iPhone"));

    Event event = child.applyToEvent(Event.builder().build());

    assertEquals(Map.of("k", "v"), event.tags());
    assertEquals(Map.of("device", Map.of("model", "iPhone")), event.contexts());
  }

  @Test
  void stackNeverDropsBelowOneScope() {
    Hub hub = new Hub();
    for (int round = 0; round < 3; round++) {
      hub.pushScope();
      hub.pushScope();
      hub.popScope();
      hub.popScope();
      hub.popScope();
      assertEquals(1, hub.stackSize());
    }
  }
}
