package io.faultline;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExceptionValueTest {

  @Test
  void chainIsInnermostFirstWithMechanismOnOutermost() {
    Throwable root = new IllegalArgumentException("root");
    Throwable middle = new IllegalStateException("middle", root);
    Throwable outer = new RuntimeException("outer", middle);

    List<ExceptionValue> chain = ExceptionValue.chainOf(outer, false, StackFrame::isInAppByDefault,
        ExceptionValue.Mechanism.GENERIC);

    assertEquals(List.of("root", "middle", "outer"), chain.stream().map(ExceptionValue::value).toList());
    assertNull(chain.get(0).mechanism());
    assertEquals(ExceptionValue.Mechanism.GENERIC, chain.get(2).mechanism());
    assertEquals("java.lang", chain.get(2).module());
  }

  @Test
  void cyclicCausesTerminate() {
    RuntimeException a = new RuntimeException("a");
    RuntimeException b = new RuntimeException("b", a);
    a.initCause(b);

    List<ExceptionValue> chain = ExceptionValue.chainOf(a, false, name -> true, ExceptionValue.Mechanism.GENERIC);

    assertEquals(2, chain.size());
  }

  @Test
  void framesAreOldestCallFirst() {
    RuntimeException error = new RuntimeException("x");
    error.setStackTrace(new StackTraceElement[] {
        new StackTraceElement("com.example.Inner", "fail", "Inner.java", 10),
        new StackTraceElement("java.lang.Thread", "run", "Thread.java", -1)
    });

    List<StackFrame> frames = ExceptionValue.chainOf(error, true, StackFrame::isInAppByDefault,
        ExceptionValue.Mechanism.UNCAUGHT).get(0).frames();

    assertEquals("run", frames.get(0).function());
    assertFalse(frames.get(0).inApp());
    assertNull(frames.get(0).lineno());
    assertEquals("fail", frames.get(1).function());
    assertTrue(frames.get(1).inApp());
    assertEquals(10, frames.get(1).lineno());
  }

  @Test
  void typeIsRequired() {
    assertThrows(NullPointerException.class, () -> new ExceptionValue(null, "v", null, null, null));
  }
}
