package io.faultline.scope;

import io.faultline.Breadcrumb;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BreadcrumbRingTest {

  @Test
  void evictsOldestWhenFull() {
    BreadcrumbRing ring = new BreadcrumbRing(3);
    for (int i = 1; i <= 5; i++) {
      ring.add(Breadcrumb.of("b" + i));
    }

    assertEquals(3, ring.size());
    assertEquals(List.of("b3", "b4", "b5"), messages(ring.toList()));
  }

  @Test
  void zeroCapacityKeepsNothing() {
    BreadcrumbRing ring = new BreadcrumbRing(0);
    ring.add(Breadcrumb.of("ignored"));

    assertEquals(0, ring.size());
  }

  @Test
  void negativeCapacityIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new BreadcrumbRing(-1));
  }

  @Test
  void copyIsIndependent() {
    BreadcrumbRing ring = new BreadcrumbRing(5);
    ring.add(Breadcrumb.of("shared"));

    BreadcrumbRing copy = ring.copy();
    copy.add(Breadcrumb.of("copy-only"));
    ring.clear();

    assertEquals(0, ring.size());
    assertEquals(List.of("shared", "copy-only"), messages(copy.toList()));
    assertEquals(5, copy.capacity());
  }

  private static List<String> messages(List<Breadcrumb> breadcrumbs) {
    return breadcrumbs.stream().map(Breadcrumb::message).toList();
  }
}
