package io.faultline.scope;

import io.faultline.Breadcrumb;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/**
 * Bounded FIFO of breadcrumbs. Adding to a full ring evicts the oldest entry.
 *
 * <p>Not thread-safe; {@link Scope} guards access with its own monitor.
 */
final class BreadcrumbRing {
  private final int capacity;
  private final ArrayDeque<Breadcrumb> entries;

  BreadcrumbRing(int capacity) {
    if (capacity < 0) {
      throw new IllegalArgumentException("capacity must be >= 0, got: " + capacity);
    }
    this.capacity = capacity;
    this.entries = new ArrayDeque<>(Math.max(1, Math.min(capacity, 128)));
  }

  private BreadcrumbRing(BreadcrumbRing source) {
    this.capacity = source.capacity;
    this.entries = new ArrayDeque<>(source.entries);
  }

  void add(Breadcrumb breadcrumb) {
    if (capacity == 0) {
      return;
    }
    while (entries.size() >= capacity) {
      entries.pollFirst();
    }
    entries.addLast(breadcrumb);
  }

  void clear() {
    entries.clear();
  }

  int size() {
    return entries.size();
  }

  int capacity() {
    return capacity;
  }

  /** Oldest first. */
  List<Breadcrumb> toList() {
    return new ArrayList<>(entries);
  }

  BreadcrumbRing copy() {
    return new BreadcrumbRing(this);
  }
}
