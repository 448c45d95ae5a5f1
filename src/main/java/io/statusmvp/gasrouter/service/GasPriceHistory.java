package io.statusmvp.gasrouter.service;

import io.statusmvp.gasrouter.model.GasPriceSample;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable fixed-capacity ring of samples for one chain. {@link #append} returns a new instance
 * that overwrites the oldest entry once full, so a published instance is never partially written.
 */
final class GasPriceHistory {
  private final GasPriceSample[] ring;
  private final int head;
  private final int count;

  private GasPriceHistory(GasPriceSample[] ring, int head, int count) {
    this.ring = ring;
    this.head = head;
    this.count = count;
  }

  static GasPriceHistory empty(int capacity) {
    return new GasPriceHistory(new GasPriceSample[Math.max(1, capacity)], 0, 0);
  }

  GasPriceHistory append(GasPriceSample sample) {
    GasPriceSample[] next = ring.clone();
    next[head] = sample;
    return new GasPriceHistory(next, (head + 1) % next.length, Math.min(count + 1, next.length));
  }

  int capacity() {
    return ring.length;
  }

  int size() {
    return count;
  }

  GasPriceSample latest() {
    if (count == 0) return null;
    return ring[(head - 1 + ring.length) % ring.length];
  }

  /** The newest {@code n} samples (clamped to what is populated), oldest first. */
  List<GasPriceSample> lastN(int n) {
    int take = Math.max(0, Math.min(n, count));
    List<GasPriceSample> out = new ArrayList<>(take);
    for (int i = take; i >= 1; i--) {
      out.add(ring[(head - i + ring.length) % ring.length]);
    }
    return Collections.unmodifiableList(out);
  }
}
