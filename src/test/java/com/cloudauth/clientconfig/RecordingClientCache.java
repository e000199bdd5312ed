package com.cloudauth.clientconfig;

import java.util.concurrent.atomic.AtomicInteger;

final class RecordingClientCache implements ClientCache {
  private final AtomicInteger flushes = new AtomicInteger();
  private volatile Runnable onFlush = () -> { };

  void onFlush(Runnable onFlush) {
    this.onFlush = onFlush;
  }

  int flushes() {
    return flushes.get();
  }

  @Override
  public void flush() {
    flushes.incrementAndGet();
    onFlush.run();
  }
}
