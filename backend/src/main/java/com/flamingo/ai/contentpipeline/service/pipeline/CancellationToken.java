package com.flamingo.ai.contentpipeline.service.pipeline;

import java.util.concurrent.atomic.AtomicBoolean;

/** Signals a running pipeline to stop at the next stage transition. */
public class CancellationToken {

  private final AtomicBoolean cancelled = new AtomicBoolean();

  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancellationRequested() {
    return cancelled.get();
  }
}
