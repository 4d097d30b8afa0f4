package com.flamingo.ai.contentpipeline.service.rag.index;

import static com.flamingo.ai.contentpipeline.service.rag.index.IndexSnapshotTest.entry;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("VectorIndex Tests")
class VectorIndexTest {

  @Test
  @DisplayName("Should keep every concurrent merge")
  void shouldKeepEveryConcurrentMerge() throws Exception {
    VectorIndex index = new VectorIndex();
    int writers = 16;
    ExecutorService pool = Executors.newFixedThreadPool(8);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int i = 0; i < writers; i++) {
        String documentId = "doc-" + i;
        long order = i;
        futures.add(
            pool.submit(
                () -> {
                  start.await();
                  index.merge(
                      List.of(
                          entry(documentId, 0, order, 1f, 0f),
                          entry(documentId, 1, order, 0f, 1f)));
                  return null;
                }));
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get();
      }
    } finally {
      pool.shutdownNow();
    }

    assertThat(index.chunkCount()).isEqualTo(writers * 2);
    assertThat(index.snapshot().documentCount()).isEqualTo(writers);
  }

  @Test
  @DisplayName("Should keep serving the old snapshot to readers that already hold it")
  void shouldServeHeldSnapshotAfterSwap() {
    VectorIndex index = new VectorIndex();
    index.merge(List.of(entry("a", 0, 0, 1f, 0f)));
    IndexSnapshot held = index.snapshot();

    index.swap(IndexSnapshot.of(List.of(entry("b", 0, 1, 1f, 0f), entry("c", 0, 2, 0f, 1f))));

    assertThat(held.size()).isEqualTo(1);
    assertThat(held.search(new float[] {1f, 0f}, 5))
        .extracting(r -> r.chunk().documentId())
        .containsExactly("a");
    assertThat(index.chunkCount()).isEqualTo(2);
  }

  @Test
  @DisplayName("Should keep documents merged while a rebuild was running")
  void shouldCarryOverMergesMissedByRebuild() {
    VectorIndex index = new VectorIndex();
    index.merge(List.of(entry("a", 0, 0, 1f, 0f)));
    IndexSnapshot rebuilt = IndexSnapshot.of(List.of(entry("a", 0, 0, 0f, 1f)));
    index.merge(List.of(entry("b", 0, 1, 1f, 1f)));

    IndexSnapshot active = index.publishRebuild(rebuilt);

    assertThat(active.documentCount()).isEqualTo(2);
    assertThat(active.size()).isEqualTo(2);
    assertThat(active.search(new float[] {0f, 1f}, 1).get(0).chunk().documentId())
        .isEqualTo("a");
    assertThat(active.search(new float[] {0f, 1f}, 1).get(0).score()).isEqualTo(1.0, within(1e-6));
  }
}
