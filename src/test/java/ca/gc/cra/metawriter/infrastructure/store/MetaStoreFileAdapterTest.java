package ca.gc.cra.metawriter.infrastructure.store;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.metawriter.application.port.ArrayStore;
import ca.gc.cra.metawriter.application.port.StoredArray;
import ca.gc.cra.metawriter.domain.dataset.ElementType;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MetaStoreFileAdapterTest {
  @TempDir Path tempDir;

  private final MetaStoreFileAdapter adapter = new MetaStoreFileAdapter();

  @Test
  void createsParentDirectoriesAndWritesHeader() throws IOException {
    Path file = tempDir.resolve("nested/dir/scan_meta.mds");

    try (ArrayStore store = adapter.create(file)) {
      assertEquals(file, store.path());
    }

    byte[] content = Files.readAllBytes(file);
    assertEquals("MDS1", new String(content, 0, 4, StandardCharsets.US_ASCII));
  }

  @Test
  void flushedValuesAreVisibleBeforeClose() throws IOException {
    Path file = tempDir.resolve("live_meta.mds");
    try (ArrayStore store = adapter.create(file)) {
      StoredArray frame = store.createArray("frame", ElementType.INT64, -1L, 0, 0, StoredArray.UNBOUNDED);
      frame.resize(3);
      frame.write(1, new Object[] {7L});
      frame.flush();
      frame.write(2, new Object[] {8L});

      StoreSnapshot live = MetaStoreReader.read(file);

      assertFalse(live.closed());
      assertFalse(live.truncated());
      assertEquals(List.of(-1L, 7L, -1L), live.array("frame").orElseThrow().values());
    }

    StoreSnapshot closed = MetaStoreReader.read(file);
    assertTrue(closed.closed());
    assertEquals(List.of(-1L, 7L, 8L), closed.array("frame").orElseThrow().values());
  }

  @Test
  void storesEveryElementType() throws IOException {
    Path file = tempDir.resolve("types_meta.mds");
    try (ArrayStore store = adapter.create(file)) {
      store.createArray("i32", ElementType.INT32, 0, 0, 0, StoredArray.UNBOUNDED).append(42);
      store.createArray("text", ElementType.STRING, "", 16, 0, StoredArray.UNBOUNDED).append("héllo");
      store.createArray("raw", ElementType.BLOB, null, 0, 0, StoredArray.UNBOUNDED)
          .append(new byte[] {1, 2, 3});
      store.createArray("seeded", List.of("a", "b"));
      store.createArray("ratios", List.of(1, 0.5));
    }

    StoreSnapshot snapshot = MetaStoreReader.read(file);

    assertEquals(List.of(42), snapshot.array("i32").orElseThrow().values());
    assertEquals(List.of("héllo"), snapshot.array("text").orElseThrow().values());
    assertArrayEquals(new byte[] {1, 2, 3}, (byte[]) snapshot.array("raw").orElseThrow().get(0));
    assertEquals(List.of("a", "b"), snapshot.array("seeded").orElseThrow().values());
    assertEquals(ElementType.STRING, snapshot.array("seeded").orElseThrow().elementType());
    assertEquals(List.of(1.0, 0.5), snapshot.array("ratios").orElseThrow().values());
    assertEquals(ElementType.FLOAT64, snapshot.array("ratios").orElseThrow().elementType());
    assertTrue(Double.isNaN((Double) snapshot.array("ratios").orElseThrow().fillValue()));
    assertEquals(List.of("i32", "text", "raw", "seeded", "ratios"), List.copyOf(snapshot.arrays().keySet()));
  }

  @Test
  void fixedExtentArraysStartAtFillAndRejectGrowth() throws IOException {
    Path file = tempDir.resolve("fixed_meta.mds");
    try (ArrayStore store = adapter.create(file)) {
      StoredArray fixed = store.createArray("gains", ElementType.INT64, 0L, 0, 2, 2);

      assertEquals(2, fixed.length());
      assertThrows(IllegalArgumentException.class, () -> fixed.resize(3));
    }

    StoredArraySnapshot gains = MetaStoreReader.read(file).array("gains").orElseThrow();
    assertEquals(List.of(0L, 0L), gains.values());
    assertEquals(2, gains.maxLength());
  }

  @Test
  void shrinkingAndRegrowingRestoresFillValues() throws IOException {
    Path file = tempDir.resolve("shrink_meta.mds");
    try (ArrayStore store = adapter.create(file)) {
      StoredArray array = store.createArray("frame", ElementType.INT64, -1L, 0, 0, StoredArray.UNBOUNDED);
      array.resize(3);
      array.write(0, new Object[] {1L, 2L, 3L});
      array.flush();
      array.resize(1);
      array.resize(3);
      array.flush();
    }

    assertEquals(List.of(1L, -1L, -1L), MetaStoreReader.read(file).array("frame").orElseThrow().values());
  }

  @Test
  void duplicateArrayAndWritesOutsideExtentAreRejected() throws IOException {
    try (ArrayStore store = adapter.create(tempDir.resolve("dup_meta.mds"))) {
      StoredArray array = store.createArray("frame", ElementType.INT64, -1L, 0, 0, StoredArray.UNBOUNDED);

      assertThrows(IllegalArgumentException.class,
          () -> store.createArray("frame", ElementType.INT64, -1L, 0, 0, StoredArray.UNBOUNDED));
      assertThrows(IndexOutOfBoundsException.class, () -> array.write(0, new Object[] {1L}));
    }
  }

  @Test
  void closedStoreRejectsFurtherUse() throws IOException {
    ArrayStore store = adapter.create(tempDir.resolve("closed_meta.mds"));
    StoredArray array = store.createArray("frame", ElementType.INT64, -1L, 0, 0, StoredArray.UNBOUNDED);
    store.close();
    store.close();

    assertThrows(IOException.class, () -> array.resize(1));
    assertThrows(IOException.class,
        () -> store.createArray("other", ElementType.INT64, -1L, 0, 0, StoredArray.UNBOUNDED));
  }

  @Test
  void reopeningReplacesExistingFile() throws IOException {
    Path file = tempDir.resolve("again_meta.mds");
    try (ArrayStore store = adapter.create(file)) {
      store.createArray("old", List.of(1L));
    }
    try (ArrayStore store = adapter.create(file)) {
      store.createArray("new", List.of(2L));
    }

    assertEquals(List.of("new"), List.copyOf(MetaStoreReader.read(file).arrays().keySet()));
  }
}
