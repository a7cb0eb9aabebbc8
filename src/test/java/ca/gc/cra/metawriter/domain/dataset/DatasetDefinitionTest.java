package ca.gc.cra.metawriter.domain.dataset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class DatasetDefinitionTest {

  @Test
  void factoriesDescribeUnlimitedDatasets() {
    DatasetDefinition frame = DatasetDefinition.int64("frame");

    assertEquals(ElementType.INT64, frame.elementType());
    assertEquals(-1L, frame.fillValue());
    assertTrue(frame.cached());
    assertFalse(frame.hasFixedLength());
    assertFalse(DatasetDefinition.int64("create_duration", false).cached());
    assertEquals(-1, DatasetDefinition.int32("gain").fillValue());
  }

  @Test
  void fillValueIsCoercedToElementType() {
    DatasetDefinition definition = new DatasetDefinition("x", ElementType.INT64, 0, 0, true, 0);

    assertEquals(0L, definition.fillValue());
  }

  @Test
  void rejectsInvalidShapes() {
    assertThrows(IllegalArgumentException.class, () -> DatasetDefinition.int64(" "));
    assertThrows(IllegalArgumentException.class,
        () -> new DatasetDefinition("x", ElementType.INT64, null, 0, true, -1));
    assertThrows(IllegalArgumentException.class, () -> DatasetDefinition.string("s", -1, false));
  }
}
