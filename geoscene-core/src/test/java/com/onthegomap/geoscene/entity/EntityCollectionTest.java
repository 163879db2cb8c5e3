package com.onthegomap.geoscene.entity;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class EntityCollectionTest {

  private final EntityCollection entities = new EntityCollection();

  @Test
  void testGetOrCreate() {
    Entity a = entities.getOrCreate("a");
    assertSame(a, entities.getOrCreate("a"));
    assertSame(a, entities.get("a"));
    assertTrue(entities.exists("a"));
    assertFalse(entities.exists("b"));
    assertNull(entities.get("b"));
    assertEquals(1, entities.size());
  }

  @Test
  void testPreservesInsertionOrder() {
    entities.getOrCreate("c");
    entities.getOrCreate("a");
    entities.getOrCreate("b");
    assertEquals(List.of("c", "a", "b"), entities.values().stream().map(Entity::getId).toList());
  }

  @Test
  void testClear() {
    entities.getOrCreate("a");
    entities.clear();
    assertEquals(0, entities.size());
    assertFalse(entities.exists("a"));
  }

  @Test
  void testValuesAreReadOnly() {
    entities.getOrCreate("a");
    assertThrows(UnsupportedOperationException.class, () -> entities.values().clear());
  }
}
