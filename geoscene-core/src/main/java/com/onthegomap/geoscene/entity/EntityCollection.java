package com.onthegomap.geoscene.entity;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * An in-memory {@link EntityStore} that preserves the order in which entities were created.
 */
@NotThreadSafe
public class EntityCollection implements EntityStore {

  private final Map<String, Entity> entities = new LinkedHashMap<>();

  @Override
  public void clear() {
    entities.clear();
  }

  @Override
  public Entity getOrCreate(String id) {
    Objects.requireNonNull(id, "id");
    return entities.computeIfAbsent(id, Entity::new);
  }

  @Override
  public boolean exists(String id) {
    return entities.containsKey(id);
  }

  @Override
  public Entity get(String id) {
    return entities.get(id);
  }

  @Override
  public int size() {
    return entities.size();
  }

  @Override
  public Collection<Entity> values() {
    return Collections.unmodifiableCollection(entities.values());
  }

  @Override
  public String toString() {
    return "EntityCollection{" + entities.size() + " entities}";
  }
}
