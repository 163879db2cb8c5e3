package com.onthegomap.geoscene.entity;

import java.util.Collection;

/**
 * Holds the entities a data source produces, keyed by their unique id.
 */
public interface EntityStore {

  /** Removes every entity. */
  void clear();

  /** Returns the entity with {@code id}, creating and adding it if there is none yet. */
  Entity getOrCreate(String id);

  boolean exists(String id);

  /** Returns the entity with {@code id}, or {@code null} if there is none. */
  Entity get(String id);

  int size();

  /** Returns every entity in the order it was first created. */
  Collection<Entity> values();
}
