package io.recurra.reconcile;

import java.util.Collection;
import java.util.Set;

/** The store's view of which instance slugs are already taken. */
@FunctionalInterface
public interface SlugIndex {

  /**
   * Returns whether a slug is already in use.
   *
   * @param slug the slug
   * @return true if taken
   */
  boolean isTaken(String slug);

  /**
   * Returns an index in which no slug is taken.
   *
   * @return an empty index
   */
  static SlugIndex none() {
    return slug -> false;
  }

  /**
   * Returns an index over a fixed set of taken slugs.
   *
   * @param taken the slugs in use
   * @return an index
   */
  static SlugIndex of(Collection<String> taken) {
    Set<String> copy = Set.copyOf(taken);
    return copy::contains;
  }
}
