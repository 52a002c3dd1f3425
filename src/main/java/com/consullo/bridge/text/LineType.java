package com.consullo.bridge.text;

/**
 * Semantic classification of an output line or a group of lines.
 *
 * <p>Each type carries two fixed orderings: {@link #groupRank()} decides which member type names a group of mixed
 * lines, {@link #basePriority()} seeds the delivery priority of a chunk.
 *
 * @since 1.0
 */
public enum LineType {

  ERROR(7, 100),
  WARNING(6, 80),
  SUCCESS(5, 60),
  INFO(4, 40),
  CODE(3, 30),
  PROGRESS(2, 10),
  NORMAL(1, 20);

  private final int groupRank;
  private final int basePriority;

  LineType(final int groupRank, final int basePriority) {
    this.groupRank = groupRank;
    this.basePriority = basePriority;
  }

  /**
   * Rank used when several line types are combined; higher wins.
   *
   * @return group rank
   */
  public int groupRank() {
    return groupRank;
  }

  /**
   * Base delivery priority for chunks of this type.
   *
   * @return base priority
   */
  public int basePriority() {
    return basePriority;
  }

  /**
   * Returns true for types that trigger an immediate flush and never share a group with another type.
   *
   * @return true for error and success
   */
  public boolean isHighPriority() {
    return this == ERROR || this == SUCCESS;
  }

  /**
   * Returns the higher-ranked of two types.
   *
   * @param a first type
   * @param b second type
   * @return the type with the higher group rank
   */
  public static LineType max(final LineType a, final LineType b) {
    return a.groupRank >= b.groupRank ? a : b;
  }
}
