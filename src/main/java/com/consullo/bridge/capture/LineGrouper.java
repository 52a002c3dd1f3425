package com.consullo.bridge.capture;

import com.consullo.bridge.text.LineType;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Groups flushed lines into presentation blocks.
 *
 * <p>
 * Greedy, in original order. A line joins the current group unless:
 * <ul>
 * <li>more than {@link #MAX_GAP} passed since the previous line of the group</li>
 * <li>the two types differ and either is error or success</li>
 * <li>exactly one of the two is progress</li>
 * <li>the group already holds {@link #MAX_GROUP_SIZE} lines</li>
 * </ul>
 * </p>
 *
 * @since 1.0
 */
public final class LineGrouper {

  public static final Duration MAX_GAP = Duration.ofSeconds(3);
  public static final int MAX_GROUP_SIZE = 20;

  private LineGrouper() {
  }

  /**
   * Groups lines.
   *
   * @param lines lines in arrival order
   * @return groups in arrival order, each non-empty
   */
  public static List<List<OutputLine>> group(final List<OutputLine> lines) {
    final List<List<OutputLine>> groups = new ArrayList<>();
    if (lines == null || lines.isEmpty()) {
      return groups;
    }

    List<OutputLine> current = new ArrayList<>();
    current.add(lines.get(0));
    for (int i = 1; i < lines.size(); i++) {
      final OutputLine line = lines.get(i);
      final OutputLine previous = current.get(current.size() - 1);
      if (current.size() < MAX_GROUP_SIZE && belongsWith(previous, line)) {
        current.add(line);
      } else {
        groups.add(current);
        current = new ArrayList<>();
        current.add(line);
      }
    }
    groups.add(current);
    return groups;
  }

  static boolean belongsWith(final OutputLine previous, final OutputLine line) {
    if (Duration.between(previous.timestamp(), line.timestamp()).compareTo(MAX_GAP) > 0) {
      return false;
    }
    final LineType a = previous.type();
    final LineType b = line.type();
    if (a != b && (a.isHighPriority() || b.isHighPriority())) {
      return false;
    }
    if ((a == LineType.PROGRESS) != (b == LineType.PROGRESS)) {
      return false;
    }
    return true;
  }

  /**
   * Returns the highest-ranked member type (error > warning > success > info > code > progress > normal).
   *
   * @param group lines of one group
   * @return aggregate type, {@link LineType#NORMAL} for an empty group
   */
  public static LineType aggregateType(final List<OutputLine> group) {
    LineType type = LineType.NORMAL;
    for (OutputLine line : group) {
      type = LineType.max(type, line.type());
    }
    return type;
  }

  /**
   * Joins the normalized text of the group's non-blank lines with newlines.
   *
   * @param group lines of one group
   * @return combined text, empty if every line is blank
   */
  public static String combine(final List<OutputLine> group) {
    final StringBuilder sb = new StringBuilder();
    for (OutputLine line : group) {
      final String text = line.text();
      if (text == null || text.isBlank()) {
        continue;
      }
      if (sb.length() > 0) {
        sb.append('\n');
      }
      sb.append(text);
    }
    return sb.toString();
  }
}
