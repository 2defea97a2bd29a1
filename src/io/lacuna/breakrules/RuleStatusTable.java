package io.lacuna.breakrules;

import io.lacuna.bifurcan.*;

import java.util.SortedSet;

/**
 * The rule-status values referenced by state table rows. The list is a sequence of groups, each a count followed by
 * that many sorted status values; a row refers to a group by the index of its count. Groups are only ever appended,
 * and index 0 always holds the group {0}.
 */
public class RuleStatusTable {

  private final LinearList<Integer> values = new LinearList<>();

  public RuleStatusTable() {
    values.addLast(1).addLast(0);
  }

  /**
   * @return the index of the group holding exactly {@code group}, appending the group if there is none
   */
  public int indexOf(SortedSet<Integer> group) {
    if (group.isEmpty()) {
      throw new IllegalArgumentException("empty status group");
    }

    int next = 0;
    while (next < size()) {
      int start = next;
      int count = get(start);
      next += count + 1;
      if (count != group.size()) {
        continue;
      }

      int i = start + 1;
      boolean matches = true;
      for (int v : group) {
        if (get(i++) != v) {
          matches = false;
          break;
        }
      }
      if (matches) {
        return start;
      }
    }

    int start = size();
    values.addLast(group.size());
    group.forEach(values::addLast);
    return start;
  }

  public int size() {
    return (int) values.size();
  }

  public int get(int idx) {
    return values.nth(idx);
  }

  public int[] toArray() {
    return values.stream().mapToInt(Integer::intValue).toArray();
  }

  /**
   * @return the status values of the group starting at {@code idx}
   */
  public int[] group(int idx) {
    int count = get(idx);
    int[] group = new int[count];
    for (int i = 0; i < count; i++) {
      group[i] = get(idx + 1 + i);
    }
    return group;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    int next = 0;
    while (next < size()) {
      sb.append(next).append(": {");
      int count = get(next);
      for (int i = 1; i <= count; i++) {
        sb.append(get(next + i)).append(i < count ? ", " : "");
      }
      sb.append("}\n");
      next += count + 1;
    }
    return sb.toString();
  }
}
