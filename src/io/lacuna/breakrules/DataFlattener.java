package io.lacuna.breakrules;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * Lays the compiled tables, trie, status values and rule text out in a single binary image.
 *
 * <pre>
 *   0   magic            32   trie, trieLen
 *   4   formatVersion    40   statusTable, statusTableLen
 *   8   length           48   ruleSource, ruleSourceLen
 *   12  catCount         56   reserved
 *   16  fTable, fTableLen
 *   24  rTable, rTableLen
 * </pre>
 *
 * All integers are little-endian. Every section starts on an 8-byte boundary. Table and status lengths include their
 * padding; the trie and rule source lengths don't, and the rule source length excludes its terminating zero.
 */
public class DataFlattener {

  public static final int MAGIC = 0xb1a0;
  public static final byte[] FORMAT_VERSION = {5, 0, 0, 0};

  public static final int HEADER_SIZE = 80;

  static final int MAGIC_OFFSET = 0;
  static final int VERSION_OFFSET = 4;
  static final int LENGTH_OFFSET = 8;
  static final int CAT_COUNT_OFFSET = 12;
  static final int FTABLE_OFFSET = 16;
  static final int RTABLE_OFFSET = 24;
  static final int TRIE_OFFSET = 32;
  static final int STATUS_OFFSET = 40;
  static final int RULES_OFFSET = 48;

  private DataFlattener() {
  }

  /**
   * @param strippedRules the rule text to store, usually the output of {@link RuleScanner#stripRules(String)}
   * @return a new image holding everything needed to find boundaries with these rules
   */
  public static byte[] flatten(StateTableBuilder table, CategoryBuilder categories, RuleStatusTable statusTable,
                               String strippedRules) {
    if (table.columnCount() != categories.categoryCount()) {
      throw new IllegalStateException("table has " + table.columnCount() + " columns but there are "
              + categories.categoryCount() + " categories");
    }

    int forwardSize = Utils.align8(table.tableSize());
    int reverseSize = Utils.align8(table.safeTableSize());
    int trieTrueSize = categories.trieSize();
    int trieSize = Utils.align8(trieTrueSize);
    int statusSize = Utils.align8(statusTable.size() * 4);
    int rulesTrueSize = strippedRules.length() * 2;
    int rulesSize = Utils.align8(rulesTrueSize + 2);

    int forwardStart = HEADER_SIZE;
    int reverseStart = forwardStart + forwardSize;
    int trieStart = reverseStart + reverseSize;
    int statusStart = trieStart + trieSize;
    int rulesStart = statusStart + statusSize;
    int length = rulesStart + rulesSize;

    byte[] image = new byte[length];
    ByteBuffer buf = ByteBuffer.wrap(image).order(ByteOrder.LITTLE_ENDIAN);

    buf.putInt(MAGIC_OFFSET, MAGIC);
    for (int i = 0; i < FORMAT_VERSION.length; i++) {
      buf.put(VERSION_OFFSET + i, FORMAT_VERSION[i]);
    }
    buf.putInt(LENGTH_OFFSET, length);
    buf.putInt(CAT_COUNT_OFFSET, categories.categoryCount());
    putSection(buf, FTABLE_OFFSET, forwardStart, forwardSize);
    putSection(buf, RTABLE_OFFSET, reverseStart, reverseSize);
    putSection(buf, TRIE_OFFSET, trieStart, trieTrueSize);
    putSection(buf, STATUS_OFFSET, statusStart, statusSize);
    putSection(buf, RULES_OFFSET, rulesStart, rulesTrueSize);

    table.exportTable(section(buf, forwardStart, forwardSize));
    table.exportSafeTable(section(buf, reverseStart, reverseSize));
    categories.serializeTrie(section(buf, trieStart, trieSize));

    ByteBuffer status = section(buf, statusStart, statusSize);
    for (int v : statusTable.toArray()) {
      status.putInt(v);
    }

    // the terminator is already zero
    section(buf, rulesStart, rulesSize).put(strippedRules.getBytes(StandardCharsets.UTF_16LE));

    return image;
  }

  private static void putSection(ByteBuffer buf, int headerOffset, int start, int len) {
    buf.putInt(headerOffset, start);
    buf.putInt(headerOffset + 4, len);
  }

  private static ByteBuffer section(ByteBuffer buf, int start, int size) {
    ByteBuffer dup = buf.duplicate();
    dup.position(start).limit(start + size);
    return dup.slice().order(ByteOrder.LITTLE_ENDIAN);
  }
}
