package io.lacuna.breakrules;

import com.ibm.icu.util.CodePointTrie;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

import static io.lacuna.breakrules.DataFlattener.*;

/**
 * A read-only view of an image produced by {@link DataFlattener}. Every section is located from the header alone.
 */
public class BreakData {

  public enum Section {
    FORWARD_TABLE(FTABLE_OFFSET),
    REVERSE_TABLE(RTABLE_OFFSET),
    TRIE(TRIE_OFFSET),
    STATUS_TABLE(STATUS_OFFSET),
    RULE_SOURCE(RULES_OFFSET);

    final int headerOffset;

    Section(int headerOffset) {
      this.headerOffset = headerOffset;
    }
  }

  /**
   * A row-by-row view of a serialized state table.
   */
  public static class StateTable {
    private final ByteBuffer buf;
    private final int stateCount, rowLength, flags;

    StateTable(ByteBuffer buf) {
      this.buf = buf;
      if (buf.limit() == 0) {
        stateCount = rowLength = flags = 0;
      } else {
        stateCount = buf.getInt(0);
        rowLength = buf.getInt(4);
        flags = buf.getInt(8);
        if (StateTableBuilder.TABLE_HEADER_SIZE + (long) stateCount * rowLength > buf.limit()) {
          throw new IllegalArgumentException("state table overruns its section");
        }
      }
    }

    public int stateCount() {
      return stateCount;
    }

    public int rowLength() {
      return rowLength;
    }

    public int flags() {
      return flags;
    }

    public int categoryCount() {
      return rowLength == 0 ? 0 : (rowLength - StateTableBuilder.ROW_HEADER_SIZE) / 2;
    }

    public int accepting(int state) {
      return buf.getShort(row(state));
    }

    public int lookAhead(int state) {
      return buf.getShort(row(state) + 2);
    }

    public int tagIndex(int state) {
      return buf.getShort(row(state) + 4);
    }

    public int next(int state, int category) {
      if (category < 0 || category >= categoryCount()) {
        throw new IndexOutOfBoundsException("no category " + category);
      }
      return buf.getShort(row(state) + StateTableBuilder.ROW_HEADER_SIZE + 2 * category) & 0xFFFF;
    }

    private int row(int state) {
      if (state < 0 || state >= stateCount) {
        throw new IndexOutOfBoundsException("no state " + state);
      }
      return StateTableBuilder.TABLE_HEADER_SIZE + state * rowLength;
    }
  }

  private final ByteBuffer buf;

  private BreakData(ByteBuffer buf) {
    this.buf = buf;
  }

  /**
   * @throws IllegalArgumentException if {@code image} isn't a complete image of a supported format
   */
  public static BreakData wrap(byte[] image) {
    if (image.length < HEADER_SIZE) {
      throw new IllegalArgumentException("image is smaller than its header");
    }

    ByteBuffer buf = ByteBuffer.wrap(image).order(ByteOrder.LITTLE_ENDIAN);
    if (buf.getInt(MAGIC_OFFSET) != MAGIC) {
      throw new IllegalArgumentException(String.format("bad magic %x", buf.getInt(MAGIC_OFFSET)));
    }
    if (buf.get(VERSION_OFFSET) != FORMAT_VERSION[0]) {
      throw new IllegalArgumentException("unsupported format version " + buf.get(VERSION_OFFSET));
    }
    if (buf.getInt(LENGTH_OFFSET) != image.length) {
      throw new IllegalArgumentException("header length " + buf.getInt(LENGTH_OFFSET)
              + " doesn't match image length " + image.length);
    }

    BreakData data = new BreakData(buf);
    for (Section s : Section.values()) {
      long end = (long) data.offset(s) + data.length(s);
      if (data.offset(s) < HEADER_SIZE || end > image.length) {
        throw new IllegalArgumentException(s + " lies outside the image");
      }
    }
    return data;
  }

  public int length() {
    return buf.getInt(LENGTH_OFFSET);
  }

  public byte[] formatVersion() {
    byte[] version = new byte[FORMAT_VERSION.length];
    for (int i = 0; i < version.length; i++) {
      version[i] = buf.get(VERSION_OFFSET + i);
    }
    return version;
  }

  public int categoryCount() {
    return buf.getInt(CAT_COUNT_OFFSET);
  }

  public int offset(Section s) {
    return buf.getInt(s.headerOffset);
  }

  /**
   * @return the section length recorded in the header, which is padded for the tables and status values
   */
  public int length(Section s) {
    return buf.getInt(s.headerOffset + 4);
  }

  /**
   * @return a little-endian view of the section's recorded bytes
   */
  public ByteBuffer section(Section s) {
    ByteBuffer dup = buf.duplicate();
    dup.position(offset(s)).limit(offset(s) + length(s));
    return dup.slice().order(ByteOrder.LITTLE_ENDIAN);
  }

  public StateTable forwardTable() {
    return new StateTable(section(Section.FORWARD_TABLE));
  }

  public StateTable reverseTable() {
    return new StateTable(section(Section.REVERSE_TABLE));
  }

  /**
   * @return the status section as ints, including any zero padding at the end
   */
  public int[] statusValues() {
    ByteBuffer status = section(Section.STATUS_TABLE);
    int[] values = new int[status.limit() / 4];
    for (int i = 0; i < values.length; i++) {
      values[i] = status.getInt(i * 4);
    }
    return values;
  }

  public String ruleSource() {
    ByteBuffer rules = section(Section.RULE_SOURCE);
    byte[] bytes = new byte[rules.limit()];
    rules.get(bytes);
    return new String(bytes, StandardCharsets.UTF_16LE);
  }

  public CodePointTrie trie() {
    return CodePointTrie.fromBinary(null, null, section(Section.TRIE));
  }
}
