package io.lacuna.breakrules;

import com.ibm.icu.util.CodePointTrie;
import com.ibm.icu.util.MutableCodePointTrie;
import io.lacuna.bifurcan.*;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.util.BitSet;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Partitions the code space into character categories, such that every code point in a category belongs to exactly
 * the same set expressions, and maps code points to categories with a {@link CodePointTrie}.
 *
 * Categories 0, 1 and 2 are reserved: 0 is unused, 1 is the beginning of text ({@code {bof}}), and 2 is the end of
 * text ({@code {eof}}). Ordinary categories are numbered from 3 in order of their lowest code point.
 */
public class CategoryBuilder implements TableMinimizer.CategoryMerger {

  private static final Logger LOGGER = Logger.getLogger(CategoryBuilder.class.getName());

  public static final int UNUSED = 0;
  public static final int BOF = 1;
  public static final int EOF = 2;
  public static final int FIRST_CATEGORY = 3;

  static final String BOF_STRING = "bof";
  static final String EOF_STRING = "eof";

  private static final int MAX_CODE_POINT = 0x10FFFF;

  static class Range {
    final int start, end;

    // indices into the set-node list of the sets containing this range
    final BitSet includes;

    int category;

    Range(int start, int end, BitSet includes) {
      this.start = start;
      this.end = end;
      this.includes = includes;
    }

    @Override
    public String toString() {
      return String.format("%04X-%04X: %d", start, end, category);
    }
  }

  private final IList<RuleNode> setNodes;
  private final LinearList<Range> ranges = new LinearList<>();
  private int groupCount;
  private boolean sawBOF;
  private byte[] trie;

  public CategoryBuilder(IList<RuleNode> setNodes) {
    this.setNodes = setNodes;
  }

  /**
   * Computes the categories, and attaches to every set node an alternation of leaves for the categories it covers.
   */
  public void buildRanges() {
    if (ranges.size() > 0) {
      throw new IllegalStateException("ranges have already been built");
    }

    TreeSet<Integer> boundaries = new TreeSet<>();
    boundaries.add(0);
    for (RuleNode uset : setNodes) {
      for (int i = 0; i < uset.set.getRangeCount(); i++) {
        boundaries.add(uset.set.getRangeStart(i));
        if (uset.set.getRangeEnd(i) < MAX_CODE_POINT) {
          boundaries.add(uset.set.getRangeEnd(i) + 1);
        }
      }
    }

    Integer[] starts = boundaries.toArray(new Integer[0]);
    for (int i = 0; i < starts.length; i++) {
      int start = starts[i];
      int end = i + 1 < starts.length ? starts[i + 1] - 1 : MAX_CODE_POINT;
      BitSet includes = new BitSet();
      for (int s = 0; s < setNodes.size(); s++) {
        if (setNodes.nth(s).set.contains(start)) {
          includes.set(s);
        }
      }
      ranges.addLast(new Range(start, end, includes));
    }

    LinearMap<BitSet, Integer> categories = new LinearMap<>();
    for (Range r : ranges) {
      Integer category = categories.get(r.includes, null);
      if (category == null) {
        groupCount++;
        category = groupCount + FIRST_CATEGORY - 1;
        categories.put(r.includes, category);
        addLeaf(r.includes, category);
      }
      r.category = category;
    }

    for (RuleNode uset : setNodes) {
      if (uset.set.contains(EOF_STRING)) {
        addLeaf(uset, EOF);
      }
      if (uset.set.contains(BOF_STRING)) {
        addLeaf(uset, BOF);
        sawBOF = true;
      }
    }

    if (LOGGER.isLoggable(Level.FINE)) {
      LOGGER.fine(ranges.size() + " ranges in " + categoryCount() + " categories");
    }
  }

  private void addLeaf(BitSet includes, int category) {
    for (int s = includes.nextSetBit(0); s >= 0; s = includes.nextSetBit(s + 1)) {
      addLeaf(setNodes.nth(s), category);
    }
  }

  private static void addLeaf(RuleNode uset, int category) {
    RuleNode leaf = RuleNode.leaf(category);
    uset.left = uset.left == null ? leaf : RuleNode.of(RuleNode.Type.OP_OR, uset.left, leaf);
  }

  /**
   * @return the number of categories, including the reserved ones
   */
  @Override
  public int categoryCount() {
    return groupCount + FIRST_CATEGORY;
  }

  /**
   * Folds the category {@code remove} into {@code keep}; categories above {@code remove} are renumbered down by one.
   */
  @Override
  public void mergeCategories(int keep, int remove) {
    if (keep < FIRST_CATEGORY || keep >= remove || remove >= categoryCount()) {
      throw new IllegalArgumentException("cannot merge category " + remove + " into " + keep);
    }
    if (trie != null) {
      throw new IllegalStateException("trie has already been built");
    }

    for (Range r : ranges) {
      if (r.category == remove) {
        r.category = keep;
      } else if (r.category > remove) {
        r.category--;
      }
    }
    groupCount--;
  }

  /**
   * @return true if any set contains {@code {bof}}
   */
  public boolean sawBOF() {
    return sawBOF;
  }

  /**
   * @return the category of {@code codePoint}
   */
  public int category(int codePoint) {
    long lo = 0;
    long hi = ranges.size() - 1;
    while (lo <= hi) {
      long mid = (lo + hi) >>> 1;
      Range r = ranges.nth(mid);
      if (codePoint < r.start) {
        hi = mid - 1;
      } else if (codePoint > r.end) {
        lo = mid + 1;
      } else {
        return r.category;
      }
    }
    return UNUSED;
  }

  /**
   * @return the lowest code point in {@code category}, or -1 if it has none
   */
  public int firstChar(int category) {
    for (Range r : ranges) {
      if (r.category == category) {
        return r.start;
      }
    }
    return -1;
  }

  /// trie

  public void buildTrie() {
    if (ranges.size() == 0) {
      throw new IllegalStateException("ranges have not been built");
    }

    MutableCodePointTrie mutable = new MutableCodePointTrie(UNUSED, UNUSED);
    for (Range r : ranges) {
      mutable.setRange(r.start, r.end, r.category);
    }

    CodePointTrie.ValueWidth width = categoryCount() < 255
            ? CodePointTrie.ValueWidth.BITS_8
            : CodePointTrie.ValueWidth.BITS_16;
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    mutable.buildImmutable(CodePointTrie.Type.FAST, width).toBinary(out);
    trie = out.toByteArray();
  }

  /**
   * @return the size in bytes of the serialized trie, without padding
   */
  public int trieSize() {
    return trieBytes().length;
  }

  public void serializeTrie(ByteBuffer dst) {
    dst.put(trieBytes());
  }

  private byte[] trieBytes() {
    if (trie == null) {
      throw new IllegalStateException("trie has not been built");
    }
    return trie;
  }

  ///

  String dumpRanges() {
    StringBuilder sb = new StringBuilder();
    for (Range r : ranges) {
      sb.append(r).append("  ");
      for (int s = r.includes.nextSetBit(0); s >= 0; s = r.includes.nextSetBit(s + 1)) {
        sb.append(setNodes.nth(s).text).append(' ');
      }
      sb.append('\n');
    }
    return sb.toString();
  }
}
