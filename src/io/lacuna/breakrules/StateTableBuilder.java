package io.lacuna.breakrules;

import com.ibm.icu.lang.UCharacter;
import com.ibm.icu.lang.UProperty;
import io.lacuna.bifurcan.*;

import java.nio.ByteBuffer;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds the forward state table from the forward rule tree using the followpos construction (Aho, Sethi, Ullman
 * 3.9), and the safe-reverse table from the forward table.
 *
 * State 0 is the stop state and state 1 the start state. Each row holds one next state per character category.
 */
public class StateTableBuilder {

  private static final Logger LOGGER = Logger.getLogger(StateTableBuilder.class.getName());

  public static final int LOOKAHEAD_HARD_BREAK = 1;
  public static final int BOF_REQUIRED = 2;

  static final int TABLE_HEADER_SIZE = 16;
  static final int ROW_HEADER_SIZE = 8;

  private static final int STOP_STATE = 0;
  private static final int START_STATE = 1;

  private final ParsedRules rules;
  private final CategoryBuilder categories;

  private LinearList<StateDescriptor> states = new LinearList<>();
  private LinearList<int[]> safeTable;
  private int columns;
  private boolean bofRequired;

  public StateTableBuilder(ParsedRules rules, CategoryBuilder categories) {
    this.rules = rules;
    this.categories = categories;
    this.columns = categories.categoryCount();
  }

  // a table assembled row by row, with no rules behind it
  StateTableBuilder(int columns) {
    this.rules = null;
    this.categories = null;
    this.columns = columns;
  }

  StateTableBuilder addState(int accepting, int lookAhead, int tagsIdx, int... next) {
    if (next.length != columns) {
      throw new IllegalArgumentException("expected " + columns + " columns, got " + next.length);
    }
    StateDescriptor sd = new StateDescriptor(new LinearSet<>(), columns);
    sd.accepting = accepting;
    sd.lookAhead = lookAhead;
    sd.tagsIdx = tagsIdx;
    sd.next = next.clone();
    states.addLast(sd);
    return this;
  }

  /// forward table

  public void buildForwardTable() {
    if (states.size() > 0) {
      throw new IllegalStateException("forward table has already been built");
    }

    columns = categories.categoryCount();
    if (rules.forwardTree == null) {
      LOGGER.fine("no forward rules, forward table is empty");
      return;
    }

    // copying the tree replaces each variable reference with its own copy of the definition
    RuleNode tree = rules.forwardTree.cloneTree();

    bofRequired = categories.sawBOF();
    if (bofRequired) {
      RuleNode bof = RuleNode.leaf(CategoryBuilder.BOF);
      bof.chainIn = true;
      tree = RuleNode.of(RuleNode.Type.OP_CAT, bof, tree);
    }

    tree = RuleNode.of(RuleNode.Type.OP_CAT, tree, new RuleNode(RuleNode.Type.END_MARK));
    tree.flattenSets();

    calcNullable(tree);
    calcFirstPos(tree);
    calcLastPos(tree);
    calcFollowPos(tree);

    if (rules.chainRules) {
      calcChainedFollowPos(tree);
    }
    if (bofRequired) {
      bofFixup(tree.left.left, tree.left.right);
    }

    buildStateTable(tree);
    flagAcceptingStates(tree);
    flagLookAheadStates(tree);
    flagTaggedStates(tree);
    mergeRuleStatusVals();

    if (LOGGER.isLoggable(Level.FINE)) {
      LOGGER.fine("forward table has " + states.size() + " states, " + columns + " categories");
    }
  }

  private static void calcNullable(RuleNode n) {
    if (n == null) {
      return;
    }

    switch (n.type) {
      case SET_REF:
      case END_MARK:
      case LEAF_CHAR:
        n.nullable = false;
        return;
      case LOOK_AHEAD:
      case TAG:
        n.nullable = true;
        return;
      default:
        break;
    }

    calcNullable(n.left);
    calcNullable(n.right);

    switch (n.type) {
      case OP_OR:
        n.nullable = n.left.nullable || n.right.nullable;
        break;
      case OP_CAT:
        n.nullable = n.left.nullable && n.right.nullable;
        break;
      case OP_STAR:
      case OP_QUESTION:
        n.nullable = true;
        break;
      case OP_PLUS:
        n.nullable = n.left.nullable;
        break;
      default:
        n.nullable = false;
        break;
    }
  }

  private static void calcFirstPos(RuleNode n) {
    if (n == null) {
      return;
    }
    if (n.isPosition()) {
      n.firstPos.add(n);
      return;
    }

    calcFirstPos(n.left);
    calcFirstPos(n.right);

    switch (n.type) {
      case OP_OR:
        Utils.addAll(n.firstPos, n.left.firstPos);
        Utils.addAll(n.firstPos, n.right.firstPos);
        break;
      case OP_CAT:
        Utils.addAll(n.firstPos, n.left.firstPos);
        if (n.left.nullable) {
          Utils.addAll(n.firstPos, n.right.firstPos);
        }
        break;
      case OP_STAR:
      case OP_QUESTION:
      case OP_PLUS:
        Utils.addAll(n.firstPos, n.left.firstPos);
        break;
      default:
        break;
    }
  }

  private static void calcLastPos(RuleNode n) {
    if (n == null) {
      return;
    }
    if (n.isPosition()) {
      n.lastPos.add(n);
      return;
    }

    calcLastPos(n.left);
    calcLastPos(n.right);

    switch (n.type) {
      case OP_OR:
        Utils.addAll(n.lastPos, n.left.lastPos);
        Utils.addAll(n.lastPos, n.right.lastPos);
        break;
      case OP_CAT:
        Utils.addAll(n.lastPos, n.right.lastPos);
        if (n.right.nullable) {
          Utils.addAll(n.lastPos, n.left.lastPos);
        }
        break;
      case OP_STAR:
      case OP_QUESTION:
      case OP_PLUS:
        Utils.addAll(n.lastPos, n.left.lastPos);
        break;
      default:
        break;
    }
  }

  private static void calcFollowPos(RuleNode n) {
    if (n == null || n.isPosition()) {
      return;
    }

    calcFollowPos(n.left);
    calcFollowPos(n.right);

    if (n.type == RuleNode.Type.OP_CAT) {
      for (RuleNode i : n.left.lastPos) {
        Utils.addAll(i.followPos, n.right.firstPos);
      }
    }

    if (n.type == RuleNode.Type.OP_STAR || n.type == RuleNode.Type.OP_PLUS) {
      for (RuleNode i : n.lastPos) {
        Utils.addAll(i.followPos, n.firstPos);
      }
    }
  }

  // lets a match continue into the start of any rule that allows chaining, from any position that can end a match
  private void calcChainedFollowPos(RuleNode tree) {
    LinearList<RuleNode> endMarkers = tree.findNodes(RuleNode.Type.END_MARK);

    LinearSet<RuleNode> matchStarts = new LinearSet<>();
    LinearList<RuleNode> ruleRoots = new LinearList<>();
    findRuleRoots(tree, ruleRoots);
    for (RuleNode root : ruleRoots) {
      if (root.chainIn) {
        Utils.addAll(matchStarts, root.firstPos);
      }
    }

    for (RuleNode leaf : tree.findNodes(RuleNode.Type.LEAF_CHAR)) {
      boolean endsMatch = endMarkers.stream().anyMatch(leaf.followPos::contains);
      if (!endsMatch) {
        continue;
      }

      if (rules.lbcmNoChain) {
        int c = categories.firstChar(leaf.val);
        if (c >= 0 && UCharacter.getIntPropertyValue(c, UProperty.LINE_BREAK) == UCharacter.LineBreak.COMBINING_MARK) {
          continue;
        }
      }

      for (RuleNode start : matchStarts) {
        if (start != leaf && start.type == RuleNode.Type.LEAF_CHAR && start.val == leaf.val) {
          Utils.addAll(leaf.followPos, start.followPos);
        }
      }
    }
  }

  private static void findRuleRoots(RuleNode n, LinearList<RuleNode> accumulator) {
    if (n == null) {
      return;
    }
    if (n.ruleRoot) {
      accumulator.addLast(n);
      return;
    }
    findRuleRoots(n.left, accumulator);
    findRuleRoots(n.right, accumulator);
  }

  // a {bof} written into a rule can be matched by the implicit {bof} at the start of the tree
  private static void bofFixup(RuleNode bof, RuleNode rest) {
    for (RuleNode start : rest.firstPos) {
      if (start.type == RuleNode.Type.LEAF_CHAR && start.val == bof.val) {
        Utils.addAll(bof.followPos, start.followPos);
      }
    }
  }

  private void buildStateTable(RuleNode tree) {
    states.addLast(new StateDescriptor(new LinearSet<>(), columns));
    states.addLast(new StateDescriptor(tree.firstPos, columns));

    LinearMap<ISet<RuleNode>, Integer> index = new LinearMap<>();
    index.put(tree.firstPos, START_STATE);

    for (int t = START_STATE; t < states.size(); t++) {
      StateDescriptor sd = states.nth(t);
      IMap<Integer, ISet<RuleNode>> byCategory = Utils.groupBy(
              Utils.toSet(sd.positions.stream().filter(p -> p.type == RuleNode.Type.LEAF_CHAR)),
              p -> p.val);

      for (int category = 1; category < columns; category++) {
        ISet<RuleNode> matching = byCategory.get(category, null);
        if (matching == null) {
          continue;
        }

        LinearSet<RuleNode> follow = new LinearSet<>();
        matching.forEach(p -> Utils.addAll(follow, p.followPos));

        Integer next = index.get(follow, null);
        if (next == null) {
          next = (int) states.size();
          states.addLast(new StateDescriptor(follow, columns));
          index.put(follow, next);
        }
        sd.next[category] = next;
      }
    }
  }

  private void flagAcceptingStates(RuleNode tree) {
    for (RuleNode end : tree.findNodes(RuleNode.Type.END_MARK)) {
      for (StateDescriptor sd : states) {
        if (!sd.positions.contains(end)) {
          continue;
        }

        if (sd.accepting == 0) {
          sd.accepting = end.val == 0 ? -1 : end.val;
        }
        // a state accepting both a lookahead and a plain rule takes the lookahead
        if (sd.accepting == -1 && end.val != 0) {
          sd.accepting = end.val;
        }
        if (end.lookAheadEnd) {
          sd.lookAhead = sd.accepting;
        }
      }
    }
  }

  private void flagLookAheadStates(RuleNode tree) {
    for (RuleNode lookAhead : tree.findNodes(RuleNode.Type.LOOK_AHEAD)) {
      for (StateDescriptor sd : states) {
        if (sd.positions.contains(lookAhead)) {
          sd.lookAhead = lookAhead.val;
        }
      }
    }
  }

  private void flagTaggedStates(RuleNode tree) {
    for (RuleNode tag : tree.findNodes(RuleNode.Type.TAG)) {
      for (StateDescriptor sd : states) {
        if (sd.positions.contains(tag)) {
          sd.tagVals.add(tag.val);
        }
      }
    }
  }

  private void mergeRuleStatusVals() {
    for (StateDescriptor sd : states) {
      sd.tagsIdx = sd.tagVals.isEmpty() ? 0 : rules.statusTable.indexOf(sd.tagVals);
    }
  }

  /// minimization

  /**
   * @return the first pair of categories, both at or above {@code start}, whose columns are identical in every
   * state, if any
   */
  public Optional<IntPair> findDuplicateCategoryFrom(int start) {
    if (states.size() == 0) {
      return Optional.empty();
    }

    for (int first = start; first < columns - 1; first++) {
      for (int second = first + 1; second < columns; second++) {
        if (columnsEqual(first, second)) {
          return Optional.of(new IntPair(first, second));
        }
      }
    }
    return Optional.empty();
  }

  private boolean columnsEqual(int a, int b) {
    for (StateDescriptor sd : states) {
      if (sd.next[a] != sd.next[b]) {
        return false;
      }
    }
    return true;
  }

  public void removeColumn(int column) {
    if (column < 0 || column >= columns) {
      throw new IllegalArgumentException("no column " + column);
    }
    for (StateDescriptor sd : states) {
      sd.next = Utils.removeIndex(sd.next, column);
    }
    columns--;
  }

  /**
   * Merges every state that is equivalent to a lower-numbered state into that state.
   *
   * @return the number of states removed
   */
  public int removeDuplicateStates() {
    int removed = 0;
    // the stop state is never merged; the start state can absorb a later duplicate
    int from = START_STATE;
    for (; ; ) {
      IntPair dupl = findDuplicateState(from);
      if (dupl == null) {
        return removed;
      }
      removeState(dupl);
      from = dupl.first;
      removed++;
    }
  }

  private IntPair findDuplicateState(int from) {
    int numStates = (int) states.size();
    for (int first = from; first < numStates - 1; first++) {
      StateDescriptor a = states.nth(first);
      for (int second = first + 1; second < numStates; second++) {
        if (a.equivalent(states.nth(second), first, second)) {
          return new IntPair(first, second);
        }
      }
    }
    return null;
  }

  private void removeState(IntPair dupl) {
    LinearList<StateDescriptor> remaining = new LinearList<>();
    for (int i = 0; i < states.size(); i++) {
      if (i != dupl.second) {
        remaining.addLast(states.nth(i));
      }
    }
    states = remaining;

    for (StateDescriptor sd : states) {
      renumber(sd.next, dupl);
    }
  }

  private static void renumber(int[] next, IntPair dupl) {
    for (int col = 0; col < next.length; col++) {
      if (next[col] == dupl.second) {
        next[col] = dupl.first;
      } else if (next[col] > dupl.second) {
        next[col]--;
      }
    }
  }

  /// safe reverse table

  /**
   * Builds the table used to find a safe point to resume scanning when moving backwards through text. A pair of
   * categories is safe if running it through the forward table ends in the same state whatever state it starts
   * from; the reverse table stops on seeing such a pair, read right to left.
   */
  public void buildSafeReverseTable() {
    if (safeTable != null) {
      throw new IllegalStateException("safe reverse table has already been built");
    }
    safeTable = new LinearList<>();

    int numStates = (int) states.size();
    if (numStates == 0) {
      return;
    }

    LinearList<IntPair> safePairs = new LinearList<>();
    for (int c1 = 0; c1 < columns; c1++) {
      for (int c2 = 0; c2 < columns; c2++) {
        int wanted = -1;
        int end = 0;
        for (int start = START_STATE; start < numStates; start++) {
          int s2 = states.nth(start).next[c1];
          end = states.nth(s2).next[c2];
          if (wanted < 0) {
            wanted = end;
          } else if (wanted != end) {
            break;
          }
        }
        if (wanted == end) {
          safePairs.addLast(new IntPair(c1, c2));
        }
      }
    }

    // rows 0 and 1 are the stop and start states, then one row per category just seen
    int[] startRow = new int[columns];
    for (int c = 0; c < columns; c++) {
      startRow[c] = c + 2;
    }
    safeTable.addLast(new int[columns]);
    safeTable.addLast(startRow);
    for (int c = 0; c < columns; c++) {
      safeTable.addLast(startRow.clone());
    }

    for (IntPair pair : safePairs) {
      safeTable.nth(pair.second + 2)[pair.first] = STOP_STATE;
    }

    int from = START_STATE;
    for (; ; ) {
      IntPair dupl = findDuplicateSafeState(from);
      if (dupl == null) {
        break;
      }
      removeSafeState(dupl);
      from = dupl.first;
    }

    if (LOGGER.isLoggable(Level.FINE)) {
      LOGGER.fine(safePairs.size() + " safe pairs, safe reverse table has " + safeTable.size() + " states");
    }
  }

  private IntPair findDuplicateSafeState(int from) {
    int numStates = (int) safeTable.size();
    for (int first = from; first < numStates - 1; first++) {
      int[] a = safeTable.nth(first);
      for (int second = first + 1; second < numStates; second++) {
        int[] b = safeTable.nth(second);
        boolean match = true;
        for (int col = 0; col < columns && match; col++) {
          int x = a[col];
          int y = b[col];
          match = x == y || ((x == first || x == second) && (y == first || y == second));
        }
        if (match) {
          return new IntPair(first, second);
        }
      }
    }
    return null;
  }

  private void removeSafeState(IntPair dupl) {
    LinearList<int[]> remaining = new LinearList<>();
    for (int i = 0; i < safeTable.size(); i++) {
      if (i != dupl.second) {
        remaining.addLast(safeTable.nth(i));
      }
    }
    safeTable = remaining;

    for (int[] row : safeTable) {
      renumber(row, dupl);
    }
  }

  /// export

  public int stateCount() {
    return (int) states.size();
  }

  public int columnCount() {
    return columns;
  }

  int[] transitions(int state) {
    return states.nth(state).next.clone();
  }

  int accepting(int state) {
    return states.nth(state).accepting;
  }

  int lookAhead(int state) {
    return states.nth(state).lookAhead;
  }

  int tagsIdx(int state) {
    return states.nth(state).tagsIdx;
  }

  boolean bofRequired() {
    return bofRequired;
  }

  int safeStateCount() {
    return (int) safeTableRows().size();
  }

  int rowLength() {
    return ROW_HEADER_SIZE + 2 * columns;
  }

  /**
   * @return the exported size of the forward table in bytes
   */
  public int tableSize() {
    return states.size() == 0 ? 0 : TABLE_HEADER_SIZE + stateCount() * rowLength();
  }

  /**
   * @return the exported size of the safe reverse table in bytes
   */
  public int safeTableSize() {
    int rows = safeStateCount();
    return rows == 0 ? 0 : TABLE_HEADER_SIZE + rows * rowLength();
  }

  public void exportTable(ByteBuffer dst) {
    if (states.size() == 0) {
      return;
    }

    int flags = 0;
    if (rules != null && rules.lookAheadHardBreak) {
      flags |= LOOKAHEAD_HARD_BREAK;
    }
    if (bofRequired) {
      flags |= BOF_REQUIRED;
    }

    writeHeader(dst, stateCount(), flags);
    for (StateDescriptor sd : states) {
      dst.putShort(toShort(sd.accepting, "accepting value"));
      dst.putShort(toShort(sd.lookAhead, "lookahead value"));
      dst.putShort(toShort(sd.tagsIdx, "status index"));
      dst.putShort((short) 0);
      writeRow(dst, sd.next);
    }
  }

  public void exportSafeTable(ByteBuffer dst) {
    IList<int[]> rows = safeTableRows();
    if (rows.size() == 0) {
      return;
    }

    writeHeader(dst, (int) rows.size(), 0);
    for (int[] row : rows) {
      dst.putLong(0);
      writeRow(dst, row);
    }
  }

  private IList<int[]> safeTableRows() {
    if (safeTable == null) {
      throw new IllegalStateException("safe reverse table has not been built");
    }
    return safeTable;
  }

  private void writeHeader(ByteBuffer dst, int numStates, int flags) {
    dst.putInt(numStates);
    dst.putInt(rowLength());
    dst.putInt(flags);
    dst.putInt(0);
  }

  private static void writeRow(ByteBuffer dst, int[] next) {
    for (int n : next) {
      if (n > 0xFFFF) {
        throw new IllegalStateException("state " + n + " does not fit in a table row");
      }
      dst.putShort((short) n);
    }
  }

  private static short toShort(int value, String what) {
    if (value < Short.MIN_VALUE || value > Short.MAX_VALUE) {
      throw new IllegalStateException(what + " " + value + " does not fit in a table row");
    }
    return (short) value;
  }

  ///

  String dumpStates() {
    StringBuilder sb = new StringBuilder("state  acc   la   tag |");
    for (int c = 0; c < columns; c++) {
      sb.append(String.format(" %3d", c));
    }
    sb.append('\n');
    for (int i = 0; i < states.size(); i++) {
      sb.append(String.format("%5d ", i)).append(states.nth(i)).append('\n');
    }
    return sb.toString();
  }

  String dumpSafeTable() {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < safeTableRows().size(); i++) {
      sb.append(String.format("%5d |", i));
      for (int n : safeTable.nth(i)) {
        sb.append(String.format(" %3d", n));
      }
      sb.append('\n');
    }
    return sb.toString();
  }
}
