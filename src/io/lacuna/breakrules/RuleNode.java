package io.lacuna.breakrules;

import com.ibm.icu.text.UnicodeSet;
import io.lacuna.bifurcan.*;

/**
 * A node in a rule parse tree.
 *
 * Leaf nodes are set references, category leaves, lookahead markers, status tags and end markers. Set references
 * point at a shared {@link Type#USET} node, which is owned by the set-node list of the {@link ParsedRules} and never
 * cloned.
 */
public class RuleNode {

  public enum Type {
    SET_REF,
    USET,
    VAR_REF,
    LEAF_CHAR,
    LOOK_AHEAD,
    TAG,
    END_MARK,
    OP_CAT,
    OP_OR,
    OP_STAR,
    OP_PLUS,
    OP_QUESTION
  }

  final Type type;

  RuleNode left, right;

  /**
   * the category for {@code LEAF_CHAR}, the status value for {@code TAG}, the rule number for {@code LOOK_AHEAD} and
   * lookahead {@code END_MARK} nodes
   */
  int val;

  String text;
  int sourceOffset;

  // USET only
  UnicodeSet set;

  boolean lookAheadEnd;
  boolean ruleRoot;
  boolean chainIn;

  boolean nullable;
  LinearSet<RuleNode> firstPos = new LinearSet<>();
  LinearSet<RuleNode> lastPos = new LinearSet<>();
  LinearSet<RuleNode> followPos = new LinearSet<>();

  RuleNode(Type type) {
    this.type = type;
  }

  static RuleNode of(Type type, RuleNode left, RuleNode right) {
    RuleNode n = new RuleNode(type);
    n.left = left;
    n.right = right;
    return n;
  }

  static RuleNode leaf(int category) {
    RuleNode n = new RuleNode(Type.LEAF_CHAR);
    n.val = category;
    return n;
  }

  public Type type() {
    return type;
  }

  public int val() {
    return val;
  }

  public String text() {
    return text;
  }

  public RuleNode left() {
    return left;
  }

  public RuleNode right() {
    return right;
  }

  public UnicodeSet set() {
    return set;
  }

  /**
   * @return true if the node is a position in the sense of the followpos construction
   */
  boolean isPosition() {
    return type == Type.LEAF_CHAR || type == Type.END_MARK || type == Type.LOOK_AHEAD || type == Type.TAG;
  }

  ////

  /**
   * @return a deep copy of the tree, with variable references replaced by copies of their definitions and set
   * nodes shared rather than copied
   */
  RuleNode cloneTree() {
    if (type == Type.VAR_REF) {
      RuleNode n = left.cloneTree();
      if (ruleRoot) {
        n.ruleRoot = true;
        n.chainIn = chainIn;
      }
      return n;
    } else if (type == Type.USET) {
      return this;
    }

    RuleNode n = new RuleNode(type);
    n.val = val;
    n.text = text;
    n.sourceOffset = sourceOffset;
    n.set = set;
    n.lookAheadEnd = lookAheadEnd;
    n.ruleRoot = ruleRoot;
    n.chainIn = chainIn;
    n.left = left == null ? null : left.cloneTree();
    n.right = right == null ? null : right.cloneTree();
    return n;
  }

  /**
   * Replaces each set reference below this node with a copy of the set's category leaves.
   */
  void flattenSets() {
    if (left != null) {
      if (left.type == Type.SET_REF) {
        left = expandSet(left);
      } else {
        left.flattenSets();
      }
    }
    if (right != null) {
      if (right.type == Type.SET_REF) {
        right = expandSet(right);
      } else {
        right.flattenSets();
      }
    }
  }

  private static RuleNode expandSet(RuleNode setRef) {
    RuleNode uset = setRef.left;
    if (uset.left == null) {
      throw new IllegalStateException("set " + uset.text + " has no categories");
    }
    RuleNode replacement = uset.left.cloneTree();
    replacement.ruleRoot = setRef.ruleRoot;
    replacement.chainIn = setRef.chainIn;
    return replacement;
  }

  /**
   * Appends every node of the given type, in pre-order.
   */
  void findNodes(Type t, LinearList<RuleNode> accumulator) {
    if (type == t) {
      accumulator.addLast(this);
    }
    if (left != null) {
      left.findNodes(t, accumulator);
    }
    if (right != null) {
      right.findNodes(t, accumulator);
    }
  }

  LinearList<RuleNode> findNodes(Type t) {
    LinearList<RuleNode> accumulator = new LinearList<>();
    findNodes(t, accumulator);
    return accumulator;
  }

  ////

  void dump(StringBuilder sb, int depth) {
    for (int i = 0; i < depth; i++) {
      sb.append("  ");
    }
    sb.append(type);
    switch (type) {
      case LEAF_CHAR:
      case TAG:
      case LOOK_AHEAD:
      case END_MARK:
        sb.append(' ').append(val);
        break;
      case SET_REF:
      case USET:
      case VAR_REF:
        sb.append(' ').append(text);
        break;
      default:
        break;
    }
    if (ruleRoot) {
      sb.append(" (rule");
      sb.append(chainIn ? ", chain-in)" : ")");
    }
    sb.append('\n');

    // a set reference's child is the shared set node, already dumped with the set list
    if (type == Type.SET_REF || type == Type.VAR_REF) {
      return;
    }
    if (left != null) {
      left.dump(sb, depth + 1);
    }
    if (right != null) {
      right.dump(sb, depth + 1);
    }
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    dump(sb, 0);
    return sb.toString();
  }
}
