package io.lacuna.breakrules;

import io.lacuna.bifurcan.*;

/**
 * The output of {@link RuleScanner#parse()}: up to four rule trees, every set node they reference, the rule-status
 * list, and the options set by {@code !!} statements.
 */
public class ParsedRules {

  RuleNode forwardTree, reverseTree, safeForwardTree, safeReverseTree;

  /**
   * one entry per distinct set expression, in order of first appearance
   */
  final LinearList<RuleNode> setNodes = new LinearList<>();

  final RuleStatusTable statusTable = new RuleStatusTable();

  boolean chainRules;
  boolean lbcmNoChain;
  boolean lookAheadHardBreak;

  public RuleNode forwardTree() {
    return forwardTree;
  }

  public RuleNode reverseTree() {
    return reverseTree;
  }

  public RuleNode safeForwardTree() {
    return safeForwardTree;
  }

  public RuleNode safeReverseTree() {
    return safeReverseTree;
  }

  public IList<RuleNode> setNodes() {
    return setNodes;
  }

  public RuleStatusTable statusTable() {
    return statusTable;
  }

  public boolean chainRules() {
    return chainRules;
  }

  public boolean lookAheadHardBreak() {
    return lookAheadHardBreak;
  }

  String dump() {
    StringBuilder sb = new StringBuilder();
    dump(sb, "forward", forwardTree);
    dump(sb, "reverse", reverseTree);
    dump(sb, "safe forward", safeForwardTree);
    dump(sb, "safe reverse", safeReverseTree);
    return sb.toString();
  }

  private static void dump(StringBuilder sb, String name, RuleNode tree) {
    if (tree != null) {
      sb.append(name).append(" rules:\n");
      tree.dump(sb, 1);
    }
  }
}
