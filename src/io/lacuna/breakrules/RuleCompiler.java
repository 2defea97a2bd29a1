package io.lacuna.breakrules;

import io.lacuna.bifurcan.*;

import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Compiles break rule text into a binary image: the rules are parsed, the code space is split into categories, a
 * forward state table is built and minimized, a safe reverse table is derived from it, and everything is flattened
 * together with the category trie, status values and stripped rule text.
 *
 * <pre>
 *   byte[] image = RuleCompiler.compile(rules);
 * </pre>
 *
 * A compiler instance runs once. Setting the system property {@code breakrules.debug} to a comma separated list of
 * {@code trees}, {@code ranges}, {@code states} and {@code status} (or {@code all}) logs those intermediate results.
 */
public class RuleCompiler {

  private static final Logger LOGGER = Logger.getLogger(RuleCompiler.class.getName());

  private static final ISet<String> DEBUG = debugFlags(System.getProperty("breakrules.debug", ""));

  public enum Stage {
    NEW,
    PARSED,
    CATEGORIZED,
    FORWARD_TABLE_BUILT,
    MINIMIZED,
    SAFE_TABLE_BUILT,
    TRIE_BUILT,
    FLATTENED,
    FAILED
  }

  private final String rules;
  private Stage stage = Stage.NEW;
  private Throwable failure;
  private TableMinimizer.Result minimization;

  private ParsedRules parsed;
  private CategoryBuilder categories;
  private StateTableBuilder table;

  public RuleCompiler(String rules) {
    if (rules == null) {
      throw new IllegalArgumentException("rules must not be null");
    }
    this.rules = rules;
  }

  /**
   * @return the compiled image for {@code rules}
   * @throws RuleSyntaxException if the rules can't be parsed
   */
  public static byte[] compile(String rules) throws RuleSyntaxException {
    return new RuleCompiler(rules).build();
  }

  /**
   * Runs the whole pipeline. Whether it succeeds or fails, the intermediate trees and tables are released before this
   * returns.
   *
   * @throws RuleSyntaxException if the rules can't be parsed
   */
  public byte[] build() throws RuleSyntaxException {
    checkStage(Stage.NEW);
    try {
      parse();
      categorize();
      buildForwardTable();
      minimize();
      buildSafeTable();
      buildTrie();
      return flatten();
    } catch (RuleSyntaxException | RuntimeException | Error e) {
      stage = Stage.FAILED;
      failure = e;
      throw e;
    } finally {
      parsed = null;
      categories = null;
      table = null;
    }
  }

  public Stage stage() {
    return stage;
  }

  /**
   * @return the exception that stopped compilation, or null
   */
  public Throwable failure() {
    return failure;
  }

  /**
   * @return a summary of the minimization, or null if it hasn't run
   */
  public TableMinimizer.Result minimization() {
    return minimization;
  }

  /// stages

  private void parse() throws RuleSyntaxException {
    parsed = new RuleScanner(rules).parse();

    if (parsed.reverseTree != null || parsed.safeForwardTree != null || parsed.safeReverseTree != null) {
      LOGGER.fine("reverse and safe rules are checked but not compiled, the safe reverse table is derived from "
              + "the forward rules");
    }
    if (debug("trees")) {
      LOGGER.info("parse trees:\n" + parsed.dump());
    }
    advance(Stage.NEW, Stage.PARSED);
  }

  private void categorize() {
    checkStage(Stage.PARSED);
    categories = new CategoryBuilder(parsed.setNodes);
    categories.buildRanges();
    if (debug("ranges")) {
      LOGGER.info("ranges:\n" + categories.dumpRanges());
    }
    advance(Stage.PARSED, Stage.CATEGORIZED);
  }

  private void buildForwardTable() {
    checkStage(Stage.CATEGORIZED);
    table = new StateTableBuilder(parsed, categories);
    table.buildForwardTable();
    if (debug("states")) {
      LOGGER.info("forward table:\n" + table.dumpStates());
    }
    advance(Stage.CATEGORIZED, Stage.FORWARD_TABLE_BUILT);
  }

  private void minimize() {
    checkStage(Stage.FORWARD_TABLE_BUILT);
    minimization = TableMinimizer.minimize(categories, table);
    if (debug("states")) {
      LOGGER.info("minimized forward table:\n" + table.dumpStates());
    }
    advance(Stage.FORWARD_TABLE_BUILT, Stage.MINIMIZED);
  }

  private void buildSafeTable() {
    checkStage(Stage.MINIMIZED);
    table.buildSafeReverseTable();
    if (debug("states")) {
      LOGGER.info("safe reverse table:\n" + table.dumpSafeTable());
    }
    advance(Stage.MINIMIZED, Stage.SAFE_TABLE_BUILT);
  }

  private void buildTrie() {
    checkStage(Stage.SAFE_TABLE_BUILT);
    categories.buildTrie();
    advance(Stage.SAFE_TABLE_BUILT, Stage.TRIE_BUILT);
  }

  private byte[] flatten() {
    checkStage(Stage.TRIE_BUILT);
    if (debug("status")) {
      LOGGER.info("status values:\n" + parsed.statusTable);
    }

    byte[] image = DataFlattener.flatten(table, categories, parsed.statusTable, RuleScanner.stripRules(rules));
    advance(Stage.TRIE_BUILT, Stage.FLATTENED);

    if (LOGGER.isLoggable(Level.FINE)) {
      LOGGER.fine("compiled " + categories.categoryCount() + " categories, " + table.stateCount()
              + " states into " + image.length + " bytes");
    }
    return image;
  }

  ///

  private void checkStage(Stage expected) {
    if (stage != expected) {
      throw new IllegalStateException("expected stage " + expected + ", but compiler is at " + stage);
    }
  }

  private void advance(Stage from, Stage to) {
    checkStage(from);
    stage = to;
    LOGGER.fine(to.toString());
  }

  private static boolean debug(String flag) {
    return DEBUG.contains(flag) || DEBUG.contains("all");
  }

  private static ISet<String> debugFlags(String property) {
    return Utils.toSet(Arrays.stream(property.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty()));
  }
}
