package io.lacuna.breakrules;

import org.junit.Test;

import java.util.Arrays;

import static io.lacuna.breakrules.BreakData.Section.*;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.Assert.fail;

public class RuleCompilerTest {

  @Test
  public void testIdenticalCategoriesAreMerged() throws RuleSyntaxException {
    RuleCompiler compiler = new RuleCompiler("$A = [a];\n$B = [b];\n$A | $B;");
    BreakData data = BreakData.wrap(compiler.build());

    assertThat(compiler.minimization().categoriesBefore, is(6));
    assertThat(compiler.minimization().categoriesAfter, is(5));
    assertThat(data.categoryCount(), is(5));
    assertThat(data.forwardTable().categoryCount(), is(5));
    assertThat(data.forwardTable().stateCount(), is(3));
    assertThat(data.length(FORWARD_TABLE), is(Utils.align8(16 + 3 * (8 + 2 * 5))));
    assertThat(data.length(FORWARD_TABLE), lessThan(Utils.align8(16 + 3 * (8 + 2 * 6))));

    assertThat(data.trie().get('a'), is(data.trie().get('b')));
    assertThat(data.trie().get('a'), not(data.trie().get('c')));
  }

  @Test
  public void testEmptyRules() throws RuleSyntaxException {
    for (String rules : new String[]{"", "  \n\t", "# only a comment\n\n"}) {
      BreakData data = BreakData.wrap(RuleCompiler.compile(rules));
      assertThat(data.categoryCount(), greaterThanOrEqualTo(3));
      assertThat(data.length(RULE_SOURCE), is(0));
      assertThat(data.length(FORWARD_TABLE), is(0));
      assertThat(data.length(REVERSE_TABLE), is(0));
      assertThat(data.forwardTable().stateCount(), is(0));
      assertThat(data.statusValues(), is(new int[]{1, 0}));
      assertThat(data.ruleSource(), is(""));
    }
  }

  @Test
  public void testSyntaxErrorIsPreserved() {
    RuleCompiler compiler = new RuleCompiler("$A = [a-z;");
    try {
      compiler.build();
      fail();
    } catch (RuleSyntaxException e) {
      assertThat(e.error(), is(RuleError.UNCLOSED_SET));
      assertThat(e.offset(), is(10));
      assertThat(compiler.failure(), sameInstance((Throwable) e));
    }
    assertThat(compiler.stage(), is(RuleCompiler.Stage.FAILED));
    assertThat(compiler.minimization(), nullValue());
  }

  @Test
  public void testUnclosedSetAtStartHasNonZeroOffset() {
    try {
      RuleCompiler.compile("[a-z;");
      fail();
    } catch (RuleSyntaxException e) {
      assertThat(e.error(), is(RuleError.UNCLOSED_SET));
      assertThat(e.offset(), greaterThan(0));
    }
  }

  @Test
  public void testCompilerIsSingleUse() throws RuleSyntaxException {
    RuleCompiler compiler = new RuleCompiler("[a];");
    compiler.build();
    assertThat(compiler.stage(), is(RuleCompiler.Stage.FLATTENED));
    assertThat(compiler.failure(), nullValue());

    try {
      compiler.build();
      fail();
    } catch (IllegalStateException e) {
      // expected
    }
  }

  @Test
  public void testDeterministic() throws RuleSyntaxException {
    for (String name : new String[]{"words.txt", "graphemes.txt"}) {
      String rules = TableWalker.rules(name);
      assertThat(name, Arrays.equals(RuleCompiler.compile(rules), RuleCompiler.compile(rules)), is(true));
    }
  }

  @Test
  public void testStrippedRulesCompileIdentically() throws RuleSyntaxException {
    for (String name : new String[]{"words.txt", "graphemes.txt"}) {
      String rules = TableWalker.rules(name);
      byte[] original = RuleCompiler.compile(rules);
      byte[] stripped = RuleCompiler.compile(RuleScanner.stripRules(rules));
      assertThat(name, Arrays.equals(original, stripped), is(true));
      assertThat(BreakData.wrap(original).ruleSource(), is(RuleScanner.stripRules(rules)));
    }
  }

  @Test
  public void testStatusTags() throws RuleSyntaxException {
    BreakData data = BreakData.wrap(RuleCompiler.compile(TableWalker.rules("words.txt")));
    BreakData.StateTable table = data.forwardTable();
    int[] status = data.statusValues();

    int afterLetter = table.next(1, data.trie().get('x'));
    int afterDigit = table.next(1, data.trie().get('7'));
    int afterSpace = table.next(1, data.trie().get(' '));

    assertThat(status[table.tagIndex(afterLetter)], is(1));
    assertThat(status[table.tagIndex(afterLetter) + 1], is(200));
    assertThat(status[table.tagIndex(afterDigit) + 1], is(100));
    assertThat(table.tagIndex(afterSpace), is(0));
  }

  @Test
  public void testWordBoundaries() throws RuleSyntaxException {
    TableWalker walker = TableWalker.of(BreakData.wrap(RuleCompiler.compile(TableWalker.rules("words.txt"))));
    assertThat(walker.boundaries("hello world 42"), is(Arrays.asList(0, 5, 6, 11, 12, 14)));
    assertThat(walker.boundaries("abc123 \r\n!"), is(Arrays.asList(0, 6, 7, 9, 10)));
  }

  @Test
  public void testLookAhead() throws RuleSyntaxException {
    BreakData data = BreakData.wrap(RuleCompiler.compile("[a] [b] / [c];\n[a] [b] [d];"));
    TableWalker walker = TableWalker.of(data);
    assertThat(walker.boundaries("abc"), is(Arrays.asList(0, 2, 3)));
    assertThat(walker.boundaries("abd"), is(Arrays.asList(0, 3)));
  }

  @Test
  public void testFlags() throws RuleSyntaxException {
    BreakData plain = BreakData.wrap(RuleCompiler.compile("[a];"));
    assertThat(plain.forwardTable().flags(), is(0));

    BreakData bof = BreakData.wrap(RuleCompiler.compile("[{bof}] [a]; [b];"));
    assertThat(bof.forwardTable().flags() & StateTableBuilder.BOF_REQUIRED, is(StateTableBuilder.BOF_REQUIRED));

    BreakData hard = BreakData.wrap(RuleCompiler.compile(TableWalker.rules("graphemes.txt")));
    assertThat(hard.forwardTable().flags() & StateTableBuilder.LOOKAHEAD_HARD_BREAK,
            is(StateTableBuilder.LOOKAHEAD_HARD_BREAK));
    assertThat(hard.reverseTable().flags(), is(0));
  }

  @Test
  public void testMinimizedImageMatchesUnminimizedTable() throws RuleSyntaxException {
    String[] samples = {
            "a\u0301 b\u0301\u200D c",
            "x\r\ny\n\u0007z",
            "\u0600\u0600a\u0308\u0308 \u0001",
            "\uAC00 abc\u0301 "
    };
    String rules = TableWalker.rules("graphemes.txt");

    ParsedRules parsed = new RuleScanner(rules).parse();
    CategoryBuilder categories = new CategoryBuilder(parsed.setNodes());
    categories.buildRanges();
    StateTableBuilder table = new StateTableBuilder(parsed, categories);
    table.buildForwardTable();
    TableWalker unminimized = TableWalker.of(table, categories, samples);

    RuleCompiler compiler = new RuleCompiler(rules);
    TableWalker compiled = TableWalker.of(BreakData.wrap(compiler.build()));

    assertThat(compiler.minimization().statesAfter, lessThanOrEqualTo(table.stateCount()));
    for (String sample : samples) {
      assertThat(sample, compiled.boundaries(sample), is(unminimized.boundaries(sample)));
    }
  }

  @Test
  public void testReverseRulesDontChangeTheImage() throws RuleSyntaxException {
    byte[] forwardOnly = RuleCompiler.compile("[a] [b];");
    byte[] withReverse = RuleCompiler.compile("[a] [b];\n!!reverse;\n[b] [a];");

    BreakData a = BreakData.wrap(forwardOnly);
    BreakData b = BreakData.wrap(withReverse);
    assertThat(b.section(FORWARD_TABLE), is(a.section(FORWARD_TABLE)));
    assertThat(b.section(REVERSE_TABLE), is(a.section(REVERSE_TABLE)));
  }
}
