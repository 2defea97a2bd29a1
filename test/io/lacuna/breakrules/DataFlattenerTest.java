package io.lacuna.breakrules;

import org.junit.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import static io.lacuna.breakrules.BreakData.Section.*;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

public class DataFlattenerTest {

  private static final BreakData.Section[] ORDER = {FORWARD_TABLE, REVERSE_TABLE, TRIE, STATUS_TABLE, RULE_SOURCE};

  // the space a section takes up in the image, which for the trie and rule source isn't what the header records
  private static int paddedSize(BreakData data, BreakData.Section s) {
    switch (s) {
      case TRIE:
        return Utils.align8(data.length(s));
      case RULE_SOURCE:
        return Utils.align8(data.length(s) + 2);
      default:
        return data.length(s);
    }
  }

  private static void checkLayout(byte[] image) {
    BreakData data = BreakData.wrap(image);

    int end = DataFlattener.HEADER_SIZE;
    for (BreakData.Section s : ORDER) {
      assertThat(s.toString(), data.offset(s) % 8, is(0));
      assertThat(s.toString(), data.offset(s), is(end));
      end = data.offset(s) + paddedSize(data, s);
    }
    assertThat(data.length(), is(end));
    assertThat(image.length, is(end));

    assertThat(data.length(FORWARD_TABLE) % 8, is(0));
    assertThat(data.length(REVERSE_TABLE) % 8, is(0));
    assertThat(data.length(STATUS_TABLE) % 8, is(0));
  }

  @Test
  public void testLayout() throws RuleSyntaxException {
    checkLayout(RuleCompiler.compile(""));
    checkLayout(RuleCompiler.compile("[a] [b];"));
    checkLayout(RuleCompiler.compile(TableWalker.rules("words.txt")));
    checkLayout(RuleCompiler.compile(TableWalker.rules("graphemes.txt")));
  }

  @Test
  public void testHeader() throws RuleSyntaxException {
    byte[] image = RuleCompiler.compile("[a] {7};");
    ByteBuffer buf = ByteBuffer.wrap(image).order(ByteOrder.LITTLE_ENDIAN);

    assertThat(buf.getInt(0), is(0xb1a0));
    assertThat(image[0], is((byte) 0xa0));
    assertThat(image[1], is((byte) 0xb1));
    assertThat(new byte[]{image[4], image[5], image[6], image[7]}, is(new byte[]{5, 0, 0, 0}));
    assertThat(buf.getInt(8), is(image.length));
    assertThat(buf.getInt(12), is(BreakData.wrap(image).forwardTable().categoryCount()));
    for (int i = 56; i < 80; i++) {
      assertThat(image[i], is((byte) 0));
    }
  }

  @Test
  public void testRuleSource() throws RuleSyntaxException {
    String rules = "# greek\n$G = [\\p{Greek}];\n$G+;   'λ' ;\n";
    byte[] image = RuleCompiler.compile(rules);
    BreakData data = BreakData.wrap(image);

    String stripped = RuleScanner.stripRules(rules);
    assertThat(stripped, is("$G=[\\p{Greek}];$G+;'λ';"));
    assertThat(data.ruleSource(), is(stripped));
    assertThat(data.length(RULE_SOURCE), is(stripped.length() * 2));

    // terminator
    int terminator = data.offset(RULE_SOURCE) + data.length(RULE_SOURCE);
    assertThat(image[terminator], is((byte) 0));
    assertThat(image[terminator + 1], is((byte) 0));
  }

  @Test
  public void testRuleSourceHasNoWhiteSpace() throws RuleSyntaxException {
    BreakData data = BreakData.wrap(RuleCompiler.compile("$A = [a];\n$B = [b];\n$A | $B;"));
    assertThat(data.ruleSource(), is("$A=[a];$B=[b];$A|$B;"));
    assertThat(data.length(RULE_SOURCE), is(40));
  }

  @Test
  public void testStatusSection() throws RuleSyntaxException {
    BreakData data = BreakData.wrap(RuleCompiler.compile("[a] {7}; [b] {3} {9};"));
    int[] status = data.statusValues();

    assertThat(status.length % 2, is(0));
    assertThat(status[0], is(1));
    assertThat(status[1], is(0));
    assertThat(status[2], is(1));
    assertThat(status[3], is(7));
    assertThat(status[4], is(2));
    assertThat(status[5], is(3));
    assertThat(status[6], is(9));
  }

  @Test
  public void testSectionsMatchBuilders() throws RuleSyntaxException {
    ParsedRules parsed = new RuleScanner("[a]+ [b]?;").parse();
    CategoryBuilder categories = new CategoryBuilder(parsed.setNodes());
    categories.buildRanges();
    StateTableBuilder table = new StateTableBuilder(parsed, categories);
    table.buildForwardTable();
    TableMinimizer.minimize(categories, table);
    table.buildSafeReverseTable();
    categories.buildTrie();

    byte[] image = DataFlattener.flatten(table, categories, parsed.statusTable(), "[a]+ [b]?;");
    BreakData data = BreakData.wrap(image);

    assertThat(data.length(FORWARD_TABLE), is(Utils.align8(table.tableSize())));
    assertThat(data.length(REVERSE_TABLE), is(Utils.align8(table.safeTableSize())));
    assertThat(data.length(TRIE), is(categories.trieSize()));
    assertThat(data.reverseTable().stateCount(), is(table.safeStateCount()));

    BreakData.StateTable forward = data.forwardTable();
    assertThat(forward.stateCount(), is(table.stateCount()));
    for (int s = 0; s < table.stateCount(); s++) {
      assertThat(forward.accepting(s), is(table.accepting(s)));
      for (int c = 0; c < table.columnCount(); c++) {
        assertThat(forward.next(s, c), is(table.transitions(s)[c]));
      }
    }
  }

  @Test(expected = IllegalStateException.class)
  public void testColumnCountMismatch() throws RuleSyntaxException {
    ParsedRules parsed = new RuleScanner("[a];").parse();
    CategoryBuilder categories = new CategoryBuilder(parsed.setNodes());
    categories.buildRanges();
    categories.buildTrie();

    StateTableBuilder table = new StateTableBuilder(2).addState(0, 0, 0, 0, 0);
    table.buildSafeReverseTable();
    DataFlattener.flatten(table, categories, parsed.statusTable(), "");
  }
}
