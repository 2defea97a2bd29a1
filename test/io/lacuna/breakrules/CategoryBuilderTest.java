package io.lacuna.breakrules;

import com.ibm.icu.util.CodePointTrie;
import org.junit.Test;

import java.nio.ByteBuffer;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.Assert.fail;

public class CategoryBuilderTest {

  private static CategoryBuilder categorize(String rules) throws RuleSyntaxException {
    CategoryBuilder categories = new CategoryBuilder(new RuleScanner(rules).parse().setNodes());
    categories.buildRanges();
    return categories;
  }

  @Test
  public void testNoSets() throws RuleSyntaxException {
    CategoryBuilder categories = categorize("");
    assertThat(categories.categoryCount(), is(4));
    assertThat(categories.category(0), is(3));
    assertThat(categories.category(0x10FFFF), is(3));
    assertThat(categories.sawBOF(), is(false));
  }

  @Test
  public void testOverlappingSets() throws RuleSyntaxException {
    CategoryBuilder categories = categorize("[a-c] [b-d];");

    // outside, a, b-c, d
    assertThat(categories.categoryCount(), is(7));
    assertThat(categories.category('0'), is(3));
    assertThat(categories.category('z'), is(3));
    assertThat(categories.category('a'), is(4));
    assertThat(categories.category('b'), is(5));
    assertThat(categories.category('c'), is(5));
    assertThat(categories.category('d'), is(6));

    assertThat(categories.firstChar(3), is(0));
    assertThat(categories.firstChar(5), is((int) 'b'));
    assertThat(categories.firstChar(2), is(-1));
  }

  @Test
  public void testSetNodesGetCategoryLeaves() throws RuleSyntaxException {
    ParsedRules parsed = new RuleScanner("[a-c] [b-d];").parse();
    new CategoryBuilder(parsed.setNodes()).buildRanges();

    RuleNode first = parsed.setNodes().nth(0);
    assertThat(first.left().type(), is(RuleNode.Type.OP_OR));
    assertThat(first.findNodes(RuleNode.Type.LEAF_CHAR).stream().map(RuleNode::val).toArray(),
            is(new Object[]{4, 5}));

    RuleNode second = parsed.setNodes().nth(1);
    assertThat(second.findNodes(RuleNode.Type.LEAF_CHAR).stream().map(RuleNode::val).toArray(),
            is(new Object[]{5, 6}));
  }

  @Test
  public void testBofAndEof() throws RuleSyntaxException {
    ParsedRules parsed = new RuleScanner("[{bof}] [a{eof}];").parse();
    CategoryBuilder categories = new CategoryBuilder(parsed.setNodes());
    categories.buildRanges();

    assertThat(categories.sawBOF(), is(true));
    assertThat(parsed.setNodes().nth(0).left().val(), is(CategoryBuilder.BOF));
    assertThat(parsed.setNodes().nth(1).findNodes(RuleNode.Type.LEAF_CHAR).stream().map(RuleNode::val).toArray(),
            is(new Object[]{4, CategoryBuilder.EOF}));
  }

  @Test
  public void testMergeCategories() throws RuleSyntaxException {
    CategoryBuilder categories = categorize("[a-c] [b-d];");
    categories.mergeCategories(4, 6);

    assertThat(categories.categoryCount(), is(6));
    assertThat(categories.category('a'), is(4));
    assertThat(categories.category('d'), is(4));
    assertThat(categories.category('b'), is(5));

    categories.mergeCategories(3, 5);
    assertThat(categories.categoryCount(), is(5));
    assertThat(categories.category('b'), is(3));
    assertThat(categories.category('a'), is(4));
  }

  @Test
  public void testReservedCategoriesCantBeMerged() throws RuleSyntaxException {
    CategoryBuilder categories = categorize("[a-c] [b-d];");
    for (int[] pair : new int[][]{{1, 2}, {2, 4}, {0, 3}, {5, 4}, {4, 4}, {4, 7}}) {
      try {
        categories.mergeCategories(pair[0], pair[1]);
        fail("merged " + pair[1] + " into " + pair[0]);
      } catch (IllegalArgumentException e) {
        // expected
      }
    }
    assertThat(categories.categoryCount(), is(7));
  }

  @Test
  public void testTrie() throws RuleSyntaxException {
    CategoryBuilder categories = categorize("[a-c] [b-d] [\\U0001F600];");
    categories.mergeCategories(4, 6);
    categories.buildTrie();

    ByteBuffer buf = ByteBuffer.allocate(categories.trieSize());
    categories.serializeTrie(buf);
    assertThat(buf.position(), is(categories.trieSize()));

    buf.flip();
    CodePointTrie trie = CodePointTrie.fromBinary(null, null, buf);
    assertThat(trie.getValueWidth(), is(CodePointTrie.ValueWidth.BITS_8));
    for (int c : new int[]{0, '0', 'a', 'b', 'c', 'd', 'e', 0x1F600, 0x10FFFF}) {
      assertThat(trie.get(c), is(categories.category(c)));
    }

    try {
      categories.mergeCategories(3, 4);
      fail();
    } catch (IllegalStateException e) {
      // expected
    }
  }

  @Test(expected = IllegalStateException.class)
  public void testTrieNeedsRanges() {
    new CategoryBuilder(new ParsedRules().setNodes()).buildTrie();
  }
}
