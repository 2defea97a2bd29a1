package io.lacuna.breakrules;

import com.ibm.icu.lang.UCharacter;
import com.ibm.icu.lang.UProperty;
import com.ibm.icu.text.UnicodeSet;
import io.lacuna.bifurcan.*;

import java.text.ParsePosition;

/**
 * Parses break rule text into rule trees.
 *
 * <pre>
 *   statement  := '!!' option ';' | '$' name '=' expression ';' | ['!'] ['^'] expression ';'
 *   expression := sequence ('|' sequence)*
 *   sequence   := item+
 *   item       := '/' | '{' digits '}' | primary ('*' | '+' | '?')*
 *   primary    := '(' expression ')' | set | '$' name | '.' | quoted | escape | literal
 * </pre>
 *
 * Comments run from {@code #} to the end of the line. Set expressions are parsed by ICU's {@link UnicodeSet}.
 */
public class RuleScanner {

  private enum Direction {
    FORWARD,
    REVERSE,
    SAFE_FORWARD,
    SAFE_REVERSE
  }

  private static final String UNEXPECTED = ")|;*+?}]=!^";

  private final String rules;
  private int pos;

  private final ParsedRules result = new ParsedRules();
  private final LinearMap<String, RuleNode> variables = new LinearMap<>();
  private final LinearMap<String, RuleNode> setsByText = new LinearMap<>();
  private final RuleSymbolTable symbols = new RuleSymbolTable(variables);

  private Direction direction = Direction.FORWARD;
  private int ruleNum = 1;
  private boolean lookAheadRule;
  private boolean parsed;

  public RuleScanner(String rules) {
    if (rules == null) {
      throw new IllegalArgumentException("rules must not be null");
    }
    this.rules = rules;
  }

  /**
   * @return the rule trees, set nodes and options described by the rule text
   * @throws RuleSyntaxException at the first syntax error
   */
  public ParsedRules parse() throws RuleSyntaxException {
    if (parsed) {
      throw new IllegalStateException("rules have already been parsed");
    }
    parsed = true;

    skipWhitespace();
    while (pos < rules.length()) {
      statement();
      skipWhitespace();
    }
    return result;
  }

  /**
   * @return the rule text with comments and all white space removed, except inside quoted literals and after a
   * backslash
   */
  public static String stripRules(String rules) {
    StringBuilder sb = new StringBuilder(rules.length());
    boolean quoted = false;
    int depth = 0;

    int i = 0;
    while (i < rules.length()) {
      int c = rules.codePointAt(i);
      int n = Character.charCount(c);

      if (quoted) {
        sb.appendCodePoint(c);
        quoted = c != '\'';
        i += n;
        continue;
      }

      if (c == '#' && depth == 0) {
        while (i < rules.length() && !isLineEnd(rules.charAt(i))) {
          i++;
        }
        continue;
      }

      if (isWhitespace(c)) {
        i += n;
        continue;
      }

      sb.appendCodePoint(c);
      i += n;

      if (c == '\\' && i < rules.length()) {
        int escaped = rules.codePointAt(i);
        sb.appendCodePoint(escaped);
        i += Character.charCount(escaped);
      } else if (c == '\'') {
        quoted = true;
      } else if (c == '[') {
        depth++;
      } else if (c == ']' && depth > 0) {
        depth--;
      }
    }

    return sb.toString();
  }

  /// statements

  private void statement() throws RuleSyntaxException {
    if (rules.startsWith("!!", pos)) {
      option();
    } else if (peek() == '$' && isDefinition()) {
      definition();
    } else {
      rule();
    }
  }

  private void option() throws RuleSyntaxException {
    int start = pos;
    pos += 2;
    int nameStart = pos;
    while (pos < rules.length() && (Character.isLetterOrDigit(rules.charAt(pos)) || rules.charAt(pos) == '_')) {
      pos++;
    }
    String name = rules.substring(nameStart, pos);

    switch (name) {
      case "chain":
        result.chainRules = true;
        break;
      case "LBCMNoChain":
        result.lbcmNoChain = true;
        break;
      case "lookAheadHardBreak":
        result.lookAheadHardBreak = true;
        break;
      case "forward":
        direction = Direction.FORWARD;
        break;
      case "reverse":
        direction = Direction.REVERSE;
        break;
      case "safe_forward":
        direction = Direction.SAFE_FORWARD;
        break;
      case "safe_reverse":
        direction = Direction.SAFE_REVERSE;
        break;
      default:
        throw error(RuleError.UNRECOGNIZED_OPTION, start, "!!" + name);
    }

    expectSemicolon();
  }

  private boolean isDefinition() {
    int saved = pos;
    pos++;
    String name = identifier();
    skipWhitespace();
    boolean definition = !name.isEmpty() && peek() == '=';
    pos = saved;
    return definition;
  }

  private void definition() throws RuleSyntaxException {
    int start = pos;
    pos++;
    String name = identifier();
    if (variables.contains(name)) {
      throw error(RuleError.VARIABLE_REDEFINITION, start, "$" + name);
    }
    skipWhitespace();
    pos++;

    RuleNode expr = expression();
    expectSemicolon();

    RuleNode definition = new RuleNode(RuleNode.Type.VAR_REF);
    definition.left = expr;
    definition.text = "$" + name;
    definition.sourceOffset = start;
    variables.put(name, definition);
  }

  private void rule() throws RuleSyntaxException {
    boolean reverseRule = false;
    boolean noChainIn = false;

    if (peek() == '!') {
      pos++;
      reverseRule = true;
      skipWhitespace();
    }
    if (peek() == '^') {
      pos++;
      noChainIn = true;
      skipWhitespace();
    }

    lookAheadRule = false;
    RuleNode rule = expression();
    expectSemicolon();

    if (lookAheadRule) {
      RuleNode end = new RuleNode(RuleNode.Type.END_MARK);
      end.val = ruleNum;
      end.lookAheadEnd = true;
      rule = RuleNode.of(RuleNode.Type.OP_CAT, rule, end);
    }

    rule.ruleRoot = true;
    rule.chainIn = result.chainRules && !noChainIn;

    attach(reverseRule ? Direction.REVERSE : direction, rule);
    ruleNum++;
    lookAheadRule = false;
  }

  private void attach(Direction d, RuleNode rule) {
    switch (d) {
      case FORWARD:
        result.forwardTree = or(result.forwardTree, rule);
        break;
      case REVERSE:
        result.reverseTree = or(result.reverseTree, rule);
        break;
      case SAFE_FORWARD:
        result.safeForwardTree = or(result.safeForwardTree, rule);
        break;
      case SAFE_REVERSE:
        result.safeReverseTree = or(result.safeReverseTree, rule);
        break;
      default:
        throw new IllegalStateException(d.toString());
    }
  }

  private static RuleNode or(RuleNode existing, RuleNode rule) {
    return existing == null ? rule : RuleNode.of(RuleNode.Type.OP_OR, existing, rule);
  }

  private void expectSemicolon() throws RuleSyntaxException {
    skipWhitespace();
    int c = peek();
    if (c == ';') {
      pos++;
    } else if (c == ')') {
      throw error(RuleError.MISMATCHED_PAREN, pos, null);
    } else {
      throw error(RuleError.RULE_SYNTAX, pos, "expected ';'");
    }
  }

  /// expressions

  private RuleNode expression() throws RuleSyntaxException {
    RuleNode left = sequence();
    skipWhitespace();
    while (peek() == '|') {
      pos++;
      left = RuleNode.of(RuleNode.Type.OP_OR, left, sequence());
      skipWhitespace();
    }
    return left;
  }

  private RuleNode sequence() throws RuleSyntaxException {
    RuleNode seq = null;
    for (; ; ) {
      skipWhitespace();
      int c = peek();
      if (c < 0 || c == '|' || c == ')' || c == ';') {
        break;
      }
      RuleNode item = item();
      seq = seq == null ? item : RuleNode.of(RuleNode.Type.OP_CAT, seq, item);
    }

    if (seq == null) {
      throw error(RuleError.RULE_SYNTAX, pos, "expression expected");
    }
    return seq;
  }

  private RuleNode item() throws RuleSyntaxException {
    int start = pos;
    int c = peek();

    if (c == '/') {
      pos++;
      if (lookAheadRule) {
        throw error(RuleError.RULE_SYNTAX, start, "more than one '/' in a rule");
      }
      lookAheadRule = true;
      RuleNode n = new RuleNode(RuleNode.Type.LOOK_AHEAD);
      n.val = ruleNum;
      n.sourceOffset = start;
      return n;
    }

    if (c == '{') {
      return tag();
    }

    RuleNode n = primary();
    for (; ; ) {
      skipWhitespace();
      RuleNode.Type op;
      switch (peek()) {
        case '*':
          op = RuleNode.Type.OP_STAR;
          break;
        case '+':
          op = RuleNode.Type.OP_PLUS;
          break;
        case '?':
          op = RuleNode.Type.OP_QUESTION;
          break;
        default:
          return n;
      }
      pos++;
      n = RuleNode.of(op, n, null);
    }
  }

  private RuleNode tag() throws RuleSyntaxException {
    int start = pos;
    pos++;
    skipWhitespace();

    int digitsStart = pos;
    while (pos < rules.length() && rules.charAt(pos) >= '0' && rules.charAt(pos) <= '9') {
      pos++;
    }
    String digits = rules.substring(digitsStart, pos);
    skipWhitespace();
    if (digits.isEmpty() || peek() != '}') {
      throw error(RuleError.MALFORMED_RULE_TAG, start, null);
    }
    pos++;

    RuleNode n = new RuleNode(RuleNode.Type.TAG);
    try {
      n.val = Integer.parseInt(digits);
    } catch (NumberFormatException e) {
      throw error(RuleError.MALFORMED_RULE_TAG, start, "value out of range");
    }
    n.text = rules.substring(start, pos);
    n.sourceOffset = start;
    return n;
  }

  private RuleNode primary() throws RuleSyntaxException {
    int start = pos;
    int c = peek();

    switch (c) {
      case '(': {
        pos++;
        RuleNode e = expression();
        skipWhitespace();
        if (peek() != ')') {
          throw error(RuleError.MISMATCHED_PAREN, start, null);
        }
        pos++;
        return e;
      }
      case '$':
        return variableReference();
      case '.':
        pos++;
        return setRef(".", new UnicodeSet(0, 0x10FFFF), start);
      case '[':
        return set();
      case '\'':
        return quoted();
      case '\\':
        return UnicodeSet.resemblesPattern(rules, pos) ? set() : escape();
      default:
        if (UNEXPECTED.indexOf(c) >= 0) {
          throw error(RuleError.RULE_SYNTAX, start, "unexpected '" + (char) c + "'");
        }
        pos += Character.charCount(c);
        return literal(c, start);
    }
  }

  private RuleNode variableReference() throws RuleSyntaxException {
    int start = pos;
    pos++;
    String name = identifier();
    if (name.isEmpty()) {
      throw error(RuleError.RULE_SYNTAX, start, "variable name expected");
    }

    RuleNode definition = variables.get(name, null);
    if (definition == null) {
      throw error(RuleError.UNDEFINED_VARIABLE, start, "$" + name);
    }

    RuleNode ref = new RuleNode(RuleNode.Type.VAR_REF);
    ref.left = definition.left;
    ref.text = definition.text;
    ref.sourceOffset = start;
    return ref;
  }

  private RuleNode quoted() throws RuleSyntaxException {
    int start = pos;
    if (rules.startsWith("''", pos)) {
      pos += 2;
      return literal('\'', start);
    }

    pos++;
    RuleNode seq = null;
    for (; ; ) {
      if (pos >= rules.length()) {
        throw error(RuleError.RULE_SYNTAX, start, "unterminated quoted literal");
      }

      int c = rules.codePointAt(pos);
      int offset = pos;
      if (isLineEnd(c)) {
        throw error(RuleError.NEW_LINE_IN_QUOTED_STRING, pos, null);
      } else if (c == '\'') {
        if (!rules.startsWith("''", pos)) {
          pos++;
          break;
        }
        pos += 2;
      } else {
        pos += Character.charCount(c);
      }

      RuleNode lit = literal(c, offset);
      seq = seq == null ? lit : RuleNode.of(RuleNode.Type.OP_CAT, seq, lit);
    }

    if (seq == null) {
      throw error(RuleError.RULE_SYNTAX, start, "empty quoted literal");
    }
    return seq;
  }

  private RuleNode escape() throws RuleSyntaxException {
    int start = pos;
    pos++;
    if (pos >= rules.length()) {
      throw error(RuleError.RULE_SYNTAX, start, "escape at end of rules");
    }

    int c = rules.codePointAt(pos);
    int cp;
    switch (c) {
      case 'u':
        pos++;
        cp = hex(start, 4, 4);
        break;
      case 'U':
        pos++;
        cp = hex(start, 8, 8);
        break;
      case 'x':
        pos++;
        if (peek() == '{') {
          pos++;
          cp = hex(start, 1, 6);
          if (peek() != '}') {
            throw error(RuleError.HEX_DIGITS_EXPECTED, start, null);
          }
          pos++;
        } else {
          cp = hex(start, 1, 2);
        }
        break;
      case 't':
        pos++;
        cp = '\t';
        break;
      case 'n':
        pos++;
        cp = '\n';
        break;
      case 'r':
        pos++;
        cp = '\r';
        break;
      default:
        pos += Character.charCount(c);
        cp = c;
        break;
    }

    if (cp > 0x10FFFF) {
      throw error(RuleError.HEX_DIGITS_EXPECTED, start, "code point out of range");
    }
    return literal(cp, start);
  }

  private int hex(int start, int min, int max) throws RuleSyntaxException {
    int value = 0;
    int count = 0;
    while (count < max && pos < rules.length() && Character.digit(rules.charAt(pos), 16) >= 0) {
      value = (value << 4) | Character.digit(rules.charAt(pos), 16);
      pos++;
      count++;
    }
    if (count < min) {
      throw error(RuleError.HEX_DIGITS_EXPECTED, start, null);
    }
    return value;
  }

  private RuleNode literal(int c, int offset) {
    return setRef(new String(Character.toChars(c)), new UnicodeSet(c, c), offset);
  }

  /// sets

  private RuleNode set() throws RuleSyntaxException {
    int start = pos;
    int end = rules.charAt(start) == '[' ? setEnd(start) : start;
    if (end < 0) {
      throw error(RuleError.UNCLOSED_SET, rules.length(), null);
    }

    symbols.reset();
    ParsePosition pp = new ParsePosition(start);
    UnicodeSet set;
    try {
      set = new UnicodeSet(rules, pp, symbols);
    } catch (IllegalArgumentException e) {
      RuleError kind = symbols.error() == null ? RuleError.MALFORMED_SET : symbols.error();
      String detail = symbols.error() == null ? e.getMessage() : symbols.errorDetail();
      throw error(kind, symbols.error() == null ? end : start, detail);
    }

    if (pp.getIndex() <= start) {
      throw error(RuleError.MALFORMED_SET, start, null);
    }
    pos = pp.getIndex();
    String text = rules.substring(start, pos);

    for (String s : set.strings()) {
      if (!s.equals(CategoryBuilder.BOF_STRING) && !s.equals(CategoryBuilder.EOF_STRING)) {
        throw error(RuleError.MALFORMED_SET, start, "unsupported string {" + s + "}");
      }
    }
    if (set.isEmpty()) {
      throw error(RuleError.RULE_EMPTY_SET, start, text);
    }

    return setRef(text, set.freeze(), start);
  }

  // the index of the ']' closing the set opened at start, or -1
  private int setEnd(int start) {
    int depth = 0;
    boolean quoted = false;
    for (int i = start; i < rules.length(); i++) {
      char c = rules.charAt(i);
      if (quoted) {
        quoted = c != '\'';
      } else if (c == '\\') {
        i++;
      } else if (c == '\'') {
        quoted = true;
      } else if (c == '[') {
        depth++;
      } else if (c == ']' && --depth == 0) {
        return i;
      }
    }
    return -1;
  }

  private RuleNode setRef(String text, UnicodeSet set, int offset) {
    RuleNode uset = setsByText.get(text, null);
    if (uset == null) {
      uset = new RuleNode(RuleNode.Type.USET);
      uset.text = text;
      uset.set = set;
      uset.sourceOffset = offset;
      setsByText.put(text, uset);
      result.setNodes.addLast(uset);
    }

    RuleNode ref = new RuleNode(RuleNode.Type.SET_REF);
    ref.left = uset;
    ref.text = text;
    ref.sourceOffset = offset;
    return ref;
  }

  /// characters

  private String identifier() {
    int start = pos;
    while (pos < rules.length()) {
      int c = rules.codePointAt(pos);
      if ((pos == start && !UCharacter.isUnicodeIdentifierStart(c)) || !UCharacter.isUnicodeIdentifierPart(c)) {
        break;
      }
      pos += Character.charCount(c);
    }
    return rules.substring(start, pos);
  }

  private void skipWhitespace() {
    while (pos < rules.length()) {
      int c = rules.codePointAt(pos);
      if (isWhitespace(c)) {
        pos += Character.charCount(c);
      } else if (c == '#') {
        while (pos < rules.length() && !isLineEnd(rules.charAt(pos))) {
          pos++;
        }
      } else {
        break;
      }
    }
  }

  private int peek() {
    return pos < rules.length() ? rules.codePointAt(pos) : -1;
  }

  private static boolean isWhitespace(int c) {
    return UCharacter.hasBinaryProperty(c, UProperty.PATTERN_WHITE_SPACE);
  }

  private static boolean isLineEnd(int c) {
    return c == '\n' || c == '\r' || c == 0x85 || c == 0x2028 || c == 0x2029;
  }

  private RuleSyntaxException error(RuleError kind, int offset, String detail) {
    return new RuleSyntaxException(kind, detail, rules, offset);
  }
}
