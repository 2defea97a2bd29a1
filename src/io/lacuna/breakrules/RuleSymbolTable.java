package io.lacuna.breakrules;

import com.ibm.icu.lang.UCharacter;
import com.ibm.icu.text.SymbolTable;
import com.ibm.icu.text.UnicodeMatcher;
import com.ibm.icu.text.UnicodeSet;
import io.lacuna.bifurcan.*;

import java.text.ParsePosition;

/**
 * Resolves {@code $variable} references inside set expressions. A variable is only usable inside a set when its
 * definition is a single set; it is handed to the set parser as a one-character stand-in that
 * {@link #lookupMatcher(int)} then maps back to the set.
 */
class RuleSymbolTable implements SymbolTable {

  private static final char SET_STAND_IN = '\uffff';

  private final IMap<String, RuleNode> variables;

  private UnicodeSet cachedSet;
  private RuleError error;
  private String errorDetail;

  RuleSymbolTable(IMap<String, RuleNode> variables) {
    this.variables = variables;
  }

  void reset() {
    cachedSet = null;
    error = null;
    errorDetail = null;
  }

  /**
   * @return the error recorded during the last set parse, if any
   */
  RuleError error() {
    return error;
  }

  String errorDetail() {
    return errorDetail;
  }

  @Override
  public char[] lookup(String name) {
    RuleNode definition = variables.get(name, null);
    if (definition == null) {
      error = RuleError.UNDEFINED_VARIABLE;
      errorDetail = "$" + name;
      return null;
    }

    RuleNode expr = definition.left;
    while (expr.type == RuleNode.Type.VAR_REF) {
      expr = expr.left;
    }

    if (expr.type != RuleNode.Type.SET_REF) {
      error = RuleError.MALFORMED_SET;
      errorDetail = "$" + name + " is not a set";
      return null;
    }

    cachedSet = expr.left.set;
    return new char[]{SET_STAND_IN};
  }

  @Override
  public UnicodeMatcher lookupMatcher(int ch) {
    UnicodeSet set = null;
    if (ch == SET_STAND_IN) {
      set = cachedSet;
      cachedSet = null;
    }
    return set;
  }

  @Override
  public String parseReference(String text, ParsePosition pos, int limit) {
    int start = pos.getIndex();
    int i = start;
    while (i < limit) {
      int c = text.codePointAt(i);
      if ((i == start && !UCharacter.isUnicodeIdentifierStart(c)) || !UCharacter.isUnicodeIdentifierPart(c)) {
        break;
      }
      i += Character.charCount(c);
    }

    if (i == start) {
      return null;
    }
    pos.setIndex(i);
    return text.substring(start, i);
  }
}
