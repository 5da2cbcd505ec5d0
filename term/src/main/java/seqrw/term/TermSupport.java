package seqrw.term;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/** Recognizers, destructors and the value oracle over {@link Term}. */
public abstract class TermSupport {
  private TermSupport() {}

  public static boolean isTrue(Term t) {
    return t.is(Op.TRUE);
  }

  public static boolean isFalse(Term t) {
    return t.is(Op.FALSE);
  }

  /** The value of a string literal, "" for the empty string, otherwise null. */
  public static String stringOf(Term t) {
    if (t.is(Op.STRING_CONST)) return (String) t.payload();
    if (t.is(Op.SEQ_EMPTY) && t.sort().isString()) return "";
    return null;
  }

  public static boolean isString(Term t) {
    return stringOf(t) != null;
  }

  public static boolean isEmpty(Term t) {
    return t.is(Op.SEQ_EMPTY);
  }

  /** The code of a character constant, -1 otherwise. */
  public static int charOf(Term t) {
    return t.is(Op.CHAR_CONST) ? (Integer) t.payload() : -1;
  }

  public static boolean isConstChar(Term t) {
    return t.is(Op.CHAR_CONST);
  }

  /** The code of a unit of a character constant, -1 otherwise. */
  public static int unitCharOf(Term t) {
    return t.is(Op.SEQ_UNIT) ? charOf(t.arg(0)) : -1;
  }

  public static BigInteger numeralOf(Term t) {
    return t.is(Op.INT_NUM) ? (BigInteger) t.payload() : null;
  }

  public static boolean isNumeral(Term t) {
    return t.is(Op.INT_NUM);
  }

  /** The numeral value when it fits an int, otherwise null. */
  public static Integer smallIntOf(Term t) {
    final BigInteger v = numeralOf(t);
    if (v == null || v.bitLength() >= 32) return null;
    return v.intValue();
  }

  /** Whether {@code t} is a non-negative numeral fitting an int. */
  public static boolean isUnsigned(Term t) {
    final Integer v = smallIntOf(t);
    return v != null && v >= 0;
  }

  public static boolean isZero(Term t) {
    final BigInteger v = numeralOf(t);
    return v != null && v.signum() == 0;
  }

  /** The parameter-form bounds of a loop: {lo} or {lo, hi}. Null for the argument forms. */
  public static int[] loopBounds(Term t) {
    if (!t.is(Op.RE_LOOP) || t.numArgs() != 1) return null;
    return t.paramsCopy();
  }

  /** Operands of a concatenation in order, with nested concatenations and empties removed. */
  public static void getConcat(Term t, List<Term> out) {
    final Deque<Term> stack = new ArrayDeque<>();
    stack.push(t);
    while (!stack.isEmpty()) {
      final Term e = stack.pop();
      if (e.is(Op.SEQ_CONCAT)) {
        for (int i = e.numArgs() - 1; i >= 0; --i) stack.push(e.arg(i));
      } else if (!isEmpty(e)) {
        out.add(e);
      }
    }
  }

  public static List<Term> getConcat(Term t) {
    final List<Term> out = new ArrayList<>();
    getConcat(t, out);
    return out;
  }

  /** Like {@link #getConcat} with string literals split into units of characters. */
  public static void getConcatUnits(TermManager mgr, Term t, List<Term> out) {
    final Deque<Term> stack = new ArrayDeque<>();
    stack.push(t);
    while (!stack.isEmpty()) {
      final Term e = stack.pop();
      final String s;
      if (e.is(Op.SEQ_CONCAT)) {
        for (int i = e.numArgs() - 1; i >= 0; --i) stack.push(e.arg(i));
      } else if ((s = stringOf(e)) != null) {
        for (int j = 0; j < s.length(); ++j) out.add(mgr.mkUnit(mgr.mkChar(s.charAt(j))));
      } else if (!isEmpty(e)) {
        out.add(e);
      }
    }
  }

  public static List<Term> getConcatUnits(TermManager mgr, Term t) {
    final List<Term> out = new ArrayList<>();
    getConcatUnits(mgr, t, out);
    return out;
  }

  /** The first non-concatenation operand of {@code t} (possibly an empty sequence). */
  public static Term getLeftmostConcat(Term t) {
    while (t.is(Op.SEQ_CONCAT)) t = t.arg(0);
    return t;
  }

  public static Term getRightmostConcat(Term t) {
    while (t.is(Op.SEQ_CONCAT)) t = t.arg(t.numArgs() - 1);
    return t;
  }

  /**
   * The concrete value of a term built only from literals, units of literals and concatenations:
   * Boolean, BigInteger, Integer (character), String (character sequence) or List (other
   * sequences). Null when {@code t} is not a value.
   */
  public static Object valueOf(Term t) {
    switch (t.op()) {
      case TRUE:
        return Boolean.TRUE;
      case FALSE:
        return Boolean.FALSE;
      case INT_NUM:
      case CHAR_CONST:
      case STRING_CONST:
        return t.payload();
      case SEQ_EMPTY:
        return t.sort().isString() ? "" : List.of();
      case SEQ_UNIT:
      case SEQ_CONCAT:
        return seqValueOf(t);
      default:
        return null;
    }
  }

  private static Object seqValueOf(Term t) {
    final List<Term> parts = getConcat(t);
    if (t.sort().isString()) {
      final StringBuilder builder = new StringBuilder();
      for (Term part : parts) {
        final String s = stringOf(part);
        final int c = unitCharOf(part);
        if (s != null) builder.append(s);
        else if (c >= 0) builder.append((char) c);
        else return null;
      }
      return builder.toString();
    }

    final List<Object> elems = new ArrayList<>(parts.size());
    for (Term part : parts) {
      if (!part.is(Op.SEQ_UNIT)) return null;
      final Object v = valueOf(part.arg(0));
      if (v == null) return null;
      elems.add(v);
    }
    return elems;
  }

  public static boolean isValue(Term t) {
    return valueOf(t) != null;
  }

  /** Sound equality: true only when both sides certainly denote the same value. */
  public static boolean areEqual(Term a, Term b) {
    if (a == b) return true;
    final Object va = valueOf(a);
    return va != null && va.equals(valueOf(b));
  }

  /** Sound disequality: true only when both sides are values and differ. */
  public static boolean areDistinct(Term a, Term b) {
    if (a == b) return false;
    final Object va = valueOf(a), vb = valueOf(b);
    return va != null && vb != null && !va.equals(vb);
  }

  /** Whether a sequence term is a concatenation of units, literals and empties only. */
  public static boolean isConcatOfUnitsAndStrings(Term t) {
    for (Term part : getConcat(t)) {
      if (!part.is(Op.SEQ_UNIT) && stringOf(part) == null) return false;
    }
    return true;
  }

  /** Total length of the units and literals among {@code es}, a lower bound on their length. */
  public static int minLength(List<Term> es) {
    int len = 0;
    for (Term e : es) {
      final String s = stringOf(e);
      if (s != null) len += s.length();
      else if (e.is(Op.SEQ_UNIT)) ++len;
    }
    return len;
  }

  /** Whether every operand of {@code es} is a unit or a literal, so {@link #minLength} is exact. */
  public static boolean isBoundedLength(List<Term> es) {
    for (Term e : es) {
      if (!e.is(Op.SEQ_UNIT) && stringOf(e) == null) return false;
    }
    return true;
  }
}
