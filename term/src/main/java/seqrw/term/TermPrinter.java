package seqrw.term;

import java.math.BigInteger;

/** SMT-LIB like rendering, for logs and test diagnostics. */
public abstract class TermPrinter {
  private TermPrinter() {}

  public static String print(Term t) {
    final StringBuilder builder = new StringBuilder();
    print(t, builder);
    return builder.toString();
  }

  private static void print(Term t, StringBuilder builder) {
    switch (t.op()) {
      case TRUE, FALSE -> builder.append(t.op().symbol());
      case VAR -> builder.append(t.payload());
      case BOUND_VAR -> builder.append("(:var ").append(t.payload()).append(')');
      case INT_NUM -> {
        final BigInteger v = (BigInteger) t.payload();
        if (v.signum() < 0) builder.append("(- ").append(v.negate()).append(')');
        else builder.append(v);
      }
      case CHAR_CONST -> builder.append("(_ Char ").append(t.payload()).append(')');
      case STRING_CONST -> builder.append('"').append(escape((String) t.payload())).append('"');
      case SEQ_EMPTY -> builder.append("(as seq.empty ").append(t.sort()).append(')');
      case RE_EMPTY, RE_FULL_SEQ, RE_FULL_CHAR -> builder.append(t.op().symbol());
      default -> {
        builder.append('(');
        if (t.numParams() > 0) {
          builder.append("(_ ").append(t.op().symbol());
          for (int i = 0; i < t.numParams(); ++i) builder.append(' ').append(t.param(i));
          builder.append(')');
        } else {
          builder.append(t.op().symbol());
        }
        for (Term arg : t.args()) {
          builder.append(' ');
          print(arg, builder);
        }
        builder.append(')');
      }
    }
  }

  private static String escape(String s) {
    final StringBuilder builder = new StringBuilder(s.length());
    for (int i = 0; i < s.length(); ++i) {
      final char c = s.charAt(i);
      if (c == '"') builder.append("\"\"");
      else if (c < 0x20 || c > 0x7e) builder.append(String.format("\\u{%x}", (int) c));
      else builder.append(c);
    }
    return builder.toString();
  }
}
