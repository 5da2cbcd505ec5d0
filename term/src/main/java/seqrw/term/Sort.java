package seqrw.term;

import java.util.Objects;

public final class Sort {
  public enum Kind {
    BOOL,
    INT,
    CHAR,
    SEQ,
    RE,
    PRED;
  }

  public static final Sort BOOL = new Sort(Kind.BOOL, null);
  public static final Sort INT = new Sort(Kind.INT, null);
  public static final Sort CHAR = new Sort(Kind.CHAR, null);
  public static final Sort STRING = new Sort(Kind.SEQ, CHAR);
  public static final Sort STRING_RE = new Sort(Kind.RE, STRING);

  private final Kind kind;
  // element sort of SEQ and PRED, sequence sort of RE
  private final Sort param;

  private Sort(Kind kind, Sort param) {
    this.kind = kind;
    this.param = param;
  }

  public static Sort seq(Sort elem) {
    return elem.equals(CHAR) ? STRING : new Sort(Kind.SEQ, elem);
  }

  public static Sort re(Sort seq) {
    if (!seq.isSeq()) throw new IllegalArgumentException("regex over non-sequence sort " + seq);
    return seq.equals(STRING) ? STRING_RE : new Sort(Kind.RE, seq);
  }

  public static Sort pred(Sort elem) {
    return new Sort(Kind.PRED, elem);
  }

  public Kind kind() {
    return kind;
  }

  public boolean isBool() {
    return kind == Kind.BOOL;
  }

  public boolean isInt() {
    return kind == Kind.INT;
  }

  public boolean isChar() {
    return kind == Kind.CHAR;
  }

  public boolean isSeq() {
    return kind == Kind.SEQ;
  }

  public boolean isString() {
    return kind == Kind.SEQ && param.isChar();
  }

  public boolean isRe() {
    return kind == Kind.RE;
  }

  public boolean isPred() {
    return kind == Kind.PRED;
  }

  /** Element sort of a sequence or predicate sort. */
  public Sort elem() {
    if (kind == Kind.SEQ || kind == Kind.PRED) return param;
    if (kind == Kind.RE) return param.param;
    throw new IllegalStateException(this + " has no element sort");
  }

  /** Sequence sort of a regex sort. */
  public Sort seqSort() {
    if (kind != Kind.RE) throw new IllegalStateException(this + " is not a regex sort");
    return param;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Sort)) return false;
    final Sort that = (Sort) o;
    return kind == that.kind && Objects.equals(param, that.param);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, param);
  }

  @Override
  public String toString() {
    return switch (kind) {
      case BOOL -> "Bool";
      case INT -> "Int";
      case CHAR -> "Char";
      case SEQ -> isString() ? "String" : "(Seq " + param + ")";
      case RE -> "(RegEx " + param + ")";
      case PRED -> "(Array " + param + " Bool)";
    };
  }
}
