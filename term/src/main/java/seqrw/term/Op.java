package seqrw.term;

public enum Op {
  TRUE(Family.BASIC, "true"),
  FALSE(Family.BASIC, "false"),
  VAR(Family.BASIC, "const"),
  BOUND_VAR(Family.BASIC, "var"),
  EQ(Family.BASIC, "="),
  NOT(Family.BASIC, "not"),
  AND(Family.BASIC, "and"),
  OR(Family.BASIC, "or"),
  ITE(Family.BASIC, "ite"),
  SELECT(Family.BASIC, "select"),

  INT_NUM(Family.ARITH, "int"),
  ADD(Family.ARITH, "+"),
  SUB(Family.ARITH, "-"),
  MUL(Family.ARITH, "*"),
  LE(Family.ARITH, "<="),
  GE(Family.ARITH, ">="),
  LT(Family.ARITH, "<"),

  CHAR_CONST(Family.CHAR, "char"),
  CHAR_LE(Family.CHAR, "char.<="),

  SEQ_EMPTY(Family.SEQ, "seq.empty"),
  STRING_CONST(Family.SEQ, "str.lit"),
  SEQ_UNIT(Family.SEQ, "seq.unit"),
  SEQ_CONCAT(Family.SEQ, "str.++"),
  SEQ_LENGTH(Family.SEQ, "str.len"),
  SEQ_EXTRACT(Family.SEQ, "str.substr"),
  SEQ_CONTAINS(Family.SEQ, "str.contains"),
  SEQ_AT(Family.SEQ, "str.at"),
  SEQ_NTH(Family.SEQ, "seq.nth"),
  SEQ_NTH_I(Family.SEQ, "seq.nth_i"),
  SEQ_NTH_U(Family.SEQ, "seq.nth_u"),
  SEQ_INDEX(Family.SEQ, "str.indexof"),
  SEQ_LAST_INDEX(Family.SEQ, "seq.last_indexof"),
  SEQ_REPLACE(Family.SEQ, "str.replace"),
  SEQ_PREFIX(Family.SEQ, "str.prefixof"),
  SEQ_SUFFIX(Family.SEQ, "str.suffixof"),
  SEQ_SKOLEM(Family.SEQ, "seq.skolem"),
  SEQ_TO_RE(Family.SEQ, "str.to_re"),
  SEQ_IN_RE(Family.SEQ, "str.in_re"),
  STRING_LT(Family.SEQ, "str.<"),
  STRING_LE(Family.SEQ, "str.<="),
  STRING_ITOS(Family.SEQ, "str.from_int"),
  STRING_STOI(Family.SEQ, "str.to_int"),
  STRING_FROM_CODE(Family.SEQ, "str.from_code"),
  STRING_TO_CODE(Family.SEQ, "str.to_code"),
  STRING_IS_DIGIT(Family.SEQ, "str.is_digit"),

  RE_EMPTY(Family.SEQ, "re.none"),
  RE_FULL_SEQ(Family.SEQ, "re.all"),
  RE_FULL_CHAR(Family.SEQ, "re.allchar"),
  RE_CONCAT(Family.SEQ, "re.++"),
  RE_UNION(Family.SEQ, "re.union"),
  RE_INTERSECT(Family.SEQ, "re.inter"),
  RE_DIFF(Family.SEQ, "re.diff"),
  RE_COMPLEMENT(Family.SEQ, "re.comp"),
  RE_STAR(Family.SEQ, "re.*"),
  RE_PLUS(Family.SEQ, "re.+"),
  RE_OPTION(Family.SEQ, "re.opt"),
  RE_LOOP(Family.SEQ, "re.loop"),
  RE_POWER(Family.SEQ, "re.^"),
  RE_RANGE(Family.SEQ, "re.range"),
  RE_REVERSE(Family.SEQ, "re.reverse"),
  RE_DERIVATIVE(Family.SEQ, "re.derivative"),
  RE_OF_PRED(Family.SEQ, "re.of_pred"),

  // cache tags only, never terms
  RE_IS_NULLABLE(Family.INTERNAL, "re.is_nullable"),
  RE_LIFT_ITES(Family.INTERNAL, "re.lift_ites");

  public enum Family {
    BASIC,
    ARITH,
    CHAR,
    SEQ,
    INTERNAL;
  }

  private final Family family;
  private final String symbol;

  Op(Family family, String symbol) {
    this.family = family;
    this.symbol = symbol;
  }

  public Family family() {
    return family;
  }

  public String symbol() {
    return symbol;
  }

  public boolean isSeqFamily() {
    return family == Family.SEQ;
  }

  /** Operators producing a regex. */
  public boolean isRegex() {
    return name().startsWith("RE_") && family != Family.INTERNAL;
  }

  public boolean isLiteral() {
    return this == TRUE
        || this == FALSE
        || this == INT_NUM
        || this == CHAR_CONST
        || this == STRING_CONST
        || this == SEQ_EMPTY;
  }
}
