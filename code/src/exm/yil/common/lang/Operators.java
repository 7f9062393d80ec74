/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.yil.common.lang;

import java.util.HashMap;
import java.util.Map;

import exm.yil.common.exceptions.UnsupportedConstructError;

/**
 * Built-in operators, identified in the IR by name.
 */
public class Operators {

  /**
   * Unary operators.  Each is rendered around its printed argument.
   */
  public static enum UnaryOp {
    NOT("Not", "!", ""),
    CARDINALITY("Cardinality", "|", "|"),
    FRESH("Fresh", "fresh(", ")"),
    ALLOCATED("Allocated", "allocated(", ")"),
    LIT("Lit", "Lit(", ")");

    private final String opName;
    private final String before;
    private final String after;

    private UnaryOp(String opName, String before, String after) {
      this.opName = opName;
      this.before = before;
      this.after = after;
    }

    public String opName() {
      return opName;
    }

    public String render(String arg) {
      return before + arg + after;
    }

    private static final Map<String, UnaryOp> nameMap =
                                        new HashMap<String, UnaryOp>();
    static {
      for (UnaryOp op: values()) {
        nameMap.put(op.opName, op);
      }
    }

    public static UnaryOp fromName(String name) {
      UnaryOp result = nameMap.get(name);
      if (result == null) {
        throw new UnsupportedConstructError("unknown unary operator: " +
                                            name);
      }
      return result;
    }
  }

  /**
   * Binary operators, named by the resolved opcodes of the front-end.
   * Type-specific variants of the same operator share their syntax.
   */
  public static enum BinaryOp {
    IFF("Iff", "<==>"),
    IMP("Imp", "==>"),
    AND("And", "&&"),
    OR("Or", "||"),

    EQ_COMMON("EqCommon", "=="),
    SET_EQ("SetEq", "=="),
    SEQ_EQ("SeqEq", "=="),
    MULTI_SET_EQ("MultiSetEq", "=="),
    MAP_EQ("MapEq", "=="),
    NEQ_COMMON("NeqCommon", "!="),
    SET_NEQ("SetNeq", "!="),
    SEQ_NEQ("SeqNeq", "!="),
    MULTI_SET_NEQ("MultiSetNeq", "!="),
    MAP_NEQ("MapNeq", "!="),

    LT("Lt", "<"),
    LT_CHAR("LtChar", "<"),
    PROPER_SUBSET("ProperSubset", "<"),
    PROPER_MULTI_SUBSET("ProperMultiSubset", "<"),
    PROPER_PREFIX("ProperPrefix", "<"),
    RANK_LT("RankLt", "<"),
    LESS_THAN_LIMIT("LessThanLimit", "<"),
    LE("Le", "<="),
    LE_CHAR("LeChar", "<="),
    SUBSET("Subset", "<="),
    MULTI_SUBSET("MultiSubset", "<="),
    PREFIX("Prefix", "<="),
    GE("Ge", ">="),
    GE_CHAR("GeChar", ">="),
    SUPERSET("Superset", ">="),
    MULTI_SUPERSET("MultiSuperset", ">="),
    GT("Gt", ">"),
    GT_CHAR("GtChar", ">"),
    PROPER_SUPERSET("ProperSuperset", ">"),
    PROPER_MULTI_SUPERSET("ProperMultiSuperset", ">"),
    RANK_GT("RankGt", ">"),

    ADD("Add", "+"),
    UNION("Union", "+"),
    MULTI_SET_UNION("MultiSetUnion", "+"),
    MAP_MERGE("MapMerge", "+"),
    CONCAT("Concat", "+"),
    SUB("Sub", "-"),
    SET_DIFFERENCE("SetDifference", "-"),
    MULTI_SET_DIFFERENCE("MultiSetDifference", "-"),
    MAP_SUBTRACTION("MapSubtraction", "-"),
    MUL("Mul", "*"),
    INTERSECTION("Intersection", "*"),
    MULTI_SET_INTERSECTION("MultiSetIntersection", "*"),
    DIV("Div", "/"),
    MOD("Mod", "%"),

    LEFT_SHIFT("LeftShift", "<<"),
    RIGHT_SHIFT("RightShift", ">>"),
    BITWISE_AND("BitwiseAnd", "&"),
    BITWISE_OR("BitwiseOr", "|"),
    BITWISE_XOR("BitwiseXor", "^"),

    DISJOINT("Disjoint", "!!"),
    MULTI_SET_DISJOINT("MultiSetDisjoint", "!!"),

    IN_SET("InSet", "in"),
    IN_MULTI_SET("InMultiSet", "in"),
    IN_SEQ("InSeq", "in"),
    IN_MAP("InMap", "in"),
    NOT_IN_SET("NotInSet", "!in"),
    NOT_IN_MULTI_SET("NotInMultiSet", "!in"),
    NOT_IN_SEQ("NotInSeq", "!in"),
    NOT_IN_MAP("NotInMap", "!in");

    private final String opName;
    private final String syntax;

    private BinaryOp(String opName, String syntax) {
      this.opName = opName;
      this.syntax = syntax;
    }

    public String opName() {
      return opName;
    }

    /** the infix operator symbol */
    public String syntax() {
      return syntax;
    }

    private static final Map<String, BinaryOp> nameMap =
                                        new HashMap<String, BinaryOp>();
    static {
      for (BinaryOp op: values()) {
        nameMap.put(op.opName, op);
      }
    }

    public static BinaryOp fromName(String name) {
      BinaryOp result = nameMap.get(name);
      if (result == null) {
        throw new UnsupportedConstructError("unknown binary operator: " +
                                            name);
      }
      return result;
    }
  }
}
