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

import java.util.Arrays;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableList;

import exm.yil.common.exceptions.YILRuntimeError;

/**
 * Types of the YIL language.
 *
 * There is no subtyping except between the numeric families and between
 * reference types and {@link #OBJECT}.
 * The base class for all types is Type; each variant is tagged by its
 * {@link TypeKind}.
 */
public class Types {

  public static enum TypeKind {
    UNIT, BOOL, CHAR,
    STRING, NAT, INT, REAL,
    BIT_VECTOR,
    TUPLE, FUNCTION, SEQ, SET, MAP, ARRAY,
    OBJECT, NULLABLE,
    APPLY, VAR,
    UNIMPLEMENTED,
  }

  public static final Type UNIT = new BaseType(TypeKind.UNIT, "unit");
  public static final Type BOOL = new BaseType(TypeKind.BOOL, "bool");
  public static final Type CHAR = new BaseType(TypeKind.CHAR, "char");
  /** supertype of all classes */
  public static final Type OBJECT = new BaseType(TypeKind.OBJECT, "object");
  /** dummy for missing cases */
  public static final Type UNIMPLEMENTED =
                        new BaseType(TypeKind.UNIMPLEMENTED, "UNIMPLEMENTED");

  public static final Bound NO_BOUND = new Bound(null);
  public static final Bound BOUND_8 = new Bound(8);
  public static final Bound BOUND_16 = new Bound(16);
  public static final Bound BOUND_32 = new Bound(32);
  public static final Bound BOUND_64 = new Bound(64);
  /** bounds used for signed Java-style integers */
  public static final Bound BOUND_31 = new Bound(31);
  public static final Bound BOUND_63 = new Bound(63);

  public static final Type INT = new BoundedType(TypeKind.INT, NO_BOUND);
  public static final Type NAT = new BoundedType(TypeKind.NAT, NO_BOUND);
  public static final Type REAL = new BoundedType(TypeKind.REAL, NO_BOUND);
  public static final Type STRING =
                        new BoundedType(TypeKind.STRING, NO_BOUND);

  public abstract static class Type {
    private final TypeKind kind;

    protected Type(TypeKind kind) {
      this.kind = kind;
    }

    public TypeKind kind() {
      return kind;
    }

    /**
     * Components compared by structural equality, in a fixed order
     */
    protected abstract List<?> parts();

    /** Compact description, e.g. seq<int32> */
    @Override
    public abstract String toString();

    @Override
    public boolean equals(Object obj) {
      if (this == obj) {
        return true;
      }
      if (obj == null || obj.getClass() != getClass()) {
        return false;
      }
      Type other = (Type)obj;
      return kind == other.kind && parts().equals(other.parts());
    }

    @Override
    public int hashCode() {
      return kind.hashCode() + 13 * parts().hashCode();
    }
  }

  /**
   * Size limit of a numeric or collection type, in bits.
   * Unbounded if bits is null.
   */
  public static class Bound {
    private final Integer bits;

    public Bound(Integer bits) {
      this.bits = bits;
    }

    public static Bound of(int bits) {
      return new Bound(bits);
    }

    public boolean isBounded() {
      return bits != null;
    }

    /** Only valid if bounded */
    public int bits() {
      if (bits == null) {
        throw new YILRuntimeError("bits() called on unbounded Bound");
      }
      return bits;
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Bound)) {
        return false;
      }
      Bound other = (Bound)obj;
      return bits == null ? other.bits == null : bits.equals(other.bits);
    }

    @Override
    public int hashCode() {
      return bits == null ? 0 : bits;
    }

    /** empty if unbounded */
    @Override
    public String toString() {
      return bits == null ? "" : bits.toString();
    }
  }

  /**
   * Types without any parameters
   */
  public static class BaseType extends Type {
    private final String name;

    private BaseType(TypeKind kind, String name) {
      super(kind);
      this.name = name;
    }

    @Override
    protected List<?> parts() {
      return ImmutableList.of();
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /**
   * String, nat, int and real types, optionally limited in size.
   * For reals, the bound selects a fixed-size floating point
   * representation.
   */
  public static class BoundedType extends Type {
    private final Bound bound;

    public BoundedType(TypeKind kind, Bound bound) {
      super(kind);
      switch (kind) {
        case STRING:
        case NAT:
        case INT:
        case REAL:
          break;
        default:
          throw new YILRuntimeError("Not a bounded base type: " + kind);
      }
      this.bound = bound;
    }

    public Bound bound() {
      return bound;
    }

    @Override
    protected List<?> parts() {
      return ImmutableList.of(bound);
    }

    @Override
    public String toString() {
      switch (kind()) {
        case STRING:
          return "string" + bound;
        case NAT:
          return "nat" + bound;
        case INT:
          return "int" + bound;
        case REAL:
          if (bound.isBounded() && bound.bits() == 32) {
            return "float";
          } else if (bound.isBounded() && bound.bits() == 64) {
            return "double";
          }
          return "real";
        default:
          throw new YILRuntimeError("Unexpected kind " + kind());
      }
    }
  }

  public static class BitVectorType extends Type {
    private final int width;

    public BitVectorType(int width) {
      super(TypeKind.BIT_VECTOR);
      this.width = width;
    }

    public int width() {
      return width;
    }

    @Override
    protected List<?> parts() {
      return ImmutableList.of(width);
    }

    @Override
    public String toString() {
      return "bv" + width;
    }
  }

  public static class TupleType extends Type {
    private final ImmutableList<Type> elems;

    public TupleType(List<? extends Type> elems) {
      super(TypeKind.TUPLE);
      this.elems = ImmutableList.copyOf(elems);
    }

    public List<Type> elems() {
      return elems;
    }

    @Override
    protected List<?> parts() {
      return elems;
    }

    @Override
    public String toString() {
      return product(elems);
    }
  }

  public static class FunctionType extends Type {
    private final ImmutableList<Type> ins;
    private final Type out;

    public FunctionType(List<? extends Type> ins, Type out) {
      super(TypeKind.FUNCTION);
      this.ins = ImmutableList.copyOf(ins);
      this.out = out;
    }

    public List<Type> ins() {
      return ins;
    }

    public Type out() {
      return out;
    }

    @Override
    protected List<?> parts() {
      return ImmutableList.of(ins, out);
    }

    @Override
    public String toString() {
      return product(ins) + "->" + out;
    }
  }

  /**
   * Sequences, sets and arrays.  Arrays of any dimension share
   * one representation: the bound is the rank or size class.
   */
  public static class CollectionType extends Type {
    private final Bound bound;
    private final Type elem;

    public CollectionType(TypeKind kind, Bound bound, Type elem) {
      super(kind);
      if (kind != TypeKind.SEQ && kind != TypeKind.SET &&
          kind != TypeKind.ARRAY) {
        throw new YILRuntimeError("Not a collection type: " + kind);
      }
      this.bound = bound;
      this.elem = elem;
    }

    public Bound bound() {
      return bound;
    }

    public Type elem() {
      return elem;
    }

    @Override
    protected List<?> parts() {
      return ImmutableList.of(bound, elem);
    }

    @Override
    public String toString() {
      String prefix;
      if (kind() == TypeKind.SEQ) {
        prefix = "seq";
      } else if (kind() == TypeKind.SET) {
        prefix = "set";
      } else {
        prefix = "arr";
      }
      return prefix + bound + typeArgs(ImmutableList.of(elem));
    }
  }

  public static class MapType extends Type {
    private final Bound bound;
    private final Type key;
    private final Type value;

    public MapType(Bound bound, Type key, Type value) {
      super(TypeKind.MAP);
      this.bound = bound;
      this.key = key;
      this.value = value;
    }

    public Bound bound() {
      return bound;
    }

    public Type key() {
      return key;
    }

    public Type value() {
      return value;
    }

    @Override
    protected List<?> parts() {
      return ImmutableList.of(bound, key, value);
    }

    @Override
    public String toString() {
      return "map" + bound + typeArgs(ImmutableList.of(key, value));
    }
  }

  public static class NullableType extends Type {
    private final Type base;

    public NullableType(Type base) {
      super(TypeKind.NULLABLE);
      this.base = base;
    }

    public Type base() {
      return base;
    }

    @Override
    protected List<?> parts() {
      return ImmutableList.of(base);
    }

    @Override
    public String toString() {
      return base + "?";
    }
  }

  /**
   * Reference to a declared type, applied to type arguments
   */
  public static class ApplyType extends Type {
    private final Path path;
    private final ImmutableList<Type> args;

    public ApplyType(Path path, List<? extends Type> args) {
      super(TypeKind.APPLY);
      this.path = path;
      this.args = ImmutableList.copyOf(args);
    }

    public Path path() {
      return path;
    }

    public List<Type> args() {
      return args;
    }

    @Override
    protected List<?> parts() {
      return ImmutableList.of(path, args);
    }

    @Override
    public String toString() {
      return path + typeArgs(args);
    }
  }

  /**
   * Reference to a type parameter
   */
  public static class TypeVar extends Type {
    private final String name;

    public TypeVar(String name) {
      super(TypeKind.VAR);
      this.name = name;
    }

    public String name() {
      return name;
    }

    @Override
    protected List<?> parts() {
      return ImmutableList.of(name);
    }

    @Override
    public String toString() {
      return name;
    }
  }

  public static Type intType(Bound b) {
    return new BoundedType(TypeKind.INT, b);
  }

  public static Type natType(Bound b) {
    return new BoundedType(TypeKind.NAT, b);
  }

  public static Type realType(Bound b) {
    return new BoundedType(TypeKind.REAL, b);
  }

  public static Type stringType(Bound b) {
    return new BoundedType(TypeKind.STRING, b);
  }

  public static Type seqType(Type elem) {
    return new CollectionType(TypeKind.SEQ, NO_BOUND, elem);
  }

  public static Type setType(Type elem) {
    return new CollectionType(TypeKind.SET, NO_BOUND, elem);
  }

  public static Type arrayType(Bound rank, Type elem) {
    return new CollectionType(TypeKind.ARRAY, rank, elem);
  }

  public static Type mapType(Type key, Type value) {
    return new MapType(NO_BOUND, key, value);
  }

  public static Type tupleType(Type... elems) {
    return new TupleType(Arrays.asList(elems));
  }

  public static Type apply(Path path, Type... args) {
    return new ApplyType(path, Arrays.asList(args));
  }

  public static Type typeVar(String name) {
    return new TypeVar(name);
  }

  private static String typeArgs(List<Type> ts) {
    if (ts.isEmpty()) {
      return "";
    }
    return "<" + StringUtils.join(ts, ",") + ">";
  }

  private static String product(List<Type> ts) {
    if (ts.size() == 1) {
      return ts.get(0).toString();
    }
    return "(" + StringUtils.join(ts, ",") + ")";
  }
}
