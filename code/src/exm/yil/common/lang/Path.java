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
import java.util.Iterator;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableList;

import exm.yil.common.exceptions.YILRuntimeError;

/**
 * A qualified identifier of a declaration, e.g. M.D.f.
 * The empty path is the root of the program.
 * See {@link exm.yil.frontend.DeclResolver} for how paths are resolved.
 *
 * Paths are immutable values compared segment by segment.
 */
public class Path implements Comparable<Path> {

  private static final Path ROOT = new Path(ImmutableList.<String>of());

  private final ImmutableList<String> names;

  public Path(List<String> names) {
    this.names = ImmutableList.copyOf(names);
  }

  public static Path root() {
    return ROOT;
  }

  public static Path of(String... names) {
    return new Path(Arrays.asList(names));
  }

  public List<String> names() {
    return names;
  }

  public int size() {
    return names.size();
  }

  /** empty path */
  public boolean isRoot() {
    return names.isEmpty();
  }

  /**
   * this . n
   * @param n child name; the empty name leaves the path unchanged
   */
  public Path child(String n) {
    if (n.isEmpty()) {
      return this;
    }
    return new Path(ImmutableList.<String>builder()
                      .addAll(names).add(n).build());
  }

  /**
   * this . ns, skipping empty segments of ns
   */
  public Path append(Path ns) {
    ImmutableList.Builder<String> result = ImmutableList.builder();
    result.addAll(names);
    for (String n: ns.names) {
      if (!n.isEmpty()) {
        result.add(n);
      }
    }
    return new Path(result.build());
  }

  /**
   * Prefix the root component, e.g. with "Old" or "New":
   * a.b ---> Old.a.b where "Old.a" is a single segment
   */
  public Path prefix(String s) {
    checkNotRoot("prefix");
    ImmutableList.Builder<String> result = ImmutableList.builder();
    result.add(s + "." + names.get(0));
    result.addAll(names.subList(1, names.size()));
    return new Path(result.build());
  }

  /** a.b.c ---> a.b */
  public Path parent() {
    checkNotRoot("parent");
    return new Path(names.subList(0, names.size() - 1));
  }

  /** a.b.c ---> c */
  public String name() {
    checkNotRoot("name");
    return names.get(names.size() - 1);
  }

  /**
   * @return true if p = this . rest for some (possibly empty) rest
   */
  public boolean isAncestorOf(Path p) {
    int l = names.size();
    return p.names.size() >= l && p.names.subList(0, l).equals(names);
  }

  /**
   * this . that ---> that
   * @return that unchanged if this is not an ancestor of it
   */
  public Path relativize(Path that) {
    if (isAncestorOf(that)) {
      return new Path(that.names.subList(names.size(), that.names.size()));
    } else {
      return that;
    }
  }

  private void checkNotRoot(String operation) {
    if (isRoot()) {
      throw new YILRuntimeError("Cannot take " + operation +
                                " of the root path");
    }
  }

  @Override
  public int compareTo(Path o) {
    Iterator<String> it1 = names.iterator();
    Iterator<String> it2 = o.names.iterator();
    while (it1.hasNext() && it2.hasNext()) {
      int c = it1.next().compareTo(it2.next());
      if (c != 0) {
        return c;
      }
    }
    return Integer.compare(names.size(), o.names.size());
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Path)) {
      return false;
    }
    return names.equals(((Path)obj).names);
  }

  @Override
  public int hashCode() {
    return names.hashCode();
  }

  /** dot-separated names */
  @Override
  public String toString() {
    return StringUtils.join(names, ".");
  }
}
