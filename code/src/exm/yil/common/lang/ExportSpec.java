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

import java.util.List;

import org.apache.commons.lang3.StringUtils;

import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;

/**
 * A module export directive with provides and reveals lists
 */
public class ExportSpec {

  public static final ExportSpec EMPTY =
      new ExportSpec(ImmutableList.<Path>of(), ImmutableList.<Path>of());

  public final ImmutableList<Path> provides;
  public final ImmutableList<Path> reveals;

  public ExportSpec(List<Path> provides, List<Path> reveals) {
    this.provides = ImmutableList.copyOf(provides);
    this.reveals = ImmutableList.copyOf(reveals);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof ExportSpec)) {
      return false;
    }
    ExportSpec other = (ExportSpec)obj;
    return provides.equals(other.provides) && reveals.equals(other.reveals);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(provides, reveals);
  }

  /** empty if nothing is exported */
  @Override
  public String toString() {
    if (provides.isEmpty() && reveals.isEmpty()) {
      return "";
    }
    StringBuilder sb = new StringBuilder("export \n");
    if (!provides.isEmpty()) {
      sb.append("   provides ").append(StringUtils.join(provides, ", "));
    }
    sb.append("\n");
    if (!reveals.isEmpty()) {
      sb.append("   reveals ").append(StringUtils.join(reveals, ", "));
    }
    return sb.toString();
  }
}
