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

import com.google.common.collect.ImmutableList;

/**
 * Result of an analysis of the imports of a module: the module and the
 * imports found so far, most recent first
 */
public class ModuleImports {
  public final Path modulePath;
  public final ImmutableList<ImportDirective> imports;

  public ModuleImports(Path modulePath, List<ImportDirective> imports) {
    this.modulePath = modulePath;
    this.imports = ImmutableList.copyOf(imports);
  }

  public ModuleImports() {
    this(Path.root(), ImmutableList.<ImportDirective>of());
  }

  public ModuleImports setModulePath(Path newPath) {
    return new ModuleImports(newPath, imports);
  }

  public ModuleImports addImport(ImportDirective importDirective) {
    return new ModuleImports(modulePath, ImmutableList.<ImportDirective>builder()
                               .add(importDirective).addAll(imports).build());
  }
}
