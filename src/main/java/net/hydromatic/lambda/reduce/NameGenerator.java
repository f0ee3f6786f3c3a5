/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.lambda.reduce;

import java.util.Set;

/**
 * Generates fresh variable names.
 *
 * <p>Names are "Var1", "Var2", and so on. The generator has no state; the
 * name it returns depends only on the set of names in use, so evaluating the
 * same term twice renames the same binders the same way.
 */
public class NameGenerator {
  /** Prefix of generated names. */
  public static final String PREFIX = "Var";

  private NameGenerator() {}

  /** Returns the first name "Var1", "Var2", ... that is not in a set. */
  public static String fresh(Set<String> usedNames) {
    for (int i = 1; ; i++) {
      final String name = PREFIX + i;
      if (!usedNames.contains(name)) {
        return name;
      }
    }
  }
}

// End NameGenerator.java
