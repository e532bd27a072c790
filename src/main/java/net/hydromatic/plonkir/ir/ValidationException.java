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
package net.hydromatic.plonkir.ir;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.plonkir.compile.CompileException;

/** Generated IR is not consistent. Holds every problem that was found. */
public class ValidationException extends CompileException {
  public final ImmutableList<String> errors;

  public ValidationException(List<String> errors) {
    super("IR validation failed:\n" + String.join("\n", errors));
    this.errors = ImmutableList.copyOf(errors);
  }
}

// End ValidationException.java
