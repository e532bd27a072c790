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
package net.hydromatic.plonkir.synthesis;

import net.hydromatic.plonkir.compile.CompileException;

/** Error in the structure of a circuit, detected while its regions, cells
 * and groups are being recorded. */
public class SynthesisException extends CompileException {
  public SynthesisException(String message) {
    super(message);
  }

  /** Creates an exception for cells whose region index does not match the
   * region they are used in. */
  public static SynthesisException inconsistentRegionIndex(Object cells) {
    return new SynthesisException("Inconsistent region index in cells: "
        + cells);
  }
}

// End SynthesisException.java
