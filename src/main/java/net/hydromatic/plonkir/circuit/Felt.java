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
package net.hydromatic.plonkir.circuit;

import static com.google.common.base.Preconditions.checkArgument;

import java.math.BigInteger;

/**
 * Element of the scalar field of the BN254 curve.
 *
 * <p>Values are immutable and always reduced modulo {@link #MODULUS}.
 * {@link #toString()} prints values in the upper half of the field as small
 * negative numbers, so that {@code MINUS_ONE} prints as "-1".
 */
public final class Felt implements Comparable<Felt> {
  /** Order of the field. */
  public static final BigInteger MODULUS =
      new BigInteger(
          "30644e72e131a029b85045b68181585d2833e84879b9709143e1f593f0000001",
          16);

  private static final BigInteger HALF = MODULUS.shiftRight(1);

  public static final Felt ZERO = new Felt(BigInteger.ZERO);
  public static final Felt ONE = new Felt(BigInteger.ONE);
  public static final Felt MINUS_ONE =
      new Felt(MODULUS.subtract(BigInteger.ONE));

  private final BigInteger value;

  private Felt(BigInteger value) {
    checkArgument(value.signum() >= 0 && value.compareTo(MODULUS) < 0);
    this.value = value;
  }

  /** Creates a field element from a (possibly negative) long. */
  public static Felt of(long value) {
    return of(BigInteger.valueOf(value));
  }

  /** Creates a field element from a (possibly negative or large) integer. */
  public static Felt of(BigInteger value) {
    final BigInteger v = value.mod(MODULUS);
    if (v.signum() == 0) {
      return ZERO;
    }
    if (v.equals(BigInteger.ONE)) {
      return ONE;
    }
    return new Felt(v);
  }

  /** Returns the canonical representative, in {@code [0, MODULUS)}. */
  public BigInteger toBigInteger() {
    return value;
  }

  public Felt add(Felt o) {
    return of(value.add(o.value));
  }

  public Felt subtract(Felt o) {
    return of(value.subtract(o.value));
  }

  public Felt multiply(Felt o) {
    return of(value.multiply(o.value));
  }

  public Felt negate() {
    return of(value.negate());
  }

  public boolean isZero() {
    return value.signum() == 0;
  }

  public boolean isOne() {
    return value.equals(BigInteger.ONE);
  }

  public boolean isMinusOne() {
    return equals(MINUS_ONE);
  }

  @Override public int compareTo(Felt o) {
    return value.compareTo(o.value);
  }

  @Override public int hashCode() {
    return value.hashCode();
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Felt
        && value.equals(((Felt) o).value);
  }

  @Override public String toString() {
    if (value.compareTo(HALF) > 0) {
      return "-" + MODULUS.subtract(value);
    }
    return value.toString();
  }
}

// End Felt.java
