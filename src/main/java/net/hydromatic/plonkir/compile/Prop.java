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
package net.hydromatic.plonkir.compile;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.base.Enums;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Compiler property.
 *
 * @see Compiler
 */
public enum Prop {
  /**
   * Boolean property "ignoreDisabledGates" controls whether the fallback
   * gate rewriter skips rows where none of a polynomial's selectors is
   * enabled. Default is true.
   */
  IGNORE_DISABLED_GATES("ignoreDisabledGates", Boolean.class, true, true),

  /**
   * Boolean property "generateDebugComments" controls whether the generated
   * IR contains comments that describe where each constraint comes from.
   * Default is false.
   */
  GENERATE_DEBUG_COMMENTS("generateDebugComments", Boolean.class, true,
      false),

  /**
   * Enum property "codegenStrategy" chooses how the IR is laid out into
   * functions. Default is {@link Strategy#GROUPS}.
   */
  CODEGEN_STRATEGY("codegenStrategy", Strategy.class, true, Strategy.GROUPS),

  /**
   * Enum property "lookupStrategy" chooses how lookups are lowered. Default
   * is {@link LookupMode#CALLBACKS}, which fails if the circuit has lookups
   * and no callbacks were supplied.
   */
  LOOKUP_STRATEGY("lookupStrategy", LookupMode.class, true,
      LookupMode.CALLBACKS),

  /** Maximum number of times an expression rewriter re-examines the
   * expressions it produced. Default is 20. */
  MAX_REWRITE_ITERATIONS("maxRewriteIterations", Integer.class, true, 20),

  /**
   * Boolean property "strictRewrite" controls what happens when expression
   * rewriting reaches {@link #MAX_REWRITE_ITERATIONS}. If true (the
   * default), compilation fails; if false, the tracer receives a warning and
   * the last expression is used.
   */
  STRICT_REWRITE("strictRewrite", Boolean.class, true, true);

  public final String camelName;
  private final Class<?> type;
  private final boolean required;
  private final Object defaultValue;

  /**
   * Map of all properties, keyed by both {@link #name()} and {@link
   * #camelName}.
   */
  public static final ImmutableMap<String, Prop> BY_NAME;

  /** List of all properties sorted by {@link #camelName}. */
  public static final List<Prop> BY_CAMEL_NAME;

  static {
    final List<Prop> list = Arrays.asList(values());
    final Ordering<Prop> ordering =
        Ordering.from(Comparator.comparing((Prop o) -> o.camelName));
    BY_CAMEL_NAME = ordering.sortedCopy(list);

    final Map<String, Prop> map = new LinkedHashMap<>();
    for (Prop value : BY_CAMEL_NAME) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Prop(String camelName, Class<?> type, boolean required,
      Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.required = required;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    checkArgument(validValue(type, defaultValue));
  }

  private static boolean validValue(Class<?> type, Object value) {
    if (type == Boolean.class
        || type == Integer.class
        || type.isEnum()) {
      return type.isInstance(value);
    }
    return false;
  }

  /** Looks up a property by name. Throws if not found; never returns null. */
  public static Prop lookup(String propName) {
    Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new IllegalArgumentException("property " + propName
          + " not found");
    }
    return prop;
  }

  /** Returns the value of a property. */
  public Object get(Map<Prop, Object> map) {
    Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(type == requestedType,
        "invalid type %s for property %s", type, camelName);
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    checkType(Boolean.class);
    return this.<Boolean>typeValue(map.get(this));
  }

  /** Returns the value of an integer property. */
  public int intValue(Map<Prop, Object> map) {
    checkType(Integer.class);
    return this.<Integer>typeValue(map.get(this));
  }

  /** Returns the value of an enum property. */
  public <E extends Enum<E>> E enumValue(Map<Prop, Object> map,
      Class<E> type) {
    checkType(type);
    return this.typeValue(map.get(this));
  }

  @SuppressWarnings("unchecked")
  private <T> T typeValue(@Nullable Object o) {
    return (T) (o == null ? defaultValue : o);
  }

  /** Sets the value of a property, allowing strings for enum types. */
  @SuppressWarnings({"rawtypes", "unchecked"})
  public void setLenient(Map<Prop, Object> map, @Nullable Object value) {
    if (type.isEnum() && value instanceof String) {
      Optional<Enum> optional =
          Enums.getIfPresent((Class<Enum>) type,
              ((String) value).toUpperCase(Locale.ROOT));
      if (!optional.isPresent()) {
        String values =
            Arrays.stream((Enum[]) type.getEnumConstants())
                .map(Enum::name)
                .collect(Collectors.joining("', '", "'", "'"));
        throw new IllegalArgumentException("value must be one of: "
            + values);
      }
      set(map, optional.get());
      return;
    }
    set(map, value);
  }

  /** Sets the value of a property. Checks that its type is valid. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      if (required) {
        throw new IllegalArgumentException("property is required");
      }
      map.remove(this);
    } else {
      if (!type.isInstance(value)) {
        throw new IllegalArgumentException("value for property must have type "
            + type);
      }
      map.put(this, value);
    }
  }

  /** Allowed values for {@link #CODEGEN_STRATEGY} property. */
  public enum Strategy {
    /** All constraints in the main function. */
    INLINE,
    /** One function per gate, called from main once per enabled row. */
    CALL_GATES,
    /** One function per class of equivalent groups. The default. */
    GROUPS
  }

  /** Allowed values for {@link #LOOKUP_STRATEGY} property. */
  public enum LookupMode {
    /** Lookups are lowered by the client's lookup callbacks. The default. */
    CALLBACKS,
    /** One function per kind of lookup, called once per region row. */
    MODULE,
    /** Each lookup becomes an assertion that some table row matches. */
    ROW_CONSTRAINT
  }
}

// End Prop.java
