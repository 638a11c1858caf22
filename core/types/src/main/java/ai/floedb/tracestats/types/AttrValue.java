/*
 * Copyright 2026 Yellowbrick Data, Inc.
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
 * limitations under the License.
 */

package ai.floedb.tracestats.types;

import java.util.Objects;

/**
 * A single attribute value read from a trace block.
 *
 * <p>The set of variants is closed: strings, 64-bit integers, 64-bit floats, booleans and the
 * {@link Missing} marker for null leaves. Whether a value belongs to an array attribute is not
 * part of the value; readers carry that flag next to it.
 *
 * <p>{@link #byteSize()} is the serialized size used by the statistics: UTF-8 length for strings,
 * 8 for integers and floats, 1 for booleans and 0 for missing values.
 */
public sealed interface AttrValue
    permits AttrValue.Str, AttrValue.Int64, AttrValue.Float64, AttrValue.Bool, AttrValue.Missing {

  ValueKind kind();

  /** Serialized size in bytes. */
  int byteSize();

  /** Canonical string form, used as the cardinality key. Missing values render as {@code ""}. */
  String asString();

  default boolean isMissing() {
    return kind() == ValueKind.MISSING;
  }

  static AttrValue of(String value) {
    return value == null ? Missing.INSTANCE : new Str(value);
  }

  static AttrValue of(long value) {
    return new Int64(value);
  }

  static AttrValue of(double value) {
    return new Float64(value);
  }

  static AttrValue of(boolean value) {
    return value ? Bool.TRUE : Bool.FALSE;
  }

  static AttrValue missing() {
    return Missing.INSTANCE;
  }

  record Str(String value) implements AttrValue {
    public Str {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public ValueKind kind() {
      return ValueKind.STRING;
    }

    @Override
    public int byteSize() {
      return Utf8.encodedLength(value);
    }

    @Override
    public String asString() {
      return value;
    }
  }

  record Int64(long value) implements AttrValue {
    @Override
    public ValueKind kind() {
      return ValueKind.INT64;
    }

    @Override
    public int byteSize() {
      return 8;
    }

    @Override
    public String asString() {
      return Long.toString(value);
    }
  }

  record Float64(double value) implements AttrValue {
    @Override
    public ValueKind kind() {
      return ValueKind.FLOAT64;
    }

    @Override
    public int byteSize() {
      return 8;
    }

    @Override
    public String asString() {
      return Double.toString(value);
    }
  }

  record Bool(boolean value) implements AttrValue {
    static final Bool TRUE = new Bool(true);
    static final Bool FALSE = new Bool(false);

    @Override
    public ValueKind kind() {
      return ValueKind.BOOL;
    }

    @Override
    public int byteSize() {
      return 1;
    }

    @Override
    public String asString() {
      return Boolean.toString(value);
    }
  }

  enum Missing implements AttrValue {
    INSTANCE;

    @Override
    public ValueKind kind() {
      return ValueKind.MISSING;
    }

    @Override
    public int byteSize() {
      return 0;
    }

    @Override
    public String asString() {
      return "";
    }
  }
}
