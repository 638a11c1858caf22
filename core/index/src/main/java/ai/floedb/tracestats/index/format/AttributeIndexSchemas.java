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

package ai.floedb.tracestats.index.format;

import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.MessageTypeParser;

/**
 * Parquet layout of {@code index.parquet}: one record per key, a LIST column per value type whose
 * elements carry the value, its code and its row numbers. Codes are absent from the rows variant
 * and row numbers from the codes variant.
 */
public final class AttributeIndexSchemas {

  static final String KEY = "Key";
  static final String KEY_CODE = "KeyCode";
  static final String SCOPE_MASK = "ScopeMask";
  static final String VALUES_STRING = "ValuesString";
  static final String VALUES_INT = "ValuesInt";
  static final String VALUES_FLOAT = "ValuesFloat";
  static final String VALUES_BOOL = "ValuesBool";
  static final String VALUE = "Value";
  static final String VALUE_CODE = "ValueCode";
  static final String ROW_NUMBERS = "RowNumbers";
  static final String[] LEVELS = {"Lvl01", "Lvl02", "Lvl03", "Lvl04"};

  private AttributeIndexSchemas() {}

  public static MessageType forType(IndexType type) {
    boolean codes = type != IndexType.ROWS;
    boolean rows = type != IndexType.CODES;
    StringBuilder sb = new StringBuilder("message IndexedAttr {\n");
    sb.append("  required binary ").append(KEY).append(" (STRING);\n");
    if (codes) {
      sb.append("  required int32 ").append(KEY_CODE).append(";\n");
    }
    sb.append("  required int64 ").append(SCOPE_MASK).append(";\n");
    values(sb, VALUES_STRING, "binary", " (STRING)", codes, rows);
    values(sb, VALUES_INT, "int64", "", codes, rows);
    values(sb, VALUES_FLOAT, "double", "", codes, rows);
    values(sb, VALUES_BOOL, "boolean", "", codes, rows);
    return MessageTypeParser.parseMessageType(sb.append("}\n").toString());
  }

  private static void values(
      StringBuilder sb,
      String name,
      String primitive,
      String annotation,
      boolean codes,
      boolean rows) {
    sb.append("  required group ").append(name).append(" (LIST) {\n");
    sb.append("    repeated group list {\n");
    sb.append("      required group element {\n");
    sb.append("        repeated ")
        .append(primitive)
        .append(' ')
        .append(VALUE)
        .append(annotation)
        .append(";\n");
    if (codes) {
      sb.append("        required int32 ").append(VALUE_CODE).append(";\n");
    }
    if (rows) {
      sb.append("        repeated group ").append(ROW_NUMBERS).append(" {\n");
      for (String level : LEVELS) {
        sb.append("          required int64 ").append(level).append(";\n");
      }
      sb.append("        }\n");
    }
    sb.append("      }\n    }\n  }\n");
  }
}
