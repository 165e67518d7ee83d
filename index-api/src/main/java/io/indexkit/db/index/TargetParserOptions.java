/*
 * Copyright The Stargate Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.indexkit.db.index;

import org.immutables.value.Value;

/** Settings of a {@link TargetParser}, by default read from system properties. */
@Value.Immutable(prehash = true)
public abstract class TargetParserOptions {

  public static final String STRICT_DUPLICATE_DETECTION_PROPERTY =
      "indexkit.index.target.strict_duplicate_detection";
  public static final String FLATTEN_NESTED_ARRAYS_PROPERTY =
      "indexkit.index.target.json_flatten_nested";

  /**
   * Whether a JSON target repeating a field, like {@code {"pk":["a"],"pk":["b"]}}, is refused as
   * JSON. When it is, such a target is handled as a bare column name. Otherwise the last
   * occurrence of the field wins.
   */
  @Value.Default
  public boolean strictDuplicateDetection() {
    return false;
  }

  /**
   * Whether an array nested in the {@code pk} or {@code ck} field of a JSON target, as written for
   * multi-column clustering targets, contributes its elements as successive columns. When it does
   * not, such a target is malformed.
   */
  @Value.Default
  public boolean flattenNestedArrays() {
    return true;
  }

  public static TargetParserOptions defaults() {
    return ImmutableTargetParserOptions.builder().build();
  }

  public static TargetParserOptions fromSystemProperties() {
    return ImmutableTargetParserOptions.builder()
        .strictDuplicateDetection(Boolean.getBoolean(STRICT_DUPLICATE_DETECTION_PROPERTY))
        .flattenNestedArrays(
            Boolean.parseBoolean(System.getProperty(FLATTEN_NESTED_ARRAYS_PROPERTY, "true")))
        .build();
  }
}
