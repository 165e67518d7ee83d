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

import io.indexkit.db.schema.CollectionIndexingType;
import io.indexkit.db.schema.ImmutableCollectionIndexingType;
import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/** What part of the target column(s) an index covers. */
public enum TargetType {
  KEYS("keys", ImmutableCollectionIndexingType.builder().indexKeys(true).build()),
  ENTRIES("entries", ImmutableCollectionIndexingType.builder().indexEntries(true).build()),
  VALUES("values", ImmutableCollectionIndexingType.builder().indexValues(true).build()),
  FULL("full", ImmutableCollectionIndexingType.builder().indexFull(true).build()),
  ;

  public static final TargetType DEFAULT = VALUES;

  private static final Map<String, TargetType> BY_KEYWORD =
      Arrays.stream(values()).collect(Collectors.toMap(TargetType::keyword, Function.identity()));

  private static final Map<CollectionIndexingType, TargetType> BY_INDEXING_TYPE =
      Arrays.stream(values())
          .collect(Collectors.toMap(TargetType::toIndexingType, Function.identity()));

  private final String keyword;
  private final CollectionIndexingType indexingType;

  TargetType(String keyword, CollectionIndexingType indexingType) {
    this.keyword = keyword;
    this.indexingType = indexingType;
  }

  /** The keyword of this type in the legacy functional target form, e.g. {@code keys(m)}. */
  public String keyword() {
    return keyword;
  }

  public CollectionIndexingType toIndexingType() {
    return indexingType;
  }

  /**
   * @param keyword one of {@code keys}, {@code entries}, {@code values} or {@code full}, matched
   *     case-sensitively.
   */
  public static TargetType fromString(String keyword) {
    TargetType value = BY_KEYWORD.get(keyword);
    if (value == null) {
      throw new IllegalArgumentException("Invalid index target type " + keyword);
    }
    return value;
  }

  public static TargetType fromIndexingType(CollectionIndexingType indexingType) {
    TargetType value = BY_INDEXING_TYPE.get(indexingType);
    if (value == null) {
      throw new IllegalArgumentException("Invalid value " + indexingType);
    }
    return value;
  }
}
