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
import java.io.Serializable;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nullable;
import org.immutables.value.Value;

/** The persisted definition of a secondary index, as stored in the schema tables. */
@Value.Immutable(prehash = true)
public abstract class IndexMetadata implements Serializable {
  private static final long serialVersionUID = 7786125303541236119L;

  public static final String TARGET_OPTION_NAME = "target";
  public static final String CUSTOM_INDEX_OPTION_NAME = "class_name";
  public static final String INDEX_KEYS_OPTION_NAME = "index_keys";
  public static final String INDEX_VALUES_OPTION_NAME = "index_values";
  public static final String INDEX_ENTRIES_OPTION_NAME = "index_keys_and_values";

  public abstract String keyspace();

  public abstract String table();

  public abstract String name();

  public abstract Map<String, String> options();

  /** The content of the "target" option, or {@code null} if there is none. */
  @Nullable
  public String target() {
    return options().get(TARGET_OPTION_NAME);
  }

  public boolean isCustom() {
    String indexingClass = indexingClass();
    return indexingClass != null && !indexingClass.isEmpty();
  }

  @Nullable
  public String indexingClass() {
    return options().get(CUSTOM_INDEX_OPTION_NAME);
  }

  /**
   * The collection indexing flags set through the {@code index_keys}, {@code index_values} and
   * {@code index_keys_and_values} options, whatever their value. None is set for most indexes.
   *
   * @throws IllegalStateException if more than one of those options is present.
   */
  public CollectionIndexingType indexingType() {
    return ImmutableCollectionIndexingType.builder()
        .indexKeys(options().containsKey(INDEX_KEYS_OPTION_NAME))
        .indexValues(options().containsKey(INDEX_VALUES_OPTION_NAME))
        .indexEntries(options().containsKey(INDEX_ENTRIES_OPTION_NAME))
        .build();
  }

  /** The target type selected by the indexing options, if any of them is set. */
  public Optional<TargetType> optionsTargetType() {
    CollectionIndexingType indexingType = indexingType();
    if (!indexingType.indexKeys() && !indexingType.indexValues() && !indexingType.indexEntries()) {
      return Optional.empty();
    }
    return Optional.of(TargetType.fromIndexingType(indexingType));
  }

  public boolean isLocal() {
    return TargetParser.instance().isLocal(target());
  }

  /** @see TargetParser#targetColumnName(String) */
  @Nullable
  public String targetColumnName() {
    return TargetParser.instance().targetColumnName(target());
  }

  public static IndexMetadata create(
      String keyspace, String table, String name, Map<String, String> options) {
    return ImmutableIndexMetadata.builder()
        .keyspace(keyspace)
        .table(table)
        .name(name)
        .options(options)
        .build();
  }

  /** Creates the metadata of a (non custom) index over the provided targets. */
  public static IndexMetadata create(
      String keyspace, String table, String name, List<IndexTarget> targets) {
    return ImmutableIndexMetadata.builder()
        .keyspace(keyspace)
        .table(table)
        .name(name)
        .putOptions(TARGET_OPTION_NAME, TargetParser.instance().serializeTargets(targets))
        .build();
  }
}
