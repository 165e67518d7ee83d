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

import com.google.common.base.Preconditions;
import io.indexkit.db.schema.CollectionIndexingType;
import io.indexkit.db.schema.Column;
import java.util.ArrayList;
import java.util.List;
import org.immutables.value.Value;

/**
 * The structured content of an index target string: the indexed columns, split by the role they
 * play in the index, and what part of their value is indexed.
 *
 * <p>Targets in the legacy forms ({@code m} or {@code keys(m)}) always yield a single partition key
 * column and no clustering columns. Targets in the JSON form may have several columns in either
 * role but are always of type {@link TargetType#VALUES}.
 */
@Value.Immutable(prehash = true)
public abstract class TargetDescriptor {

  @Value.Default
  public TargetType type() {
    return TargetType.DEFAULT;
  }

  public abstract List<Column> partitionKeyColumns();

  public abstract List<Column> clusteringKeyColumns();

  @Value.Check
  protected void check() {
    Preconditions.checkState(
        !partitionKeyColumns().isEmpty(),
        "An index target needs at least one partition key column");
  }

  /**
   * Whether the index shares the partition key of its base table and is only differentiated by
   * clustering columns.
   */
  public boolean isLocal() {
    return !clusteringKeyColumns().isEmpty();
  }

  public CollectionIndexingType indexingType() {
    return type().toIndexingType();
  }

  /**
   * The columns of this descriptor as the index targets that {@link
   * TargetParser#serializeTargets(List)} turns back into an equivalent target string. The type is
   * not carried over.
   */
  public List<IndexTarget> toTargets() {
    List<IndexTarget> targets = new ArrayList<>(1 + clusteringKeyColumns().size());
    targets.add(
        partitionKeyColumns().size() == 1
            ? IndexTarget.single(partitionKeyColumns().get(0))
            : IndexTarget.multiple(partitionKeyColumns()));
    for (Column column : clusteringKeyColumns()) {
      targets.add(IndexTarget.single(column));
    }
    return targets;
  }

  public static TargetDescriptor of(TargetType type, Column column) {
    return ImmutableTargetDescriptor.builder().type(type).addPartitionKeyColumns(column).build();
  }
}
