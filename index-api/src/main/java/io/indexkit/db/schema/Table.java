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
package io.indexkit.db.schema;

import static io.indexkit.db.schema.Column.Kind.Clustering;
import static io.indexkit.db.schema.Column.Kind.PartitionKey;

import com.google.common.collect.ImmutableList;
import java.io.Serializable;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.immutables.value.Value;

@Value.Immutable(prehash = true)
public abstract class Table implements ColumnResolver, Serializable {
  private static final long serialVersionUID = 6630112508436151329L;

  public abstract String keyspace();

  public abstract String name();

  public abstract List<Column> columns();

  @Value.Lazy
  Map<String, Column> columnMap() {
    return columns().stream().collect(Collectors.toMap(Column::name, Function.identity()));
  }

  @Value.Lazy
  public List<Column> partitionKeyColumns() {
    return ImmutableList.copyOf(
        columns().stream().filter(c -> c.kind() == PartitionKey).collect(Collectors.toList()));
  }

  // for clustering keys, order matters
  @Value.Lazy
  public List<Column> clusteringKeyColumns() {
    return ImmutableList.copyOf(
        columns().stream().filter(c -> c.kind() == Clustering).collect(Collectors.toList()));
  }

  public Column column(String name) {
    return columnMap().get(name);
  }

  @Override
  public Optional<Column> resolve(String name) {
    return Optional.ofNullable(column(name));
  }

  public static Table create(String keyspace, String name, Iterable<Column> columns) {
    return ImmutableTable.builder().keyspace(keyspace).name(name).columns(columns).build();
  }

  @Override
  public String toString() {
    return String.format(
        "Table '%s.%s' (%s)",
        keyspace(),
        name(),
        columns().stream()
            .map(c -> c.kind() == null ? c.name() : c.name() + " " + c.kind())
            .collect(Collectors.joining(", ")));
  }
}
