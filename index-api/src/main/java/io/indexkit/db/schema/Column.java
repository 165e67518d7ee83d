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

import java.io.Serializable;
import javax.annotation.Nullable;
import org.immutables.value.Value;

/**
 * A column of a table, as handed out by a {@link ColumnResolver}.
 *
 * <p>Only the name takes part in index target strings: the canonical textual form of a column in a
 * target is its {@link #name()}, unquoted.
 */
@Value.Immutable(prehash = true)
public abstract class Column implements Serializable {
  private static final long serialVersionUID = 4619532188740357215L;

  public enum Kind {
    PartitionKey,
    Clustering,
    Regular,
    Static;

    public boolean isPrimaryKeyKind() {
      return this == PartitionKey || this == Clustering;
    }
  }

  public abstract String name();

  @Nullable
  public abstract Kind kind();

  @Nullable
  public abstract String keyspace();

  @Nullable
  public abstract String table();

  public static Column reference(String name) {
    return ImmutableColumn.builder().name(name).build();
  }

  public static Column create(String name, Kind kind) {
    return ImmutableColumn.builder().name(name).kind(kind).build();
  }

  public boolean isPrimaryKeyComponent() {
    if (kind() == null) {
      return false;
    }
    return kind().isPrimaryKeyKind();
  }

  public boolean isPartitionKey() {
    return kind() == Kind.PartitionKey;
  }

  public boolean isClusteringKey() {
    return kind() == Kind.Clustering;
  }
}
