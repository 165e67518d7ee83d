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
import io.indexkit.db.schema.Column;
import java.util.Arrays;
import java.util.List;
import org.immutables.value.Value;

/**
 * One element of the target list of an index being created: either a single column or a group of
 * columns that together form one component of the index key.
 */
@Value.Immutable(prehash = true)
public abstract class IndexTarget {

  public enum Shape {
    SINGLE_COLUMN,
    MULTIPLE_COLUMNS,
  }

  public abstract Shape shape();

  public abstract List<Column> columns();

  @Value.Check
  protected void check() {
    Preconditions.checkState(!columns().isEmpty(), "An index target needs at least one column");
    Preconditions.checkState(
        shape() != Shape.SINGLE_COLUMN || columns().size() == 1,
        "A single column index target cannot hold %s columns",
        columns().size());
  }

  /** The only column of a {@link Shape#SINGLE_COLUMN} target. */
  public Column column() {
    Preconditions.checkState(
        shape() == Shape.SINGLE_COLUMN, "Index target %s is not a single column", this);
    return columns().get(0);
  }

  public static IndexTarget single(Column column) {
    return ImmutableIndexTarget.builder().shape(Shape.SINGLE_COLUMN).addColumns(column).build();
  }

  public static IndexTarget multiple(List<Column> columns) {
    return ImmutableIndexTarget.builder()
        .shape(Shape.MULTIPLE_COLUMNS)
        .addAllColumns(columns)
        .build();
  }

  public static IndexTarget multiple(Column... columns) {
    return multiple(Arrays.asList(columns));
  }
}
