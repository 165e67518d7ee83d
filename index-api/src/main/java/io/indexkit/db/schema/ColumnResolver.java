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

import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * Looks up columns by name against an immutable schema snapshot.
 *
 * <p>Implementations must not have side effects: index target parsing may call {@link
 * #resolve(String)} several times for a single target, from any thread.
 */
@FunctionalInterface
public interface ColumnResolver {

  /**
   * @param name the exact (case-sensitive, unquoted) name of the column.
   * @return the column, or empty if the schema has no column by that name.
   */
  Optional<Column> resolve(String name);

  static ColumnResolver of(Iterable<Column> columns) {
    Map<String, Column> byName =
        StreamSupport.stream(columns.spliterator(), false)
            .collect(Collectors.toMap(Column::name, Function.identity()));
    return name -> Optional.ofNullable(byName.get(name));
  }
}
