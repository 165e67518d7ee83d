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

public class ColumnNotFoundException extends InvalidTargetException {
  private final String columnName;

  public ColumnNotFoundException(String target, String columnName) {
    super(target, String.format("Column %s not found", columnName));
    this.columnName = columnName;
  }

  public String getColumnName() {
    return columnName;
  }
}
