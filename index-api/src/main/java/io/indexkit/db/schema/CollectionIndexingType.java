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

import com.google.common.base.Preconditions;
import java.io.Serializable;
import org.immutables.value.Value;

/**
 * Flags telling which part of a column an index covers. At most one flag is set; none means the
 * column is indexed as a whole.
 */
@Value.Immutable(prehash = true)
public abstract class CollectionIndexingType implements Serializable {
  private static final long serialVersionUID = -3311726437162540893L;

  /** Keys of a map column. */
  @Value.Default
  public boolean indexKeys() {
    return false;
  }

  /** Values of a collection, or the value of a non-collection column. */
  @Value.Default
  public boolean indexValues() {
    return false;
  }

  /** Key/value pairs of a map column. */
  @Value.Default
  public boolean indexEntries() {
    return false;
  }

  /** The whole value of a frozen collection. */
  @Value.Default
  public boolean indexFull() {
    return false;
  }

  @Value.Check
  protected void check() {
    int flags = 0;
    for (boolean flag : new boolean[] {indexKeys(), indexValues(), indexEntries(), indexFull()}) {
      flags += flag ? 1 : 0;
    }
    Preconditions.checkState(flags <= 1, "At most one indexing flag can be set, got %s", this);
  }
}
