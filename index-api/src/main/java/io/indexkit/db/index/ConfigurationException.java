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

/**
 * Thrown when the persisted definition of an index cannot be interpreted. The underlying failure
 * is available as the cause.
 */
public class ConfigurationException extends RuntimeException {
  private final String indexName;
  private final String target;

  public ConfigurationException(String indexName, String target, Throwable cause) {
    super(
        String.format(
            "Unable to parse targets for index %s (%s): %s",
            indexName, target, cause.getMessage()),
        cause);
    this.indexName = indexName;
    this.target = target;
  }

  public String getIndexName() {
    return indexName;
  }

  public String getTarget() {
    return target;
  }
}
