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

/** Thrown when an index target string cannot be turned into a {@link TargetDescriptor}. */
public class InvalidTargetException extends IllegalArgumentException {
  private final String target;

  public InvalidTargetException(String target, String message) {
    super(message);
    this.target = target;
  }

  /** The raw target string that failed to parse. */
  public String getTarget() {
    return target;
  }
}
