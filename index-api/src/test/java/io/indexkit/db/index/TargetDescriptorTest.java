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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.indexkit.db.schema.Column;
import org.junit.jupiter.api.Test;

class TargetDescriptorTest {

  private static final Column A = Column.reference("a");
  private static final Column B = Column.reference("b");
  private static final Column C = Column.reference("c");

  @Test
  public void defaultsToValues() {
    TargetDescriptor descriptor =
        ImmutableTargetDescriptor.builder().addPartitionKeyColumns(A).build();

    assertThat(descriptor.type()).isEqualTo(TargetType.VALUES);
    assertThat(descriptor.indexingType().indexValues()).isTrue();
  }

  @Test
  public void requiresPartitionKeyColumn() {
    assertThatThrownBy(() -> ImmutableTargetDescriptor.builder().addClusteringKeyColumns(C).build())
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  public void singlePartitionKeyColumnToTargets() {
    assertThat(TargetDescriptor.of(TargetType.FULL, A).toTargets())
        .containsExactly(IndexTarget.single(A));
  }

  @Test
  public void compositeToTargets() {
    TargetDescriptor descriptor =
        ImmutableTargetDescriptor.builder()
            .addPartitionKeyColumns(A, B)
            .addClusteringKeyColumns(C)
            .build();

    assertThat(descriptor.isLocal()).isTrue();
    assertThat(descriptor.toTargets())
        .containsExactly(IndexTarget.multiple(A, B), IndexTarget.single(C));
  }

  @Test
  public void indexTargetShapes() {
    assertThat(IndexTarget.single(A).column()).isEqualTo(A);
    assertThatThrownBy(() -> IndexTarget.multiple(A, B).column())
        .isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(() -> IndexTarget.multiple())
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("An index target needs at least one column");
    assertThatThrownBy(
            () ->
                ImmutableIndexTarget.builder()
                    .shape(IndexTarget.Shape.SINGLE_COLUMN)
                    .addColumns(A, B)
                    .build())
        .isInstanceOf(IllegalStateException.class);
  }
}
