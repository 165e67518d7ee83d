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
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableMap;
import io.indexkit.db.schema.Column;
import io.indexkit.db.schema.ColumnResolver;
import io.indexkit.db.schema.ImmutableCollectionIndexingType;
import java.util.Arrays;
import java.util.Collections;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class IndexMetadataTest {

  private final TargetParser parser = TargetParser.instance();

  @Mock private ColumnResolver resolver;

  @Test
  public void shouldParseTargetOption() {
    // given
    Column column = Column.create("m", Column.Kind.Regular);
    when(resolver.resolve("m")).thenReturn(Optional.of(column));
    IndexMetadata index =
        IndexMetadata.create("ks", "tbl", "m_idx", ImmutableMap.of("target", "keys(m)"));

    // when
    TargetDescriptor descriptor = parser.parse(resolver, index);

    // then
    assertThat(descriptor.type()).isEqualTo(TargetType.KEYS);
    assertThat(descriptor.partitionKeyColumns()).containsExactly(column);
    verify(resolver).resolve("m");
  }

  @Test
  public void shouldWrapUnknownColumn() {
    // given
    when(resolver.resolve(anyString())).thenReturn(Optional.empty());
    IndexMetadata index =
        IndexMetadata.create("ks", "tbl", "gone_idx", ImmutableMap.of("target", "gone"));

    // when, then
    assertThatThrownBy(() -> parser.parse(resolver, index))
        .isInstanceOf(ConfigurationException.class)
        .hasMessage("Unable to parse targets for index gone_idx (gone): Column gone not found")
        .hasCauseInstanceOf(ColumnNotFoundException.class)
        .satisfies(
            e -> {
              ConfigurationException configurationException = (ConfigurationException) e;
              assertThat(configurationException.getIndexName()).isEqualTo("gone_idx");
              assertThat(configurationException.getTarget()).isEqualTo("gone");
            });
  }

  @Test
  public void shouldWrapMalformedTarget() {
    IndexMetadata index =
        IndexMetadata.create("ks", "tbl", "bad_idx", ImmutableMap.of("target", "{\"pk\":1}"));

    assertThatThrownBy(() -> parser.parse(resolver, index))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("bad_idx ({\"pk\":1})")
        .hasCauseInstanceOf(MalformedTargetException.class);
  }

  @Test
  public void shouldWrapMissingTarget() {
    IndexMetadata index = IndexMetadata.create("ks", "tbl", "no_target", ImmutableMap.of());

    assertThatThrownBy(() -> parser.parse(resolver, index))
        .isInstanceOf(ConfigurationException.class)
        .hasMessage(
            "Unable to parse targets for index no_target (null): "
                + "No target definition found for index no_target")
        .hasCauseInstanceOf(InvalidTargetException.class);
  }

  @Test
  public void shouldCreateFromTargets() {
    Column a = Column.create("a", Column.Kind.PartitionKey);
    Column c = Column.create("c", Column.Kind.Clustering);

    IndexMetadata local =
        IndexMetadata.create(
            "ks", "tbl", "local_idx", Arrays.asList(IndexTarget.single(a), IndexTarget.single(c)));
    IndexMetadata global =
        IndexMetadata.create(
            "ks", "tbl", "global_idx", Collections.singletonList(IndexTarget.single(c)));

    assertThat(local.target()).isEqualTo("{\"pk\":[\"a\"],\"ck\":[\"c\"]}");
    assertThat(local.isLocal()).isTrue();
    assertThat(local.targetColumnName()).isEqualTo("c");
    assertThat(local.isCustom()).isFalse();

    assertThat(global.target()).isEqualTo("c");
    assertThat(global.isLocal()).isFalse();
    assertThat(global.targetColumnName()).isEqualTo("c");
  }

  @Test
  public void shouldDetectCustomIndex() {
    IndexMetadata index =
        IndexMetadata.create(
            "ks",
            "tbl",
            "sai_idx",
            ImmutableMap.of("target", "v", "class_name", "StorageAttachedIndex"));

    assertThat(index.isCustom()).isTrue();
    assertThat(index.indexingClass()).isEqualTo("StorageAttachedIndex");
  }

  @Test
  public void shouldHandleMissingTargetWhenClassifying() {
    IndexMetadata index = IndexMetadata.create("ks", "tbl", "no_target", ImmutableMap.of());

    assertThat(index.target()).isNull();
    assertThat(index.isLocal()).isFalse();
    assertThat(index.targetColumnName()).isNull();
  }

  @Test
  public void shouldReadIndexingTypeFromOptions() {
    IndexMetadata keys =
        IndexMetadata.create(
            "ks", "tbl", "keys_idx", ImmutableMap.of("target", "m", "index_keys", ""));
    IndexMetadata entries =
        IndexMetadata.create(
            "ks",
            "tbl",
            "entries_idx",
            ImmutableMap.of("target", "m", "index_keys_and_values", ""));
    IndexMetadata values =
        IndexMetadata.create(
            "ks", "tbl", "values_idx", ImmutableMap.of("target", "m", "index_values", ""));
    IndexMetadata plain = IndexMetadata.create("ks", "tbl", "idx", ImmutableMap.of("target", "m"));

    assertThat(keys.indexingType().indexKeys()).isTrue();
    assertThat(keys.optionsTargetType()).contains(TargetType.KEYS);
    assertThat(entries.optionsTargetType()).contains(TargetType.ENTRIES);
    assertThat(values.optionsTargetType()).contains(TargetType.VALUES);
    assertThat(plain.indexingType()).isEqualTo(ImmutableCollectionIndexingType.builder().build());
    assertThat(plain.optionsTargetType()).isEmpty();
  }

  @Test
  public void shouldRejectConflictingIndexingOptions() {
    IndexMetadata index =
        IndexMetadata.create(
            "ks", "tbl", "idx", ImmutableMap.of("index_keys", "", "index_values", ""));

    assertThatThrownBy(index::indexingType).isInstanceOf(IllegalStateException.class);
  }
}
