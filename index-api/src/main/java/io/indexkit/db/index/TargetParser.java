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

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.google.common.base.Preconditions;
import io.indexkit.db.schema.Column;
import io.indexkit.db.schema.ColumnResolver;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes the "target" option of secondary indexes.
 *
 * <p>Three shapes of target strings exist and must all remain readable:
 *
 * <ul>
 *   <li>a bare column name, {@code m}, indexing the values of that column;
 *   <li>the functional form {@code keys(m)}, {@code entries(m)}, {@code values(m)} or {@code
 *       full(m)};
 *   <li>a JSON object {@code {"pk": ["a", "b"], "ck": ["c"]}} listing the partition key and
 *       clustering columns of a multi-column target. {@code ck} may be omitted.
 * </ul>
 *
 * Nothing in a stored target says which shape it uses, so they are tried in that order: the
 * functional form first, then a JSON object, and finally the whole string as a column name.
 *
 * <p>Instances are immutable and safe to share between threads.
 */
public class TargetParser {
  private static final Logger LOGGER = LoggerFactory.getLogger(TargetParser.class);

  public static final String PK_TARGET_KEY = "pk";
  public static final String CK_TARGET_KEY = "ck";

  private static final Pattern TARGET_REGEX =
      Pattern.compile("^(keys|entries|values|full)\\((.+)\\)$");

  private static final TargetParser INSTANCE =
      new TargetParser(TargetParserOptions.fromSystemProperties());

  private final TargetParserOptions options;
  private final ObjectMapper mapper;

  public TargetParser(TargetParserOptions options) {
    this.options = options;
    this.mapper = new ObjectMapper();
    mapper.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    if (options.strictDuplicateDetection()) {
      mapper.enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);
    }
  }

  /** The shared parser, configured from system properties. */
  public static TargetParser instance() {
    return INSTANCE;
  }

  public TargetParserOptions options() {
    return options;
  }

  /**
   * Parses the target of a persisted index.
   *
   * @throws ConfigurationException if the index has no target or if its target cannot be parsed.
   *     The original failure is the cause.
   */
  public TargetDescriptor parse(ColumnResolver resolver, IndexMetadata index) {
    String target = index.target();
    try {
      if (target == null) {
        throw new InvalidTargetException(
            null, String.format("No target definition found for index %s", index.name()));
      }
      return parse(resolver, target);
    } catch (RuntimeException e) {
      LOGGER.warn(
          "Unable to parse target of index {} on {}.{}: {}",
          index.name(),
          index.keyspace(),
          index.table(),
          e.getMessage());
      throw new ConfigurationException(index.name(), target, e);
    }
  }

  /**
   * Parses an index target string, resolving the columns it names with {@code resolver}.
   *
   * @throws ColumnNotFoundException if a column named by the target cannot be resolved.
   * @throws MalformedTargetException if the target is a JSON object not following the expected
   *     structure.
   */
  public TargetDescriptor parse(ColumnResolver resolver, String target) {
    Preconditions.checkNotNull(target, "Index target cannot be null");
    return parseFunctional(resolver, target)
        .or(() -> parseJsonObject(resolver, target))
        .orElseGet(() -> parseColumnName(resolver, target));
  }

  private Optional<TargetDescriptor> parseFunctional(ColumnResolver resolver, String target) {
    Matcher matcher = TARGET_REGEX.matcher(target);
    if (!matcher.matches()) {
      return Optional.empty();
    }
    TargetType type = TargetType.fromString(matcher.group(1));
    LOGGER.debug("Index target {} is in functional form ({})", target, type);
    Column column = resolveColumn(resolver, target, matcher.group(2));
    return Optional.of(TargetDescriptor.of(type, column));
  }

  private Optional<TargetDescriptor> parseJsonObject(ColumnResolver resolver, String target) {
    Optional<ObjectNode> maybeJson = readJsonObject(target);
    if (!maybeJson.isPresent()) {
      return Optional.empty();
    }
    LOGGER.debug("Index target {} is a JSON definition", target);
    ObjectNode json = maybeJson.get();
    JsonNode pk = json.path(PK_TARGET_KEY);
    JsonNode ck = json.path(CK_TARGET_KEY);
    if (!isArrayOrMissing(pk) || !isArrayOrMissing(ck)) {
      throw new MalformedTargetException(
          target, "pk and ck fields of JSON definition must be arrays");
    }

    List<String> pkNames = columnNames(target, PK_TARGET_KEY, pk);
    if (pkNames.isEmpty()) {
      throw new MalformedTargetException(
          target, "pk field of JSON definition must name at least one column");
    }
    ImmutableTargetDescriptor.Builder descriptor =
        ImmutableTargetDescriptor.builder().type(TargetType.VALUES);
    for (String name : pkNames) {
      descriptor.addPartitionKeyColumns(resolveColumn(resolver, target, name));
    }
    for (String name : columnNames(target, CK_TARGET_KEY, ck)) {
      descriptor.addClusteringKeyColumns(resolveColumn(resolver, target, name));
    }
    return Optional.of(descriptor.build());
  }

  private TargetDescriptor parseColumnName(ColumnResolver resolver, String target) {
    LOGGER.debug("Using index target {} as a column name", target);
    return TargetDescriptor.of(TargetType.VALUES, resolveColumn(resolver, target, target));
  }

  private static Column resolveColumn(ColumnResolver resolver, String target, String name) {
    return resolver.resolve(name).orElseThrow(() -> new ColumnNotFoundException(target, name));
  }

  private static boolean isArrayOrMissing(JsonNode node) {
    return node.isMissingNode() || node.isArray();
  }

  private List<String> columnNames(String target, String field, JsonNode array) {
    List<String> names = new ArrayList<>(array.size());
    for (JsonNode element : array) {
      if (element.isArray() && options.flattenNestedArrays()) {
        if (element.size() == 0) {
          throw new MalformedTargetException(
              target,
              String.format(
                  "Nested arrays of the %s field of JSON definition cannot be empty", field));
        }
        for (JsonNode nested : element) {
          names.add(columnName(target, field, nested));
        }
      } else {
        names.add(columnName(target, field, element));
      }
    }
    return names;
  }

  private static String columnName(String target, String field, JsonNode element) {
    if (!element.isValueNode() || element.isNull()) {
      throw new MalformedTargetException(
          target,
          String.format(
              "Elements of the %s field of JSON definition must be column names, got %s",
              field, element));
    }
    return element.asText();
  }

  private Optional<ObjectNode> readJsonObject(String target) {
    JsonNode node;
    try {
      node = mapper.readTree(target);
    } catch (JsonProcessingException e) {
      LOGGER.debug("Index target {} is not JSON: {}", target, e.getOriginalMessage());
      return Optional.empty();
    }
    if (node == null || !node.isObject()) {
      return Optional.empty();
    }
    return Optional.of((ObjectNode) node);
  }

  /**
   * Whether the target describes a local index, that is a JSON target with both partition key and
   * clustering columns. Never throws: anything else, including invalid input, is not local.
   */
  public boolean isLocal(String target) {
    if (target == null) {
      return false;
    }
    return readJsonObject(target)
        .map(
            json ->
                isNonEmptyArray(json.path(PK_TARGET_KEY))
                    && isNonEmptyArray(json.path(CK_TARGET_KEY)))
        .orElse(false);
  }

  /**
   * Extracts, without resolving anything, the name of the column that best represents the target
   * for display: the first clustering column of a JSON target, or else its first partition key
   * column. Any other target is returned unchanged.
   */
  public String targetColumnName(String target) {
    if (target == null) {
      return null;
    }
    Optional<ObjectNode> maybeJson = readJsonObject(target);
    if (!maybeJson.isPresent()) {
      return target;
    }
    ObjectNode json = maybeJson.get();
    JsonNode ck = json.path(CK_TARGET_KEY);
    JsonNode columns = isNonEmptyArray(ck) ? ck : json.path(PK_TARGET_KEY);
    return firstColumnName(columns).orElse(target);
  }

  private static boolean isNonEmptyArray(JsonNode node) {
    return node.isArray() && node.size() > 0;
  }

  private static Optional<String> firstColumnName(JsonNode node) {
    if (!isNonEmptyArray(node)) {
      return Optional.empty();
    }
    JsonNode first = node.get(0);
    if (first.isArray()) {
      return firstColumnName(first);
    }
    if (!first.isValueNode() || first.isNull()) {
      LOGGER.debug("Cannot extract a column name from {}", node);
      return Optional.empty();
    }
    return Optional.of(first.asText());
  }

  /**
   * Builds the target string of an index over the provided targets.
   *
   * <p>A single single-column target is written as the bare column name. Anything else is written
   * as a JSON object where the first target gives the {@code pk} array and the following ones, if
   * any, the {@code ck} array.
   */
  public String serializeTargets(List<IndexTarget> targets) {
    Preconditions.checkArgument(!targets.isEmpty(), "At least one index target is required");
    IndexTarget first = targets.get(0);
    if (targets.size() == 1 && first.shape() == IndexTarget.Shape.SINGLE_COLUMN) {
      return first.column().name();
    }

    ObjectNode json = mapper.createObjectNode();
    JsonNode pk = toJson(first);
    if (!pk.isArray()) {
      pk = mapper.createArrayNode().add(pk);
    }
    json.set(PK_TARGET_KEY, pk);
    if (targets.size() > 1) {
      ArrayNode ck = json.putArray(CK_TARGET_KEY);
      for (IndexTarget target : targets.subList(1, targets.size())) {
        ck.add(toJson(target));
      }
    }
    try {
      return mapper.writeValueAsString(json);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unable to write index targets " + targets, e);
    }
  }

  private JsonNode toJson(IndexTarget target) {
    switch (target.shape()) {
      case SINGLE_COLUMN:
        return TextNode.valueOf(target.column().name());
      case MULTIPLE_COLUMNS:
        ArrayNode columns = mapper.createArrayNode();
        for (Column column : target.columns()) {
          columns.add(column.name());
        }
        return columns;
      default:
        throw new AssertionError("Unhandled index target shape " + target.shape());
    }
  }
}
