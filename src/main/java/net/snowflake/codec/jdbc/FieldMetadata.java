package net.snowflake.codec.jdbc;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import net.snowflake.codec.core.SFException;

/**
 * Metadata of a result column or of a field nested in a structured column. OBJECT fields carry one
 * child per attribute, ARRAY fields carry the element metadata and MAP fields carry the key and the
 * value metadata, in that order.
 *
 * <p>Instances are read only once built and are shared by all rows of a result.
 */
public class FieldMetadata {
  public static final int MAX_STRUCTURED_DEPTH = 100;

  private final String name;
  private final String typeName;
  private final boolean nullable;
  private final int precision;
  private final int scale;
  private final SnowflakeType base;
  private final List<FieldMetadata> fields;

  public FieldMetadata(
      String name,
      String typeName,
      boolean nullable,
      int precision,
      int scale,
      SnowflakeType base,
      List<FieldMetadata> fields) {
    this.name = name;
    this.typeName = typeName;
    this.nullable = nullable;
    this.precision = precision;
    this.scale = scale;
    this.base = Objects.requireNonNull(base, "base");
    this.fields =
        fields == null
            ? Collections.<FieldMetadata>emptyList()
            : Collections.unmodifiableList(new ArrayList<>(fields));
  }

  public FieldMetadata(String name, SnowflakeType base, int scale, List<FieldMetadata> fields) {
    this(name, base.name(), true, 0, scale, base, fields);
  }

  public FieldMetadata(String name, SnowflakeType base, int scale) {
    this(name, base, scale, null);
  }

  public FieldMetadata(String name, SnowflakeType base) {
    this(name, base, 0, null);
  }

  /**
   * Build metadata from a row type descriptor as sent by the server, e.g. {@code {"name":"C1",
   * "type":"array", "scale":0, "nullable":true, "fields":[...]}}.
   *
   * @param node row type node
   * @return metadata tree
   * @throws SFException if a type tag is unknown or the tree breaks the rules of {@link
   *     #validate()}
   */
  public static FieldMetadata fromJson(JsonNode node) throws SFException {
    FieldMetadata field = readRowType(node);
    field.validate();
    return field;
  }

  private static FieldMetadata readRowType(JsonNode node) throws SFException {
    String name = node.path("name").asText(null);
    String typeTag = node.path("type").asText(null);
    SnowflakeType base = SnowflakeType.fromString(typeTag);
    List<FieldMetadata> children = new ArrayList<>();
    JsonNode fieldsNode = node.path("fields");
    if (fieldsNode.isArray()) {
      for (JsonNode child : fieldsNode) {
        children.add(readRowType(child));
      }
    }
    return new FieldMetadata(
        name,
        typeTag,
        node.path("nullable").asBoolean(true),
        node.path("precision").asInt(0),
        node.path("scale").asInt(0),
        base,
        children);
  }

  /**
   * Check the arity and depth rules of the whole tree.
   *
   * @throws SFException if an ARRAY does not have exactly one child, a MAP does not have exactly
   *     two, a scale is negative or the tree is nested too deep
   */
  public void validate() throws SFException {
    validate(0);
  }

  private void validate(int depth) throws SFException {
    if (depth > MAX_STRUCTURED_DEPTH) {
      throw new SFException(
          ErrorCode.INVALID_STRUCT_DATA, name, "nesting deeper than " + MAX_STRUCTURED_DEPTH);
    }
    if (scale < 0) {
      throw new SFException(ErrorCode.INVALID_STRUCT_DATA, name, "negative scale " + scale);
    }
    if (base == SnowflakeType.ARRAY && fields.size() > 1) {
      throw new SFException(
          ErrorCode.INVALID_STRUCT_DATA, name, "array with " + fields.size() + " element fields");
    }
    if (base == SnowflakeType.MAP && !fields.isEmpty() && fields.size() != 2) {
      throw new SFException(
          ErrorCode.INVALID_STRUCT_DATA, name, "map with " + fields.size() + " fields");
    }
    for (FieldMetadata child : fields) {
      child.validate(depth + 1);
    }
  }

  public String getName() {
    return name;
  }

  public String getTypeName() {
    return typeName;
  }

  public boolean isNullable() {
    return nullable;
  }

  public int getPrecision() {
    return precision;
  }

  public int getScale() {
    return scale;
  }

  public SnowflakeType getBase() {
    return base;
  }

  public List<FieldMetadata> getFields() {
    return fields;
  }

  /**
   * @param fieldName attribute name
   * @return the child with the given name or null
   */
  public FieldMetadata getField(String fieldName) {
    for (FieldMetadata field : fields) {
      if (field.getName() != null && field.getName().equals(fieldName)) {
        return field;
      }
    }
    return null;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    FieldMetadata that = (FieldMetadata) o;
    return nullable == that.nullable
        && precision == that.precision
        && scale == that.scale
        && Objects.equals(name, that.name)
        && base == that.base
        && fields.equals(that.fields);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, nullable, precision, scale, base, fields);
  }

  @Override
  public String toString() {
    return "FieldMetadata{name=" + name + ", base=" + base + ", scale=" + scale + "}";
  }
}
