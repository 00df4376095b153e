package edu.washington.escience.arrayagg;

import java.io.Serializable;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;

/**
 * Describes the attribute an aggregate reads: its name, whether its cells are variable-length, whether it is nullable,
 * the number of values per cell and the datatype of those values.
 */
public final class FieldInfo implements Serializable {
  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;

  /** The attribute name. */
  @JsonProperty
  private final String name;
  /** True if the cells of this attribute have variable length. */
  @JsonProperty
  private final boolean varSized;
  /** True if the attribute carries a validity vector. */
  @JsonProperty
  private final boolean nullable;
  /** Values per cell, or {@link ArrayAggConstants#VAR_NUM}. */
  @JsonProperty
  private final int cellValNum;
  /** The datatype of one value. */
  @JsonProperty
  private final Datatype datatype;

  /**
   * @param name the attribute name.
   * @param varSized true if the cells of this attribute have variable length.
   * @param nullable true if the attribute carries a validity vector.
   * @param cellValNum values per cell, or {@link ArrayAggConstants#VAR_NUM}.
   * @param datatype the datatype of one value.
   */
  @JsonCreator
  public FieldInfo(@JsonProperty(value = "name", required = true) final String name,
      @JsonProperty(value = "varSized", required = true) final boolean varSized,
      @JsonProperty(value = "nullable", required = true) final boolean nullable,
      @JsonProperty(value = "cellValNum", required = true) final int cellValNum,
      @JsonProperty(value = "datatype", required = true) final Datatype datatype) {
    this.name = Objects.requireNonNull(name, "name");
    this.datatype = Objects.requireNonNull(datatype, "datatype");
    Preconditions.checkArgument(cellValNum > 0 || cellValNum == ArrayAggConstants.VAR_NUM,
        "cellValNum must be positive or VAR_NUM, not %s", cellValNum);
    this.varSized = varSized;
    this.nullable = nullable;
    this.cellValNum = cellValNum;
  }

  /**
   * A fixed-size field with one value per cell.
   *
   * @param name the attribute name.
   * @param nullable true if the attribute carries a validity vector.
   * @param datatype the datatype of one value.
   * @return the field.
   */
  public static FieldInfo fixed(final String name, final boolean nullable, final Datatype datatype) {
    return new FieldInfo(name, false, nullable, 1, datatype);
  }

  /**
   * A variable-length field.
   *
   * @param name the attribute name.
   * @param nullable true if the attribute carries a validity vector.
   * @param datatype the datatype of one value.
   * @return the field.
   */
  public static FieldInfo var(final String name, final boolean nullable, final Datatype datatype) {
    return new FieldInfo(name, true, nullable, ArrayAggConstants.VAR_NUM, datatype);
  }

  /** @return the attribute name. */
  public String getName() {
    return name;
  }

  /** @return true if the cells of this attribute have variable length. */
  public boolean isVarSized() {
    return varSized;
  }

  /** @return true if the attribute carries a validity vector. */
  public boolean isNullable() {
    return nullable;
  }

  /** @return values per cell, or {@link ArrayAggConstants#VAR_NUM}. */
  public int getCellValNum() {
    return cellValNum;
  }

  /** @return the datatype of one value. */
  public Datatype getDatatype() {
    return datatype;
  }

  /** @return the number of bytes one fixed-size cell occupies. */
  public int getCellSize() {
    Preconditions.checkState(!varSized, "var sized field %s has no fixed cell size", name);
    return datatype.size() * cellValNum;
  }

  @Override
  public boolean equals(final Object o) {
    if (!(o instanceof FieldInfo)) {
      return false;
    }
    FieldInfo other = (FieldInfo) o;
    return name.equals(other.name) && varSized == other.varSized && nullable == other.nullable
        && cellValNum == other.cellValNum && datatype == other.datatype;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, varSized, nullable, cellValNum, datatype);
  }

  @Override
  public String toString() {
    return name + "(" + datatype + (varSized ? ", var" : ", " + cellValNum) + (nullable ? ", nullable" : "") + ")";
  }
}
