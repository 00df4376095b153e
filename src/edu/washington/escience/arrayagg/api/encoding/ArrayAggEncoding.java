package edu.washington.escience.arrayagg.api.encoding;

import java.lang.reflect.Field;
import java.util.LinkedList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.google.common.base.Joiner;
import com.google.common.collect.Lists;

import edu.washington.escience.arrayagg.AggregateConfigurationException;

/**
 * The base of all encodings. {@link #validate()} explains why a deserialized object is incorrect.
 */
public abstract class ArrayAggEncoding {
  /**
   * @return a list of required fields.
   */
  @JsonIgnore
  private List<Field> getRequiredFields() {
    List<Field> requiredFields = new LinkedList<>();
    for (Field f : getClass().getFields()) {
      if (f.getAnnotation(Required.class) != null) {
        requiredFields.add(f);
      }
    }
    return requiredFields;
  }

  /**
   * Checks that this deserialized instance passes input validation. First, it enforces that all required fields are
   * present. Second, it calls the child's method validateExtra().
   *
   * @throws AggregateConfigurationException if the validation checks fail.
   */
  public final void validate() throws AggregateConfigurationException {
    final List<String> missing = Lists.newLinkedList();
    try {
      for (final Field f : getRequiredFields()) {
        if (null == f.get(this)) {
          missing.add(f.getName());
        }
      }
    } catch (IllegalAccessException e) {
      throw new IllegalStateException(e);
    }
    if (!missing.isEmpty()) {
      throw new AggregateConfigurationException(getClass().getSimpleName(),
          "missing required fields: " + Joiner.on(", ").join(missing) + ".");
    }
    validateExtra();
  }

  /**
   * Extra validation beyond the list of required fields.
   *
   * @throws AggregateConfigurationException if the validation checks fail.
   */
  protected void validateExtra() throws AggregateConfigurationException {}
}
