package edu.washington.escience.arrayagg.api;

import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.datatype.guava.GuavaModule;

/**
 * This class generates the JSON {@link ObjectMapper} shared by the aggregate encodings.
 */
public final class ArrayAggJsonMapperProvider {
  /** Only create this object once, and share it among instances. */
  private static final ObjectMapper MAPPER = newMapper();

  /** Utility class. */
  private ArrayAggJsonMapperProvider() {}

  /**
   * @return An {@link ObjectMapper} that fits the engine's customizations.
   */
  public static ObjectMapper getMapper() {
    return MAPPER;
  }

  /**
   * @return An {@link ObjectReader} that fits the engine's customizations.
   */
  public static ObjectReader getReader() {
    return MAPPER.reader();
  }

  /**
   * @return An {@link ObjectWriter} that fits the engine's customizations.
   */
  public static ObjectWriter getWriter() {
    return MAPPER.writer();
  }

  /**
   * Create the standard custom ObjectMapper.
   *
   * @return the standard custom ObjectMapper.
   */
  private static ObjectMapper newMapper() {
    ObjectMapper mapper = new ObjectMapper();

    /* Serialize Guava types correctly */
    mapper.registerModule(new GuavaModule());

    /* Don't automatically detect getters, explicit is better than implicit. */
    mapper.setVisibility(PropertyAccessor.GETTER, Visibility.NONE);
    mapper.setVisibility(PropertyAccessor.IS_GETTER, Visibility.NONE);
    mapper.setVisibility(PropertyAccessor.SETTER, Visibility.NONE);

    return mapper;
  }
}
