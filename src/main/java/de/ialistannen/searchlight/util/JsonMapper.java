package de.ialistannen.searchlight.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

public final class JsonMapper {

  private JsonMapper() {
    throw new UnsupportedOperationException("No instantiation");
  }

  /**
   * @return an object mapper that knows java.time types and writes them as ISO-8601 strings
   */
  public static ObjectMapper create() {
    ObjectMapper mapper = new ObjectMapper();
    mapper.findAndRegisterModules();
    mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    return mapper;
  }
}
