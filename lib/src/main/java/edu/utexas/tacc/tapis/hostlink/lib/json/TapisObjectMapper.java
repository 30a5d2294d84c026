package edu.utexas.tacc.tapis.hostlink.lib.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;


/**
 * This class is a singleton for getting the object mapper used for every durable record written by hostlink:
 * registry rows, device cache entries and the last target pointer. Records are written compactly, one per line,
 * so a registry row never spans more than one line.
 */
public class TapisObjectMapper {

    private static ObjectMapper mapper;


    /**
     * gets/creates the object mapper and configures it for datetimes etc.
     * @return ObjectMapper
     */
    public static synchronized ObjectMapper getMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
            mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
            mapper.configure(SerializationFeature.INDENT_OUTPUT, false);
            // Newer writers may add fields, older readers should still honor the ones they know
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        }
        return mapper;
    }

}
