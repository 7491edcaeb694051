package org.nullablefields.convertor;

import jakarta.persistence.Converter;
import tools.jackson.core.type.TypeReference;

import java.util.Map;

@Converter
public class JsonMapConverter extends JsonAttributeConverter<Map<String, Object>> {

    public JsonMapConverter() {
        super(new TypeReference<Map<String, Object>>() {});
    }
}
