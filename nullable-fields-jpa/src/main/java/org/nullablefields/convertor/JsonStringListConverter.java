package org.nullablefields.convertor;

import jakarta.persistence.Converter;
import tools.jackson.core.type.TypeReference;

import java.util.List;

@Converter
public class JsonStringListConverter extends JsonAttributeConverter<List<String>> {

    public JsonStringListConverter() {
        super(new TypeReference<List<String>>() {});
    }
}
