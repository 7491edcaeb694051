package org.nullablefields.config;

import org.nullablefields.service.EmptyValueClassifier;
import org.nullablefields.service.NullableFieldsNormalizer;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import tools.jackson.databind.ObjectMapper;

@AutoConfiguration
@EnableConfigurationProperties(NullableFieldsProperties.class)
public class NullableFieldsConfig {

    @Bean
    @ConditionalOnMissingBean
    public EmptyValueClassifier emptyValueClassifier(ObjectProvider<ObjectMapper> objectMapper) {
        return new EmptyValueClassifier(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public NullableFieldsNormalizer nullableFieldsNormalizer(EmptyValueClassifier emptyValueClassifier,
                                                             NullableFieldsProperties properties) {
        return new NullableFieldsNormalizer(emptyValueClassifier, properties.isEnabled());
    }
}
