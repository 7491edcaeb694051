package org.nullablefields.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "nullable-fields")
@Getter
@Setter
public class NullableFieldsProperties {

    /**
     * Whether empty nullable attributes are set to null before save. When disabled, entities are
     * persisted exactly as assigned.
     */
    private boolean enabled = true;
}
