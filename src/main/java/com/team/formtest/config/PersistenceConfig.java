package com.team.formtest.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "form-test.persistence")
@Getter
@Setter
public class PersistenceConfig {

    /** Write terminal runs and screenshot references to the database */
    private boolean enabled = true;
}
