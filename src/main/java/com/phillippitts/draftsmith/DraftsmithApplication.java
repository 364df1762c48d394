package com.phillippitts.draftsmith;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        com.phillippitts.draftsmith.config.properties.ProviderProperties.class,
        com.phillippitts.draftsmith.config.properties.OrchestrationProperties.class,
        com.phillippitts.draftsmith.config.properties.StorageProperties.class
})
public class DraftsmithApplication {

    public static void main(String[] args) {
        SpringApplication.run(DraftsmithApplication.class, args);
    }

}
