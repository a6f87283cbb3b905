package com.phillippitts.observability;

import com.phillippitts.observability.config.properties.MiddlewareProperties;
import com.phillippitts.observability.config.properties.StorageProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        MiddlewareProperties.class,
        StorageProperties.class
})
@EnableScheduling
public class ObservabilityApplication {

    public static void main(String[] args) {
        SpringApplication.run(ObservabilityApplication.class, args);
    }

}
