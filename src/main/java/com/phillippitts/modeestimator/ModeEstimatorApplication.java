package com.phillippitts.modeestimator;

import com.phillippitts.modeestimator.config.properties.ModeEstimatorProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ModeEstimatorProperties.class)
public class ModeEstimatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(ModeEstimatorApplication.class, args);
    }

}
