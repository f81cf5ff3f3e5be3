package com.phillippitts.modeestimator.config;

import com.phillippitts.modeestimator.core.ModeEstimator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Exposes the stateless core estimator as a singleton bean.
 */
@Configuration
public class ModeEstimatorConfig {

    @Bean
    public ModeEstimator modeEstimator() {
        return new ModeEstimator();
    }
}
