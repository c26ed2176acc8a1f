package com.featuredetect.API;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(SiftProperties.class)
public class FeatureDetectApplication {

    public static void main(String[] args) {
        SpringApplication.run(FeatureDetectApplication.class, args);
    }
}
