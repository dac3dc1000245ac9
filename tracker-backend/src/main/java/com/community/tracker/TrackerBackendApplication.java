package com.community.tracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling // 定时刷新进度
@ConfigurationPropertiesScan
public class TrackerBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(TrackerBackendApplication.class, args);
    }

}
