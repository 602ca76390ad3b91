package com.alibaba.cloud.ai.organizer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * AI 文件整理器
 *
 * @author RobustH
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class OrganizerApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(OrganizerApplication.class, args)));
    }
}
