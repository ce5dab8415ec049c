package com.autoheal;

import com.autoheal.config.AutoHealProperties;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * AutoHeal: audits a Python application's logs and sources, repairs what it safely
 * can, and remembers which fixes worked.
 */
@SpringBootApplication
@EnableConfigurationProperties(AutoHealProperties.class)
public class AutoHealApplication {

    public static void main(String[] args) {
        SpringApplication.run(AutoHealApplication.class, args);
    }
}
