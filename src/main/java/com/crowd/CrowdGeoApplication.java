package com.crowd;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.apache.dubbo.config.spring.context.annotation.EnableDubbo;

/**
 * Crowd Geo server: geohash proximity search and crowd density over HTTP and DUBBO
 */
@SpringBootApplication
@EnableDubbo
public class CrowdGeoApplication {
    public static void main(String[] args) {
        SpringApplication.run(CrowdGeoApplication.class, args);
    }
}
