package com.pulsegrid.matrix;

import com.pulsegrid.matrix.config.PulsegridProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties(PulsegridProperties.class)
@EnableScheduling
public class MatrixServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(MatrixServiceApplication.class, args);
    }
}
