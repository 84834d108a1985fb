package com.edugen.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "com.edugen")
@EntityScan("com.edugen.data.entity")
@EnableJpaRepositories("com.edugen.data.repository")
@EnableScheduling
public class EduGenApiApplication {
    
    public static void main(String[] args) {
        SpringApplication.run(EduGenApiApplication.class, args);
    }
}
