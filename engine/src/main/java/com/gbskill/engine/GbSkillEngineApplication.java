package com.gbskill.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GbSkillEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(GbSkillEngineApplication.class, args);
    }
}
