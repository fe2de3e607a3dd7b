package com.foo.skilltemplate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SkillTemplateApplication {

    public static void main(String[] args) {
        SpringApplication.run(SkillTemplateApplication.class, args);
    }
}
