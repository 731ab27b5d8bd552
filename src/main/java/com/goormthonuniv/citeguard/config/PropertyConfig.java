package com.goormthonuniv.citeguard.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;

/** 로컬 자격증명(MOZ/AHREFS/OPENAI 키)은 커밋하지 않는 env.properties 로 덮어쓴다. */
@Configuration
@PropertySource(
        value = "classpath:properties/env.properties",
        ignoreResourceNotFound = true
)
public class PropertyConfig {

}
