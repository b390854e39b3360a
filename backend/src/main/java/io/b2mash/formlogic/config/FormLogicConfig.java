package io.b2mash.formlogic.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(FormLogicProperties.class)
public class FormLogicConfig {}
