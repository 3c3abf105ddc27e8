package com.example.chat.shared.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jdbc.repository.config.EnableJdbcRepositories;

@Configuration
@EnableJdbcRepositories(basePackages = "com.example.chat.shared.repository")
public class PropertiesConfig {

    @Value("${node.name:${NODE_NAME:chat-service-0}}")
    private String nodeName;

    @Bean
    @ConfigurationProperties(prefix = "chat")
    public AppProperties appProperties() {
        AppProperties properties = new AppProperties();
        // the remaining chat.* keys are bound by @ConfigurationProperties
        properties.setNodeName(nodeName);
        return properties;
    }
}
