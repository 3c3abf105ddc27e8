package com.example.chat.shared.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.h2.tools.Server;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.ContextRefreshedEvent;
import org.springframework.context.event.EventListener;

import java.sql.SQLException;

@Configuration
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(prefix = "chat.h2-console", name = "enabled", havingValue = "true")
public class H2ConsoleConfig {

    private final AppProperties appProperties;

    private Server webServer;
    private Server tcpServer;

    @EventListener(ContextRefreshedEvent.class)
    public void start() throws SQLException {
        if (webServer != null) {
            return;
        }
        AppProperties.H2Console console = appProperties.getH2Console();
        this.webServer = Server.createWebServer("-webPort", console.getWebPort(), "-webAllowOthers").start();
        this.tcpServer = Server.createTcpServer("-tcpPort", console.getTcpPort(), "-tcpAllowOthers").start();
        log.info("H2 console listening on web port {} and tcp port {}", console.getWebPort(), console.getTcpPort());
    }

    @EventListener(ContextClosedEvent.class)
    public void stop() {
        if (tcpServer != null) {
            tcpServer.stop();
        }
        if (webServer != null) {
            webServer.stop();
        }
    }
}
