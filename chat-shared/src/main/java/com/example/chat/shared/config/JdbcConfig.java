package com.example.chat.shared.config;

import com.example.chat.shared.converter.TimestampToOffsetDateTimeConverter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jdbc.core.convert.JdbcCustomConversions;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Spring Data JDBC conversions and the scheduler that reactive callers hand blocking
 * repository work to.
 */
@Configuration
@Slf4j
public class JdbcConfig {

    @Bean
    public JdbcCustomConversions jdbcCustomConversions() {
        return new JdbcCustomConversions(List.of(
                new TimestampToOffsetDateTimeConverter(),
                new TimestampToOffsetDateTimeConverter.FromLocalDateTime()));
    }

    /**
     * Sized like the connection pool: more threads would only queue on connections.
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler jdbcScheduler(AppProperties appProperties) {
        int parallelism = appProperties.getDb().getJdbcParallelism();
        log.info("JDBC scheduler using {} threads", parallelism);
        return Schedulers.newBoundedElastic(parallelism, Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE, "jdbc-io");
    }
}
