package io.github.hotbrkm.smtpguard.gateway.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class DnsExecutorConfig {
    @Value("${gateway.dns.pool.size:50}")
    private int poolSize;

    @Bean
    public ThreadPoolTaskExecutor dnsLookupExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setThreadNamePrefix("dns-lookup-");
        executor.setDaemon(true);
        executor.setBeanName("dnsLookupExecutor");
        executor.initialize();
        return executor;
    }
}
