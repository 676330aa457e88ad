package io.github.hotbrkm.smtpguard.gateway.config;

import io.github.hotbrkm.smtpguard.gateway.smtp.handler.GatewayMessageHandlerFactory;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.PolicyOrchestrator;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.PolicyOrchestratorFactory;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.check.IdentityCheckRegistry;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.dns.DnsResolver;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.metrics.PolicyMetricsRecorder;
import io.github.hotbrkm.smtpguard.gateway.smtp.properties.GatewaySmtpProperties;
import io.github.hotbrkm.smtpguard.gateway.smtp.service.SmtpMessageStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.util.StringUtils;
import org.subethamail.smtp.server.SMTPServer;

import java.net.InetAddress;
import java.net.UnknownHostException;

@Slf4j
@Configuration
@EnableConfigurationProperties(GatewaySmtpProperties.class)
public class SmtpServerConfig {

    private static final String PROPERTY_PREFIX = "gateway.smtp";

    @Bean(initMethod = "start", destroyMethod = "stop")
    @ConditionalOnProperty(prefix = PROPERTY_PREFIX, name = "enabled", havingValue = "true", matchIfMissing = true)
    public SMTPServer smtpServer(GatewaySmtpProperties properties,
                                 GatewayMessageHandlerFactory handlerFactory) {
        SMTPServer.Builder builder = new SMTPServer.Builder()
                .messageHandlerFactory(handlerFactory)
                .port(properties.getPort());

        if (properties.getMaxConnections() != null) {
            builder.maxConnections(properties.getMaxConnections());
        }

        if (properties.getMaxMessageSize() != null) {
            builder.maxMessageSize(properties.getMaxMessageSize());
        }

        if (StringUtils.hasText(properties.getHostName())) {
            builder.hostName(properties.getHostName());
        }

        if (StringUtils.hasText(properties.getBindAddress())) {
            builder.bindAddress(resolveBindAddress(properties.getBindAddress()));
        }

        SMTPServer smtpServer = builder.build();
        log.info("Gateway SMTP server is configured to listen on {}.", smtpServer.getDisplayableLocalSocketAddress());
        return smtpServer;
    }

    @Bean
    public DnsResolver dnsResolver(@Qualifier("dnsLookupExecutor") ThreadPoolTaskExecutor dnsLookupExecutor) {
        return new DnsResolver(dnsLookupExecutor);
    }

    @Bean
    @ConditionalOnMissingBean(IdentityCheckRegistry.class)
    public IdentityCheckRegistry identityCheckRegistry() {
        return IdentityCheckRegistry.defaults();
    }

    @Bean
    @ConditionalOnProperty(prefix = PROPERTY_PREFIX, name = "enabled", havingValue = "true", matchIfMissing = true)
    public PolicyOrchestrator policyOrchestrator(GatewaySmtpProperties properties,
                                                 IdentityCheckRegistry identityCheckRegistry,
                                                 DnsResolver dnsResolver,
                                                 PolicyMetricsRecorder metricsRecorder) {
        PolicyOrchestrator orchestrator = PolicyOrchestratorFactory.build(
                properties.getIdentity(), identityCheckRegistry, dnsResolver, metricsRecorder);
        log.info("Identity checks configured - enabled={}, checks={}",
                properties.getIdentity().isEnabled(), properties.getIdentity().getChecks().size());
        return orchestrator;
    }

    @Bean
    @ConditionalOnProperty(prefix = PROPERTY_PREFIX, name = "enabled", havingValue = "true", matchIfMissing = true)
    public GatewayMessageHandlerFactory gatewayMessageHandlerFactory(GatewaySmtpProperties properties,
                                                                     SmtpMessageStore messageStore,
                                                                     PolicyOrchestrator policyOrchestrator,
                                                                     DnsResolver dnsResolver) {
        return new GatewayMessageHandlerFactory(properties, messageStore, policyOrchestrator, dnsResolver);
    }

    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    @ConditionalOnProperty(prefix = PROPERTY_PREFIX, name = "enabled", havingValue = "true", matchIfMissing = true)
    public PolicyMetricsRecorder policyMetricsRecorder(MeterRegistry meterRegistry) {
        return new PolicyMetricsRecorder(meterRegistry);
    }

    private static InetAddress resolveBindAddress(String bindAddress) {
        try {
            return InetAddress.getByName(bindAddress);
        } catch (UnknownHostException e) {
            throw new IllegalStateException("Invalid SMTP bind address: " + bindAddress, e);
        }
    }
}
