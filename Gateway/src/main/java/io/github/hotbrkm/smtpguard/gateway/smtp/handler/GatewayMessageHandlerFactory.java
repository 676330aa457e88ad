package io.github.hotbrkm.smtpguard.gateway.smtp.handler;

import io.github.hotbrkm.smtpguard.gateway.smtp.policy.PolicyOrchestrator;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.check.ConnectionMeta;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.check.ReverseDnsName;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.dns.DnsResolver;
import io.github.hotbrkm.smtpguard.gateway.smtp.policy.dns.LookupContext;
import io.github.hotbrkm.smtpguard.gateway.smtp.properties.GatewaySmtpProperties;
import io.github.hotbrkm.smtpguard.gateway.smtp.service.SmtpMessageStore;
import io.github.hotbrkm.smtpguard.gateway.smtp.util.IpAddressUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.subethamail.smtp.MessageContext;
import org.subethamail.smtp.MessageHandler;
import org.subethamail.smtp.MessageHandlerFactory;

import java.net.InetAddress;
import java.net.SocketAddress;
import java.util.Optional;

@Slf4j
@RequiredArgsConstructor
public class GatewayMessageHandlerFactory implements MessageHandlerFactory {

    private final GatewaySmtpProperties properties;
    private final SmtpMessageStore messageStore;
    private final PolicyOrchestrator policyOrchestrator;
    private final DnsResolver dnsResolver;

    @Override
    public MessageHandler create(MessageContext context) {
        return new GatewayMessageHandler(context, connectionOf(context), properties, messageStore, policyOrchestrator);
    }

    ConnectionMeta connectionOf(MessageContext context) {
        SocketAddress remoteAddress = context.getRemoteAddress();
        String helo = context.getHelo().orElse(null);
        Optional<InetAddress> ip = IpAddressUtil.ipAddressOf(remoteAddress);
        if (!properties.getIdentity().isReverseDnsLookup() || ip.isEmpty()) {
            return ConnectionMeta.of(remoteAddress, helo, ReverseDnsName.notAttempted());
        }

        InetAddress address = ip.get();
        return ConnectionMeta.lazy(remoteAddress, helo, () -> {
            LookupContext lookupContext = LookupContext.withTimeout(properties.getIdentity().getLookupTimeout());
            try {
                ReverseDnsName name = ReverseDnsName.lookup(dnsResolver, address, lookupContext);
                log.debug("rDNS lookup - ip={}, status={}, name={}", address.getHostAddress(), name.status(), name.name());
                return name;
            } finally {
                lookupContext.cancel();
            }
        });
    }
}
