package io.github.hotbrkm.inviteengine.agent.invite.config;

import io.github.hotbrkm.inviteengine.agent.invite.send.engine.InviteSchedulingEngine;
import io.github.hotbrkm.inviteengine.agent.invite.send.engine.InviteSchedulingEngineFactory;
import io.github.hotbrkm.inviteengine.agent.invite.send.transport.InviteTransport;
import io.github.hotbrkm.inviteengine.agent.invite.send.transport.ProviderTransportRouter;
import io.github.hotbrkm.inviteengine.agent.invite.store.InMemoryInboxStore;
import io.github.hotbrkm.inviteengine.agent.invite.store.InboxStore;
import io.github.hotbrkm.inviteengine.agent.invite.store.SchedulingSettingsProvider;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.stream.Collectors;

@Configuration
@EnableConfigurationProperties(InviteEngineProperties.class)
@ConditionalOnProperty(prefix = "invite", name = "enabled", havingValue = "true", matchIfMissing = true)
public class InviteEngineConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock inviteEngineClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public InboxStore inboxStore() {
        return new InMemoryInboxStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public SchedulingSettingsProvider schedulingSettingsProvider(InviteEngineProperties properties) {
        return new ConfiguredSchedulingSettingsProvider(properties.getScheduling());
    }

    /**
     * InviteSchedulingEngine Bean.
     * Sends through a provider router over every {@link InviteTransport} bean of the host application.
     * Calls start() on application startup and shutdown() on termination.
     */
    @Bean(initMethod = "start", destroyMethod = "shutdown")
    public InviteSchedulingEngine inviteSchedulingEngine(InviteEngineProperties properties, InboxStore inboxStore,
                                                         ObjectProvider<InviteTransport> transports,
                                                         SchedulingSettingsProvider schedulingSettingsProvider,
                                                         Clock clock) {
        ProviderTransportRouter router = new ProviderTransportRouter(transports.orderedStream().collect(Collectors.toList()));
        return InviteSchedulingEngineFactory.create(properties, inboxStore, router, schedulingSettingsProvider, clock);
    }
}
