package io.github.hotbrkm.inviteengine.agent.invite.config;

import io.github.hotbrkm.inviteengine.agent.invite.domain.BookedSlot;
import io.github.hotbrkm.inviteengine.agent.invite.domain.Campaign;
import io.github.hotbrkm.inviteengine.agent.invite.domain.FallbackPolicy;
import io.github.hotbrkm.inviteengine.agent.invite.domain.Inbox;
import io.github.hotbrkm.inviteengine.agent.invite.domain.ProviderKind;
import io.github.hotbrkm.inviteengine.agent.invite.domain.Recipient;
import io.github.hotbrkm.inviteengine.agent.invite.domain.SettingsScope;
import io.github.hotbrkm.inviteengine.agent.invite.send.engine.InviteSchedulingEngine;
import io.github.hotbrkm.inviteengine.agent.invite.send.result.CampaignRunSummary;
import io.github.hotbrkm.inviteengine.agent.invite.send.transport.InviteTransport;
import io.github.hotbrkm.inviteengine.agent.invite.send.transport.TransportResult;
import io.github.hotbrkm.inviteengine.agent.invite.store.InMemoryInboxStore;
import io.github.hotbrkm.inviteengine.agent.invite.store.InboxStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.DayOfWeek;
import java.util.List;
import java.util.Set;

import static io.github.hotbrkm.inviteengine.agent.invite.support.InviteTestFixtures.inbox;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("InviteEngineConfig test")
class InviteEngineConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(InviteEngineConfig.class);

    @Test
    @DisplayName("Defaults create a started engine over an in-memory store")
    void defaults() {
        contextRunner.run(ctx -> {
            assertThat(ctx).hasSingleBean(InviteSchedulingEngine.class);
            assertThat(ctx).hasSingleBean(InMemoryInboxStore.class);
            assertThat(ctx.getBean(InviteSchedulingEngine.class).getStatus()).isEqualTo("Idle");

            InviteEngineProperties properties = ctx.getBean(InviteEngineProperties.class);
            assertThat(properties.getEngine().getWorkerCount()).isEqualTo(InviteEngineProperties.Engine.DEFAULT_WORKER_COUNT);
            assertThat(properties.getDailyReset().isEnabled()).isFalse();
        });
    }

    @Test
    @DisplayName("Properties bind into engine and scheduling settings")
    void propertyBinding() {
        contextRunner
                .withPropertyValues(
                        "invite.engine.worker-count=3",
                        "invite.engine.random-seed=99",
                        "invite.engine.health-error-penalty=15",
                        "invite.scheduling.cooldown-minutes=5",
                        "invite.scheduling.campaigns.acme.fallback-policy=force",
                        "invite.scheduling.domain-timezones[example.de]=Europe/Berlin",
                        "invite.daily-reset.weekly-reset-day=sunday")
                .run(ctx -> {
                    InviteEngineProperties properties = ctx.getBean(InviteEngineProperties.class);
                    assertThat(properties.getEngine().getWorkerCount()).isEqualTo(3);
                    assertThat(properties.getEngine().getRandomSeed()).isEqualTo(99L);
                    assertThat(properties.getEngine().resolveHealthErrorPenalty()).isEqualTo(15);
                    assertThat(properties.getScheduling().getDomainTimezones()).containsKey("example.de");
                    assertThat(properties.getDailyReset().resolveWeeklyResetDay()).isEqualTo(DayOfWeek.SUNDAY);

                    InviteSchedulingEngine engine = ctx.getBean(InviteSchedulingEngine.class);
                    assertThat(engine.settingsFor(SettingsScope.global()).cooldownMinutes()).isEqualTo(5);
                    assertThat(engine.settingsFor(SettingsScope.campaign("acme")).fallbackPolicy())
                            .isEqualTo(FallbackPolicy.FORCE);
                });
    }

    @Test
    @DisplayName("invite.enabled=false creates no beans")
    void disabled() {
        contextRunner
                .withPropertyValues("invite.enabled=false")
                .run(ctx -> {
                    assertThat(ctx).doesNotHaveBean(InviteSchedulingEngine.class);
                    assertThat(ctx).doesNotHaveBean(InboxStore.class);
                });
    }

    @Test
    @DisplayName("Host beans replace the defaults and transports are routed by provider")
    void hostBeans() {
        InMemoryInboxStore hostStore = new InMemoryInboxStore(List.of(inbox("inbox-a", 10)));
        InviteTransport googleTransport = new InviteTransport() {
            @Override
            public TransportResult sendInvite(Inbox inbox, Recipient recipient, BookedSlot slot) {
                return TransportResult.success("google-" + slot.getId());
            }

            @Override
            public Set<ProviderKind> supportedProviders() {
                return Set.of(ProviderKind.GOOGLE);
            }
        };

        contextRunner
                .withBean(InboxStore.class, () -> hostStore)
                .withBean(InviteTransport.class, () -> googleTransport)
                .run(ctx -> {
                    assertThat(ctx.getBean(InboxStore.class)).isSameAs(hostStore);

                    CampaignRunSummary summary = ctx.getBean(InviteSchedulingEngine.class)
                            .process(Campaign.of("campaign-1", List.of(Recipient.of("lead@example.com", "UTC"))));

                    assertThat(summary.sent()).isEqualTo(1);
                    assertThat(hostStore.findInbox("inbox-a").orElseThrow().getSentToday()).isEqualTo(1);
                });
    }
}
