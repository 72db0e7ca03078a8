package io.github.hotbrkm.inviteengine.agent.invite.send.queue;

import io.github.hotbrkm.inviteengine.agent.invite.send.result.CampaignRunSummary;
import io.github.hotbrkm.inviteengine.agent.invite.send.result.RecipientOutcome;
import io.github.hotbrkm.inviteengine.agent.invite.send.result.RecipientResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Campaign run aggregator
 * <p>
 * - Wait for all recipient futures to complete (with timeout)
 * - Count outcomes, including recipients settled before dispatch
 * - Build per-inbox statistics and output summary log
 */
@Slf4j
@RequiredArgsConstructor
final class CampaignRunAggregator {
    private final String campaignId;

    /**
     * @param settled   Results decided without dispatch (duplicates, deferred)
     * @param futures   Futures of dispatched recipients
     * @param timeoutMs Total wait timeout (ms)
     */
    CampaignRunSummary aggregate(List<RecipientResult> settled, List<CompletableFuture<RecipientResult>> futures,
                                 long timeoutMs) {
        CompletableFuture<Void> all = CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));
        try {
            all.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("campaignId={}, event=wait_timeout, timeoutMs={}", campaignId, timeoutMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("campaignId={}, event=wait_interrupted", campaignId);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("campaignId={}, event=wait_error, message={}", campaignId, cause.getMessage());
        }

        List<RecipientResult> results = new ArrayList<>(settled);
        int notCompleted = 0;
        for (CompletableFuture<RecipientResult> future : futures) {
            if (!future.isDone()) {
                notCompleted++;
                continue;
            }
            try {
                results.add(future.join());
            } catch (CompletionException e) {
                notCompleted++;
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("campaignId={}, event=recipient_future_failed, message={}", campaignId, cause.getMessage());
            }
        }
        if (notCompleted > 0) {
            log.warn("campaignId={}, notCompleted={}, event=recipients_not_completed_within_timeout",
                    campaignId, notCompleted);
        }

        Map<RecipientOutcome, Integer> counts = new HashMap<>();
        Map<String, Integer> inboxAttempts = new LinkedHashMap<>();
        Map<String, Integer> inboxSent = new HashMap<>();
        for (RecipientResult result : results) {
            counts.merge(result.outcome(), 1, Integer::sum);
            if (result.inboxId() != null) {
                inboxAttempts.merge(result.inboxId(), 1, Integer::sum);
                if (result.outcome() == RecipientOutcome.SENT) {
                    inboxSent.merge(result.inboxId(), 1, Integer::sum);
                }
            }
        }

        Map<String, CampaignRunSummary.InboxStats> stats = new LinkedHashMap<>();
        inboxAttempts.forEach((inboxId, attempts) ->
                stats.put(inboxId, new CampaignRunSummary.InboxStats(attempts, inboxSent.getOrDefault(inboxId, 0))));

        CampaignRunSummary summary = CampaignRunSummary.builder()
                .campaignId(campaignId)
                .totalRecipients(settled.size() + futures.size())
                .sent(counts.getOrDefault(RecipientOutcome.SENT, 0))
                .needsAttention(counts.getOrDefault(RecipientOutcome.NEEDS_ATTENTION, 0))
                .skippedDuplicate(counts.getOrDefault(RecipientOutcome.SKIPPED_DUPLICATE, 0))
                .deferred(counts.getOrDefault(RecipientOutcome.DEFERRED, 0))
                .notCompleted(notCompleted)
                .inboxStats(stats)
                .results(results)
                .build();

        log.info("campaignId={}, total={}, sent={}, needsAttention={}, skippedDuplicate={}, deferred={}, notCompleted={}, inboxStats={}",
                campaignId, summary.totalRecipients(), summary.sent(), summary.needsAttention(),
                summary.skippedDuplicate(), summary.deferred(), notCompleted, stats);
        return summary;
    }
}
