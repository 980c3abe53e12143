package uk.gegc.aimeter.features.ai.application.relay;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import uk.gegc.aimeter.features.ai.domain.event.AiEvent;
import uk.gegc.aimeter.features.ai.domain.event.AssistantFinalEvent;
import uk.gegc.aimeter.features.ai.domain.event.DoneEvent;
import uk.gegc.aimeter.features.ai.domain.event.ErrorEvent;
import uk.gegc.aimeter.features.ai.domain.event.TextDeltaEvent;
import uk.gegc.aimeter.features.ai.domain.event.UsageReportEvent;
import uk.gegc.aimeter.features.ai.domain.model.AbortSignal;
import uk.gegc.aimeter.features.ai.domain.model.GraphErrorCode;
import uk.gegc.aimeter.features.ai.domain.model.GraphFinal;
import uk.gegc.aimeter.features.ai.domain.model.GraphRunResult;
import uk.gegc.aimeter.features.ai.domain.model.RunContext;
import uk.gegc.aimeter.features.billing.application.BillingLedgerService;
import uk.gegc.aimeter.features.billing.application.BillingMetricsService;

import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Stream;

/**
 * Pump/drain relay between a provider run and its caller.
 * <p>
 * The pump runs on the relay executor and drives the provider stream to its end no matter what
 * the caller does: every {@code usage_report} goes to the billing ledger, every other event is
 * offered to an {@link EventChannel} drained by the caller's {@link UiEventStream}. The pump
 * synthesizes exactly one terminal event followed by one {@code done}; provider {@code done}
 * events and UI events after the terminal one are dropped, usage reports never are.
 */
@Slf4j
@Component
public class RunEventRelay {

    private final BillingLedgerService billingLedgerService;
    private final BillingMetricsService metricsService;
    private final RelayProperties relayProperties;
    private final Executor relayExecutor;

    public RunEventRelay(BillingLedgerService billingLedgerService,
                         BillingMetricsService metricsService,
                         RelayProperties relayProperties,
                         @Qualifier("relayTaskExecutor") Executor relayExecutor) {
        this.billingLedgerService = billingLedgerService;
        this.metricsService = metricsService;
        this.relayProperties = relayProperties;
        this.relayExecutor = relayExecutor;
    }

    public RelayedRun relay(GraphRunResult result, RunContext runContext, AbortSignal abortSignal) {
        EventChannel<AiEvent> channel = new EventChannel<>();
        RunPump pump = new RunPump(result, runContext, abortSignal, channel, MDC.getCopyOfContextMap());

        abortSignal.onAbort(pump::onAbort);
        CompletableFuture<Void> pumpCompletion = CompletableFuture.runAsync(pump::run, relayExecutor);

        return new RelayedRun(new UiEventStream(channel), result.finalResult(), pumpCompletion);
    }

    private final class RunPump {

        private final GraphRunResult result;
        private final RunContext runContext;
        private final AbortSignal abortSignal;
        private final EventChannel<AiEvent> channel;
        private final Map<String, String> mdcContext;
        private final StringBuilder assistantText = new StringBuilder();

        private volatile PumpState state = PumpState.RUNNING;
        private int usageOrdinal;
        private RuntimeException billingFailure;

        RunPump(GraphRunResult result, RunContext runContext, AbortSignal abortSignal,
                EventChannel<AiEvent> channel, Map<String, String> mdcContext) {
            this.result = result;
            this.runContext = runContext;
            this.abortSignal = abortSignal;
            this.channel = channel;
            this.mdcContext = mdcContext;
        }

        void run() {
            Map<String, String> previousContext = MDC.getCopyOfContextMap();
            if (mdcContext != null) {
                MDC.setContextMap(mdcContext);
            }
            try (Stream<AiEvent> events = result.stream()) {
                Iterator<AiEvent> iterator = events.iterator();
                while (iterator.hasNext()) {
                    handle(iterator.next());
                }
                onStreamEnd();
            } catch (RuntimeException e) {
                if (abortSignal.isAborted()) {
                    log.info("Provider stream ended by abort runId={}: {}", runContext.runId(), e.getMessage());
                    terminate(PumpState.ABORTED, ErrorEvent.aborted());
                } else {
                    log.warn("Provider stream failed runId={}", runContext.runId(), e);
                    terminate(PumpState.FAILED, new ErrorEvent(messageOf(e)));
                }
            } finally {
                terminate(PumpState.FAILED, new ErrorEvent(GraphErrorCode.INTERNAL.wireName()));
                channel.close();
                state = PumpState.CLOSED;
                log.debug("Relay pump closed runId={} usageReports={}", runContext.runId(), usageOrdinal);
                if (previousContext != null) {
                    MDC.setContextMap(previousContext);
                } else {
                    MDC.clear();
                }
            }
            if (billingFailure != null) {
                throw billingFailure;
            }
        }

        void onAbort() {
            if (terminate(PumpState.ABORTED, ErrorEvent.aborted())) {
                log.info("Run aborted by caller runId={}", runContext.runId());
            }
        }

        private void handle(AiEvent event) {
            if (event instanceof UsageReportEvent usage) {
                commit(usage);
            } else if (event instanceof DoneEvent) {
                // the relay emits its own done
            } else if (event instanceof AssistantFinalEvent finalEvent) {
                terminate(PumpState.SUCCEEDED, finalEvent);
            } else if (event instanceof ErrorEvent error) {
                boolean aborted = abortSignal.isAborted() && ErrorEvent.ABORTED.equals(error.error());
                terminate(aborted ? PumpState.ABORTED : PumpState.FAILED, error);
            } else {
                if (event instanceof TextDeltaEvent delta && delta.delta() != null) {
                    assistantText.append(delta.delta());
                }
                emit(event);
            }
        }

        private void commit(UsageReportEvent usage) {
            int ordinal = usageOrdinal++;
            try {
                billingLedgerService.commitUsageFact(usage.fact(), ordinal);
            } catch (RuntimeException e) {
                // Only reachable when the ledger is configured to rethrow
                log.error("Billing commit failed runId={} ordinal={}", runContext.runId(), ordinal, e);
                if (billingFailure == null) {
                    billingFailure = e;
                }
                terminate(PumpState.FAILED, new ErrorEvent(messageOf(e)));
            }
        }

        private void onStreamEnd() {
            if (state != PumpState.RUNNING) {
                return;
            }
            if (abortSignal.isAborted()) {
                terminate(PumpState.ABORTED, ErrorEvent.aborted());
                return;
            }
            GraphFinal graphFinal = awaitFinal();
            if (graphFinal.ok()) {
                terminate(PumpState.SUCCEEDED, new AssistantFinalEvent(assistantText.toString()));
            } else {
                GraphErrorCode code = graphFinal.error() != null ? graphFinal.error() : GraphErrorCode.INTERNAL;
                terminate(code == GraphErrorCode.ABORTED ? PumpState.ABORTED : PumpState.FAILED,
                        new ErrorEvent(code.wireName()));
            }
        }

        private GraphFinal awaitFinal() {
            long timeoutMs = relayProperties.getFinalTimeout().toMillis();
            try {
                return result.finalResult().get(timeoutMs, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                log.warn("Final result not resolved within {} ms runId={}", timeoutMs, runContext.runId());
                return GraphFinal.failure(runContext.runId(), runContext.ingressRequestId(), GraphErrorCode.TIMEOUT);
            } catch (ExecutionException e) {
                log.warn("Final result failed runId={}", runContext.runId(), e.getCause());
                return GraphFinal.failure(runContext.runId(), runContext.ingressRequestId(), GraphErrorCode.INTERNAL);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return GraphFinal.failure(runContext.runId(), runContext.ingressRequestId(), GraphErrorCode.INTERNAL);
            }
        }

        private synchronized void emit(AiEvent event) {
            if (state == PumpState.RUNNING) {
                channel.offer(event);
            }
        }

        /**
         * Moves the pump out of RUNNING and emits the terminal event plus {@code done}.
         * Only the first call has any effect.
         */
        private synchronized boolean terminate(PumpState outcome, AiEvent terminalEvent) {
            if (state != PumpState.RUNNING) {
                return false;
            }
            state = outcome;
            channel.offer(terminalEvent);
            channel.offer(new DoneEvent());
            channel.close();
            metricsService.incrementRunOutcome(outcome.name().toLowerCase(Locale.ROOT));
            return true;
        }

        private String messageOf(Throwable e) {
            return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        }
    }
}
