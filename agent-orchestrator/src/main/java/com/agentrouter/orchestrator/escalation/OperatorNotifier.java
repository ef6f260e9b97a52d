package com.agentrouter.orchestrator.escalation;

import com.agentrouter.common.model.EscalationRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Posts each new escalation to the operator webhook (fire-and-forget).
 *
 * <p>Disabled when {@code routing.escalation.operator-webhook-url} is blank. A failed post is
 * logged as non-critical; it never affects the session.
 */
@Component
public class OperatorNotifier {

    private static final Logger log = LoggerFactory.getLogger(OperatorNotifier.class);

    private final WebClient webhookClient;

    public OperatorNotifier(WebClient.Builder builder,
                            @Value("${routing.escalation.operator-webhook-url:}") String webhookUrl) {
        this.webhookClient = webhookUrl.isBlank() ? null : builder.baseUrl(webhookUrl).build();
    }

    public void notifyOperators(EscalationRecord record) {
        if (webhookClient == null) {
            log.debug("Operator webhook not configured. sessionId={}", record.sessionId());
            return;
        }
        webhookClient.post()
            .header("X-Session-Id", record.sessionId())
            .bodyValue(record)
            .retrieve()
            .toBodilessEntity()
            .subscribe(
                r   -> log.info("Escalation notification sent. sessionId={} priority={} status={}",
                                record.sessionId(), record.priority(), r.getStatusCode()),
                err -> log.warn("Escalation notification failed (non-critical). sessionId={}",
                                record.sessionId(), err)
            );
    }
}
