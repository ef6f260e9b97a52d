package com.agentrouter.common.routing;

import com.agentrouter.common.model.Complexity;
import com.agentrouter.common.model.EscalationDecision;
import com.agentrouter.common.model.EscalationPriority;
import com.agentrouter.common.model.EscalationReason;
import com.agentrouter.common.model.QueryAnalysis;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Decides whether a query needs a human operator.
 *
 * <pre>
 *   escalate = complexity == HIGH  OR  sentiment &lt;= -1  OR  recommendedCount &gt; 2
 * </pre>
 * Every matching condition is reported as a reason; the decision priority is the highest
 * priority among them.
 */
public final class EscalationDecider {

    static final int SENTIMENT_LIMIT       = -1;
    static final int MAX_UNESCALATED_MATCH = 2;

    private EscalationDecider() {}

    public static EscalationDecision decide(QueryAnalysis analysis, int recommendedCount) {
        List<EscalationReason> reasons = new ArrayList<>();
        if (analysis.complexity() == Complexity.HIGH) {
            reasons.add(EscalationReason.COMPLEX_ISSUE);
        }
        if (analysis.sentiment() <= SENTIMENT_LIMIT) {
            reasons.add(EscalationReason.NEGATIVE_SENTIMENT);
        }
        if (recommendedCount > MAX_UNESCALATED_MATCH) {
            reasons.add(EscalationReason.BROAD_MATCH);
        }
        if (reasons.isEmpty()) {
            return EscalationDecision.none();
        }
        EscalationPriority priority = reasons.stream()
            .map(EscalationReason::priority)
            .max(Comparator.naturalOrder())
            .orElse(EscalationPriority.LOW);
        return new EscalationDecision(true, reasons, priority);
    }
}
