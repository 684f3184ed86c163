package com.company.anomaly.notification;

import com.company.anomaly.domain.Anomaly;
import org.springframework.stereotype.Component;

@Component
public class AlertMessageFormatter {

    public AlertMessage format(Anomaly anomaly) {
        String title = "Anomaly Detected: " + anomaly.getType().getDisplayName();

        StringBuilder body = new StringBuilder()
                .append(title).append("\n\n")
                .append("Type: ").append(anomaly.getType().getDisplayName()).append('\n')
                .append("Severity: ").append(anomaly.getSeverity().name()).append("\n\n")
                .append("Description: ").append(anomaly.getDescription()).append("\n\n")
                .append("Affected: ").append(String.join(", ", anomaly.getAffectedEntities())).append("\n\n")
                .append("Investigation Steps:");
        for (String step : anomaly.getInvestigationSteps()) {
            body.append("\n  - ").append(step);
        }

        return new AlertMessage(title, body.toString(), anomaly.getSeverity());
    }
}
