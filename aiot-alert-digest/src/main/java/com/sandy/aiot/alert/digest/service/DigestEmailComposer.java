package com.sandy.aiot.alert.digest.service;

import com.sandy.aiot.alert.digest.entity.DigestAlertItem;
import com.sandy.aiot.alert.digest.entity.DigestPolicy;
import com.sandy.aiot.alert.digest.tools.DigestCategories;
import com.sandy.aiot.alert.digest.vo.DigestEmail;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Plain-text subject and body for digest emails, including the acknowledgment link.
 */
@Component
public class DigestEmailComposer {

    private static final DateTimeFormatter TS_FMT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    @Value("${digest.email.subject-prefix:Alert Digest:}")
    private String subjectPrefix;
    @Value("${digest.email.ack-base-url:http://localhost:8080/api/alert-digests/acknowledge}")
    private String ackBaseUrl;

    public String subject(DigestEmail email) {
        int n = email.getItems().size();
        return String.format("%s %s (%d alert%s)", subjectPrefix, DigestCategories.label(email.getCategory()), n, n == 1 ? "" : "s");
    }

    public String body(DigestEmail email) {
        StringBuilder sb = new StringBuilder();
        sb.append("Water quality alert digest: ").append(DigestCategories.label(email.getCategory())).append("\n");
        sb.append("First alert: ").append(TS_FMT.format(email.getCreatedAt())).append("\n");
        sb.append("Notification ").append(email.getAttempt()).append(" of ").append(DigestPolicy.MAX_SEND_ATTEMPTS).append("\n\n");
        for (DigestAlertItem item : email.getItems()) {
            sb.append("- [").append(item.getSeverity()).append("] ").append(item.getSummary())
                    .append(" (").append(TS_FMT.format(item.getTimestamp())).append(")\n");
        }
        sb.append("\nAcknowledge to stop further reminders for this issue:\n").append(ackLink(email)).append("\n\n");
        sb.append("Reminders are sent at most once every ").append(DigestPolicy.COOLDOWN.toHours()).append(" hours.\n");
        return sb.toString();
    }

    public String ackLink(DigestEmail email) {
        return UriComponentsBuilder.fromHttpUrl(ackBaseUrl)
                .queryParam("token", email.getAckToken())
                .queryParam("id", email.getDigestId())
                .encode()
                .toUriString();
    }
}
