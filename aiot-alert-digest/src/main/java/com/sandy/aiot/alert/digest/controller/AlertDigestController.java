package com.sandy.aiot.alert.digest.controller;

import com.sandy.aiot.alert.digest.entity.AlertDigest;
import com.sandy.aiot.alert.digest.entity.DigestAlertItem;
import com.sandy.aiot.alert.digest.service.DigestAcknowledgmentService;
import com.sandy.aiot.alert.digest.service.DigestCooldownScheduler;
import com.sandy.aiot.alert.digest.service.DigestStore;
import com.sandy.aiot.alert.digest.service.RawAlertIngestService;
import com.sandy.aiot.alert.digest.vo.AckResult;
import com.sandy.aiot.alert.digest.vo.DigestSweepReport;
import com.sandy.aiot.alert.digest.vo.MergeResult;
import com.sandy.aiot.alert.digest.vo.RawAlertEvent;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * REST endpoints for digest acknowledgment links, raw alert intake and read-only digest views.
 */
@RestController
@RequestMapping("/api/alert-digests")
@RequiredArgsConstructor
@Slf4j
public class AlertDigestController {

    public static final String ACTOR_HEADER = "X-User-Uid";

    private final DigestAcknowledgmentService acknowledgmentService;
    private final RawAlertIngestService ingestService;
    private final DigestCooldownScheduler cooldownScheduler;
    private final DigestStore digestStore;

    /** Link-click form: /acknowledge?token=..&id=.. */
    @GetMapping("/acknowledge")
    public ResponseEntity<AckResp> acknowledgeByLink(@RequestParam(required = false) String token,
                                                     @RequestParam(required = false) String id,
                                                     @RequestHeader(value = ACTOR_HEADER, required = false) String actorUid) {
        return acknowledge(token, id, actorUid);
    }

    @PostMapping("/acknowledge")
    public ResponseEntity<AckResp> acknowledgeByPost(@RequestBody(required = false) AckReq req,
                                                     @RequestParam(required = false) String token,
                                                     @RequestParam(required = false) String id,
                                                     @RequestHeader(value = ACTOR_HEADER, required = false) String actorUid) {
        String t = req != null && req.getToken() != null ? req.getToken() : token;
        String digestId = req != null && req.getDigestId() != null ? req.getDigestId() : id;
        return acknowledge(t, digestId, actorUid);
    }

    private ResponseEntity<AckResp> acknowledge(String token, String digestId, String actorUid) {
        if (token == null || token.isBlank() || digestId == null || digestId.isBlank()) {
            return ResponseEntity.badRequest().body(AckResp.fail("Missing required parameters: token and id", null));
        }
        AckResult result = acknowledgmentService.acknowledge(digestId, token, actorUid);
        switch (result.getStatus()) {
            case ACKNOWLEDGED:
                return ResponseEntity.ok(AckResp.ok("Alert digest acknowledged successfully. You will no longer receive reminders for this issue.", digestId));
            case ALREADY_ACKNOWLEDGED:
                return ResponseEntity.ok(AckResp.ok("Digest was already acknowledged", digestId));
            case NOT_FOUND:
                return ResponseEntity.status(HttpStatus.NOT_FOUND).body(AckResp.fail("Digest not found", null));
            case INVALID_TOKEN:
                return ResponseEntity.status(HttpStatus.FORBIDDEN).body(AckResp.fail("Invalid acknowledgement token", null));
            default:
                return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(AckResp.fail("Acknowledgement could not be processed, please retry", null));
        }
    }

    @PostMapping("/events")
    public ResponseEntity<MergeResp> ingest(@RequestBody RawAlertEvent event) {
        MergeResult result = ingestService.ingest(event);
        MergeResp resp = new MergeResp();
        resp.setSuccess(result.isAggregated());
        resp.setStatus(result.getStatus().name());
        resp.setMessage(result.getMessage());
        if (result.getDigest() != null) {
            resp.setDigestId(result.getDigest().getId());
            resp.setCategory(result.getDigest().getCategory());
            resp.setItemCount(result.getDigest().getItems().size());
        }
        if (result.getStatus() == MergeResult.Status.REJECTED) {
            return ResponseEntity.unprocessableEntity().body(resp);
        }
        if (!result.isAggregated()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(resp);
        }
        return ResponseEntity.ok(resp);
    }

    @GetMapping
    public List<DigestView> list(@RequestParam(required = false) String recipientUid) {
        List<AlertDigest> digests = recipientUid == null || recipientUid.isBlank()
                ? digestStore.findRecent()
                : digestStore.findByRecipient(recipientUid);
        return digests.stream().map(this::toView).collect(Collectors.toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<DigestView> get(@PathVariable String id) {
        return digestStore.findById(id)
                .map(d -> ResponseEntity.ok(toView(d)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /** Runs one cooldown sweep now instead of waiting for the timer. */
    @PostMapping("/send")
    public DigestSweepReport sendNow() {
        return cooldownScheduler.sweepOnce();
    }

    private DigestView toView(AlertDigest d) {
        DigestView v = new DigestView();
        v.setId(d.getId());
        v.setRecipientUid(d.getRecipientUid());
        v.setRecipientEmail(d.getRecipientEmail());
        v.setCategory(d.getCategory());
        v.setItems(new ArrayList<>(d.getItems()));
        v.setCreatedAt(d.getCreatedAt());
        v.setLastUpdatedAt(d.getLastUpdatedAt());
        v.setLastSentAt(d.getLastSentAt());
        v.setCooldownUntil(d.getCooldownUntil());
        v.setSendAttempts(d.getSendAttempts());
        v.setAcknowledged(d.isAcknowledged());
        v.setAcknowledgedBy(d.getAcknowledgedBy());
        v.setAcknowledgedAt(d.getAcknowledgedAt());
        return v;
    }

    @Data
    public static class AckReq {
        private String token;
        private String digestId;
    }

    @Data
    public static class AckResp {
        private boolean success;
        private String message;
        private String digestId;
        public static AckResp ok(String msg, String digestId) { AckResp r = new AckResp(); r.success = true; r.message = msg; r.digestId = digestId; return r; }
        public static AckResp fail(String msg, String digestId) { AckResp r = new AckResp(); r.success = false; r.message = msg; r.digestId = digestId; return r; }
    }

    @Data
    public static class MergeResp {
        private boolean success;
        private String status;
        private String message;
        private String digestId;
        private String category;
        private int itemCount;
    }

    @Data
    public static class DigestView {
        private String id;
        private String recipientUid;
        private String recipientEmail;
        private String category;
        private List<DigestAlertItem> items;
        private Instant createdAt;
        private Instant lastUpdatedAt;
        private Instant lastSentAt;
        private Instant cooldownUntil;
        private int sendAttempts;
        private boolean acknowledged;
        private String acknowledgedBy;
        private Instant acknowledgedAt;
    }
}
