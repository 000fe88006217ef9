package com.tenex.sync.admin;

import com.tenex.sync.core.entity.Project;
import com.tenex.sync.core.entity.ProjectStatus;
import com.tenex.sync.service.ProjectSyncService;
import com.tenex.sync.subscription.SubscriptionInfo;
import com.tenex.sync.subscription.SubscriptionOrchestrator;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Read-only view of the synchronization state, for operators.
 *
 * <p>Disabled unless {@code tenex.sync.admin.enabled=true}. Should sit behind authentication or
 * network controls: it exposes project and agent identities.</p>
 */
@RestController
@RequestMapping(path = "/sync", produces = MediaType.APPLICATION_JSON_VALUE)
@ConditionalOnProperty(prefix = "tenex.sync.admin", name = "enabled", havingValue = "true", matchIfMissing = false)
@Validated
public class SyncAdminController {

    private final ProjectSyncService sync;
    private final SubscriptionOrchestrator orchestrator;
    private final Clock clock;

    public SyncAdminController(ProjectSyncService sync, SubscriptionOrchestrator orchestrator, Clock clock) {
        this.sync = sync;
        this.orchestrator = orchestrator;
        this.clock = clock;
    }

    @GetMapping("/ping")
    public PingResponse ping() {
        return new PingResponse("ok", clock.instant().toString(), sync.session().isPresent());
    }

    @GetMapping("/projects")
    public List<Project> projects() {
        return sync.projects();
    }

    /**
     * Latest presence of one project. 404 when the project is unknown.
     */
    @GetMapping("/projects/{identity}/status")
    public ResponseEntity<ProjectStatusResponse> status(@PathVariable("identity") @NotBlank String identity) {
        if (sync.project(identity).isEmpty() && sync.status(identity).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        ProjectStatus status = sync.status(identity).orElse(null);
        return ResponseEntity.ok(new ProjectStatusResponse(
                identity,
                sync.isOnline(identity),
                status == null ? null : status.observedAt(),
                sync.availableAgents(identity)));
    }

    @GetMapping("/subscriptions")
    public List<SubscriptionInfo> subscriptions() {
        return orchestrator.activeSubscriptions();
    }

    public record PingResponse(String status, String timestamp, boolean sessionRunning) {
    }

    public record ProjectStatusResponse(String projectIdentity, boolean online, Instant observedAt,
                                        List<ProjectStatus.AgentAvailability> availableAgents) {
    }
}
