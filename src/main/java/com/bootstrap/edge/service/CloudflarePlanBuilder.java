package com.bootstrap.edge.service;

import com.bootstrap.edge.dto.CloudflarePlanRequest;
import com.bootstrap.edge.model.CloudflareCapabilities;
import com.bootstrap.shared.exception.MissingConfigurationException;
import com.bootstrap.shared.model.Plan;
import com.bootstrap.shared.model.PlanStep;
import com.bootstrap.shared.model.Provider;
import com.bootstrap.shared.model.StepStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Cloudflare 計畫產生器
 *
 * 固定三個步驟 worker / d1 / r2，只解析名稱，不呼叫 API。
 * 權限探測明確回報沒有 D1 / R2 權限時，該步驟改為 skipped。
 */
@Slf4j
@Service
public class CloudflarePlanBuilder {

    public Plan buildPlan(CloudflarePlanRequest request, CloudflareCapabilities capabilities) {
        String projectId = request.getProjectId();
        if (projectId == null || projectId.isBlank()) {
            throw new MissingConfigurationException("PROJECT_ID", "PROJECT_ID is required to build the Cloudflare plan");
        }

        String workerName = workerName(projectId);
        String d1Name = resolveD1Name(request);
        String bucket = resolveR2Bucket(request);
        boolean d1Denied = capabilities != null && capabilities.isD1Denied();
        boolean r2Denied = capabilities != null && capabilities.isR2Denied();

        List<PlanStep> steps = new ArrayList<>();
        steps.add(new PlanStep("worker", "Worker project",
                StepStatus.ENSURE, "Ensure worker \"" + workerName + "\" exists"));
        steps.add(new PlanStep("d1", "D1 database",
                d1Denied ? StepStatus.SKIPPED : StepStatus.ENSURE,
                d1Denied
                        ? "Skip database \"" + d1Name + "\" (no D1 permissions)"
                        : "Ensure database \"" + d1Name + "\" exists"));
        steps.add(new PlanStep("r2", "R2 bucket",
                r2Denied ? StepStatus.SKIPPED : StepStatus.ENSURE,
                r2Denied
                        ? "Skip bucket \"" + bucket + "\" (no R2 permissions)"
                        : "Ensure bucket \"" + bucket + "\" exists"));

        List<String> notes = new ArrayList<>();
        notes.add("Project: " + projectId);
        notes.add("Worker: " + workerName);
        notes.add("D1 database: " + d1Name + (isBlank(request.getD1DatabaseName()) ? " (default)" : ""));
        notes.add("R2 bucket: " + bucket + (isBlank(request.getR2Bucket()) ? " (default)" : ""));
        notes.add("Zone: " + (isBlank(request.getZoneId()) ? "not set" : request.getZoneId()));
        notes.add("Stripe webhook: " + (request.isStripeWebhookConfigured() ? "configured" : "missing"));

        if (capabilities != null) {
            if (Boolean.FALSE.equals(capabilities.getAuthenticated())) {
                notes.add("Warning: Cloudflare API token could not be verified");
            }
            if (capabilities.getUserEmail() != null) {
                notes.add("Authenticated: " + capabilities.getUserEmail());
            }
            if (d1Denied) {
                notes.add("Warning: No D1 permissions detected");
            }
            if (r2Denied) {
                notes.add("Warning: No R2 permissions detected");
            }
        }

        log.info("Cloudflare 計畫完成: worker={}, d1={}, r2={}, probed={}",
                workerName, d1Name, bucket, capabilities != null);

        return Plan.builder()
                .provider(Provider.CLOUDFLARE)
                .accountId(request.getAccountId())
                .steps(steps)
                .notes(notes)
                .build();
    }

    // ==================== 名稱解析 ====================

    public static String workerName(String projectId) {
        return projectId + "-worker";
    }

    public static String resolveD1Name(CloudflarePlanRequest request) {
        return isBlank(request.getD1DatabaseName())
                ? request.getProjectId() + "-d1"
                : request.getD1DatabaseName().trim();
    }

    public static String resolveR2Bucket(CloudflarePlanRequest request) {
        return isBlank(request.getR2Bucket())
                ? request.getProjectId() + "-assets"
                : request.getR2Bucket().trim();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
