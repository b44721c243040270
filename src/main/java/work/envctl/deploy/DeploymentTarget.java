package work.envctl.deploy;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import work.envctl.controlplane.ControlPlane;
import work.envctl.controlplane.ControlPlaneException;
import work.envctl.runtime.OperationContext;
import work.envctl.template.OutputDefinition;
import work.envctl.template.Template;

/**
 * Deployment operations bound to one {@link Scope}. Every call is routed to the control plane with that
 * scope; a successful {@link #deploy} waits until the new deployment is readable.
 */
public final class DeploymentTarget {
    private static final String DEPLOYMENT_BLADE = "/#view/HubsExtension/DeploymentDetailsBlade/~/overview/id/";

    private final ControlPlane controlPlane;
    private final Scope scope;
    private final ReadAfterWriteRetry retry;
    private final String portalBase;

    public DeploymentTarget(ControlPlane controlPlane, Scope scope, ReadAfterWriteRetry retry, String portalBase) {
        this.controlPlane = Objects.requireNonNull(controlPlane, "controlPlane");
        this.scope = Objects.requireNonNull(scope, "scope");
        this.retry = Objects.requireNonNull(retry, "retry");
        this.portalBase = portalBase == null ? "https://portal.azure.com" : portalBase;
    }

    public Scope scope() {
        return scope;
    }

    public DeploymentRecord deploy(
        String deploymentName,
        byte[] artifact,
        Map<String, Object> parameters,
        Map<String, String> tags,
        OperationContext context
    ) {
        context.ensureNotCancelled();
        try {
            controlPlane.deploy(scope, deploymentName, artifact, parameters, tags);
        } catch (ControlPlaneException ex) {
            throw new DeploymentFailedException("deployment", deploymentName, ex);
        }
        return retry.await(deploymentName, () -> controlPlane.getDeployment(scope, deploymentName), context);
    }

    public DeploymentRecord getDeployment(String deploymentName) {
        return controlPlane.getDeployment(scope, deploymentName);
    }

    public List<DeploymentRecord> listDeployments() {
        return controlPlane.listDeployments(scope);
    }

    public List<WhatIfChange> deployPreview(String deploymentName, byte[] artifact, Map<String, Object> parameters) {
        try {
            return controlPlane.whatIf(scope, deploymentName, artifact, parameters);
        } catch (ControlPlaneException ex) {
            throw new DeploymentFailedException("deployment preview", deploymentName, ex);
        }
    }

    public List<DeploymentOperation> operations(String deploymentName) {
        return controlPlane.listOperations(scope, deploymentName);
    }

    public String deploymentPortalUrl(String deploymentId) {
        return portalBase + DEPLOYMENT_BLADE + URLEncoder.encode(deploymentId, StandardCharsets.UTF_8);
    }

    public String resourcePortalUrl(String resourceId) {
        return controlPlane.portalUrl(resourceId);
    }

    public String describe() {
        if (scope instanceof Scope.ResourceGroup group) {
            return "resource group " + group.resourceGroup() + " (subscription " + group.subscriptionId() + ")";
        }
        Scope.Subscription subscription = (Scope.Subscription) scope;
        return "subscription " + subscription.subscriptionId() + " (" + subscription.location() + ")";
    }

    /**
     * Maps deployment outputs onto the template's declared outputs. Names match case-insensitively and the
     * template's casing wins; undeclared outputs are dropped.
     */
    public static Map<String, DeploymentOutput> mapOutputs(Template template, DeploymentRecord record) {
        Map<String, OutputDefinition> declared = new LinkedHashMap<>();
        for (OutputDefinition output : template.outputs().values()) {
            declared.put(output.name().toLowerCase(Locale.ROOT), output);
        }
        Map<String, DeploymentOutput> mapped = new LinkedHashMap<>();
        record.outputs().forEach((name, output) -> {
            OutputDefinition definition = declared.get(name.toLowerCase(Locale.ROOT));
            if (definition != null) {
                mapped.put(definition.name(), new DeploymentOutput(definition.type().name().toLowerCase(Locale.ROOT), output.value()));
            }
        });
        return mapped;
    }
}
