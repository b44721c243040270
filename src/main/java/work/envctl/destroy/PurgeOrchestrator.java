package work.envctl.destroy;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.envctl.config.EnvironmentKeys;
import work.envctl.console.Console;
import work.envctl.console.UserDeniedException;
import work.envctl.controlplane.ControlPlane;
import work.envctl.controlplane.ControlPlaneException;
import work.envctl.controlplane.ResourceProperties;
import work.envctl.controlplane.ResourceSummary;
import work.envctl.deploy.DeploymentDependency;
import work.envctl.deploy.DeploymentFailedException;
import work.envctl.deploy.DeploymentLocator;
import work.envctl.deploy.DeploymentRecord;
import work.envctl.deploy.DeploymentTags;
import work.envctl.deploy.DeploymentTarget;
import work.envctl.deploy.DeploymentTimeoutException;
import work.envctl.deploy.ProvisioningState;
import work.envctl.deploy.Scope;
import work.envctl.runtime.OperationContext;

/**
 * Tears down the infrastructure of an environment: deletes the resource groups its last deployment created,
 * purges soft-deleted resources, then overwrites the deployment with an empty template so its history stays.
 */
public final class PurgeOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(PurgeOrchestrator.class);

    static final String DEPLOYMENTS_TYPE = "Microsoft.Resources/deployments";
    static final String RESOURCE_GROUPS_TYPE = "Microsoft.Resources/resourceGroups";

    private static final String GROUP_SCHEMA = "https://schema.management.azure.com/schemas/2019-04-01/deploymentTemplate.json#";
    private static final String SUBSCRIPTION_SCHEMA =
        "https://schema.management.azure.com/schemas/2018-05-01/subscriptionDeploymentTemplate.json#";

    private final ControlPlane controlPlane;
    private final Console console;
    private final DeploymentLocator locator;

    public PurgeOrchestrator(ControlPlane controlPlane, Console console) {
        this.controlPlane = Objects.requireNonNull(controlPlane, "controlPlane");
        this.console = Objects.requireNonNull(console, "console");
        this.locator = new DeploymentLocator(console);
    }

    public DestroyResult destroy(DeploymentTarget target, String environmentName, DestroyOptions options, OperationContext context) {
        Scope scope = target.scope();
        String subscriptionId = scope.subscriptionId();
        DeploymentRecord deployment = locator.locate(target, environmentName, environmentName);

        List<String> groups = resourceGroups(scope, deployment);
        Map<String, List<ResourceSummary>> resources = new LinkedHashMap<>();
        Set<String> missingGroups = new LinkedHashSet<>();
        for (String group : groups) {
            context.ensureNotCancelled();
            try {
                resources.put(group, controlPlane.listResources(subscriptionId, group));
            } catch (ControlPlaneException ex) {
                if (!ex.isNotFound()) {
                    throw new DeploymentFailedException("resource group", group, ex);
                }
                log.info("Resource group {} no longer exists, skipping it", group);
                missingGroups.add(group);
            }
        }

        List<PurgeCandidate> candidates = purgeCandidates(subscriptionId, resources);

        if (!resources.isEmpty()) {
            int total = 0;
            for (List<ResourceSummary> groupResources : resources.values()) {
                total += groupResources.size();
            }
            if (!options.force()) {
                for (String group : resources.keySet()) {
                    console.message("Resource group " + group + ": "
                        + target.resourcePortalUrl(ResourceIds.resourceGroupId(subscriptionId, group)));
                }
                String question = String.format("This will delete %d resources, are you sure you want to continue?", total);
                if (!console.confirm(question, false)) {
                    throw new UserDeniedException("user denied delete confirmation");
                }
            }
        }

        List<String> deleted = new ArrayList<>();
        for (String group : resources.keySet()) {
            context.ensureNotCancelled();
            console.showSpinner("Deleting resource group " + group);
            try {
                controlPlane.deleteResourceGroup(subscriptionId, group);
                console.stopSpinner("Deleting resource group " + group, true);
                deleted.add(group);
            } catch (ControlPlaneException ex) {
                console.stopSpinner("Deleting resource group " + group, false);
                throw new DeploymentFailedException("resource group", group, ex);
            }
        }

        List<PurgeOutcome> outcomes = purge(subscriptionId, candidates, options, context);

        redeployEmpty(target, deployment, environmentName, context);

        return new DestroyResult(deployment, deleted, outcomes, invalidatedKeys(scope, deployment, missingGroups));
    }

    /**
     * Groups a deployment created: taken from its output resources when it succeeded, otherwise from the nested
     * deployments that depend on resource groups.
     */
    static List<String> resourceGroups(Scope scope, DeploymentRecord deployment) {
        if (scope instanceof Scope.ResourceGroup group) {
            return List.of(group.resourceGroup());
        }
        Set<String> groups = new LinkedHashSet<>();
        if (deployment.state() == ProvisioningState.SUCCEEDED) {
            for (String id : deployment.outputResourceIds()) {
                ResourceIds.resourceGroup(id).ifPresent(groups::add);
            }
        } else {
            for (DeploymentDependency dependency : deployment.dependencies()) {
                if (!DEPLOYMENTS_TYPE.equalsIgnoreCase(dependency.resourceType())) {
                    continue;
                }
                for (DeploymentDependency.Reference reference : dependency.dependsOn()) {
                    if (RESOURCE_GROUPS_TYPE.equalsIgnoreCase(reference.resourceType())) {
                        groups.add(reference.resourceName());
                    }
                }
            }
        }
        return new ArrayList<>(groups);
    }

    private List<PurgeCandidate> purgeCandidates(String subscriptionId, Map<String, List<ResourceSummary>> resources) {
        List<PurgeCandidate> candidates = new ArrayList<>();
        for (PurgeKind kind : PurgeKind.values()) {
            resources.forEach((group, groupResources) -> {
                for (ResourceSummary resource : groupResources) {
                    if (!kind.resourceType().equalsIgnoreCase(resource.type())) {
                        continue;
                    }
                    ResourceProperties properties;
                    try {
                        properties = controlPlane.getResourceProperties(subscriptionId, resource);
                    } catch (ControlPlaneException ex) {
                        throw new DeploymentFailedException(resource.type(), resource.name(), ex);
                    }
                    candidates.add(new PurgeCandidate(kind, subscriptionId, group, resource, properties));
                }
            });
        }
        return candidates;
    }

    private List<PurgeOutcome> purge(String subscriptionId, List<PurgeCandidate> candidates, DestroyOptions options, OperationContext context) {
        List<PurgeOutcome> outcomes = new ArrayList<>();
        Map<String, List<PurgeCandidate>> eligible = new LinkedHashMap<>();
        for (PurgeCandidate candidate : candidates) {
            if (candidate.eligible()) {
                eligible.computeIfAbsent(candidate.groupLabel(), label -> new ArrayList<>()).add(candidate);
            } else {
                log.info("{} {} has purge protection or no soft delete, leaving it", candidate.kind().displayName(),
                    candidate.resource().name());
                outcomes.add(new PurgeOutcome(candidate.kind(), candidate.resource().name(), PurgeOutcome.Status.PROTECTED));
            }
        }
        if (eligible.isEmpty()) {
            return outcomes;
        }

        if (!options.purge() && !confirmPurge(eligible)) {
            log.info("Purge declined; soft-deleted resources keep their names reserved");
            eligible.values().forEach(group -> group.forEach(candidate ->
                outcomes.add(new PurgeOutcome(candidate.kind(), candidate.resource().name(), PurgeOutcome.Status.SKIPPED))));
            return outcomes;
        }

        for (Map.Entry<String, List<PurgeCandidate>> group : eligible.entrySet()) {
            for (PurgeCandidate candidate : group.getValue()) {
                context.ensureNotCancelled();
                String title = "Purging " + group.getKey() + ": " + candidate.resource().name();
                console.showSpinner(title);
                try {
                    controlPlane.purge(subscriptionId, candidate.resource(), candidate.properties());
                    console.stopSpinner(title, true);
                } catch (ControlPlaneException ex) {
                    console.stopSpinner(title, false);
                    throw new DeploymentFailedException(candidate.kind().resourceType(), candidate.resource().name(), ex);
                }
                outcomes.add(new PurgeOutcome(candidate.kind(), candidate.resource().name(), PurgeOutcome.Status.PURGED));
            }
        }
        return outcomes;
    }

    private boolean confirmPurge(Map<String, List<PurgeCandidate>> eligible) {
        StringBuilder warning = new StringBuilder("This operation will delete:");
        for (Map.Entry<String, List<PurgeCandidate>> group : eligible.entrySet()) {
            warning.append("\n  ").append(group.getValue().size()).append(' ').append(group.getKey());
        }
        String types = String.join("/", eligible.keySet());
        warning.append("\nThese ").append(types).append(" have soft delete enabled allowing them to be recovered for a period")
            .append(" of time after deletion. During this period, their names may not be reused.")
            .append("\nYou can use argument --purge to skip this confirmation.");
        console.message(warning.toString());
        return console.confirm(
            "Would you like to permanently delete these " + types + " instead, allowing their names to be reused?", false);
    }

    private void redeployEmpty(DeploymentTarget target, DeploymentRecord deployment, String environmentName, OperationContext context) {
        Map<String, String> tags = new LinkedHashMap<>();
        tags.put(DeploymentTags.ENV_NAME, environmentName);
        tags.put(DeploymentTags.DEPLOY_REASON, DeploymentTags.REASON_DOWN);
        try {
            target.deploy(deployment.name(), emptyTemplate(target.scope()), Map.of(), tags, context);
        } catch (DeploymentFailedException | DeploymentTimeoutException ex) {
            log.warn("Failed to record the teardown of {}: {}", deployment.name(), ex.getMessage());
        }
    }

    static byte[] emptyTemplate(Scope scope) {
        String schema = scope instanceof Scope.Subscription ? SUBSCRIPTION_SCHEMA : GROUP_SCHEMA;
        String json = "{\"$schema\":\"" + schema + "\",\"contentVersion\":\"1.0.0.0\",\"resources\":[]}";
        return json.getBytes(StandardCharsets.UTF_8);
    }

    private static List<String> invalidatedKeys(Scope scope, DeploymentRecord deployment, Set<String> missingGroups) {
        List<String> keys = new ArrayList<>(deployment.outputs().keySet());
        if (scope instanceof Scope.ResourceGroup group && !missingGroups.contains(group.resourceGroup())) {
            keys.add(EnvironmentKeys.RESOURCE_GROUP);
        }
        return keys;
    }
}
