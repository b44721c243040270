package work.envctl.support;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import work.envctl.controlplane.ControlPlane;
import work.envctl.controlplane.ControlPlaneException;
import work.envctl.controlplane.Location;
import work.envctl.controlplane.ResourceProperties;
import work.envctl.controlplane.ResourceSummary;
import work.envctl.controlplane.UsageQuota;
import work.envctl.deploy.DeploymentOperation;
import work.envctl.deploy.DeploymentOutput;
import work.envctl.deploy.DeploymentRecord;
import work.envctl.deploy.ProvisioningState;
import work.envctl.deploy.Scope;
import work.envctl.deploy.WhatIfChange;

/**
 * Scriptable in-memory control plane that records every mutating call.
 */
public final class FakeControlPlane implements ControlPlane {
    public record DeployCall(Scope scope, String name, byte[] template, Map<String, Object> parameters, Map<String, String> tags) {}

    public final List<DeploymentRecord> deployments = new ArrayList<>();
    public final List<DeployCall> deployCalls = new ArrayList<>();
    public final AtomicInteger getDeploymentCalls = new AtomicInteger();
    public final AtomicInteger listDeploymentCalls = new AtomicInteger();
    public int notFoundReads;
    public ControlPlaneException getFailure;
    public ControlPlaneException deployFailure;
    public ControlPlaneException listFailure;
    public String templateHash = "template-hash";
    public Map<String, DeploymentOutput> nextOutputs = new LinkedHashMap<>();
    public ProvisioningState nextState = ProvisioningState.SUCCEEDED;

    public final List<Location> locations = new ArrayList<>();
    public final Map<String, List<UsageQuota>> usages = new HashMap<>();
    public final List<String> resourceGroups = new ArrayList<>();
    public final List<String> createdGroups = new ArrayList<>();

    public final Map<String, List<ResourceSummary>> resources = new LinkedHashMap<>();
    public final Map<String, ResourceProperties> properties = new HashMap<>();
    public final Set<String> missingGroups = new HashSet<>();
    public final Map<String, ControlPlaneException> listResourceFailures = new HashMap<>();
    public final List<String> deletedGroups = new ArrayList<>();
    public final Map<String, ControlPlaneException> deleteFailures = new HashMap<>();
    public final List<String> purged = new ArrayList<>();
    public final Map<String, ControlPlaneException> purgeFailures = new HashMap<>();
    public final List<DeploymentOperation> operations = new ArrayList<>();
    public final AtomicInteger listOperationsCalls = new AtomicInteger();
    public volatile ControlPlaneException operationsFailure;

    private Instant clock = Instant.parse("2024-01-01T00:00:00Z");

    @Override
    public synchronized DeploymentRecord deploy(
        Scope scope,
        String deploymentName,
        byte[] template,
        Map<String, Object> parameters,
        Map<String, String> tags
    ) {
        deployCalls.add(new DeployCall(scope, deploymentName, template, parameters, tags));
        if (deployFailure != null) {
            throw deployFailure;
        }
        clock = clock.plusSeconds(60);
        DeploymentRecord record = new DeploymentRecord(
            "/subscriptions/" + scope.subscriptionId() + "/providers/Microsoft.Resources/deployments/" + deploymentName,
            deploymentName,
            "eastus",
            nextState,
            clock,
            tags,
            templateHash,
            nextOutputs,
            List.of(),
            List.of()
        );
        deployments.removeIf(existing -> existing.name().equals(deploymentName));
        deployments.add(record);
        return record;
    }

    @Override
    public synchronized DeploymentRecord getDeployment(Scope scope, String deploymentName) {
        getDeploymentCalls.incrementAndGet();
        if (notFoundReads > 0) {
            notFoundReads--;
            throw ControlPlaneException.notFound("Deployment not found: " + deploymentName);
        }
        if (getFailure != null) {
            throw getFailure;
        }
        for (DeploymentRecord record : deployments) {
            if (record.name().equals(deploymentName)) {
                return record;
            }
        }
        throw ControlPlaneException.notFound("Deployment not found: " + deploymentName);
    }

    @Override
    public synchronized List<DeploymentRecord> listDeployments(Scope scope) {
        listDeploymentCalls.incrementAndGet();
        if (listFailure != null) {
            throw listFailure;
        }
        return new ArrayList<>(deployments);
    }

    @Override
    public List<WhatIfChange> whatIf(Scope scope, String deploymentName, byte[] template, Map<String, Object> parameters) {
        return List.of(new WhatIfChange(WhatIfChange.ChangeType.CREATE, "/subscriptions/sub/resourceGroups/rg", "Microsoft.Resources/resourceGroups"));
    }

    @Override
    public synchronized List<DeploymentOperation> listOperations(Scope scope, String deploymentName) {
        listOperationsCalls.incrementAndGet();
        if (operationsFailure != null) {
            throw operationsFailure;
        }
        return new ArrayList<>(operations);
    }

    @Override
    public String calculateTemplateHash(String subscriptionId, byte[] template) {
        return templateHash;
    }

    @Override
    public List<Location> listLocations(String subscriptionId) {
        return locations;
    }

    @Override
    public List<UsageQuota> listUsages(String subscriptionId, String location) {
        return usages.getOrDefault(location, List.of());
    }

    @Override
    public List<String> listResourceGroups(String subscriptionId) {
        return resourceGroups;
    }

    @Override
    public void createResourceGroup(String subscriptionId, String resourceGroup, String location) {
        if (!resourceGroups.contains(resourceGroup)) {
            resourceGroups.add(resourceGroup);
            createdGroups.add(resourceGroup);
        }
    }

    @Override
    public List<ResourceSummary> listResources(String subscriptionId, String resourceGroup) {
        if (listResourceFailures.containsKey(resourceGroup)) {
            throw listResourceFailures.get(resourceGroup);
        }
        if (missingGroups.contains(resourceGroup)) {
            throw ControlPlaneException.notFound("Resource group not found: " + resourceGroup);
        }
        return resources.getOrDefault(resourceGroup, List.of());
    }

    @Override
    public ResourceProperties getResourceProperties(String subscriptionId, ResourceSummary resource) {
        ResourceProperties found = properties.get(resource.id());
        if (found == null) {
            throw ControlPlaneException.notFound("Resource not found: " + resource.id());
        }
        return found;
    }

    @Override
    public void deleteResourceGroup(String subscriptionId, String resourceGroup) {
        if (deleteFailures.containsKey(resourceGroup)) {
            throw deleteFailures.get(resourceGroup);
        }
        deletedGroups.add(resourceGroup);
    }

    @Override
    public void purge(String subscriptionId, ResourceSummary resource, ResourceProperties properties) {
        if (purgeFailures.containsKey(resource.name())) {
            throw purgeFailures.get(resource.name());
        }
        purged.add(resource.name());
    }

    @Override
    public String portalUrl(String resourceId) {
        return "https://portal.test/#@/resource" + resourceId;
    }

    public static DeploymentRecord record(String name, ProvisioningState state, Instant timestamp, Map<String, String> tags) {
        return new DeploymentRecord("/deployments/" + name, name, "eastus", state, timestamp, tags, "template-hash",
            Map.of(), List.of(), List.of());
    }

    public void addResource(String group, String type, String name, ResourceProperties resourceProperties) {
        String id = "/subscriptions/sub/resourceGroups/" + group + "/providers/" + type + "/" + name;
        resources.computeIfAbsent(group, key -> new ArrayList<>()).add(new ResourceSummary(id, name, type, "eastus"));
        if (resourceProperties != null) {
            properties.put(id, resourceProperties);
        }
    }
}
