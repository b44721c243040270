package work.envctl.controlplane;

import java.util.List;
import java.util.Map;
import work.envctl.deploy.DeploymentOperation;
import work.envctl.deploy.DeploymentRecord;
import work.envctl.deploy.Scope;
import work.envctl.deploy.WhatIfChange;

/**
 * Cloud control-plane client. Deployment calls take the {@link Scope} they act on; a lookup of something
 * that does not exist raises {@link ControlPlaneException} with {@link ControlPlaneException#isNotFound()} set.
 */
public interface ControlPlane {

    /**
     * Issues a deployment and blocks until the control plane reports it finished. The returned record is
     * whatever the submission call reported and may lag behind the stored deployment.
     */
    DeploymentRecord deploy(
        Scope scope,
        String deploymentName,
        byte[] template,
        Map<String, Object> parameters,
        Map<String, String> tags
    );

    DeploymentRecord getDeployment(Scope scope, String deploymentName);

    List<DeploymentRecord> listDeployments(Scope scope);

    List<WhatIfChange> whatIf(Scope scope, String deploymentName, byte[] template, Map<String, Object> parameters);

    List<DeploymentOperation> listOperations(Scope scope, String deploymentName);

    String calculateTemplateHash(String subscriptionId, byte[] template);

    List<Location> listLocations(String subscriptionId);

    List<UsageQuota> listUsages(String subscriptionId, String location);

    List<String> listResourceGroups(String subscriptionId);

    /**
     * Creates an empty resource group, or leaves an existing one untouched.
     */
    void createResourceGroup(String subscriptionId, String resourceGroup, String location);

    List<ResourceSummary> listResources(String subscriptionId, String resourceGroup);

    ResourceProperties getResourceProperties(String subscriptionId, ResourceSummary resource);

    void deleteResourceGroup(String subscriptionId, String resourceGroup);

    /**
     * Permanently removes a soft-deleted resource so its name can be reused.
     */
    void purge(String subscriptionId, ResourceSummary resource, ResourceProperties properties);

    String portalUrl(String resourceId);
}
