package work.envctl.controlplane;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.envctl.deploy.DeploymentOperation;
import work.envctl.deploy.DeploymentOutput;
import work.envctl.deploy.DeploymentRecord;
import work.envctl.deploy.ProvisioningState;
import work.envctl.deploy.Scope;
import work.envctl.deploy.WhatIfChange;

/**
 * Control plane simulated in a JSON file. Deploying a template records the deployment and materializes its
 * {@code resources} into resource groups, which must exist or be declared earlier in the same template; deleting
 * a group soft-deletes the resource types that support it.
 * Outputs may reference parameters with {@code [parameters('name')]}.
 */
public final class LocalControlPlane implements ControlPlane {
    private static final Logger log = LoggerFactory.getLogger(LocalControlPlane.class);
    private static final ObjectMapper JSON = new ObjectMapper()
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    private static final Pattern PARAMETER_REF = Pattern.compile("^\\[parameters\\('([^']+)'\\)\\]$");
    private static final String RESOURCE_GROUPS_TYPE = "Microsoft.Resources/resourceGroups";
    private static final List<String> SOFT_DELETE_TYPES = List.of(
        "microsoft.keyvault/vaults",
        "microsoft.keyvault/managedhsms",
        "microsoft.appconfiguration/configurationstores",
        "microsoft.apimanagement/service",
        "microsoft.cognitiveservices/accounts"
    );
    private static final List<Location> LOCATIONS = List.of(
        new Location("eastus", "East US"),
        new Location("eastus2", "East US 2"),
        new Location("westus2", "West US 2"),
        new Location("westeurope", "West Europe"),
        new Location("northeurope", "North Europe"),
        new Location("swedencentral", "Sweden Central")
    );

    private final Path stateFile;
    private final Clock clock;

    public LocalControlPlane(Path stateDirectory, Clock clock) {
        this.stateFile = Objects.requireNonNull(stateDirectory, "stateDirectory").resolve("state.json");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public synchronized DeploymentRecord deploy(
        Scope scope,
        String deploymentName,
        byte[] template,
        Map<String, Object> parameters,
        Map<String, String> tags
    ) {
        JsonNode root = readTemplate(template);
        State state = load();
        String subscriptionId = scope.subscriptionId();
        List<String> outputResources = new ArrayList<>();
        List<StoredOperation> operations = new ArrayList<>();
        String defaultGroup = scope instanceof Scope.ResourceGroup group ? group.resourceGroup() : null;
        if (defaultGroup != null && !state.groups.containsKey(key(subscriptionId, defaultGroup))) {
            throw ControlPlaneException.notFound("Resource group not found: " + defaultGroup);
        }

        int index = 0;
        for (JsonNode resource : root.path("resources")) {
            String type = resource.path("type").asText("");
            String name = resource.path("name").asText("");
            if (type.isEmpty() || name.isEmpty()) {
                continue;
            }
            index++;
            if (RESOURCE_GROUPS_TYPE.equalsIgnoreCase(type)) {
                state.groups.computeIfAbsent(key(subscriptionId, name), k -> new StoredGroup(subscriptionId, name));
                outputResources.add(groupId(subscriptionId, name));
            } else {
                String groupName = resource.path("resourceGroup").asText(defaultGroup);
                if (groupName == null || groupName.isBlank()) {
                    throw new ControlPlaneException("Resource " + name + " has no resource group");
                }
                StoredGroup group = state.groups.get(key(subscriptionId, groupName));
                if (group == null) {
                    throw ControlPlaneException.notFound("Resource group not found: " + groupName);
                }
                StoredResource stored = new StoredResource();
                stored.id = groupId(subscriptionId, groupName) + "/providers/" + type + "/" + name;
                stored.name = name;
                stored.type = type;
                stored.location = resource.path("location").asText("");
                stored.kind = resource.path("kind").asText("");
                JsonNode properties = resource.path("properties");
                stored.softDelete = properties.path("enableSoftDelete").asBoolean(isSoftDeleteType(type));
                stored.purgeProtection = properties.path("enablePurgeProtection").asBoolean(false);
                group.resources.removeIf(existing -> existing.id.equalsIgnoreCase(stored.id));
                group.resources.add(stored);
                outputResources.add(stored.id);
            }
            StoredOperation operation = new StoredOperation();
            operation.operationId = deploymentName + "-" + index;
            operation.resourceType = type;
            operation.resourceName = name;
            operations.add(operation);
        }

        StoredDeployment deployment = new StoredDeployment();
        deployment.scope = scopeKey(scope);
        deployment.id = deploymentId(scope, deploymentName);
        deployment.name = deploymentName;
        deployment.location = scope instanceof Scope.Subscription subscription ? subscription.location() : "";
        deployment.state = ProvisioningState.SUCCEEDED.displayName();
        deployment.timestamp = clock.instant().toString();
        deployment.tags = new LinkedHashMap<>(tags);
        deployment.templateHash = sha256(template);
        deployment.outputs = evaluateOutputs(root, parameters);
        deployment.outputResourceIds = outputResources;
        deployment.operations = operations;
        state.deployments.removeIf(existing -> existing.scope.equals(deployment.scope) && existing.name.equals(deploymentName));
        state.deployments.add(deployment);
        save(state);
        log.debug("Recorded local deployment {} with {} resources", deploymentName, operations.size());
        return toRecord(deployment);
    }

    @Override
    public synchronized DeploymentRecord getDeployment(Scope scope, String deploymentName) {
        String scopeKey = scopeKey(scope);
        for (StoredDeployment deployment : load().deployments) {
            if (deployment.scope.equals(scopeKey) && deployment.name.equals(deploymentName)) {
                return toRecord(deployment);
            }
        }
        throw ControlPlaneException.notFound("Deployment not found: " + deploymentName);
    }

    @Override
    public synchronized List<DeploymentRecord> listDeployments(Scope scope) {
        String scopeKey = scopeKey(scope);
        List<DeploymentRecord> records = new ArrayList<>();
        for (StoredDeployment deployment : load().deployments) {
            if (deployment.scope.equals(scopeKey)) {
                records.add(toRecord(deployment));
            }
        }
        return records;
    }

    @Override
    public synchronized List<WhatIfChange> whatIf(Scope scope, String deploymentName, byte[] template, Map<String, Object> parameters) {
        JsonNode root = readTemplate(template);
        State state = load();
        String subscriptionId = scope.subscriptionId();
        String defaultGroup = scope instanceof Scope.ResourceGroup group ? group.resourceGroup() : null;
        List<WhatIfChange> changes = new ArrayList<>();
        for (JsonNode resource : root.path("resources")) {
            String type = resource.path("type").asText("");
            String name = resource.path("name").asText("");
            if (type.isEmpty() || name.isEmpty()) {
                continue;
            }
            String id;
            boolean exists;
            if (RESOURCE_GROUPS_TYPE.equalsIgnoreCase(type)) {
                id = groupId(subscriptionId, name);
                exists = state.groups.containsKey(key(subscriptionId, name));
            } else {
                String groupName = resource.path("resourceGroup").asText(defaultGroup == null ? "" : defaultGroup);
                id = groupId(subscriptionId, groupName) + "/providers/" + type + "/" + name;
                StoredGroup group = state.groups.get(key(subscriptionId, groupName));
                exists = group != null && group.resources.stream().anyMatch(existing -> existing.id.equalsIgnoreCase(id));
            }
            changes.add(new WhatIfChange(exists ? WhatIfChange.ChangeType.NO_CHANGE : WhatIfChange.ChangeType.CREATE, id, type));
        }
        return changes;
    }

    @Override
    public synchronized List<DeploymentOperation> listOperations(Scope scope, String deploymentName) {
        String scopeKey = scopeKey(scope);
        for (StoredDeployment deployment : load().deployments) {
            if (deployment.scope.equals(scopeKey) && deployment.name.equals(deploymentName)) {
                List<DeploymentOperation> operations = new ArrayList<>();
                Instant timestamp = Instant.parse(deployment.timestamp);
                for (StoredOperation operation : deployment.operations) {
                    operations.add(new DeploymentOperation(operation.operationId, operation.resourceType,
                        operation.resourceName, ProvisioningState.SUCCEEDED, timestamp));
                }
                return operations;
            }
        }
        throw ControlPlaneException.notFound("Deployment not found: " + deploymentName);
    }

    @Override
    public String calculateTemplateHash(String subscriptionId, byte[] template) {
        return sha256(template);
    }

    @Override
    public List<Location> listLocations(String subscriptionId) {
        return LOCATIONS;
    }

    @Override
    public synchronized List<UsageQuota> listUsages(String subscriptionId, String location) {
        List<UsageQuota> usages = new ArrayList<>();
        load().usages.getOrDefault(location.toLowerCase(Locale.ROOT), Map.of())
            .forEach((name, limit) -> usages.add(new UsageQuota(name, 0, limit)));
        return usages;
    }

    @Override
    public synchronized List<String> listResourceGroups(String subscriptionId) {
        List<String> names = new ArrayList<>();
        for (StoredGroup group : load().groups.values()) {
            if (group.subscriptionId.equals(subscriptionId)) {
                names.add(group.name);
            }
        }
        return names;
    }

    @Override
    public synchronized void createResourceGroup(String subscriptionId, String resourceGroup, String location) {
        State state = load();
        if (state.groups.containsKey(key(subscriptionId, resourceGroup))) {
            return;
        }
        state.groups.put(key(subscriptionId, resourceGroup), new StoredGroup(subscriptionId, resourceGroup));
        save(state);
        log.debug("Created local resource group {} in {}", resourceGroup, location);
    }

    @Override
    public synchronized List<ResourceSummary> listResources(String subscriptionId, String resourceGroup) {
        StoredGroup group = load().groups.get(key(subscriptionId, resourceGroup));
        if (group == null) {
            throw ControlPlaneException.notFound("Resource group not found: " + resourceGroup);
        }
        List<ResourceSummary> resources = new ArrayList<>();
        for (StoredResource resource : group.resources) {
            resources.add(new ResourceSummary(resource.id, resource.name, resource.type, resource.location));
        }
        return resources;
    }

    @Override
    public synchronized ResourceProperties getResourceProperties(String subscriptionId, ResourceSummary resource) {
        for (StoredGroup group : load().groups.values()) {
            for (StoredResource stored : group.resources) {
                if (stored.id.equalsIgnoreCase(resource.id())) {
                    return new ResourceProperties(stored.softDelete, stored.purgeProtection, stored.location, stored.kind);
                }
            }
        }
        throw ControlPlaneException.notFound("Resource not found: " + resource.id());
    }

    @Override
    public synchronized void deleteResourceGroup(String subscriptionId, String resourceGroup) {
        State state = load();
        StoredGroup group = state.groups.remove(key(subscriptionId, resourceGroup));
        if (group == null) {
            throw ControlPlaneException.notFound("Resource group not found: " + resourceGroup);
        }
        for (StoredResource resource : group.resources) {
            if (resource.softDelete) {
                state.softDeleted.add(resource);
            }
        }
        save(state);
    }

    @Override
    public synchronized void purge(String subscriptionId, ResourceSummary resource, ResourceProperties properties) {
        State state = load();
        boolean removed = state.softDeleted.removeIf(deleted -> deleted.id.equalsIgnoreCase(resource.id()));
        if (!removed) {
            throw ControlPlaneException.notFound("No soft-deleted resource: " + resource.id());
        }
        save(state);
    }

    @Override
    public String portalUrl(String resourceId) {
        return "https://portal.azure.com/#@/resource" + resourceId;
    }

    /**
     * Soft-deleted resources still holding their names.
     */
    public synchronized List<ResourceSummary> listSoftDeleted() {
        List<ResourceSummary> deleted = new ArrayList<>();
        for (StoredResource resource : load().softDeleted) {
            deleted.add(new ResourceSummary(resource.id, resource.name, resource.type, resource.location));
        }
        return deleted;
    }

    /**
     * Declares the quota limit of a usage in a location; current consumption is always zero locally.
     */
    public synchronized void setUsageLimit(String location, String usageName, long limit) {
        State state = load();
        state.usages.computeIfAbsent(location.toLowerCase(Locale.ROOT), k -> new LinkedHashMap<>()).put(usageName, limit);
        save(state);
    }

    private static Map<String, StoredOutput> evaluateOutputs(JsonNode template, Map<String, Object> parameters) {
        Map<String, StoredOutput> evaluated = new LinkedHashMap<>();
        var fields = template.path("outputs").fields();
        while (fields.hasNext()) {
            var field = fields.next();
            StoredOutput output = new StoredOutput();
            output.type = field.getValue().path("type").asText("string");
            JsonNode value = field.getValue().get("value");
            Object plain = value == null ? null : JSON.convertValue(value, Object.class);
            if (plain instanceof String str) {
                Matcher matcher = PARAMETER_REF.matcher(str.trim());
                if (matcher.matches()) {
                    plain = parameterValue(template, parameters, matcher.group(1));
                }
            }
            output.value = plain;
            evaluated.put(field.getKey(), output);
        }
        return evaluated;
    }

    // unsupplied parameters fall back to the template default
    private static Object parameterValue(JsonNode template, Map<String, Object> parameters, String name) {
        if (parameters.containsKey(name)) {
            return parameters.get(name);
        }
        JsonNode fallback = template.path("parameters").path(name).get("defaultValue");
        return fallback == null ? null : JSON.convertValue(fallback, Object.class);
    }

    private static DeploymentRecord toRecord(StoredDeployment deployment) {
        Map<String, DeploymentOutput> outputs = new LinkedHashMap<>();
        deployment.outputs.forEach((name, output) -> outputs.put(name, new DeploymentOutput(output.type, output.value)));
        return new DeploymentRecord(
            deployment.id,
            deployment.name,
            deployment.location,
            ProvisioningState.from(deployment.state),
            Instant.parse(deployment.timestamp),
            deployment.tags,
            deployment.templateHash,
            outputs,
            deployment.outputResourceIds,
            List.of()
        );
    }

    private static JsonNode readTemplate(byte[] template) {
        try {
            JsonNode root = JSON.readTree(template);
            if (root == null || !root.isObject()) {
                throw new ControlPlaneException("Template must be a JSON object");
            }
            return root;
        } catch (IOException ex) {
            throw new ControlPlaneException("Template is not valid JSON", ex);
        }
    }

    private State load() {
        if (!Files.isRegularFile(stateFile)) {
            return new State();
        }
        try {
            return JSON.readValue(stateFile.toFile(), State.class);
        } catch (IOException ex) {
            throw new ControlPlaneException("Failed to read local control-plane state: " + stateFile, ex);
        }
    }

    private void save(State state) {
        try {
            Files.createDirectories(stateFile.getParent());
            JSON.writerWithDefaultPrettyPrinter().writeValue(stateFile.toFile(), state);
        } catch (IOException ex) {
            throw new ControlPlaneException("Failed to write local control-plane state: " + stateFile, ex);
        }
    }

    private static boolean isSoftDeleteType(String type) {
        return SOFT_DELETE_TYPES.contains(type.toLowerCase(Locale.ROOT));
    }

    private static String key(String subscriptionId, String group) {
        return subscriptionId + "/" + group.toLowerCase(Locale.ROOT);
    }

    private static String groupId(String subscriptionId, String group) {
        return "/subscriptions/" + subscriptionId + "/resourceGroups/" + group;
    }

    private static String scopeKey(Scope scope) {
        if (scope instanceof Scope.ResourceGroup group) {
            return key(group.subscriptionId(), group.resourceGroup());
        }
        return scope.subscriptionId();
    }

    private static String deploymentId(Scope scope, String deploymentName) {
        String prefix = scope instanceof Scope.ResourceGroup group
            ? groupId(group.subscriptionId(), group.resourceGroup())
            : "/subscriptions/" + scope.subscriptionId();
        return prefix + "/providers/Microsoft.Resources/deployments/" + deploymentName;
    }

    private static String sha256(byte[] content) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(content));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 is not available", ex);
        }
    }

    static final class State {
        public List<StoredDeployment> deployments = new ArrayList<>();
        public Map<String, StoredGroup> groups = new LinkedHashMap<>();
        public List<StoredResource> softDeleted = new ArrayList<>();
        public Map<String, Map<String, Long>> usages = new LinkedHashMap<>();
    }

    static final class StoredDeployment {
        public String scope;
        public String id;
        public String name;
        public String location;
        public String state;
        public String timestamp;
        public Map<String, String> tags = new LinkedHashMap<>();
        public String templateHash;
        public Map<String, StoredOutput> outputs = new LinkedHashMap<>();
        public List<String> outputResourceIds = new ArrayList<>();
        public List<StoredOperation> operations = new ArrayList<>();
    }

    static final class StoredOutput {
        public String type;
        public Object value;
    }

    static final class StoredOperation {
        public String operationId;
        public String resourceType;
        public String resourceName;
    }

    static final class StoredGroup {
        public String subscriptionId;
        public String name;
        public List<StoredResource> resources = new ArrayList<>();

        StoredGroup() {}

        StoredGroup(String subscriptionId, String name) {
            this.subscriptionId = subscriptionId;
            this.name = name;
        }
    }

    static final class StoredResource {
        public String id;
        public String name;
        public String type;
        public String location;
        public String kind;
        public boolean softDelete;
        public boolean purgeProtection;
    }
}
