package work.envctl.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.envctl.config.ConfigStoreException;
import work.envctl.config.EnvironmentKeys;
import work.envctl.config.EnvironmentStore;
import work.envctl.console.PromptOptions;
import work.envctl.controlplane.ControlPlane;
import work.envctl.controlplane.ControlPlaneException;
import work.envctl.controlplane.Location;
import work.envctl.deploy.DeployResult;
import work.envctl.deploy.Deployer;
import work.envctl.deploy.DeploymentLocator;
import work.envctl.deploy.DeploymentNames;
import work.envctl.deploy.DeploymentOutput;
import work.envctl.deploy.DeploymentRecord;
import work.envctl.deploy.DeploymentTags;
import work.envctl.deploy.DeploymentTarget;
import work.envctl.deploy.ReadAfterWriteRetry;
import work.envctl.deploy.Scope;
import work.envctl.deploy.WhatIfChange;
import work.envctl.destroy.DestroyOptions;
import work.envctl.destroy.DestroyResult;
import work.envctl.destroy.PurgeOrchestrator;
import work.envctl.destroy.PurgeOutcome;
import work.envctl.params.LocationContext;
import work.envctl.params.ParameterFile;
import work.envctl.params.ParameterPrompter;
import work.envctl.params.ParameterResolver;
import work.envctl.params.ResolvedParameters;
import work.envctl.project.ProjectManifest;
import work.envctl.runtime.OperationContext;
import work.envctl.state.DeploymentStateReconciler;
import work.envctl.state.SkipDecision;
import work.envctl.template.Template;
import work.envctl.template.TemplateCache;
import work.envctl.template.TargetScope;

/**
 * Public entry point: provisions, previews, shows and destroys the infrastructure of one environment. One
 * instance serves one invocation and owns its template, parameter and location caches.
 */
public final class ProvisionRunner {
    private static final Logger log = LoggerFactory.getLogger(ProvisionRunner.class);
    private static final ObjectMapper JSON = new ObjectMapper();

    private final ProjectManifest manifest;
    private final ProvisionServices services;
    private final String environmentName;
    private final TemplateCache templates;
    private final LocationContext locationContext;
    private final DeploymentStateReconciler reconciler;
    private ParameterResolver resolver;

    public ProvisionRunner(ProjectManifest manifest, ProvisionServices services, String environmentName) {
        this.manifest = Objects.requireNonNull(manifest, "manifest");
        this.services = Objects.requireNonNull(services, "services");
        this.environmentName = Objects.requireNonNull(environmentName, "environmentName");
        this.templates = new TemplateCache(services.compiler());
        EnvironmentStore environment = services.environment();
        this.locationContext = new LocationContext(
            environment.get(EnvironmentKeys.LOCATION).or(manifest::location).orElse(null));
        this.reconciler = new DeploymentStateReconciler(services.controlPlane());
    }

    public OperationResult provision(boolean ignoreDeploymentState, OperationContext context) {
        var started = Instant.now();
        var metadata = baseMetadata("provision");
        try {
            context.ensureNotCancelled();
            Template template = templates.get(manifest.infraModule());
            ResolvedParameters parameters = resolveParameters(template);
            DeploymentTarget target = target(template);
            SkipDecision decision = reconciler.evaluate(target, template, parameters, environmentName, ignoreDeploymentState);

            DeployResult result;
            if (decision.skip()) {
                DeploymentRecord prior = decision.prior().orElseThrow();
                services.console().message("Skipped: no changes since deployment " + prior.name());
                result = new DeployResult(prior, DeploymentTarget.mapOutputs(template, prior), true, SkipDecision.SKIPPED);
            } else {
                Map<String, String> tags = new LinkedHashMap<>();
                decision.parameterHash().ifPresent(hash -> tags.put(DeploymentTags.PARAMS_HASH, hash));
                Deployer deployer = new Deployer(services.clock(), services.console()::message);
                result = deployer.deploy(target, template, parameters, environmentName, tags, context);
            }

            writeEnvironment(target.scope(), result.outputs());
            metadata.put("deployment", result.deployment().name());
            metadata.put("reason", result.skipped() ? SkipDecision.SKIPPED : decision.reason());
            metadata.put("outputs", plainOutputs(result.outputs()));
            if (result.deployment().id() != null) {
                metadata.put("portalUrl", target.deploymentPortalUrl(result.deployment().id()));
            }
            return OperationResult.success(metadata, started);
        } catch (EnvctlException ex) {
            return failure(ex.status(), ex, metadata, started);
        } catch (ControlPlaneException ex) {
            return failure(OperationStatus.DEPLOYMENT_FAILED, ex, metadata, started);
        }
    }

    public OperationResult preview(OperationContext context) {
        var started = Instant.now();
        var metadata = baseMetadata("preview");
        try {
            context.ensureNotCancelled();
            Template template = templates.get(manifest.infraModule());
            ResolvedParameters parameters = resolveParameters(template);
            DeploymentTarget target = target(template);
            String deploymentName = DeploymentNames.generate(environmentName, services.clock());
            List<WhatIfChange> changes = target.deployPreview(deploymentName, template.artifact(), parameters.toPlainMap());
            List<Map<String, Object>> rendered = new ArrayList<>();
            for (WhatIfChange change : changes) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("change", change.changeType().name().toLowerCase(Locale.ROOT));
                entry.put("resourceType", change.resourceType());
                entry.put("resourceId", change.resourceId());
                rendered.add(entry);
            }
            metadata.put("changes", rendered);
            return OperationResult.success(metadata, started);
        } catch (EnvctlException ex) {
            return failure(ex.status(), ex, metadata, started);
        } catch (ControlPlaneException ex) {
            return failure(OperationStatus.DEPLOYMENT_FAILED, ex, metadata, started);
        }
    }

    public OperationResult show(OperationContext context) {
        var started = Instant.now();
        var metadata = baseMetadata("show");
        try {
            context.ensureNotCancelled();
            Template template = templates.get(manifest.infraModule());
            DeploymentTarget target = existingTarget(template);
            DeploymentRecord deployment = new DeploymentLocator(services.console())
                .locate(target, environmentName, environmentName);
            metadata.put("deployment", deployment.name());
            metadata.put("state", deployment.state().displayName());
            metadata.put("timestamp", deployment.timestamp().toString());
            metadata.put("outputs", plainOutputs(DeploymentTarget.mapOutputs(template, deployment)));
            if (deployment.id() != null) {
                metadata.put("portalUrl", target.deploymentPortalUrl(deployment.id()));
            }
            return OperationResult.success(metadata, started);
        } catch (EnvctlException ex) {
            return failure(ex.status(), ex, metadata, started);
        } catch (ControlPlaneException ex) {
            return failure(OperationStatus.DEPLOYMENT_FAILED, ex, metadata, started);
        }
    }

    public OperationResult destroy(DestroyOptions options, OperationContext context) {
        var started = Instant.now();
        var metadata = baseMetadata("destroy");
        try {
            context.ensureNotCancelled();
            Template template = templates.get(manifest.infraModule());
            DeploymentTarget target = existingTarget(template);
            PurgeOrchestrator orchestrator = new PurgeOrchestrator(services.controlPlane(), services.console());
            DestroyResult result = orchestrator.destroy(target, environmentName, options, context);

            removeInvalidatedKeys(result.invalidatedKeys());
            metadata.put("deployment", result.deployment().name());
            metadata.put("deletedResourceGroups", result.deletedResourceGroups());
            List<Map<String, Object>> purged = new ArrayList<>();
            for (PurgeOutcome outcome : result.purgeOutcomes()) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("resourceType", outcome.kind().resourceType());
                entry.put("name", outcome.resourceName());
                entry.put("status", outcome.status().name().toLowerCase(Locale.ROOT));
                purged.add(entry);
            }
            metadata.put("purge", purged);
            metadata.put("invalidatedKeys", result.invalidatedKeys());
            return OperationResult.success(metadata, started);
        } catch (EnvctlException ex) {
            return failure(ex.status(), ex, metadata, started);
        } catch (ControlPlaneException ex) {
            return failure(OperationStatus.DEPLOYMENT_FAILED, ex, metadata, started);
        }
    }

    private ResolvedParameters resolveParameters(Template template) {
        if (resolver == null) {
            ParameterPrompter prompter = new ParameterPrompter(
                services.console(),
                services.controlPlane(),
                subscriptionId(),
                locationContext,
                services.passwordGenerator()
            );
            resolver = new ParameterResolver(services.config(), prompter);
        }
        EnvironmentStore environment = services.environment();
        ParameterFile file = manifest.parameterFile()
            .map(path -> ParameterFile.load(path, name -> environment.get(name).orElseGet(() -> System.getenv(name))))
            .orElse(ParameterFile.empty());
        return resolver.resolve(template, file);
    }

    /**
     * Scope for a new deployment; prompts for whatever the environment does not pin down yet.
     */
    private DeploymentTarget target(Template template) {
        String subscriptionId = subscriptionId();
        Scope scope;
        if (template.targetScope() == TargetScope.SUBSCRIPTION) {
            scope = new Scope.Subscription(subscriptionId, location());
        } else {
            scope = new Scope.ResourceGroup(subscriptionId, resourceGroup(subscriptionId, true));
        }
        return newTarget(scope);
    }

    /**
     * Scope of an environment that was provisioned before; never prompts.
     */
    private DeploymentTarget existingTarget(Template template) {
        String subscriptionId = subscriptionId();
        if (template.targetScope() == TargetScope.SUBSCRIPTION) {
            String location = locationContext.location()
                .orElseThrow(() -> configurationError(EnvironmentKeys.LOCATION + " is not set for environment " + environmentName));
            return newTarget(new Scope.Subscription(subscriptionId, location));
        }
        return newTarget(new Scope.ResourceGroup(subscriptionId, resourceGroup(subscriptionId, false)));
    }

    private DeploymentTarget newTarget(Scope scope) {
        return new DeploymentTarget(services.controlPlane(), scope, new ReadAfterWriteRetry(services.retryPolicy()), null);
    }

    private String subscriptionId() {
        return services.environment().get(EnvironmentKeys.SUBSCRIPTION_ID)
            .or(manifest::subscriptionId)
            .orElseThrow(() -> configurationError("No subscription configured: set " + EnvironmentKeys.SUBSCRIPTION_ID
                + " or environment.subscription in " + ProjectManifest.FILE_NAME));
    }

    private String location() {
        if (locationContext.isFixed()) {
            return locationContext.location().orElseThrow();
        }
        List<Location> locations = services.controlPlane().listLocations(subscriptionId());
        if (locations.isEmpty()) {
            throw configurationError("No locations are available");
        }
        List<String> labels = new ArrayList<>(locations.size());
        for (Location location : locations) {
            labels.add(location.displayName() + " (" + location.name() + ")");
        }
        int choice = services.console().select("Select a location to store deployment metadata", labels, 0);
        locationContext.fix(locations.get(choice).name());
        return locations.get(choice).name();
    }

    private String resourceGroup(String subscriptionId, boolean prompt) {
        Optional<String> configured = services.environment().get(EnvironmentKeys.RESOURCE_GROUP).or(manifest::resourceGroup);
        if (configured.isPresent()) {
            return configured.get();
        }
        if (!prompt) {
            throw configurationError(EnvironmentKeys.RESOURCE_GROUP + " is not set for environment " + environmentName);
        }
        String answer = services.console().prompt(
            PromptOptions.of("Enter the resource group to deploy into").withDefault("rg-" + environmentName));
        if (answer == null || answer.isBlank()) {
            throw configurationError("A resource group is required for resource-group scoped templates");
        }
        String resourceGroup = answer.trim();
        ensureResourceGroup(subscriptionId, resourceGroup);
        return resourceGroup;
    }

    /**
     * Creates a group named at the prompt when it does not exist yet. A configured group is left for the
     * deployment to reject.
     */
    private void ensureResourceGroup(String subscriptionId, String resourceGroup) {
        ControlPlane controlPlane = services.controlPlane();
        if (controlPlane.listResourceGroups(subscriptionId).contains(resourceGroup)) {
            return;
        }
        String location = location();
        services.console().message("Creating resource group " + resourceGroup + " in " + location);
        controlPlane.createResourceGroup(subscriptionId, resourceGroup, location);
        log.info("Created resource group {} in {}", resourceGroup, location);
    }

    private void writeEnvironment(Scope scope, Map<String, DeploymentOutput> outputs) {
        EnvironmentStore environment = services.environment();
        environment.set(EnvironmentKeys.ENV_NAME, environmentName);
        environment.set(EnvironmentKeys.SUBSCRIPTION_ID, scope.subscriptionId());
        if (scope instanceof Scope.Subscription subscription) {
            environment.set(EnvironmentKeys.LOCATION, subscription.location());
        } else {
            environment.set(EnvironmentKeys.RESOURCE_GROUP, ((Scope.ResourceGroup) scope).resourceGroup());
            locationContext.location().ifPresent(location -> environment.set(EnvironmentKeys.LOCATION, location));
        }
        outputs.forEach((name, output) -> environment.set(name, envValue(output.value())));
        saveEnvironment();
    }

    private void removeInvalidatedKeys(List<String> keys) {
        EnvironmentStore environment = services.environment();
        List<String> existing = new ArrayList<>(environment.values().keySet());
        for (String key : keys) {
            for (String candidate : existing) {
                if (candidate.equalsIgnoreCase(key)) {
                    environment.unset(candidate);
                }
            }
        }
        saveEnvironment();
    }

    private void saveEnvironment() {
        try {
            services.environment().save();
        } catch (ConfigStoreException ex) {
            log.warn("Failed to save environment {}: {}", environmentName, ex.getMessage());
        }
    }

    private static String envValue(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof String str) {
            return str;
        }
        try {
            return JSON.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            return String.valueOf(value);
        }
    }

    private static Map<String, Object> plainOutputs(Map<String, DeploymentOutput> outputs) {
        Map<String, Object> plain = new LinkedHashMap<>();
        outputs.forEach((name, output) -> plain.put(name, output.value()));
        return plain;
    }

    private LinkedHashMap<String, Object> baseMetadata(String operation) {
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("operation", operation);
        metadata.put("environment", environmentName);
        return metadata;
    }

    private OperationResult failure(OperationStatus status, RuntimeException ex, Map<String, Object> metadata, Instant started) {
        log.debug("{} failed", metadata.get("operation"), ex);
        return OperationResult.failure(status, ex.getMessage(), metadata, started);
    }

    private static EnvctlException configurationError(String message) {
        return new EnvctlException(OperationStatus.CONFIGURATION_ERROR, message);
    }
}
