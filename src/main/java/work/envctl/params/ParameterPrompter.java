package work.envctl.params;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.envctl.console.Console;
import work.envctl.console.PromptOptions;
import work.envctl.controlplane.ControlPlane;
import work.envctl.controlplane.Location;
import work.envctl.controlplane.UsageQuota;
import work.envctl.template.GenerateConfig;
import work.envctl.template.MetadataKind;
import work.envctl.template.ParameterConfigurationException;
import work.envctl.template.ParameterDefinition;
import work.envctl.template.ParameterValue;

/**
 * Asks the user for one parameter value, choosing the prompt style from the parameter's type, allowed
 * values and extension metadata.
 */
public final class ParameterPrompter {
    private static final Logger log = LoggerFactory.getLogger(ParameterPrompter.class);

    static final String AUTO_GENERATE = "Auto generate";
    static final String MANUAL_INPUT = "Manual input";

    private final Console console;
    private final ControlPlane controlPlane;
    private final String subscriptionId;
    private final LocationContext locationContext;
    private final PasswordGenerator passwordGenerator;

    public ParameterPrompter(
        Console console,
        ControlPlane controlPlane,
        String subscriptionId,
        LocationContext locationContext,
        PasswordGenerator passwordGenerator
    ) {
        this.console = console;
        this.controlPlane = controlPlane;
        this.subscriptionId = subscriptionId;
        this.locationContext = locationContext;
        this.passwordGenerator = passwordGenerator;
    }

    /**
     * @param resolved lookup of values resolved so far, used to substitute metadata references
     */
    public ParameterValue prompt(ParameterDefinition definition, Function<String, String> resolved) {
        var metadata = definition.metadata();
        Optional<Object> metadataDefault = metadata.defaultValue(resolved);

        if (metadata.is(MetadataKind.LOCATION)) {
            return promptLocation(definition, metadataDefault, metadata.usageNames(resolved));
        }
        if (metadata.is(MetadataKind.GENERATE)) {
            return ParameterValue.of(passwordGenerator.generate(metadata.generate().orElse(GenerateConfig.defaults())));
        }
        if (metadata.is(MetadataKind.GENERATE_OR_MANUAL)) {
            return promptGenerateOrManual(definition, metadataDefault);
        }
        if (metadata.is(MetadataKind.RESOURCE_GROUP)) {
            return promptResourceGroup(definition);
        }
        if (definition.allowedValues().isPresent()) {
            return promptAllowed(definition, definition.allowedValues().get(), metadataDefault);
        }
        switch (definition.type()) {
            case BOOLEAN:
                return promptBoolean(definition, metadataDefault);
            case NUMBER:
                return promptFreeText(definition, metadataDefault, text -> PromptValidators.number(definition, text));
            case ARRAY:
                return promptJson(definition, PromptValidators::array);
            case OBJECT:
                return promptJson(definition, PromptValidators::object);
            case STRING:
            default:
                return promptFreeText(definition, metadataDefault, text -> PromptValidators.string(definition, text));
        }
    }

    private ParameterValue promptAllowed(ParameterDefinition definition, List<ParameterValue> allowed, Optional<Object> metadataDefault) {
        if (allowed.isEmpty()) {
            throw new ParameterConfigurationException("Parameter '" + definition.name() + "' has an empty allowed-values list");
        }
        List<String> options = new ArrayList<>(allowed.size());
        for (ParameterValue value : allowed) {
            options.add(value.display());
        }
        int defaultIndex = 0;
        if (metadataDefault.isPresent()) {
            defaultIndex = options.indexOf(String.valueOf(metadataDefault.get()));
            if (defaultIndex < 0) {
                throw new ParameterConfigurationException("Default value '" + metadataDefault.get()
                    + "' of parameter '" + definition.name() + "' is not one of its allowed values");
            }
        }
        int choice = console.select(message(definition), options, defaultIndex);
        return allowed.get(choice);
    }

    private ParameterValue promptBoolean(ParameterDefinition definition, Optional<Object> metadataDefault) {
        int defaultIndex = metadataDefault
            .map(value -> Boolean.parseBoolean(String.valueOf(value)) ? 1 : 0)
            .orElse(0);
        int choice = console.select(message(definition), List.of("False", "True"), defaultIndex);
        return ParameterValue.of(choice == 1);
    }

    private ParameterValue promptFreeText(
        ParameterDefinition definition,
        Optional<Object> metadataDefault,
        Function<String, PromptValidators.Outcome> validator
    ) {
        PromptOptions options = PromptOptions.of(message(definition))
            .withHelp(definition.description().orElse(null))
            .withDefault(metadataDefault.map(String::valueOf).orElse(null))
            .masked(definition.secure());
        return promptUntilValid(options, validator);
    }

    // JSON answers are typed in full: no default, never masked
    private ParameterValue promptJson(ParameterDefinition definition, Function<String, PromptValidators.Outcome> validator) {
        PromptOptions options = PromptOptions.of(message(definition))
            .withHelp(definition.description().orElse(null));
        return promptUntilValid(options, validator);
    }

    private ParameterValue promptUntilValid(PromptOptions options, Function<String, PromptValidators.Outcome> validator) {
        while (true) {
            String answer = console.prompt(options);
            PromptValidators.Outcome outcome = validator.apply(answer);
            if (outcome.valid()) {
                return outcome.value();
            }
            console.message(outcome.error());
        }
    }

    private ParameterValue promptGenerateOrManual(ParameterDefinition definition, Optional<Object> metadataDefault) {
        int choice = console.select(
            "How would you like to set '" + definition.name() + "'?",
            List.of(AUTO_GENERATE, MANUAL_INPUT),
            0
        );
        if (choice == 0) {
            GenerateConfig config = definition.metadata().generate().orElse(GenerateConfig.defaults());
            return ParameterValue.of(passwordGenerator.generate(config));
        }
        return promptFreeText(definition, metadataDefault, text -> PromptValidators.string(definition, text));
    }

    private ParameterValue promptResourceGroup(ParameterDefinition definition) {
        List<String> groups = controlPlane.listResourceGroups(subscriptionId);
        if (groups.isEmpty()) {
            throw new ParameterConfigurationException(
                "Parameter '" + definition.name() + "' needs an existing resource group but none were found");
        }
        List<String> sorted = new ArrayList<>(groups);
        sorted.sort(String.CASE_INSENSITIVE_ORDER);
        int choice = console.select(message(definition), sorted, 0);
        return ParameterValue.of(sorted.get(choice));
    }

    private ParameterValue promptLocation(ParameterDefinition definition, Optional<Object> metadataDefault, List<String> usageNames) {
        List<QuotaRequirement> requirements = new ArrayList<>();
        for (String usage : usageNames) {
            requirements.add(QuotaRequirement.parse(usage));
        }
        List<String> candidates = new ArrayList<>();
        List<String> labels = new ArrayList<>();
        for (Location location : controlPlane.listLocations(subscriptionId)) {
            if (!isAllowed(definition, location.name()) || !meetsQuota(location.name(), requirements)) {
                continue;
            }
            candidates.add(location.name());
            labels.add(location.displayName().equals(location.name())
                ? location.name()
                : location.displayName() + " (" + location.name() + ")");
        }

        Optional<String> shared = locationContext.location();
        if (shared.isPresent() && containsIgnoreCase(candidates, shared.get())) {
            log.debug("Using shared location {} for parameter {}", shared.get(), definition.name());
            return ParameterValue.of(shared.get());
        }
        if (candidates.isEmpty()) {
            throw new ParameterConfigurationException(
                "No location satisfies the allowed values and quota requirements of parameter '" + definition.name() + "'");
        }
        int defaultIndex = 0;
        String preferred = metadataDefault.map(String::valueOf).orElse(shared.orElse(null));
        if (preferred != null) {
            defaultIndex = Math.max(0, indexOfIgnoreCase(candidates, preferred));
        }
        int choice = console.select(message(definition), labels, defaultIndex);
        String location = candidates.get(choice);
        locationContext.fix(location);
        return ParameterValue.of(location);
    }

    private boolean meetsQuota(String location, List<QuotaRequirement> requirements) {
        if (requirements.isEmpty()) {
            return true;
        }
        List<UsageQuota> usages = controlPlane.listUsages(subscriptionId, location);
        for (QuotaRequirement requirement : requirements) {
            boolean satisfied = false;
            for (UsageQuota usage : usages) {
                if (usage.name().equalsIgnoreCase(requirement.usageName()) && usage.remaining() >= requirement.capacity()) {
                    satisfied = true;
                    break;
                }
            }
            if (!satisfied) {
                log.debug("Location {} lacks capacity {} for {}", location, requirement.capacity(), requirement.usageName());
                return false;
            }
        }
        return true;
    }

    private static boolean isAllowed(ParameterDefinition definition, String location) {
        if (definition.allowedValues().isEmpty()) {
            return true;
        }
        for (ParameterValue allowed : definition.allowedValues().get()) {
            if (allowed.display().equalsIgnoreCase(location)) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsIgnoreCase(List<String> values, String candidate) {
        return indexOfIgnoreCase(values, candidate) >= 0;
    }

    private static int indexOfIgnoreCase(List<String> values, String candidate) {
        for (int i = 0; i < values.size(); i++) {
            if (values.get(i).equalsIgnoreCase(candidate)) {
                return i;
            }
        }
        return -1;
    }

    private static String message(ParameterDefinition definition) {
        return "Enter a value for the '" + definition.name() + "' infrastructure parameter";
    }
}
