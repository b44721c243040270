package work.envctl.deploy;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import work.envctl.console.Console;

/**
 * Finds the deployment that belongs to an environment.
 *
 * <p>Newest first: a deployment tagged with the environment name wins outright; otherwise one named exactly
 * like the environment; otherwise finished deployments whose name contains the hint. Several such candidates
 * are offered for selection when a console is available.</p>
 */
public final class DeploymentLocator {
    private static final DateTimeFormatter TIMESTAMP =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    private final Console console;

    /**
     * @param console used to disambiguate; {@code null} for non-interactive lookups
     */
    public DeploymentLocator(Console console) {
        this.console = console;
    }

    public DeploymentRecord locate(DeploymentTarget target, String environmentName, String hint) {
        List<DeploymentRecord> deployments = new ArrayList<>(target.listDeployments());
        deployments.sort(Comparator.comparing(DeploymentRecord::timestamp).reversed());

        DeploymentRecord exactName = null;
        for (DeploymentRecord deployment : deployments) {
            Optional<String> tagged = deployment.tag(DeploymentTags.ENV_NAME);
            if (tagged.isPresent() && tagged.get().equals(environmentName)) {
                return deployment;
            }
            if (exactName == null && deployment.name().equals(environmentName)) {
                exactName = deployment;
            }
        }
        if (exactName != null) {
            return exactName;
        }

        String filter = hint == null || hint.isBlank() ? environmentName : hint;
        List<DeploymentRecord> candidates = new ArrayList<>();
        for (DeploymentRecord deployment : deployments) {
            if (deployment.state().isTerminal() && deployment.name().contains(filter)) {
                candidates.add(deployment);
            }
        }
        if (candidates.isEmpty()) {
            throw new NoDeploymentsFoundException(environmentName);
        }
        if (candidates.size() == 1) {
            return candidates.get(0);
        }
        if (console == null) {
            throw new AmbiguousDeploymentException(environmentName, candidates.size());
        }
        List<String> options = new ArrayList<>(candidates.size());
        for (DeploymentRecord candidate : candidates) {
            options.add(candidate.name() + " (" + TIMESTAMP.format(candidate.timestamp()) + ")");
        }
        int choice = console.select("Select the deployment for environment '" + environmentName + "'", options, 0);
        return candidates.get(choice);
    }
}
