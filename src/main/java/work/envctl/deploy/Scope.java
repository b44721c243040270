package work.envctl.deploy;

import java.util.Objects;
import work.envctl.template.TargetScope;

/**
 * Where a deployment lives. Subscription deployments carry the location their metadata is stored in;
 * resource-group deployments carry the group they deploy into.
 */
public sealed interface Scope {

    String subscriptionId();

    TargetScope kind();

    record Subscription(String subscriptionId, String location) implements Scope {
        public Subscription {
            Objects.requireNonNull(subscriptionId, "subscriptionId");
            Objects.requireNonNull(location, "location");
        }

        @Override
        public TargetScope kind() {
            return TargetScope.SUBSCRIPTION;
        }
    }

    record ResourceGroup(String subscriptionId, String resourceGroup) implements Scope {
        public ResourceGroup {
            Objects.requireNonNull(subscriptionId, "subscriptionId");
            Objects.requireNonNull(resourceGroup, "resourceGroup");
        }

        @Override
        public TargetScope kind() {
            return TargetScope.RESOURCE_GROUP;
        }
    }
}
