package work.envctl.destroy;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class ResourceIdsTest {
    @Test
    void extractsGroupFromResourceId() {
        assertEquals(Optional.of("rg-app"),
            ResourceIds.resourceGroup("/subscriptions/sub/resourceGroups/rg-app/providers/Microsoft.Web/sites/web"));
        assertEquals(Optional.of("rg-app"), ResourceIds.resourceGroup("/subscriptions/sub/resourcegroups/rg-app"));
    }

    @Test
    void subscriptionLevelIdsHaveNoGroup() {
        assertEquals(Optional.empty(), ResourceIds.resourceGroup("/subscriptions/sub/providers/Microsoft.Resources/deployments/x"));
        assertEquals(Optional.empty(), ResourceIds.resourceGroup(null));
    }
}
