package work.envctl.deploy;

import java.util.Locale;

/**
 * Provisioning state reported by the control plane for a deployment.
 */
public enum ProvisioningState {
    ACCEPTED,
    CANCELED,
    CREATING,
    DELETED,
    DELETING,
    FAILED,
    NOT_SPECIFIED,
    READY,
    RUNNING,
    SUCCEEDED,
    UPDATING;

    /**
     * Only finished attempts are terminal; a cancelled deployment is neither.
     */
    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }

    public String displayName() {
        String lower = name().toLowerCase(Locale.ROOT);
        StringBuilder builder = new StringBuilder(lower.length());
        boolean upper = true;
        for (char ch : lower.toCharArray()) {
            if (ch == '_') {
                upper = true;
                continue;
            }
            builder.append(upper ? Character.toUpperCase(ch) : ch);
            upper = false;
        }
        return builder.toString();
    }

    public static ProvisioningState from(String value) {
        if (value == null || value.isBlank()) {
            return NOT_SPECIFIED;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ProvisioningState state : values()) {
            if (state.name().replace("_", "").toLowerCase(Locale.ROOT).equals(normalized)) {
                return state;
            }
        }
        return NOT_SPECIFIED;
    }
}
