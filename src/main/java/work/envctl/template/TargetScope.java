package work.envctl.template;

/**
 * Scope a compiled template declares it deploys into.
 */
public enum TargetScope {
    SUBSCRIPTION,
    RESOURCE_GROUP
}
