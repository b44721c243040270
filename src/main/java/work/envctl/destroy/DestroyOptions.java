package work.envctl.destroy;

/**
 * @param force delete without the resource-count confirmation
 * @param purge purge soft-deleted resources without asking
 */
public record DestroyOptions(boolean force, boolean purge) {
}
