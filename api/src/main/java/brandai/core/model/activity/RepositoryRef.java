package brandai.core.model.activity;

/**
 * Repository name and last update time as listed in an activity summary.
 */
public record RepositoryRef(String name, String updatedAt) {}
