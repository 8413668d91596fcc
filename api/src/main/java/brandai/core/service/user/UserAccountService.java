package brandai.core.service.user;

import java.time.Clock;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import brandai.core.model.github.GitHubProfile;
import brandai.core.model.user.ProviderCredentials;
import brandai.core.model.user.UserAccount;

/**
 * Creates and updates local accounts for GitHub users.
 */
@ApplicationScoped
public class UserAccountService {

    private static final Logger LOG = Logger.getLogger(UserAccountService.class);

    private final UserAccountStorageProviderRegistry storageRegistry;
    private final Clock clock;

    @Inject
    public UserAccountService(UserAccountStorageProviderRegistry storageRegistry, Clock clock) {
        this.storageRegistry = storageRegistry;
        this.clock = clock;
    }

    /**
     * Create the account for an unseen GitHub user, or refresh the existing one.
     *
     * <p>On update the profile fields and credentials are replaced; the local id,
     * GitHub id, preferences and creation time are kept.
     *
     * @param profile     the GitHub profile
     * @param credentials the encrypted credentials
     * @return the stored account
     */
    public Uni<UserAccount> upsertFromGitHub(GitHubProfile profile, ProviderCredentials credentials) {
        final var repository = storageRegistry.getRepository();
        return repository.findByGithubId(profile.id()).flatMap(existing -> {
            final var now = clock.instant();
            if (existing.isPresent()) {
                final var updated =
                        existing.get().withProfile(profile, now).withCredentials(credentials, now);
                return repository
                        .update(updated)
                        .invoke(account -> LOG.infof(
                                "Updated user %s for GitHub user %s", account.id(), account.username()));
            }
            return repository
                    .insert(UserAccount.create(profile, credentials, now))
                    .invoke(account ->
                            LOG.infof("Created user %s for GitHub user %s", account.id(), account.username()));
        });
    }

    /**
     * Replace the stored credentials of an account.
     *
     * @param account     the account
     * @param credentials the new encrypted credentials
     * @return the stored account
     */
    public Uni<UserAccount> replaceCredentials(UserAccount account, ProviderCredentials credentials) {
        return storageRegistry.getRepository().update(account.withCredentials(credentials, clock.instant()));
    }

    /**
     * Find an account by local id.
     *
     * @param id local id
     * @return the account, or empty if none
     */
    public Uni<Optional<UserAccount>> findById(String id) {
        return storageRegistry.getRepository().findById(id);
    }
}
