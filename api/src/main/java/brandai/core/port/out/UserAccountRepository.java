package brandai.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import brandai.core.model.user.UserAccount;

/**
 * Outbound port for user account storage.
 *
 * <p>Implementations must enforce uniqueness of the GitHub id. Insert and
 * update together form the upsert used by the sign-in flows.
 */
public interface UserAccountRepository {

    /**
     * Find the account linked to a GitHub user.
     *
     * @param githubId GitHub user id
     * @return the account, or empty if none
     */
    Uni<Optional<UserAccount>> findByGithubId(long githubId);

    /**
     * Find an account by its local id.
     *
     * @param id local id
     * @return the account, or empty if none
     */
    Uni<Optional<UserAccount>> findById(String id);

    /**
     * Store a new account and assign its local id.
     *
     * @param account account without an id
     * @return the stored account carrying its id
     * @throws brandai.core.exception.DuplicateAccountException if the GitHub id is already linked
     */
    Uni<UserAccount> insert(UserAccount account);

    /**
     * Replace a stored account.
     *
     * @param account account carrying its id
     * @return the stored account
     * @throws IllegalStateException if no account has that id
     */
    Uni<UserAccount> update(UserAccount account);
}
