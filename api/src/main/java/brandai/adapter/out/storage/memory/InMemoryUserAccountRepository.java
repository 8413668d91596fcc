package brandai.adapter.out.storage.memory;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import brandai.core.exception.DuplicateAccountException;
import brandai.core.model.user.UserAccount;
import brandai.core.port.out.UserAccountRepository;

/**
 * In-memory implementation of UserAccountRepository.
 *
 * <p>Intended for development and testing only. Accounts are lost on restart
 * and not shared across instances.
 */
public class InMemoryUserAccountRepository implements UserAccountRepository {

    private static final Logger LOG = Logger.getLogger(InMemoryUserAccountRepository.class);

    private final ConcurrentMap<String, UserAccount> accounts = new ConcurrentHashMap<>();
    private final ConcurrentMap<Long, String> githubIndex = new ConcurrentHashMap<>();

    @Override
    public Uni<Optional<UserAccount>> findByGithubId(long githubId) {
        return Uni.createFrom()
                .item(() -> Optional.ofNullable(githubIndex.get(githubId)).map(accounts::get));
    }

    @Override
    public Uni<Optional<UserAccount>> findById(String id) {
        return Uni.createFrom()
                .item(() -> id == null ? Optional.<UserAccount>empty() : Optional.ofNullable(accounts.get(id)));
    }

    @Override
    public Uni<UserAccount> insert(UserAccount account) {
        return Uni.createFrom().item(() -> {
            final String id = UUID.randomUUID().toString();
            final String existing = githubIndex.putIfAbsent(account.githubId(), id);
            if (existing != null) {
                throw new DuplicateAccountException("github_id", account.githubId());
            }
            final UserAccount stored = account.withId(id);
            accounts.put(id, stored);
            LOG.debugf("User account created: %s for GitHub user %d", id, account.githubId());
            return stored;
        });
    }

    @Override
    public Uni<UserAccount> update(UserAccount account) {
        return Uni.createFrom().item(() -> {
            final UserAccount previous = account.id() == null ? null : accounts.get(account.id());
            if (previous == null) {
                throw new IllegalStateException("User account not found: " + account.id());
            }
            if (previous.githubId() != account.githubId()) {
                throw new IllegalStateException("GitHub id of user account " + account.id() + " cannot change");
            }
            accounts.put(account.id(), account);
            return account;
        });
    }

    /**
     * Get the current number of stored accounts (for monitoring).
     *
     * @return Number of accounts
     */
    public int getAccountCount() {
        return accounts.size();
    }
}
