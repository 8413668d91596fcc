package brandai.adapter.out.storage.mongodb;

import java.util.Optional;
import java.util.function.Supplier;

import com.mongodb.ErrorCategory;
import com.mongodb.MongoException;
import com.mongodb.MongoWriteException;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.jboss.logging.Logger;

import brandai.core.exception.DuplicateAccountException;
import brandai.core.model.user.UserAccount;
import brandai.core.port.out.UserAccountRepository;

import static brandai.adapter.out.storage.mongodb.UserAccountDocumentMapper.GITHUB_ID;
import static brandai.adapter.out.storage.mongodb.UserAccountDocumentMapper.ID;

/**
 * MongoDB implementation of UserAccountRepository.
 *
 * <p>Uses the synchronous driver; every call runs on the Mutiny worker pool so
 * the event loop never blocks. Uniqueness of the GitHub id is enforced by a
 * unique index.
 */
public class MongoUserAccountRepository implements UserAccountRepository {

    private static final Logger LOG = Logger.getLogger(MongoUserAccountRepository.class);

    private final MongoCollection<Document> collection;

    public MongoUserAccountRepository(MongoCollection<Document> collection) {
        this.collection = collection;
    }

    /**
     * Create the unique index on {@code github_id} if it does not exist.
     */
    public void ensureIndexes() {
        collection.createIndex(Indexes.ascending(GITHUB_ID), new IndexOptions().unique(true));
        LOG.debug("Ensured unique index on users.github_id");
    }

    @Override
    public Uni<Optional<UserAccount>> findByGithubId(long githubId) {
        return blocking(() -> Optional.ofNullable(collection.find(Filters.eq(GITHUB_ID, githubId)).first())
                .map(UserAccountDocumentMapper::fromDocument));
    }

    @Override
    public Uni<Optional<UserAccount>> findById(String id) {
        if (id == null || !ObjectId.isValid(id)) {
            return Uni.createFrom().item(Optional.empty());
        }
        return blocking(() -> Optional.ofNullable(collection.find(Filters.eq(ID, new ObjectId(id))).first())
                .map(UserAccountDocumentMapper::fromDocument));
    }

    @Override
    public Uni<UserAccount> insert(UserAccount account) {
        return blocking(() -> {
            final Document doc = UserAccountDocumentMapper.toDocument(account.withId(null));
            try {
                collection.insertOne(doc);
            } catch (MongoWriteException e) {
                if (e.getError().getCategory() == ErrorCategory.DUPLICATE_KEY) {
                    LOG.warnf("Duplicate GitHub id %d on insert", account.githubId());
                    throw new DuplicateAccountException(GITHUB_ID, account.githubId(), e);
                }
                throw e;
            }
            return account.withId(doc.getObjectId(ID).toHexString());
        });
    }

    @Override
    public Uni<UserAccount> update(UserAccount account) {
        if (account.id() == null || !ObjectId.isValid(account.id())) {
            return Uni.createFrom().failure(new IllegalStateException("User account not found: " + account.id()));
        }
        return blocking(() -> {
            final var result = collection.replaceOne(
                    Filters.eq(ID, new ObjectId(account.id())), UserAccountDocumentMapper.toDocument(account));
            if (result.getMatchedCount() == 0) {
                throw new IllegalStateException("User account not found: " + account.id());
            }
            return account;
        });
    }

    private <T> Uni<T> blocking(Supplier<T> operation) {
        return Uni.createFrom()
                .item(operation)
                .runSubscriptionOn(Infrastructure.getDefaultWorkerPool())
                .onFailure(MongoException.class)
                .invoke(e -> LOG.errorf(e, "MongoDB operation on users failed"));
    }
}
