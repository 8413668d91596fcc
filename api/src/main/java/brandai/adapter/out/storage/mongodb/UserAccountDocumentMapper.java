package brandai.adapter.out.storage.mongodb;

import java.time.Instant;
import java.util.Date;

import org.bson.Document;
import org.bson.types.ObjectId;

import brandai.core.model.user.Cadence;
import brandai.core.model.user.GitHubUsage;
import brandai.core.model.user.NotificationPreferences;
import brandai.core.model.user.Tone;
import brandai.core.model.user.UserAccount;

/**
 * Maps user accounts to documents of the {@code users} collection.
 */
final class UserAccountDocumentMapper {

    static final String ID = "_id";
    static final String GITHUB_ID = "github_id";

    private UserAccountDocumentMapper() {
        // Utility class
    }

    static Document toDocument(UserAccount account) {
        final var doc = new Document();
        if (account.id() != null) {
            doc.put(ID, new ObjectId(account.id()));
        }
        doc.put(GITHUB_ID, account.githubId());
        doc.put("username", account.username());
        doc.put("email", account.email());
        doc.put("name", account.name());
        doc.put("avatar_url", account.avatarUrl());
        doc.put("public_repos", account.usage().publicRepos());
        doc.put("private_repos", account.usage().privateRepos());
        doc.put("followers", account.usage().followers());
        doc.put("following", account.usage().following());
        doc.put("cadence", account.preferences().cadence().value());
        doc.put("tone", account.preferences().tone().value());
        doc.put("emojis", account.preferences().emojis());
        doc.put("hashtags", account.preferences().hashtags());
        doc.put("github_access_token", account.encryptedAccessToken());
        doc.put("github_token_expires_at", toDate(account.tokenExpiresAt()));
        doc.put("github_refresh_token", account.encryptedRefreshToken());
        doc.put("created_at", toDate(account.createdAt()));
        doc.put("updated_at", toDate(account.updatedAt()));
        return doc;
    }

    static UserAccount fromDocument(Document doc) {
        final var defaults = NotificationPreferences.defaults();
        final String cadence = doc.getString("cadence");
        final String tone = doc.getString("tone");
        final Boolean emojis = doc.getBoolean("emojis");
        final Boolean hashtags = doc.getBoolean("hashtags");

        return UserAccount.builder(((Number) doc.get(GITHUB_ID)).longValue())
                .id(doc.getObjectId(ID).toHexString())
                .username(doc.getString("username"))
                .email(doc.getString("email"))
                .name(doc.getString("name"))
                .avatarUrl(doc.getString("avatar_url"))
                .usage(new GitHubUsage(
                        doc.getInteger("public_repos"),
                        doc.getInteger("private_repos"),
                        doc.getInteger("followers"),
                        doc.getInteger("following")))
                .preferences(new NotificationPreferences(
                        cadence != null ? Cadence.fromValue(cadence) : defaults.cadence(),
                        tone != null ? Tone.fromValue(tone) : defaults.tone(),
                        emojis != null ? emojis : defaults.emojis(),
                        hashtags != null ? hashtags : defaults.hashtags()))
                .encryptedAccessToken(doc.getString("github_access_token"))
                .tokenExpiresAt(toInstant(doc.getDate("github_token_expires_at")))
                .encryptedRefreshToken(doc.getString("github_refresh_token"))
                .createdAt(toInstant(doc.getDate("created_at")))
                .updatedAt(toInstant(doc.getDate("updated_at")))
                .build();
    }

    private static Date toDate(Instant instant) {
        return instant != null ? Date.from(instant) : null;
    }

    private static Instant toInstant(Date date) {
        return date != null ? date.toInstant() : null;
    }
}
