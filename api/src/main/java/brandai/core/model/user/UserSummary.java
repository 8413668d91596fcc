package brandai.core.model.user;

/**
 * Public view of a user account returned alongside a session token.
 */
public record UserSummary(String id, long githubId, String username, String email) {

    public static UserSummary from(UserAccount account) {
        return new UserSummary(account.id(), account.githubId(), account.username(), account.email());
    }
}
