package brandai.core.exception;

/**
 * Thrown when an account insert collides with an existing GitHub id.
 *
 * <p>Happens when two logins for the same GitHub user race past the
 * find-then-insert check.
 */
public class DuplicateAccountException extends BrandAiException {

    private final String field;

    public DuplicateAccountException(String field, Object value) {
        super(ErrorKind.DUPLICATE_ACCOUNT, "User already exists: duplicate on field %s (%s)".formatted(field, value));
        this.field = field;
    }

    public DuplicateAccountException(String field, Object value, Throwable cause) {
        super(
                ErrorKind.DUPLICATE_ACCOUNT,
                "User already exists: duplicate on field %s (%s)".formatted(field, value),
                cause);
        this.field = field;
    }

    public String field() {
        return field;
    }
}
