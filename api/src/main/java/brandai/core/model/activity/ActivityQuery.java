package brandai.core.model.activity;

import java.time.Instant;
import java.util.Optional;

/**
 * Filters and paging for an activity query.
 *
 * <p>{@code since} and {@code until} bound the window inclusively. Without a
 * {@code repo} the query spans the user's repositories.
 *
 * @param since   lower bound, optional
 * @param until   upper bound, optional
 * @param repo    repository as {@code owner/name}, optional
 * @param state   pull request or issue state (open, closed, all)
 * @param author  commit author filter, optional
 * @param page    1-based page number
 * @param perPage page size between 1 and 100
 */
public record ActivityQuery(
        Optional<Instant> since,
        Optional<Instant> until,
        Optional<String> repo,
        String state,
        Optional<String> author,
        int page,
        int perPage) {

    public static final String DEFAULT_STATE = "all";
    public static final int DEFAULT_PER_PAGE = 30;
    public static final int MAX_PER_PAGE = 100;

    public ActivityQuery {
        since = since == null ? Optional.empty() : since;
        until = until == null ? Optional.empty() : until;
        repo = repo == null ? Optional.empty() : repo.filter(r -> !r.isBlank());
        author = author == null ? Optional.empty() : author.filter(a -> !a.isBlank());
        if (state == null || state.isBlank()) {
            state = DEFAULT_STATE;
        }
        if (page < 1) {
            throw new IllegalArgumentException("page must be at least 1");
        }
        if (perPage < 1 || perPage > MAX_PER_PAGE) {
            throw new IllegalArgumentException("per_page must be between 1 and " + MAX_PER_PAGE);
        }
        if (since.isPresent() && until.isPresent() && since.get().isAfter(until.get())) {
            throw new IllegalArgumentException("since must not be after until");
        }
    }

    public static ActivityQuery defaults() {
        return builder().build();
    }

    /**
     * Copy with different paging, keeping all filters.
     */
    public ActivityQuery withPaging(int newPage, int newPerPage) {
        return new ActivityQuery(since, until, repo, state, author, newPage, newPerPage);
    }

    /**
     * Copy scoped to a single repository.
     */
    public ActivityQuery withRepo(String newRepo) {
        return new ActivityQuery(since, until, Optional.ofNullable(newRepo), state, author, page, perPage);
    }

    /**
     * Whether the instant falls inside the inclusive since/until window.
     */
    public boolean includes(Instant instant) {
        if (since.isPresent() && instant.isBefore(since.get())) {
            return false;
        }
        return until.isEmpty() || !instant.isAfter(until.get());
    }

    public boolean hasTimeWindow() {
        return since.isPresent() || until.isPresent();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Instant since;
        private Instant until;
        private String repo;
        private String state = DEFAULT_STATE;
        private String author;
        private int page = 1;
        private int perPage = DEFAULT_PER_PAGE;

        private Builder() {}

        public Builder since(Instant since) {
            this.since = since;
            return this;
        }

        public Builder until(Instant until) {
            this.until = until;
            return this;
        }

        public Builder repo(String repo) {
            this.repo = repo;
            return this;
        }

        public Builder state(String state) {
            this.state = state;
            return this;
        }

        public Builder author(String author) {
            this.author = author;
            return this;
        }

        public Builder page(int page) {
            this.page = page;
            return this;
        }

        public Builder perPage(int perPage) {
            this.perPage = perPage;
            return this;
        }

        public ActivityQuery build() {
            return new ActivityQuery(
                    Optional.ofNullable(since),
                    Optional.ofNullable(until),
                    Optional.ofNullable(repo),
                    state,
                    Optional.ofNullable(author),
                    page,
                    perPage);
        }
    }
}
