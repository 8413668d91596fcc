package brandai.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration mapping for GitHub activity aggregation.
 *
 * <p>Configuration prefix: {@code brandai.activity}
 */
@ConfigMapping(prefix = "brandai.activity")
public interface ActivityConfig {

    /**
     * Page cap for {@code fetchAllPages}.
     *
     * @return Max pages (default: 10)
     */
    @WithName("max-pages")
    @WithDefault("10")
    int maxPages();

    /**
     * Number of repositories considered when a query spans all repositories.
     *
     * @return Max repositories (default: 100)
     */
    @WithName("max-repositories")
    @WithDefault("100")
    int maxRepositories();

    /**
     * Number of per-repository requests in flight during a fan-out.
     *
     * @return Concurrency (default: 5)
     */
    @WithName("fan-out-concurrency")
    @WithDefault("5")
    int fanOutConcurrency();
}
