package dev.mtrx.newsroom.repository;

import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

/**
 * Named monotonic counters. {@link #increment} takes the row lock for the rest of the
 * surrounding transaction, so concurrent allocations serialise and stay gap-free on commit.
 */
@Repository
public class IssueCounterRepository {

    public static final String NEWSLETTER_ISSUE = "newsletter_issue";

    private final DatabaseClient databaseClient;

    public IssueCounterRepository(R2dbcEntityTemplate r2dbcTemplate) {
        this.databaseClient = r2dbcTemplate.getDatabaseClient();
    }

    public Mono<Long> increment(String name) {
        return databaseClient
                .sql("UPDATE counters SET last_value = last_value + 1 WHERE name = :name RETURNING last_value")
                .bind("name", name)
                .map(row -> row.get("last_value", Long.class))
                .one();
    }

    public Mono<Long> current(String name) {
        return databaseClient
                .sql("SELECT last_value FROM counters WHERE name = :name")
                .bind("name", name)
                .map(row -> row.get("last_value", Long.class))
                .one()
                .defaultIfEmpty(0L);
    }
}
