package dev.mtrx.newsroom.repository;

import dev.mtrx.newsroom.dto.TranslationJobFilter;
import dev.mtrx.newsroom.entity.TranslationJob;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Filtered job listing. Only the filters that are set end up in the WHERE clause.
 */
@Repository
public class TranslationJobQueryRepository {

    private final R2dbcEntityTemplate r2dbcTemplate;

    public TranslationJobQueryRepository(R2dbcEntityTemplate r2dbcTemplate) {
        this.r2dbcTemplate = r2dbcTemplate;
    }

    public Flux<TranslationJob> findByFilter(TranslationJobFilter filter, int limit, int offset) {
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder("SELECT * FROM translation_jobs");
        appendWhere(sql, params, filter);
        sql.append(" ORDER BY created_at DESC, id DESC LIMIT $").append(params.size() + 1)
                .append(" OFFSET $").append(params.size() + 2);
        params.add(limit);
        params.add(offset);

        return bindAll(r2dbcTemplate.getDatabaseClient().sql(sql.toString()), params)
                .map((row, metadata) -> {
                    TranslationJob job = r2dbcTemplate.getConverter().read(TranslationJob.class, row, metadata);
                    job.setNewRecord(false);
                    return job;
                })
                .all();
    }

    public Mono<Long> countByFilter(TranslationJobFilter filter) {
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder("SELECT COUNT(*) FROM translation_jobs");
        appendWhere(sql, params, filter);

        return bindAll(r2dbcTemplate.getDatabaseClient().sql(sql.toString()), params)
                .map((row, metadata) -> row.get(0, Long.class))
                .one()
                .defaultIfEmpty(0L);
    }

    private static void appendWhere(StringBuilder sql, List<Object> params, TranslationJobFilter filter) {
        List<String> conditions = new ArrayList<>();
        if (filter.status() != null) {
            params.add(filter.status().name());
            conditions.add("status = $" + params.size());
        }
        if (filter.scopeType() != null) {
            params.add(filter.scopeType().name());
            conditions.add("scope_type = $" + params.size());
        }
        if (filter.targetLanguage() != null) {
            params.add(filter.targetLanguage());
            conditions.add("target_language = $" + params.size());
        }
        if (!conditions.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", conditions));
        }
    }

    private static DatabaseClient.GenericExecuteSpec bindAll(DatabaseClient.GenericExecuteSpec spec, List<Object> params) {
        for (int i = 0; i < params.size(); i++) {
            spec = spec.bind("$" + (i + 1), params.get(i));
        }
        return spec;
    }
}
