package dev.mtrx.newsroom.service;

import dev.mtrx.newsroom.util.SnowflakeId;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Hands out Snowflake IDs for new articles, issues, sections, assignments and jobs.
 *
 * <pre>
 * NewsletterIssue issue = NewsletterIssue.builder()
 *     .id(idService.nextId())
 *     .issueNumber(number)
 *     .build();
 * </pre>
 */
@Service
@RequiredArgsConstructor
public class IdService {

    private final SnowflakeId snowflakeId;

    public long nextId() {
        return snowflakeId.nextId();
    }

    /**
     * Creation time (UTC) embedded in an ID.
     */
    public LocalDateTime getCreatedAt(long id) {
        return LocalDateTime.ofInstant(SnowflakeId.extractInstant(id), ZoneOffset.UTC);
    }
}
