package dev.mtrx.newsroom.config;

import dev.mtrx.newsroom.entity.NewRecordAware;
import org.reactivestreams.Publisher;
import org.springframework.data.r2dbc.mapping.event.AfterConvertCallback;
import org.springframework.data.relational.core.sql.SqlIdentifier;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Marks every loaded pipeline entity as existing. Articles, issues and jobs carry
 * pre-assigned Snowflake IDs, so without this a {@code save()} of a loaded row would INSERT.
 */
@Component
public class PersistableEntityCallback implements AfterConvertCallback<Object> {

    @Override
    public Publisher<Object> onAfterConvert(Object entity, SqlIdentifier table) {
        if (entity instanceof NewRecordAware aware) {
            aware.setNewRecord(false);
        }
        return Mono.just(entity);
    }
}
