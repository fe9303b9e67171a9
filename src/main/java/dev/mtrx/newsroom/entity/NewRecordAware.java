package dev.mtrx.newsroom.entity;

/**
 * Marker interface for entities that track their persistence state
 * via a {@code newRecord} flag. All entities using Snowflake IDs
 * with {@link org.springframework.data.domain.Persistable} implement
 * this so {@link dev.mtrx.newsroom.config.PersistableEntityCallback}
 * can flip the flag after a row is loaded.
 */
public interface NewRecordAware {
    void setNewRecord(boolean newRecord);
}
