package dev.mtrx.newsroom.config.converter;

import dev.mtrx.newsroom.entity.IssueMetadata;
import io.r2dbc.postgresql.codec.Json;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;

/**
 * R2DBC Reading converter: PostgreSQL JSONB (Json) → IssueMetadata.
 */
@ReadingConverter
public class JsonToIssueMetadataConverter implements Converter<Json, IssueMetadata> {

    @Override
    public IssueMetadata convert(Json source) {
        return IssueMetadata.fromJson(source.asString());
    }
}
