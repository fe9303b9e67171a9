package dev.mtrx.newsroom.config.converter;

import dev.mtrx.newsroom.entity.IssueMetadata;
import io.r2dbc.postgresql.codec.Json;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.WritingConverter;

/**
 * R2DBC Writing converter: IssueMetadata → PostgreSQL JSONB (Json).
 */
@WritingConverter
public class IssueMetadataToJsonConverter implements Converter<IssueMetadata, Json> {

    @Override
    public Json convert(IssueMetadata source) {
        return Json.of(source.toJson());
    }
}
