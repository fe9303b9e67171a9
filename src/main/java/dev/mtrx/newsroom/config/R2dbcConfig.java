package dev.mtrx.newsroom.config;

import dev.mtrx.newsroom.config.converter.IssueMetadataToJsonConverter;
import dev.mtrx.newsroom.config.converter.JsonToIssueMetadataConverter;
import io.r2dbc.spi.ConnectionFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.r2dbc.convert.R2dbcCustomConversions;
import org.springframework.data.r2dbc.dialect.DialectResolver;
import org.springframework.data.r2dbc.repository.config.EnableR2dbcRepositories;
import org.springframework.r2dbc.connection.init.ConnectionFactoryInitializer;
import org.springframework.r2dbc.connection.init.ResourceDatabasePopulator;

import java.util.List;

@Configuration(proxyBeanMethods = false)
@EnableR2dbcRepositories(basePackages = "dev.mtrx.newsroom.repository")
public class R2dbcConfig {

    @Value("${app.schema.file:schema.sql}")
    private String schemaFile;

    /**
     * Apply {@code schema.sql} on startup when {@code app.schema.init=true}.
     * Production schemas are expected to be applied externally.
     */
    @Bean
    @ConditionalOnProperty(name = "app.schema.init", havingValue = "true", matchIfMissing = false)
    public ConnectionFactoryInitializer initializer(ConnectionFactory connectionFactory) {
        ConnectionFactoryInitializer initializer = new ConnectionFactoryInitializer();
        initializer.setConnectionFactory(connectionFactory);
        initializer.setDatabasePopulator(new ResourceDatabasePopulator(new ClassPathResource(schemaFile)));
        return initializer;
    }

    @Bean
    public R2dbcCustomConversions r2dbcCustomConversions(ConnectionFactory connectionFactory) {
        var dialect = DialectResolver.getDialect(connectionFactory);
        return R2dbcCustomConversions.of(dialect, List.of(
                new JsonToIssueMetadataConverter(),
                new IssueMetadataToJsonConverter()
        ));
    }
}
