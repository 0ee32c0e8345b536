package org.dandiarchive.archive.core.db;

import io.agroal.api.AgroalDataSource;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.dandiarchive.archive.core.dao.ArchiveColumnTypesPlugin;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.statement.Slf4JSqlLogger;
import org.jdbi.v3.jackson2.Jackson2Plugin;
import org.jdbi.v3.postgres.PostgresPlugin;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;
import org.slf4j.LoggerFactory;

/**
 * The archive's single {@link Jdbi}. Statements are logged at DEBUG under {@code org.dandiarchive.archive.sql}.
 */
@ApplicationScoped
public class JdbiProducer {

    static final String SQL_LOGGER = "org.dandiarchive.archive.sql";

    @ConfigProperty(name = "quarkus.datasource.db-kind", defaultValue = "postgresql")
    String dbKind;

    @Produces
    @Singleton
    public Jdbi jdbi(AgroalDataSource dataSource) {
        Jdbi jdbi = Jdbi.create(dataSource);
        if ("postgresql".equals(dbKind)) {
            jdbi.installPlugin(new PostgresPlugin());
        }
        return configure(jdbi).setSqlLogger(new Slf4JSqlLogger(LoggerFactory.getLogger(SQL_LOGGER)));
    }

    /** Plugins every archive database handle needs, whatever the backing engine. */
    public static Jdbi configure(Jdbi jdbi) {
        return jdbi.installPlugin(new SqlObjectPlugin())
                .installPlugin(new Jackson2Plugin())
                .installPlugin(new ArchiveColumnTypesPlugin());
    }
}
