package ch.so.arp.rag.qa;

import java.util.UUID;

import javax.sql.DataSource;

import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

final class H2Databases {

    private H2Databases() {
    }

    /**
     * A private in-memory database that lives until the JVM exits.
     */
    static DataSource freshDataSource() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource();
        dataSource.setDriverClassName("org.h2.Driver");
        dataSource.setUrl("jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1");
        dataSource.setUsername("sa");
        dataSource.setPassword("");
        return dataSource;
    }

    static JdbcClient freshJdbcClient() {
        return JdbcClient.create(freshDataSource());
    }
}
