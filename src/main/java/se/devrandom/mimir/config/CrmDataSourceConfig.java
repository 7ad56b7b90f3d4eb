/*
 * Mimir - CRM Backup and Restore
 * Copyright (C) 2025 Johan Karlsteen
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package se.devrandom.mimir.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Connection pool for the live CRM database. Spring Batch keeps its job metadata
 * in the same database.
 */
@Configuration
public class CrmDataSourceConfig {
    private static final Logger log = LoggerFactory.getLogger(CrmDataSourceConfig.class);

    @Bean(destroyMethod = "close")
    public HikariDataSource crmDataSource(
            @Value("${crm.datasource.url}") String jdbcUrl,
            @Value("${crm.datasource.username:}") String username,
            @Value("${crm.datasource.password:}") String password,
            @Value("${crm.datasource.maximum-pool-size:5}") int maximumPoolSize) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbcUrl);
        config.setUsername(username);
        config.setPassword(password);
        config.setMaximumPoolSize(maximumPoolSize);
        config.setMinimumIdle(1);
        config.setConnectionTimeout(30000);
        config.setPoolName("mimir-crm");
        log.info("CRM connection pool initialized for {} (max {} connections)", jdbcUrl, maximumPoolSize);
        return new HikariDataSource(config);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
