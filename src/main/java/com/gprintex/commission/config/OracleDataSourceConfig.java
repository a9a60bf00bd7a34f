package com.gprintex.commission.config;

import com.zaxxer.hikari.HikariDataSource;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import javax.sql.DataSource;
import java.util.Properties;

/**
 * Oracle DataSource with Wallet support, activated by oracle.wallet.enabled=true.
 * The commission tables must already exist in the target schema.
 */
@Configuration
@ConditionalOnProperty(name = "oracle.wallet.enabled", havingValue = "true")
public class OracleDataSourceConfig {

    @Value("${spring.datasource.username}")
    private String username;

    @Value("${spring.datasource.password}")
    private String password;

    @Bean
    public HikariDataSource dataSource(OracleWalletProperties walletProps) {
        var dataSource = new HikariDataSource();
        dataSource.setJdbcUrl(String.format(
            "jdbc:oracle:thin:@%s?TNS_ADMIN=%s",
            walletProps.tnsName(),
            walletProps.walletLocation()
        ));
        dataSource.setDriverClassName("oracle.jdbc.OracleDriver");
        dataSource.setUsername(username);
        dataSource.setPassword(password);
        dataSource.setMaximumPoolSize(walletProps.maxPoolSize());
        dataSource.setPoolName("commission-oracle");

        var props = new Properties();
        props.setProperty("oracle.net.wallet_location",
            "(SOURCE=(METHOD=FILE)(METHOD_DATA=(DIRECTORY=" + walletProps.walletLocation() + ")))");
        props.setProperty("oracle.net.tns_admin", walletProps.walletLocation());
        props.setProperty("oracle.jdbc.timezoneAsRegion", "false");
        dataSource.setDataSourceProperties(props);

        return dataSource;
    }

    @Bean
    public JdbcTemplate jdbcTemplate(DataSource dataSource) {
        return new JdbcTemplate(dataSource);
    }

    @Bean
    public NamedParameterJdbcTemplate namedParameterJdbcTemplate(DataSource dataSource) {
        return new NamedParameterJdbcTemplate(dataSource);
    }
}
