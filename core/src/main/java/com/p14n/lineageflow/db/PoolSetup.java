package com.p14n.lineageflow.db;

import com.p14n.lineageflow.data.LineageFlowConfig;
import com.zaxxer.hikari.HikariDataSource;

import javax.sql.DataSource;

public class PoolSetup {
    /**
     * Creates and configures a connection pool using HikariCP. The pool is
     * sized for the consumer, the notification relay, the depth reporter and
     * ad hoc admin queries.
     *
     * @param cfg Configuration containing database connection details
     * @return Configured DataSource
     */
    public static DataSource createPool(LineageFlowConfig cfg) {
        HikariDataSource ds = new HikariDataSource();
        ds.setJdbcUrl(cfg.jdbcUrl());
        ds.setUsername(cfg.dbUser());
        ds.setPassword(cfg.dbPassword());
        ds.setMaximumPoolSize(6);
        ds.setPoolName("lineageflow");
        return ds;
    }

}
