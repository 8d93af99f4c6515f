package com.geico.poc.cargoquery.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.geico.poc.cargoquery.CargoQueryExecutor;
import com.geico.poc.cargoquery.compiler.CompilerOptions;
import com.geico.poc.cargoquery.compiler.QueryCompiler;
import com.geico.poc.cargoquery.schema.JdbcSchemaProvider;
import com.geico.poc.cargoquery.schema.SchemaProvider;
import com.geico.poc.cargoquery.search.BooleanModeSearchTermExtractor;
import com.geico.poc.cargoquery.search.SearchTermExtractor;
import com.geico.poc.cargoquery.storage.JdbcQueryEngine;
import com.geico.poc.cargoquery.storage.QueryEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Wires the compiler and its collaborators from {@link CargoQueryConfig}
 */
@Configuration
public class CargoQueryBeans {

    private static final Logger log = LoggerFactory.getLogger(CargoQueryBeans.class);

    @Bean
    public QueryEngine queryEngine(DataSource dataSource, CargoQueryConfig config) {
        log.info("Query engine: dialect={}, table prefix='{}'", config.getDialect(), config.getTablePrefix());
        return new JdbcQueryEngine(dataSource, config.getDialect().toSqlDialect(), config.getTablePrefix());
    }

    @Bean
    public SchemaProvider schemaProvider(DataSource dataSource, ObjectMapper objectMapper, CargoQueryConfig config) {
        return new JdbcSchemaProvider(dataSource, objectMapper, config.getSchemaTable());
    }

    @Bean
    public SearchTermExtractor searchTermExtractor() {
        return new BooleanModeSearchTermExtractor();
    }

    @Bean
    public QueryCompiler queryCompiler(SchemaProvider schemaProvider, QueryEngine queryEngine,
                                       SearchTermExtractor searchTermExtractor, CargoQueryConfig config) {
        CompilerOptions options = new CompilerOptions(config.getDefaultQueryLimit(), config.getMaxQueryLimit(),
                config.getAllowedSqlFunctions());
        log.info("Query limits: default={}, max={}; {} SQL functions allowed",
                options.getDefaultQueryLimit(), options.getMaxQueryLimit(), options.getAllowedSqlFunctions().size());
        return new QueryCompiler(schemaProvider, queryEngine, searchTermExtractor, options);
    }

    @Bean
    public CargoQueryExecutor cargoQueryExecutor(QueryEngine queryEngine) {
        return new CargoQueryExecutor(queryEngine);
    }
}
