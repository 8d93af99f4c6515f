package com.geico.poc.cargoquery;

import com.geico.poc.cargoquery.compiler.CargoQueryException;
import com.geico.poc.cargoquery.compiler.CompileResult;
import com.geico.poc.cargoquery.compiler.CompiledQuery;
import com.geico.poc.cargoquery.compiler.QueryCompiler;
import com.geico.poc.cargoquery.compiler.QueryError;
import com.geico.poc.cargoquery.compiler.QuerySpec;
import com.geico.poc.cargoquery.dto.CompileResponse;
import com.geico.poc.cargoquery.dto.QueryResponse;
import com.geico.poc.cargoquery.storage.JoinClause;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class QueryService {

    private static final Logger log = LoggerFactory.getLogger(QueryService.class);

    @Autowired
    private QueryCompiler compiler;

    @Autowired
    private CargoQueryExecutor executor;

    /**
     * Compile and run. Compile errors and missing tables come back as an error response;
     * storage failures propagate.
     */
    public QueryResponse execute(QuerySpec spec) {
        CompileResult result = compiler.compile(spec);
        if (!result.isSuccess()) {
            QueryError error = result.getError();
            return QueryResponse.error(error.getMessage(), error.getKind());
        }

        CompiledQuery query = result.getQuery();
        List<Map<String, String>> rows;
        try {
            rows = executor.run(query);
        } catch (CargoQueryException e) {
            log.warn("Query rejected ({}): {}", e.getKind(), e.getMessage());
            return QueryResponse.error(e.getMessage(), e.getKind());
        }

        QueryResponse response = new QueryResponse(rows, new ArrayList<>(query.getAliasedFields().keySet()));
        response.setSearchTerms(query.getSearchTerms());
        return response;
    }

    /**
     * Compile only, reporting the SQL that would run
     */
    public CompileResponse compile(QuerySpec spec) {
        CompileResult result = compiler.compile(spec);
        if (!result.isSuccess()) {
            QueryError error = result.getError();
            return CompileResponse.error(error.getMessage(), error.getKind());
        }

        CompiledQuery query = result.getQuery();
        Map<String, String> joinClauses = new LinkedHashMap<>();
        for (Map.Entry<String, JoinClause> entry : query.getJoinClauses().entrySet()) {
            joinClauses.put(entry.getKey(), entry.getValue().toString());
        }

        CompileResponse response = new CompileResponse();
        response.setSql(executor.toSql(query));
        response.setTables(query.getTables());
        response.setFields(query.getAliasedFields());
        response.setJoinClauses(joinClauses);
        response.setSearchTerms(query.getSearchTerms());
        response.setLimit(query.getLimit());
        return response;
    }
}
