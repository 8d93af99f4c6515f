package com.geico.poc.cargoquery.compiler;

import com.geico.poc.cargoquery.schema.SchemaProvider;
import com.geico.poc.cargoquery.schema.TableSchema;
import com.geico.poc.cargoquery.search.SearchTermExtractor;
import com.geico.poc.cargoquery.storage.JoinClause;
import com.geico.poc.cargoquery.storage.QueryEngine;
import com.geico.poc.cargoquery.validation.QueryTokenGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.util.HtmlUtils;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Compiles query parameters into a {@link CompiledQuery}.
 *
 * Validation, alias resolution, join graph and type resolution build the first snapshot;
 * the rewrite stages then run in a fixed order. List fields go first because they can add
 * tables and joins the later stages must see, and table prefixing goes last because every
 * other stage works with logical names.
 */
public class QueryCompiler {

    private static final Logger log = LoggerFactory.getLogger(QueryCompiler.class);

    private final CompilerOptions options;
    private final QueryTokenGuard tokenGuard;
    private final FieldAliasResolver aliasResolver;
    private final JoinGraphBuilder joinGraphBuilder;
    private final FieldTypeResolver typeResolver;
    private final JoinClauseRenderer joinClauseRenderer;
    private final List<RewriteStage> stages;

    public QueryCompiler(SchemaProvider schemaProvider, QueryEngine engine,
                         SearchTermExtractor searchTermExtractor, CompilerOptions options) {
        this.options = options;
        this.tokenGuard = new QueryTokenGuard(options.getAllowedSqlFunctions());
        this.aliasResolver = new FieldAliasResolver();
        this.joinGraphBuilder = new JoinGraphBuilder();
        this.typeResolver = new FieldTypeResolver(schemaProvider, tokenGuard);
        this.joinClauseRenderer = new JoinClauseRenderer(engine);
        this.stages = Collections.unmodifiableList(Arrays.asList(
                new VirtualFieldRewriter(),
                new CoordinateFieldRewriter(),
                new SearchTextRewriter(searchTermExtractor),
                new DateFieldAugmenter(),
                new TablePrefixQualifier(engine)));
    }

    public CompilerOptions getOptions() {
        return options;
    }

    /**
     * Compile, reporting failure as a {@link QueryError} instead of throwing
     */
    public CompileResult compile(QuerySpec spec) {
        try {
            return CompileResult.success(compileOrThrow(spec));
        } catch (CargoQueryException e) {
            log.warn("Query rejected ({}): {}", e.getKind(), e.getMessage());
            return CompileResult.failure(QueryError.from(e));
        }
    }

    /**
     * @throws CargoQueryException subclass for the first fatal problem found
     */
    public CompiledQuery compileOrThrow(QuerySpec spec) {
        log.debug("Compiling {}", spec);
        tokenGuard.check(spec);

        QueryIr ir = initialIr(spec);
        for (RewriteStage stage : stages) {
            ir = stage.apply(ir);
        }

        Map<String, JoinClause> joinClauses = joinClauseRenderer.render(ir.getJoinConditions());
        CompiledQuery compiled = new CompiledQuery(ir, joinClauses, parseLimit(spec.getLimit()));
        log.debug("Compiled {}", compiled);
        return compiled;
    }

    /**
     * The snapshot the rewrite stages start from: tables, aliases, join conditions and
     * resolved fields, with the clauses as given apart from the decoded where.
     */
    QueryIr initialIr(QuerySpec spec) {
        List<String> tables = parseTables(spec.getTables());

        // Page-name macros HTML-encode their output, quotes included
        String where = HtmlUtils.htmlUnescape(spec.getWhere());

        List<JoinCondition> joinConditions = joinGraphBuilder.build(spec.getJoinOn(), tables);
        FieldAliasResolver.Result aliases = aliasResolver.resolve(spec.getFields());
        Map<String, TableSchema> schemas = typeResolver.loadSchemas(tables);

        boolean defaultOrderBy = spec.getOrderBy().trim().isEmpty();
        String orderBy = defaultOrderBy
                ? aliases.getAliasedFields().values().iterator().next()
                : spec.getOrderBy();

        return QueryIr.builder()
                .tables(tables)
                .aliasedFields(aliases.getAliasedFields())
                .fieldStringAliases(aliases.getFieldStringAliases())
                .tableSchemas(schemas)
                .resolvedFields(typeResolver.resolve(aliases.getAliasedFields(), tables, schemas))
                .joinConditions(joinConditions)
                .joinOn(spec.getJoinOn())
                .where(where)
                .groupBy(spec.getGroupBy())
                .having(spec.getHaving())
                .orderBy(orderBy)
                .defaultOrderBy(defaultOrderBy)
                .build();
    }

    static List<String> parseTables(String tablesStr) {
        List<String> tables = new ArrayList<>();
        for (String table : tablesStr.split(",")) {
            String trimmed = table.trim();
            if (!trimmed.isEmpty() && !tables.contains(trimmed)) {
                tables.add(trimmed);
            }
        }
        if (tables.isEmpty()) {
            throw new QuerySyntaxException("Error: at least one table must be specified.");
        }
        return tables;
    }

    /**
     * Requested limit capped at the maximum; the default when none is given
     */
    int parseLimit(String limitStr) {
        String trimmed = limitStr.trim();
        if (trimmed.isEmpty()) {
            return options.getDefaultQueryLimit();
        }
        BigInteger requested;
        try {
            requested = new BigInteger(trimmed);
        } catch (NumberFormatException e) {
            throw new QuerySyntaxException("Error: the limit \"" + trimmed + "\" is not a whole number.");
        }
        if (requested.signum() < 0) {
            throw new QuerySyntaxException("Error: the limit must not be negative.");
        }
        return requested.min(BigInteger.valueOf(options.getMaxQueryLimit())).intValue();
    }
}
