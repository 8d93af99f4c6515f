package com.geico.poc.cargoquery.compiler;

import com.geico.poc.cargoquery.compiler.token.ClauseScanner;
import com.geico.poc.cargoquery.compiler.token.SqlToken;
import com.geico.poc.cargoquery.storage.QueryEngine;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns every {@code table.field} reference to a declared table into the engine's
 * physical, quoted form, e.g. {@code Films.Title -> `cargo__Films`.`Title`}.
 *
 * Must run after every other stage, since they all produce logical names. The table list
 * and join conditions are left alone: the engine prefixes those itself.
 */
public class TablePrefixQualifier implements RewriteStage {

    private final QueryEngine engine;

    public TablePrefixQualifier(QueryEngine engine) {
        this.engine = engine;
    }

    @Override
    public QueryIr apply(QueryIr ir) {
        List<String> tables = ir.getTables();

        Map<String, String> aliasedFields = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : ir.getAliasedFields().entrySet()) {
            aliasedFields.put(entry.getKey(), qualify(entry.getValue(), tables));
        }

        return ir.toBuilder()
                .aliasedFields(aliasedFields)
                .where(qualify(ir.getWhere(), tables))
                .groupBy(qualify(ir.getGroupBy(), tables))
                .having(qualify(ir.getHaving(), tables))
                .orderBy(qualify(ir.getOrderBy(), tables))
                .build();
    }

    String qualify(String clause, List<String> tables) {
        return ClauseScanner.rewrite(clause, (tokens, index, out) -> {
            SqlToken token = tokens.get(index);
            if (!token.isWord() || !tables.contains(token.getText())) {
                return 0;
            }
            if (index > 0 && tokens.get(index - 1).isSymbol('.')) {
                return 0;
            }
            if (index + 2 >= tokens.size()
                    || !tokens.get(index + 1).isSymbol('.')
                    || !tokens.get(index + 2).isWord()) {
                return 0;
            }
            out.append(engine.tableName(token.getText()))
                    .append('.')
                    .append(engine.addIdentifierQuotes(tokens.get(index + 2).getText()));
            return 3;
        });
    }
}
