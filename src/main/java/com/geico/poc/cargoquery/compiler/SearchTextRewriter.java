package com.geico.poc.cargoquery.compiler;

import com.geico.poc.cargoquery.compiler.token.ClauseScanner;
import com.geico.poc.cargoquery.compiler.token.SqlToken;
import com.geico.poc.cargoquery.schema.FieldDescription;
import com.geico.poc.cargoquery.schema.FieldType;
import com.geico.poc.cargoquery.schema.TableSchema;
import com.geico.poc.cargoquery.search.SearchTermExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Rewrites {@code <Searchtext field> MATCHES '<search>'} into a boolean-mode full-text
 * predicate and records the searched terms under the field's alias.
 */
public class SearchTextRewriter implements RewriteStage {

    private static final Logger log = LoggerFactory.getLogger(SearchTextRewriter.class);

    private final SearchTermExtractor searchTermExtractor;

    public SearchTextRewriter(SearchTermExtractor searchTermExtractor) {
        this.searchTermExtractor = searchTermExtractor;
    }

    @Override
    public QueryIr apply(QueryIr ir) {
        QueryIr.Builder builder = ir.toBuilder();
        String where = ir.getWhere();
        boolean changed = false;

        for (Map.Entry<String, TableSchema> schema : ir.getTableSchemas().entrySet()) {
            String tableName = schema.getKey();
            for (Map.Entry<String, FieldDescription> field : schema.getValue().getFieldDescriptions().entrySet()) {
                if (!field.getValue().hasType(FieldType.SEARCHTEXT)) {
                    continue;
                }
                String fieldName = field.getKey();
                String qualifier = VirtualFieldRewriter.containsReference(where, tableName, fieldName) ? tableName : null;
                List<String> terms = new ArrayList<>();
                String rewritten = rewriteMatches(where, tableName, fieldName, qualifier, terms);
                if (!rewritten.equals(where)) {
                    where = rewritten;
                    changed = true;
                    builder.searchTerms(aliasFor(ir, tableName, fieldName), terms);
                }
            }
        }

        if (!changed) {
            return ir;
        }
        QueryIr result = builder.where(where).build();
        log.debug("After full-text rewrite: where='{}', terms={}", result.getWhere(), result.getSearchTerms());
        return result;
    }

    /**
     * Alias the field is selected under, or the field name when it is not selected
     */
    private static String aliasFor(QueryIr ir, String tableName, String fieldName) {
        for (Map.Entry<String, ResolvedField> entry : ir.getResolvedFields().entrySet()) {
            FieldRef ref = entry.getValue().getRef();
            if (ref.is(FieldRef.Kind.DIRECT) && ref.refersTo(tableName, fieldName)) {
                return entry.getKey();
            }
        }
        return fieldName;
    }

    private String rewriteMatches(String where, String tableName, String fieldName, String qualifier,
                                  List<String> terms) {
        return ClauseScanner.rewrite(where, (tokens, index, out) -> {
            int end = ClauseScanner.matchReference(tokens, index, qualifier, fieldName);
            if (end < 0 || end >= tokens.size() || !tokens.get(end).isWhitespace()) {
                return 0;
            }
            int matches = ClauseScanner.matchKeywords(tokens, end + 1, "MATCHES");
            if (matches < 0) {
                return 0;
            }
            int literal = ClauseScanner.skipWhitespace(tokens, matches);
            if (literal >= tokens.size() || !tokens.get(literal).isString()) {
                throw new QuerySyntaxException("Error: the 'MATCHES' operator for the field '" + tableName + "."
                        + fieldName + "' must be followed by a quoted search string.");
            }
            SqlToken searchString = tokens.get(literal);
            out.append(" MATCH(").append(tableName).append('.').append(fieldName).append(") AGAINST (")
                    .append(searchString.getText()).append(" IN BOOLEAN MODE) ");
            for (String term : searchTermExtractor.getSearchTerms(searchString.unquotedText())) {
                if (!terms.contains(term)) {
                    terms.add(term);
                }
            }
            return literal + 1 - index;
        });
    }
}
