package com.geico.poc.cargoquery.compiler;

import com.geico.poc.cargoquery.schema.FieldDescription;
import com.geico.poc.cargoquery.schema.FieldType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Selects the {@code __precision} companion of every selected Date / Datetime column,
 * so that year-only and year-month values can be displayed as such.
 */
public class DateFieldAugmenter implements RewriteStage {

    @Override
    public QueryIr apply(QueryIr ir) {
        Map<String, String> dateFields = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : ir.getAliasedFields().entrySet()) {
            ResolvedField resolved = ir.getResolvedField(entry.getKey());
            if (resolved == null) {
                continue;
            }
            FieldDescription description = resolved.getDescription();
            String expression = entry.getValue();
            // Function results and list values have no precision column
            if (description.isTyped() && description.getType().isDate()
                    && !description.isList()
                    && expression.indexOf('(') < 0 && expression.indexOf(')') < 0) {
                dateFields.put(entry.getKey(), expression);
            }
        }
        if (dateFields.isEmpty()) {
            return ir;
        }

        QueryIr.Builder builder = ir.toBuilder();
        for (Map.Entry<String, String> entry : dateFields.entrySet()) {
            String alias = entry.getKey();
            ResolvedField resolved = ir.getResolvedField(alias);
            String precisionAlias = alias + FieldTypeResolver.PRECISION_SUFFIX;
            builder.aliasedField(precisionAlias, entry.getValue() + FieldTypeResolver.PRECISION_SUFFIX);
            builder.resolvedField(precisionAlias, new ResolvedField(FieldDescription.of(FieldType.DATE_PRECISION),
                    resolved.getTable(), FieldRef.datePrecision(resolved.getTable(), resolved.getRef().getField())));
        }
        return builder.build();
    }
}
