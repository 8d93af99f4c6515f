package com.geico.poc.cargoquery.compiler;

import com.geico.poc.cargoquery.compiler.token.ClauseScanner;
import com.geico.poc.cargoquery.schema.FieldDescription;
import com.geico.poc.cargoquery.schema.FieldType;
import com.geico.poc.cargoquery.schema.TableSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rewrites Coordinates fields. A selected coordinates field is projected as its
 * {@code __full} column plus its {@code __lat} / {@code __lon} columns; a NEAR predicate
 * in the where clause becomes a bounding box over the {@code __lat} / {@code __lon} columns:
 *
 *   Location NEAR (40.7, -74.0, 50 km)
 *     -> Places.Location__lat >= 40.2495... AND Places.Location__lat <= 41.1504...
 *        AND Places.Location__lon >= -74.5924... AND Places.Location__lon <= -73.4075...
 */
public class CoordinateFieldRewriter implements RewriteStage {

    private static final Logger log = LoggerFactory.getLogger(CoordinateFieldRewriter.class);

    @Override
    public QueryIr apply(QueryIr ir) {
        List<String[]> coordinateFields = coordinateFields(ir.getTableSchemas());
        if (coordinateFields.isEmpty()) {
            return ir;
        }

        QueryIr.Builder builder = ir.toBuilder();

        // fields
        Map<String, String> helperAliases = new LinkedHashMap<>();
        Map<String, ResolvedField> helperFields = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : ir.getAliasedFields().entrySet()) {
            String alias = entry.getKey();
            ResolvedField resolved = ir.getResolvedField(alias);
            if (resolved == null
                    || !resolved.getRef().is(FieldRef.Kind.DIRECT)
                    || resolved.getTable() == null
                    || !resolved.getDescription().hasType(FieldType.COORDINATES)) {
                continue;
            }
            String tableName = resolved.getTable();
            String fieldName = resolved.getRef().getField();
            builder.aliasedField(alias, fieldName + FieldTypeResolver.FULL_SUFFIX);
            builder.resolvedField(alias, resolved.withRef(FieldRef.listFull(tableName, fieldName)));

            // Needed for map display
            FieldDescription part = FieldDescription.of(FieldType.COORDINATES_PART);
            helperAliases.put(fieldName + "  lat", fieldName + FieldTypeResolver.LAT_SUFFIX);
            helperFields.put(fieldName + "  lat",
                    new ResolvedField(part, tableName, FieldRef.coordinatePart(tableName, fieldName)));
            helperAliases.put(fieldName + "  lon", fieldName + FieldTypeResolver.LON_SUFFIX);
            helperFields.put(fieldName + "  lon",
                    new ResolvedField(part, tableName, FieldRef.coordinatePart(tableName, fieldName)));
        }
        helperAliases.forEach(builder::aliasedField);
        helperFields.forEach(builder::resolvedField);

        // where
        String where = ir.getWhere();
        for (String[] coordinateField : coordinateFields) {
            String tableName = coordinateField[0];
            String fieldName = coordinateField[1];
            where = rewriteNear(where, tableName, fieldName, tableName);
            where = rewriteNear(where, tableName, fieldName, null);
        }
        builder.where(where);

        QueryIr result = builder.build();
        log.debug("After coordinates rewrite: {}", result);
        return result;
    }

    private static List<String[]> coordinateFields(Map<String, TableSchema> schemas) {
        List<String[]> fields = new ArrayList<>();
        for (Map.Entry<String, TableSchema> schema : schemas.entrySet()) {
            for (Map.Entry<String, FieldDescription> field : schema.getValue().getFieldDescriptions().entrySet()) {
                if (field.getValue().hasType(FieldType.COORDINATES)) {
                    fields.add(new String[]{schema.getKey(), field.getKey()});
                }
            }
        }
        return fields;
    }

    private static String rewriteNear(String where, String tableName, String fieldName, String qualifier) {
        return ClauseScanner.rewrite(where, (tokens, index, out) -> {
            int end = ClauseScanner.matchReference(tokens, index, qualifier, fieldName);
            if (end < 0 || end >= tokens.size() || !tokens.get(end).isWhitespace()) {
                return 0;
            }
            int near = ClauseScanner.matchKeywords(tokens, end + 1, "NEAR");
            if (near < 0) {
                return 0;
            }
            int open = ClauseScanner.skipWhitespace(tokens, near);
            if (open >= tokens.size() || !tokens.get(open).isSymbol('(')) {
                throw new QuerySyntaxException("Error: value for the 'NEAR' operator must be of the form "
                        + "\"(latitude, longitude, distance)\".");
            }
            int close = ClauseScanner.findClosingParenthesis(tokens, open);
            if (close < 0) {
                throw new QuerySyntaxException("Error: unclosed parenthesis after 'NEAR'.");
            }
            out.append(boundingBox(tableName, fieldName, ClauseScanner.render(tokens, open + 1, close)));
            return close + 1 - index;
        });
    }

    static String boundingBox(String tableName, String fieldName, String arguments) {
        String[] coordinatesAndDistance = arguments.split(",", -1);
        if (coordinatesAndDistance.length != 3) {
            throw new QuerySyntaxException("Error: value for the 'NEAR' operator must be of the form "
                    + "\"(latitude, longitude, distance)\".");
        }
        String[] distanceComponents = coordinatesAndDistance[2].trim().split("\\s+");
        if (distanceComponents.length != 2) {
            throw new QuerySyntaxException("Error: the third argument for the 'NEAR' operator, "
                    + "representing the distance, must be of the form \"number unit\".");
        }
        double distance;
        try {
            distance = Double.parseDouble(distanceComponents[0]);
        } catch (NumberFormatException e) {
            distance = Double.NaN;
        }
        if (!Double.isFinite(distance)) {
            throw new QuerySyntaxException("Error: \"" + distanceComponents[0]
                    + "\" is not a valid distance for the 'NEAR' operator.");
        }

        double latitude = DistanceConverter.parseLatitude(coordinatesAndDistance[0]);
        double longitude = DistanceConverter.parseLongitude(coordinatesAndDistance[1]);
        double[] deltas = DistanceConverter.distanceToDegrees(distance, distanceComponents[1],
                coordinatesAndDistance[0]);
        if (!Double.isFinite(deltas[0]) || !Double.isFinite(deltas[1])) {
            throw new QuerySyntaxException("Error: \"" + coordinatesAndDistance[2].trim()
                    + "\" is not a valid distance for the 'NEAR' operator.");
        }

        // Bounding box instead of a circle
        String latColumn = tableName + "." + fieldName + FieldTypeResolver.LAT_SUFFIX;
        String lonColumn = tableName + "." + fieldName + FieldTypeResolver.LON_SUFFIX;
        return " " + latColumn + " >= " + format(Math.max(latitude - deltas[0], -90))
                + " AND " + latColumn + " <= " + format(Math.min(latitude + deltas[0], 90))
                + " AND " + lonColumn + " >= " + format(Math.max(longitude - deltas[1], -180))
                + " AND " + lonColumn + " <= " + format(Math.min(longitude + deltas[1], 180)) + " ";
    }

    private static String format(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
