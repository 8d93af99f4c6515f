package com.geico.poc.cargoquery.compiler;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Distance and coordinate arithmetic for NEAR.
 */
public final class DistanceConverter {

    public static final double KM_PER_MILE = 1.60934;
    public static final double KM_PER_DEGREE_LATITUDE = 111;
    public static final double KM_PER_DEGREE_LONGITUDE_AT_EQUATOR = 111.321;

    private static final Set<String> KILOMETER_UNITS = Set.of("kilometers", "kilometres", "km");
    private static final Set<String> MILE_UNITS = Set.of("miles", "mi");

    // 40°42′46″ (minutes and seconds optional)
    private static final Pattern DMS_PATTERN = Pattern.compile(
            "^(\\d+(?:\\.\\d+)?)\\s*°\\s*(?:(\\d+(?:\\.\\d+)?)\\s*[′']\\s*)?(?:(\\d+(?:\\.\\d+)?)\\s*[″\"]\\s*)?$");

    private DistanceConverter() {
    }

    /**
     * Degrees of latitude and of longitude spanned by a distance at the given latitude.
     * The latitude span is the same everywhere; the longitude span grows towards the poles.
     *
     * @return {latitudeDelta, longitudeDelta}
     */
    public static double[] distanceToDegrees(double distance, String unit, String latitude) {
        double distanceInKm = toKilometers(distance, unit);
        double latDistance = distanceInKm / KM_PER_DEGREE_LATITUDE;

        double latNum = parseLatitude(latitude);
        double lengthOfOneDegreeLongitude = Math.cos(Math.toRadians(latNum)) * KM_PER_DEGREE_LONGITUDE_AT_EQUATOR;
        double longDistance = distanceInKm / lengthOfOneDegreeLongitude;

        return new double[]{latDistance, longDistance};
    }

    public static double toKilometers(double distance, String unit) {
        String normalized = unit.trim().toLowerCase(Locale.ROOT);
        if (KILOMETER_UNITS.contains(normalized)) {
            return distance;
        }
        if (MILE_UNITS.contains(normalized)) {
            return distance * KM_PER_MILE;
        }
        throw new QuerySyntaxException("Error: distance for 'NEAR' operator must be in either miles or "
                + "kilometers (\"" + unit + "\" specified).");
    }

    public static double parseLatitude(String latitude) {
        return parseCoordinate(latitude, 'N', 'S');
    }

    public static double parseLongitude(String longitude) {
        return parseCoordinate(longitude, 'E', 'W');
    }

    /**
     * Signed decimal degrees, or degrees with a hemisphere letter; the negative
     * hemisphere flips the sign.
     */
    static double parseCoordinate(String value, char positive, char negative) {
        String text = value.trim();
        boolean isNegative = false;
        if (!text.isEmpty()) {
            char last = Character.toUpperCase(text.charAt(text.length() - 1));
            if (last == negative || last == positive) {
                isNegative = last == negative;
                text = text.substring(0, text.length() - 1).trim();
            }
        }

        double number;
        Matcher dms = DMS_PATTERN.matcher(text);
        if (dms.matches()) {
            number = Double.parseDouble(dms.group(1));
            if (dms.group(2) != null) {
                number += Double.parseDouble(dms.group(2)) / 60;
            }
            if (dms.group(3) != null) {
                number += Double.parseDouble(dms.group(3)) / 3600;
            }
        } else {
            try {
                number = Double.parseDouble(text);
            } catch (NumberFormatException e) {
                throw new QuerySyntaxException("Error: \"" + value.trim() + "\" is not a valid coordinate.");
            }
        }
        // parseDouble accepts "Infinity" and overflows "1e999"
        if (!Double.isFinite(number)) {
            throw new QuerySyntaxException("Error: \"" + value.trim() + "\" is not a valid coordinate.");
        }
        return isNegative ? -number : number;
    }
}
