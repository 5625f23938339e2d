package com.example.mnm.search;

import com.example.mnm.exceptions.InvalidParameterException;
import com.example.mnm.exceptions.MissingParameterException;

import java.util.List;

/**
 * Validated parameters of a proximity search. Distances are computed by the caller; this
 * type only guarantees the coordinates and radius are usable.
 */
public record ProximitySearchQuery(double lat, double lon, double radius, String serviceId) {

    public static final double DEFAULT_RADIUS_KM = 8;
    public static final String EXAMPLE = "/professionals/search?lat=-19.9167&lon=-43.9345&radius=8";

    /**
     * @throws MissingParameterException if {@code lat} or {@code lon} is absent
     * @throws InvalidParameterException  if a value is not numeric or out of range
     */
    public static ProximitySearchQuery parse(String lat, String lon, String radius, String serviceId) {
        if (isBlank(lat) || isBlank(lon)) {
            throw new MissingParameterException(List.of("lat", "lon"), EXAMPLE);
        }

        double latitude = number("lat", lat);
        if (latitude < -90 || latitude > 90) {
            throw new InvalidParameterException("lat", "lat must be between -90 and 90");
        }
        double longitude = number("lon", lon);
        if (longitude < -180 || longitude > 180) {
            throw new InvalidParameterException("lon", "lon must be between -180 and 180");
        }
        double radiusKm = isBlank(radius) ? DEFAULT_RADIUS_KM : number("radius", radius);
        if (radiusKm <= 0) {
            throw new InvalidParameterException("radius", "radius must be greater than 0");
        }
        return new ProximitySearchQuery(latitude, longitude, radiusKm, isBlank(serviceId) ? null : serviceId.trim());
    }

    private static double number(String name, String raw) {
        try {
            double value = Double.parseDouble(raw.trim());
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw new InvalidParameterException(name, name + " must be a number");
            }
            return value;
        } catch (NumberFormatException e) {
            throw new InvalidParameterException(name, name + " must be a number");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
