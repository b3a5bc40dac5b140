package com.example.UniScout.model;

/**
 * Optional origin hints for a request. All fields may be null.
 */
public record QueryHints(
        String latitude,
        String longitude,
        String city,
        String country
) {
    public boolean isEmpty() {
        return isBlank(latitude) && isBlank(longitude) && isBlank(city) && isBlank(country);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
