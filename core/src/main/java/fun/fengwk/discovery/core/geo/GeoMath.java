package fun.fengwk.discovery.core.geo;

/**
 * Great-circle helpers on a spherical Earth.
 *
 * <p>Coordinates are expected to be validated by the caller.</p>
 *
 * @author fengwk
 */
public final class GeoMath {

    /**
     * Mean Earth radius in meters.
     */
    public static final double EARTH_RADIUS_METERS = 6_371_000D;

    // floating point slack, well under a meter
    private static final double BOX_MARGIN_DEGREES = 1e-6;

    private GeoMath() {
    }

    /**
     * Haversine distance between two points in meters.
     */
    public static double distanceMeters(double lat1, double lon1, double lat2, double lon2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLon = Math.toRadians(lon2 - lon1);
        double sinLat = Math.sin(dLat / 2);
        double sinLon = Math.sin(dLon / 2);
        double a = sinLat * sinLat
            + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2)) * sinLon * sinLon;
        // rounding can push a slightly above 1 for antipodal points
        a = Math.min(1D, Math.max(0D, a));
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_METERS * c;
    }

    public static boolean withinRadius(double distanceMeters, double radiusMeters) {
        return distanceMeters <= radiusMeters;
    }

    /**
     * Smallest latitude/longitude box containing every point within {@code radiusMeters} of the center.
     *
     * <p>The box is a superset of the circle, so callers still apply {@link #distanceMeters} to the
     * points it admits. Longitude bounds are null when the circle reaches a pole or crosses the
     * antimeridian.</p>
     */
    public static BoundingBox boundingBox(double latitude, double longitude, double radiusMeters) {
        double angular = Math.max(0D, radiusMeters) / EARTH_RADIUS_METERS;
        double latRad = Math.toRadians(latitude);
        double minLat = latRad - angular;
        double maxLat = latRad + angular;
        if (minLat <= -Math.PI / 2 || maxLat >= Math.PI / 2) {
            return new BoundingBox(Math.max(-90D, Math.toDegrees(minLat) - BOX_MARGIN_DEGREES),
                Math.min(90D, Math.toDegrees(maxLat) + BOX_MARGIN_DEGREES), null, null);
        }
        double deltaLon = Math.asin(Math.min(1D, Math.sin(angular) / Math.cos(latRad)));
        double minLon = Math.toDegrees(Math.toRadians(longitude) - deltaLon) - BOX_MARGIN_DEGREES;
        double maxLon = Math.toDegrees(Math.toRadians(longitude) + deltaLon) + BOX_MARGIN_DEGREES;
        boolean wraps = minLon < -180D || maxLon > 180D;
        return new BoundingBox(Math.toDegrees(minLat) - BOX_MARGIN_DEGREES, Math.toDegrees(maxLat) + BOX_MARGIN_DEGREES,
            wraps ? null : minLon, wraps ? null : maxLon);
    }

    /**
     * Inclusive coordinate bounds in degrees.
     */
    public record BoundingBox(double minLatitude, double maxLatitude, Double minLongitude, Double maxLongitude) {

        public boolean hasLongitudeBounds() {
            return minLongitude != null && maxLongitude != null;
        }

    }

}
