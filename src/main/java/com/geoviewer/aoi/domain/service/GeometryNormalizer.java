package com.geoviewer.aoi.domain.service;

import com.geoviewer.aoi.domain.model.Geometry;
import com.geoviewer.aoi.domain.model.MultiPolygonGeometry;
import com.geoviewer.aoi.domain.model.PointGeometry;
import com.geoviewer.aoi.domain.model.PolygonGeometry;
import com.geoviewer.aoi.domain.model.Position;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.simplify.DouglasPeuckerSimplifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Domain service that prepares user-drawn geometry for storage.
 *
 * Normalization Rule: close every ring, simplify every ring with
 * Douglas-Peucker, then reject anything outside WGS84 bounds.
 *
 * Distances are measured in raw lng/lat degrees without projection, so the
 * effective tolerance shrinks east-west towards the poles. The default
 * tolerance of 1e-4 degrees is about 11m at the equator.
 *
 * Stateless and safe to share between threads.
 */
@Service
public class GeometryNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(GeometryNormalizer.class);

    public static final double DEFAULT_TOLERANCE_DEG = 1e-4;

    private static final GeometryFactory GEOMETRY_FACTORY = new GeometryFactory();

    /**
     * Close, simplify and bounds-check a geometry.
     *
     * @param geometry Schema-valid geometry
     * @return Normalized geometry
     * @throws OutOfBoundsException if any position lies outside [-180,180] x [-90,90]
     */
    public Geometry normalize(Geometry geometry) {
        Geometry closed = closeRings(geometry);
        Geometry simplified = simplify(closed, DEFAULT_TOLERANCE_DEG);
        if (!validateBounds(simplified)) {
            throw new OutOfBoundsException("Coordinates out of bounds");
        }
        if (logger.isDebugEnabled()) {
            logger.debug("Normalized {}: {} -> {} positions", geometry.getType().getGeoJsonName(),
                geometry.getPositions().size(), simplified.getPositions().size());
        }
        return simplified;
    }

    /**
     * Appends the first position to every ring that does not already end with it.
     * Idempotent; points are returned as-is.
     */
    public Geometry closeRings(Geometry geometry) {
        return mapRings(geometry, GeometryNormalizer::closeRing);
    }

    /**
     * Simplifies every ring independently. Ring endpoints are always kept and no
     * ring drops below four positions.
     *
     * @param geometry Geometry to simplify
     * @param toleranceDeg Maximum allowed deviation in degrees
     */
    public Geometry simplify(Geometry geometry, double toleranceDeg) {
        if (!Double.isFinite(toleranceDeg) || toleranceDeg < 0) {
            throw new IllegalArgumentException("Tolerance must be a finite, non-negative number: " + toleranceDeg);
        }
        return mapRings(geometry, ring -> simplifyRing(ring, toleranceDeg));
    }

    /**
     * @return true if every position lies within WGS84 bounds
     */
    public boolean validateBounds(Geometry geometry) {
        return switch (geometry.getType()) {
            case POINT -> ((PointGeometry) geometry).getCoordinates().isWithinBounds();
            case POLYGON -> ringsWithinBounds(((PolygonGeometry) geometry).getCoordinates());
            case MULTI_POLYGON -> ((MultiPolygonGeometry) geometry).getCoordinates().stream()
                .allMatch(GeometryNormalizer::ringsWithinBounds);
        };
    }

    private static boolean ringsWithinBounds(List<List<Position>> rings) {
        return rings.stream().flatMap(List::stream).allMatch(Position::isWithinBounds);
    }

    private static Geometry mapRings(Geometry geometry, UnaryOperator<List<Position>> ringOperation) {
        return switch (geometry.getType()) {
            case POINT -> geometry;
            case POLYGON -> new PolygonGeometry(
                mapPolygon(((PolygonGeometry) geometry).getCoordinates(), ringOperation));
            case MULTI_POLYGON -> new MultiPolygonGeometry(((MultiPolygonGeometry) geometry).getCoordinates().stream()
                .map(polygon -> mapPolygon(polygon, ringOperation))
                .toList());
        };
    }

    private static List<List<Position>> mapPolygon(List<List<Position>> rings,
                                                   UnaryOperator<List<Position>> ringOperation) {
        return rings.stream().map(ringOperation).toList();
    }

    static List<Position> closeRing(List<Position> ring) {
        if (ring.isEmpty() || isClosed(ring)) {
            return ring;
        }
        List<Position> closed = new ArrayList<>(ring.size() + 1);
        closed.addAll(ring);
        closed.add(ring.get(0));
        return closed;
    }

    private static boolean isClosed(List<Position> ring) {
        return ring.get(0).equals(ring.get(ring.size() - 1));
    }

    /**
     * Douglas-Peucker over the closed ring treated as a line, so both endpoints
     * are kept. Rings that would drop below four positions are returned unsimplified.
     */
    static List<Position> simplifyRing(List<Position> points, double tolerance) {
        if (points.size() <= PolygonGeometry.MIN_RING_SIZE) {
            return points;
        }
        List<Position> ring = closeRing(points);

        Coordinate[] coordinates = ring.stream()
            .map(position -> new Coordinate(position.getLng(), position.getLat()))
            .toArray(Coordinate[]::new);
        LineString line = GEOMETRY_FACTORY.createLineString(coordinates);
        Coordinate[] kept = DouglasPeuckerSimplifier.simplify(line, tolerance).getCoordinates();

        if (kept.length < PolygonGeometry.MIN_RING_SIZE) {
            return ring;
        }
        return Arrays.stream(kept)
            .map(coordinate -> new Position(coordinate.getX(), coordinate.getY()))
            .toList();
    }

    /**
     * Exception thrown when normalized geometry falls outside WGS84 bounds.
     */
    public static class OutOfBoundsException extends RuntimeException {
        public OutOfBoundsException(String message) {
            super(message);
        }
    }
}
