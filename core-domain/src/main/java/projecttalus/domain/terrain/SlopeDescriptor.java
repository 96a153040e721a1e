package projecttalus.domain.terrain;

import java.util.List;

/**
 * Descriptores geométricos del talud derivados del perfil del terreno.
 *
 * @param height                 Desnivel H entre coronación y pie [m].
 * @param crestX                 Abscisa de la coronación (borde de la meseta superior) [m].
 * @param toeX                   Abscisa del pie (borde de la meseta inferior) [m].
 * @param crestElevation         Cota de coronación [m].
 * @param toeElevation           Cota del pie [m].
 * @param faceAngleDegrees       Inclinación media del paramento [°].
 * @param descendsTowardPositiveX Sentido de deslizamiento.
 */
public record SlopeDescriptor(
        double height,
        double crestX,
        double toeX,
        double crestElevation,
        double toeElevation,
        double faceAngleDegrees,
        boolean descendsTowardPositiveX
) {
    /**
     * Tolerancia relativa (fracción de H) para considerar un vértice parte de una meseta.
     */
    private static final double PLATEAU_TOLERANCE = 0.01;

    public static SlopeDescriptor fromTerrain(TerrainProfile terrain) {
        List<TerrainPoint> points = terrain.getPoints();
        double maxY = terrain.getMaxY();
        double minY = terrain.getMinY();
        double height = maxY - minY;
        double tolerance = Math.max(1e-9, PLATEAU_TOLERANCE * height);
        boolean descends = terrain.descendsTowardPositiveX();

        double crestX = descends ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        double toeX = descends ? Double.POSITIVE_INFINITY : Double.NEGATIVE_INFINITY;
        for (TerrainPoint p : points) {
            if (p.y() >= maxY - tolerance) {
                crestX = descends ? Math.max(crestX, p.x()) : Math.min(crestX, p.x());
            }
            if (p.y() <= minY + tolerance) {
                toeX = descends ? Math.min(toeX, p.x()) : Math.max(toeX, p.x());
            }
        }
        double run = Math.abs(toeX - crestX);
        double angle = run > 0 ? Math.toDegrees(Math.atan(height / run)) : 90.0;
        return new SlopeDescriptor(height, crestX, toeX, maxY, minY, angle, descends);
    }

    public double faceMinX() {
        return Math.min(crestX, toeX);
    }

    public double faceMaxX() {
        return Math.max(crestX, toeX);
    }
}
