package projecttalus.domain.terrain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import projecttalus.domain.circle.FailureCircle;
import projecttalus.exception.ParameterException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Perfil inmutable de la superficie del terreno.
 * <p>
 * Secuencia ordenada de puntos (x, y) con abscisas estrictamente crecientes.
 * No se exige monotonía en y: el terreno puede tener bermas. Se usa tanto
 * para el terreno como para la superficie piezométrica del nivel freático.
 */
public final class TerrainProfile {

    private final List<TerrainPoint> points;

    /**
     * Construye el perfil validando su consistencia.
     *
     * @param points Puntos del perfil (al menos 2, x estrictamente creciente).
     * @throws ParameterException si el perfil es degenerado.
     */
    @JsonCreator
    public TerrainProfile(@JsonProperty("points") List<TerrainPoint> points) {
        Objects.requireNonNull(points, "La lista de puntos del perfil no puede ser nula.");
        if (points.size() < 2) {
            throw new ParameterException("points", points.size(), "El perfil debe tener al menos 2 puntos");
        }
        for (int i = 0; i < points.size() - 1; i++) {
            TerrainPoint current = Objects.requireNonNull(points.get(i), "Punto nulo en el perfil.");
            TerrainPoint next = Objects.requireNonNull(points.get(i + 1), "Punto nulo en el perfil.");
            if (next.x() <= current.x()) {
                throw new ParameterException(String.format(
                        "Las abscisas del perfil deben ser estrictamente crecientes: x[%d] = %.3f, x[%d] = %.3f",
                        i, current.x(), i + 1, next.x()));
            }
        }
        this.points = Collections.unmodifiableList(new ArrayList<>(points));
    }

    public static TerrainProfile of(double... coordinates) {
        if (coordinates.length % 2 != 0) {
            throw new ParameterException("Se esperaba un número par de coordenadas (x, y).");
        }
        List<TerrainPoint> list = new ArrayList<>(coordinates.length / 2);
        for (int i = 0; i < coordinates.length; i += 2) {
            list.add(new TerrainPoint(coordinates[i], coordinates[i + 1]));
        }
        return new TerrainProfile(list);
    }

    @JsonProperty("points")
    public List<TerrainPoint> getPoints() {
        return points;
    }

    @JsonIgnore
    public int size() {
        return points.size();
    }

    @JsonIgnore
    public double getMinX() {
        return points.get(0).x();
    }

    @JsonIgnore
    public double getMaxX() {
        return points.get(points.size() - 1).x();
    }

    @JsonIgnore
    public double getMinY() {
        return points.stream().mapToDouble(TerrainPoint::y).min().orElseThrow();
    }

    @JsonIgnore
    public double getMaxY() {
        return points.stream().mapToDouble(TerrainPoint::y).max().orElseThrow();
    }

    /**
     * Desnivel total del perfil (maxY - minY) [m].
     */
    @JsonIgnore
    public double getHeight() {
        return getMaxY() - getMinY();
    }

    public boolean contains(double x) {
        return x >= getMinX() && x <= getMaxX();
    }

    /**
     * Indica si el terreno desciende hacia +x (cabeza a la izquierda, pie a la
     * derecha). Define el sentido de deslizamiento y, con él, el signo de α.
     * Un perfil con extremos a la misma cota se trata como descendente.
     */
    public boolean descendsTowardPositiveX() {
        return points.get(0).y() >= points.get(points.size() - 1).y();
    }

    /**
     * Interpola linealmente la elevación del perfil en una abscisa.
     *
     * @param x Abscisa dentro de [minX, maxX].
     * @return Elevación interpolada [m].
     * @throws ParameterException si x está fuera del perfil.
     */
    public double elevationAt(double x) {
        if (!contains(x)) {
            throw new ParameterException("x", x, String.format(
                    "Abscisa fuera del perfil [%.3f, %.3f]", getMinX(), getMaxX()));
        }
        int low = 0;
        int high = points.size() - 1;
        // Búsqueda binaria del segmento [low, low + 1] que contiene x
        while (high - low > 1) {
            int mid = (low + high) >>> 1;
            if (points.get(mid).x() <= x) {
                low = mid;
            } else {
                high = mid;
            }
        }
        TerrainPoint a = points.get(low);
        TerrainPoint b = points.get(high);
        double factor = (x - a.x()) / (b.x() - a.x());
        return a.y() + factor * (b.y() - a.y());
    }

    /**
     * Calcula los puntos de corte entre el círculo completo y la poligonal del
     * perfil, ordenados por abscisa.
     *
     * @param circle Círculo a intersectar.
     * @return Lista (posiblemente vacía) de intersecciones.
     */
    public List<TerrainPoint> intersections(FailureCircle circle) {
        List<TerrainPoint> result = new ArrayList<>();
        for (int i = 0; i < points.size() - 1; i++) {
            TerrainPoint a = points.get(i);
            TerrainPoint b = points.get(i + 1);
            double dx = b.x() - a.x();
            double dy = b.y() - a.y();
            double fx = a.x() - circle.centerX();
            double fy = a.y() - circle.centerY();

            // |A + t·D - C|² = r²  ->  qa·t² + qb·t + qc = 0
            double qa = dx * dx + dy * dy;
            double qb = 2.0 * (fx * dx + fy * dy);
            double qc = fx * fx + fy * fy - circle.radius() * circle.radius();
            double discriminant = qb * qb - 4.0 * qa * qc;
            if (discriminant < 0) {
                continue;
            }
            double sqrtDiscriminant = Math.sqrt(discriminant);
            double[] roots = {(-qb - sqrtDiscriminant) / (2.0 * qa), (-qb + sqrtDiscriminant) / (2.0 * qa)};
            for (double t : roots) {
                // El extremo final se excluye salvo en el último segmento para no duplicar vértices
                boolean lastSegment = i == points.size() - 2;
                if (t >= 0.0 && (t < 1.0 || (lastSegment && t <= 1.0))) {
                    TerrainPoint p = new TerrainPoint(a.x() + t * dx, a.y() + t * dy);
                    if (result.isEmpty() || !sameLocation(result.get(result.size() - 1), p)) {
                        result.add(p);
                    }
                }
                if (discriminant == 0) {
                    break;
                }
            }
        }
        result.sort((p, q) -> Double.compare(p.x(), q.x()));
        return result;
    }

    private static boolean sameLocation(TerrainPoint p, TerrainPoint q) {
        return Math.abs(p.x() - q.x()) < 1e-9 && Math.abs(p.y() - q.y()) < 1e-9;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return points.equals(((TerrainProfile) o).points);
    }

    @Override
    public int hashCode() {
        return points.hashCode();
    }

    @Override
    public String toString() {
        return "TerrainProfile{" + points.size() + " puntos, x ∈ [" + getMinX() + ", " + getMaxX()
                + "], y ∈ [" + getMinY() + ", " + getMaxY() + "]}";
    }
}
