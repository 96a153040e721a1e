package projecttalus.physics.geometry;

import lombok.extern.slf4j.Slf4j;
import projecttalus.config.AnalysisConfig;
import projecttalus.domain.circle.FailureCircle;
import projecttalus.domain.slice.Slice;
import projecttalus.domain.slice.SliceSet;
import projecttalus.domain.terrain.SoilLayer;
import projecttalus.domain.terrain.SoilProfile;
import projecttalus.domain.terrain.TerrainProfile;
import projecttalus.domain.terrain.WaterTable;
import projecttalus.exception.GeometryException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Divide la masa deslizante delimitada por un círculo y el terreno en dovelas verticales.
 * <p>
 * La base de cada dovela está sobre el arco inferior del círculo. La
 * inclinación α se obtiene analíticamente de la pendiente del arco en el
 * centro de la dovela, medida en el sentido del deslizamiento:
 * sin(α) = s·(xc - x)/r, con s = +1 si el terreno desciende hacia +x.
 * <p>
 * Stateless y Thread-Safe: una misma instancia se comparte entre los hilos de la búsqueda.
 */
@Slf4j
public class SliceDiscretizer {

    /**
     * Genera las dovelas válidas del círculo.
     *
     * @param circle     Círculo de falla.
     * @param terrain    Perfil del terreno.
     * @param soil       Perfil estratigráfico.
     * @param waterTable Nivel freático, o {@code null} para terreno seco.
     * @param config     Número de columnas, límite de α y mínimo de dovelas válidas.
     * @return Dovelas válidas ordenadas por abscisa.
     * @throws projecttalus.exception.ParameterException si la configuración es inválida.
     * @throws GeometryException si el rango efectivo es vacío o quedan pocas dovelas válidas.
     */
    public SliceSet discretize(FailureCircle circle, TerrainProfile terrain, SoilProfile soil,
                               WaterTable waterTable, AnalysisConfig config) {
        Objects.requireNonNull(circle, "El círculo no puede ser nulo.");
        Objects.requireNonNull(terrain, "El terreno no puede ser nulo.");
        Objects.requireNonNull(soil, "El perfil de suelo no puede ser nulo.");
        Objects.requireNonNull(config, "La configuración no puede ser nula.");
        config.validate();

        final double xc = circle.centerX();
        final double r = circle.radius();
        final double xMin = Math.max(xc - r, terrain.getMinX());
        final double xMax = Math.min(xc + r, terrain.getMaxX());
        if (xMax - xMin <= 0) {
            throw new GeometryException(String.format(
                    "El círculo %s no se solapa con el perfil [%.3f, %.3f]", circle, terrain.getMinX(), terrain.getMaxX()), 0);
        }

        final int n = config.sliceCount();
        final double dx = (xMax - xMin) / n;
        final boolean descends = terrain.descendsTowardPositiveX();
        final double direction = descends ? 1.0 : -1.0;
        final double maxAlpha = Math.toRadians(config.maxAlphaDegrees());

        List<Slice> slices = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            double xLeft = xMin + i * dx;
            double xRight = (i == n - 1) ? xMax : xLeft + dx;
            double width = xRight - xLeft;
            double xCenter = xLeft + width / 2.0;

            OptionalDouble base = circle.lowerArcAt(xCenter);
            if (base.isEmpty()) {
                continue;
            }
            double yBase = base.getAsDouble();
            double ySurface = terrain.elevationAt(xCenter);
            double height = ySurface - yBase;
            if (height <= 0) {
                log.trace("Columna {} descartada: el arco queda por encima del terreno", i);
                continue;
            }

            double alpha = Math.asin(clampUnit(direction * (xc - xCenter) / r));
            if (Math.abs(alpha) >= maxAlpha) {
                log.trace("Columna {} descartada: |α| = {}° ≥ {}°", i, Math.toDegrees(Math.abs(alpha)), config.maxAlphaDegrees());
                continue;
            }

            double arcLength = arcLength(circle, xLeft, xRight);
            double weight = soil.columnWeight(yBase, ySurface, width);
            double porePressure = waterTable == null ? 0.0 : waterTable.porePressureAt(xCenter, yBase);
            SoilLayer baseLayer = soil.layerAt(yBase);

            slices.add(new Slice(i, xLeft, xRight, width, xCenter, yBase, ySurface, height, alpha,
                    arcLength, weight, porePressure, baseLayer.cohesion(), baseLayer.frictionAngleDegrees()));
        }

        if (slices.size() < config.minValidSlices()) {
            throw new GeometryException(String.format(
                    "Solo %d dovelas válidas de %d (mínimo %d) para %s",
                    slices.size(), n, config.minValidSlices(), circle), slices.size());
        }
        log.debug("{}: {} dovelas válidas de {}", circle, slices.size(), n);
        return new SliceSet(slices, circle, descends, n);
    }

    /**
     * Longitud del arco inferior entre dos abscisas: r·|θr - θl|, θ = asin((x - xc)/r).
     */
    static double arcLength(FailureCircle circle, double xLeft, double xRight) {
        double r = circle.radius();
        double thetaLeft = Math.asin(clampUnit((xLeft - circle.centerX()) / r));
        double thetaRight = Math.asin(clampUnit((xRight - circle.centerX()) / r));
        return r * Math.abs(thetaRight - thetaLeft);
    }

    private static double clampUnit(double value) {
        return Math.max(-1.0, Math.min(1.0, value));
    }
}
