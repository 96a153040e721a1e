package projecttalus.domain.terrain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import projecttalus.exception.ParameterException;

import java.util.Objects;

/**
 * Superficie piezométrica opcional. Solo se usa para derivar la presión de
 * poros en la base de las dovelas; los solvers nunca la modifican.
 *
 * @param surface         Perfil de la superficie piezométrica.
 * @param waterUnitWeight Peso específico del agua γw [kN/m³].
 */
public record WaterTable(TerrainProfile surface, double waterUnitWeight) {

    public static final double DEFAULT_WATER_UNIT_WEIGHT = 9.81;

    @JsonCreator
    public WaterTable(@JsonProperty("surface") TerrainProfile surface,
                      @JsonProperty("waterUnitWeight") double waterUnitWeight) {
        Objects.requireNonNull(surface, "La superficie piezométrica no puede ser nula.");
        if (!(waterUnitWeight > 0) || Double.isInfinite(waterUnitWeight)) {
            throw new ParameterException("waterUnitWeight", waterUnitWeight, "El peso específico del agua debe ser > 0");
        }
        this.surface = surface;
        this.waterUnitWeight = waterUnitWeight;
    }

    public WaterTable(TerrainProfile surface) {
        this(surface, DEFAULT_WATER_UNIT_WEIGHT);
    }

    /**
     * Presión de poros en un punto de la base de una dovela.
     * Fuera del rango en x de la superficie piezométrica se considera suelo seco.
     *
     * @param x             Abscisa del punto [m].
     * @param baseElevation Cota de la base [m].
     * @return u = max(0, (yw - yBase)·γw) [kPa].
     */
    public double porePressureAt(double x, double baseElevation) {
        if (!surface.contains(x)) {
            return 0.0;
        }
        double head = surface.elevationAt(x) - baseElevation;
        return head > 0 ? head * waterUnitWeight : 0.0;
    }
}
