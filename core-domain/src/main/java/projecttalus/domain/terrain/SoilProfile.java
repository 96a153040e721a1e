package projecttalus.domain.terrain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import projecttalus.exception.ParameterException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Columna estratigráfica ordenada de techo a muro.
 * <p>
 * Cada estrato ocupa desde su cota de muro hasta el muro del estrato superior
 * (el primero llega hasta la superficie). El último estrato se prolonga sin
 * límite hacia abajo, tenga o no cota de muro declarada.
 */
public final class SoilProfile {

    private final List<SoilLayer> layers;

    @JsonCreator
    public SoilProfile(@JsonProperty("layers") List<SoilLayer> layers) {
        Objects.requireNonNull(layers, "La lista de estratos no puede ser nula.");
        if (layers.isEmpty()) {
            throw new ParameterException("layers", 0, "Se necesita al menos un estrato");
        }
        for (int i = 0; i < layers.size() - 1; i++) {
            SoilLayer upper = Objects.requireNonNull(layers.get(i), "Estrato nulo en el perfil.");
            SoilLayer lower = Objects.requireNonNull(layers.get(i + 1), "Estrato nulo en el perfil.");
            if (!(upper.bottomElevation() > lower.bottomElevation())) {
                throw new ParameterException(String.format(
                        "Los estratos deben ordenarse de techo a muro con cotas de muro decrecientes: '%s' (%.2f) sobre '%s' (%.2f)",
                        upper.name(), upper.bottomElevation(), lower.name(), lower.bottomElevation()));
            }
        }
        this.layers = Collections.unmodifiableList(new ArrayList<>(layers));
    }

    public static SoilProfile homogeneous(SoilLayer layer) {
        return new SoilProfile(List.of(layer));
    }

    @JsonProperty("layers")
    public List<SoilLayer> getLayers() {
        return layers;
    }

    /**
     * Devuelve el estrato que contiene la cota indicada.
     *
     * @param elevation Cota [m].
     * @return El estrato cuyo intervalo vertical contiene la cota.
     */
    public SoilLayer layerAt(double elevation) {
        for (int i = 0; i < layers.size() - 1; i++) {
            if (elevation >= layers.get(i).bottomElevation()) {
                return layers.get(i);
            }
        }
        return layers.get(layers.size() - 1);
    }

    /**
     * Peso de una columna vertical de suelo entre dos cotas, sumando la
     * contribución de cada estrato atravesado (espesor unitario).
     *
     * @param baseElevation    Cota inferior de la columna [m].
     * @param surfaceElevation Cota superior de la columna [m].
     * @param width            Ancho de la columna [m].
     * @return Peso W [kN/m].
     */
    public double columnWeight(double baseElevation, double surfaceElevation, double width) {
        double weight = 0.0;
        double top = Double.POSITIVE_INFINITY;
        for (int i = 0; i < layers.size(); i++) {
            SoilLayer layer = layers.get(i);
            double bottom = (i == layers.size() - 1) ? Double.NEGATIVE_INFINITY : layer.bottomElevation();
            double thickness = Math.min(surfaceElevation, top) - Math.max(baseElevation, bottom);
            if (thickness > 0) {
                weight += layer.unitWeight() * thickness * width;
            }
            top = bottom;
        }
        return weight;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return layers.equals(((SoilProfile) o).layers);
    }

    @Override
    public int hashCode() {
        return layers.hashCode();
    }

    @Override
    public String toString() {
        return "SoilProfile" + layers;
    }
}
