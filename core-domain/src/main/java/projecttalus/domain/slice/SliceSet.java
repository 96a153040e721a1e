package projecttalus.domain.slice;

import projecttalus.domain.circle.FailureCircle;

import java.util.List;
import java.util.Objects;

/**
 * Conjunto ordenado (abscisa creciente) de dovelas válidas de un círculo.
 *
 * @param slices                  Dovelas válidas.
 * @param circle                  Círculo del que proceden.
 * @param descendsTowardPositiveX Sentido del deslizamiento usado para el signo de α.
 * @param requestedSliceCount     Número de columnas N solicitadas antes del filtrado.
 */
public record SliceSet(
        List<Slice> slices,
        FailureCircle circle,
        boolean descendsTowardPositiveX,
        int requestedSliceCount
) {
    public SliceSet {
        Objects.requireNonNull(circle, "El círculo no puede ser nulo.");
        slices = List.copyOf(Objects.requireNonNull(slices, "La lista de dovelas no puede ser nula."));
        for (int i = 1; i < slices.size(); i++) {
            if (slices.get(i).xCenter() <= slices.get(i - 1).xCenter()) {
                throw new IllegalArgumentException("Las dovelas deben estar ordenadas por abscisa creciente.");
            }
        }
    }

    public int size() {
        return slices.size();
    }

    public Slice get(int position) {
        return slices.get(position);
    }

    /**
     * Σ W·sin(α). Un valor ≤ 0 invalida el círculo como superficie de deslizamiento.
     */
    public double drivingSum() {
        double sum = 0.0;
        for (Slice slice : slices) {
            sum += slice.drivingForce();
        }
        return sum;
    }

    public double totalWeight() {
        return slices.stream().mapToDouble(Slice::weight).sum();
    }

    public double totalArcLength() {
        return slices.stream().mapToDouble(Slice::arcLength).sum();
    }

    public long tensionSliceCount() {
        return slices.stream().filter(Slice::inTension).count();
    }
}
