package projecttalus.exception;

import lombok.Getter;
import projecttalus.domain.result.AnalysisStatus;

/**
 * El círculo no intersecta el terreno lo suficiente para representar una
 * superficie de deslizamiento (rango efectivo vacío o pocas dovelas válidas).
 */
@Getter
public class GeometryException extends StabilityException {

    private final int validSliceCount;

    public GeometryException(String message, int validSliceCount) {
        super(AnalysisStatus.GEOMETRY_ERROR, message);
        this.validSliceCount = validSliceCount;
    }
}
