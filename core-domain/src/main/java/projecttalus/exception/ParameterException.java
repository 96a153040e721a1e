package projecttalus.exception;

import lombok.Getter;
import projecttalus.domain.result.AnalysisStatus;

/**
 * Parámetro de suelo, geometría o configuración fuera de su rango físico.
 * Se detecta antes de discretizar.
 */
@Getter
public class ParameterException extends StabilityException {

    private final String parameter;
    private final double value;

    public ParameterException(String parameter, double value, String message) {
        super(AnalysisStatus.PARAMETER_ERROR, String.format("%s (%s = %s)", message, parameter, value));
        this.parameter = parameter;
        this.value = value;
    }

    public ParameterException(String message) {
        super(AnalysisStatus.PARAMETER_ERROR, message);
        this.parameter = null;
        this.value = Double.NaN;
    }
}
