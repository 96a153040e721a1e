package projecttalus.exception;

import lombok.Getter;
import projecttalus.domain.result.AnalysisStatus;

/**
 * Raíz de la taxonomía de errores del motor de estabilidad.
 * <p>
 * Cada subclase se corresponde con un {@link AnalysisStatus}, lo que permite
 * a la fachada de análisis y a la búsqueda de círculo crítico traducir
 * cualquier fallo a un estado sin inspeccionar mensajes de texto.
 */
@Getter
public abstract class StabilityException extends RuntimeException {

    private final AnalysisStatus status;

    protected StabilityException(AnalysisStatus status, String message) {
        super(message);
        this.status = status;
    }
}
