package projecttalus.physics.solver;

/**
 * Contrato base para cualquier componente numérico del motor.
 * Permite tratar a todos los solvers de forma polimórfica para tareas
 * de logging e identificación, sin importar el método.
 */
public interface SolverComponent {
    /**
     * Nombre corto del algoritmo (ej: "Bishop simplificado").
     */
    String getName();

    /**
     * Descripción técnica detallada.
     */
    default String getDescription() {
        return "Sin descripción disponible.";
    }
}
