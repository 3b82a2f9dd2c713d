package waterinsoils.physics.i;

/**
 * Contrato base para cualquier componente numérico del cálculo.
 * Permite tratar a todos los solvers de forma polimórfica para tareas
 * de logging e identificación, sin importar su física.
 */
public interface ISolverComponent {
    /**
     * Nombre corto del algoritmo (ej: "Head-Comparison", "Piecewise-Layered").
     */
    String getName();

    /**
     * Descripción técnica detallada.
     */
    default String getDescription() {
        return "Sin descripción disponible.";
    }
}
