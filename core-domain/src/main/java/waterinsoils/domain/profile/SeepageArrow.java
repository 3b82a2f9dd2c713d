package waterinsoils.domain.profile;

/**
 * Anotación de la fuerza de filtración en la arcilla.
 * <p>
 * La flecha va de {@code baseDepth} a {@code tipDepth}; si ambas coinciden sólo se muestra la etiqueta.
 *
 * @param tipDepth  Profundidad de la punta (centro de la arcilla) [m].
 * @param baseDepth Profundidad del arranque de la flecha [m].
 * @param label     Texto ("- f_s", "+ f_s" o "Hydrostatic").
 */
public record SeepageArrow(double tipDepth, double baseDepth, String label) {

    public boolean showsArrow() {
        return tipDepth != baseDepth;
    }

    /**
     * La punta queda por encima del arranque: la filtración empuja hacia la superficie.
     */
    public boolean pointsUp() {
        return tipDepth < baseDepth;
    }
}
