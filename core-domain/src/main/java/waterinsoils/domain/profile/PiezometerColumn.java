package waterinsoils.domain.profile;

/**
 * Piezómetro dibujado junto a un estrato de arena: tubo desde la base del estrato hasta
 * el nivel que alcanza el agua.
 *
 * @param label       Etiqueta de la carga ("h₁", "h₃").
 * @param bottomDepth Profundidad de la base del estrato [m].
 * @param topDepth    Profundidad del nivel del agua en el tubo [m]. Negativa si supera la superficie.
 */
public record PiezometerColumn(String label, double bottomDepth, double topDepth) {

    public double height() {
        return bottomDepth - topDepth;
    }

    public boolean risesAboveSurface() {
        return topDepth < 0.0;
    }
}
