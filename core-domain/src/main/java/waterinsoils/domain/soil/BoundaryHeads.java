package waterinsoils.domain.soil;

/**
 * Cargas piezométricas exteriores que actúan sobre el perfil.
 *
 * @param h1 Altura del agua en el piezómetro de la arena superior, medida desde la base del estrato 1 [m].
 * @param h3 Altura del agua en el piezómetro de la arena inferior, medida desde la base del estrato 3 [m].
 */
public record BoundaryHeads(double h1, double h3) {

    public static BoundaryHeads none() {
        return new BoundaryHeads(0.0, 0.0);
    }

    public BoundaryHeads withH1(double newH1) {
        return new BoundaryHeads(newH1, h3);
    }

    public BoundaryHeads withH3(double newH3) {
        return new BoundaryHeads(h1, newH3);
    }
}
