package waterinsoils.domain.profile;

import waterinsoils.domain.soil.SoilLayerType;

/**
 * Franja vertical ocupada por un estrato presente en la columna.
 */
public record LayerBand(SoilLayerType layer, String name, double topDepth, double bottomDepth) {

    public double midDepth() {
        return (topDepth + bottomDepth) / 2.0;
    }
}
