package waterinsoils.domain.profile;

import waterinsoils.domain.soil.SoilLayerType;

/**
 * Pesos específicos sumergidos γ' de cada estrato [kN/m³]. El de la arcilla incluye la fuerza de filtración.
 */
public record EffectiveUnitWeights(double sand1, double clay, double sand2) {

    public double of(SoilLayerType layer) {
        return switch (layer) {
            case SAND_1 -> sand1;
            case CLAY -> clay;
            case SAND_2 -> sand2;
        };
    }
}
