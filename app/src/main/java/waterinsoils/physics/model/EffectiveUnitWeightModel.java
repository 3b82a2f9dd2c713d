package waterinsoils.physics.model;

import waterinsoils.domain.profile.EffectiveUnitWeights;
import waterinsoils.domain.soil.ResolvedGeometry;
import waterinsoils.domain.soil.SoilStratigraphy;

import static waterinsoils.config.PhysicalConstants.GAMMA_WATER;

/**
 * Modelo de peso específico sumergido (γ') por estrato.
 * <p>
 * En las arenas es simplemente {@code γsat - γw}. En la arcilla se suma la fuerza de filtración
 * por unidad de volumen, {@code i·γw}, con el gradiente con signo del resolvedor:
 * <ul>
 * <li><b>Exceso de carga arriba (i > 0):</b> la filtración empuja hacia abajo, γ' aumenta.</li>
 * <li><b>Déficit de carga arriba (i < 0):</b> la filtración empuja hacia arriba, γ' disminuye y puede anularse.</li>
 * </ul>
 * Con Sand-1 seca no hay flujo a través de la arcilla y no se suma término de filtración.
 * Fuera de ese caso coincide con la pendiente de la tensión efectiva dentro de la arcilla.
 */
public class EffectiveUnitWeightModel {

    public EffectiveUnitWeights calculate(SoilStratigraphy layers, ResolvedGeometry geometry) {
        double sand1 = layers.sand1().saturatedUnitWeight() - GAMMA_WATER;
        double clay = (layers.clay().saturatedUnitWeight() - GAMMA_WATER) + geometry.seepageGradient() * GAMMA_WATER;
        double sand2 = layers.sand2().saturatedUnitWeight() - GAMMA_WATER;
        return new EffectiveUnitWeights(sand1, clay, sand2);
    }
}
