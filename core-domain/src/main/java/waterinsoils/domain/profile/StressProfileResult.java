package waterinsoils.domain.profile;

import lombok.Builder;
import waterinsoils.config.SoilProfileConfig;
import waterinsoils.domain.soil.Regime;
import waterinsoils.domain.soil.ResolvedGeometry;

/**
 * Resultado completo de un recálculo: entradas, régimen, perfil y anotaciones para el dibujo.
 */
@Builder
public record StressProfileResult(
        SoilProfileConfig config,
        ResolvedGeometry geometry,
        StressProfile profile,
        EffectiveUnitWeights effectiveUnitWeights,
        ProfileAnnotations annotations
) {

    public Regime regime() {
        return geometry.regime();
    }
}
