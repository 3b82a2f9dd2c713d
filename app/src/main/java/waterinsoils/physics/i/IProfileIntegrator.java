package waterinsoils.physics.i;

import waterinsoils.domain.profile.DepthAxis;
import waterinsoils.domain.profile.StressProfile;
import waterinsoils.domain.soil.ResolvedGeometry;
import waterinsoils.domain.soil.SoilStratigraphy;

public interface IProfileIntegrator extends ISolverComponent {
    /**
     * Recorre el eje de profundidad acumulando tensión total y presión intersticial estrato a estrato.
     *
     * @param depthAxis Profundidades de muestreo [m]
     * @param layers    Pesos específicos de cada estrato
     * @param geometry  Régimen y anclajes producidos por el resolvedor
     * @return Perfil alineado con {@code depthAxis}
     */
    StressProfile integrate(DepthAxis depthAxis, SoilStratigraphy layers, ResolvedGeometry geometry);
}
