package waterinsoils.physics.i;

import waterinsoils.domain.soil.BoundaryHeads;
import waterinsoils.domain.soil.ResolvedGeometry;
import waterinsoils.domain.soil.SoilStratigraphy;

public interface IRegimeResolver extends ISolverComponent {
    /**
     * Clasifica el régimen de la arcilla y deriva los valores de contorno del perfil.
     * Nunca falla por geometría degenerada: los espesores negativos cuentan como estratos ausentes.
     *
     * @param z1 Espesor de Sand-1 [m]
     * @param z2 Espesor de Clay [m]
     * @param z3 Espesor de Sand-2 [m]
     * @param h1 Carga sobre la base de Sand-1 [m]
     * @param h3 Carga sobre la base de Sand-2 [m]
     */
    ResolvedGeometry resolve(double z1, double z2, double z3, double h1, double h3);

    default ResolvedGeometry resolve(SoilStratigraphy layers, BoundaryHeads heads) {
        return resolve(layers.sand1().thickness(), layers.clay().thickness(), layers.sand2().thickness(),
                heads.h1(), heads.h3());
    }
}
