package waterinsoils.config;

/**
 * Configuraciones de partida para las tres condiciones de contorno típicas.
 */
public class ProfilePresets {

    public static SoilProfileConfig standard() {
        return SoilProfileConfig.getTestingProfile();
    }

    /**
     * h3 = h1 + z2 + z3: la arena inferior en continuidad hidráulica con la superior.
     */
    public static SoilProfileConfig hydrostatic() {
        SoilProfileConfig base = standard();
        return base.withH3(base.h1() + base.z2() + base.z3());
    }

    /**
     * Arena inferior en carga artesiana, por encima de la superficie del terreno.
     */
    public static SoilProfileConfig artesian() {
        return standard()
                .withH1(2.0)
                .withH3(8.0);
    }

    /**
     * Drenaje inferior: el nivel piezométrico de Sand-2 queda dentro del propio estrato.
     */
    public static SoilProfileConfig underDrainage() {
        return standard()
                .withH1(2.0)
                .withH3(1.0);
    }
}
