package waterinsoils.domain.soil;

/**
 * Los tres estratos del perfil, ordenados de la superficie hacia abajo.
 */
public enum SoilLayerType {
    SAND_1("Sand-1"),  // Arena superior, acuífero libre
    CLAY("Clay"),      // Arcilla confinante
    SAND_2("Sand-2");  // Arena inferior, acuífero confinado

    private final String displayName;

    SoilLayerType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
