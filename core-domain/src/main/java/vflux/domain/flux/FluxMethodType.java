package vflux.domain.flux;

/**
 * Los cinco métodos analíticos de inversión de flujo soportados.
 */
public enum FluxMethodType {
    HATCH_AMPLITUDE("hatch_amplitude", "Hatch-Amplitud", false),
    HATCH_PHASE("hatch_phase", "Hatch-Fase", false),
    KEERY("keery", "Keery (2007)", true),
    MCCALLUM("mccallum", "McCallum (2012)", true),
    LUCE("luce", "Luce (2013)", false);

    private final String key;
    private final String displayName;
    private final boolean provisional;

    FluxMethodType(String key, String displayName, boolean provisional) {
        this.key = key;
        this.displayName = displayName;
        this.provisional = provisional;
    }

    /**
     * Clave estable usada en los mapas de resultados y en el JSON exportado.
     */
    public String key() {
        return key;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Métodos cuyo término de fase usa el desfase total sin separar la componente
     * conductiva. Sus resultados quedan pendientes de verificación bibliográfica.
     */
    public boolean isProvisional() {
        return provisional;
    }
}
