package vflux.config;

/**
 * Política para estimar la frecuencia angular inicial del ajuste armónico.
 */
public enum FrequencyInitialization {
    /**
     * Usa el periodo esperado indicado por el llamador (ej: 24 h). Es la opción por
     * defecto porque los registros cortos no dan un pico FFT limpio.
     */
    KNOWN_PERIOD,

    /**
     * Usa el pico dominante del espectro de amplitudes de la serie sin media.
     */
    SPECTRAL_PEAK
}
