package vflux.domain.flux;

/**
 * Motivo legible por máquina por el que un método no produjo un flujo físico.
 */
public enum UndefinedReason {
    /** El método produjo un valor. */
    NONE,
    /** Alguna de las amplitudes es cero o negativa. */
    NON_POSITIVE_AMPLITUDE,
    /** Ar = B_superficial / B_profundo ≤ 1: sin flujo descendente resoluble. */
    AMPLITUDE_RATIO_NOT_ABOVE_ONE,
    /** El desfase medido no supera el desfase puramente conductivo. */
    NO_ADVECTIVE_PHASE_LAG
}
