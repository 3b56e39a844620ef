package vflux.physics.impl;

import vflux.exception.PhysicalDomainException;

/**
 * Precondiciones compartidas por todos los métodos de flujo: Δz > 0, α > 0, ω > 0.
 */
final class FluxPreconditions {

    private FluxPreconditions() {
    }

    static void require(double depthDifference, double diffusivity) {
        PhysicalDomainException.requirePositive(depthDifference, "depthDifference");
        PhysicalDomainException.requirePositive(diffusivity, "thermalDiffusivity");
    }

    static void require(double depthDifference, double diffusivity, double angularFrequency) {
        require(depthDifference, diffusivity);
        PhysicalDomainException.requirePositive(angularFrequency, "angularFrequency");
    }
}
