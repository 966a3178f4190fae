package io.phosflow.job;

/**
 * Parameter set used when preparing a job. The non-standard variants are the corrective retries.
 */
public enum JobVariant {
    STANDARD,
    /** Optimisation with force constants at every step ({@code opt=calcall}). */
    STRICT_CONVERGENCE,
    /** Overlap job with normal modes expressed in Cartesian coordinates. */
    CARTESIAN_COORDINATES
}
