package fr.lapetina.apiruntime.domain.model;

/**
 * Algorithm family of resolved key material.
 */
public enum KeyAlgorithm {
    SHARED_SECRET,
    ASYMMETRIC_KEY_PAIR
}
