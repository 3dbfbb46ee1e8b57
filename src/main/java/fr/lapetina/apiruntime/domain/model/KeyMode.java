package fr.lapetina.apiruntime.domain.model;

/**
 * Where resolved key material came from.
 */
public enum KeyMode {
    INLINE_SECRET,
    INLINE_KEY_TEXT,
    KEY_FILE_PATH
}
