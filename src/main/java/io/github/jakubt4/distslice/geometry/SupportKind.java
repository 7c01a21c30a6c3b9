package io.github.jakubt4.distslice.geometry;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Support quantities a rotation preset may depend on.
 */
@Getter
@RequiredArgsConstructor
public enum SupportKind {
    MAGNETIC_FIELD("magnetic field"),
    BULK_VELOCITY("bulk velocity"),
    CUSTOM_ROTATION("custom rotation");

    private final String label;
}
