package io.github.jakubt4.distslice.dto;

import org.hipparchus.geometry.euclidean.threed.Vector3D;

/**
 * Support vectors averaged over the slice window. Members are {@code null} when
 * the corresponding series was not supplied.
 */
public record SupportVectors(Vector3D magneticField,
                             Vector3D bulkVelocity,
                             Vector3D sunDirection) {

    public static SupportVectors none() {
        return new SupportVectors(null, null, null);
    }
}
