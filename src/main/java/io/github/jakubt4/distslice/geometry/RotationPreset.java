package io.github.jakubt4.distslice.geometry;

import lombok.Getter;
import org.hipparchus.geometry.euclidean.threed.Vector3D;

import java.util.Arrays;
import java.util.Optional;
import java.util.Set;

import static org.hipparchus.geometry.euclidean.threed.Vector3D.crossProduct;

/**
 * Named physical frames a slice can be aligned to.
 *
 * <p>Each preset is defined by two reference vectors fed to
 * {@link RotationMatrices#calRot}: the first becomes the x axis, the second fixes
 * the x-y plane. Presets without a reference pair leave the (possibly custom
 * rotated) data frame untouched. B is the magnetic field, V the bulk velocity
 * and E = -V × B the convection electric field.
 */
@Getter
public enum RotationPreset {

    /** x and y of the data frame. */
    XY("xy", Set.of()) {
        @Override
        public Optional<ReferencePair> referencePair(final Vector3D b, final Vector3D v) {
            return Optional.empty();
        }
    },
    /** x and z of the data frame. */
    XZ("xz", Set.of()) {
        @Override
        public Optional<ReferencePair> referencePair(final Vector3D b, final Vector3D v) {
            return ReferencePair.of(Vector3D.PLUS_I, Vector3D.PLUS_K);
        }
    },
    /** y and z of the data frame. */
    YZ("yz", Set.of()) {
        @Override
        public Optional<ReferencePair> referencePair(final Vector3D b, final Vector3D v) {
            return ReferencePair.of(Vector3D.PLUS_J, Vector3D.PLUS_K);
        }
    },
    /** x along B, bulk velocity in the x-y plane. */
    BV("bv", Set.of(SupportKind.MAGNETIC_FIELD, SupportKind.BULK_VELOCITY)) {
        @Override
        public Optional<ReferencePair> referencePair(final Vector3D b, final Vector3D v) {
            return ReferencePair.of(b, v);
        }
    },
    /** x along B, B × V in the x-y plane. */
    BE("be", Set.of(SupportKind.MAGNETIC_FIELD, SupportKind.BULK_VELOCITY)) {
        @Override
        public Optional<ReferencePair> referencePair(final Vector3D b, final Vector3D v) {
            return ReferencePair.of(b, crossProduct(b, v));
        }
    },
    /** x along the data x axis, bulk velocity in the x-y plane. */
    XVEL("xvel", Set.of(SupportKind.BULK_VELOCITY)) {
        @Override
        public Optional<ReferencePair> referencePair(final Vector3D b, final Vector3D v) {
            return ReferencePair.of(Vector3D.PLUS_I, v);
        }
    },
    /** x along V projected perpendicular to B, y along B × V. */
    PERP("perp", Set.of(SupportKind.MAGNETIC_FIELD, SupportKind.BULK_VELOCITY)) {
        @Override
        public Optional<ReferencePair> referencePair(final Vector3D b, final Vector3D v) {
            final var bxv = crossProduct(b, v);
            return ReferencePair.of(crossProduct(bxv, b), bxv);
        }
    },
    /** x along E × B, y along B × (E × B); the plane normal to B. */
    PERP1_PERP2("perp1-perp2", Set.of(SupportKind.MAGNETIC_FIELD, SupportKind.BULK_VELOCITY)) {
        @Override
        public Optional<ReferencePair> referencePair(final Vector3D b, final Vector3D v) {
            final var exb = crossProduct(convectionField(b, v), b);
            return ReferencePair.of(exb, crossProduct(b, exb));
        }
    },
    /** Data x and y projected onto the plane normal to B. */
    PERP_XY("perp_xy", Set.of(SupportKind.MAGNETIC_FIELD)) {
        @Override
        public Optional<ReferencePair> referencePair(final Vector3D b, final Vector3D v) {
            return ReferencePair.of(perpendicular(b, Vector3D.PLUS_I), perpendicular(b, Vector3D.PLUS_J));
        }
    },
    /** Data x and z projected onto the plane normal to B. */
    PERP_XZ("perp_xz", Set.of(SupportKind.MAGNETIC_FIELD)) {
        @Override
        public Optional<ReferencePair> referencePair(final Vector3D b, final Vector3D v) {
            return ReferencePair.of(perpendicular(b, Vector3D.PLUS_I), perpendicular(b, Vector3D.PLUS_K));
        }
    },
    /** Data y and z projected onto the plane normal to B. */
    PERP_YZ("perp_yz", Set.of(SupportKind.MAGNETIC_FIELD)) {
        @Override
        public Optional<ReferencePair> referencePair(final Vector3D b, final Vector3D v) {
            return ReferencePair.of(perpendicular(b, Vector3D.PLUS_J), perpendicular(b, Vector3D.PLUS_K));
        }
    },
    /** x along B, y along E × B. */
    B_EXB("b_exb", Set.of(SupportKind.MAGNETIC_FIELD, SupportKind.BULK_VELOCITY)) {
        @Override
        public Optional<ReferencePair> referencePair(final Vector3D b, final Vector3D v) {
            return ReferencePair.of(b, crossProduct(convectionField(b, v), b));
        }
    },
    /** Only the caller's custom rotation. */
    CUSTOM("custom", Set.of(SupportKind.CUSTOM_ROTATION)) {
        @Override
        public Optional<ReferencePair> referencePair(final Vector3D b, final Vector3D v) {
            return Optional.empty();
        }
    };

    private final String label;
    private final Set<SupportKind> requiredSupport;

    RotationPreset(final String label, final Set<SupportKind> requiredSupport) {
        this.label = label;
        this.requiredSupport = requiredSupport;
    }

    /**
     * Reference vectors for this preset, or empty when the preset keeps the
     * incoming frame. Support arguments not in {@link #getRequiredSupport()} may
     * be {@code null}.
     */
    public abstract Optional<ReferencePair> referencePair(Vector3D b, Vector3D v);

    public boolean requires(final SupportKind kind) {
        return requiredSupport.contains(kind);
    }

    /**
     * Looks a preset up by its label ({@code "perp1-perp2"}) or constant name,
     * case-insensitively.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static RotationPreset fromLabel(final String name) {
        return Arrays.stream(values())
                .filter(p -> p.label.equalsIgnoreCase(name) || p.name().equalsIgnoreCase(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown rotation: " + name));
    }

    private static Vector3D convectionField(final Vector3D b, final Vector3D v) {
        return crossProduct(v, b).negate();
    }

    /** (B × axis) × B: the axis with its B-parallel part removed, up to scale. */
    private static Vector3D perpendicular(final Vector3D b, final Vector3D axis) {
        return crossProduct(crossProduct(b, axis), b);
    }

    public record ReferencePair(Vector3D first, Vector3D second) {

        public static Optional<ReferencePair> of(final Vector3D first, final Vector3D second) {
            return Optional.of(new ReferencePair(first, second));
        }
    }
}
