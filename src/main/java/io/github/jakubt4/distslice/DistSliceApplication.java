package io.github.jakubt4.distslice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Distslice: 2-D slices through 3-D particle velocity distributions.
 *
 * <p>Selects and aggregates instrument distribution samples over a time window,
 * orients a cutting plane from magnetic field / bulk flow support data, and
 * rebins the spherical instrument bins onto a uniform Cartesian grid ready for
 * an external renderer.
 *
 * @see io.github.jakubt4.distslice.service.DistributionSliceService
 * @see io.github.jakubt4.distslice.service.GeometricRebinner
 */
@SpringBootApplication
public class DistSliceApplication {

    public static void main(String[] args) {
        SpringApplication.run(DistSliceApplication.class, args);
    }
}
