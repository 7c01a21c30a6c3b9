package io.github.jakubt4.distslice.service;

import io.github.jakubt4.distslice.dto.DistributionSample;
import org.springframework.stereotype.Service;

import java.util.Arrays;

/**
 * Decides whether two consecutive samples share bin geometry and may be summed
 * element by element. Equality is exact: a change in geometry marks an
 * instrument mode transition.
 */
@Service
public class BinCompatibilityChecker {

    /**
     * @param previous last accumulated sample, or {@code null} when nothing is accumulated
     * @param current  next sample
     */
    public boolean compatible(final DistributionSample previous, final DistributionSample current) {
        if (previous == null) {
            return true;
        }
        return previous.shape().equals(current.shape())
                && Double.compare(previous.mass(), current.mass()) == 0
                && Arrays.equals(previous.phi(), current.phi())
                && Arrays.equals(previous.theta(), current.theta())
                && Arrays.equals(previous.energy(), current.energy());
    }
}
