package com.securepower.antitheft.infrastructure.geo;

import com.securepower.antitheft.domain.ports.ReverseGeocoder;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * Offline fallback that labels a point with its formatted coordinates.
 */
@Component
public class CoordinateReverseGeocoder implements ReverseGeocoder {

    @Override
    public Optional<String> resolve(double lat, double lng) {
        return Optional.of(String.format(Locale.ROOT, "%.6f, %.6f", lat, lng));
    }
}
