package com.securepower.antitheft.domain.ports;

import java.util.Optional;

public interface ReverseGeocoder {
    Optional<String> resolve(double lat, double lng);
}
