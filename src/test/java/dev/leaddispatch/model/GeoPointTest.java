package dev.leaddispatch.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GeoPointTest {

    @Test
    void shouldRejectOutOfRangeConstruction() {
        assertThatThrownBy(() -> new GeoPoint(-91, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new GeoPoint(0, 180.5))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldMapStoredValues() {
        assertThat(GeoPoint.of(19.07, 72.87)).contains(new GeoPoint(19.07, 72.87));
        assertThat(GeoPoint.of(null, 72.87)).isEmpty();
        assertThat(GeoPoint.of(0.0, 0.0)).isEmpty();
        assertThat(GeoPoint.of(0.0, 72.87)).isPresent();
        assertThat(GeoPoint.of(120.0, 10.0)).isEmpty();
    }
}
