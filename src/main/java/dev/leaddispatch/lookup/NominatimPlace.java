package dev.leaddispatch.lookup;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.Optional;

/**
 * One search result as returned by Nominatim ({@code format=jsonv2}).
 * Coordinates arrive as strings.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class NominatimPlace {

    @JsonProperty("display_name")
    private String displayName;

    private String name;
    private String lat;
    private String lon;
    private String category;
    private String type;
    private Map<String, String> extratags;

    /**
     * First non-blank tag among {@code keys}.
     */
    public Optional<String> tag(String... keys) {
        if (extratags == null) {
            return Optional.empty();
        }
        for (String key : keys) {
            String value = extratags.get(key);
            if (value != null && !value.isBlank()) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
