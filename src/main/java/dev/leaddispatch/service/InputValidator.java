package dev.leaddispatch.service;

import dev.leaddispatch.model.GeoPoint;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Sanitizes and validates every value before it is written to the store.
 * Invalid contact details and coordinates are cleared instead of failing
 * the write; the cleared fields are reported back to the caller.
 */
@Component
public class InputValidator {

    public static final int MAX_QUERY_LENGTH = 200;
    public static final int MAX_NAME_LENGTH = 500;
    public static final int MAX_ADDRESS_LENGTH = 500;
    public static final int MAX_PHONE_LENGTH = 20;
    public static final int MAX_EMAIL_LENGTH = 100;
    public static final int MAX_SKILLS_LENGTH = 500;

    public static final String FIELD_NAME = "name";
    public static final String FIELD_PHONE = "phone";
    public static final String FIELD_EMAIL = "email";
    public static final String FIELD_LOCATION = "location";

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x1f\\x7f-\\x9f]");
    private static final Pattern PHONE_PATTERN = Pattern.compile("^\\+?[\\d\\s\\-()]{6,20}$");
    private static final Pattern EMAIL_PATTERN =
            Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");

    /**
     * Cleaned contact data plus the fields that were cleared or truncated.
     */
    public record SanitizedContact(
            String name,
            String phone,
            String email,
            Optional<GeoPoint> location,
            Set<String> downgradedFields) {

        public boolean isDowngraded(String field) {
            return downgradedFields.contains(field);
        }
    }

    /**
     * Strip control characters, hard-truncate to {@code maxLength} and trim.
     * Null becomes the empty string.
     */
    public String sanitize(String text, int maxLength) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String cleaned = CONTROL_CHARS.matcher(text).replaceAll("");
        if (cleaned.length() > maxLength) {
            cleaned = cleaned.substring(0, maxLength);
        }
        return cleaned.strip();
    }

    public boolean isValidPhone(String phone) {
        return phone != null && !phone.isBlank() && PHONE_PATTERN.matcher(phone.strip()).matches();
    }

    public boolean isValidEmail(String email) {
        return email != null && !email.isBlank()
                && EMAIL_PATTERN.matcher(email.strip().toLowerCase(Locale.ROOT)).matches();
    }

    /**
     * Parse a coordinate pair from loosely typed input (numbers or numeric
     * strings). Anything unparseable or out of range is unknown.
     */
    public Optional<GeoPoint> parseCoordinates(Object latitude, Object longitude) {
        Double lat = toDouble(latitude);
        Double lon = toDouble(longitude);
        if (lat == null || lon == null) {
            return Optional.empty();
        }
        return GeoPoint.of(lat, lon);
    }

    /**
     * Normalize a skill list: lower-case, comma separated, no blanks.
     */
    public String normalizeSkills(String skills) {
        String cleaned = sanitize(skills, MAX_SKILLS_LENGTH).toLowerCase(Locale.ROOT);
        return Arrays.stream(cleaned.split(","))
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.joining(","));
    }

    /**
     * Apply the clear-on-invalid policy to a set of contact fields.
     */
    public SanitizedContact sanitizeContact(String name, String phone, String email,
                                            Object latitude, Object longitude) {
        Set<String> downgraded = new LinkedHashSet<>();

        String cleanName = sanitize(name, MAX_NAME_LENGTH);
        if (name != null && name.strip().length() > MAX_NAME_LENGTH) {
            downgraded.add(FIELD_NAME);
        }

        String cleanPhone = sanitize(phone, MAX_PHONE_LENGTH);
        if (!cleanPhone.isEmpty() && !isValidPhone(cleanPhone)) {
            cleanPhone = "";
            downgraded.add(FIELD_PHONE);
        }

        String cleanEmail = sanitize(email, MAX_EMAIL_LENGTH);
        if (!cleanEmail.isEmpty() && !isValidEmail(cleanEmail)) {
            cleanEmail = "";
            downgraded.add(FIELD_EMAIL);
        }

        Optional<GeoPoint> location = parseCoordinates(latitude, longitude);
        if (location.isEmpty() && hasValue(latitude) && hasValue(longitude) && !isZeroPair(latitude, longitude)) {
            downgraded.add(FIELD_LOCATION);
        }

        return new SanitizedContact(cleanName, cleanPhone, cleanEmail, location,
                Collections.unmodifiableSet(downgraded));
    }

    private boolean isZeroPair(Object latitude, Object longitude) {
        Double lat = toDouble(latitude);
        Double lon = toDouble(longitude);
        return lat != null && lon != null && lat == 0.0 && lon == 0.0;
    }

    private boolean hasValue(Object value) {
        return value != null && !(value instanceof String s && s.isBlank());
    }

    private Double toDouble(Object value) {
        if (value instanceof Number number) {
            double d = number.doubleValue();
            return Double.isFinite(d) ? d : null;
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                double d = Double.parseDouble(text.strip());
                return Double.isFinite(d) ? d : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
