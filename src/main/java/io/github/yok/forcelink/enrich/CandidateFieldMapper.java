package io.github.yok.forcelink.enrich;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.apache.commons.lang3.StringUtils;

/**
 * Maps a {@link CompanyProfile} onto the fields of a CRM object.
 *
 * <p>
 * The address is split on commas: with four or more parts the first two form the street and the
 * last three are city, state and postal code; with three parts they are street, city and state.
 * Postal codes keep digits only and the country is always {@code United States}. Shorter
 * addresses are not mapped.
 * </p>
 */
public class CandidateFieldMapper {

    static final String DEFAULT_COUNTRY = "United States";

    // street, city, state, postal code, country
    private static final Map<String, List<String>> ADDRESS_FIELDS = ImmutableMap.of("Account",
            ImmutableList.of("BillingStreet", "BillingCity", "BillingState", "BillingPostalCode",
                    "BillingCountry"),
            "Contact",
            ImmutableList.of("MailingStreet", "MailingCity", "MailingState", "MailingPostalCode",
                    "MailingCountry"),
            "Lead", ImmutableList.of("Street", "City", "State", "PostalCode", "Country"));

    /**
     * Produces the proposed field values for an object type. The result is not filtered by any
     * allow-list.
     *
     * @param objectType object type, e.g. {@code Account}
     * @param profile harvested profile
     * @return field -> proposed value; blank values omitted
     */
    public Map<String, String> toFieldValues(String objectType, CompanyProfile profile) {
        Map<String, String> values = new LinkedHashMap<>();
        putIfNotBlank(values, "Phone", profile.getPhone());
        if ("Account".equals(objectType)) {
            putIfNotBlank(values, "Website", profile.getWebsite());
        } else {
            putIfNotBlank(values, "Email", profile.getEmail());
        }
        List<String> addressFields = ADDRESS_FIELDS.get(objectType);
        if (addressFields != null && StringUtils.isNotBlank(profile.getAddress())) {
            mapAddress(profile.getAddress(), addressFields, values);
        }
        return values;
    }

    private static void mapAddress(String address, List<String> fields,
            Map<String, String> values) {
        List<String> parts = Arrays.stream(address.split(",")).map(String::trim)
                .collect(Collectors.toList());
        String street;
        String city;
        String state;
        String postal = "";
        if (parts.size() >= 4) {
            street = String.join(", ", parts.subList(0, 2));
            city = parts.get(parts.size() - 3);
            state = parts.get(parts.size() - 2);
            postal = parts.get(parts.size() - 1);
        } else if (parts.size() == 3) {
            street = parts.get(0);
            city = parts.get(1);
            state = parts.get(2);
        } else {
            return;
        }
        putIfNotBlank(values, fields.get(0), street);
        putIfNotBlank(values, fields.get(1), city);
        putIfNotBlank(values, fields.get(2), state);
        putIfNotBlank(values, fields.get(3), postal.replaceAll("[^0-9]", ""));
        values.put(fields.get(4), DEFAULT_COUNTRY);
    }

    private static void putIfNotBlank(Map<String, String> values, String field, String value) {
        if (StringUtils.isNotBlank(value)) {
            values.put(field, value.trim());
        }
    }
}
