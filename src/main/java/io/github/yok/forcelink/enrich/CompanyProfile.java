package io.github.yok.forcelink.enrich;

import lombok.Builder;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;

/**
 * Contact details harvested for one company. Missing values are empty strings.
 */
@Value
@Builder
public class CompanyProfile {

    @Builder.Default
    String phone = "";

    @Builder.Default
    String email = "";

    // Free-text, comma separated address as found on the page
    @Builder.Default
    String address = "";

    @Builder.Default
    String website = "";

    /**
     * Returns whether no contact detail (phone, e-mail, address) was found.
     *
     * @return {@code true} when the profile carries nothing worth proposing
     */
    public boolean hasNoContactDetails() {
        return StringUtils.isAllBlank(phone, email, address);
    }
}
