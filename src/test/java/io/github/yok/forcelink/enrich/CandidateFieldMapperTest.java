package io.github.yok.forcelink.enrich;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CandidateFieldMapperTest {

    private final CandidateFieldMapper mapper = new CandidateFieldMapper();

    @Test
    void toFieldValues_正常ケース_取引先では請求先住所とWebサイトに対応付けられること() {
        CompanyProfile profile = CompanyProfile.builder().phone("555-010-1234")
                .email("info@acme.com")
                .address("100 Main Street, Suite 5, Springfield, IL, 62701-1234")
                .website("https://acme.com").build();

        Map<String, String> values = mapper.toFieldValues("Account", profile);

        Map<String, String> expected = new LinkedHashMap<>();
        expected.put("Phone", "555-010-1234");
        expected.put("Website", "https://acme.com");
        expected.put("BillingStreet", "100 Main Street, Suite 5");
        expected.put("BillingCity", "Springfield");
        expected.put("BillingState", "IL");
        expected.put("BillingPostalCode", "627011234");
        expected.put("BillingCountry", CandidateFieldMapper.DEFAULT_COUNTRY);
        assertEquals(expected, values);
    }

    @Test
    void toFieldValues_正常ケース_取引先責任者ではメールと郵送先住所に対応付けられること() {
        CompanyProfile profile = CompanyProfile.builder().email("info@acme.com")
                .address("500 Oak Avenue, Denver, CO").website("https://acme.com").build();

        Map<String, String> values = mapper.toFieldValues("Contact", profile);

        assertEquals("info@acme.com", values.get("Email"));
        assertEquals("500 Oak Avenue", values.get("MailingStreet"));
        assertEquals("Denver", values.get("MailingCity"));
        assertEquals("CO", values.get("MailingState"));
        assertFalse(values.containsKey("MailingPostalCode"));
        assertEquals("United States", values.get("MailingCountry"));
        assertFalse(values.containsKey("Website"));
        assertFalse(values.containsKey("Phone"));
    }

    @Test
    void toFieldValues_正常ケース_要素が足りない住所は対応付けられないこと() {
        CompanyProfile profile =
                CompanyProfile.builder().phone("1").address("1 Main St, Springfield").build();

        Map<String, String> values = mapper.toFieldValues("Lead", profile);

        assertEquals(Map.of("Phone", "1"), values);
    }

    @Test
    void toFieldValues_正常ケース_未知のオブジェクトでは住所が対応付けられないこと() {
        CompanyProfile profile = CompanyProfile.builder().phone("555-010-1234")
                .email("a@b.com").address("1 Main St, Town, ST, 12345").build();

        Map<String, String> values = mapper.toFieldValues("Partner__c", profile);

        assertEquals(Map.of("Phone", "555-010-1234", "Email", "a@b.com"), values);
    }
}
