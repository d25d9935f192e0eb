package io.github.yok.forcelink.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class EnrichmentCandidateTest {

    private static final Set<String> ALLOWED =
            new LinkedHashSet<>(List.of("Phone", "Website", "BillingCity"));

    @Test
    void diff_正常ケース_値が異なる許可フィールドのみ許可リスト順で返ること() {
        Map<String, String> current = new HashMap<>();
        current.put("Phone", null);
        current.put("Website", "https://acme.example");
        current.put("BillingCity", "Springfield");
        Map<String, String> proposed = Map.of("BillingCity", "Shelbyville", "Phone", "555-0100",
                "Website", "https://acme.example");

        List<FieldChange> diff =
                new EnrichmentCandidate("001000000000001", "Account", current, proposed, ALLOWED)
                        .diff();

        assertEquals(List.of(new FieldChange("Phone", "", "555-0100"),
                new FieldChange("BillingCity", "Springfield", "Shelbyville")), diff);
    }

    @Test
    void constructor_正常ケース_許可リスト外と空の提案値が除外されること() {
        Map<String, String> proposed =
                Map.of("Phone", "555-0100", "Email", "info@acme.example", "Website", " ");

        EnrichmentCandidate candidate = new EnrichmentCandidate("001000000000001", "Account",
                Map.of(), proposed, ALLOWED);

        assertEquals(Set.of("Phone"), candidate.getProposedValues().keySet());
        assertFalse(candidate.diff().stream().anyMatch(c -> c.getField().equals("Email")));
    }

    @Test
    void diff_正常ケース_変更がない場合は空であること() {
        EnrichmentCandidate candidate = new EnrichmentCandidate("001000000000001", "Account",
                Map.of("Phone", "555-0100"), Map.of("Phone", "555-0100"), ALLOWED);
        assertTrue(candidate.diff().isEmpty());
    }
}
