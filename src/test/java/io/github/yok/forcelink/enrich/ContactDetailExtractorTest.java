package io.github.yok.forcelink.enrich;

import static org.junit.jupiter.api.Assertions.assertEquals;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;

class ContactDetailExtractorTest {

    @Test
    void extractPhone_正常ケース_北米形式の番号が抽出されること() {
        assertEquals("(415) 555-0132",
                ContactDetailExtractor.extractPhone("Headquarters: (415) 555-0132 (main)"));
    }

    @Test
    void extractPhone_正常ケース_国際形式の番号が抽出されること() {
        assertEquals("+44 20 7946 0958",
                ContactDetailExtractor.extractPhone("London office +44 20 7946 0958"));
    }

    @Test
    void extractPhone_正常ケース_番号がなければ空文字となること() {
        assertEquals("", ContactDetailExtractor.extractPhone("no numbers here"));
        assertEquals("", ContactDetailExtractor.extractPhone(null));
    }

    @Test
    void extractEmail_正常ケース_小文字に変換されて抽出されること() {
        assertEquals("info@acme.com",
                ContactDetailExtractor.extractEmail("Write to Info@ACME.com today"));
        assertEquals("", ContactDetailExtractor.extractEmail("nothing"));
    }

    @Test
    void extractAddress_正常ケース_住所らしいクラスの要素から抽出されること() {
        Document doc = Jsoup.parse("<div class=\"hero\">42 reasons to visit</div>"
                + "<p class=\"company-location\">  500   Oak Avenue, Denver, CO, 80202 </p>");

        assertEquals("500 Oak Avenue, Denver, CO, 80202",
                ContactDetailExtractor.extractAddress(doc));
    }

    @Test
    void extractAddress_正常ケース_番地を含まない要素は無視されること() {
        Document doc = Jsoup.parse("<div class=\"address\">Visit our office downtown</div>");

        assertEquals("", ContactDetailExtractor.extractAddress(doc));
    }

    @Test
    void cleanText_正常ケース_空白が正規化されること() {
        assertEquals("a b c", ContactDetailExtractor.cleanText("  a \n b\t c "));
        assertEquals("", ContactDetailExtractor.cleanText(null));
    }
}
