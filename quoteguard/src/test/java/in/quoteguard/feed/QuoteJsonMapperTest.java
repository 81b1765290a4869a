package in.quoteguard.feed;

import in.quoteguard.domain.model.Quote;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QuoteJsonMapperTest {

    private static final String WETH = "0xc02aaa39b223fe8d0a0e5c4f27ead9083c756cc2";

    private static String resource(String name) throws IOException {
        try (InputStream in = QuoteJsonMapperTest.class.getResourceAsStream("/" + name)) {
            assertNotNull(in, "missing test resource " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    void readsSampleBatch() throws IOException {
        List<Quote> quotes = QuoteJsonMapper.readQuotes(resource("quotes-sample.json"));

        assertEquals(2, quotes.size());
        assertEquals(WETH, quotes.get(0).makerAssetAddress());
        assertEquals(new BigDecimal("100000000000000000000"), quotes.get(0).makerAssetAmount());
        assertEquals(new BigDecimal("50000000000000000000"), quotes.get(0).takerAssetAmount());
        assertEquals(WETH, quotes.get(1).makerAssetAddress());
        assertEquals(0, BigDecimal.valueOf(100).compareTo(quotes.get(1).makerAssetAmount()));
    }

    @Test
    void emptyArrayIsEmptyBatch() {
        assertTrue(QuoteJsonMapper.readQuotes("[]").isEmpty());
    }

    @Test
    void rejectsNonArrayAndBrokenJson() {
        assertThrows(IllegalArgumentException.class, () -> QuoteJsonMapper.readQuotes("{}"));
        assertThrows(IllegalArgumentException.class, () -> QuoteJsonMapper.readQuotes("[{"));
    }

    @Test
    void rejectsQuoteWithoutAsset() {
        String json = """
            [{"makerAddress": "0xa", "makerAssetAmount": "1", "takerAssetAmount": "1"}]
            """;

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> QuoteJsonMapper.readQuotes(json));
        assertTrue(e.getMessage().contains("makerAssetAddress"));
    }

    @Test
    void rejectsNonDecimalAmount() {
        String json = """
            [{"makerAddress": "0xa", "makerAssetAddress": "0xb", "makerAssetAmount": "lots", "takerAssetAmount": "1"}]
            """;

        assertThrows(IllegalArgumentException.class, () -> QuoteJsonMapper.readQuotes(json));
    }

    @Test
    void writesPlainDecimalStrings() {
        String json = QuoteJsonMapper.writeAmounts(List.of(new BigDecimal("1E+21"), BigDecimal.ZERO, new BigDecimal("20")));

        assertEquals("[\"1000000000000000000000\",\"0\",\"20\"]", json);
    }
}
